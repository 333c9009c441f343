// This file is part of Downstore.
// Copyright (C) 2026  The Downstore Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.downstore.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;

/**
 * A label name found in the part key index of a shard. Sorts by shard, then
 * by name.
 *
 * @since 1.0
 */
public final class IndexName implements Comparable<IndexName> {
  private final String name;
  private final int shard;

  @JsonCreator
  public IndexName(final @JsonProperty("name") String name,
                   final @JsonProperty("shard") int shard) {
    if (name == null) {
      throw new IllegalArgumentException("Name cannot be null.");
    }
    if (shard < 0) {
      throw new IllegalArgumentException("Shard cannot be negative.");
    }
    this.name = name;
    this.shard = shard;
  }

  @JsonProperty
  public String name() {
    return name;
  }

  @JsonProperty
  public int shard() {
    return shard;
  }

  @Override
  public int compareTo(final IndexName other) {
    return ComparisonChain.start()
        .compare(shard, other.shard)
        .compare(name, other.name)
        .result();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final IndexName other = (IndexName) o;
    return shard == other.shard && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, shard);
  }

  @Override
  public String toString() {
    return "IndexName(" + name + "," + shard + ")";
  }
}
