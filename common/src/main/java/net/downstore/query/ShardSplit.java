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
package net.downstore.query;

/**
 * A scan split covering one whole shard.
 *
 * @since 1.0
 */
public final class ShardSplit implements ScanSplit {
  private final int shard;

  public ShardSplit(final int shard) {
    if (shard < 0) {
      throw new IllegalArgumentException("Shard cannot be negative: " + shard);
    }
    this.shard = shard;
  }

  public int shard() {
    return shard;
  }

  @Override
  public String description() {
    return "shard=" + shard;
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof ShardSplit && ((ShardSplit) o).shard == shard;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(shard);
  }

  @Override
  public String toString() {
    return "ShardSplit(" + shard + ")";
  }
}
