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

/**
 * A label value along with the number of series in a shard carrying it.
 *
 * @since 1.0
 */
public final class TermInfo {
  private final String term;
  private final int frequency;

  @JsonCreator
  public TermInfo(final @JsonProperty("term") String term,
                  final @JsonProperty("frequency") int frequency) {
    if (term == null) {
      throw new IllegalArgumentException("Term cannot be null.");
    }
    this.term = term;
    this.frequency = frequency;
  }

  @JsonProperty
  public String term() {
    return term;
  }

  @JsonProperty
  public int frequency() {
    return frequency;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TermInfo other = (TermInfo) o;
    return frequency == other.frequency && term.equals(other.term);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(term, frequency);
  }

  @Override
  public String toString() {
    return "TermInfo(" + term + "," + frequency + ")";
  }
}
