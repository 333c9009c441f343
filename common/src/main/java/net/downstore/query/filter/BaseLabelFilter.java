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
package net.downstore.query.filter;

import java.nio.charset.StandardCharsets;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * A base class for label value filters holding the raw filter and the label
 * to check on.
 */
public abstract class BaseLabelFilter implements LabelFilter {
  static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

  /** The label to filter on. */
  protected final String label;

  /** The raw filter from the user. */
  protected final String filter;

  /**
   * Default ctor.
   * @param label The non-null and non-empty label name.
   * @param filter The non-null filter. May be empty.
   * @throws IllegalArgumentException if the label was null or empty or the
   * filter was null.
   */
  protected BaseLabelFilter(final String label, final String filter) {
    if (Strings.isNullOrEmpty(label)) {
      throw new IllegalArgumentException("Label cannot be null or empty.");
    }
    if (filter == null) {
      throw new IllegalArgumentException("Filter cannot be null.");
    }
    this.label = label;
    this.filter = filter;
  }

  @Override
  public String getLabel() {
    return label;
  }

  @Override
  public String getFilter() {
    return filter;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final BaseLabelFilter other = (BaseLabelFilter) o;
    return Objects.equal(label, other.label)
        && Objects.equal(filter, other.filter);
  }

  @Override
  public int hashCode() {
    return buildHashCode().asInt();
  }

  @Override
  public HashCode buildHashCode() {
    return HASH_FUNCTION.newHasher()
        .putString(label, StandardCharsets.UTF_8)
        .putString(filter, StandardCharsets.UTF_8)
        .putString(Strings.nullToEmpty(getType()), StandardCharsets.UTF_8)
        .hash();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{type=")
        .append(getClass().getSimpleName())
        .append(", label=")
        .append(label)
        .append(", filter=")
        .append(filter)
        .append("}")
        .toString();
  }
}
