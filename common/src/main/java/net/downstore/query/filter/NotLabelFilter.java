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

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

/**
 * Inverts the match of a label filter, e.g. {@code host!="web01"} or
 * {@code host!~"web.*"}. Series lacking the label are evaluated against the
 * empty value so they match unless the wrapped filter matches the empty
 * string.
 *
 * @since 1.0
 */
public class NotLabelFilter implements LabelFilter {
  public static final String TYPE = "Not";

  /** The filter to invert. */
  private final LabelFilter filter;

  /**
   * Protected ctor.
   * @param builder The non-null builder.
   * @throws IllegalArgumentException if the wrapped filter was null.
   */
  protected NotLabelFilter(final Builder builder) {
    if (builder.filter == null) {
      throw new IllegalArgumentException("Filter cannot be null.");
    }
    filter = builder.filter;
  }

  @Override
  public String getType() {
    return TYPE;
  }

  @Override
  public String getLabel() {
    return filter.getLabel();
  }

  @Override
  public String getFilter() {
    return filter.getFilter();
  }

  /** @return The wrapped filter. */
  public LabelFilter getWrapped() {
    return filter;
  }

  @Override
  public boolean matches(final String value) {
    return !filter.matches(value);
  }

  @Override
  public HashCode buildHashCode() {
    return Hashing.combineOrdered(ImmutableList.of(
        filter.buildHashCode(),
        BaseLabelFilter.HASH_FUNCTION.newHasher()
            .putString(TYPE, StandardCharsets.UTF_8)
            .hash()));
  }

  @Override
  public int hashCode() {
    return buildHashCode().asInt();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return filter.equals(((NotLabelFilter) o).filter);
  }

  @Override
  public String toString() {
    return "{type=NotLabelFilter, filter=" + filter + "}";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private LabelFilter filter;

    public Builder setFilter(final LabelFilter filter) {
      this.filter = filter;
      return this;
    }

    public NotLabelFilter build() {
      return new NotLabelFilter(this);
    }
  }
}
