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

import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

/**
 * Filters on a set of one or more case sensitive label values separated by
 * pipes, e.g. {@code web01|web02}. A single value is an equality filter.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = LabelValueLiteralOrFilter.Builder.class)
public class LabelValueLiteralOrFilter extends BaseLabelFilter {
  public static final String TYPE = "LabelValueLiteralOr";

  /** The distinct values to match on, in the order given. */
  protected final List<String> literals;

  /** The values as a set for lookups. */
  private final Set<String> literal_set;

  /**
   * Protected builder ctor
   * @param builder The non-null builder.
   * @throws IllegalArgumentException if the label or filter were empty or null
   */
  protected LabelValueLiteralOrFilter(final Builder builder) {
    super(builder.label, builder.filter);
    if (filter.isEmpty() || (filter.length() == 1 && filter.charAt(0) == '|')) {
      throw new IllegalArgumentException("Filter must contain at least one value.");
    }
    final Set<String> dedupe = Sets.newLinkedHashSet();
    for (final String value : Splitter.on('|').trimResults().omitEmptyStrings()
        .split(filter)) {
      dedupe.add(value);
    }
    if (dedupe.isEmpty()) {
      throw new IllegalArgumentException("Filter must contain at least one value.");
    }
    literals = ImmutableList.copyOf(dedupe);
    literal_set = dedupe;
  }

  @Override
  public String getType() {
    return TYPE;
  }

  @Override
  public boolean matches(final String value) {
    return literal_set.contains(value);
  }

  /** @return The distinct literal values. */
  public List<String> literals() {
    return literals;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private String label;
    @JsonProperty
    private String filter;

    public Builder setLabel(final String label) {
      this.label = label;
      return this;
    }

    public Builder setFilter(final String filter) {
      this.filter = filter;
      return this;
    }

    public LabelValueLiteralOrFilter build() {
      return new LabelValueLiteralOrFilter(this);
    }
  }
}
