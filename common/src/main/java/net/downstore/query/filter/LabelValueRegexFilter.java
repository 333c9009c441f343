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

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Regular expression filter on label values. The expression is anchored:
 * it must match the whole value.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = LabelValueRegexFilter.Builder.class)
public class LabelValueRegexFilter extends BaseLabelFilter {
  public static final String TYPE = "LabelValueRegex";

  /** The compiled pattern */
  final Pattern pattern;

  /** Whether or not the regex would match-all. */
  final boolean matches_all;

  /**
   * Protected ctor.
   * @param builder The non-null builder.
   * @throws IllegalArgumentException if the label was missing or the
   * expression did not compile.
   */
  protected LabelValueRegexFilter(final Builder builder) {
    super(builder.label, builder.filter);
    try {
      pattern = Pattern.compile(filter.trim());
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid regular expression for label "
          + label + ": " + filter, e);
    }

    final String trimmed = filter.trim();
    // the common spellings, there are many more.
    matches_all = trimmed.equals(".*")
        || trimmed.equals("^.*")
        || trimmed.equals(".*$")
        || trimmed.equals("^.*$");
  }

  @Override
  public String getType() {
    return TYPE;
  }

  @Override
  public boolean matches(final String value) {
    if (matches_all) {
      return true;
    }
    return pattern.matcher(value).matches();
  }

  /** Whether or not the regex would match all strings. */
  public boolean matchesAll() {
    return matches_all;
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
        .append(", matchesAll=")
        .append(matches_all)
        .append("}")
        .toString();
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

    public LabelValueRegexFilter build() {
      return new LabelValueRegexFilter(this);
    }
  }
}
