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

import java.util.Map;

import com.google.common.hash.HashCode;

/**
 * A predicate over the value of a single label. Filters handed to a shard
 * are combined with AND semantics.
 * <p>
 * A series without the label is evaluated as if the label had the empty
 * value, so negative filters match series lacking the label while literal
 * filters on a non-empty value do not.
 *
 * @since 1.0
 */
public interface LabelFilter {

  /** @return A name for the filter type, used when parsing. */
  public String getType();

  /** @return The non-null and non-empty label name to filter on. */
  public String getLabel();

  /** @return The raw filter given by the user. */
  public String getFilter();

  /**
   * @param value A non-null label value, empty if the series lacks the label.
   * @return True if the value satisfies the filter.
   */
  public boolean matches(final String value);

  /**
   * @param labels The non-null labels of a series.
   * @return True if the series satisfies the filter.
   */
  public default boolean matches(final Map<String, String> labels) {
    final String value = labels.get(getLabel());
    return matches(value == null ? "" : value);
  }

  /** @return A HashCode object for deterministic, non-secure hashing */
  public HashCode buildHashCode();
}
