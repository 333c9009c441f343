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

import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.downstore.utils.JSON;

/**
 * Helpers for building, parsing and evaluating label filters.
 *
 * @since 1.0
 */
public final class LabelFilters {
  private LabelFilters() {
    // static class
  }

  /** @return A filter matching the exact value. */
  public static LabelFilter equalTo(final String label, final String value) {
    return LabelValueLiteralOrFilter.newBuilder()
        .setLabel(label)
        .setFilter(value)
        .build();
  }

  /** @return A filter matching any value but the given one. */
  public static LabelFilter notEqualTo(final String label, final String value) {
    return NotLabelFilter.newBuilder()
        .setFilter(equalTo(label, value))
        .build();
  }

  /** @return A filter matching values that fully match the expression. */
  public static LabelFilter regex(final String label, final String regex) {
    return LabelValueRegexFilter.newBuilder()
        .setLabel(label)
        .setFilter(regex)
        .build();
  }

  /** @return A filter matching values that do not match the expression. */
  public static LabelFilter notRegex(final String label, final String regex) {
    return NotLabelFilter.newBuilder()
        .setFilter(regex(label, regex))
        .build();
  }

  /**
   * Evaluates the conjunction of the filters. An empty collection matches.
   * @param filters A non-null collection of filters.
   * @param labels The non-null labels of a series.
   * @return True if every filter matched.
   */
  public static boolean matchesAll(final Collection<LabelFilter> filters,
                                   final Map<String, String> labels) {
    for (final LabelFilter filter : filters) {
      if (!filter.matches(labels)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Parses a single filter from JSON. The {@code type} field selects the
   * implementation: {@code LabelValueLiteralOr}, {@code LabelValueRegex} or
   * {@code Not} with a nested {@code filter} object.
   * @param node A non-null JSON object.
   * @return The parsed filter.
   * @throws IllegalArgumentException if the node was null, the type was
   * missing or unknown, or the filter was invalid.
   */
  public static LabelFilter parse(final JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Filter node must be a JSON object.");
    }
    final JsonNode type_node = node.get("type");
    final String type = type_node == null ? null : type_node.asText();
    if (Strings.isNullOrEmpty(type)) {
      throw new IllegalArgumentException("Filter type cannot be null or empty.");
    }
    try {
      switch (type) {
      case LabelValueLiteralOrFilter.TYPE:
        return JSON.getMapper().treeToValue(node, LabelValueLiteralOrFilter.class);
      case LabelValueRegexFilter.TYPE:
        return JSON.getMapper().treeToValue(node, LabelValueRegexFilter.class);
      case NotLabelFilter.TYPE:
        return NotLabelFilter.newBuilder()
            .setFilter(parse(node.get("filter")))
            .build();
      default:
        throw new IllegalArgumentException("Unknown filter type: " + type);
      }
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to parse filter: " + node, e);
    }
  }

  /**
   * Parses a JSON array of filters.
   * @param json A non-null JSON array string.
   * @return The parsed filters in order.
   * @throws IllegalArgumentException if the JSON was not an array or any
   * filter failed to parse.
   */
  public static List<LabelFilter> parseList(final String json) {
    final JsonNode root = JSON.parseToTree(json);
    if (!root.isArray()) {
      throw new IllegalArgumentException("Filters must be a JSON array.");
    }
    final ImmutableList.Builder<LabelFilter> filters = ImmutableList.builder();
    for (final JsonNode node : root) {
      filters.add(parse(node));
    }
    return filters.build();
  }
}
