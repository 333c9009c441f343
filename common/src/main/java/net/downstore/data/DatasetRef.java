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

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.CharMatcher;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;

/**
 * Identifies a logical dataset, either raw or one of its downsampled
 * derivatives. An optional database name namespaces the dataset.
 * <p>
 * Instances are immutable, hashable and ordered by database then dataset
 * name so they can be used as map keys and persisted by name.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
public final class DatasetRef implements Comparable<DatasetRef> {

  /** The dataset name. */
  private final String dataset;

  /** An optional database, null when not namespaced. */
  private final String database;

  /**
   * Ctor for a dataset without a database.
   * @param dataset A non-null and non-empty name without whitespace.
   * @throws IllegalArgumentException if the name was invalid.
   */
  public DatasetRef(final String dataset) {
    this(dataset, null);
  }

  /**
   * Ctor for a namespaced dataset.
   * @param dataset A non-null and non-empty name without whitespace.
   * @param database An optional database name. Empty is treated as null.
   * @throws IllegalArgumentException if either name was invalid.
   */
  @JsonCreator
  public DatasetRef(final @JsonProperty("dataset") String dataset,
                    final @JsonProperty("database") String database) {
    if (Strings.isNullOrEmpty(dataset)) {
      throw new IllegalArgumentException("Dataset name cannot be null or empty.");
    }
    if (CharMatcher.whitespace().matchesAnyOf(dataset)) {
      throw new IllegalArgumentException("Dataset name cannot contain "
          + "whitespace: '" + dataset + "'");
    }
    if (database != null && CharMatcher.whitespace().matchesAnyOf(database)) {
      throw new IllegalArgumentException("Database name cannot contain "
          + "whitespace: '" + database + "'");
    }
    this.dataset = dataset;
    this.database = Strings.emptyToNull(database);
  }

  /** @return The non-null dataset name. */
  @JsonProperty
  public String dataset() {
    return dataset;
  }

  /** @return The database if the dataset is namespaced. */
  public Optional<String> database() {
    return Optional.ofNullable(database);
  }

  @JsonProperty("database")
  String databaseOrNull() {
    return database;
  }

  @Override
  public int compareTo(final DatasetRef other) {
    return ComparisonChain.start()
        .compare(database, other.database, Ordering.natural().nullsFirst())
        .compare(dataset, other.dataset)
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
    final DatasetRef other = (DatasetRef) o;
    return Objects.equal(dataset, other.dataset)
        && Objects.equal(database, other.database);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(dataset, database);
  }

  /** @return The qualified name, e.g. {@code db.dataset} or {@code dataset}. */
  @Override
  public String toString() {
    return database == null ? dataset : database + "." + dataset;
  }
}
