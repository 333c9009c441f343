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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Describes the layout of the series stored under one schema: the labels
 * forming the partition key and the data columns in each chunk. The store
 * only uses the schema to hand it along with partitions; it never decodes
 * chunk data itself.
 *
 * @since 1.0
 */
@JsonDeserialize(builder = Schema.Builder.class)
public final class Schema {
  private final String name;
  private final int id;
  private final ImmutableList<String> partition_labels;
  private final ImmutableList<String> data_columns;

  private Schema(final Builder builder) {
    if (Strings.isNullOrEmpty(builder.name)) {
      throw new IllegalArgumentException("Schema name cannot be null or empty.");
    }
    if (builder.dataColumns == null || builder.dataColumns.isEmpty()) {
      throw new IllegalArgumentException("Schema " + builder.name
          + " must have at least one data column.");
    }
    name = builder.name;
    id = builder.id;
    partition_labels = builder.partitionLabels == null
        ? ImmutableList.<String>of()
        : ImmutableList.copyOf(builder.partitionLabels);
    data_columns = ImmutableList.copyOf(builder.dataColumns);
  }

  @JsonProperty
  public String name() {
    return name;
  }

  /** @return The numeric ID stored alongside each part key. */
  @JsonProperty
  public int id() {
    return id;
  }

  @JsonProperty
  public List<String> partitionLabels() {
    return partition_labels;
  }

  @JsonProperty
  public List<String> dataColumns() {
    return data_columns;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Schema other = (Schema) o;
    return id == other.id && name.equals(other.name)
        && partition_labels.equals(other.partition_labels)
        && data_columns.equals(other.data_columns);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(
        name, id, partition_labels, data_columns);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("id", id)
        .add("partitionLabels", partition_labels)
        .add("dataColumns", data_columns)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private String name;
    @JsonProperty
    private int id;
    @JsonProperty
    private List<String> partitionLabels;
    @JsonProperty
    private List<String> dataColumns;

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setId(final int id) {
      this.id = id;
      return this;
    }

    public Builder setPartitionLabels(final List<String> partition_labels) {
      this.partitionLabels = partition_labels;
      return this;
    }

    public Builder setDataColumns(final List<String> data_columns) {
      this.dataColumns = data_columns;
      return this;
    }

    public Schema build() {
      return new Schema(this);
    }
  }
}
