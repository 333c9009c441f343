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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.downstore.query.filter.LabelFilter;

/**
 * Scans the partitions of a shard whose labels satisfy every filter.
 *
 * @since 1.0
 */
public class FilteredPartitionScan extends PartitionScanMethod {
  private final ImmutableList<LabelFilter> filters;

  /**
   * @param shard The non-negative shard number.
   * @param filters The non-null filters. An empty list matches everything.
   */
  public FilteredPartitionScan(final int shard, final List<LabelFilter> filters) {
    super(shard);
    if (filters == null) {
      throw new IllegalArgumentException("Filters cannot be null.");
    }
    this.filters = ImmutableList.copyOf(filters);
  }

  public List<LabelFilter> filters() {
    return filters;
  }

  @Override
  public String toString() {
    return "FilteredPartitionScan(shard=" + shard + ", filters=" + filters + ")";
  }
}
