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

import net.downstore.data.PartKey;

/**
 * Scans an explicit set of partitions of a shard. Keys the shard does not
 * know are ignored.
 *
 * @since 1.0
 */
public class MultiPartitionScan extends PartitionScanMethod {
  private final ImmutableList<PartKey> part_keys;

  public MultiPartitionScan(final int shard, final List<PartKey> part_keys) {
    super(shard);
    if (part_keys == null) {
      throw new IllegalArgumentException("Part keys cannot be null.");
    }
    this.part_keys = ImmutableList.copyOf(part_keys);
  }

  public List<PartKey> partKeys() {
    return part_keys;
  }

  @Override
  public String toString() {
    return "MultiPartitionScan(shard=" + shard + ", keys=" + part_keys.size() + ")";
  }
}
