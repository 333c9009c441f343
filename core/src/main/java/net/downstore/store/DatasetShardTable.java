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
package net.downstore.store;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.google.common.collect.ImmutableList;

import net.downstore.data.DatasetRef;
import net.downstore.index.DownsampledShard;

/**
 * The shards of one dataset held by this node. Also remembers which shard
 * numbers were removed so lookups can report them as reassigned.
 */
class DatasetShardTable {
  private final DatasetRef dataset;
  private final ConcurrentMap<Integer, DownsampledShard> shards =
      new ConcurrentHashMap<Integer, DownsampledShard>();
  private final Set<Integer> removed = ConcurrentHashMap.newKeySet();

  DatasetShardTable(final DatasetRef dataset) {
    this.dataset = dataset;
  }

  DatasetRef dataset() {
    return dataset;
  }

  DownsampledShard get(final int shard) {
    return shards.get(shard);
  }

  ConcurrentMap<Integer, DownsampledShard> shards() {
    return shards;
  }

  /** Called once a new shard instance was registered under the number. */
  void setUp(final int shard) {
    removed.remove(shard);
  }

  /**
   * Removes the shard only if the registered instance is the given one.
   * @return True if removed.
   */
  boolean remove(final int shard, final DownsampledShard expected) {
    // ConcurrentHashMap compares with equals() which is identity for shards
    if (shards.remove(shard, expected)) {
      removed.add(shard);
      return true;
    }
    return false;
  }

  boolean wasRemoved(final int shard) {
    return removed.contains(shard);
  }

  List<Integer> shardNumbers() {
    return ImmutableList.copyOf(shards.keySet());
  }

  Collection<DownsampledShard> instances() {
    return ImmutableList.copyOf(shards.values());
  }
}
