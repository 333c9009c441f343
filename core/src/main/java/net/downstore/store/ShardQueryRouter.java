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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import net.downstore.data.DatasetRef;
import net.downstore.data.IndexName;
import net.downstore.data.PartKey;
import net.downstore.data.ReadablePartition;
import net.downstore.data.TermInfo;
import net.downstore.exceptions.ShardAssignmentException;
import net.downstore.index.DownsampledShard;
import net.downstore.query.ChunkScanMethod;
import net.downstore.query.PartLookupResult;
import net.downstore.query.PartitionScanMethod;
import net.downstore.query.ScanSplit;
import net.downstore.query.ShardSplit;
import net.downstore.query.filter.LabelFilter;
import net.downstore.stats.ShardStats;
import net.downstore.utils.CloseableIterator;

/**
 * Routes shard scoped queries to the shards in the registry. A query for a
 * shard this node does not hold fails with a {@link ShardAssignmentException}:
 * {@link net.downstore.exceptions.ShardNotAssignedException} if the shard was
 * removed from this node, {@link net.downstore.exceptions.ShardNotSetUpException}
 * if it never was set up.
 *
 * @since 1.0
 */
public class ShardQueryRouter {
  private final ShardRegistry registry;

  public ShardQueryRouter(final ShardRegistry registry) {
    if (registry == null) {
      throw new IllegalArgumentException("Registry cannot be null.");
    }
    this.registry = registry;
  }

  /**
   * @return The registered shard.
   * @throws ShardAssignmentException if this node does not hold the shard.
   */
  public DownsampledShard route(final DatasetRef dataset, final int shard) {
    return registry.lookup(dataset, shard).getOrThrow();
  }

  public PartLookupResult lookupPartitions(final DatasetRef dataset,
                                           final PartitionScanMethod part_method,
                                           final ChunkScanMethod chunk_method) {
    if (part_method == null) {
      throw new IllegalArgumentException("Partition method cannot be null.");
    }
    return route(dataset, part_method.shard())
        .lookupPartitions(part_method, chunk_method);
  }

  public CloseableIterator<ReadablePartition> scanPartitions(
      final DatasetRef dataset,
      final PartLookupResult lookup) {
    if (lookup == null) {
      throw new IllegalArgumentException("Lookup result cannot be null.");
    }
    return route(dataset, lookup.shard()).scanPartitions(lookup);
  }

  public List<TermInfo> labelValues(final DatasetRef dataset,
                                    final int shard,
                                    final String label,
                                    final int top_k) {
    return route(dataset, shard).labelValues(label, top_k);
  }

  public CloseableIterator<Map<String, String>> labelValuesWithFilters(
      final DatasetRef dataset,
      final int shard,
      final Collection<LabelFilter> filters,
      final Collection<String> label_names,
      final long start_time,
      final long end_time,
      final int limit) {
    return route(dataset, shard).labelValuesWithFilters(filters, label_names,
        start_time, end_time, limit);
  }

  public CloseableIterator<PartKey> partKeysWithFilters(
      final DatasetRef dataset,
      final int shard,
      final Collection<LabelFilter> filters,
      final long start_time,
      final long end_time,
      final int limit) {
    return route(dataset, shard).partKeysWithFilters(filters, start_time,
        end_time, limit);
  }

  public ShardStats.Snapshot shardMetrics(final DatasetRef dataset,
                                          final int shard) {
    return route(dataset, shard).shardStats();
  }

  public Deferred<Object> recoverIndex(final DatasetRef dataset, final int shard) {
    return route(dataset, shard).recoverIndex();
  }

  /**
   * Label names across all shards of the dataset, each paired with the
   * shard it came from. The limit applies per shard.
   * @return The names, empty if the dataset has no shards here.
   * @throws net.downstore.exceptions.IndexNotReadyException if a shard has
   * no index yet.
   */
  public List<IndexName> indexNames(final DatasetRef dataset,
                                   final int limit) {
    final List<IndexName> names = Lists.newArrayList();
    for (final DownsampledShard shard : registry.shards(dataset)) {
      for (final String name : shard.indexNames(limit)) {
        names.add(new IndexName(name, shard.shardNum()));
      }
    }
    return names;
  }

  /**
   * One split per shard of the dataset held by this node, by shard number.
   * @param splits_per_node Accepted for compatibility, splits are always
   * whole shards.
   */
  public List<ScanSplit> getScanSplits(final DatasetRef dataset,
                                       final int splits_per_node) {
    if (splits_per_node < 1) {
      throw new IllegalArgumentException("Splits per node must be at least 1: "
          + splits_per_node);
    }
    final List<Integer> shards = Lists.newArrayList(registry.activeShards(dataset));
    Collections.sort(shards);
    final ImmutableList.Builder<ScanSplit> splits = ImmutableList.builder();
    for (final int shard : shards) {
      splits.add(new ShardSplit(shard));
    }
    return splits.build();
  }
}
