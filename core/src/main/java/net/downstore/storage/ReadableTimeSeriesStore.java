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
package net.downstore.storage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.stumbleupon.async.Deferred;

import net.downstore.data.DatasetRef;
import net.downstore.data.IndexName;
import net.downstore.data.PartKey;
import net.downstore.data.ReadablePartition;
import net.downstore.data.Schemas;
import net.downstore.data.TermInfo;
import net.downstore.downsample.DownsampleConfig;
import net.downstore.index.DownsampledShard;
import net.downstore.query.ChunkScanMethod;
import net.downstore.query.PartLookupResult;
import net.downstore.query.PartitionScanMethod;
import net.downstore.query.ScanSplit;
import net.downstore.query.filter.LabelFilter;
import net.downstore.stats.ShardStats;
import net.downstore.store.StoreConfig;
import net.downstore.utils.CloseableIterator;

/**
 * The read side of a sharded time series store, as used by the query and
 * shard coordination layers. Shards are set up and removed by the
 * coordination layer as assignments change; queries are routed to the shard
 * they name.
 * <p>
 * Shard scoped calls throw a
 * {@link net.downstore.exceptions.ShardAssignmentException} if this node does
 * not hold the shard.
 *
 * @since 1.0
 */
public interface ReadableTimeSeriesStore {

  /**
   * Sets up a shard with the given schemas. Not idempotent.
   * @param dataset The non-null dataset.
   * @param shard The shard number.
   * @param schemas The non-null schemas of the dataset.
   * @param store_config The non-null store tuning.
   * @param downsample_config The downsample settings, null for disabled.
   * @throws net.downstore.exceptions.ShardAlreadySetupException if the shard
   * is already set up.
   */
  public void setup(final DatasetRef dataset,
                    final int shard,
                    final Schemas schemas,
                    final StoreConfig store_config,
                    final DownsampleConfig downsample_config);

  /**
   * Sets up a shard with the schemas read from the meta store.
   * @return A deferred resolving to null once set up or to an exception.
   */
  public Deferred<Object> setup(final DatasetRef dataset,
                                final int shard,
                                final StoreConfig store_config,
                                final DownsampleConfig downsample_config);

  /**
   * Rebuilds the index of a shard from the column store.
   * @return A deferred resolving to null on success or to an exception.
   */
  public Deferred<Object> recoverIndex(final DatasetRef dataset, final int shard);

  /**
   * Rebuilds the indices of every shard of the dataset.
   * @return A deferred resolving to null once all completed or to the first
   * exception.
   */
  public Deferred<Object> recoverIndices(final DatasetRef dataset);

  /** @return The shard if set up on this node. */
  public Optional<DownsampledShard> getShard(final DatasetRef dataset,
                                             final int shard);

  public List<IndexName> indexNames(final DatasetRef dataset,
                                   final int limit);

  public List<TermInfo> labelValues(final DatasetRef dataset,
                                    final int shard,
                                    final String label,
                                    final int top_k);

  public CloseableIterator<Map<String, String>> labelValuesWithFilters(
      final DatasetRef dataset,
      final int shard,
      final Collection<LabelFilter> filters,
      final Collection<String> label_names,
      final long start_time,
      final long end_time,
      final int limit);

  public CloseableIterator<PartKey> partKeysWithFilters(
      final DatasetRef dataset,
      final int shard,
      final Collection<LabelFilter> filters,
      final long start_time,
      final long end_time,
      final int limit);

  public PartLookupResult lookupPartitions(final DatasetRef dataset,
                                           final PartitionScanMethod part_method,
                                           final ChunkScanMethod chunk_method);

  public CloseableIterator<ReadablePartition> scanPartitions(
      final DatasetRef dataset,
      final PartLookupResult lookup);

  public ShardStats.Snapshot shardMetrics(final DatasetRef dataset,
                                          final int shard);

  /** @return The shard numbers of the dataset set up on this node. */
  public List<Integer> activeShards(final DatasetRef dataset);

  public List<ScanSplit> getScanSplits(final DatasetRef dataset,
                                       final int splits_per_node);

  /** @return The schemas of the dataset if any shard of it is set up. */
  public Optional<Schemas> schemas(final DatasetRef dataset);

  /**
   * Removes the shard if {@code expected} is the registered instance.
   * @return True if removed.
   */
  public boolean removeShard(final DatasetRef dataset,
                             final int shard,
                             final DownsampledShard expected);

  /** Drops all shards and resets the column store. Tests and tooling only. */
  public void reset();

  /** @return Whether or not the store refuses all writes. */
  public boolean isReadOnly();

  /**
   * Releases resources held by the store.
   * @return A deferred resolving to null.
   */
  public Deferred<Object> shutdown();
}
