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
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.downstore.data.DatasetRef;
import net.downstore.data.Schemas;
import net.downstore.downsample.DownsampleConfig;
import net.downstore.exceptions.ShardAlreadySetupException;
import net.downstore.exceptions.ShardNotSetUpException;
import net.downstore.index.DownsampledShard;
import net.downstore.stats.ScanStats;
import net.downstore.storage.ColumnStore;

/**
 * Maps datasets and shard numbers to the shards held by this node. Lookups
 * never block. Setup and removal are atomic per shard: a shard is created
 * at most once per key and only the registered instance can be removed.
 *
 * @since 1.0
 */
public class ShardRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(ShardRegistry.class);

  private final ConcurrentMap<DatasetRef, DatasetShardTable> datasets =
      new ConcurrentHashMap<DatasetRef, DatasetShardTable>();

  private final ColumnStore column_store;
  private final ExecutorService io_pool;
  private final MetricRegistry metrics;
  private final ScanStats scan_stats;

  /**
   * Default ctor.
   * @param column_store The non-null column store shared by all shards.
   * @param io_pool The non-null pool index rebuilds run on.
   * @param metrics The non-null metric registry.
   * @param scan_stats The non-null store wide scan counters.
   */
  public ShardRegistry(final ColumnStore column_store,
                       final ExecutorService io_pool,
                       final MetricRegistry metrics,
                       final ScanStats scan_stats) {
    if (column_store == null) {
      throw new IllegalArgumentException("Column store cannot be null.");
    }
    if (io_pool == null) {
      throw new IllegalArgumentException("IO pool cannot be null.");
    }
    if (metrics == null) {
      throw new IllegalArgumentException("Metric registry cannot be null.");
    }
    this.column_store = column_store;
    this.io_pool = io_pool;
    this.metrics = metrics;
    this.scan_stats = scan_stats;
  }

  /**
   * Creates and registers a shard. Not idempotent.
   * @param dataset The non-null dataset.
   * @param shard The shard number.
   * @param schemas The non-null schemas of the dataset.
   * @param store_config The non-null store tuning.
   * @param downsample_config The downsample settings, null for disabled.
   * @return The new shard. Its index still has to be recovered.
   * @throws ShardAlreadySetupException if the shard is already registered.
   */
  public DownsampledShard setup(final DatasetRef dataset,
                                final int shard,
                                final Schemas schemas,
                                final StoreConfig store_config,
                                final DownsampleConfig downsample_config) {
    if (dataset == null) {
      throw new IllegalArgumentException("Dataset cannot be null.");
    }
    if (shard < 0) {
      throw new IllegalArgumentException("Shard cannot be negative: " + shard);
    }
    final DatasetShardTable table =
        datasets.computeIfAbsent(dataset, DatasetShardTable::new);
    final AtomicBoolean created = new AtomicBoolean();
    final DownsampledShard instance = table.shards().computeIfAbsent(shard, n -> {
      created.set(true);
      return new DownsampledShard(dataset, n, schemas, store_config,
          downsample_config, column_store, io_pool, metrics, scan_stats);
    });
    if (!created.get()) {
      throw new ShardAlreadySetupException(dataset, shard);
    }
    table.setUp(shard);
    LOG.info("Set up {} shard {}", dataset, shard);
    return instance;
  }

  /**
   * @return The shard if registered, empty otherwise. Never throws.
   */
  public Optional<DownsampledShard> getShard(final DatasetRef dataset,
                                             final int shard) {
    final DatasetShardTable table = dataset == null ? null : datasets.get(dataset);
    return table == null ? Optional.<DownsampledShard>empty()
        : Optional.ofNullable(table.get(shard));
  }

  /**
   * @return The registered shard.
   * @throws ShardNotSetUpException if the shard is not registered.
   */
  public DownsampledShard getShardOrFail(final DatasetRef dataset,
                                         final int shard) {
    return getShard(dataset, shard).orElseThrow(() ->
        new ShardNotSetUpException(dataset, shard));
  }

  /**
   * Resolves a shard, telling shards removed from this node apart from
   * shards never set up here.
   */
  public ShardLookup lookup(final DatasetRef dataset, final int shard) {
    final DatasetShardTable table = dataset == null ? null : datasets.get(dataset);
    if (table == null) {
      return ShardLookup.notSetUp(dataset, shard);
    }
    final DownsampledShard instance = table.get(shard);
    if (instance != null) {
      return ShardLookup.found(instance);
    }
    return table.wasRemoved(shard) ? ShardLookup.reassigned(dataset, shard)
        : ShardLookup.notSetUp(dataset, shard);
  }

  /** @return A point in time list of the shard numbers of the dataset. */
  public List<Integer> activeShards(final DatasetRef dataset) {
    final DatasetShardTable table = dataset == null ? null : datasets.get(dataset);
    return table == null ? ImmutableList.<Integer>of() : table.shardNumbers();
  }

  /** @return A point in time list of the shards of the dataset. */
  public Collection<DownsampledShard> shards(final DatasetRef dataset) {
    final DatasetShardTable table = dataset == null ? null : datasets.get(dataset);
    return table == null ? ImmutableList.<DownsampledShard>of() : table.instances();
  }

  /** @return The datasets with a table on this node. */
  public Set<DatasetRef> datasets() {
    return ImmutableSet.copyOf(datasets.keySet());
  }

  /**
   * Removes the shard only if the registered instance is {@code expected}
   * so a late teardown cannot evict a shard set up again since. The removed
   * shard is shut down.
   * @return True if the expected instance was removed.
   */
  public boolean removeShard(final DatasetRef dataset,
                             final int shard,
                             final DownsampledShard expected) {
    if (expected == null) {
      return false;
    }
    final DatasetShardTable table = dataset == null ? null : datasets.get(dataset);
    if (table == null || !table.remove(shard, expected)) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Not removing {} shard {}, instance {} is not registered",
            dataset, shard, expected);
      }
      return false;
    }
    expected.shutdown();
    LOG.info("Removed {} shard {}", dataset, shard);
    return true;
  }

  /**
   * Drops every shard and resets the column store. Must not run concurrently
   * with queries. Only meant for tests and admin tooling.
   */
  public void reset() {
    for (final DatasetShardTable table : datasets.values()) {
      for (final DownsampledShard shard : table.instances()) {
        shard.shutdown();
      }
    }
    datasets.clear();
    column_store.reset();
    LOG.info("Reset the shard registry and column store");
  }
}
