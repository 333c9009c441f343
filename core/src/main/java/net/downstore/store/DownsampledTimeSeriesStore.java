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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.DeferredGroupException;
import com.typesafe.config.Config;

import net.downstore.data.DatasetRef;
import net.downstore.data.IndexName;
import net.downstore.data.IngestBatch;
import net.downstore.data.PartKey;
import net.downstore.data.RawPartData;
import net.downstore.data.ReadablePartition;
import net.downstore.data.Schemas;
import net.downstore.data.TermInfo;
import net.downstore.downsample.DownsampleConfig;
import net.downstore.exceptions.CorruptVectorException;
import net.downstore.exceptions.ReadOnlyStoreException;
import net.downstore.index.DownsampledShard;
import net.downstore.query.ChunkScanMethod;
import net.downstore.query.PartLookupResult;
import net.downstore.query.PartitionScanMethod;
import net.downstore.query.ScanSplit;
import net.downstore.query.filter.LabelFilter;
import net.downstore.stats.ScanStats;
import net.downstore.stats.ShardStats;
import net.downstore.storage.ColumnStore;
import net.downstore.storage.ColumnStoreDescriptor;
import net.downstore.storage.ColumnStoreModule;
import net.downstore.storage.MetaStore;
import net.downstore.storage.TimeSeriesStore;
import net.downstore.utils.CloseableIterator;

/**
 * A read-only store over downsampled datasets. Every shard holds an
 * in-memory part key index recovered from the column store; chunks are read
 * from the column store on each scan. Ingestion is handled elsewhere so all
 * write calls throw a {@link ReadOnlyStoreException}.
 *
 * @since 1.0
 */
public class DownsampledTimeSeriesStore implements TimeSeriesStore {
  private static final Logger LOG =
      LoggerFactory.getLogger(DownsampledTimeSeriesStore.class);

  private final ColumnStore column_store;
  private final MetaStore meta_store;
  private final StoreConfig store_config;
  private final ScanStats scan_stats;
  private final ShardRegistry registry;
  private final ShardQueryRouter router;

  /**
   * Default ctor.
   * @param column_store The non-null column store.
   * @param meta_store The non-null meta store.
   * @param config The non-null config with the reference fallback applied.
   * @param metrics The non-null metric registry.
   * @param io_pool The non-null pool index rebuilds run on. Owned by the
   * caller.
   */
  public DownsampledTimeSeriesStore(final ColumnStore column_store,
                                    final MetaStore meta_store,
                                    final Config config,
                                    final MetricRegistry metrics,
                                    final ExecutorService io_pool) {
    if (meta_store == null) {
      throw new IllegalArgumentException("Meta store cannot be null.");
    }
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (metrics == null) {
      throw new IllegalArgumentException("Metric registry cannot be null.");
    }
    this.column_store = column_store;
    this.meta_store = meta_store;
    store_config = StoreConfig.fromConfig(config);
    scan_stats = new ScanStats(metrics);
    registry = new ShardRegistry(column_store, io_pool, metrics, scan_stats);
    router = new ShardQueryRouter(registry);
  }

  /**
   * Creates a store over the column store adapter named in the config.
   * @param config The non-null config with the reference fallback applied.
   * @param metrics The non-null metric registry.
   * @param io_pool The non-null pool index rebuilds run on.
   * @return A new store.
   * @throws net.downstore.core.InvalidConfigException if no adapter matches.
   */
  public static DownsampledTimeSeriesStore create(final Config config,
                                                  final MetricRegistry metrics,
                                                  final ExecutorService io_pool) {
    final ColumnStoreDescriptor descriptor =
        new ColumnStoreModule().provideDescriptor(config);
    return new DownsampledTimeSeriesStore(
        descriptor.createColumnStore(config, metrics),
        descriptor.createMetaStore(config), config, metrics, io_pool);
  }

  @Override
  public void setup(final DatasetRef dataset,
                    final int shard,
                    final Schemas schemas,
                    final StoreConfig store_config,
                    final DownsampleConfig downsample_config) {
    registry.setup(dataset, shard, schemas, store_config, downsample_config);
  }

  @Override
  public Deferred<Object> setup(final DatasetRef dataset,
                                final int shard,
                                final StoreConfig store_config,
                                final DownsampleConfig downsample_config) {
    class SetupCB implements Callback<Object, Schemas> {
      @Override
      public Object call(final Schemas schemas) throws Exception {
        setup(dataset, shard, schemas, store_config, downsample_config);
        return null;
      }
      @Override
      public String toString() {
        return "Setup " + dataset + " shard " + shard;
      }
    }
    return meta_store.readSchemas(dataset).addCallback(new SetupCB());
  }

  /** @return The store tuning read from the config. */
  public StoreConfig storeConfig() {
    return store_config;
  }

  @Override
  public Deferred<Object> recoverIndex(final DatasetRef dataset, final int shard) {
    return router.recoverIndex(dataset, shard);
  }

  /**
   * Recovers the shards of the dataset, at most
   * {@link StoreConfig#partitionListParallelism()} at a time.
   */
  @Override
  public Deferred<Object> recoverIndices(final DatasetRef dataset) {
    final List<DownsampledShard> shards =
        Lists.newArrayList(registry.shards(dataset));
    if (shards.isEmpty()) {
      return Deferred.fromResult(null);
    }
    shards.sort(Comparator.comparingInt(DownsampledShard::shardNum));
    final int lanes = Math.min(store_config.partitionListParallelism(),
        shards.size());

    class RecoverCB implements Callback<Deferred<Object>, Object> {
      private final DownsampledShard shard;

      RecoverCB(final DownsampledShard shard) {
        this.shard = shard;
      }

      @Override
      public Deferred<Object> call(final Object ignored) throws Exception {
        return shard.recoverIndex();
      }

      @Override
      public String toString() {
        return "Recover " + shard;
      }
    }

    final List<Deferred<Object>> chains = new ArrayList<Deferred<Object>>(lanes);
    for (int lane = 0; lane < lanes; lane++) {
      Deferred<Object> chain = Deferred.fromResult(null);
      for (int i = lane; i < shards.size(); i += lanes) {
        chain = chain.addCallbackDeferring(new RecoverCB(shards.get(i)));
      }
      chains.add(chain);
    }

    class GroupCB implements Callback<Object, ArrayList<Object>> {
      @Override
      public Object call(final ArrayList<Object> ignored) throws Exception {
        LOG.info("Recovered {} shards of {}", shards.size(), dataset);
        return null;
      }
    }

    class UnwrapErrCB implements Callback<Object, Exception> {
      @Override
      public Object call(final Exception e) throws Exception {
        if (e instanceof DeferredGroupException && e.getCause() instanceof Exception) {
          return e.getCause();
        }
        return e;
      }
    }

    return Deferred.group(chains)
        .addCallbacks(new GroupCB(), new UnwrapErrCB());
  }

  /**
   * Recovers every shard of the dataset and waits for it, up to
   * {@link StoreConfig#indexRecoveryTimeout()}. For tests and admin tooling.
   * @throws Exception the recovery failure, or a
   * {@link com.stumbleupon.async.TimeoutException} if the wait timed out.
   */
  public void refreshIndicesBlocking(final DatasetRef dataset) throws Exception {
    recoverIndices(dataset).join(store_config.indexRecoveryTimeout().toMillis());
  }

  @Override
  public Optional<DownsampledShard> getShard(final DatasetRef dataset,
                                             final int shard) {
    return registry.getShard(dataset, shard);
  }

  @Override
  public List<IndexName> indexNames(final DatasetRef dataset,
                                   final int limit) {
    return router.indexNames(dataset, limit);
  }

  @Override
  public List<TermInfo> labelValues(final DatasetRef dataset,
                                    final int shard,
                                    final String label,
                                    final int top_k) {
    return router.labelValues(dataset, shard, label, top_k);
  }

  @Override
  public CloseableIterator<Map<String, String>> labelValuesWithFilters(
      final DatasetRef dataset,
      final int shard,
      final Collection<LabelFilter> filters,
      final Collection<String> label_names,
      final long start_time,
      final long end_time,
      final int limit) {
    return router.labelValuesWithFilters(dataset, shard, filters, label_names,
        start_time, end_time, limit);
  }

  @Override
  public CloseableIterator<PartKey> partKeysWithFilters(
      final DatasetRef dataset,
      final int shard,
      final Collection<LabelFilter> filters,
      final long start_time,
      final long end_time,
      final int limit) {
    return router.partKeysWithFilters(dataset, shard, filters, start_time,
        end_time, limit);
  }

  @Override
  public PartLookupResult lookupPartitions(final DatasetRef dataset,
                                           final PartitionScanMethod part_method,
                                           final ChunkScanMethod chunk_method) {
    return router.lookupPartitions(dataset, part_method, chunk_method);
  }

  @Override
  public CloseableIterator<ReadablePartition> scanPartitions(
      final DatasetRef dataset,
      final PartLookupResult lookup) {
    return router.scanPartitions(dataset, lookup);
  }

  @Override
  public ShardStats.Snapshot shardMetrics(final DatasetRef dataset,
                                          final int shard) {
    return router.shardMetrics(dataset, shard);
  }

  @Override
  public List<Integer> activeShards(final DatasetRef dataset) {
    return registry.activeShards(dataset);
  }

  @Override
  public List<ScanSplit> getScanSplits(final DatasetRef dataset,
                                       final int splits_per_node) {
    return router.getScanSplits(dataset, splits_per_node);
  }

  @Override
  public Optional<Schemas> schemas(final DatasetRef dataset) {
    final Iterator<DownsampledShard> shards = registry.shards(dataset).iterator();
    return shards.hasNext() ? Optional.of(shards.next().schemas())
        : Optional.<Schemas>empty();
  }

  @Override
  public boolean removeShard(final DatasetRef dataset,
                             final int shard,
                             final DownsampledShard expected) {
    return registry.removeShard(dataset, shard, expected);
  }

  @Override
  public void reset() {
    registry.reset();
  }

  @Override
  public boolean isReadOnly() {
    return true;
  }

  /** @return The store wide scan counters. */
  public ScanStats scanStats() {
    return scan_stats;
  }

  /** @return The registry of shards held by this store. */
  public ShardRegistry registry() {
    return registry;
  }

  /**
   * Cancels running index recoveries, drops every shard and shuts down the
   * column store. Persisted data is left alone.
   */
  @Override
  public Deferred<Object> shutdown() {
    for (final DatasetRef dataset : registry.datasets()) {
      for (final DownsampledShard shard : registry.shards(dataset)) {
        registry.removeShard(dataset, shard.shardNum(), shard);
      }
    }
    LOG.info("Shut down the downsampled store");
    return column_store.shutdown();
  }

  @Override
  public void ingest(final DatasetRef dataset,
                     final int shard,
                     final IngestBatch batch) {
    throw new ReadOnlyStoreException("ingest");
  }

  @Override
  public Deferred<Object> ingestStream(final DatasetRef dataset,
                                       final int shard,
                                       final Iterator<IngestBatch> stream) {
    throw new ReadOnlyStoreException("ingestStream");
  }

  @Override
  public Deferred<Long> recoverStream(final DatasetRef dataset,
                                      final int shard,
                                      final Iterator<IngestBatch> stream,
                                      final long start_offset,
                                      final long end_offset) {
    throw new ReadOnlyStoreException("recoverStream");
  }

  @Override
  public Deferred<Object> truncate(final DatasetRef dataset, final int num_shards) {
    throw new ReadOnlyStoreException("truncate");
  }

  @Override
  public int numPartitions(final DatasetRef dataset, final int shard) {
    throw new ReadOnlyStoreException("numPartitions");
  }

  @Override
  public long numRowsIngested(final DatasetRef dataset, final int shard) {
    throw new ReadOnlyStoreException("numRowsIngested");
  }

  @Override
  public long latestOffset(final DatasetRef dataset, final int shard) {
    throw new ReadOnlyStoreException("latestOffset");
  }

  @Override
  public int groupsInDataset(final DatasetRef dataset) {
    throw new ReadOnlyStoreException("groupsInDataset");
  }

  @Override
  public void analyzeAndLogCorruptPtr(final DatasetRef dataset,
                                      final CorruptVectorException e) {
    throw new ReadOnlyStoreException("analyzeAndLogCorruptPtr");
  }

  @Override
  public CloseableIterator<RawPartData> readRawPartitions(
      final DatasetRef dataset,
      final PartitionScanMethod part_method,
      final ChunkScanMethod chunk_method) {
    throw new ReadOnlyStoreException("readRawPartitions");
  }
}
