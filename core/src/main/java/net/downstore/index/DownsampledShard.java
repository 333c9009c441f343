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
package net.downstore.index;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.stumbleupon.async.Deferred;

import net.downstore.data.DatasetRef;
import net.downstore.data.PartKey;
import net.downstore.data.PartKeyRecord;
import net.downstore.data.RawPartData;
import net.downstore.data.ReadablePartition;
import net.downstore.data.Schema;
import net.downstore.data.Schemas;
import net.downstore.data.TermInfo;
import net.downstore.downsample.DownsampleConfig;
import net.downstore.exceptions.IndexRecoveryCanceledException;
import net.downstore.exceptions.ShardMisroutedException;
import net.downstore.query.AllPartitionScan;
import net.downstore.query.ChunkScanMethod;
import net.downstore.query.FilteredPartitionScan;
import net.downstore.query.MultiPartitionScan;
import net.downstore.query.PartLookupResult;
import net.downstore.query.PartitionScanMethod;
import net.downstore.query.filter.LabelFilter;
import net.downstore.stats.ScanStats;
import net.downstore.stats.ShardStats;
import net.downstore.stats.StopTimerCallback;
import net.downstore.storage.ColumnStore;
import net.downstore.store.StoreConfig;
import net.downstore.utils.CloseableIterator;
import net.downstore.utils.CloseableIterators;

/**
 * One shard of a downsampled dataset. Holds the in-memory part key index of
 * the shard, rebuilt from the column store by {@link #recoverIndex()}, and
 * serves lookups and scans against it. Chunks are never cached, scans read
 * them from the column store.
 * <p>
 * All query calls are safe to run concurrently with each other and with a
 * rebuild. Rebuilds of the same shard run one at a time.
 *
 * @since 1.0
 */
public class DownsampledShard {
  private static final Logger LOG = LoggerFactory.getLogger(DownsampledShard.class);

  private final DatasetRef dataset;
  private final int shard;
  private final Schemas schemas;
  private final StoreConfig store_config;
  private final DownsampleConfig downsample_config;
  private final ColumnStore column_store;
  private final ExecutorService io_pool;
  private final ShardStats stats;
  private final ScanStats scan_stats;

  private final PartKeyIndex index;
  private final AtomicReference<IndexState> state =
      new AtomicReference<IndexState>(IndexState.UNINITIALIZED);
  private final ReentrantLock rebuild_lock = new ReentrantLock();
  private final Set<Recovery> in_flight = Sets.newConcurrentHashSet();
  private final AtomicBoolean shut_down = new AtomicBoolean();

  /**
   * Default ctor.
   * @param dataset The non-null dataset.
   * @param shard The shard number, zero or greater.
   * @param schemas The non-null schemas part keys may use.
   * @param store_config The non-null store tuning.
   * @param downsample_config The non-null downsample settings.
   * @param column_store The non-null column store to read from.
   * @param io_pool The non-null pool index rebuilds run on.
   * @param registry The non-null registry to register stats in.
   * @param scan_stats The non-null store wide scan counters.
   */
  public DownsampledShard(final DatasetRef dataset,
                          final int shard,
                          final Schemas schemas,
                          final StoreConfig store_config,
                          final DownsampleConfig downsample_config,
                          final ColumnStore column_store,
                          final ExecutorService io_pool,
                          final MetricRegistry registry,
                          final ScanStats scan_stats) {
    if (dataset == null) {
      throw new IllegalArgumentException("Dataset cannot be null.");
    }
    if (shard < 0) {
      throw new IllegalArgumentException("Shard cannot be negative: " + shard);
    }
    if (schemas == null) {
      throw new IllegalArgumentException("Schemas cannot be null.");
    }
    if (store_config == null) {
      throw new IllegalArgumentException("Store config cannot be null.");
    }
    if (column_store == null) {
      throw new IllegalArgumentException("Column store cannot be null.");
    }
    if (io_pool == null) {
      throw new IllegalArgumentException("IO pool cannot be null.");
    }
    this.dataset = dataset;
    this.shard = shard;
    this.schemas = schemas;
    this.store_config = store_config;
    this.downsample_config = downsample_config == null
        ? DownsampleConfig.DISABLED : downsample_config;
    this.column_store = column_store;
    this.io_pool = io_pool;
    this.scan_stats = scan_stats;
    stats = new ShardStats(dataset, shard, registry);
    index = new PartKeyIndex(dataset, shard);
  }

  /**
   * Rebuilds the part key index from the column store on the IO pool. The
   * current index keeps serving queries until the new one is complete.
   * @return A deferred resolving to null once the new index is published,
   * to the store's exception if the rebuild failed (the previous index is
   * kept; an {@link Error} arrives wrapped in an IllegalStateException) or
   * to an {@link IndexRecoveryCanceledException} if the shard was
   * shut down first.
   */
  public Deferred<Object> recoverIndex() {
    if (shut_down.get()) {
      return Deferred.fromError(
          new IndexRecoveryCanceledException(dataset, shard, "shard is shut down"));
    }
    final Recovery recovery = new Recovery();
    in_flight.add(recovery);
    final Deferred<Object> result =
        StopTimerCallback.stopOn(stats.startRecovery(), recovery.deferred);
    // a shutdown may have raced the add above
    if (shut_down.get()) {
      recovery.cancel("shard is shut down");
      return result;
    }
    try {
      io_pool.execute(recovery);
    } catch (RejectedExecutionException e) {
      recovery.fail(e);
    }
    return result;
  }

  /** @return The lifecycle state of the index. */
  public IndexState indexState() {
    return state.get();
  }

  /**
   * Label names known to the index.
   * @param limit The maximum number of names to return.
   * @return Up to limit names.
   */
  public List<String> indexNames(final int limit) {
    try {
      return index.indexNames(limit);
    } catch (RuntimeException e) {
      stats.queryError();
      throw e;
    }
  }

  /**
   * The most frequent values of a label.
   * @param label The label name.
   * @param top_k How many values to return at most.
   * @return Values by frequency descending, ties by value. Empty if the label
   * is unknown.
   */
  public List<TermInfo> labelValues(final String label, final int top_k) {
    try {
      return index.labelValues(label, top_k);
    } catch (RuntimeException e) {
      stats.queryError();
      throw e;
    }
  }

  /**
   * Distinct label projections of the series matching all filters within
   * the time range.
   * @return A lazy iterator of at most limit projections. Must be closed.
   */
  public CloseableIterator<Map<String, String>> labelValuesWithFilters(
      final Collection<LabelFilter> filters,
      final Collection<String> label_names,
      final long start_time,
      final long end_time,
      final int limit) {
    try {
      return index.labelValuesWithFilters(filters, label_names, start_time,
          end_time, limit);
    } catch (RuntimeException e) {
      stats.queryError();
      throw e;
    }
  }

  /**
   * Part keys of the series matching all filters within the time range.
   * @return A lazy iterator of at most limit part keys. Must be closed.
   */
  public CloseableIterator<PartKey> partKeysWithFilters(
      final Collection<LabelFilter> filters,
      final long start_time,
      final long end_time,
      final int limit) {
    try {
      return index.partKeysWithFilters(filters, start_time, end_time, limit);
    } catch (RuntimeException e) {
      stats.queryError();
      throw e;
    }
  }

  /**
   * Resolves the partitions a scan should read.
   * @param part_method The non-null partition selection for this shard.
   * @param chunk_method The non-null time range of chunks to read.
   * @return The lookup result bound to this shard.
   * @throws ShardMisroutedException if the method targets another shard.
   */
  public PartLookupResult lookupPartitions(final PartitionScanMethod part_method,
                                           final ChunkScanMethod chunk_method) {
    if (part_method == null) {
      throw new IllegalArgumentException("Partition method cannot be null.");
    }
    if (chunk_method == null) {
      throw new IllegalArgumentException("Chunk method cannot be null.");
    }
    try {
      if (part_method.shard() != shard) {
        throw new ShardMisroutedException(dataset, shard, part_method.shard());
      }
      final IndexSnapshot snapshot = index.require();
      final List<PartKeyRecord> records = Lists.newArrayList();
      if (part_method instanceof MultiPartitionScan) {
        for (final PartKey part_key : ((MultiPartitionScan) part_method).partKeys()) {
          final PartKeyRecord record = snapshot.record(part_key);
          if (record != null && record.overlaps(chunk_method.startTime(),
              chunk_method.endTime())) {
            records.add(record);
          }
        }
      } else {
        final List<LabelFilter> filters;
        if (part_method instanceof FilteredPartitionScan) {
          filters = ((FilteredPartitionScan) part_method).filters();
        } else if (part_method instanceof AllPartitionScan) {
          filters = ImmutableList.of();
        } else {
          throw new IllegalArgumentException("Unsupported partition method: "
              + part_method);
        }
        try (final CloseableIterator<PartKeyRecord> it = index.records(filters,
            chunk_method.startTime(), chunk_method.endTime())) {
          while (it.hasNext()) {
            records.add(it.next());
          }
        }
      }

      final List<PartKey> part_keys = Lists.newArrayListWithCapacity(records.size());
      for (final PartKeyRecord record : records) {
        part_keys.add(record.partKey());
      }
      stats.lookup(part_keys.size());
      if (LOG.isDebugEnabled()) {
        LOG.debug("Lookup on {} shard {} with {} matched {} partitions",
            dataset, shard, part_method, part_keys.size());
      }
      return new PartLookupResult(dataset, shard, chunk_method, part_keys,
          records.isEmpty() ? OptionalInt.empty()
              : OptionalInt.of(records.get(0).schemaId()));
    } catch (RuntimeException e) {
      stats.queryError();
      throw e;
    }
  }

  /**
   * Streams the partitions of a lookup result from the column store, reading
   * {@link StoreConfig#scanBatchSize()} partitions per call to the store.
   * @param lookup A non-null result produced by this shard.
   * @return A lazy iterator of partitions. Must be closed to release the
   * store's cursor if not consumed fully.
   * @throws ShardMisroutedException if the result belongs to another shard
   * or dataset.
   */
  public CloseableIterator<ReadablePartition> scanPartitions(
      final PartLookupResult lookup) {
    if (lookup == null) {
      throw new IllegalArgumentException("Lookup result cannot be null.");
    }
    if (lookup.shard() != shard || !lookup.dataset().equals(dataset)) {
      stats.queryError();
      throw new ShardMisroutedException(dataset, shard, lookup.shard());
    }
    final IndexSnapshot snapshot = index.current();
    final long start_time = lookup.chunkMethod().startTime();
    final long end_time = lookup.chunkMethod().endTime();
    final Iterator<List<PartKey>> batches =
        Lists.partition(lookup.partKeys(), store_config.scanBatchSize()).iterator();
    final CloseableIterator<RawPartData> raw = CloseableIterators.concat(() ->
        batches.hasNext()
            ? column_store.readRawPartitions(dataset, shard, batches.next(),
                start_time, end_time)
            : null);
    return CloseableIterators.transform(raw, data -> {
      final DownsampledPartition partition =
          toPartition(snapshot, lookup, data, start_time, end_time);
      if (scan_stats != null) {
        scan_stats.partitionScanned(partition.chunks().size());
      }
      return partition;
    });
  }

  private DownsampledPartition toPartition(final IndexSnapshot snapshot,
                                           final PartLookupResult lookup,
                                           final RawPartData data,
                                           final long start_time,
                                           final long end_time) {
    final PartKeyRecord record = snapshot == null ? null
        : snapshot.record(data.partKey());
    final int schema_id;
    if (record != null) {
      schema_id = record.schemaId();
    } else if (lookup.firstSchemaId().isPresent()) {
      schema_id = lookup.firstSchemaId().getAsInt();
    } else {
      throw new IllegalStateException("No schema known for " + data.partKey()
          + " in " + dataset + " shard " + shard);
    }
    final Schema schema = schemas.schema(schema_id).orElseThrow(() ->
        new IllegalStateException("Unknown schema " + schema_id + " for "
            + data.partKey() + " in " + dataset + " shard " + shard));
    final Map<String, String> labels = record == null
        ? ImmutableMap.<String, String>of() : record.labels();
    return new DownsampledPartition(shard, data, labels, schema, start_time,
        end_time);
  }

  /** @return A point in time copy of the shard's counters. */
  public ShardStats.Snapshot shardStats() {
    return stats.snapshot();
  }

  /**
   * Cancels any running rebuild and unregisters the shard's metrics. The
   * index is left as is.
   */
  public void shutdown() {
    if (!shut_down.compareAndSet(false, true)) {
      return;
    }
    for (final Recovery recovery : in_flight) {
      recovery.cancel("shard is shut down");
    }
    stats.unregister();
    LOG.info("Shut down {} shard {}", dataset, shard);
  }

  public DatasetRef dataset() {
    return dataset;
  }

  public int shardNum() {
    return shard;
  }

  public Schemas schemas() {
    return schemas;
  }

  public StoreConfig storeConfig() {
    return store_config;
  }

  public DownsampleConfig downsampleConfig() {
    return downsample_config;
  }

  /** @return The number of part keys in the current index. */
  public int indexSize() {
    return index.size();
  }

  @Override
  public String toString() {
    return "DownsampledShard(" + dataset + ", " + shard + ", " + state.get() + ")";
  }

  /**
   * One rebuild of the index. Completes exactly once: the first of publish,
   * failure or cancellation wins.
   */
  private class Recovery implements Runnable {
    final Deferred<Object> deferred = new Deferred<Object>();
    private final AtomicBoolean done = new AtomicBoolean();

    @Override
    public void run() {
      rebuild_lock.lock();
      try {
        if (done.get()) {
          return;
        }
        state.set(IndexState.INDEXING);
        LOG.info("Recovering index of {} shard {}", dataset, shard);
        final IndexSnapshot.Builder builder = IndexSnapshot.newBuilder();
        int skipped = 0;
        try (final CloseableIterator<PartKeyRecord> it = column_store.scanPartKeys(
            dataset, shard, store_config.indexRecoveryPageSize())) {
          while (it.hasNext()) {
            if (done.get()) {
              return;
            }
            final PartKeyRecord record = it.next();
            if (!schemas.contains(record.schemaId())) {
              skipped++;
              stats.skippedRecord();
              if (LOG.isDebugEnabled()) {
                LOG.debug("Skipping {} of {} shard {} with unknown schema {}",
                    record.partKey(), dataset, shard, record.schemaId());
              }
              continue;
            }
            builder.add(record);
          }
        }
        if (skipped > 0) {
          LOG.warn("Skipped {} part keys with unknown schemas recovering {} shard {}",
              skipped, dataset, shard);
        }
        publish(builder.build());
      } catch (RuntimeException e) {
        settleState();
        fail(e);
      } catch (Error e) {
        settleState();
        fail(new IllegalStateException("Index recovery of " + dataset
            + " shard " + shard + " aborted", e));
        throw e;
      } finally {
        settleState();
        rebuild_lock.unlock();
        in_flight.remove(this);
      }
    }

    private void publish(final IndexSnapshot snapshot) {
      if (!done.compareAndSet(false, true)) {
        return;
      }
      index.swap(snapshot);
      state.set(IndexState.READY);
      stats.recovered(snapshot.size());
      LOG.info("Recovered index of {} shard {} with {} part keys",
          dataset, shard, snapshot.size());
      deferred.callback(null);
    }

    void fail(final Exception e) {
      if (!done.compareAndSet(false, true)) {
        return;
      }
      in_flight.remove(this);
      stats.recoveryFailed();
      LOG.error("Failed to recover index of {} shard {}", dataset, shard, e);
      deferred.callback(e);
    }

    void cancel(final String reason) {
      if (!done.compareAndSet(false, true)) {
        return;
      }
      in_flight.remove(this);
      LOG.info("Canceled index recovery of {} shard {}: {}", dataset, shard, reason);
      deferred.callback(new IndexRecoveryCanceledException(dataset, shard, reason));
    }

    /** Called with the rebuild lock held. */
    private void settleState() {
      state.set(index.current() == null ? IndexState.UNINITIALIZED
          : IndexState.READY);
    }
  }
}
