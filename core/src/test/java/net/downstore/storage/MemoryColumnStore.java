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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Deferred;

import net.downstore.data.DatasetRef;
import net.downstore.data.PartKey;
import net.downstore.data.PartKeyRecord;
import net.downstore.data.RawChunk;
import net.downstore.data.RawPartData;
import net.downstore.data.Schemas;
import net.downstore.exceptions.StoreUnavailableException;
import net.downstore.utils.AbstractCloseableIterator;
import net.downstore.utils.CloseableIterator;
import net.downstore.utils.CloseableIterators;

/**
 * An in-memory column and meta store for unit tests. Keeps part key records
 * and chunks per dataset and shard, counts the cursors it hands out and can
 * be told to fail or to block scans.
 */
public class MemoryColumnStore implements ColumnStore, MetaStore {
  private final Map<String, List<PartKeyRecord>> part_keys =
      new ConcurrentHashMap<String, List<PartKeyRecord>>();
  private final Map<String, Map<PartKey, List<RawChunk>>> chunks =
      new ConcurrentHashMap<String, Map<PartKey, List<RawChunk>>>();
  private final Map<DatasetRef, Schemas> schemas =
      new ConcurrentHashMap<DatasetRef, Schemas>();

  private final AtomicInteger open_cursors = new AtomicInteger();
  private final AtomicInteger scans = new AtomicInteger();
  private final AtomicInteger pages = new AtomicInteger();
  private final AtomicInteger resets = new AtomicInteger();
  private final AtomicInteger shutdowns = new AtomicInteger();
  private final List<Integer> read_batches = new CopyOnWriteArrayList<Integer>();

  private volatile RuntimeException scan_failure;
  private volatile int fail_after;
  private volatile CountDownLatch scan_started;
  private volatile CountDownLatch scan_gate;

  private static String key(final DatasetRef dataset, final int shard) {
    return dataset + ":" + shard;
  }

  public void addPartKey(final DatasetRef dataset, final PartKeyRecord record) {
    part_keys.computeIfAbsent(key(dataset, record.shard()),
        k -> new CopyOnWriteArrayList<PartKeyRecord>()).add(record);
  }

  public void addChunks(final DatasetRef dataset,
                        final int shard,
                        final PartKey part_key,
                        final RawChunk... data) {
    chunks.computeIfAbsent(key(dataset, shard),
        k -> new ConcurrentHashMap<PartKey, List<RawChunk>>())
        .computeIfAbsent(part_key, k -> new CopyOnWriteArrayList<RawChunk>())
        .addAll(ImmutableList.copyOf(data));
  }

  public void putSchemas(final DatasetRef dataset, final Schemas schemas) {
    this.schemas.put(dataset, schemas);
  }

  /**
   * Makes part key scans throw after returning the given number of records.
   * A null exception turns failures off.
   */
  public void failScans(final RuntimeException e, final int after_records) {
    fail_after = after_records;
    scan_failure = e;
  }

  /**
   * Blocks the next part key scans until the gate opens, counting down the
   * started latch as each scan begins.
   */
  public void blockScans(final CountDownLatch started, final CountDownLatch gate) {
    scan_started = started;
    scan_gate = gate;
  }

  public int openCursors() {
    return open_cursors.get();
  }

  public int scans() {
    return scans.get();
  }

  public int pages() {
    return pages.get();
  }

  public int resets() {
    return resets.get();
  }

  public int shutdowns() {
    return shutdowns.get();
  }

  /** @return The number of part keys asked for in each partition read. */
  public List<Integer> readBatches() {
    return read_batches;
  }

  @Override
  public CloseableIterator<PartKeyRecord> scanPartKeys(final DatasetRef dataset,
                                                       final int shard,
                                                       final int page_size) {
    scans.incrementAndGet();
    final CountDownLatch started = scan_started;
    final CountDownLatch gate = scan_gate;
    if (started != null) {
      started.countDown();
    }
    if (gate != null) {
      try {
        if (!gate.await(30, TimeUnit.SECONDS)) {
          throw new StoreUnavailableException("Timed out waiting on the gate");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new StoreUnavailableException("Interrupted", e);
      }
    }

    final List<PartKeyRecord> records = part_keys.getOrDefault(
        key(dataset, shard), Collections.<PartKeyRecord>emptyList());
    final Iterator<List<PartKeyRecord>> paged =
        Lists.partition(ImmutableList.copyOf(records), page_size).iterator();
    final CloseableIterator<PartKeyRecord> all = CloseableIterators.concat(() -> {
      if (!paged.hasNext()) {
        return null;
      }
      pages.incrementAndGet();
      return CloseableIterators.wrap(paged.next().iterator());
    });
    final RuntimeException failure = scan_failure;
    final int limit = fail_after;
    open_cursors.incrementAndGet();
    return new AbstractCloseableIterator<PartKeyRecord>() {
      private int returned;

      @Override
      protected PartKeyRecord fetchNext() {
        if (failure != null && returned >= limit) {
          throw failure;
        }
        if (!all.hasNext()) {
          return endOfData();
        }
        returned++;
        return all.next();
      }

      @Override
      protected void release() {
        all.close();
        open_cursors.decrementAndGet();
      }
    };
  }

  @Override
  public CloseableIterator<RawPartData> readRawPartitions(final DatasetRef dataset,
                                                          final int shard,
                                                          final List<PartKey> keys,
                                                          final long start_time,
                                                          final long end_time) {
    read_batches.add(keys.size());
    final Map<PartKey, List<RawChunk>> shard_chunks = chunks.getOrDefault(
        key(dataset, shard), Maps.<PartKey, List<RawChunk>>newHashMap());
    final List<RawPartData> results = Lists.newArrayList();
    for (final PartKey part_key : keys) {
      final List<RawChunk> data = shard_chunks.get(part_key);
      results.add(new RawPartData(part_key,
          data == null ? ImmutableList.<RawChunk>of() : data));
    }
    open_cursors.incrementAndGet();
    return CloseableIterators.wrap(results.iterator(),
        open_cursors::decrementAndGet);
  }

  @Override
  public Deferred<Schemas> readSchemas(final DatasetRef dataset) {
    final Schemas found = schemas.get(dataset);
    if (found == null) {
      return Deferred.fromError(new StoreUnavailableException(
          "No schemas for " + dataset));
    }
    return Deferred.fromResult(found);
  }

  @Override
  public void reset() {
    resets.incrementAndGet();
    part_keys.clear();
    chunks.clear();
  }

  @Override
  public Deferred<Object> shutdown() {
    shutdowns.incrementAndGet();
    return Deferred.fromResult(null);
  }
}
