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
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.roaringbitmap.PeekableIntIterator;
import org.roaringbitmap.RoaringBitmap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;

import net.downstore.data.DatasetRef;
import net.downstore.data.PartKey;
import net.downstore.data.PartKeyRecord;
import net.downstore.data.TermInfo;
import net.downstore.exceptions.IndexNotReadyException;
import net.downstore.query.filter.LabelFilter;
import net.downstore.utils.AbstractCloseableIterator;
import net.downstore.utils.CloseableIterator;
import net.downstore.utils.CloseableIterators;

/**
 * The part key index of one shard. Readers always work against one complete
 * {@link IndexSnapshot}, fetched once per call; a rebuild publishes a new
 * snapshot with a single atomic store so no reader sees a partial index.
 */
public class PartKeyIndex {
  private final DatasetRef dataset;
  private final int shard;
  private final AtomicReference<IndexSnapshot> snapshot =
      new AtomicReference<IndexSnapshot>();

  public PartKeyIndex(final DatasetRef dataset, final int shard) {
    this.dataset = dataset;
    this.shard = shard;
  }

  /** @return The current snapshot or null if the index was never built. */
  public IndexSnapshot current() {
    return snapshot.get();
  }

  /**
   * Publishes a new complete snapshot.
   * @param next A non-null snapshot.
   */
  void swap(final IndexSnapshot next) {
    if (next == null) {
      throw new IllegalArgumentException("Snapshot cannot be null.");
    }
    snapshot.set(next);
  }

  /**
   * @return The current snapshot.
   * @throws IndexNotReadyException if the index was never built.
   */
  public IndexSnapshot require() {
    final IndexSnapshot current = snapshot.get();
    if (current == null) {
      throw new IndexNotReadyException(dataset, shard);
    }
    return current;
  }

  /** @return The number of part keys in the current snapshot, 0 if none. */
  public int size() {
    final IndexSnapshot current = snapshot.get();
    return current == null ? 0 : current.size();
  }

  public List<String> indexNames(final int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("Limit cannot be negative: " + limit);
    }
    return ImmutableList.copyOf(Iterables.limit(require().labelNames(), limit));
  }

  public List<TermInfo> labelValues(final String label, final int top_k) {
    if (label == null) {
      throw new IllegalArgumentException("Label cannot be null.");
    }
    return require().termInfos(label, top_k);
  }

  /**
   * Lazily iterates the records matching every filter whose time range
   * overlaps {@code [start_time, end_time]}, in document order.
   */
  public CloseableIterator<PartKeyRecord> records(
      final Collection<LabelFilter> filters,
      final long start_time,
      final long end_time) {
    if (filters == null) {
      throw new IllegalArgumentException("Filters cannot be null.");
    }
    final IndexSnapshot current = require();
    final RoaringBitmap docs = current.matching(filters);
    final PeekableIntIterator it = docs.getIntIterator();
    return new AbstractCloseableIterator<PartKeyRecord>() {
      @Override
      protected PartKeyRecord fetchNext() {
        while (it.hasNext()) {
          final PartKeyRecord record = current.record(it.next());
          if (record.overlaps(start_time, end_time)) {
            return record;
          }
        }
        return endOfData();
      }

      @Override
      protected void release() {
        // nothing to release, the snapshot is in memory
      }
    };
  }

  public CloseableIterator<PartKey> partKeysWithFilters(
      final Collection<LabelFilter> filters,
      final long start_time,
      final long end_time,
      final int limit) {
    return CloseableIterators.limit(CloseableIterators.transform(
        records(filters, start_time, end_time), PartKeyRecord::partKey), limit);
  }

  /**
   * Distinct projections of the matching series onto the given label names.
   * Labels a series lacks are left out of its projection and series lacking
   * all of them are skipped.
   */
  public CloseableIterator<Map<String, String>> labelValuesWithFilters(
      final Collection<LabelFilter> filters,
      final Collection<String> label_names,
      final long start_time,
      final long end_time,
      final int limit) {
    if (label_names == null) {
      throw new IllegalArgumentException("Label names cannot be null.");
    }
    final List<String> names = ImmutableList.copyOf(label_names);
    final CloseableIterator<Map<String, String>> projections =
        CloseableIterators.transform(records(filters, start_time, end_time),
            record -> project(record, names));
    return CloseableIterators.limit(CloseableIterators.distinct(
        CloseableIterators.filter(projections, map -> !map.isEmpty())), limit);
  }

  private static Map<String, String> project(final PartKeyRecord record,
                                             final List<String> names) {
    final ImmutableMap.Builder<String, String> projection = ImmutableMap.builder();
    for (final String name : names) {
      final String value = record.labels().get(name);
      if (value != null) {
        projection.put(name, value);
      }
    }
    return projection.buildKeepingLast();
  }
}
