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

import java.util.List;

import com.stumbleupon.async.Deferred;

import net.downstore.data.DatasetRef;
import net.downstore.data.PartKey;
import net.downstore.data.PartKeyRecord;
import net.downstore.data.RawPartData;
import net.downstore.utils.CloseableIterator;

/**
 * The backing column store holding persisted part keys and chunks of the
 * downsampled datasets. Implementations are shared between every shard on
 * a node and are only ever read from by the shard store.
 * <p>
 * Any call may throw a {@link net.downstore.exceptions.StoreUnavailableException}
 * when the store cannot be reached. The shard store does not retry.
 *
 * @since 1.0
 */
public interface ColumnStore {

  /**
   * Scans the part key index table of the given shard. The store is expected
   * to fetch from its backend in pages of {@code page_size} records as the
   * iterator is consumed.
   * @param dataset A non-null dataset.
   * @param shard The shard number.
   * @param page_size The number of records to fetch per round trip.
   * @return A non-null iterator that must be closed by the caller.
   */
  public CloseableIterator<PartKeyRecord> scanPartKeys(final DatasetRef dataset,
                                                       final int shard,
                                                       final int page_size);

  /**
   * Reads the chunks of the given partitions that overlap the time range.
   * Chunks of each partition are ordered by start time.
   * @param dataset A non-null dataset.
   * @param shard The shard number.
   * @param part_keys A non-null list of part keys to read.
   * @param start_time The inclusive start of the range in milliseconds.
   * @param end_time The inclusive end of the range in milliseconds.
   * @return A non-null iterator over the partitions found, in no particular
   * order. Partitions without data may be omitted. Must be closed by the
   * caller.
   */
  public CloseableIterator<RawPartData> readRawPartitions(
      final DatasetRef dataset,
      final int shard,
      final List<PartKey> part_keys,
      final long start_time,
      final long end_time);

  /**
   * Drops all state of the store. Only used in tests and admin tooling.
   */
  public void reset();

  /**
   * Releases resources held by the store.
   * @return A deferred resolving to null.
   */
  public Deferred<Object> shutdown();
}
