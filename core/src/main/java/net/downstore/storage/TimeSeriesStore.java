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

import java.util.Iterator;

import com.stumbleupon.async.Deferred;

import net.downstore.data.DatasetRef;
import net.downstore.data.IngestBatch;
import net.downstore.data.RawPartData;
import net.downstore.exceptions.CorruptVectorException;
import net.downstore.query.ChunkScanMethod;
import net.downstore.query.PartitionScanMethod;
import net.downstore.utils.CloseableIterator;

/**
 * A store that also ingests. Read-only implementations throw a
 * {@link net.downstore.exceptions.ReadOnlyStoreException} from every method
 * declared here, code that only reads should depend on
 * {@link ReadableTimeSeriesStore} instead.
 *
 * @since 1.0
 */
public interface TimeSeriesStore extends ReadableTimeSeriesStore {

  public void ingest(final DatasetRef dataset,
                     final int shard,
                     final IngestBatch batch);

  /**
   * Ingests batches until the stream ends.
   * @return A deferred resolving to null once the stream is consumed.
   */
  public Deferred<Object> ingestStream(final DatasetRef dataset,
                                       final int shard,
                                       final Iterator<IngestBatch> stream);

  /**
   * Replays the stream between the offsets.
   * @return A deferred resolving to the last offset replayed.
   */
  public Deferred<Long> recoverStream(final DatasetRef dataset,
                                      final int shard,
                                      final Iterator<IngestBatch> stream,
                                      final long start_offset,
                                      final long end_offset);

  public Deferred<Object> truncate(final DatasetRef dataset, final int num_shards);

  public int numPartitions(final DatasetRef dataset, final int shard);

  public long numRowsIngested(final DatasetRef dataset, final int shard);

  public long latestOffset(final DatasetRef dataset, final int shard);

  public int groupsInDataset(final DatasetRef dataset);

  public void analyzeAndLogCorruptPtr(final DatasetRef dataset,
                                      final CorruptVectorException e);

  public CloseableIterator<RawPartData> readRawPartitions(
      final DatasetRef dataset,
      final PartitionScanMethod part_method,
      final ChunkScanMethod chunk_method);
}
