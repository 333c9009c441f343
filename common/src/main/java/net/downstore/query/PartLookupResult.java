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
package net.downstore.query;

import java.util.List;
import java.util.OptionalInt;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import net.downstore.data.DatasetRef;
import net.downstore.data.PartKey;

/**
 * The partitions a shard resolved for a scan, bound to that shard and to the
 * chunk range requested. A result must only be handed back to the shard that
 * produced it; shards reject results recorded for another shard number.
 *
 * @since 1.0
 */
public final class PartLookupResult {
  private final DatasetRef dataset;
  private final int shard;
  private final ChunkScanMethod chunk_method;
  private final ImmutableList<PartKey> part_keys;
  private final OptionalInt first_schema_id;

  /**
   * Default ctor.
   * @param dataset The non-null dataset the lookup ran against.
   * @param shard The shard that resolved the partitions.
   * @param chunk_method The non-null chunk range to read.
   * @param part_keys The non-null matched keys in index order.
   * @param first_schema_id The schema of the first match if any matched.
   */
  public PartLookupResult(final DatasetRef dataset,
                          final int shard,
                          final ChunkScanMethod chunk_method,
                          final List<PartKey> part_keys,
                          final OptionalInt first_schema_id) {
    if (dataset == null) {
      throw new IllegalArgumentException("Dataset cannot be null.");
    }
    if (chunk_method == null) {
      throw new IllegalArgumentException("Chunk method cannot be null.");
    }
    if (part_keys == null) {
      throw new IllegalArgumentException("Part keys cannot be null.");
    }
    this.dataset = dataset;
    this.shard = shard;
    this.chunk_method = chunk_method;
    this.part_keys = ImmutableList.copyOf(part_keys);
    this.first_schema_id = first_schema_id == null ? OptionalInt.empty()
        : first_schema_id;
  }

  public DatasetRef dataset() {
    return dataset;
  }

  public int shard() {
    return shard;
  }

  public ChunkScanMethod chunkMethod() {
    return chunk_method;
  }

  public List<PartKey> partKeys() {
    return part_keys;
  }

  /** @return The schema ID of the first matched partition, empty when
   * nothing matched. */
  public OptionalInt firstSchemaId() {
    return first_schema_id;
  }

  /** @return True when no partition matched. */
  public boolean isEmpty() {
    return part_keys.isEmpty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("dataset", dataset)
        .add("shard", shard)
        .add("chunkMethod", chunk_method)
        .add("partitions", part_keys.size())
        .add("firstSchemaId", first_schema_id)
        .toString();
  }
}
