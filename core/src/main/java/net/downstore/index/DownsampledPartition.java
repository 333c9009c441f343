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

import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import net.downstore.data.PartKey;
import net.downstore.data.RawChunk;
import net.downstore.data.RawPartData;
import net.downstore.data.ReadablePartition;
import net.downstore.data.Schema;

/**
 * A partition read from the column store, holding only the chunks that
 * overlap the queried time range.
 */
public class DownsampledPartition implements ReadablePartition {
  private final int shard;
  private final PartKey part_key;
  private final Map<String, String> labels;
  private final Schema schema;
  private final ImmutableList<RawChunk> chunks;

  public DownsampledPartition(final int shard,
                              final RawPartData data,
                              final Map<String, String> labels,
                              final Schema schema,
                              final long start_time,
                              final long end_time) {
    this.shard = shard;
    this.part_key = data.partKey();
    this.labels = labels;
    this.schema = schema;
    final ImmutableList.Builder<RawChunk> chunks = ImmutableList.builder();
    for (final RawChunk chunk : data.chunks()) {
      if (chunk.overlaps(start_time, end_time)) {
        chunks.add(chunk);
      }
    }
    this.chunks = chunks.build();
  }

  @Override
  public int shard() {
    return shard;
  }

  @Override
  public PartKey partKey() {
    return part_key;
  }

  @Override
  public Map<String, String> labels() {
    return labels;
  }

  @Override
  public Schema schema() {
    return schema;
  }

  @Override
  public List<RawChunk> chunks() {
    return chunks;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("shard", shard)
        .add("partKey", part_key)
        .add("labels", labels)
        .add("schema", schema.name())
        .add("chunks", chunks.size())
        .toString();
  }
}
