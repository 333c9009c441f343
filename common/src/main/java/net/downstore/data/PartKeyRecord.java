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
package net.downstore.data;

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSortedMap;

/**
 * A part key as persisted by the backing column store along with the labels
 * it encodes, the schema of its data and the time range it has data for.
 * These are what a shard index is rebuilt from.
 *
 * @since 1.0
 */
public final class PartKeyRecord {
  private final PartKey part_key;
  private final ImmutableSortedMap<String, String> labels;
  private final int schema_id;
  private final long start_time;
  private final long end_time;
  private final int shard;

  /**
   * Default ctor.
   * @param part_key The non-null part key.
   * @param labels The non-null labels of the series.
   * @param schema_id The schema ID of the series data.
   * @param start_time The earliest timestamp with data, in epoch millis.
   * @param end_time The latest timestamp with data, in epoch millis.
   * @param shard The shard the record was read from.
   * @throws IllegalArgumentException if the key or labels were null or the
   * time range was inverted.
   */
  public PartKeyRecord(final PartKey part_key,
                       final Map<String, String> labels,
                       final int schema_id,
                       final long start_time,
                       final long end_time,
                       final int shard) {
    if (part_key == null) {
      throw new IllegalArgumentException("Part key cannot be null.");
    }
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    if (end_time < start_time) {
      throw new IllegalArgumentException("End time " + end_time
          + " cannot be less than start time " + start_time);
    }
    this.part_key = part_key;
    this.labels = ImmutableSortedMap.copyOf(labels);
    this.schema_id = schema_id;
    this.start_time = start_time;
    this.end_time = end_time;
    this.shard = shard;
  }

  public PartKey partKey() {
    return part_key;
  }

  public ImmutableSortedMap<String, String> labels() {
    return labels;
  }

  public int schemaId() {
    return schema_id;
  }

  public long startTime() {
    return start_time;
  }

  public long endTime() {
    return end_time;
  }

  public int shard() {
    return shard;
  }

  /**
   * @param start The inclusive start of a query range in epoch millis.
   * @param end The inclusive end of a query range in epoch millis.
   * @return True if this series has data inside the range.
   */
  public boolean overlaps(final long start, final long end) {
    return start_time <= end && end_time >= start;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("partKey", part_key)
        .add("labels", labels)
        .add("schemaId", schema_id)
        .add("startTime", start_time)
        .add("endTime", end_time)
        .add("shard", shard)
        .toString();
  }
}
