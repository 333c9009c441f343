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

import java.util.Arrays;

/**
 * One encoded chunk of a partition as returned by the backing column store.
 * The bytes are opaque to the store; only the time bounds are interpreted.
 *
 * @since 1.0
 */
public final class RawChunk {
  private final long start_time;
  private final long end_time;
  private final int num_rows;
  private final byte[] data;

  /**
   * Default ctor.
   * @param start_time The first timestamp in the chunk, epoch millis.
   * @param end_time The last timestamp in the chunk, epoch millis.
   * @param num_rows The number of rows encoded.
   * @param data The non-null encoded chunk.
   */
  public RawChunk(final long start_time,
                  final long end_time,
                  final int num_rows,
                  final byte[] data) {
    if (data == null) {
      throw new IllegalArgumentException("Chunk data cannot be null.");
    }
    if (end_time < start_time) {
      throw new IllegalArgumentException("Chunk end time " + end_time
          + " is before the start time " + start_time);
    }
    this.start_time = start_time;
    this.end_time = end_time;
    this.num_rows = num_rows;
    this.data = data;
  }

  public long startTime() {
    return start_time;
  }

  public long endTime() {
    return end_time;
  }

  public int numRows() {
    return num_rows;
  }

  /** @return The encoded chunk. Callers must not modify the array. */
  public byte[] data() {
    return data;
  }

  /** @return True if the chunk holds data within the inclusive range. */
  public boolean overlaps(final long start, final long end) {
    return start_time <= end && end_time >= start;
  }

  @Override
  public String toString() {
    return "RawChunk(start=" + start_time + ", end=" + end_time + ", rows="
        + num_rows + ", bytes=" + data.length + ")";
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawChunk)) {
      return false;
    }
    final RawChunk other = (RawChunk) o;
    return start_time == other.start_time && end_time == other.end_time
        && num_rows == other.num_rows && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(start_time) + Arrays.hashCode(data);
  }
}
