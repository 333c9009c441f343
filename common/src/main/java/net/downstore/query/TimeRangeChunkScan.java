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

/**
 * Reads the chunks of each partition overlapping an inclusive time range.
 *
 * @since 1.0
 */
public final class TimeRangeChunkScan extends ChunkScanMethod {

  public TimeRangeChunkScan(final long start_time, final long end_time) {
    super(start_time, end_time);
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof TimeRangeChunkScan)) {
      return false;
    }
    final TimeRangeChunkScan other = (TimeRangeChunkScan) o;
    return start_time == other.start_time && end_time == other.end_time;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(start_time) * 31 + Long.hashCode(end_time);
  }

  @Override
  public String toString() {
    return "TimeRangeChunkScan(" + start_time + ", " + end_time + ")";
  }
}
