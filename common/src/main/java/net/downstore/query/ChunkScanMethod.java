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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The time range of chunks a query wants from each partition. Both ends are
 * inclusive epoch milliseconds.
 *
 * @since 1.0
 */
public abstract class ChunkScanMethod {
  protected final long start_time;
  protected final long end_time;

  /**
   * @param start_time The inclusive start, zero or more.
   * @param end_time The inclusive end, not less than the start.
   * @throws IllegalArgumentException if the range was invalid.
   */
  protected ChunkScanMethod(final long start_time, final long end_time) {
    checkArgument(start_time >= 0,
        "The start time must be zero or greater but was %s", start_time);
    checkArgument(end_time >= start_time,
        "The end time cannot be less than the start time. End %s, start %s",
        end_time, start_time);
    this.start_time = start_time;
    this.end_time = end_time;
  }

  public long startTime() {
    return start_time;
  }

  public long endTime() {
    return end_time;
  }
}
