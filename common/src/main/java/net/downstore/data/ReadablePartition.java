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

import java.util.List;
import java.util.Map;

/**
 * A partition (time series) read for a query: its identity, the schema its
 * chunks are encoded with and the chunks falling inside the queried range.
 *
 * @since 1.0
 */
public interface ReadablePartition {

  /** @return The shard the partition was read from. */
  public int shard();

  /** @return The non-null part key. */
  public PartKey partKey();

  /** @return The non-null labels of the series. */
  public Map<String, String> labels();

  /** @return The schema the chunks are encoded with. */
  public Schema schema();

  /** @return The chunks within the queried range ordered by start time. May
   * be empty if the series had no data in the range. */
  public List<RawChunk> chunks();

  /** @return The total number of rows across the returned chunks. */
  public default long numRows() {
    long rows = 0;
    for (final RawChunk chunk : chunks()) {
      rows += chunk.numRows();
    }
    return rows;
  }
}
