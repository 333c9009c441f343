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

import com.google.common.collect.ImmutableList;

/**
 * The chunks of a single partition read from the backing column store for a
 * time range, ordered by chunk start time.
 *
 * @since 1.0
 */
public final class RawPartData {
  private final PartKey part_key;
  private final ImmutableList<RawChunk> chunks;

  public RawPartData(final PartKey part_key, final List<RawChunk> chunks) {
    if (part_key == null) {
      throw new IllegalArgumentException("Part key cannot be null.");
    }
    this.part_key = part_key;
    this.chunks = chunks == null ? ImmutableList.<RawChunk>of()
        : ImmutableList.copyOf(chunks);
  }

  public PartKey partKey() {
    return part_key;
  }

  public List<RawChunk> chunks() {
    return chunks;
  }

  @Override
  public String toString() {
    return "RawPartData(" + part_key + ", chunks=" + chunks.size() + ")";
  }
}
