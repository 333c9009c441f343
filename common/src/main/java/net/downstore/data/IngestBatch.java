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
 * A batch of encoded records consumed from an ingestion stream at a given
 * offset. Only writable stores accept these.
 *
 * @since 1.0
 */
public final class IngestBatch {
  private final long offset;
  private final ImmutableList<byte[]> records;

  public IngestBatch(final long offset, final List<byte[]> records) {
    this.offset = offset;
    this.records = records == null ? ImmutableList.<byte[]>of()
        : ImmutableList.copyOf(records);
  }

  /** @return The stream offset of the batch. */
  public long offset() {
    return offset;
  }

  public List<byte[]> records() {
    return records;
  }
}
