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
package net.downstore.stats;

import static net.downstore.stats.Metrics.name;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;

/**
 * Store wide counters of partitions and chunks handed to the query layer.
 */
public class ScanStats {
  private final Counter partitions_scanned;
  private final Counter chunks_read;

  public ScanStats(final MetricRegistry registry) {
    partitions_scanned = registry.counter(name("store.partitions.scanned"));
    chunks_read = registry.counter(name("store.chunks.read"));
  }

  public void partitionScanned(final int chunks) {
    partitions_scanned.inc();
    chunks_read.inc(chunks);
  }

  public long partitionsScanned() {
    return partitions_scanned.getCount();
  }

  public long chunksRead() {
    return chunks_read.getCount();
  }
}
