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
package net.downstore.storage;

import com.codahale.metrics.MetricRegistry;
import com.typesafe.config.Config;

/**
 * Hands out one shared {@link MemoryColumnStore} as both the column and the
 * meta store.
 */
public class MemoryColumnStoreDescriptor extends ColumnStoreDescriptor {
  private final MemoryColumnStore store = new MemoryColumnStore();

  @Override
  public ColumnStore createColumnStore(final Config config,
                                       final MetricRegistry metrics) {
    return store;
  }

  @Override
  public MetaStore createMetaStore(final Config config) {
    return store;
  }
}
