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

import javax.annotation.Nonnull;

import com.codahale.metrics.MetricRegistry;
import com.typesafe.config.Config;

/**
 * Plugin entry point for backing store implementations. Descriptors are found
 * through the {@link java.util.ServiceLoader} and picked by their canonical
 * class name in {@code downstore.columnstore.adapter}.
 */
public abstract class ColumnStoreDescriptor {

  /**
   * @param config The full config.
   * @param metrics The registry to register store metrics in.
   * @return A non-null column store ready to use.
   */
  @Nonnull
  public abstract ColumnStore createColumnStore(Config config,
                                                MetricRegistry metrics);

  /**
   * @param config The full config.
   * @return A non-null meta store, usually backed by the same cluster.
   */
  @Nonnull
  public abstract MetaStore createMetaStore(Config config);
}
