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

import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import net.downstore.core.InvalidConfigException;

/**
 * Picks the {@link ColumnStoreDescriptor} the configuration asks for among
 * the descriptors registered as services.
 */
public class ColumnStoreModule {
  private static final Logger LOG = LoggerFactory.getLogger(ColumnStoreModule.class);

  public static final String ADAPTER_KEY = "downstore.columnstore.adapter";

  /**
   * Get the {@link ColumnStoreDescriptor} that the configuration specifies.
   *
   * @param config The config holding {@value #ADAPTER_KEY}.
   * @param descriptors The candidate descriptors.
   * @return The descriptor whose canonical class name matches.
   * @throws InvalidConfigException if no descriptor matches.
   */
  public ColumnStoreDescriptor provideDescriptor(
      final Config config,
      final Iterable<ColumnStoreDescriptor> descriptors) {
    final String adapter_type = config.getString(ADAPTER_KEY);

    for (final ColumnStoreDescriptor descriptor : descriptors) {
      final String plugin_name = descriptor.getClass().getCanonicalName();

      if (plugin_name.equals(adapter_type)) {
        LOG.info("Using column store adapter {}", plugin_name);
        return descriptor;
      }
    }

    throw new InvalidConfigException(config.getValue(ADAPTER_KEY),
        "Found no column store adapter that matches '" + adapter_type + "'");
  }

  /**
   * Provides all {@link ColumnStoreDescriptor}s that are registered as
   * services and thus are found by the {@link java.util.ServiceLoader}.
   */
  public Iterable<ColumnStoreDescriptor> provideDescriptors() {
    return ServiceLoader.load(ColumnStoreDescriptor.class);
  }

  /**
   * Shortcut for {@link #provideDescriptor(Config, Iterable)} over the
   * registered services.
   */
  public ColumnStoreDescriptor provideDescriptor(final Config config) {
    return provideDescriptor(config, provideDescriptors());
  }
}
