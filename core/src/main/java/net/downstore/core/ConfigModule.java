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
package net.downstore.core;

import java.io.File;
import java.util.Map;

import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;

import net.downstore.downsample.DownsampleConfig;
import net.downstore.store.StoreConfig;

/**
 * Provides a config object that is loaded from the indicated file or with
 * optional overrides. The {@code reference.conf} shipped with the core module
 * is always used as the fallback so every {@code downstore} key has a default.
 *
 * <p>This class may be extended to load other files by default instead of the
 * default "application" one dictated by the config library by overriding
 * {@link #ConfigModule()}.
 */
public class ConfigModule {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigModule.class);
  private static final ConfigParseOptions DEFAULT_PARSE_OPTIONS =
      ConfigParseOptions.defaults().setAllowMissing(false);

  private final Config config;

  /**
   * Create a new config module with the configuration loaded from the default
   * (application) file as dictated by the config library.
   */
  public ConfigModule() {
    this(ConfigFactory.load(ConfigParseOptions.defaults()));
  }

  /**
   * Create a new config module that provides the given config instance.
   *
   * @param config The config object that will be provided
   */
  protected ConfigModule(final Config config) {
    this.config = config.withFallback(
        ConfigFactory.parseResourcesAnySyntax("reference", DEFAULT_PARSE_OPTIONS))
        .resolve();
    LOG.info("Loaded config from {}", config.origin().description());
  }

  private ConfigModule(final Config config, final Config overrides) {
    this(overrides.withFallback(config));
  }

  /**
   * Create a new config module with the configuration loaded from the default
   * (application) file with the provided configuration values overridden.
   *
   * @param overrides The configuration values that should override the default
   * ones, keyed by their full path.
   * @return A newly instantiated config module
   */
  @Nonnull
  public static ConfigModule defaultWithOverrides(final Map<String, ?> overrides) {
    final Config config_overrides = ConfigFactory.parseMap(overrides, "overrides");
    return new ConfigModule(ConfigFactory.load(ConfigParseOptions.defaults()),
        config_overrides);
  }

  /**
   * Create a new config module with the configuration loaded from the
   * provided file.
   *
   * @param config_file A file object that points to the configuration file
   * @return A newly instantiated config module
   * @throws com.typesafe.config.ConfigException.IO if the file is missing
   */
  @Nonnull
  public static ConfigModule fromFile(final File config_file) {
    return new ConfigModule(
        ConfigFactory.parseFileAnySyntax(config_file, DEFAULT_PARSE_OPTIONS));
  }

  /** @return The loaded config with the reference fallback applied. */
  public Config config() {
    return config;
  }

  /** @return The store tuning read from {@code downstore.store}. */
  public StoreConfig storeConfig() {
    return StoreConfig.fromConfig(config);
  }

  /** @return The downsample settings read from {@code downstore.downsample}. */
  public DownsampleConfig downsampleConfig() {
    return DownsampleConfig.fromConfig(config);
  }
}
