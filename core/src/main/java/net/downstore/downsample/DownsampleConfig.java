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
package net.downstore.downsample;

import java.time.Duration;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.typesafe.config.Config;

import net.downstore.core.InvalidConfigException;
import net.downstore.data.DatasetRef;

/**
 * Downsample settings of a raw dataset, read from the
 * {@code downstore.downsample} section of the config. Resolutions and TTLs
 * pair up by position.
 *
 * @since 1.0
 */
public final class DownsampleConfig {
  public static final String PREFIX = "downstore.downsample";
  public static final String ENABLED_KEY = PREFIX + ".enabled";
  public static final String RESOLUTIONS_KEY = PREFIX + ".resolutions";
  public static final String TTLS_KEY = PREFIX + ".ttls";

  /** A config with downsampling turned off. */
  public static final DownsampleConfig DISABLED =
      new DownsampleConfig(false, ImmutableList.<Duration>of(),
          ImmutableList.<Duration>of());

  private final boolean enabled;
  private final ImmutableList<Duration> resolutions;
  private final ImmutableList<Duration> ttls;

  /**
   * Default ctor.
   * @param enabled Whether or not downsampled datasets are in use.
   * @param resolutions The resolutions, may be empty when disabled.
   * @param ttls The retention of each resolution, same length as the
   * resolutions when not empty.
   */
  public DownsampleConfig(final boolean enabled,
                          final List<Duration> resolutions,
                          final List<Duration> ttls) {
    if (resolutions == null || ttls == null) {
      throw new IllegalArgumentException("Resolutions and TTLs cannot be null.");
    }
    if (!ttls.isEmpty() && ttls.size() != resolutions.size()) {
      throw new IllegalArgumentException("Got " + ttls.size() + " TTLs for "
          + resolutions.size() + " resolutions.");
    }
    if (enabled && resolutions.isEmpty()) {
      throw new IllegalArgumentException("Downsampling is enabled but no "
          + "resolutions were given.");
    }
    this.enabled = enabled;
    this.resolutions = ImmutableList.copyOf(resolutions);
    this.ttls = ImmutableList.copyOf(ttls);
  }

  /**
   * Reads the downsample section of the given config.
   * @param config A non-null config with the reference fallback applied.
   * @return The parsed config.
   * @throws InvalidConfigException if the values are inconsistent.
   */
  public static DownsampleConfig fromConfig(final Config config) {
    final boolean enabled = config.getBoolean(ENABLED_KEY);
    final List<Duration> resolutions = config.getDurationList(RESOLUTIONS_KEY);
    final List<Duration> ttls = config.getDurationList(TTLS_KEY);
    if (enabled && resolutions.isEmpty()) {
      throw new InvalidConfigException(config.getValue(RESOLUTIONS_KEY),
          "Downsampling is enabled but no resolutions were given");
    }
    if (!ttls.isEmpty() && ttls.size() != resolutions.size()) {
      throw new InvalidConfigException(config.getValue(TTLS_KEY),
          "Expected " + resolutions.size() + " TTLs but got " + ttls.size());
    }
    try {
      // validates the resolutions without binding to a real dataset
      DownsampledDatasets.downsampleDatasetRefs(new DatasetRef("validate"),
          resolutions);
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigException(config.getValue(RESOLUTIONS_KEY),
          e.getMessage());
    }
    return new DownsampleConfig(enabled, resolutions, ttls);
  }

  public boolean enabled() {
    return enabled;
  }

  public List<Duration> resolutions() {
    return resolutions;
  }

  public List<Duration> ttls() {
    return ttls;
  }

  /**
   * The downsampled datasets of the given raw dataset for the configured
   * resolutions.
   * @param raw A non-null raw dataset.
   * @return A map of resolution to dataset, empty when disabled.
   */
  public ImmutableSortedMap<Duration, DatasetRef> downsampleDatasetRefs(
      final DatasetRef raw) {
    if (!enabled) {
      return ImmutableSortedMap.of();
    }
    return DownsampledDatasets.downsampleDatasetRefs(raw, resolutions);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("enabled", enabled)
        .add("resolutions", resolutions)
        .add("ttls", ttls)
        .toString();
  }
}
