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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import net.downstore.core.InvalidConfigException;
import net.downstore.data.DatasetRef;

public class TestDownsampleConfig {

  private static Config config(final ImmutableMap<String, Object> overrides) {
    return ConfigFactory.parseMap(overrides)
        .withFallback(ConfigFactory.defaultReference())
        .resolve();
  }

  @Test
  public void defaults() throws Exception {
    final DownsampleConfig config = DownsampleConfig.fromConfig(
        config(ImmutableMap.<String, Object>of()));
    assertFalse(config.enabled());
    assertTrue(config.resolutions().isEmpty());
    assertTrue(config.downsampleDatasetRefs(new DatasetRef("metrics")).isEmpty());
  }

  @Test
  public void fromConfig() throws Exception {
    final DownsampleConfig config = DownsampleConfig.fromConfig(config(
        ImmutableMap.<String, Object>of(
            DownsampleConfig.ENABLED_KEY, true,
            DownsampleConfig.RESOLUTIONS_KEY, ImmutableList.of("5m", "1h"),
            DownsampleConfig.TTLS_KEY, ImmutableList.of("30d", "365d"))));
    assertTrue(config.enabled());
    assertEquals(ImmutableList.of(Duration.ofMinutes(5), Duration.ofHours(1)),
        config.resolutions());
    assertEquals(ImmutableList.of(Duration.ofDays(30), Duration.ofDays(365)),
        config.ttls());
    assertEquals(ImmutableMap.of(
        Duration.ofMinutes(5), new DatasetRef("metrics_ds_5"),
        Duration.ofHours(1), new DatasetRef("metrics_ds_60")),
        config.downsampleDatasetRefs(new DatasetRef("metrics")));
  }

  @Test
  public void fromConfigInvalid() throws Exception {
    // enabled without resolutions
    try {
      DownsampleConfig.fromConfig(config(ImmutableMap.<String, Object>of(
          DownsampleConfig.ENABLED_KEY, true)));
      fail("Expected InvalidConfigException");
    } catch (InvalidConfigException e) { }

    // TTL count mismatch
    try {
      DownsampleConfig.fromConfig(config(ImmutableMap.<String, Object>of(
          DownsampleConfig.ENABLED_KEY, true,
          DownsampleConfig.RESOLUTIONS_KEY, ImmutableList.of("5m", "1h"),
          DownsampleConfig.TTLS_KEY, ImmutableList.of("30d"))));
      fail("Expected InvalidConfigException");
    } catch (InvalidConfigException e) { }

    // sub-minute
    try {
      DownsampleConfig.fromConfig(config(ImmutableMap.<String, Object>of(
          DownsampleConfig.ENABLED_KEY, true,
          DownsampleConfig.RESOLUTIONS_KEY, ImmutableList.of("30s"))));
      fail("Expected InvalidConfigException");
    } catch (InvalidConfigException e) {
      assertTrue(e.getMessage().contains("whole number of minutes"));
    }
  }

  @Test
  public void ctor() throws Exception {
    assertFalse(DownsampleConfig.DISABLED.enabled());
    try {
      new DownsampleConfig(true, ImmutableList.<Duration>of(),
          ImmutableList.<Duration>of());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new DownsampleConfig(true, null, ImmutableList.<Duration>of());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new DownsampleConfig(true, ImmutableList.of(Duration.ofMinutes(5)),
          ImmutableList.of(Duration.ofDays(1), Duration.ofDays(2)));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
