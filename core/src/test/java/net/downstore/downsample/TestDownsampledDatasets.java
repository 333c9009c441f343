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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import net.downstore.data.DatasetRef;

public class TestDownsampledDatasets {
  private static final DatasetRef RAW = new DatasetRef("metrics");

  @Test
  public void downsampleDatasetRefs() throws Exception {
    final Map<Duration, DatasetRef> refs = DownsampledDatasets.downsampleDatasetRefs(
        RAW, ImmutableList.of(Duration.ofMinutes(60), Duration.ofMinutes(5)));
    assertEquals(2, refs.size());
    assertEquals(new DatasetRef("metrics_ds_5"), refs.get(Duration.ofMinutes(5)));
    assertEquals(new DatasetRef("metrics_ds_60"), refs.get(Duration.ofMinutes(60)));
    // sorted by resolution
    assertEquals(ImmutableList.of(Duration.ofMinutes(5), Duration.ofMinutes(60)),
        ImmutableList.copyOf(refs.keySet()));

    // stable
    assertEquals(refs, DownsampledDatasets.downsampleDatasetRefs(
        RAW, ImmutableList.of(Duration.ofMinutes(5), Duration.ofMinutes(60))));

    assertTrue(DownsampledDatasets.downsampleDatasetRefs(
        RAW, ImmutableList.<Duration>of()).isEmpty());
  }

  @Test
  public void keepsTheDatabase() throws Exception {
    assertEquals(new DatasetRef("metrics_ds_1440", "prod"),
        DownsampledDatasets.downsampleDatasetRef(new DatasetRef("metrics", "prod"),
            Duration.ofDays(1)));
    assertEquals(new DatasetRef("metrics_ds_1"),
        DownsampledDatasets.downsampleDatasetRef(RAW, Duration.ofSeconds(60)));

    // same printed name, different identity than a flat name
    final DatasetRef ref = DownsampledDatasets.downsampleDatasetRef(
        new DatasetRef("metrics", "prod"), Duration.ofMinutes(5));
    assertEquals("prod.metrics_ds_5", ref.toString());
    assertNotEquals(new DatasetRef("prod.metrics_ds_5"), ref);
  }

  @Test
  public void invalidResolutions() throws Exception {
    try {
      DownsampledDatasets.downsampleDatasetRef(RAW, Duration.ofSeconds(90));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DownsampledDatasets.downsampleDatasetRef(RAW, Duration.ofSeconds(30));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DownsampledDatasets.downsampleDatasetRef(RAW,
          Duration.ofMinutes(5).plusMillis(1));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DownsampledDatasets.downsampleDatasetRef(RAW, Duration.ZERO);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DownsampledDatasets.downsampleDatasetRef(RAW, Duration.ofMinutes(-5));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DownsampledDatasets.downsampleDatasetRef(RAW, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DownsampledDatasets.downsampleDatasetRefs(null,
          ImmutableList.of(Duration.ofMinutes(5)));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DownsampledDatasets.downsampleDatasetRefs(RAW, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DownsampledDatasets.downsampleDatasetRefs(RAW,
          ImmutableList.of(Duration.ofMinutes(5), Duration.ofSeconds(300)));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().startsWith("Duplicate resolution"));
    }
  }
}
