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
import java.util.Collection;
import java.util.SortedMap;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

import net.downstore.data.DatasetRef;

/**
 * Derives the names of the downsampled datasets of a raw dataset. The names
 * are persisted and compared by other components so the rule must never
 * change: {@code <raw dataset>_ds_<resolution in minutes>}, keeping the
 * database of the raw dataset.
 *
 * @since 1.0
 */
public final class DownsampledDatasets {
  /** Separator between the raw dataset name and the resolution. */
  public static final String SEPARATOR = "_ds_";

  private DownsampledDatasets() {
    // static class
  }

  /**
   * Maps each resolution to the dataset holding data downsampled to it.
   * @param raw A non-null raw dataset.
   * @param resolutions A non-null collection of distinct, positive
   * resolutions that are whole minutes. May be empty.
   * @return A map sorted by resolution.
   * @throws IllegalArgumentException if the dataset or collection is null or
   * a resolution is invalid or repeated.
   */
  public static ImmutableSortedMap<Duration, DatasetRef> downsampleDatasetRefs(
      final DatasetRef raw,
      final Collection<Duration> resolutions) {
    if (raw == null) {
      throw new IllegalArgumentException("Raw dataset cannot be null.");
    }
    if (resolutions == null) {
      throw new IllegalArgumentException("Resolutions cannot be null.");
    }
    final SortedMap<Duration, DatasetRef> refs = Maps.newTreeMap();
    for (final Duration resolution : resolutions) {
      if (refs.put(resolution, downsampleDatasetRef(raw, resolution)) != null) {
        throw new IllegalArgumentException("Duplicate resolution: " + resolution);
      }
    }
    return ImmutableSortedMap.copyOfSorted(refs);
  }

  /**
   * The dataset holding data of the raw dataset downsampled to one
   * resolution. The suffix goes on the dataset name and the raw database
   * carries over as the qualifier, so {@code prod.metrics} at 5 minutes
   * becomes {@code new DatasetRef("metrics_ds_5", "prod")}. It prints as
   * {@code prod.metrics_ds_5} but does not equal a ref whose dataset name is
   * the whole string {@code "prod.metrics_ds_5"} with no database.
   * @param raw A non-null raw dataset.
   * @param resolution A positive resolution that is a whole number of minutes.
   * @return The downsampled dataset.
   * @throws IllegalArgumentException if the resolution is invalid.
   */
  public static DatasetRef downsampleDatasetRef(final DatasetRef raw,
                                                final Duration resolution) {
    if (resolution == null) {
      throw new IllegalArgumentException("Resolution cannot be null.");
    }
    if (resolution.isNegative() || resolution.isZero()) {
      throw new IllegalArgumentException("Resolution must be positive: "
          + resolution);
    }
    if (resolution.getNano() != 0 || resolution.getSeconds() % 60 != 0) {
      throw new IllegalArgumentException("Resolution must be a whole number "
          + "of minutes: " + resolution);
    }
    return new DatasetRef(raw.dataset() + SEPARATOR + resolution.toMinutes(),
        raw.database().orElse(null));
  }
}
