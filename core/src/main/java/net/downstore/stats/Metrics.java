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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;

import net.downstore.data.DatasetRef;

/**
 * Helpers for naming metrics in the shared {@link com.codahale.metrics.MetricRegistry}.
 * Names have the form {@code metric:key=value,key=value}.
 */
public final class Metrics {
  private static final Joiner TAG_JOINER = Joiner.on(",");

  /**
   * Create a new name for the metrics library with the given metric and tags.
   */
  public static String name(final String metric, final Tag... tags) {
    final StringBuilder sb = new StringBuilder()
        .append(checkNotNull(metric));

    if (tags.length > 0) {
      sb.append(":");
      TAG_JOINER.appendTo(sb, tags);
    }

    return sb.toString();
  }

  /**
   * Create a new tag with the given tag key and tag value. Only meant for use
   * with the name method above.
   */
  public static Tag tag(final String key, final String value) {
    return new Tag(key, value);
  }

  /**
   * The tags identifying a single shard of a dataset.
   */
  public static Tag[] shardTags(final DatasetRef dataset, final int shard) {
    return new Tag[] {
        tag("dataset", dataset.toString()),
        tag("shard", Integer.toString(shard)) };
  }

  /**
   * Describes tags for use with the name method above.
   */
  public static class Tag {
    public final String key;
    public final String value;

    public Tag(final String key, final String value) {
      this.key = checkNotNull(key);
      this.value = checkNotNull(value);
    }

    @Override
    public String toString() {
      return key + "=" + value;
    }
  }

  private Metrics() {}
}
