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

import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Metric;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import net.downstore.data.DatasetRef;

/**
 * Live counters of one shard registered in the shared metric registry. Use
 * {@link #snapshot()} for a consistent, serializable view.
 */
public class ShardStats {
  private final DatasetRef dataset;
  private final int shard;
  private final MetricRegistry registry;

  private final Counter lookups;
  private final Counter partitions_looked_up;
  private final Counter index_recoveries;
  private final Counter recovery_failures;
  private final Counter skipped_records;
  private final Counter query_errors;
  private final Timer recovery_timer;
  private final AtomicLong index_size = new AtomicLong();
  private final Gauge<Long> index_size_gauge;
  private final Set<Metric> owned;

  public ShardStats(final DatasetRef dataset,
                    final int shard,
                    final MetricRegistry registry) {
    this.dataset = dataset;
    this.shard = shard;
    this.registry = registry;
    final Metrics.Tag[] tags = Metrics.shardTags(dataset, shard);
    lookups = install(name("shard.lookups", tags), new Counter());
    partitions_looked_up = install(name("shard.partitions.looked_up", tags),
        new Counter());
    index_recoveries = install(name("shard.index.recoveries", tags), new Counter());
    recovery_failures = install(name("shard.index.recovery_failures", tags),
        new Counter());
    skipped_records = install(name("shard.index.skipped_records", tags),
        new Counter());
    query_errors = install(name("shard.query.errors", tags), new Counter());
    recovery_timer = install(name("shard.index.recovery_time", tags), new Timer());
    final Gauge<Long> gauge = index_size::get;
    index_size_gauge = install(name("shard.index.size", tags), gauge);
    owned = ImmutableSet.<Metric>of(lookups, partitions_looked_up,
        index_recoveries, recovery_failures, skipped_records, query_errors,
        recovery_timer, index_size_gauge);
  }

  /**
   * Registers the metric under the name, replacing whatever an older instance
   * of the same shard left there.
   */
  private <T extends Metric> T install(final String metric_name, final T metric) {
    synchronized (registry) {
      registry.remove(metric_name);
      return registry.register(metric_name, metric);
    }
  }

  public void lookup(final int partitions) {
    lookups.inc();
    partitions_looked_up.inc(partitions);
  }

  public void recovered(final long entries) {
    index_recoveries.inc();
    index_size.set(entries);
  }

  public void recoveryFailed() {
    recovery_failures.inc();
  }

  public void skippedRecord() {
    skipped_records.inc();
  }

  public void queryError() {
    query_errors.inc();
  }

  /** @return A started recovery timer context. */
  public Timer.Context startRecovery() {
    return recovery_timer.time();
  }

  /**
   * Removes the metrics of this shard from the registry. Metrics registered
   * under the same names by a newer instance of the shard are left alone.
   */
  public void unregister() {
    registry.removeMatching((metric_name, metric) -> owned.contains(metric));
  }

  /** @return An immutable point in time copy of the counters. */
  public Snapshot snapshot() {
    return new Snapshot(this);
  }

  /**
   * Immutable copy of the counters of a shard.
   */
  @JsonPropertyOrder({ "dataset", "shard", "indexSize", "lookups",
      "partitionsLookedUp", "indexRecoveries", "recoveryFailures",
      "skippedRecords", "queryErrors" })
  public static final class Snapshot {
    private final String dataset;
    private final int shard;
    private final long index_size;
    private final long lookups;
    private final long partitions_looked_up;
    private final long index_recoveries;
    private final long recovery_failures;
    private final long skipped_records;
    private final long query_errors;

    private Snapshot(final ShardStats stats) {
      dataset = stats.dataset.toString();
      shard = stats.shard;
      index_size = stats.index_size.get();
      lookups = stats.lookups.getCount();
      partitions_looked_up = stats.partitions_looked_up.getCount();
      index_recoveries = stats.index_recoveries.getCount();
      recovery_failures = stats.recovery_failures.getCount();
      skipped_records = stats.skipped_records.getCount();
      query_errors = stats.query_errors.getCount();
    }

    @JsonProperty
    public String dataset() {
      return dataset;
    }

    @JsonProperty
    public int shard() {
      return shard;
    }

    /** @return The number of partitions in the current index. */
    @JsonProperty
    public long indexSize() {
      return index_size;
    }

    @JsonProperty
    public long lookups() {
      return lookups;
    }

    @JsonProperty
    public long partitionsLookedUp() {
      return partitions_looked_up;
    }

    @JsonProperty
    public long indexRecoveries() {
      return index_recoveries;
    }

    @JsonProperty
    public long recoveryFailures() {
      return recovery_failures;
    }

    /** @return Part key records dropped on recovery for an unknown schema. */
    @JsonProperty
    public long skippedRecords() {
      return skipped_records;
    }

    @JsonProperty
    public long queryErrors() {
      return query_errors;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("dataset", dataset)
          .add("shard", shard)
          .add("indexSize", index_size)
          .add("lookups", lookups)
          .add("partitionsLookedUp", partitions_looked_up)
          .add("indexRecoveries", index_recoveries)
          .add("recoveryFailures", recovery_failures)
          .add("skippedRecords", skipped_records)
          .add("queryErrors", query_errors)
          .toString();
    }
  }
}
