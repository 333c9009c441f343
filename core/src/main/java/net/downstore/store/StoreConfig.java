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
package net.downstore.store;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.typesafe.config.Config;

import net.downstore.core.InvalidConfigException;

/**
 * Tuning for shards of the store, read from the {@code downstore.store}
 * section of the config.
 *
 * @since 1.0
 */
public final class StoreConfig {
  public static final String PREFIX = "downstore.store";
  public static final String PAGE_SIZE_KEY = PREFIX + ".index-recovery-page-size";
  public static final String SCAN_BATCH_KEY = PREFIX + ".scan-batch-size";
  public static final String RECOVERY_TIMEOUT_KEY = PREFIX + ".index-recovery-timeout";
  public static final String PARALLELISM_KEY = PREFIX + ".partition-list-parallelism";

  private final int index_recovery_page_size;
  private final int scan_batch_size;
  private final Duration index_recovery_timeout;
  private final int partition_list_parallelism;

  private StoreConfig(final Builder builder) {
    if (builder.indexRecoveryPageSize < 1) {
      throw new IllegalArgumentException("Index recovery page size must be "
          + "at least 1: " + builder.indexRecoveryPageSize);
    }
    if (builder.scanBatchSize < 1) {
      throw new IllegalArgumentException("Scan batch size must be at least 1: "
          + builder.scanBatchSize);
    }
    if (builder.indexRecoveryTimeout == null
        || builder.indexRecoveryTimeout.isNegative()
        || builder.indexRecoveryTimeout.isZero()) {
      throw new IllegalArgumentException("Index recovery timeout must be "
          + "positive: " + builder.indexRecoveryTimeout);
    }
    if (builder.partitionListParallelism < 1) {
      throw new IllegalArgumentException("Partition list parallelism must be "
          + "at least 1: " + builder.partitionListParallelism);
    }
    index_recovery_page_size = builder.indexRecoveryPageSize;
    scan_batch_size = builder.scanBatchSize;
    index_recovery_timeout = builder.indexRecoveryTimeout;
    partition_list_parallelism = builder.partitionListParallelism;
  }

  /**
   * Reads the store section of the given config.
   * @param config A non-null config with the reference fallback applied.
   * @return The parsed store config.
   * @throws InvalidConfigException if a value is out of range.
   * @throws com.typesafe.config.ConfigException if a value is missing or of
   * the wrong type.
   */
  public static StoreConfig fromConfig(final Config config) {
    final Builder builder = newBuilder()
        .setIndexRecoveryPageSize(positiveInt(config, PAGE_SIZE_KEY))
        .setScanBatchSize(positiveInt(config, SCAN_BATCH_KEY))
        .setPartitionListParallelism(positiveInt(config, PARALLELISM_KEY));
    final Duration timeout = config.getDuration(RECOVERY_TIMEOUT_KEY);
    if (timeout.isNegative() || timeout.isZero()) {
      throw new InvalidConfigException(config.getValue(RECOVERY_TIMEOUT_KEY),
          "Index recovery timeout must be positive");
    }
    return builder.setIndexRecoveryTimeout(timeout).build();
  }

  private static int positiveInt(final Config config, final String key) {
    final int value = config.getInt(key);
    if (value < 1) {
      throw new InvalidConfigException(config.getValue(key),
          key + " must be at least 1 but was " + value);
    }
    return value;
  }

  /** @return The number of part key records fetched per page on recovery. */
  @JsonProperty
  public int indexRecoveryPageSize() {
    return index_recovery_page_size;
  }

  /** @return The number of partitions read from the column store at once
   * when scanning. */
  @JsonProperty
  public int scanBatchSize() {
    return scan_batch_size;
  }

  /** @return How long blocking index refreshes wait. */
  public Duration indexRecoveryTimeout() {
    return index_recovery_timeout;
  }

  @JsonProperty("indexRecoveryTimeout")
  long indexRecoveryTimeoutMillis() {
    return index_recovery_timeout.toMillis();
  }

  /** @return How many shards of one dataset are recovered at once. */
  @JsonProperty
  public int partitionListParallelism() {
    return partition_list_parallelism;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("indexRecoveryPageSize", index_recovery_page_size)
        .add("scanBatchSize", scan_batch_size)
        .add("indexRecoveryTimeout", index_recovery_timeout)
        .add("partitionListParallelism", partition_list_parallelism)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private int indexRecoveryPageSize = 1000;
    private int scanBatchSize = 64;
    private Duration indexRecoveryTimeout = Duration.ofMinutes(5);
    private int partitionListParallelism = 4;

    public Builder setIndexRecoveryPageSize(final int index_recovery_page_size) {
      indexRecoveryPageSize = index_recovery_page_size;
      return this;
    }

    public Builder setScanBatchSize(final int scan_batch_size) {
      scanBatchSize = scan_batch_size;
      return this;
    }

    public Builder setIndexRecoveryTimeout(final Duration index_recovery_timeout) {
      indexRecoveryTimeout = index_recovery_timeout;
      return this;
    }

    public Builder setPartitionListParallelism(final int partition_list_parallelism) {
      partitionListParallelism = partition_list_parallelism;
      return this;
    }

    public StoreConfig build() {
      return new StoreConfig(this);
    }
  }
}
