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
package net.downstore.query;

/**
 * Describes which partitions of one shard a query wants: all of them, those
 * matching label filters, or an explicit set of part keys.
 *
 * @since 1.0
 */
public abstract class PartitionScanMethod {

  /** The shard the scan is bound to. */
  protected final int shard;

  /**
   * @param shard The non-negative shard number.
   * @throws IllegalArgumentException if the shard was negative.
   */
  protected PartitionScanMethod(final int shard) {
    if (shard < 0) {
      throw new IllegalArgumentException("Shard cannot be negative: " + shard);
    }
    this.shard = shard;
  }

  /** @return The shard this scan targets. */
  public int shard() {
    return shard;
  }
}
