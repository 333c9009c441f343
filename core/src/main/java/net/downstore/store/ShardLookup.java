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

import java.util.Optional;

import net.downstore.data.DatasetRef;
import net.downstore.exceptions.ShardAssignmentException;
import net.downstore.exceptions.ShardNotAssignedException;
import net.downstore.exceptions.ShardNotSetUpException;
import net.downstore.index.DownsampledShard;

/**
 * The outcome of resolving a dataset and shard number in the registry. Tells
 * a shard that was never set up on this node apart from one that was removed,
 * usually because it was reassigned to another node.
 *
 * @since 1.0
 */
public final class ShardLookup {

  /** How the lookup resolved. */
  public enum Status {
    FOUND,
    NOT_SET_UP,
    REASSIGNED
  }

  private final Status status;
  private final DatasetRef dataset;
  private final int shard_num;
  private final DownsampledShard shard;

  private ShardLookup(final Status status,
                      final DatasetRef dataset,
                      final int shard_num,
                      final DownsampledShard shard) {
    this.status = status;
    this.dataset = dataset;
    this.shard_num = shard_num;
    this.shard = shard;
  }

  static ShardLookup found(final DownsampledShard shard) {
    return new ShardLookup(Status.FOUND, shard.dataset(), shard.shardNum(), shard);
  }

  static ShardLookup notSetUp(final DatasetRef dataset, final int shard_num) {
    return new ShardLookup(Status.NOT_SET_UP, dataset, shard_num, null);
  }

  static ShardLookup reassigned(final DatasetRef dataset, final int shard_num) {
    return new ShardLookup(Status.REASSIGNED, dataset, shard_num, null);
  }

  public Status status() {
    return status;
  }

  public DatasetRef dataset() {
    return dataset;
  }

  public int shardNum() {
    return shard_num;
  }

  /** @return The shard if found. */
  public Optional<DownsampledShard> shard() {
    return Optional.ofNullable(shard);
  }

  /**
   * @return The shard.
   * @throws ShardNotAssignedException if the shard was removed from this node.
   * @throws ShardNotSetUpException if the shard was never set up here.
   */
  public DownsampledShard getOrThrow() throws ShardAssignmentException {
    switch (status) {
    case FOUND:
      return shard;
    case REASSIGNED:
      throw new ShardNotAssignedException(dataset, shard_num);
    default:
      throw new ShardNotSetUpException(dataset, shard_num);
    }
  }

  @Override
  public String toString() {
    return "ShardLookup(" + dataset + ", " + shard_num + ", " + status + ")";
  }
}
