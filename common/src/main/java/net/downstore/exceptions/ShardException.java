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
package net.downstore.exceptions;

import net.downstore.data.DatasetRef;

/**
 * High level exception for failures scoped to one shard of a dataset. These
 * bubble up to the caller untouched; the store never retries them.
 *
 * @since 1.0
 */
public class ShardException extends RuntimeException {
  private static final long serialVersionUID = -3158322541960125021L;

  /** The dataset the failure pertains to. */
  protected final DatasetRef dataset;

  /** The shard the failure pertains to. */
  protected final int shard;

  /** A status code associated with the exception, e.g. an HTTP code. */
  protected final int status_code;

  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   * @param dataset The dataset.
   * @param shard The shard number.
   * @param status_code A status code reflecting the error state.
   */
  public ShardException(final String msg,
                        final DatasetRef dataset,
                        final int shard,
                        final int status_code) {
    this(msg, dataset, shard, status_code, null);
  }

  /**
   * Ctor with a cause.
   * @param msg A non-null message to be given.
   * @param dataset The dataset.
   * @param shard The shard number.
   * @param status_code A status code reflecting the error state.
   * @param cause An optional cause.
   */
  public ShardException(final String msg,
                        final DatasetRef dataset,
                        final int shard,
                        final int status_code,
                        final Throwable cause) {
    super(msg, cause);
    this.dataset = dataset;
    this.shard = shard;
    this.status_code = status_code;
  }

  /** @return The dataset the failure pertains to. */
  public DatasetRef getDataset() {
    return dataset;
  }

  /** @return The shard the failure pertains to. */
  public int getShard() {
    return shard;
  }

  /** @return A status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }
}
