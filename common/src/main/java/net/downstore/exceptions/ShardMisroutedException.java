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
 * A lookup result was handed to a shard other than the one that produced it.
 *
 * @since 1.0
 */
public class ShardMisroutedException extends ShardException {
  private static final long serialVersionUID = 6091526719930853718L;

  /**
   * @param dataset The dataset.
   * @param shard The shard the result was handed to.
   * @param lookup_shard The shard recorded in the result.
   */
  public ShardMisroutedException(final DatasetRef dataset,
                                 final int shard,
                                 final int lookup_shard) {
    super("Lookup result for shard " + lookup_shard + " of dataset " + dataset
        + " was routed to shard " + shard, dataset, shard, 400);
  }
}
