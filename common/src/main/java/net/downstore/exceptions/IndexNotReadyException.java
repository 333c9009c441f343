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
 * Thrown when a shard is queried before its index was ever recovered.
 *
 * @since 1.0
 */
public class IndexNotReadyException extends ShardException {
  private static final long serialVersionUID = 8810645713306420148L;

  public IndexNotReadyException(final DatasetRef dataset, final int shard) {
    super("The index of shard " + shard + " of dataset " + dataset
        + " has not been recovered yet.", dataset, shard, 503);
  }
}
