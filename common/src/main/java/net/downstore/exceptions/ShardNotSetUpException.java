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
 * The shard was never set up on this node, usually a bug in the caller.
 *
 * @since 1.0
 */
public class ShardNotSetUpException extends ShardAssignmentException {
  private static final long serialVersionUID = 2187432981450716640L;

  public ShardNotSetUpException(final DatasetRef dataset, final int shard) {
    super("dataset=" + dataset + " shard=" + shard + " have not been set up",
        dataset, shard, 404);
  }
}
