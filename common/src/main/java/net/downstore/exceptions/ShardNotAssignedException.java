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
 * The shard used to live on this node but was removed, most likely because
 * it was reassigned to another node. Seeing this for long means the caller's
 * view of shard assignments is stale.
 *
 * @since 1.0
 */
public class ShardNotAssignedException extends ShardAssignmentException {
  private static final long serialVersionUID = -6310447101385392230L;

  public ShardNotAssignedException(final DatasetRef dataset, final int shard) {
    super("Shard " + shard + " of dataset " + dataset + " is not assigned to "
        + "this node. Was it recently reassigned to another node? Prolonged "
        + "occurrence indicates an issue.", dataset, shard, 503);
  }
}
