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
 * Thrown when a query targets a shard this node does not hold. Callers may
 * retry after refreshing their view of shard assignments.
 *
 * @since 1.0
 */
public abstract class ShardAssignmentException extends ShardException {
  private static final long serialVersionUID = -1520776329186545466L;

  protected ShardAssignmentException(final String msg,
                                     final DatasetRef dataset,
                                     final int shard,
                                     final int status_code) {
    super(msg, dataset, shard, status_code);
  }
}
