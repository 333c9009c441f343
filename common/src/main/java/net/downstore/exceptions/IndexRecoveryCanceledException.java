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
 * Reported when an index rebuild is canceled, e.g. on shutdown or when the
 * shard is removed. The shard keeps the index it had before the rebuild.
 *
 * @since 1.0
 */
public class IndexRecoveryCanceledException extends ShardException {
  private static final long serialVersionUID = -4046224811563520971L;

  public IndexRecoveryCanceledException(final DatasetRef dataset,
                                        final int shard,
                                        final String reason) {
    super("Index recovery of shard " + shard + " of dataset " + dataset
        + " was canceled: " + reason, dataset, shard, 503);
  }
}
