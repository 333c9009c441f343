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
package net.downstore.storage;

import com.stumbleupon.async.Deferred;

import net.downstore.data.DatasetRef;
import net.downstore.data.Schemas;

/**
 * The metadata store persisting dataset and schema definitions.
 *
 * @since 1.0
 */
public interface MetaStore {

  /**
   * Resolves the schemas a dataset's partitions may use.
   * @param dataset A non-null dataset.
   * @return A deferred resolving to the schemas or an exception, e.g. an
   * {@link IllegalArgumentException} if the dataset is unknown or a
   * {@link net.downstore.exceptions.StoreUnavailableException}.
   */
  public Deferred<Schemas> readSchemas(final DatasetRef dataset);
}
