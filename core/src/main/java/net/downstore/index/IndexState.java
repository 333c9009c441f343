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
package net.downstore.index;

/**
 * Lifecycle of a shard's part key index.
 */
public enum IndexState {
  /** Never recovered, queries fail. */
  UNINITIALIZED,

  /** A rebuild is running. Queries read the last ready snapshot if any. */
  INDEXING,

  /** A complete snapshot is in place. */
  READY
}
