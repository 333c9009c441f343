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

/**
 * Thrown by read-only stores for every ingestion or mutation call.
 *
 * @since 1.0
 */
public class ReadOnlyStoreException extends UnsupportedOperationException {
  private static final long serialVersionUID = -7707516125938744906L;

  /**
   * @param operation The name of the refused operation.
   */
  public ReadOnlyStoreException(final String operation) {
    super(operation + " is unsupported for read-only store");
  }
}
