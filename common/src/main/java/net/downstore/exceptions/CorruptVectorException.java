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
 * Raised by chunk readers when an encoded vector fails validation.
 *
 * @since 1.0
 */
public class CorruptVectorException extends RuntimeException {
  private static final long serialVersionUID = -1803092455740128417L;

  /** The address or offset of the corrupt vector. */
  private final long pointer;

  public CorruptVectorException(final String msg, final long pointer) {
    super(msg);
    this.pointer = pointer;
  }

  /** @return The address or offset of the corrupt vector. */
  public long getPointer() {
    return pointer;
  }
}
