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
package net.downstore.utils;

import java.io.Closeable;
import java.util.Iterator;

/**
 * A pull based, finite and non-restartable sequence that may hold a cursor
 * or other handle against a backing store. Implementations must release
 * their resources when the sequence is exhausted, when {@link #next()}
 * throws, or when the consumer calls {@link #close()} early, whichever comes
 * first. {@link #close()} must be idempotent.
 *
 * @param <T> The type of element produced.
 * @since 1.0
 */
public interface CloseableIterator<T> extends Iterator<T>, Closeable {

  /**
   * Releases any resources held. Never throws a checked exception; failures
   * releasing a cursor are reported as unchecked exceptions.
   */
  @Override
  public void close();
}
