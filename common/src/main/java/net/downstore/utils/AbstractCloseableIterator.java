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

import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.collect.AbstractIterator;

/**
 * Base for closeable iterators built on Guava's {@link AbstractIterator}.
 * Subclasses implement {@link #fetchNext()} and {@link #release()}; the
 * release hook runs exactly once, on exhaustion, on an exception from
 * {@link #fetchNext()} or on {@link #close()}.
 *
 * @param <T> The type of element produced.
 * @since 1.0
 */
public abstract class AbstractCloseableIterator<T> extends AbstractIterator<T>
    implements CloseableIterator<T> {

  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * @return The next element or the result of {@link #endOfData()} when
   * there is nothing left.
   */
  protected abstract T fetchNext();

  /** Releases the resources held by this iterator. Called once. */
  protected abstract void release();

  @Override
  protected final T computeNext() {
    if (closed.get()) {
      return endOfData();
    }
    final T next;
    try {
      next = fetchNext();
    } catch (RuntimeException e) {
      close();
      throw e;
    }
    if (next == null) {
      // fetchNext() called endOfData()
      close();
      return null;
    }
    return next;
  }

  @Override
  public final void close() {
    if (closed.compareAndSet(false, true)) {
      release();
    }
  }

  /** @return True once the iterator released its resources. */
  public boolean isClosed() {
    return closed.get();
  }
}
