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
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.google.common.collect.Sets;

/**
 * Static helpers for building and decorating {@link CloseableIterator}s.
 * Every decorator closes its source when it is closed or exhausted.
 *
 * @since 1.0
 */
public final class CloseableIterators {
  private CloseableIterators() {
    // static class
  }

  /** @return An exhausted iterator. */
  public static <T> CloseableIterator<T> empty() {
    return wrap(Collections.<T>emptyIterator(), null);
  }

  /**
   * Wraps a plain iterator holding no resources.
   * @param iterator A non-null iterator.
   * @return The closeable iterator.
   */
  public static <T> CloseableIterator<T> wrap(final Iterator<T> iterator) {
    return wrap(iterator, null);
  }

  /**
   * Wraps an iterator along with the handle to release when done.
   * @param iterator A non-null iterator.
   * @param resource An optional resource to close on exhaustion or close.
   * @return The closeable iterator.
   */
  public static <T> CloseableIterator<T> wrap(final Iterator<T> iterator,
                                              final Closeable resource) {
    if (iterator == null) {
      throw new IllegalArgumentException("Iterator cannot be null.");
    }
    return new AbstractCloseableIterator<T>() {
      @Override
      protected T fetchNext() {
        return iterator.hasNext() ? iterator.next() : endOfData();
      }

      @Override
      protected void release() {
        closeResource(resource);
      }
    };
  }

  /**
   * Stops after at most {@code limit} elements and closes the source then.
   * @param source A non-null source.
   * @param limit The maximum number of elements, zero or more.
   * @return The limited iterator.
   */
  public static <T> CloseableIterator<T> limit(final CloseableIterator<T> source,
                                               final int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("Limit cannot be negative: " + limit);
    }
    return new AbstractCloseableIterator<T>() {
      private int returned;

      @Override
      protected T fetchNext() {
        if (returned >= limit || !source.hasNext()) {
          return endOfData();
        }
        returned++;
        return source.next();
      }

      @Override
      protected void release() {
        source.close();
      }
    };
  }

  /**
   * Lazily maps each element of the source.
   * @param source A non-null source.
   * @param function A non-null function returning non-null values.
   * @return The transformed iterator.
   */
  public static <F, T> CloseableIterator<T> transform(
      final CloseableIterator<F> source,
      final Function<? super F, ? extends T> function) {
    return new AbstractCloseableIterator<T>() {
      @Override
      protected T fetchNext() {
        return source.hasNext() ? function.apply(source.next()) : endOfData();
      }

      @Override
      protected void release() {
        source.close();
      }
    };
  }

  /**
   * Lazily skips elements failing the predicate.
   * @param source A non-null source.
   * @param predicate A non-null predicate.
   * @return The filtered iterator.
   */
  public static <T> CloseableIterator<T> filter(final CloseableIterator<T> source,
                                                final Predicate<? super T> predicate) {
    return new AbstractCloseableIterator<T>() {
      @Override
      protected T fetchNext() {
        while (source.hasNext()) {
          final T next = source.next();
          if (predicate.test(next)) {
            return next;
          }
        }
        return endOfData();
      }

      @Override
      protected void release() {
        source.close();
      }
    };
  }

  /**
   * Lazily drops elements equal to one already returned. Keeps the seen
   * elements in memory so it is meant for bounded, small results.
   * @param source A non-null source.
   * @return The de-duplicated iterator.
   */
  public static <T> CloseableIterator<T> distinct(final CloseableIterator<T> source) {
    final Set<T> seen = Sets.newHashSet();
    return filter(source, seen::add);
  }

  /**
   * Concatenates iterators produced one after another by the supplier, for
   * paging through a backing store. Each page is closed before the next one
   * is requested and the current page is closed on early close.
   * @param pages A supplier returning the next page or null when there are
   * no more pages.
   * @return The concatenated iterator.
   */
  public static <T> CloseableIterator<T> concat(
      final Supplier<CloseableIterator<T>> pages) {
    return new AbstractCloseableIterator<T>() {
      private CloseableIterator<T> current;

      @Override
      protected T fetchNext() {
        while (true) {
          if (current != null && current.hasNext()) {
            return current.next();
          }
          if (current != null) {
            current.close();
            current = null;
          }
          current = pages.get();
          if (current == null) {
            return endOfData();
          }
        }
      }

      @Override
      protected void release() {
        if (current != null) {
          current.close();
          current = null;
        }
      }
    };
  }

  /**
   * Closes the resource, rethrowing IO failures unchecked.
   * @param resource An optional resource.
   * @throws UncheckedIOException if the close failed.
   */
  static void closeResource(final Closeable resource) {
    if (resource == null) {
      return;
    }
    try {
      resource.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to release cursor: " + resource, e);
    }
  }
}
