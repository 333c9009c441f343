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
package net.downstore.data;

import java.util.Arrays;
import java.util.Comparator;

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.UnsignedBytes;

/**
 * An opaque key uniquely identifying a time series (partition) within a
 * shard. Keys are compared byte-wise as unsigned values, the same order the
 * backing column store keeps them in.
 * <p>
 * The bytes are copied on the way in and on the way out so a key can never
 * change once it has been indexed.
 *
 * @since 1.0
 */
public final class PartKey implements Comparable<PartKey> {
  private static final Comparator<byte[]> COMPARATOR =
      UnsignedBytes.lexicographicalComparator();

  private final byte[] bytes;
  private final int hash;

  private PartKey(final byte[] bytes) {
    this.bytes = bytes;
    hash = Arrays.hashCode(bytes);
  }

  /**
   * Creates a key from a copy of the given bytes.
   * @param bytes A non-null and non-empty array.
   * @return The key.
   * @throws IllegalArgumentException if the bytes were null or empty.
   */
  public static PartKey of(final byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new IllegalArgumentException("Part key bytes cannot be null or empty.");
    }
    return new PartKey(Arrays.copyOf(bytes, bytes.length));
  }

  /** @return A copy of the key bytes. */
  public byte[] bytes() {
    return Arrays.copyOf(bytes, bytes.length);
  }

  /** @return The length of the key in bytes. */
  public int length() {
    return bytes.length;
  }

  @Override
  public int compareTo(final PartKey other) {
    return COMPARATOR.compare(bytes, other.bytes);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PartKey)) {
      return false;
    }
    final PartKey other = (PartKey) o;
    return hash == other.hash && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return "PartKey(0x" + BaseEncoding.base16().encode(bytes) + ")";
  }
}
