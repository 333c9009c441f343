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
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/**
 * The set of schemas a dataset's series may be stored under, keyed by the
 * schema ID recorded with every part key.
 *
 * @since 1.0
 */
public final class Schemas {
  private final ImmutableMap<Integer, Schema> schemas;

  private Schemas(final ImmutableMap<Integer, Schema> schemas) {
    this.schemas = schemas;
  }

  /**
   * @param schemas A non-null and non-empty collection of schemas with
   * unique IDs.
   * @return The schemas instance.
   * @throws IllegalArgumentException if the collection was null, empty or
   * contained duplicate IDs.
   */
  public static Schemas of(final Collection<Schema> schemas) {
    if (schemas == null || schemas.isEmpty()) {
      throw new IllegalArgumentException("At least one schema is required.");
    }
    final ImmutableMap.Builder<Integer, Schema> builder = ImmutableMap.builder();
    for (final Schema schema : schemas) {
      builder.put(schema.id(), schema);
    }
    return new Schemas(builder.buildOrThrow());
  }

  /**
   * @param schemas One or more schemas with unique IDs.
   * @return The schemas instance.
   */
  public static Schemas of(final Schema... schemas) {
    return of(Arrays.asList(schemas));
  }

  /**
   * @param id A schema ID.
   * @return The schema if known.
   */
  public Optional<Schema> schema(final int id) {
    return Optional.ofNullable(schemas.get(id));
  }

  /** @return True if the ID is one of these schemas. */
  public boolean contains(final int id) {
    return schemas.containsKey(id);
  }

  /** @return The schemas keyed by ID. */
  public Map<Integer, Schema> asMap() {
    return schemas;
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof Schemas && schemas.equals(((Schemas) o).schemas);
  }

  @Override
  public int hashCode() {
    return schemas.hashCode();
  }

  @Override
  public String toString() {
    return "Schemas" + schemas.values();
  }
}
