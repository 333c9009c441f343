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

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.roaringbitmap.RoaringBitmap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.downstore.data.PartKey;
import net.downstore.data.PartKeyRecord;
import net.downstore.data.TermInfo;
import net.downstore.query.filter.LabelFilter;

/**
 * An immutable inverted index over the part keys of one shard. Each part key
 * record is a document with a dense id. Label values map to bitmaps of the
 * documents carrying them. Snapshots are built off to the side by a
 * {@link Builder} and never change once published.
 */
public final class IndexSnapshot {
  /** Frequency descending, then value ascending. */
  static final Comparator<TermInfo> TERM_ORDER =
      Comparator.comparingInt(TermInfo::frequency).reversed()
          .thenComparing(TermInfo::term);

  private final ImmutableList<PartKeyRecord> docs;
  private final ImmutableMap<String, ImmutableMap<String, RoaringBitmap>> postings;
  private final ImmutableMap<PartKey, Integer> doc_ids;
  private final ImmutableSortedSet<String> label_names;

  private IndexSnapshot(final Builder builder) {
    docs = ImmutableList.copyOf(builder.records.values());
    final Map<String, Map<String, RoaringBitmap>> postings = Maps.newHashMap();
    final ImmutableMap.Builder<PartKey, Integer> doc_ids = ImmutableMap.builder();
    for (int doc = 0; doc < docs.size(); doc++) {
      final PartKeyRecord record = docs.get(doc);
      doc_ids.put(record.partKey(), doc);
      for (final Entry<String, String> label : record.labels().entrySet()) {
        postings.computeIfAbsent(label.getKey(), k -> Maps.newHashMap())
            .computeIfAbsent(label.getValue(), v -> new RoaringBitmap())
            .add(doc);
      }
    }
    final ImmutableMap.Builder<String, ImmutableMap<String, RoaringBitmap>> frozen =
        ImmutableMap.builder();
    for (final Entry<String, Map<String, RoaringBitmap>> entry : postings.entrySet()) {
      for (final RoaringBitmap bitmap : entry.getValue().values()) {
        bitmap.runOptimize();
      }
      frozen.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    this.postings = frozen.build();
    this.doc_ids = doc_ids.build();
    label_names = ImmutableSortedSet.copyOf(postings.keySet());
  }

  /** @return An empty snapshot. */
  public static IndexSnapshot empty() {
    return newBuilder().build();
  }

  /** @return The number of part keys indexed. */
  public int size() {
    return docs.size();
  }

  /** @return The record of a document. */
  public PartKeyRecord record(final int doc) {
    return docs.get(doc);
  }

  /** @return The record of the part key or null if not indexed. */
  public PartKeyRecord record(final PartKey part_key) {
    final Integer doc = doc_ids.get(part_key);
    return doc == null ? null : docs.get(doc);
  }

  /** @return All label names in the index, sorted. */
  public ImmutableSortedSet<String> labelNames() {
    return label_names;
  }

  /**
   * The most frequent values of a label.
   * @param label The label name.
   * @param top_k The maximum number of values to return.
   * @return The values by frequency descending, ties broken by value. Empty
   * if the label is unknown.
   */
  public List<TermInfo> termInfos(final String label, final int top_k) {
    final Map<String, RoaringBitmap> values = postings.get(label);
    if (values == null || top_k < 1) {
      return ImmutableList.of();
    }
    final List<TermInfo> terms = Lists.newArrayListWithCapacity(values.size());
    for (final Entry<String, RoaringBitmap> entry : values.entrySet()) {
      terms.add(new TermInfo(entry.getKey(), entry.getValue().getCardinality()));
    }
    terms.sort(TERM_ORDER);
    return ImmutableList.copyOf(terms.subList(0, Math.min(top_k, terms.size())));
  }

  /**
   * Evaluates the conjunction of the filters over every document. A filter
   * on a label the document lacks is evaluated against the empty string.
   * @param filters A non-null, possibly empty, collection of filters.
   * @return A new bitmap of the matching documents, ascending.
   */
  public RoaringBitmap matching(final Collection<LabelFilter> filters) {
    final RoaringBitmap result = all();
    for (final LabelFilter filter : filters) {
      if (result.isEmpty()) {
        break;
      }
      result.and(matching(filter));
    }
    return result;
  }

  private RoaringBitmap matching(final LabelFilter filter) {
    final Map<String, RoaringBitmap> values = postings.get(filter.getLabel());
    final RoaringBitmap matched = new RoaringBitmap();
    if (values != null) {
      for (final Entry<String, RoaringBitmap> entry : values.entrySet()) {
        if (filter.matches(entry.getKey())) {
          matched.or(entry.getValue());
        }
      }
    }
    if (filter.matches("")) {
      final RoaringBitmap absent = all();
      if (values != null) {
        for (final RoaringBitmap bitmap : values.values()) {
          absent.andNot(bitmap);
        }
      }
      matched.or(absent);
    }
    return matched;
  }

  private RoaringBitmap all() {
    final RoaringBitmap all = new RoaringBitmap();
    all.add(0L, (long) docs.size());
    return all;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Collects records for a new snapshot. A part key added twice keeps its
   * first position and the last record.
   */
  public static class Builder {
    private final Map<PartKey, PartKeyRecord> records = Maps.newLinkedHashMap();

    public Builder add(final PartKeyRecord record) {
      if (record == null) {
        throw new IllegalArgumentException("Record cannot be null.");
      }
      records.put(record.partKey(), record);
      return this;
    }

    public int size() {
      return records.size();
    }

    public IndexSnapshot build() {
      return new IndexSnapshot(this);
    }
  }
}
