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
package net.downstore.store;

import static net.downstore.store.TestShardRegistry.CONFIG;
import static net.downstore.store.TestShardRegistry.DATASET;
import static net.downstore.store.TestShardRegistry.OTHER;
import static net.downstore.store.TestShardRegistry.SCHEMAS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.MoreExecutors;

import net.downstore.data.IndexName;
import net.downstore.data.PartKey;
import net.downstore.data.PartKeyRecord;
import net.downstore.data.ReadablePartition;
import net.downstore.data.TermInfo;
import net.downstore.exceptions.IndexNotReadyException;
import net.downstore.exceptions.ShardAssignmentException;
import net.downstore.exceptions.ShardNotAssignedException;
import net.downstore.exceptions.ShardNotSetUpException;
import net.downstore.index.DownsampledShard;
import net.downstore.query.AllChunkScan;
import net.downstore.query.AllPartitionScan;
import net.downstore.query.PartLookupResult;
import net.downstore.query.ScanSplit;
import net.downstore.query.ShardSplit;
import net.downstore.query.filter.LabelFilter;
import net.downstore.query.filter.LabelFilters;
import net.downstore.stats.ScanStats;
import net.downstore.storage.MemoryColumnStore;
import net.downstore.utils.CloseableIterator;

public class TestShardQueryRouter {
  private MemoryColumnStore store;
  private ExecutorService pool;
  private ShardRegistry registry;
  private ShardQueryRouter router;

  @Before
  public void before() throws Exception {
    store = new MemoryColumnStore();
    pool = MoreExecutors.newDirectExecutorService();
    final MetricRegistry metrics = new MetricRegistry();
    registry = new ShardRegistry(store, pool, metrics, new ScanStats(metrics));
    router = new ShardQueryRouter(registry);
  }

  @After
  public void after() throws Exception {
    pool.shutdownNow();
  }

  private static PartKeyRecord record(final int id,
                                      final int shard,
                                      final String host) {
    return new PartKeyRecord(PartKey.of(new byte[] { (byte) shard, (byte) id }),
        ImmutableMap.of("host", host), 1, 0, 100, shard);
  }

  private void twoShards() throws Exception {
    store.addPartKey(DATASET, record(1, 0, "a"));
    store.addPartKey(DATASET, record(2, 0, "a"));
    store.addPartKey(DATASET, new PartKeyRecord(
        PartKey.of(new byte[] { 1, 1 }),
        ImmutableMap.of("host", "b", "dc", "phx"), 1, 0, 100, 1));
    registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
    registry.setup(DATASET, 1, SCHEMAS, CONFIG, null);
    router.recoverIndex(DATASET, 0).join(5000);
    router.recoverIndex(DATASET, 1).join(5000);
  }

  @Test
  public void ctor() throws Exception {
    try {
      new ShardQueryRouter(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void routeUnknownShards() throws Exception {
    try {
      router.labelValues(DATASET, 0, "host", 10);
      fail("Expected ShardNotSetUpException");
    } catch (ShardNotSetUpException e) { }

    try {
      router.lookupPartitions(DATASET, new AllPartitionScan(0),
          AllChunkScan.INSTANCE);
      fail("Expected ShardNotSetUpException");
    } catch (ShardNotSetUpException e) { }

    try {
      router.recoverIndex(OTHER, 0);
      fail("Expected ShardNotSetUpException");
    } catch (ShardNotSetUpException e) { }

    final DownsampledShard shard = registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
    assertSame(shard, router.route(DATASET, 0));
    registry.removeShard(DATASET, 0, shard);
    try {
      router.shardMetrics(DATASET, 0);
      fail("Expected ShardNotAssignedException");
    } catch (ShardNotAssignedException e) { }

    try {
      router.partKeysWithFilters(DATASET, 0, ImmutableList.<LabelFilter>of(),
          0, 100, 10);
      fail("Expected ShardAssignmentException");
    } catch (ShardAssignmentException e) { }
  }

  @Test
  public void delegates() throws Exception {
    twoShards();
    assertEquals(ImmutableList.of(new TermInfo("a", 2)),
        router.labelValues(DATASET, 0, "host", 10));
    assertEquals(ImmutableList.of(new TermInfo("b", 1)),
        router.labelValues(DATASET, 1, "host", 10));

    final PartLookupResult lookup = router.lookupPartitions(DATASET,
        new AllPartitionScan(1), AllChunkScan.INSTANCE);
    assertEquals(1, lookup.shard());
    assertEquals(1, lookup.partKeys().size());

    final CloseableIterator<ReadablePartition> scan =
        router.scanPartitions(DATASET, lookup);
    try {
      final List<ReadablePartition> partitions = Lists.newArrayList(scan);
      assertEquals(1, partitions.size());
      assertEquals(1, partitions.get(0).shard());
      assertEquals("phx", partitions.get(0).labels().get("dc"));
    } finally {
      scan.close();
    }

    final CloseableIterator<Map<String, String>> values =
        router.labelValuesWithFilters(DATASET, 0,
            ImmutableList.of(LabelFilters.equalTo("host", "a")),
            ImmutableList.of("host"), 0, 100, 10);
    try {
      assertEquals(ImmutableList.of(ImmutableMap.of("host", "a")),
          Lists.newArrayList(values));
    } finally {
      values.close();
    }

    final CloseableIterator<PartKey> keys = router.partKeysWithFilters(
        DATASET, 0, ImmutableList.<LabelFilter>of(), 0, 100, 1);
    try {
      assertEquals(1, Lists.newArrayList(keys).size());
    } finally {
      keys.close();
    }

    assertEquals(2, router.shardMetrics(DATASET, 0).indexSize());
    assertEquals(1, router.shardMetrics(DATASET, 1).lookups());
  }

  @Test
  public void indexNames() throws Exception {
    twoShards();
    final List<IndexName> names = Lists.newArrayList(
        router.indexNames(DATASET, 10));
    names.sort(null);
    assertEquals(ImmutableList.of(
        new IndexName("host", 0),
        new IndexName("dc", 1),
        new IndexName("host", 1)), names);

    // limit is per shard
    assertEquals(2, router.indexNames(DATASET, 1).size());
    assertTrue(router.indexNames(OTHER, 10).isEmpty());
  }

  @Test
  public void indexNamesBeforeRecovery() throws Exception {
    registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
    try {
      router.indexNames(DATASET, 10);
      fail("Expected IndexNotReadyException");
    } catch (IndexNotReadyException e) { }
  }

  @Test
  public void getScanSplits() throws Exception {
    assertTrue(router.getScanSplits(DATASET, 1).isEmpty());

    registry.setup(DATASET, 7, SCHEMAS, CONFIG, null);
    registry.setup(DATASET, 2, SCHEMAS, CONFIG, null);
    registry.setup(DATASET, 4, SCHEMAS, CONFIG, null);
    registry.setup(OTHER, 9, SCHEMAS, CONFIG, null);

    final List<ScanSplit> splits = router.getScanSplits(DATASET, 3);
    assertEquals(ImmutableList.of(new ShardSplit(2), new ShardSplit(4),
        new ShardSplit(7)), splits);

    try {
      router.getScanSplits(DATASET, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
