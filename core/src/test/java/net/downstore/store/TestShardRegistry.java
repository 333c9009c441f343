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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.MoreExecutors;

import net.downstore.data.DatasetRef;
import net.downstore.data.Schema;
import net.downstore.data.Schemas;
import net.downstore.exceptions.ShardAlreadySetupException;
import net.downstore.exceptions.ShardNotAssignedException;
import net.downstore.exceptions.ShardNotSetUpException;
import net.downstore.index.DownsampledShard;
import net.downstore.stats.ScanStats;
import net.downstore.storage.MemoryColumnStore;

public class TestShardRegistry {
  static final DatasetRef DATASET = new DatasetRef("metrics_ds_5");
  static final DatasetRef OTHER = new DatasetRef("metrics_ds_60");
  static final Schemas SCHEMAS = Schemas.of(Schema.newBuilder()
      .setName("gauge")
      .setId(1)
      .setDataColumns(ImmutableList.of("timestamp", "avg"))
      .build());
  static final StoreConfig CONFIG = StoreConfig.newBuilder().build();

  private MemoryColumnStore store;
  private ExecutorService pool;
  private ShardRegistry registry;

  @Before
  public void before() throws Exception {
    store = new MemoryColumnStore();
    pool = MoreExecutors.newDirectExecutorService();
    final MetricRegistry metrics = new MetricRegistry();
    registry = new ShardRegistry(store, pool, metrics, new ScanStats(metrics));
  }

  @After
  public void after() throws Exception {
    pool.shutdownNow();
  }

  @Test
  public void ctor() throws Exception {
    final MetricRegistry metrics = new MetricRegistry();
    try {
      new ShardRegistry(null, pool, metrics, new ScanStats(metrics));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new ShardRegistry(store, null, metrics, new ScanStats(metrics));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new ShardRegistry(store, pool, null, new ScanStats(metrics));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void setupAndGet() throws Exception {
    final DownsampledShard shard = registry.setup(DATASET, 3, SCHEMAS, CONFIG, null);
    assertSame(shard, registry.getShard(DATASET, 3).get());
    assertSame(shard, registry.getShardOrFail(DATASET, 3));
    assertSame(SCHEMAS, shard.schemas());
    assertEquals(ImmutableList.of(3), registry.activeShards(DATASET));
    assertEquals(ImmutableSet.of(DATASET), registry.datasets());

    assertFalse(registry.getShard(DATASET, 4).isPresent());
    assertFalse(registry.getShard(OTHER, 3).isPresent());
    assertFalse(registry.getShard(null, 3).isPresent());
    assertTrue(registry.activeShards(OTHER).isEmpty());
    assertTrue(registry.shards(OTHER).isEmpty());

    try {
      registry.getShardOrFail(OTHER, 3);
      fail("Expected ShardNotSetUpException");
    } catch (ShardNotSetUpException e) {
      assertEquals(404, e.getStatusCode());
      assertEquals(OTHER, e.getDataset());
      assertEquals(3, e.getShard());
    }
  }

  @Test
  public void setupTwiceFails() throws Exception {
    final DownsampledShard shard = registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
    try {
      registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
      fail("Expected ShardAlreadySetupException");
    } catch (ShardAlreadySetupException e) {
      assertEquals(409, e.getStatusCode());
    }
    assertSame(shard, registry.getShardOrFail(DATASET, 0));

    // same number on another dataset is fine
    registry.setup(OTHER, 0, SCHEMAS, CONFIG, null);
    assertEquals(ImmutableSet.of(DATASET, OTHER), registry.datasets());
  }

  @Test
  public void setupBadArgs() throws Exception {
    try {
      registry.setup(null, 0, SCHEMAS, CONFIG, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      registry.setup(DATASET, -1, SCHEMAS, CONFIG, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    assertTrue(registry.activeShards(DATASET).isEmpty());
  }

  @Test
  public void concurrentSetupCreatesOneShard() throws Exception {
    final ExecutorService threads = Executors.newFixedThreadPool(8);
    try {
      final CountDownLatch go = new CountDownLatch(1);
      final List<Future<DownsampledShard>> futures = Lists.newArrayList();
      for (int i = 0; i < 8; i++) {
        futures.add(threads.submit(new Callable<DownsampledShard>() {
          @Override
          public DownsampledShard call() throws Exception {
            go.await();
            return registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
          }
        }));
      }
      go.countDown();
      int created = 0;
      int failed = 0;
      for (final Future<DownsampledShard> future : futures) {
        try {
          assertSame(registry.getShardOrFail(DATASET, 0),
              future.get(10, TimeUnit.SECONDS));
          created++;
        } catch (ExecutionException e) {
          assertTrue(e.getCause() instanceof ShardAlreadySetupException);
          failed++;
        }
      }
      assertEquals(1, created);
      assertEquals(7, failed);
    } finally {
      threads.shutdownNow();
    }
  }

  @Test
  public void removeShardComparesInstances() throws Exception {
    final DownsampledShard first = registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
    assertTrue(registry.removeShard(DATASET, 0, first));
    assertFalse(registry.getShard(DATASET, 0).isPresent());

    final DownsampledShard second = registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
    assertNotSame(first, second);

    // a late teardown of the old instance leaves the new one alone
    assertFalse(registry.removeShard(DATASET, 0, first));
    assertSame(second, registry.getShardOrFail(DATASET, 0));

    assertFalse(registry.removeShard(DATASET, 0, null));
    assertFalse(registry.removeShard(OTHER, 0, second));
    assertFalse(registry.removeShard(DATASET, 1, second));
    assertTrue(registry.removeShard(DATASET, 0, second));
  }

  @Test
  public void lookup() throws Exception {
    assertEquals(ShardLookup.Status.NOT_SET_UP, registry.lookup(DATASET, 0).status());
    assertEquals(ShardLookup.Status.NOT_SET_UP, registry.lookup(null, 0).status());

    final DownsampledShard shard = registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
    ShardLookup lookup = registry.lookup(DATASET, 0);
    assertEquals(ShardLookup.Status.FOUND, lookup.status());
    assertSame(shard, lookup.shard().get());
    assertSame(shard, lookup.getOrThrow());
    assertEquals(ShardLookup.Status.NOT_SET_UP, registry.lookup(DATASET, 1).status());

    registry.removeShard(DATASET, 0, shard);
    lookup = registry.lookup(DATASET, 0);
    assertEquals(ShardLookup.Status.REASSIGNED, lookup.status());
    assertFalse(lookup.shard().isPresent());
    try {
      lookup.getOrThrow();
      fail("Expected ShardNotAssignedException");
    } catch (ShardNotAssignedException e) {
      assertEquals(503, e.getStatusCode());
    }

    try {
      registry.lookup(DATASET, 1).getOrThrow();
      fail("Expected ShardNotSetUpException");
    } catch (ShardNotSetUpException e) { }

    // set up again
    registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
    assertEquals(ShardLookup.Status.FOUND, registry.lookup(DATASET, 0).status());
  }

  @Test
  public void reset() throws Exception {
    registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
    registry.setup(DATASET, 1, SCHEMAS, CONFIG, null);
    registry.setup(OTHER, 0, SCHEMAS, CONFIG, null);

    registry.reset();
    assertTrue(registry.datasets().isEmpty());
    assertTrue(registry.activeShards(DATASET).isEmpty());
    assertEquals(ShardLookup.Status.NOT_SET_UP, registry.lookup(DATASET, 0).status());
    assertEquals(1, store.resets());

    // usable afterwards
    registry.setup(DATASET, 0, SCHEMAS, CONFIG, null);
    assertTrue(registry.getShard(DATASET, 0).isPresent());
  }
}
