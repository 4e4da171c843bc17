/*
 * Copyright 2020 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.rackspace.timelens.app.services;

import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.timelens.app.model.TimeRange;
import com.rackspace.timelens.app.resolution.ChunkIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

class PrefetchQueueTest {

  static final long MINUTE = 60_000_000L;

  VirtualTimeScheduler scheduler;
  TestPacketDataProvider provider;
  ChunkIndex chunkIndex;
  ChunkLoader chunkLoader;
  PrefetchQueue prefetchQueue;

  @BeforeEach
  void setUp() {
    scheduler = VirtualTimeScheduler.create();
    provider = TestPacketDataProvider.everySecond(0, 10 * MINUTE);
    chunkIndex = ChunkIndex.build(provider.getTimeExtent(), MINUTE);
    chunkLoader = new ChunkLoader(50, 100_000, scheduler, new SimpleMeterRegistry());
    chunkLoader.attach(provider, chunkIndex);
    prefetchQueue = new PrefetchQueue(chunkLoader, scheduler, Duration.ofMillis(10));
  }

  @AfterEach
  void tearDown() {
    scheduler.dispose();
  }

  @Test
  void enqueuesNeighboursOfTheChunksInView() {
    final int added = prefetchQueue.enqueueAdjacent(chunkIndex,
        TimeRange.of(4 * MINUTE + 1, 5 * MINUTE + 1), 2);

    assertThat(added).isEqualTo(4);
    assertThat(prefetchQueue.contains(3 * MINUTE)).isTrue();
    assertThat(prefetchQueue.contains(2 * MINUTE)).isTrue();
    assertThat(prefetchQueue.contains(6 * MINUTE)).isTrue();
    assertThat(prefetchQueue.contains(7 * MINUTE)).isTrue();
    assertThat(prefetchQueue.contains(4 * MINUTE)).isFalse();
  }

  @Test
  void skipsChunksAlreadyCachedOrQueued() {
    chunkLoader.load(6 * MINUTE).block();
    prefetchQueue.enqueueAdjacent(chunkIndex, TimeRange.of(4 * MINUTE, 4 * MINUTE + 5), 1);

    final int added = prefetchQueue.enqueueAdjacent(chunkIndex,
        TimeRange.of(4 * MINUTE, 5 * MINUTE + 5), 1);

    // 3 was queued by the first call, 6 is cached
    assertThat(added).isZero();
    assertThat(prefetchQueue.size()).isEqualTo(2);
  }

  @Test
  void drainsOneChunkPerYield() {
    prefetchQueue.enqueueAdjacent(chunkIndex, TimeRange.of(4 * MINUTE, 5 * MINUTE + 5), 2);

    prefetchQueue.process();

    assertThat(prefetchQueue.isDraining()).isTrue();
    assertThat(chunkLoader.cachedChunks()).isEqualTo(1);
    assertThat(chunkLoader.isCached(3 * MINUTE)).isTrue();

    // re-entrant call while draining is a no-op
    prefetchQueue.process();
    assertThat(chunkLoader.cachedChunks()).isEqualTo(1);

    scheduler.advanceTimeBy(Duration.ofMillis(10));
    assertThat(chunkLoader.cachedChunks()).isEqualTo(2);

    scheduler.advanceTimeBy(Duration.ofSeconds(1));
    assertThat(prefetchQueue.isDraining()).isFalse();
    assertThat(prefetchQueue.size()).isZero();
    assertThat(chunkLoader.cachedChunks()).isEqualTo(4);
    assertThat(provider.totalDetailCalls()).isEqualTo(4);
    assertThat(provider.detailCallsFor(4 * MINUTE, 5 * MINUTE)).isZero();
  }

  @Test
  void skipsChunksCachedSinceEnqueue() {
    prefetchQueue.enqueueAdjacent(chunkIndex, TimeRange.of(4 * MINUTE, 4 * MINUTE + 5), 1);
    chunkLoader.load(3 * MINUTE).block();

    prefetchQueue.process();
    scheduler.advanceTimeBy(Duration.ofSeconds(1));

    assertThat(provider.detailCallsFor(3 * MINUTE, 4 * MINUTE)).isEqualTo(1);
    assertThat(chunkLoader.isCached(5 * MINUTE)).isTrue();
    assertThat(prefetchQueue.isDraining()).isFalse();
  }

  @Test
  void failedChunkDoesNotStopDraining() {
    provider.failingChunks.add(3 * MINUTE);
    prefetchQueue.enqueueAdjacent(chunkIndex, TimeRange.of(4 * MINUTE, 4 * MINUTE + 5), 1);

    prefetchQueue.process();
    scheduler.advanceTimeBy(Duration.ofSeconds(1));

    assertThat(chunkLoader.isCached(3 * MINUTE)).isFalse();
    assertThat(chunkLoader.isCached(5 * MINUTE)).isTrue();
    assertThat(prefetchQueue.isDraining()).isFalse();
  }

  @Test
  void clear() {
    prefetchQueue.enqueueAdjacent(chunkIndex, TimeRange.of(4 * MINUTE, 4 * MINUTE + 5), 2);

    prefetchQueue.clear();
    prefetchQueue.process();

    assertThat(prefetchQueue.size()).isZero();
    assertThat(prefetchQueue.isDraining()).isFalse();
    assertThat(provider.totalDetailCalls()).isZero();
  }
}
