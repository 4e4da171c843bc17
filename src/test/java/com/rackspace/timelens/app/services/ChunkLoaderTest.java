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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.timelens.app.model.PacketRecord;
import com.rackspace.timelens.app.model.TimeRange;
import com.rackspace.timelens.app.resolution.ChunkIndex;
import com.rackspace.timelens.app.resolution.StaleChunkException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

class ChunkLoaderTest {

  static final long MINUTE = 60_000_000L;

  SimpleMeterRegistry meterRegistry;
  PacketDataProvider provider;
  ChunkIndex chunkIndex;
  ChunkLoader chunkLoader;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    provider = mock(PacketDataProvider.class);
    chunkIndex = ChunkIndex.build(TimeRange.of(0, 10 * MINUTE), MINUTE);
    chunkLoader = new ChunkLoader(3, 1000, Schedulers.immediate(), meterRegistry);
    chunkLoader.attach(provider, chunkIndex);
  }

  private static List<PacketRecord> packets(long... timestamps) {
    final List<PacketRecord> packets = new ArrayList<>();
    for (long timestamp : timestamps) {
      packets.add(TestPacketDataProvider.packet(timestamp, "10.0.0.1", 64));
    }
    return packets;
  }

  @Test
  void loadsAndCachesChunk() {
    when(provider.getDetailData(any(), anyInt()))
        .thenReturn(Mono.just(packets(MINUTE + 5, MINUTE + 9)));

    StepVerifier.create(chunkLoader.load(MINUTE))
        .verifyComplete();

    assertThat(chunkLoader.isCached(MINUTE)).isTrue();
    assertThat(chunkLoader.isLoading(MINUTE)).isFalse();
    assertThat(chunkLoader.get(MINUTE)).hasSize(2);
    assertThat(chunkLoader.cachedRecords()).isEqualTo(2);
    verify(provider).getDetailData(TimeRange.of(MINUTE, 2 * MINUTE), 1000);
    assertThat(meterRegistry.get("timelens.chunk.fetches").tag("outcome", "success")
        .counter().count()).isEqualTo(1);
  }

  @Test
  void concurrentLoadsShareOneFetch() {
    final Sinks.One<List<PacketRecord>> response = Sinks.one();
    when(provider.getDetailData(any(), anyInt())).thenReturn(response.asMono());

    final Mono<Void> first = chunkLoader.load(2 * MINUTE);
    final Mono<Void> second = chunkLoader.load(2 * MINUTE);

    assertThat(chunkLoader.isLoading(2 * MINUTE)).isTrue();
    assertThat(chunkLoader.loadingChunks()).isEqualTo(1);
    verify(provider, times(1)).getDetailData(any(), anyInt());

    response.tryEmitValue(packets(2 * MINUTE));

    StepVerifier.create(Mono.when(first, second)).verifyComplete();
    assertThat(chunkLoader.isCached(2 * MINUTE)).isTrue();
    assertThat(chunkLoader.loadingChunks()).isZero();
  }

  @Test
  void cachedChunkIsNotFetchedAgain() {
    when(provider.getDetailData(any(), anyInt())).thenReturn(Mono.just(packets(0)));

    chunkLoader.load(0).block();
    chunkLoader.load(0).block();

    verify(provider, times(1)).getDetailData(any(), anyInt());
  }

  @Test
  void failedFetchLeavesGap() {
    when(provider.getDetailData(eq(TimeRange.of(MINUTE, 2 * MINUTE)), anyInt()))
        .thenReturn(Mono.error(new IllegalStateException("disk on fire")));

    StepVerifier.create(chunkLoader.load(MINUTE))
        .verifyComplete();

    assertThat(chunkLoader.isCached(MINUTE)).isFalse();
    assertThat(chunkLoader.isLoading(MINUTE)).isFalse();
    assertThat(meterRegistry.get("timelens.chunk.fetches").tag("outcome", "failure")
        .counter().count()).isEqualTo(1);
  }

  @Test
  void evictsLeastRecentlyUsedChunk() {
    when(provider.getDetailData(any(), anyInt())).thenReturn(Mono.just(packets(1)));

    for (long chunkId = 0; chunkId < 4 * MINUTE; chunkId += MINUTE) {
      chunkLoader.load(chunkId).block();
    }

    assertThat(chunkLoader.cachedChunks()).isEqualTo(3);
    assertThat(chunkLoader.isCached(0)).isFalse();
  }

  @Test
  void staleChunkId() {
    StepVerifier.create(chunkLoader.load(42))
        .expectError(StaleChunkException.class)
        .verify();
  }

  @Test
  void notAttached() {
    chunkLoader.clear();

    StepVerifier.create(chunkLoader.load(0))
        .expectError(IllegalStateException.class)
        .verify();
  }

  @Test
  void fetchSettlingAfterClearIsDiscarded() {
    final Sinks.One<List<PacketRecord>> response = Sinks.one();
    when(provider.getDetailData(any(), anyInt())).thenReturn(response.asMono());
    final Mono<Void> load = chunkLoader.load(0);

    chunkLoader.clear();
    chunkLoader.attach(provider, chunkIndex);
    response.tryEmitValue(packets(7));

    StepVerifier.create(load).verifyComplete();
    assertThat(chunkLoader.isCached(0)).isFalse();
    assertThat(chunkLoader.loadingChunks()).isZero();
  }
}
