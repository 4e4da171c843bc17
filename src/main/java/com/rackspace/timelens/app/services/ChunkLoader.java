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

import com.rackspace.timelens.app.model.PacketRecord;
import com.rackspace.timelens.app.resolution.Chunk;
import com.rackspace.timelens.app.resolution.ChunkIndex;
import com.rackspace.timelens.app.resolution.EvictionCache;
import com.rackspace.timelens.app.resolution.StaleChunkException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Fetches fine chunks into the eviction cache. Each chunk is fetched at most once at a time:
 * callers asking for a chunk that is already being fetched join the in-flight fetch. Fetches are
 * never cancelled once issued, and a failed fetch leaves the chunk absent.
 * <p>
 * Must only be called on the session scheduler.
 * </p>
 */
@Slf4j
public class ChunkLoader {

  private final EvictionCache<Long, List<PacketRecord>> cache;
  private final Map<Long, Mono<Void>> loading = new HashMap<>();
  private final Scheduler scheduler;
  private final int fetchLimit;
  private final Counter fetchedCounter;
  private final Counter failedCounter;

  private PacketDataProvider provider;
  private ChunkIndex chunkIndex;
  /**
   * Bumped on every clear so fetches issued before it are dropped when they settle.
   */
  private long epoch;

  public ChunkLoader(int capacity, int fetchLimit, Scheduler scheduler,
                     MeterRegistry meterRegistry) {
    this.cache = new EvictionCache<>(capacity);
    this.fetchLimit = fetchLimit;
    this.scheduler = scheduler;
    this.fetchedCounter = meterRegistry.counter("timelens.chunk.fetches", "outcome", "success");
    this.failedCounter = meterRegistry.counter("timelens.chunk.fetches", "outcome", "failure");
  }

  public void attach(PacketDataProvider provider, ChunkIndex chunkIndex) {
    this.provider = provider;
    this.chunkIndex = chunkIndex;
  }

  public boolean isCached(long chunkId) {
    return cache.has(chunkId);
  }

  public boolean isLoading(long chunkId) {
    return loading.containsKey(chunkId);
  }

  public boolean isCachedOrLoading(long chunkId) {
    return isCached(chunkId) || isLoading(chunkId);
  }

  public boolean allCached(Collection<Long> chunkIds) {
    return chunkIds.stream().allMatch(cache::has);
  }

  /**
   * @return the cached payload, promoted to most-recently-used, or null
   */
  public List<PacketRecord> get(long chunkId) {
    return cache.get(chunkId);
  }

  /**
   * Ensures the chunk is cached or being fetched.
   *
   * @return completes once the chunk's fetch has settled, successfully or not
   */
  public Mono<Void> load(long chunkId) {
    if (cache.has(chunkId)) {
      return Mono.empty();
    }
    final Mono<Void> inFlight = loading.get(chunkId);
    if (inFlight != null) {
      return inFlight;
    }
    if (provider == null || chunkIndex == null) {
      return Mono.error(new IllegalStateException("Chunk loader is not attached to a dataset"));
    }

    final Chunk chunk;
    try {
      chunk = chunkIndex.get(chunkId);
    } catch (StaleChunkException e) {
      return Mono.error(e);
    }

    final long loadEpoch = epoch;
    final long started = System.nanoTime();
    final Mono<Void> fetch = Mono.defer(() -> provider.getDetailData(chunk.toRange(), fetchLimit))
        .publishOn(scheduler)
        .doOnNext(records -> {
          if (loadEpoch != epoch) {
            log.debug("Dropping chunk {} fetched before the dataset was cleared", chunkId);
            return;
          }
          final Long evicted = cache.put(chunkId, records);
          fetchedCounter.increment();
          log.debug("Loaded chunk {}: {} packets in {}ms{}", chunkId, records.size(),
              (System.nanoTime() - started) / 1_000_000,
              evicted != null ? ", evicted chunk " + evicted : "");
        })
        .doOnError(throwable -> {
          failedCounter.increment();
          log.warn("Failed to load chunk {}", chunkId, throwable);
        })
        .onErrorResume(throwable -> Mono.empty())
        .doOnTerminate(() -> {
          if (loadEpoch == epoch) {
            loading.remove(chunkId);
          }
        })
        .then()
        .cache();

    loading.put(chunkId, fetch);
    fetch.subscribe();
    return fetch;
  }

  public int cachedChunks() {
    return cache.size();
  }

  public long cachedRecords() {
    return cache.values().stream().mapToLong(List::size).sum();
  }

  public int loadingChunks() {
    return loading.size();
  }

  public void clear() {
    epoch++;
    cache.clear();
    loading.clear();
    provider = null;
    chunkIndex = null;
  }
}
