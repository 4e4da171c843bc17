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

import static com.rackspace.timelens.app.utils.DateTimeUtils.formatSpan;

import com.github.benmanes.caffeine.cache.Cache;
import com.rackspace.timelens.app.config.CacheProperties;
import com.rackspace.timelens.app.config.ResolutionProperties;
import com.rackspace.timelens.app.model.AggregatedBin;
import com.rackspace.timelens.app.model.DomainData;
import com.rackspace.timelens.app.model.ImmediateData;
import com.rackspace.timelens.app.model.MemoryStats;
import com.rackspace.timelens.app.model.PacketRecord;
import com.rackspace.timelens.app.model.ResolutionTier;
import com.rackspace.timelens.app.model.TimeRange;
import com.rackspace.timelens.app.model.TimelineEntry;
import com.rackspace.timelens.app.model.TransitionInfo;
import com.rackspace.timelens.app.resolution.CancellationToken;
import com.rackspace.timelens.app.resolution.ChunkIndex;
import com.rackspace.timelens.app.resolution.PrefetchKey;
import com.rackspace.timelens.app.resolution.ResolutionStateMachine;
import com.rackspace.timelens.app.utils.DateTimeUtils;
import com.rackspace.timelens.app.utils.TimestampProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Serves one viewport with timeline data at the resolution its visible span calls for.
 * <p>
 * Coarse bins stay resident for the whole session. Medium bins are fetched per domain. Fine
 * packets are fetched in time-aligned chunks that are kept in an LRU eviction cache and shared
 * between requests.
 * </p>
 * <p>
 * All state is confined to the session scheduler: public methods hop onto it and provider results
 * are published back onto it before they are applied, so no locking is needed. Every domain
 * request bumps the render generation; results of superseded requests are dropped.
 * </p>
 */
@Slf4j
public class ResolutionManager {

  @Getter
  private final String viewportId;
  private final ResolutionProperties resolutionProperties;
  private final CacheProperties cacheProperties;
  private final Scheduler scheduler;
  private final ResolutionStateMachine stateMachine;
  private final ChunkLoader chunkLoader;
  private final PrefetchQueue prefetchQueue;
  private final Cache<PrefetchKey, List<? extends TimelineEntry>> prefetchedResolutions;
  private final Set<PrefetchKey> resolutionPrefetchesInFlight = new HashSet<>();
  private final List<ResolutionListener> listeners = new CopyOnWriteArrayList<>();
  private final Map<ResolutionTier, Counter> queryCounters =
      new EnumMap<>(ResolutionTier.class);

  private PacketDataProvider provider;
  private ChunkIndex chunkIndex;
  private List<AggregatedBin> coarseCache = List.of();
  private List<AggregatedBin> mediumCache = List.of();
  private TimeRange mediumCoverage;
  private CancellationToken currentToken;
  private volatile long generation;

  public ResolutionManager(String viewportId,
                           ResolutionProperties resolutionProperties,
                           CacheProperties cacheProperties,
                           Scheduler scheduler,
                           TimestampProvider timestampProvider,
                           Cache<PrefetchKey, List<? extends TimelineEntry>> prefetchedResolutions,
                           MeterRegistry meterRegistry) {
    this.viewportId = viewportId;
    this.resolutionProperties = resolutionProperties;
    this.cacheProperties = cacheProperties;
    this.scheduler = scheduler;
    this.prefetchedResolutions = prefetchedResolutions;
    this.stateMachine = new ResolutionStateMachine(resolutionProperties, timestampProvider);
    this.chunkLoader = new ChunkLoader(cacheProperties.getDetailCapacity(),
        cacheProperties.getDetailFetchLimit(), scheduler, meterRegistry);
    this.prefetchQueue = new PrefetchQueue(chunkLoader, scheduler,
        cacheProperties.getPrefetchYield());
    for (ResolutionTier tier : ResolutionTier.values()) {
      queryCounters.put(tier, meterRegistry.counter("timelens.query",
          "tier", tier.name().toLowerCase(Locale.ROOT)));
    }
  }

  public void addListener(ResolutionListener listener) {
    listeners.add(listener);
  }

  public void removeListener(ResolutionListener listener) {
    listeners.remove(listener);
  }

  /**
   * Builds the chunk index from the provider's time extent and loads the coarse cache.
   *
   * @return the coarse bins of the whole dataset
   */
  public Mono<List<AggregatedBin>> init(PacketDataProvider dataProvider) {
    return Mono.defer(() -> {
      resetState();
      final TimeRange extent = dataProvider.getTimeExtent();
      log.info("Initializing viewport {} over time extent {}", viewportId, extent);
      chunkIndex = ChunkIndex.build(extent,
          DateTimeUtils.toMicros(cacheProperties.getChunkWidth()),
          cacheProperties.getMaxIndexedChunks());
      provider = dataProvider;
      chunkLoader.attach(dataProvider, chunkIndex);
      return loadCoarse(dataProvider);
    })
        .subscribeOn(scheduler);
  }

  /**
   * Reloads the coarse cache wholesale, for example after the query backing it changed. Medium
   * and prefetched resolution data derived from the old query is dropped.
   */
  public Mono<List<AggregatedBin>> refreshCoarse() {
    return Mono.defer(() -> {
      final PacketDataProvider dataProvider = requireProvider();
      mediumCache = List.of();
      mediumCoverage = null;
      prefetchedResolutions.invalidateAll();
      return loadCoarse(dataProvider);
    })
        .subscribeOn(scheduler);
  }

  private Mono<List<AggregatedBin>> loadCoarse(PacketDataProvider dataProvider) {
    final long started = System.nanoTime();
    return Mono.defer(dataProvider::getCoarseAggregates)
        .publishOn(scheduler)
        .onErrorMap(ProviderUnavailableException::wrap)
        .doOnNext(bins -> {
          if (provider != dataProvider) {
            return;
          }
          coarseCache = List.copyOf(bins);
          log.info("Viewport {} loaded {} coarse bins in {}ms, chunk index has {} chunks",
              viewportId, bins.size(), (System.nanoTime() - started) / 1_000_000,
              chunkIndex.size());
        });
  }

  public ResolutionTier getCurrentResolution() {
    return stateMachine.getCurrentTier();
  }

  public long getGeneration() {
    return generation;
  }

  /**
   * @return true if no newer domain request was issued since the one that produced the data
   */
  public boolean isCurrent(DomainData domainData) {
    return domainData.getGeneration() == generation;
  }

  /**
   * Resolves the tier for the domain and returns its data once fully loaded.
   * <p>
   * Completes empty when the request is superseded by a newer one before its medium or fine data
   * arrives. A failed medium query is signalled as {@link ProviderUnavailableException}; failed
   * fine chunks only leave gaps.
   * </p>
   */
  public Mono<DomainData> getDataForDomain(TimeRange domain) {
    return Mono.defer(() -> {
      requireProvider();
      final long requestGeneration = ++generation;
      final ResolutionTier previous = stateMachine.getCurrentTier();
      final TransitionInfo transition = stateMachine.resolve(domain.span());
      final ResolutionTier tier = transition.getResolution();
      final CancellationToken token = renewToken(requestGeneration);
      queryCounters.get(tier).increment();
      log.debug("Viewport {} domain {} span {} resolved to {}", viewportId, domain,
          formatSpan(domain.span()), tier);
      notifyResolutionChange(previous, transition);

      final List<? extends TimelineEntry> prefetched = prefetchedData(domain, tier);
      if (prefetched != null) {
        return Mono.just(domainData(prefetched, tier, true, requestGeneration));
      }

      switch (tier) {
        case COARSE:
          return Mono.just(domainData(filterCoarse(domain), tier, true, requestGeneration));
        case MEDIUM:
          return loadMedium(domain, token)
              .map(bins -> domainData(bins, tier, false, requestGeneration));
        default:
          final boolean allCached = chunkLoader.allCached(chunkIndex.chunkIdsOverlapping(domain));
          return loadFine(domain, true)
              .filter(packets -> isLatest(requestGeneration, tier, domain))
              .map(packets -> domainData(packets, tier, allCached, requestGeneration));
      }
    })
        .subscribeOn(scheduler);
  }

  /**
   * Returns the best data available right now without waiting on the provider. When the target
   * tier's data is missing, stale or the tier just changed, a background load is started and
   * exposed as {@link ImmediateData#getLoadingFuture()}.
   */
  public Mono<ImmediateData> getDataForDomainNonBlocking(TimeRange domain) {
    return Mono.fromCallable(() -> {
      requireProvider();
      final long requestGeneration = ++generation;
      final ResolutionTier previous = stateMachine.getCurrentTier();
      final TransitionInfo transition = stateMachine.resolve(domain.span());
      final ResolutionTier tier = transition.getResolution();
      queryCounters.get(tier).increment();
      notifyResolutionChange(previous, transition);

      final ImmediateData result = new ImmediateData()
          .setResolution(tier)
          .setTransitionInfo(transition)
          .setGeneration(requestGeneration);

      final List<? extends TimelineEntry> prefetched = prefetchedData(domain, tier);
      if (prefetched != null) {
        log.debug("Viewport {} serving prefetched {} data for {}", viewportId, tier, domain);
        result.setData(prefetched);
      } else {
        result.setData(immediateData(domain, tier));
        final boolean needsMedium = tier == ResolutionTier.MEDIUM
            && (mediumCoverage == null || !mediumCoverage.covers(domain));
        final boolean needsFine = tier == ResolutionTier.FINE
            && !chunkLoader.allCached(chunkIndex.chunkIdsOverlapping(domain));
        if (transition.isSwitchedResolution() || needsMedium || needsFine) {
          result.setLoading(true)
              .setLoadingFuture(startBackgroundLoad(domain, tier, requestGeneration));
        }
      }
      log.debug("Viewport {} non-blocking domain {} resolved to {}, {} immediate entries, "
          + "loading={}", viewportId, domain, tier, result.getData().size(), result.isLoading());

      if (resolutionProperties.isAutoPrefetch() && transition.isShouldPrefetch()) {
        enqueueResolution(domain, transition.getPrefetchResolution());
      }
      return result;
    })
        .subscribeOn(scheduler);
  }

  private Mono<List<? extends TimelineEntry>> startBackgroundLoad(TimeRange domain,
                                                                  ResolutionTier tier,
                                                                  long requestGeneration) {
    final CancellationToken token = renewToken(requestGeneration);
    notifyListeners(listener -> listener.onBackgroundLoadStart(tier));

    final Mono<List<? extends TimelineEntry>> load = loadForTier(domain, tier, token)
        .filter(data -> isLatest(requestGeneration, tier, domain))
        .doOnNext(data -> notifyListeners(
            listener -> listener.onBackgroundLoadComplete(tier, data)))
        .onErrorResume(throwable -> {
          log.warn("Background load of {} data for {} failed", tier, domain, throwable);
          return Mono.empty();
        })
        .cache();
    load.subscribe();
    return load;
  }

  private Mono<List<? extends TimelineEntry>> loadForTier(TimeRange domain, ResolutionTier tier,
                                                         CancellationToken token) {
    switch (tier) {
      case COARSE:
        return Mono.just(filterCoarse(domain));
      case MEDIUM:
        return loadMedium(domain, token).map(bins -> bins);
      default:
        return loadFine(domain, true).map(packets -> packets);
    }
  }

  /**
   * Queues up to {@code count} chunks on each side of the domain for speculative loading. Only
   * acts while the viewport is at the fine tier.
   */
  public void prefetchAdjacent(TimeRange domain, int count) {
    scheduler.schedule(() -> {
      if (chunkIndex == null || stateMachine.getCurrentTier() != ResolutionTier.FINE) {
        return;
      }
      prefetchQueue.enqueueAdjacent(chunkIndex, domain, count);
      prefetchQueue.process();
    });
  }

  public void prefetchAdjacent(TimeRange domain) {
    prefetchAdjacent(domain, cacheProperties.getPrefetchAdjacentChunks());
  }

  /**
   * Warms the given tier's data for the domain so that a later request for exactly that domain
   * and tier is served instantly.
   */
  public void prefetchResolution(TimeRange domain, ResolutionTier tier) {
    scheduler.schedule(() -> enqueueResolution(domain, tier));
  }

  private void enqueueResolution(TimeRange domain, ResolutionTier tier) {
    // coarse data is always resident
    if (provider == null || tier == null || tier == ResolutionTier.COARSE
        || tier == stateMachine.getCurrentTier()) {
      return;
    }
    final PrefetchKey key = new PrefetchKey(domain, tier);
    if (prefetchedResolutions.getIfPresent(key) != null
        || !resolutionPrefetchesInFlight.add(key)) {
      return;
    }
    log.debug("Viewport {} prefetching {} data for {}", viewportId, tier, domain);

    final PacketDataProvider dataProvider = provider;
    final Mono<? extends List<? extends TimelineEntry>> load = tier == ResolutionTier.MEDIUM ?
        fetchMedium(dataProvider, domain) : loadFine(domain, false);
    load
        .doOnNext(data -> {
          if (provider == dataProvider) {
            prefetchedResolutions.put(key, data);
            log.debug("Viewport {} prefetched {} {} entries for {}", viewportId, data.size(), tier,
                domain);
          }
        })
        .doOnError(throwable -> log.warn("Prefetch of {} data for {} failed", tier, domain,
            throwable))
        .onErrorResume(throwable -> Mono.empty())
        .doFinally(signal -> resolutionPrefetchesInFlight.remove(key))
        .subscribe();
  }

  public Mono<MemoryStats> getMemoryStats() {
    return Mono.fromCallable(() -> {
      final long coarseBytes = (long) coarseCache.size() * cacheProperties.getBinSizeEstimate();
      final long mediumBytes = (long) mediumCache.size() * cacheProperties.getBinSizeEstimate();
      final long detailRecords = chunkLoader.cachedRecords();
      final long detailBytes = detailRecords * cacheProperties.getRecordSizeEstimate();
      return new MemoryStats()
          .setCoarseCacheEntries(coarseCache.size())
          .setCoarseCacheSizeKb(Math.round(coarseBytes / 1024.0))
          .setMediumCacheEntries(mediumCache.size())
          .setDetailCacheChunks(chunkLoader.cachedChunks())
          .setDetailCacheRecords(detailRecords)
          .setDetailCacheSizeKb(Math.round(detailBytes / 1024.0))
          .setTotalSizeKb(Math.round((coarseBytes + mediumBytes + detailBytes) / 1024.0))
          .setLoadingChunks(chunkLoader.loadingChunks())
          .setPrefetchQueueLength(prefetchQueue.size())
          .setPrefetchedResolutions(prefetchedResolutions.estimatedSize())
          .setCurrentResolution(stateMachine.getCurrentTier())
          .setGeneration(generation);
    })
        .subscribeOn(scheduler);
  }

  /**
   * Drops every cache and in-flight result. The manager has to be initialized again before use.
   */
  public Mono<Void> clear() {
    return Mono.fromRunnable(() -> {
      resetState();
      log.info("Cleared viewport {}", viewportId);
    })
        .subscribeOn(scheduler)
        .then();
  }

  private void resetState() {
    if (currentToken != null) {
      currentToken.cancel();
      currentToken = null;
    }
    generation++;
    chunkLoader.clear();
    prefetchQueue.clear();
    prefetchedResolutions.invalidateAll();
    resolutionPrefetchesInFlight.clear();
    coarseCache = List.of();
    mediumCache = List.of();
    mediumCoverage = null;
    chunkIndex = null;
    provider = null;
    stateMachine.reset();
  }

  private boolean isLatest(long requestGeneration, ResolutionTier tier, TimeRange domain) {
    if (requestGeneration != generation) {
      log.debug("Discarding {} data for {}, generation {} superseded by {}", tier, domain,
          requestGeneration, generation);
      return false;
    }
    return true;
  }

  private CancellationToken renewToken(long requestGeneration) {
    if (currentToken != null) {
      currentToken.cancel();
    }
    currentToken = new CancellationToken(requestGeneration);
    return currentToken;
  }

  private Mono<List<AggregatedBin>> fetchMedium(PacketDataProvider dataProvider,
                                                TimeRange domain) {
    return Mono.defer(() -> dataProvider.getMediumAggregates(domain))
        .publishOn(scheduler)
        .onErrorMap(ProviderUnavailableException::wrap);
  }

  private Mono<List<AggregatedBin>> loadMedium(TimeRange domain, CancellationToken token) {
    final PacketDataProvider dataProvider = provider;
    notifyListeners(listener -> listener.onLoadingStart(ResolutionTier.MEDIUM));
    return token.guard(fetchMedium(dataProvider, domain))
        .doOnNext(bins -> {
          if (provider == dataProvider) {
            mediumCache = List.copyOf(bins);
            mediumCoverage = domain;
          }
        })
        .doOnSuccess(bins -> {
          if (bins == null && token.isCancelled()) {
            log.debug("Medium query for {} superseded by generation {}", domain, generation);
          }
        })
        .doFinally(signal -> notifyListeners(
            listener -> listener.onLoadingEnd(ResolutionTier.MEDIUM)));
  }

  /**
   * Fetches the domain's missing chunks concurrently and assembles the packets once all of them
   * have settled.
   */
  private Mono<List<PacketRecord>> loadFine(TimeRange domain, boolean interactive) {
    final List<Long> chunkIds = chunkIndex.chunkIdsOverlapping(domain);
    final List<Mono<Void>> fetches = chunkIds.stream()
        .filter(chunkId -> !chunkLoader.isCached(chunkId))
        .map(chunkLoader::load)
        .collect(Collectors.toList());
    log.debug("Viewport {} fine request {}: {} chunks needed, {} missing", viewportId, domain,
        chunkIds.size(), fetches.size());

    if (fetches.isEmpty()) {
      return Mono.fromCallable(() -> assemble(chunkIds, domain));
    }
    if (interactive) {
      notifyListeners(listener -> listener.onLoadingStart(ResolutionTier.FINE));
    }
    return Mono.when(fetches)
        .publishOn(scheduler)
        .doFinally(signal -> {
          if (interactive) {
            notifyListeners(listener -> listener.onLoadingEnd(ResolutionTier.FINE));
          }
        })
        .then(Mono.fromCallable(() -> assemble(chunkIds, domain)));
  }

  /**
   * Concatenates the cached chunks, keeps the packets within the domain and sorts them by
   * timestamp. Missing chunks contribute nothing.
   */
  private List<PacketRecord> assemble(List<Long> chunkIds, TimeRange domain) {
    final List<PacketRecord> packets = new ArrayList<>();
    for (Long chunkId : chunkIds) {
      final List<PacketRecord> chunk = chunkLoader.get(chunkId);
      if (chunk == null) {
        continue;
      }
      for (PacketRecord packet : chunk) {
        if (domain.contains(packet.getTimestamp())) {
          packets.add(packet);
        }
      }
    }
    packets.sort(Comparator.comparingLong(PacketRecord::getTimestamp));
    return packets;
  }

  private List<? extends TimelineEntry> immediateData(TimeRange domain, ResolutionTier tier) {
    if (tier == ResolutionTier.MEDIUM && mediumCoverage != null && mediumCoverage.covers(domain)) {
      return filterBins(mediumCache, domain);
    }
    if (tier == ResolutionTier.FINE) {
      final List<PacketRecord> cached = assemble(chunkIndex.chunkIdsOverlapping(domain), domain);
      if (!cached.isEmpty()) {
        return cached;
      }
    }
    // coarse data is always available as a stand-in
    return filterCoarse(domain);
  }

  private List<? extends TimelineEntry> prefetchedData(TimeRange domain, ResolutionTier tier) {
    if (tier == ResolutionTier.COARSE) {
      return null;
    }
    return prefetchedResolutions.getIfPresent(new PrefetchKey(domain, tier));
  }

  private List<AggregatedBin> filterCoarse(TimeRange domain) {
    return filterBins(coarseCache, domain);
  }

  private static List<AggregatedBin> filterBins(List<AggregatedBin> bins, TimeRange domain) {
    return bins.stream()
        .filter(bin -> domain.contains(bin.getTimestamp()))
        .collect(Collectors.toList());
  }

  private static DomainData domainData(List<? extends TimelineEntry> data, ResolutionTier tier,
                                       boolean fromCache, long requestGeneration) {
    return new DomainData()
        .setData(data)
        .setResolution(tier)
        .setFromCache(fromCache)
        .setGeneration(requestGeneration);
  }

  private PacketDataProvider requireProvider() {
    if (provider == null) {
      throw new IllegalStateException("Viewport " + viewportId + " is not initialized");
    }
    return provider;
  }

  private void notifyResolutionChange(ResolutionTier previous, TransitionInfo transition) {
    if (transition.isSwitchedResolution()) {
      log.info("Viewport {} switched resolution {} -> {}", viewportId, previous,
          transition.getResolution());
      notifyListeners(listener ->
          listener.onResolutionChange(previous, transition.getResolution(), transition));
    }
  }

  private void notifyListeners(Consumer<ResolutionListener> callback) {
    for (ResolutionListener listener : listeners) {
      try {
        callback.accept(listener);
      } catch (RuntimeException e) {
        log.warn("Resolution listener {} failed", listener, e);
      }
    }
  }
}
