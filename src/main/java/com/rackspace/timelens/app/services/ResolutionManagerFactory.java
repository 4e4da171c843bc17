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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.rackspace.timelens.app.config.CacheProperties;
import com.rackspace.timelens.app.config.ResolutionProperties;
import com.rackspace.timelens.app.model.TimelineEntry;
import com.rackspace.timelens.app.resolution.PrefetchKey;
import com.rackspace.timelens.app.utils.TimestampProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

/**
 * Creates independent resolution managers, one per viewport. Each gets its own caches; only the
 * session scheduler and the meter registry are shared.
 */
@Component
public class ResolutionManagerFactory {

  private final ResolutionProperties resolutionProperties;
  private final CacheProperties cacheProperties;
  private final Scheduler sessionScheduler;
  private final TimestampProvider timestampProvider;
  private final MeterRegistry meterRegistry;

  @Autowired
  public ResolutionManagerFactory(ResolutionProperties resolutionProperties,
                                  CacheProperties cacheProperties,
                                  Scheduler sessionScheduler,
                                  TimestampProvider timestampProvider,
                                  MeterRegistry meterRegistry) {
    this.resolutionProperties = resolutionProperties;
    this.cacheProperties = cacheProperties;
    this.sessionScheduler = sessionScheduler;
    this.timestampProvider = timestampProvider;
    this.meterRegistry = meterRegistry;
  }

  public ResolutionManager create(String viewportId) {
    final ResolutionManager manager = new ResolutionManager(viewportId, resolutionProperties,
        cacheProperties, sessionScheduler, timestampProvider,
        prefetchedResolutionsCache(viewportId), meterRegistry);
    manager.addListener(new MeteredResolutionListener(meterRegistry));
    return manager;
  }

  private Cache<PrefetchKey, List<? extends TimelineEntry>> prefetchedResolutionsCache(
      String viewportId) {
    final Cache<PrefetchKey, List<? extends TimelineEntry>> cache = Caffeine
        .newBuilder()
        .maximumSize(cacheProperties.getPrefetchedResolutionCapacity())
        .recordStats()
        .build();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "prefetchedResolutions",
        "viewport", viewportId);
    return cache;
  }
}
