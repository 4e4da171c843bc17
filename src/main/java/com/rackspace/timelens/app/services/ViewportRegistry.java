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

import com.rackspace.timelens.app.config.AppProperties;
import com.rackspace.timelens.app.model.AggregatedBin;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Tracks the open viewports. Viewports never share caches, closing one clears its manager.
 */
@Service
@Slf4j
public class ViewportRegistry {

  private final Map<String, ResolutionManager> viewports = new ConcurrentHashMap<>();
  private final ResolutionManagerFactory resolutionManagerFactory;
  private final AppProperties appProperties;

  @Autowired
  public ViewportRegistry(ResolutionManagerFactory resolutionManagerFactory,
                          AppProperties appProperties) {
    this.resolutionManagerFactory = resolutionManagerFactory;
    this.appProperties = appProperties;
  }

  /**
   * Opens the viewport, or re-initializes it when already open, against the given dataset.
   *
   * @return the coarse bins of the whole dataset
   */
  public Mono<List<AggregatedBin>> open(String viewportId, PacketDataProvider provider) {
    return Mono.fromCallable(() -> viewports.computeIfAbsent(viewportId, this::create))
        .flatMap(manager -> manager.init(provider));
  }

  private ResolutionManager create(String viewportId) {
    if (viewports.size() >= appProperties.getMaxViewports()) {
      throw new ViewportLimitException(appProperties.getMaxViewports());
    }
    log.info("Opening viewport {}", viewportId);
    return resolutionManagerFactory.create(viewportId);
  }

  /**
   * @throws ViewportNotFoundException if the viewport is not open
   */
  public ResolutionManager get(String viewportId) {
    final ResolutionManager manager = viewports.get(viewportId);
    if (manager == null) {
      throw new ViewportNotFoundException(viewportId);
    }
    return manager;
  }

  public Set<String> getViewportIds() {
    return Set.copyOf(viewports.keySet());
  }

  public Mono<Void> close(String viewportId) {
    return Mono.defer(() -> {
      final ResolutionManager manager = viewports.remove(viewportId);
      if (manager == null) {
        return Mono.error(new ViewportNotFoundException(viewportId));
      }
      log.info("Closing viewport {}", viewportId);
      return manager.clear();
    });
  }

  /**
   * Closes every open viewport.
   *
   * @return the number of viewports closed
   */
  public Mono<Integer> closeAll() {
    return Mono.defer(() -> {
      final List<ResolutionManager> closing = new ArrayList<>();
      for (String viewportId : getViewportIds()) {
        final ResolutionManager manager = viewports.remove(viewportId);
        if (manager != null) {
          closing.add(manager);
        }
      }
      return Flux.fromIterable(closing)
          .flatMap(ResolutionManager::clear)
          .then(Mono.just(closing.size()));
    });
  }
}
