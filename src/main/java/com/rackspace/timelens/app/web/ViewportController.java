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


package com.rackspace.timelens.app.web;

import static com.rackspace.timelens.app.validation.DomainRequestValidator.validateCount;
import static com.rackspace.timelens.app.validation.DomainRequestValidator.validateDomain;
import static com.rackspace.timelens.app.validation.DomainRequestValidator.validateTier;

import com.rackspace.timelens.app.config.CacheProperties;
import com.rackspace.timelens.app.model.AggregatedBin;
import com.rackspace.timelens.app.model.DomainData;
import com.rackspace.timelens.app.model.ImmediateData;
import com.rackspace.timelens.app.model.MemoryStats;
import com.rackspace.timelens.app.model.ResolutionTier;
import com.rackspace.timelens.app.model.TimeRange;
import com.rackspace.timelens.app.services.DatasetService;
import com.rackspace.timelens.app.services.ResolutionManager;
import com.rackspace.timelens.app.services.ViewportRegistry;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/viewports")
public class ViewportController {

  private final ViewportRegistry viewportRegistry;
  private final DatasetService datasetService;
  private final CacheProperties cacheProperties;

  @Autowired
  public ViewportController(ViewportRegistry viewportRegistry, DatasetService datasetService,
                            CacheProperties cacheProperties) {
    this.viewportRegistry = viewportRegistry;
    this.datasetService = datasetService;
    this.cacheProperties = cacheProperties;
  }

  /**
   * Opens the viewport against the active dataset and returns its coarse overview.
   */
  @PostMapping("/{viewportId}")
  public Mono<List<AggregatedBin>> open(@PathVariable String viewportId) {
    return datasetService.openViewport(viewportId);
  }

  /**
   * Waits for the data of the resolved tier. Responds with no content when a newer request for
   * the same viewport superseded this one.
   */
  @GetMapping("/{viewportId}/data")
  public Mono<ResponseEntity<DomainData>> getData(@PathVariable String viewportId,
                                                  @RequestParam String start,
                                                  @RequestParam String end) {
    return Mono.fromCallable(() -> validateDomain(start, end))
        .flatMap(domain -> viewportRegistry.get(viewportId).getDataForDomain(domain))
        .map(ResponseEntity::ok)
        .defaultIfEmpty(ResponseEntity.noContent().build());
  }

  @GetMapping("/{viewportId}/preview")
  public Mono<ImmediateData> preview(@PathVariable String viewportId,
                                     @RequestParam String start,
                                     @RequestParam String end) {
    return Mono.fromCallable(() -> validateDomain(start, end))
        .flatMap(domain -> viewportRegistry.get(viewportId).getDataForDomainNonBlocking(domain));
  }

  @PostMapping("/{viewportId}/prefetch")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public Mono<Void> prefetchAdjacent(@PathVariable String viewportId,
                                     @RequestParam String start,
                                     @RequestParam String end,
                                     @RequestParam(required = false) Integer count) {
    return Mono.fromRunnable(() -> {
      final TimeRange domain = validateDomain(start, end);
      final int chunks = validateCount(count, cacheProperties.getPrefetchAdjacentChunks());
      viewportRegistry.get(viewportId).prefetchAdjacent(domain, chunks);
    });
  }

  @PostMapping("/{viewportId}/prefetch/{tier}")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public Mono<Void> prefetchResolution(@PathVariable String viewportId,
                                       @PathVariable String tier,
                                       @RequestParam String start,
                                       @RequestParam String end) {
    return Mono.fromRunnable(() -> {
      final TimeRange domain = validateDomain(start, end);
      final ResolutionTier resolutionTier = validateTier(tier);
      final ResolutionManager manager = viewportRegistry.get(viewportId);
      manager.prefetchResolution(domain, resolutionTier);
    });
  }

  @GetMapping("/{viewportId}/stats")
  public Mono<MemoryStats> getStats(@PathVariable String viewportId) {
    return Mono.fromCallable(() -> viewportRegistry.get(viewportId))
        .flatMap(ResolutionManager::getMemoryStats);
  }

  @DeleteMapping("/{viewportId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public Mono<Void> close(@PathVariable String viewportId) {
    return viewportRegistry.close(viewportId);
  }
}
