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
import com.rackspace.timelens.app.model.DatasetSummary;
import com.rackspace.timelens.app.model.PacketRecord;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Holds the active packet dataset. Loading a new dataset closes every open viewport since their
 * chunk indexes and caches were built for the previous one.
 */
@Service
@Slf4j
public class DatasetService {

  private final AtomicReference<InMemoryPacketDataProvider> activeDataset;
  private final ViewportRegistry viewportRegistry;
  private final AppProperties appProperties;

  @Autowired
  public DatasetService(ViewportRegistry viewportRegistry, AppProperties appProperties) {
    this.viewportRegistry = viewportRegistry;
    this.appProperties = appProperties;
    this.activeDataset = new AtomicReference<>(newProvider(List.of()));
  }

  public Mono<DatasetSummary> load(List<PacketRecord> records) {
    if (records == null) {
      return Mono.error(new IllegalArgumentException("Packet records are required"));
    }
    return Mono.fromCallable(() -> newProvider(records))
        // sorting a large capture should not hold up the event loop
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(provider -> {
          activeDataset.set(provider);
          log.info("Loaded dataset of {} packets spanning {}", provider.size(),
              provider.getTimeExtent());
          return viewportRegistry.closeAll()
              .map(closed -> summaryOf(provider).setClosedViewports(closed));
        });
  }

  public DatasetSummary getSummary() {
    return summaryOf(activeDataset.get());
  }

  public PacketDataProvider getActiveDataset() {
    return activeDataset.get();
  }

  /**
   * Opens the viewport against the active dataset.
   */
  public Mono<List<AggregatedBin>> openViewport(String viewportId) {
    return viewportRegistry.open(viewportId, activeDataset.get());
  }

  private InMemoryPacketDataProvider newProvider(List<PacketRecord> records) {
    return new InMemoryPacketDataProvider(records, appProperties.getCoarseBinWidth(),
        appProperties.getMediumBinWidth());
  }

  private static DatasetSummary summaryOf(InMemoryPacketDataProvider provider) {
    return new DatasetSummary()
        .setPacketCount(provider.size())
        .setTimeExtent(provider.getTimeExtent());
  }
}
