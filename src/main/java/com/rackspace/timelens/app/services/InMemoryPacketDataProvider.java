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

import static com.rackspace.timelens.app.utils.DateTimeUtils.toMicros;

import com.rackspace.timelens.app.aggregate.BinCollectors;
import com.rackspace.timelens.app.model.AggregatedBin;
import com.rackspace.timelens.app.model.PacketRecord;
import com.rackspace.timelens.app.model.ResolutionTier;
import com.rackspace.timelens.app.model.TimeRange;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Serves a dataset held entirely in memory, computing the aggregates on demand. Packets are kept
 * sorted so range lookups are binary searches.
 */
@Slf4j
public class InMemoryPacketDataProvider implements PacketDataProvider {

  private final List<PacketRecord> packets;
  private final long coarseBinWidth;
  private final long mediumBinWidth;
  private final TimeRange timeExtent;

  public InMemoryPacketDataProvider(List<PacketRecord> packets, Duration coarseBinWidth,
                                    Duration mediumBinWidth) {
    final List<PacketRecord> sorted = new ArrayList<>(packets);
    sorted.sort(Comparator.comparingLong(PacketRecord::getTimestamp));
    this.packets = List.copyOf(sorted);
    this.coarseBinWidth = toMicros(coarseBinWidth);
    this.mediumBinWidth = toMicros(mediumBinWidth);
    this.timeExtent = this.packets.isEmpty() ? TimeRange.of(0, 0) :
        TimeRange.of(this.packets.get(0).getTimestamp(),
            this.packets.get(this.packets.size() - 1).getTimestamp());
  }

  public int size() {
    return packets.size();
  }

  @Override
  public TimeRange getTimeExtent() {
    return timeExtent;
  }

  @Override
  public Mono<List<AggregatedBin>> getCoarseAggregates() {
    return Mono.fromCallable(() ->
        packets.stream().collect(BinCollectors.binning(coarseBinWidth, ResolutionTier.COARSE)));
  }

  @Override
  public Mono<List<AggregatedBin>> getMediumAggregates(TimeRange domain) {
    return Mono.fromCallable(() ->
        slice(domain.getStart(), domain.getEnd(), true).stream()
            .collect(BinCollectors.binning(mediumBinWidth, ResolutionTier.MEDIUM)));
  }

  @Override
  public Mono<List<PacketRecord>> getDetailData(TimeRange range, int limit) {
    return Mono.fromCallable(() -> {
      final List<PacketRecord> slice = slice(range.getStart(), range.getEnd(), false);
      if (slice.size() > limit) {
        log.debug("Truncating {} packets in {} to limit {}", slice.size(), range, limit);
        return List.copyOf(slice.subList(0, limit));
      }
      return slice;
    });
  }

  private List<PacketRecord> slice(long start, long end, boolean endInclusive) {
    final int from = firstIndexAtOrAfter(start);
    final int to;
    if (!endInclusive) {
      to = firstIndexAtOrAfter(end);
    } else if (end == Long.MAX_VALUE) {
      to = packets.size();
    } else {
      to = firstIndexAtOrAfter(end + 1);
    }
    return from >= to ? List.of() : packets.subList(from, to);
  }

  private int firstIndexAtOrAfter(long timestamp) {
    int low = 0;
    int high = packets.size();
    while (low < high) {
      final int mid = (low + high) >>> 1;
      if (packets.get(mid).getTimestamp() < timestamp) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }
}
