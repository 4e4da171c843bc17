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

package com.rackspace.timelens.app.aggregate;

import static com.rackspace.timelens.app.utils.DateTimeUtils.alignDown;

import com.rackspace.timelens.app.model.AggregatedBin;
import com.rackspace.timelens.app.model.PacketRecord;
import com.rackspace.timelens.app.model.ResolutionTier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collector;
import java.util.stream.Collectors;

public class BinCollectors {

  private BinCollectors() {
  }

  /**
   * Groups packets into bins of the given width per source, destination and flags, returning
   * the bins ordered by bin start.
   *
   * @param binWidth width of a bin in microseconds
   */
  public static Collector<PacketRecord, ?, List<AggregatedBin>> binning(long binWidth,
                                                                        ResolutionTier tier) {
    return Collectors.collectingAndThen(
        Collectors.groupingBy(
            packet -> new BinKey(alignDown(packet.getTimestamp(), binWidth),
                packet.getSrcIp(), packet.getDstIp(), packet.getFlags()),
            LinkedHashMap::new,
            binCollector(binWidth, tier)
        ),
        bins -> {
          final List<AggregatedBin> sorted = new ArrayList<>(bins.values());
          sorted.sort(Comparator.comparingLong(AggregatedBin::getTimestamp));
          return sorted;
        }
    );
  }

  static Collector<PacketRecord, AggregatedBin, AggregatedBin> binCollector(long binWidth,
                                                                            ResolutionTier tier) {
    return Collector.of(
        () -> new AggregatedBin()
            .setMinTimestamp(Long.MAX_VALUE)
            .setMaxTimestamp(Long.MIN_VALUE),
        (bin, packet) -> {
          bin.setSrcIp(packet.getSrcIp());
          bin.setDstIp(packet.getDstIp());
          bin.setFlags(packet.getFlags());
          bin.setCount(bin.getCount() + 1);
          bin.setTotalBytes(bin.getTotalBytes() + packet.getLength());
          bin.setMinTimestamp(Math.min(bin.getMinTimestamp(), packet.getTimestamp()));
          bin.setMaxTimestamp(Math.max(bin.getMaxTimestamp(), packet.getTimestamp()));
        },
        BinCollectors::combine,
        bin -> {
          final long binStart = alignDown(bin.getMinTimestamp(), binWidth);
          bin.setTimestamp(binStart);
          bin.setBinEnd(binStart > Long.MAX_VALUE - binWidth ?
              Long.MAX_VALUE : binStart + binWidth);
          bin.setTier(tier);
          return bin;
        }
    );
  }

  private static AggregatedBin combine(AggregatedBin agg, AggregatedBin in) {
    if (agg.getSrcIp() == null) {
      agg.setSrcIp(in.getSrcIp());
      agg.setDstIp(in.getDstIp());
      agg.setFlags(in.getFlags());
    }
    agg.setCount(agg.getCount() + in.getCount());
    agg.setTotalBytes(agg.getTotalBytes() + in.getTotalBytes());
    agg.setMinTimestamp(Math.min(agg.getMinTimestamp(), in.getMinTimestamp()));
    agg.setMaxTimestamp(Math.max(agg.getMaxTimestamp(), in.getMaxTimestamp()));
    return agg;
  }
}
