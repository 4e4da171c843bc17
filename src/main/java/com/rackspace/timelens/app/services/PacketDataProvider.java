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

import com.rackspace.timelens.app.model.AggregatedBin;
import com.rackspace.timelens.app.model.PacketRecord;
import com.rackspace.timelens.app.model.TimeRange;
import java.util.List;
import reactor.core.publisher.Mono;

/**
 * Read-only source of a packet-capture dataset at every resolution. Implementations own
 * persistence, aggregation and timeouts; failures are signalled as errors of the returned
 * {@link Mono}.
 */
public interface PacketDataProvider {

  /**
   * @return the timestamps of the first and last packet of the dataset
   */
  TimeRange getTimeExtent();

  /**
   * @return whole-dataset coarse bins ordered by bin start
   */
  Mono<List<AggregatedBin>> getCoarseAggregates();

  /**
   * @return medium bins whose start lies within the closed domain, ordered by bin start
   */
  Mono<List<AggregatedBin>> getMediumAggregates(TimeRange domain);

  /**
   * @param range half-open range, packets at {@code range.getEnd()} are excluded
   * @param limit maximum number of packets to return
   * @return packets ordered by timestamp
   */
  Mono<List<PacketRecord>> getDetailData(TimeRange range, int limit);
}
