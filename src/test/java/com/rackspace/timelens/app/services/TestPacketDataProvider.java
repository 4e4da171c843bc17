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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicInteger;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Wraps the in-memory provider to count calls, delay them, hold medium queries back or fail
 * them.
 */
class TestPacketDataProvider implements PacketDataProvider {

  static final long SECOND = 1_000_000L;

  final InMemoryPacketDataProvider delegate;
  final AtomicInteger coarseCalls = new AtomicInteger();
  final AtomicInteger mediumCalls = new AtomicInteger();
  final Map<TimeRange, AtomicInteger> detailCalls = new ConcurrentHashMap<>();
  final Set<Long> failingChunks = new CopyOnWriteArraySet<>();

  volatile Duration detailDelay = Duration.ZERO;
  volatile boolean failMedium;
  volatile boolean failCoarse;
  private volatile Sinks.Empty<Void> mediumGate;

  TestPacketDataProvider(List<PacketRecord> packets) {
    this.delegate = new InMemoryPacketDataProvider(packets, Duration.ofMinutes(1),
        Duration.ofSeconds(1));
  }

  /**
   * One packet per second over the closed range, alternating between two flows.
   */
  static TestPacketDataProvider everySecond(long start, long end) {
    return new TestPacketDataProvider(packetsEverySecond(start, end));
  }

  static List<PacketRecord> packetsEverySecond(long start, long end) {
    final List<PacketRecord> packets = new ArrayList<>();
    for (long ts = start; ts <= end; ts += SECOND) {
      packets.add(packet(ts, (ts / SECOND) % 2 == 0 ? "10.0.0.1" : "10.0.0.7", 100));
    }
    return packets;
  }

  static PacketRecord packet(long timestamp, String srcIp, int length) {
    final PacketRecord packet = new PacketRecord()
        .setSrcIp(srcIp)
        .setDstIp("192.168.1.10")
        .setSrcPort(40_000)
        .setDstPort(443)
        .setProtocol("TCP")
        .setFlags("ACK")
        .setLength(length);
    packet.setTimestamp(timestamp);
    return packet;
  }

  void holdMedium() {
    mediumGate = Sinks.empty();
  }

  void releaseMedium() {
    mediumGate.tryEmitEmpty();
  }

  int detailCallsFor(long start, long end) {
    final AtomicInteger calls = detailCalls.get(TimeRange.of(start, end));
    return calls == null ? 0 : calls.get();
  }

  int totalDetailCalls() {
    return detailCalls.values().stream().mapToInt(AtomicInteger::get).sum();
  }

  @Override
  public TimeRange getTimeExtent() {
    return delegate.getTimeExtent();
  }

  @Override
  public Mono<List<AggregatedBin>> getCoarseAggregates() {
    coarseCalls.incrementAndGet();
    if (failCoarse) {
      return Mono.error(new IllegalStateException("coarse aggregates unavailable"));
    }
    return delegate.getCoarseAggregates();
  }

  @Override
  public Mono<List<AggregatedBin>> getMediumAggregates(TimeRange domain) {
    mediumCalls.incrementAndGet();
    if (failMedium) {
      return Mono.error(new IllegalStateException("medium aggregates unavailable"));
    }
    final Sinks.Empty<Void> gate = mediumGate;
    final Mono<List<AggregatedBin>> result = delegate.getMediumAggregates(domain);
    return gate == null ? result : gate.asMono().then(result);
  }

  @Override
  public Mono<List<PacketRecord>> getDetailData(TimeRange range, int limit) {
    detailCalls.computeIfAbsent(range, key -> new AtomicInteger()).incrementAndGet();
    if (failingChunks.contains(range.getStart())) {
      return Mono.error(new IllegalStateException("chunk " + range.getStart() + " unreadable"));
    }
    final Mono<List<PacketRecord>> result = delegate.getDetailData(range, limit);
    return detailDelay.isZero() ? result : result.delayElement(detailDelay);
  }
}
