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

import com.rackspace.timelens.app.model.TimeRange;
import com.rackspace.timelens.app.resolution.ChunkIndex;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * FIFO of chunk ids to load speculatively. Entries are loaded one at a time with an idle yield on
 * the session scheduler between them, so interactive requests queued on the scheduler run first.
 * <p>
 * Must only be called on the session scheduler.
 * </p>
 */
@Slf4j
public class PrefetchQueue {

  private final LinkedHashSet<Long> queue = new LinkedHashSet<>();
  private final ChunkLoader chunkLoader;
  private final Scheduler scheduler;
  private final Duration yield;
  private boolean draining;

  public PrefetchQueue(ChunkLoader chunkLoader, Scheduler scheduler, Duration yield) {
    this.chunkLoader = chunkLoader;
    this.scheduler = scheduler;
    this.yield = yield;
  }

  /**
   * Queues up to {@code count} chunks on each side of the chunks in view.
   *
   * @return number of chunk ids added to the queue
   */
  public int enqueueAdjacent(ChunkIndex chunkIndex, TimeRange domain, int count) {
    final List<Long> inView = chunkIndex.chunkIdsOverlapping(domain);
    int added = 0;
    for (Long chunkId : chunkIndex.adjacentTo(inView, count)) {
      if (!chunkLoader.isCachedOrLoading(chunkId) && queue.add(chunkId)) {
        added++;
      }
    }
    log.trace("Queued {} adjacent chunks for {}, queue length {}", added, domain, queue.size());
    return added;
  }

  /**
   * Starts draining the queue unless a drain is already running.
   */
  public void process() {
    if (draining || queue.isEmpty()) {
      return;
    }
    draining = true;
    drainNext();
  }

  private void drainNext() {
    final Iterator<Long> head = queue.iterator();
    if (!head.hasNext()) {
      draining = false;
      return;
    }
    final long chunkId = head.next();
    head.remove();

    final Mono<Void> step = chunkLoader.isCachedOrLoading(chunkId) ?
        Mono.empty() : chunkLoader.load(chunkId);
    step
        .then(Mono.delay(yield, scheduler))
        .subscribe(
            tick -> drainNext(),
            throwable -> {
              log.warn("Prefetch of chunk {} failed", chunkId, throwable);
              scheduler.schedule(this::drainNext);
            });
  }

  public boolean isDraining() {
    return draining;
  }

  public boolean contains(long chunkId) {
    return queue.contains(chunkId);
  }

  public int size() {
    return queue.size();
  }

  public void clear() {
    queue.clear();
  }
}
