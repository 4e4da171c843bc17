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

package com.rackspace.timelens.app.resolution;

import static com.rackspace.timelens.app.utils.DateTimeUtils.alignDown;

import com.rackspace.timelens.app.model.TimeRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable map from aligned chunk id to chunk bounds covering the full dataset extent.
 */
@Slf4j
public class ChunkIndex {

  public static final int DEFAULT_MAX_CHUNKS = 100_000;

  private final NavigableMap<Long, Chunk> chunks;
  @Getter
  private final long chunkWidth;
  @Getter
  private final TimeRange extent;

  private ChunkIndex(NavigableMap<Long, Chunk> chunks, long chunkWidth, TimeRange extent) {
    this.chunks = Collections.unmodifiableNavigableMap(chunks);
    this.chunkWidth = chunkWidth;
    this.extent = extent;
  }

  public static ChunkIndex build(TimeRange extent, long chunkWidth) {
    return build(extent, chunkWidth, DEFAULT_MAX_CHUNKS);
  }

  /**
   * @throws IllegalArgumentException if covering the extent takes more than {@code maxChunks}
   * chunks
   */
  public static ChunkIndex build(TimeRange extent, long chunkWidth, int maxChunks) {
    if (chunkWidth <= 0) {
      throw new IllegalArgumentException("Chunk width must be positive, was " + chunkWidth);
    }
    final long first = alignDown(extent.getStart(), chunkWidth);
    if (first > extent.getStart()) {
      // aligning wrapped around Long.MIN_VALUE
      throw new IllegalArgumentException("Time extent " + extent + " cannot be split into chunks");
    }
    final long chunkCount;
    try {
      chunkCount = Math.subtractExact(extent.getEnd(), first) / chunkWidth + 1;
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Time extent " + extent + " is too wide to index", e);
    }
    if (chunkCount > maxChunks) {
      throw new IllegalArgumentException(String.format(
          "Time extent %s needs %d chunks of %dus, more than the limit of %d",
          extent, chunkCount, chunkWidth, maxChunks));
    }

    final NavigableMap<Long, Chunk> chunks = new TreeMap<>();
    for (long i = 0; i < chunkCount; i++) {
      final long chunkStart = first + i * chunkWidth;
      // the last chunk is cut short rather than overflow
      final long chunkEnd = chunkStart > Long.MAX_VALUE - chunkWidth ?
          Long.MAX_VALUE : chunkStart + chunkWidth;
      chunks.put(chunkStart, new Chunk(chunkStart, chunkEnd));
    }
    log.debug("Built chunk index with {} chunks of {}us over {}", chunks.size(), chunkWidth,
        extent);
    return new ChunkIndex(chunks, chunkWidth, extent);
  }

  public boolean contains(long chunkId) {
    return chunks.containsKey(chunkId);
  }

  /**
   * @throws StaleChunkException if the id is not part of this index
   */
  public Chunk get(long chunkId) {
    final Chunk chunk = chunks.get(chunkId);
    if (chunk == null) {
      throw new StaleChunkException(chunkId);
    }
    return chunk;
  }

  public int size() {
    return chunks.size();
  }

  public long chunkIdFor(long timestamp) {
    return alignDown(timestamp, chunkWidth);
  }

  /**
   * Ids of the indexed chunks overlapping the closed domain, ascending. Ids outside the dataset
   * extent are skipped.
   */
  public List<Long> chunkIdsOverlapping(TimeRange domain) {
    final long start = Math.max(domain.getStart(), extent.getStart());
    final long end = Math.min(domain.getEnd(), extent.getEnd());
    if (start > end) {
      return List.of();
    }
    final long first = chunkIdFor(start);
    final long last = chunkIdFor(end);
    final List<Long> ids = new ArrayList<>(chunks.subMap(first, true, last, true).keySet());
    log.trace("Domain {} maps to chunks {}", domain, ids);
    return ids;
  }

  /**
   * Up to {@code count} indexed chunk ids immediately before the first and after the last of the
   * given ids, nearest first.
   */
  public List<Long> adjacentTo(List<Long> chunkIds, int count) {
    if (chunkIds.isEmpty() || count <= 0) {
      return List.of();
    }
    final long min = Collections.min(chunkIds);
    final long max = Collections.max(chunkIds);

    final List<Long> adjacent = new ArrayList<>(count * 2);
    for (int i = 1; i <= count; i++) {
      final long previous = min - i * chunkWidth;
      if (contains(previous)) {
        adjacent.add(previous);
      }
    }
    for (int i = 1; i <= count; i++) {
      final long next = max + i * chunkWidth;
      if (contains(next)) {
        adjacent.add(next);
      }
    }
    return adjacent;
  }
}
