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

import lombok.Getter;

/**
 * Thrown when a chunk id is used that is not part of the {@link ChunkIndex}.
 */
public class StaleChunkException extends IllegalArgumentException {

  @Getter
  private final long chunkId;

  public StaleChunkException(long chunkId) {
    super("Chunk " + chunkId + " is not part of the chunk index");
    this.chunkId = chunkId;
  }
}
