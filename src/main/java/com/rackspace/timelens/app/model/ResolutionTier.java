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

package com.rackspace.timelens.app.model;

/**
 * Resolution levels of timeline data, ordered from coarsest to finest.
 */
public enum ResolutionTier {
  /**
   * Whole-dataset pre-aggregated bins, always resident after init.
   */
  COARSE,
  /**
   * Domain-scoped pre-aggregated bins.
   */
  MEDIUM,
  /**
   * Raw per-packet detail, loaded in chunks.
   */
  FINE;

  public ResolutionTier finer() {
    return this == COARSE ? MEDIUM : FINE;
  }

  public ResolutionTier coarser() {
    return this == FINE ? MEDIUM : COARSE;
  }

  public boolean isFinerThan(ResolutionTier other) {
    return ordinal() > other.ordinal();
  }
}
