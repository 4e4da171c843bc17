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

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import lombok.Data;
import reactor.core.publisher.Mono;

/**
 * Result of a non-blocking domain request: the best data available right now, plus the refined
 * data when a background load was started.
 */
@Data
public class ImmediateData {
  List<? extends TimelineEntry> data;
  ResolutionTier resolution;
  boolean loading;
  /**
   * Completes with the refined data, or empty when nothing was loaded, the load failed or it was
   * superseded by a newer request.
   */
  @JsonIgnore
  Mono<List<? extends TimelineEntry>> loadingFuture = Mono.empty();
  TransitionInfo transitionInfo;
  long generation;
}
