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

import java.util.List;
import lombok.Data;

/**
 * Result of a blocking domain request.
 */
@Data
public class DomainData {
  List<? extends TimelineEntry> data;
  ResolutionTier resolution;
  /**
   * True when everything was served from resident caches without calling the provider.
   */
  boolean fromCache;
  /**
   * Render generation of the request that produced this result.
   */
  long generation;
}
