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

import lombok.Data;

/**
 * Common shape of everything placed on the timeline. Each variant reports the
 * {@link ResolutionTier} it belongs to, which is also serialized as its tag.
 */
@Data
public abstract class TimelineEntry {
  /**
   * Microseconds since epoch. For bins this is the start of the bin.
   */
  long timestamp;

  public abstract ResolutionTier getTier();
}
