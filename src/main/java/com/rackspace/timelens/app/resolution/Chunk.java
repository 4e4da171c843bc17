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

import com.rackspace.timelens.app.model.TimeRange;
import lombok.Value;

/**
 * A time-aligned unit of fine data covering {@code [start, end)}, identified by its start.
 */
@Value
public class Chunk {
  long start;
  long end;

  public long getId() {
    return start;
  }

  public TimeRange toRange() {
    return TimeRange.of(start, end);
  }
}
