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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A closed interval of dataset time, in microseconds.
 */
@Value
public class TimeRange {
  long start;
  long end;

  @JsonCreator
  public TimeRange(@JsonProperty("start") long start, @JsonProperty("end") long end) {
    if (end < start) {
      throw new IllegalArgumentException(
          String.format("Time range end %d is before start %d", end, start));
    }
    this.start = start;
    this.end = end;
  }

  public static TimeRange of(long start, long end) {
    return new TimeRange(start, end);
  }

  /**
   * @throws ArithmeticException if the span does not fit in a long
   */
  public long span() {
    return Math.subtractExact(end, start);
  }

  public boolean contains(long timestamp) {
    return timestamp >= start && timestamp <= end;
  }

  public boolean covers(TimeRange other) {
    return other.start >= start && other.end <= end;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + "]";
  }
}
