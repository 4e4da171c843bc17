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

package com.rackspace.timelens.app.utils;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Helpers for the dataset's native time unit, microseconds since epoch.
 */
public class DateTimeUtils {

  public static final Pattern EPOCH_MICROS_PATTERN = Pattern.compile("-?\\d{1,19}");

  private DateTimeUtils() {
  }

  public static long toMicros(Duration duration) {
    return TimeUnit.NANOSECONDS.toMicros(duration.toNanos());
  }

  public static long toMicros(Instant instant) {
    return Math.addExact(
        Math.multiplyExact(instant.getEpochSecond(), 1_000_000L),
        instant.getNano() / 1_000L);
  }

  /**
   * Aligns the timestamp down to a multiple of width, also for negative timestamps.
   */
  public static long alignDown(long timestamp, long width) {
    return Math.floorDiv(timestamp, width) * width;
  }

  /**
   * Checks if the time is valid epoch microseconds.
   */
  public static boolean isValidEpochMicros(String time) {
    return EPOCH_MICROS_PATTERN.matcher(time).matches();
  }

  /**
   * Checks if the string time is valid Instant in UTC.
   */
  public static boolean isValidInstantInstance(String time) {
    try {
      Instant.parse(time);
      return true;
    } catch (DateTimeParseException dateTimeParseException) {
      return false;
    }
  }

  /**
   * Parses either epoch microseconds or an ISO-8601 instant into epoch microseconds.
   */
  public static long parseMicros(String time) {
    if (StringUtils.isBlank(time)) {
      throw new IllegalArgumentException("Time value is required");
    }
    if (isValidEpochMicros(time)) {
      return Long.parseLong(time);
    } else if (isValidInstantInstance(time)) {
      return toMicros(Instant.parse(time));
    } else {
      throw new IllegalArgumentException("Invalid time format: " + time);
    }
  }

  public static String formatSpan(long micros) {
    if (micros >= 60_000_000L) {
      return String.format(Locale.ROOT, "%.1fmin", micros / 60_000_000.0);
    }
    return String.format(Locale.ROOT, "%.3fs", micros / 1_000_000.0);
  }
}
