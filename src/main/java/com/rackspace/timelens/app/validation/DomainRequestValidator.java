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


package com.rackspace.timelens.app.validation;

import com.rackspace.timelens.app.model.PacketRecord;
import com.rackspace.timelens.app.model.ResolutionTier;
import com.rackspace.timelens.app.model.TimeRange;
import com.rackspace.timelens.app.utils.DateTimeUtils;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.springframework.util.StringUtils;

public class DomainRequestValidator {

  private DomainRequestValidator() {
  }

  /**
   * Parses the visible domain from epoch microseconds or ISO-8601 instants.
   */
  public static TimeRange validateDomain(String start, String end) {
    final long startMicros = DateTimeUtils.parseMicros(start);
    final long endMicros = DateTimeUtils.parseMicros(end);
    if (endMicros < startMicros) {
      throw new IllegalArgumentException("end must not be before start");
    }
    final TimeRange domain = TimeRange.of(startMicros, endMicros);
    try {
      domain.span();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Time range " + domain + " is too wide", e);
    }
    return domain;
  }

  public static ResolutionTier validateTier(String tier) {
    if (!StringUtils.hasText(tier)) {
      throw new IllegalArgumentException("tier is required");
    }
    try {
      return ResolutionTier.valueOf(tier.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown resolution tier: " + tier);
    }
  }

  public static int validateCount(Integer count, int defaultCount) {
    if (count == null) {
      return defaultCount;
    }
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative");
    }
    return count;
  }

  public static void validateRecords(List<PacketRecord> records) {
    if (records == null) {
      throw new IllegalArgumentException("Packet records are required");
    }
    if (records.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("Packet records must not contain null entries");
    }
  }
}
