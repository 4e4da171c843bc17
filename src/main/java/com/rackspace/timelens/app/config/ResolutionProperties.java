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

package com.rackspace.timelens.app.config;

import com.rackspace.timelens.app.config.configValidator.TierThresholds;
import java.time.Duration;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning of the tier decision. The percentages are empirical UI values, so they stay configurable.
 */
@ConfigurationProperties("timelens.resolution")
@Component
@Data
@Validated
@TierThresholds
public class ResolutionProperties {

  /**
   * Visible spans wider than this use the coarse tier.
   */
  @NotNull
  Duration coarseThreshold = Duration.ofHours(2);

  /**
   * Visible spans narrower than this use the fine tier, anything between the two thresholds
   * uses the medium tier.
   */
  @NotNull
  Duration mediumThreshold = Duration.ofMinutes(1);

  /**
   * Fraction of a threshold the span has to move past before the current tier is left.
   */
  @DecimalMin("0.0")
  @DecimalMax("0.5")
  double hysteresis = 0.05;

  /**
   * Half-width of the transition zone around each threshold, as a fraction of the threshold.
   */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  double transitionZone = 0.20;

  /**
   * How far above the next finer threshold, as a fraction of it, to start prefetching while
   * zooming in.
   */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  double prefetchZone = 0.35;

  /**
   * Minimum wall-clock time between two tier switches.
   */
  @NotNull
  Duration minSwitchInterval = Duration.ofMillis(50);

  /**
   * Relative span change below which the zoom is considered stable.
   */
  @DecimalMin("0.0")
  @DecimalMax("0.5")
  double zoomTolerance = 0.02;

  /**
   * When set, non-blocking requests schedule the suggested resolution prefetch themselves.
   */
  boolean autoPrefetch = true;
}
