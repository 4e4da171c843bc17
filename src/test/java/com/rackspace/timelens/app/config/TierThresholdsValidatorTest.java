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

import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.timelens.app.config.configValidator.ConcreteTierThresholdsValidator;
import java.time.Duration;
import org.junit.jupiter.api.Test;

public class TierThresholdsValidatorTest {

  ConcreteTierThresholdsValidator validator = new ConcreteTierThresholdsValidator();

  @Test
  public void defaults() {
    assertThat(validator.isValid(new ResolutionProperties(), null)).isTrue();
  }

  @Test
  public void mediumNotBelowCoarse() {
    ResolutionProperties properties = new ResolutionProperties()
        .setCoarseThreshold(Duration.ofMinutes(1))
        .setMediumThreshold(Duration.ofMinutes(1));

    assertThat(validator.isValid(properties, null)).isFalse();
  }

  @Test
  public void mediumAboveCoarse() {
    ResolutionProperties properties = new ResolutionProperties()
        .setCoarseThreshold(Duration.ofMinutes(1))
        .setMediumThreshold(Duration.ofHours(2));

    assertThat(validator.isValid(properties, null)).isFalse();
  }

  @Test
  public void nonPositiveMedium() {
    ResolutionProperties properties = new ResolutionProperties()
        .setMediumThreshold(Duration.ZERO);

    assertThat(validator.isValid(properties, null)).isFalse();
  }

  @Test
  public void missingThresholdsLeftToNotNull() {
    ResolutionProperties properties = new ResolutionProperties()
        .setMediumThreshold(null);

    assertThat(validator.isValid(properties, null)).isTrue();
  }
}
