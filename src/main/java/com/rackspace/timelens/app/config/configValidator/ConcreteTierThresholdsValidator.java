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

package com.rackspace.timelens.app.config.configValidator;

import com.rackspace.timelens.app.config.ResolutionProperties;
import javax.validation.ConstraintValidator;
import javax.validation.ConstraintValidatorContext;

public class ConcreteTierThresholdsValidator implements
    ConstraintValidator<TierThresholds, ResolutionProperties> {

  @Override
  public boolean isValid(ResolutionProperties properties, ConstraintValidatorContext context) {
    if (properties == null
        || properties.getCoarseThreshold() == null
        || properties.getMediumThreshold() == null) {
      // @NotNull reports the missing values
      return true;
    }
    return !properties.getMediumThreshold().isNegative()
        && !properties.getMediumThreshold().isZero()
        && properties.getMediumThreshold().compareTo(properties.getCoarseThreshold()) < 0;
  }
}
