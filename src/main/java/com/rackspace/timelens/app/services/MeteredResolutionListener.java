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

package com.rackspace.timelens.app.services;

import com.rackspace.timelens.app.model.ResolutionTier;
import com.rackspace.timelens.app.model.TransitionInfo;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;

/**
 * Counts tier switches per target tier.
 */
public class MeteredResolutionListener implements ResolutionListener {

  private final MeterRegistry meterRegistry;

  public MeteredResolutionListener(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onResolutionChange(ResolutionTier previous, ResolutionTier current,
                                 TransitionInfo transitionInfo) {
    meterRegistry.counter("timelens.resolution.switches",
        "to", current.name().toLowerCase(Locale.ROOT)).increment();
  }

  @Override
  public void onBackgroundLoadStart(ResolutionTier tier) {
    meterRegistry.counter("timelens.background.loads",
        "tier", tier.name().toLowerCase(Locale.ROOT)).increment();
  }
}
