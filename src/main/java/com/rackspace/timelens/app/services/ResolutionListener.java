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
import com.rackspace.timelens.app.model.TimelineEntry;
import com.rackspace.timelens.app.model.TransitionInfo;
import java.util.List;

/**
 * Observer of a {@link ResolutionManager}. Callbacks run on the session scheduler and must not
 * block.
 */
public interface ResolutionListener {

  default void onLoadingStart(ResolutionTier tier) {
  }

  default void onLoadingEnd(ResolutionTier tier) {
  }

  default void onResolutionChange(ResolutionTier previous, ResolutionTier current,
                                  TransitionInfo transitionInfo) {
  }

  default void onBackgroundLoadStart(ResolutionTier tier) {
  }

  default void onBackgroundLoadComplete(ResolutionTier tier,
                                        List<? extends TimelineEntry> data) {
  }
}
