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

import static com.rackspace.timelens.app.utils.DateTimeUtils.formatSpan;
import static com.rackspace.timelens.app.utils.DateTimeUtils.toMicros;

import com.rackspace.timelens.app.config.ResolutionProperties;
import com.rackspace.timelens.app.model.ResolutionTier;
import com.rackspace.timelens.app.model.TransitionInfo;
import com.rackspace.timelens.app.model.ZoomDirection;
import com.rackspace.timelens.app.utils.TimestampProvider;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides the resolution tier for a visible span.
 * <p>
 * Leaving the current tier requires the span to move past the threshold by the hysteresis
 * fraction, so a span oscillating around a threshold does not flicker between tiers. Even then a
 * switch is suppressed until the minimum switch interval has passed since the previous one.
 * </p>
 */
@Slf4j
public class ResolutionStateMachine {

  private final TimestampProvider timestampProvider;
  private final long coarseThreshold;
  private final long mediumThreshold;
  private final double hysteresis;
  private final double transitionZone;
  private final double prefetchZone;
  private final double zoomTolerance;
  private final Duration minSwitchInterval;

  private volatile ResolutionTier currentTier = ResolutionTier.COARSE;
  private Instant lastSwitch;
  private double lastSpan = Double.POSITIVE_INFINITY;
  private ZoomDirection zoomDirection = ZoomDirection.STABLE;

  public ResolutionStateMachine(ResolutionProperties properties,
                                TimestampProvider timestampProvider) {
    this.timestampProvider = timestampProvider;
    this.coarseThreshold = toMicros(properties.getCoarseThreshold());
    this.mediumThreshold = toMicros(properties.getMediumThreshold());
    this.hysteresis = properties.getHysteresis();
    this.transitionZone = properties.getTransitionZone();
    this.prefetchZone = properties.getPrefetchZone();
    this.zoomTolerance = properties.getZoomTolerance();
    this.minSwitchInterval = properties.getMinSwitchInterval();
  }

  /**
   * Resolves the tier for the visible span and updates the machine's state.
   *
   * @param span visible time span in microseconds
   */
  public TransitionInfo resolve(long span) {
    final Instant now = timestampProvider.now();
    final ResolutionTier previous = currentTier;

    zoomDirection = directionOf(span);
    lastSpan = span;

    final ResolutionTier target = targetTier(span);
    if (target != currentTier) {
      if (lastSwitch != null
          && Duration.between(lastSwitch, now).compareTo(minSwitchInterval) < 0) {
        log.debug("Suppressing switch {} -> {}, last switch was at {}", currentTier, target,
            lastSwitch);
      } else {
        log.debug("Switching resolution {} -> {} at span {}", currentTier, target,
            formatSpan(span));
        lastSwitch = now;
        currentTier = target;
      }
    }

    final ResolutionTier resolved = currentTier;
    final ResolutionTier prefetch = prefetchTier(resolved, span);
    return new TransitionInfo()
        .setResolution(resolved)
        .setInTransitionZone(isInZone(span, coarseThreshold) || isInZone(span, mediumThreshold))
        .setTransitionProgress(transitionProgress(span))
        .setZoomDirection(zoomDirection)
        .setShouldPrefetch(prefetch != null)
        .setPrefetchResolution(prefetch)
        .setSwitchedResolution(resolved != previous);
  }

  public ResolutionTier getCurrentTier() {
    return currentTier;
  }

  public ZoomDirection getZoomDirection() {
    return zoomDirection;
  }

  public void reset() {
    currentTier = ResolutionTier.COARSE;
    lastSwitch = null;
    lastSpan = Double.POSITIVE_INFINITY;
    zoomDirection = ZoomDirection.STABLE;
  }

  private ZoomDirection directionOf(long span) {
    if (span < lastSpan * (1 - zoomTolerance)) {
      return ZoomDirection.IN;
    } else if (span > lastSpan * (1 + zoomTolerance)) {
      return ZoomDirection.OUT;
    }
    return ZoomDirection.STABLE;
  }

  private ResolutionTier targetTier(long span) {
    double coarse = coarseThreshold;
    double medium = mediumThreshold;
    switch (currentTier) {
      case COARSE:
        coarse = coarseThreshold * (1 - hysteresis);
        break;
      case MEDIUM:
        coarse = coarseThreshold * (1 + hysteresis);
        medium = mediumThreshold * (1 - hysteresis);
        break;
      case FINE:
        medium = mediumThreshold * (1 + hysteresis);
        break;
    }

    if (span > coarse) {
      return ResolutionTier.COARSE;
    } else if (span > medium) {
      return ResolutionTier.MEDIUM;
    }
    return ResolutionTier.FINE;
  }

  private ResolutionTier prefetchTier(ResolutionTier resolved, long span) {
    if (zoomDirection != ZoomDirection.IN) {
      return null;
    }
    if (resolved == ResolutionTier.COARSE && span < coarseThreshold * (1 + prefetchZone)) {
      return ResolutionTier.MEDIUM;
    }
    if (resolved == ResolutionTier.MEDIUM && span < mediumThreshold * (1 + prefetchZone)) {
      return ResolutionTier.FINE;
    }
    return null;
  }

  private boolean isInZone(long span, long threshold) {
    return Math.abs(span - threshold) < threshold * transitionZone;
  }

  private double transitionProgress(long span) {
    for (long threshold : new long[]{coarseThreshold, mediumThreshold}) {
      if (isInZone(span, threshold)) {
        final double zone = threshold * transitionZone;
        final double progress = 1 - (span - (threshold - zone)) / (2 * zone);
        return Math.max(0, Math.min(1, progress));
      }
    }
    return 0;
  }
}
