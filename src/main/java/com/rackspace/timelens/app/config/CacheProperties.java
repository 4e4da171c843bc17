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

import java.time.Duration;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("timelens.cache")
@Component
@Data
@Validated
public class CacheProperties {
  /**
   * Width of the time-aligned chunks that fine data is fetched and cached in.
   */
  @NotNull
  Duration chunkWidth = Duration.ofMinutes(1);

  /**
   * Maximum number of fine chunks each viewport keeps resident.
   */
  @Min(1)
  int detailCapacity = 50;

  /**
   * Maximum number of chunks a dataset's time extent may be split into. Datasets spanning more
   * are refused when a viewport is opened.
   */
  @Min(1)
  int maxIndexedChunks = 100_000;

  /**
   * Maximum number of records requested from the provider for a single chunk.
   */
  @Min(1)
  int detailFetchLimit = 100_000;

  /**
   * Idle time between two speculative chunk loads.
   */
  @NotNull
  Duration prefetchYield = Duration.ofMillis(10);

  @Min(0)
  int prefetchAdjacentChunks = 2;

  /**
   * Maximum number of (domain, tier) results kept from resolution prefetching.
   */
  @Min(0)
  long prefetchedResolutionCapacity = 20;

  /**
   * Approximate bytes per aggregated bin, used for memory estimates only.
   */
  @Min(1)
  int binSizeEstimate = 100;

  /**
   * Approximate bytes per packet record, used for memory estimates only.
   */
  @Min(1)
  int recordSizeEstimate = 100;
}
