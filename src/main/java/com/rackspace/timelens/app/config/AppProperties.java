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

@ConfigurationProperties("timelens")
@Component
@Data
@Validated
public class AppProperties {
  /**
   * Bin width of the whole-dataset aggregates computed by the in-memory provider.
   */
  @NotNull
  Duration coarseBinWidth = Duration.ofMinutes(1);

  /**
   * Bin width of the domain-scoped aggregates computed by the in-memory provider.
   */
  @NotNull
  Duration mediumBinWidth = Duration.ofSeconds(1);

  /**
   * Upper bound on concurrently open viewports, each of which owns its own caches.
   */
  @Min(1)
  int maxViewports = 64;
}
