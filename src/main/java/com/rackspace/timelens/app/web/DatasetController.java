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


package com.rackspace.timelens.app.web;

import com.rackspace.timelens.app.model.DatasetSummary;
import com.rackspace.timelens.app.model.PacketRecord;
import com.rackspace.timelens.app.services.DatasetService;
import com.rackspace.timelens.app.validation.DomainRequestValidator;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/dataset")
public class DatasetController {

  private final DatasetService datasetService;

  @Autowired
  public DatasetController(DatasetService datasetService) {
    this.datasetService = datasetService;
  }

  /**
   * Replaces the active dataset. Every open viewport is closed and has to be opened again.
   */
  @PutMapping
  public Mono<DatasetSummary> load(@RequestBody List<PacketRecord> records) {
    return Mono.fromRunnable(() -> DomainRequestValidator.validateRecords(records))
        .then(Mono.defer(() -> datasetService.load(records)));
  }

  @GetMapping
  public DatasetSummary getSummary() {
    return datasetService.getSummary();
  }
}
