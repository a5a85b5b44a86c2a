/*
 * Copyright 2026 Rackspace US, Inc.
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

package com.rackspace.vesta.app.web;

import com.rackspace.vesta.app.entities.DeadLetter;
import com.rackspace.vesta.app.model.JobStatusView;
import com.rackspace.vesta.app.services.DeadLetterService;
import io.swagger.annotations.ApiOperation;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/dead-letters")
@Profile("query")
public class DeadLetterController {

  private static final int MAX_LIMIT = 1000;

  private final DeadLetterService deadLetterService;

  @Autowired
  public DeadLetterController(DeadLetterService deadLetterService) {
    this.deadLetterService = deadLetterService;
  }

  @GetMapping
  @ApiOperation(value = "Lists the most recent jobs that failed permanently")
  public Flux<DeadLetter> list(@RequestParam(defaultValue = "100") int limit) {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    return deadLetterService.listRecent(limit);
  }

  @PostMapping("/{jobId}/requeue")
  @ApiOperation(value = "Submits the parameters of a failed job again as a new job")
  public Mono<JobStatusView> requeue(@PathVariable UUID jobId) {
    return deadLetterService.requeue(jobId);
  }
}
