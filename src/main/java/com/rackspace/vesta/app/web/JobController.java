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

import com.rackspace.vesta.app.model.JobStatusView;
import com.rackspace.vesta.app.services.JobService;
import io.swagger.annotations.ApiOperation;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/jobs")
@Profile("query")
public class JobController {

  private final JobService jobService;

  @Autowired
  public JobController(JobService jobService) {
    this.jobService = jobService;
  }

  @GetMapping("/{jobId}")
  @ApiOperation(value = "Gets the status of a queued query job")
  public Mono<JobStatusView> getJob(@PathVariable UUID jobId) {
    return jobService.status(jobId);
  }

  @DeleteMapping("/{jobId}")
  @ApiOperation(value = "Cancels a job. Queued jobs fail immediately, processing jobs stop "
      + "between sub-batches")
  public Mono<JobStatusView> cancelJob(@PathVariable UUID jobId) {
    return jobService.cancel(jobId);
  }
}
