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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.rackspace.vesta.app.exceptions.JobNotFoundException;
import com.rackspace.vesta.app.model.JobStatus;
import com.rackspace.vesta.app.model.JobStatusView;
import com.rackspace.vesta.app.services.JobService;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebFlux;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@ActiveProfiles(profiles = {"test", "query"})
@SpringBootTest(classes = {JobController.class, MDCFilter.class, RestWebExceptionHandler.class,
    RestExceptionAdvice.class})
@AutoConfigureWebTestClient
@AutoConfigureWebFlux
public class JobControllerTest {

  @MockBean
  JobService jobService;

  @Autowired
  private WebTestClient webTestClient;

  @Test
  public void testGetJob() {
    final UUID jobId = UUID.randomUUID();
    when(jobService.status(jobId)).thenReturn(Mono.just(new JobStatusView()
        .setJobId(jobId)
        .setStatus(JobStatus.processing)
        .setCompletedBatches(2)
        .setTotalBatches(4)
        .setProgress(0.5)));

    webTestClient.get()
        .uri("/api/jobs/{jobId}", jobId)
        .exchange().expectStatus().isOk()
        .expectBody()
        .jsonPath("$.status").isEqualTo("processing")
        .jsonPath("$.progress").isEqualTo(0.5);
  }

  @Test
  public void testEchoesRequestId() {
    final UUID jobId = UUID.randomUUID();
    when(jobService.status(jobId)).thenReturn(Mono.just(new JobStatusView()
        .setJobId(jobId)
        .setStatus(JobStatus.queued)));

    webTestClient.get()
        .uri("/api/jobs/{jobId}", jobId)
        .header(MDCFilter.X_REQUEST_ID, "req-1")
        .exchange().expectStatus().isOk()
        .expectHeader().valueEquals(MDCFilter.X_REQUEST_ID, "req-1");
  }

  @Test
  public void testUnknownJob() {
    final UUID jobId = UUID.randomUUID();
    when(jobService.status(jobId)).thenReturn(Mono.error(new JobNotFoundException(jobId)));

    webTestClient.get()
        .uri("/api/jobs/{jobId}", jobId)
        .exchange().expectStatus().isNotFound()
        .expectBody()
        .jsonPath("$.message").isEqualTo("Job " + jobId + " not found");
  }

  @Test
  public void testMalformedJobId() {
    webTestClient.get()
        .uri("/api/jobs/not-a-uuid")
        .exchange().expectStatus().isBadRequest();
  }

  @Test
  public void testCancelJob() {
    final UUID jobId = UUID.randomUUID();
    when(jobService.cancel(any())).thenReturn(Mono.just(new JobStatusView()
        .setJobId(jobId)
        .setStatus(JobStatus.failed)
        .setError("cancelled")));

    webTestClient.delete()
        .uri("/api/jobs/{jobId}", jobId)
        .exchange().expectStatus().isOk()
        .expectBody()
        .jsonPath("$.status").isEqualTo("failed")
        .jsonPath("$.error").isEqualTo("cancelled");
  }
}
