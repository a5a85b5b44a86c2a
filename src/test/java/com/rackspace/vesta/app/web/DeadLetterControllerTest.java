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

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.vesta.app.entities.DeadLetter;
import com.rackspace.vesta.app.model.ErrorType;
import com.rackspace.vesta.app.model.JobStatus;
import com.rackspace.vesta.app.model.JobStatusView;
import com.rackspace.vesta.app.services.DeadLetterService;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebFlux;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@ActiveProfiles(profiles = {"test", "query"})
@SpringBootTest(classes = {DeadLetterController.class, RestWebExceptionHandler.class,
    RestExceptionAdvice.class})
@AutoConfigureWebTestClient
@AutoConfigureWebFlux
public class DeadLetterControllerTest {

  @MockBean
  DeadLetterService deadLetterService;

  @Autowired
  private WebTestClient webTestClient;

  @Test
  public void testListWithDefaultLimit() {
    final UUID jobId = UUID.randomUUID();
    when(deadLetterService.listRecent(100)).thenReturn(Flux.just(new DeadLetter()
        .setDay("2024-01-15")
        .setJobId(jobId)
        .setErrorType(ErrorType.SYSTEM_ERROR)));

    webTestClient.get()
        .uri("/api/dead-letters")
        .exchange().expectStatus().isOk()
        .expectBody()
        .jsonPath("$[0].jobId").isEqualTo(jobId.toString())
        .jsonPath("$[0].errorType").isEqualTo("SYSTEM_ERROR");
  }

  @Test
  public void testLimitOutOfRange() {
    webTestClient.get()
        .uri("/api/dead-letters?limit=0")
        .exchange().expectStatus().isBadRequest();

    verify(deadLetterService, never()).listRecent(anyInt());
  }

  @Test
  public void testRequeue() {
    final UUID failedJobId = UUID.randomUUID();
    final UUID newJobId = UUID.randomUUID();
    when(deadLetterService.requeue(failedJobId)).thenReturn(Mono.just(new JobStatusView()
        .setJobId(newJobId)
        .setStatus(JobStatus.queued)));

    webTestClient.post()
        .uri("/api/dead-letters/{jobId}/requeue", failedJobId)
        .exchange().expectStatus().isOk()
        .expectBody()
        .jsonPath("$.jobId").isEqualTo(newJobId.toString())
        .jsonPath("$.status").isEqualTo("queued");
  }
}
