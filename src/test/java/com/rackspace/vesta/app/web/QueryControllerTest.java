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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.vesta.app.config.ClockConfig;
import com.rackspace.vesta.app.exceptions.DegradedServiceException;
import com.rackspace.vesta.app.exceptions.UpstreamRejectedException;
import com.rackspace.vesta.app.model.DispatchMode;
import com.rackspace.vesta.app.model.QueryRequest;
import com.rackspace.vesta.app.model.QueryResponse;
import com.rackspace.vesta.app.model.Quality;
import com.rackspace.vesta.app.model.SampleValue;
import com.rackspace.vesta.app.model.SeriesResult;
import com.rackspace.vesta.app.model.Tier;
import com.rackspace.vesta.app.services.QueryService;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebFlux;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@ActiveProfiles(profiles = {"test", "query"})
@SpringBootTest(classes = {QueryController.class, ClockConfig.class,
    RestWebExceptionHandler.class, RestExceptionAdvice.class})
@AutoConfigureWebTestClient
@AutoConfigureWebFlux
public class QueryControllerTest {

  @MockBean
  QueryService queryService;

  @Autowired
  private WebTestClient webTestClient;

  @Test
  public void testQueryAnsweredInline() {
    final SeriesResult result = new SeriesResult().setSite("S1").setStartMs(1000).setEndMs(2000);
    result.getSeries().put("P1", List.of(new SampleValue(1500, 21.5, Quality.good, Tier.raw)));
    when(queryService.query(any()))
        .thenReturn(Mono.just(QueryResponse.ok(result, DispatchMode.direct,
            QueryService.SOURCE_UPSTREAM, "S1:abc")));

    webTestClient.get()
        .uri(uriBuilder -> uriBuilder.path("/api/query")
            .queryParam("site", "S1")
            .queryParam("points", "P1,P2")
            .queryParam("points", "P3")
            .queryParam("start", "1000")
            .queryParam("end", "2000")
            .queryParam("resolution", "PT5M")
            .build())
        .exchange().expectStatus().isOk()
        .expectBody()
        .jsonPath("$.status").isEqualTo("ok")
        .jsonPath("$.mode").isEqualTo("direct")
        .jsonPath("$.source").isEqualTo("upstream")
        .jsonPath("$.samples.P1[0].value").isEqualTo(21.5)
        .jsonPath("$.jobId").doesNotExist();

    final ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(queryService).query(captor.capture());
    assertThat(captor.getValue().getPoints()).containsExactly("P1", "P2", "P3");
    assertThat(captor.getValue().getStartMs()).isEqualTo(1000);
    assertThat(captor.getValue().getEndMs()).isEqualTo(2000);
    assertThat(captor.getValue().getResolution()).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  public void testOffsetTimesAccepted() {
    when(queryService.query(any()))
        .thenReturn(Mono.just(QueryResponse.ok(new SeriesResult().setSite("S1"),
            DispatchMode.direct, QueryService.SOURCE_UPSTREAM, "S1:abc")));

    webTestClient.get()
        .uri(uriBuilder -> uriBuilder.path("/api/query")
            .queryParam("site", "S1")
            .queryParam("points", "P1")
            .queryParam("start", "{start}")
            .queryParam("end", "{end}")
            .build("2024-01-01T00:00:00+02:00", "2024-01-01T01:00:00-05:00"))
        .exchange().expectStatus().isOk();

    final ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(queryService).query(captor.capture());
    assertThat(captor.getValue().getStartMs())
        .isEqualTo(Instant.parse("2023-12-31T22:00:00Z").toEpochMilli());
    assertThat(captor.getValue().getEndMs())
        .isEqualTo(Instant.parse("2024-01-01T06:00:00Z").toEpochMilli());
  }

  @Test
  public void testQueuedQueryAccepted() {
    final UUID jobId = UUID.randomUUID();
    when(queryService.query(any()))
        .thenReturn(Mono.just(QueryResponse.processing(jobId, "S1:abc")));

    webTestClient.get()
        .uri(uriBuilder -> uriBuilder.path("/api/query")
            .queryParam("site", "S1")
            .queryParam("points", "P1")
            .queryParam("start", "30d-ago")
            .build())
        .exchange().expectStatus().isAccepted()
        .expectBody()
        .jsonPath("$.status").isEqualTo("processing")
        .jsonPath("$.jobId").isEqualTo(jobId.toString());
  }

  @Test
  public void testInvalidResolution() {
    webTestClient.get()
        .uri(uriBuilder -> uriBuilder.path("/api/query")
            .queryParam("site", "S1")
            .queryParam("points", "P1")
            .queryParam("start", "1000")
            .queryParam("resolution", "fast")
            .build())
        .exchange().expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.message").isEqualTo("Invalid resolution: fast");

    verify(queryService, never()).query(any());
  }

  @Test
  public void testMissingSite() {
    webTestClient.get()
        .uri(uriBuilder -> uriBuilder.path("/api/query")
            .queryParam("points", "P1")
            .queryParam("start", "1000")
            .build())
        .exchange().expectStatus().isBadRequest();
  }

  @Test
  public void testValidationFailure() {
    when(queryService.query(any()))
        .thenReturn(Mono.error(new IllegalArgumentException("end must be after start")));

    webTestClient.get()
        .uri(uriBuilder -> uriBuilder.path("/api/query")
            .queryParam("site", "S1")
            .queryParam("points", "P1")
            .queryParam("start", "2000")
            .queryParam("end", "1000")
            .build())
        .exchange().expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.message").isEqualTo("end must be after start");
  }

  @Test
  public void testUpstreamRejection() {
    when(queryService.query(any()))
        .thenReturn(Mono.error(new UpstreamRejectedException(404, "unknown site")));

    webTestClient.get()
        .uri(uriBuilder -> uriBuilder.path("/api/query")
            .queryParam("site", "S9")
            .queryParam("points", "P1")
            .queryParam("start", "1000")
            .build())
        .exchange().expectStatus().isEqualTo(502)
        .expectBody()
        .jsonPath("$.upstreamStatus").isEqualTo(404);
  }

  @Test
  public void testDegradedStorage() {
    when(queryService.query(any()))
        .thenReturn(Mono.error(new DegradedServiceException("Unable to enqueue job", null)));

    webTestClient.get()
        .uri(uriBuilder -> uriBuilder.path("/api/query")
            .queryParam("site", "S1")
            .queryParam("points", "P1")
            .queryParam("start", "1000")
            .build())
        .exchange().expectStatus().isEqualTo(503);
  }

  @Test
  public void testParseResolution() {
    assertThat(QueryController.parseResolution(null)).isNull();
    assertThat(QueryController.parseResolution("60000")).isEqualTo(Duration.ofMinutes(1));
    assertThat(QueryController.parseResolution("PT15M")).isEqualTo(Duration.ofMinutes(15));
  }
}
