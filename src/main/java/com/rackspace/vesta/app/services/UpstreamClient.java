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

package com.rackspace.vesta.app.services;

import com.google.common.collect.Lists;
import com.rackspace.vesta.app.config.UpstreamProperties;
import com.rackspace.vesta.app.exceptions.UpstreamRejectedException;
import com.rackspace.vesta.app.exceptions.UpstreamTransientException;
import com.rackspace.vesta.app.model.FetchPlan;
import com.rackspace.vesta.app.model.Tier;
import com.rackspace.vesta.app.model.UpstreamPage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Reads paginated samples from the metering API.
 * <p>
 * Each page is requested with a timeout and retried with exponential backoff and jitter on
 * timeouts, throttling and server errors. A 429 response's <code>Retry-After</code> is honored
 * up to <code>maxRetryAfter</code>. Other 4xx responses fail immediately with
 * {@link UpstreamRejectedException}.
 * </p>
 */
@Service
@Slf4j
public class UpstreamClient {

  static final String PAGINATED_PATH = "/sites/{site}/timeseries/paginated";

  static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter
      .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSxxx")
      .withZone(ZoneOffset.UTC);

  private final WebClient webClient;
  private final UpstreamProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Counter retriesCounter;

  @Autowired
  public UpstreamClient(WebClient.Builder webClientBuilder,
                        UpstreamProperties properties,
                        Clock clock,
                        MeterRegistry meterRegistry) {
    if (properties.getPageSize() > properties.getMaxPageSize()) {
      throw new IllegalArgumentException(String.format(
          "Upstream page size %d exceeds the maximum page size %d",
          properties.getPageSize(), properties.getMaxPageSize()));
    }
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.retriesCounter = meterRegistry.counter("vesta.upstream.retries");

    WebClient.Builder builder = webClientBuilder.clone()
        .baseUrl(properties.getBaseUrl())
        .codecs(configurer -> configurer.defaultCodecs()
            .maxInMemorySize(properties.getMaxResponseBytes()));
    if (StringUtils.isNotBlank(properties.getToken())) {
      builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION,
          "Bearer " + properties.getToken());
    }
    this.webClient = builder.build();

    log.info("Upstream client using baseUrl={} pageSize={} maxAttempts={}",
        properties.getBaseUrl(), properties.getPageSize(), properties.getMaxAttempts());
  }

  /**
   * Fetches every page of the plan's range for the given points. Point lists longer than
   * <code>maxPointsPerRequest</code> are split into consecutive paginated ranges.
   */
  public Flux<UpstreamPage> fetchAll(String site, List<String> points, FetchPlan plan) {
    if (points.isEmpty()) {
      return fetchPages(site, points, plan, null);
    }
    return Flux.fromIterable(Lists.partition(points, properties.getMaxPointsPerRequest()))
        .concatMap(chunk -> fetchPages(site, chunk, plan, null));
  }

  /**
   * Lazily walks the pages of one range starting at the given cursor, or at the beginning
   * when the cursor is null. Pages are only requested as they are consumed. When
   * <code>maxPages</code> is reached with more pages available, a
   * {@link UpstreamPage#truncationMarker} is emitted last.
   */
  public Flux<UpstreamPage> fetchPages(String site, List<String> points, FetchPlan plan,
                                       String cursor) {
    return Flux.defer(() -> {
      final AtomicInteger pageCount = new AtomicInteger(1);
      return fetchPage(site, points, plan, cursor)
          .expand(page -> {
            if (!page.isHasMore() || StringUtils.isBlank(page.getNextCursor())) {
              return Mono.empty();
            }
            if (pageCount.incrementAndGet() > properties.getMaxPages()) {
              log.warn("Stopping pagination of site={} tier={} after {} pages",
                  site, plan.getTier(), properties.getMaxPages());
              return Mono.just(UpstreamPage.truncationMarker(points));
            }
            return fetchPage(site, points, plan, page.getNextCursor());
          });
    });
  }

  public Mono<UpstreamPage> fetchPage(String site, List<String> points, FetchPlan plan,
                                      String cursor) {
    return Mono.defer(() ->
            webClient.get()
                .uri(uriBuilder -> buildUri(uriBuilder, site, points, plan, cursor))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(this::handleResponse)
                .timeout(properties.getPageTimeout())
        )
        .retryWhen(retrySpec(site, plan))
        .doOnNext(page -> {
          meterRegistry.counter("vesta.upstream.pages", "tier", plan.getTier().name())
              .increment();
          log.debug("Fetched page of {} samples for site={} tier={} hasMore={}",
              page.getPointSamples().size(), site, plan.getTier(), page.isHasMore());
        });
  }

  private URI buildUri(UriBuilder uriBuilder, String site, List<String> points,
                                FetchPlan plan, String cursor) {
    final Map<String, Object> vars = new HashMap<>();
    vars.put("site", site);
    vars.put("start", TIME_FORMAT.format(Instant.ofEpochMilli(plan.getStartMs())));
    vars.put("end", TIME_FORMAT.format(Instant.ofEpochMilli(plan.getEndMs())));
    vars.put("raw", plan.getTier() == Tier.raw);
    vars.put("pageSize", properties.getPageSize());

    uriBuilder.path(PAGINATED_PATH)
        .queryParam("start_time", "{start}")
        .queryParam("end_time", "{end}")
        .queryParam("raw_data", "{raw}")
        .queryParam("page_size", "{pageSize}");
    if (!points.isEmpty()) {
      vars.put("points", String.join(",", points));
      uriBuilder.queryParam("point_names", "{points}");
    }
    if (StringUtils.isNotBlank(cursor)) {
      vars.put("cursor", cursor);
      uriBuilder.queryParam("cursor", "{cursor}");
    }
    return uriBuilder.build(vars);
  }

  private Mono<UpstreamPage> handleResponse(ClientResponse response) {
    final int status = response.rawStatusCode();
    if (status >= 200 && status < 300) {
      return response.bodyToMono(UpstreamPage.class)
          .defaultIfEmpty(new UpstreamPage());
    }
    final Duration retryAfter = status == HttpStatus.TOO_MANY_REQUESTS.value() ?
        parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER)) :
        null;
    return response.bodyToMono(String.class)
        .defaultIfEmpty("")
        .flatMap(body -> {
          final String message = String.format("Upstream responded with %d: %s",
              status, StringUtils.abbreviate(body, 200));
          if (status == HttpStatus.TOO_MANY_REQUESTS.value() || status >= 500) {
            return Mono.error(new RetryableStatusException(status, message, retryAfter));
          }
          return Mono.error(new UpstreamRejectedException(status, message));
        });
  }

  Duration parseRetryAfter(String value) {
    if (StringUtils.isBlank(value)) {
      return null;
    }
    Duration delay;
    if (StringUtils.isNumeric(value.trim())) {
      delay = Duration.ofSeconds(Long.parseLong(value.trim()));
    } else {
      try {
        final ZonedDateTime at = ZonedDateTime.parse(value.trim(),
            DateTimeFormatter.RFC_1123_DATE_TIME);
        delay = Duration.between(clock.instant(), at.toInstant());
      } catch (DateTimeParseException e) {
        log.debug("Ignoring unparseable Retry-After={}", value);
        return null;
      }
    }
    if (delay.isNegative()) {
      delay = Duration.ZERO;
    }
    return delay.compareTo(properties.getMaxRetryAfter()) > 0 ?
        properties.getMaxRetryAfter() : delay;
  }

  private Retry retrySpec(String site, FetchPlan plan) {
    return Retry.from(signals -> signals.concatMap(signal -> {
      final Throwable failure = signal.failure();
      final long retriesSoFar = signal.totalRetries();
      if (!isRetryable(failure)) {
        return Mono.error(failure);
      }
      if (retriesSoFar + 1 >= properties.getMaxAttempts()) {
        return Mono.error(exhausted(failure));
      }
      final Duration delay = delayFor(failure, retriesSoFar);
      retriesCounter.increment();
      log.warn("Retrying upstream page of site={} tier={} in {} after: {}",
          site, plan.getTier(), delay, failure.getMessage());
      return Mono.delay(delay);
    }));
  }

  private static boolean isRetryable(Throwable failure) {
    return failure instanceof RetryableStatusException
        || failure instanceof TimeoutException
        || failure instanceof WebClientRequestException;
  }

  private UpstreamTransientException exhausted(Throwable failure) {
    if (failure instanceof RetryableStatusException) {
      return new UpstreamTransientException(((RetryableStatusException) failure).status,
          failure.getMessage());
    }
    return new UpstreamTransientException(
        "Upstream request failed after " + properties.getMaxAttempts() + " attempts", failure);
  }

  Duration delayFor(Throwable failure, long retriesSoFar) {
    if (failure instanceof RetryableStatusException
        && ((RetryableStatusException) failure).retryAfter != null) {
      return ((RetryableStatusException) failure).retryAfter;
    }
    final double base = properties.getMinBackoff().toMillis()
        * Math.pow(properties.getBackoffFactor(), retriesSoFar);
    final double jitterFactor = properties.getJitter() == 0 ? 0 :
        ThreadLocalRandom.current().nextDouble(-properties.getJitter(), properties.getJitter());
    return Duration.ofMillis(Math.max(0, Math.round(base * (1 + jitterFactor))));
  }

  static class RetryableStatusException extends RuntimeException {
    final int status;
    final Duration retryAfter;

    RetryableStatusException(int status, String message, Duration retryAfter) {
      super(message);
      this.status = status;
      this.retryAfter = retryAfter;
    }
  }
}
