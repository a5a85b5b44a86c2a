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

import com.rackspace.vesta.app.config.AppProperties;
import com.rackspace.vesta.app.exceptions.StorageWriteFailedException;
import com.rackspace.vesta.app.exceptions.UpstreamRejectedException;
import com.rackspace.vesta.app.exceptions.UpstreamTransientException;
import com.rackspace.vesta.app.model.DispatchMode;
import com.rackspace.vesta.app.model.DispatchResult;
import com.rackspace.vesta.app.model.QueryRequest;
import com.rackspace.vesta.app.model.Sample;
import com.rackspace.vesta.app.model.TimeRange;
import com.rackspace.vesta.app.utils.DateTimeUtils;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Chooses how the uncovered ranges of a query are fetched, based on the estimated number of
 * samples: inline, as a bounded parallel fan-out per point, or as a queued job.
 * <p>
 * Fetched samples are written through to storage. A storage failure does not fail the
 * query, it is reported as a warning on the result, as is a series cut short by the upstream
 * page limit.
 * </p>
 */
@Service
@Slf4j
public class SizeDispatcher {

  private final SampleFetcher sampleFetcher;
  private final SampleStorageService sampleStorageService;
  private final JobService jobService;
  private final AppProperties appProperties;

  @Autowired
  public SizeDispatcher(SampleFetcher sampleFetcher,
                        SampleStorageService sampleStorageService,
                        JobService jobService,
                        AppProperties appProperties) {
    this.sampleFetcher = sampleFetcher;
    this.sampleStorageService = sampleStorageService;
    this.jobService = jobService;
    this.appProperties = appProperties;
  }

  public long estimate(List<String> points, List<TimeRange> ranges, Duration resolution) {
    final long perPoint = ranges.stream()
        .mapToLong(range -> DateTimeUtils.expectedSamplesPerPointInRange(
            range.getStartMs(), range.getEndMs(), resolution))
        .sum();
    return points.size() * perPoint;
  }

  public DispatchMode classify(long estimatedSamples) {
    if (estimatedSamples < appProperties.getDirectThreshold()) {
      return DispatchMode.direct;
    } else if (estimatedSamples < appProperties.getBatchThreshold()) {
      return DispatchMode.batched;
    } else {
      return DispatchMode.queued;
    }
  }

  /**
   * @param ranges the parts of the query not already covered by cached results
   * @param cacheKey fingerprint of the whole query, given to a queued job
   */
  public Mono<DispatchResult> dispatch(QueryRequest request, List<TimeRange> ranges,
                                       String cacheKey) {
    final Duration resolution = resolutionOf(request);
    final long estimate = estimate(request.getPoints(), ranges, resolution);
    final DispatchMode mode = classify(estimate);
    log.debug("Dispatching site={} points={} ranges={} estimate={} as {}", request.getSite(),
        request.getPoints().size(), ranges, estimate, mode);

    final DispatchResult result = new DispatchResult()
        .setMode(mode)
        .setEstimatedSamples(estimate);

    switch (mode) {
      case direct:
        return sampleFetcher.fetch(request.getSite(), request.getPoints(), ranges)
            .map(fetched -> {
              result.getSamples().putAll(fetched.getSamples());
              fetched.getTruncated().forEach((point, message) ->
                  result.getWarnings().add(truncationWarning(point, message)));
              return result;
            })
            .onErrorResume(UpstreamRejectedException.class, e -> {
              if (request.getPoints().size() <= 1) {
                return Mono.error(e);
              }
              log.debug("Direct fetch of site={} rejected, isolating points: {}",
                  request.getSite(), e.getMessage());
              return fetchPerPoint(request, ranges, result);
            })
            .flatMap(this::writeThrough);
      case batched:
        return fetchPerPoint(request, ranges, result)
            .flatMap(this::writeThrough);
      case queued:
        return jobService.submit(request.getSite(), request.getPoints(), ranges,
                request.getStartMs(), request.getEndMs(), resolution, cacheKey)
            .map(result::setJobId);
      default:
        throw new IllegalStateException("Unknown dispatch mode " + mode);
    }
  }

  Duration resolutionOf(QueryRequest request) {
    return request.getResolution() != null ?
        request.getResolution() : appProperties.getDefaultResolution();
  }

  private Mono<DispatchResult> fetchPerPoint(QueryRequest request, List<TimeRange> ranges,
                                             DispatchResult result) {
    return Flux.fromIterable(request.getPoints())
        .flatMapSequential(point ->
                sampleFetcher.fetch(request.getSite(), List.of(point), ranges)
                    .map(fetched -> PointOutcome.success(point,
                        fetched.getSamples().getOrDefault(point, List.of()),
                        fetched.getTruncated().get(point)))
                    .onErrorResume(e -> isPointError(e),
                        e -> Mono.just(PointOutcome.failure(point, e))),
            appProperties.getMaxBatchConcurrency())
        .collectList()
        .flatMap(outcomes -> {
          final List<PointOutcome> failures = outcomes.stream()
              .filter(outcome -> outcome.error != null)
              .collect(Collectors.toList());
          if (!outcomes.isEmpty() && failures.size() == outcomes.size()
              && failures.stream().anyMatch(f -> f.error instanceof UpstreamTransientException)) {
            // nothing usable came back, surface it rather than answering with no data
            return Mono.error(failures.get(0).error);
          }
          for (PointOutcome outcome : outcomes) {
            if (outcome.error != null) {
              log.debug("Point={} of site={} failed: {}", outcome.point, request.getSite(),
                  outcome.error.getMessage());
              result.getErrors().put(outcome.point, outcome.error.getMessage());
            } else {
              if (!outcome.samples.isEmpty()) {
                result.getSamples().put(outcome.point, outcome.samples);
              }
              if (outcome.truncation != null) {
                result.getWarnings().add(truncationWarning(outcome.point, outcome.truncation));
              }
            }
          }
          return Mono.just(result);
        });
  }

  private static String truncationWarning(String point, String message) {
    return point + ": " + message;
  }

  private static boolean isPointError(Throwable e) {
    return e instanceof UpstreamRejectedException || e instanceof UpstreamTransientException;
  }

  private Mono<DispatchResult> writeThrough(DispatchResult result) {
    final List<Sample> samples = result.getSamples().values().stream()
        .flatMap(List::stream)
        .collect(Collectors.toList());
    if (samples.isEmpty()) {
      return Mono.just(result);
    }
    return sampleStorageService.upsert(samples)
        .doOnNext(stored -> log.trace("Stored {} fetched samples", stored))
        .thenReturn(result)
        .onErrorResume(StorageWriteFailedException.class, e -> {
          log.warn("Write-through of {} samples failed", samples.size(), e);
          result.getWarnings().add("Fetched samples could not be stored: " + e.getMessage());
          return Mono.just(result);
        });
  }

  private static class PointOutcome {
    final String point;
    final List<Sample> samples;
    final String truncation;
    final Throwable error;

    private PointOutcome(String point, List<Sample> samples, String truncation,
                         Throwable error) {
      this.point = point;
      this.samples = samples;
      this.truncation = truncation;
      this.error = error;
    }

    static PointOutcome success(String point, List<Sample> samples, String truncation) {
      return new PointOutcome(point, samples, truncation, null);
    }

    static PointOutcome failure(String point, Throwable error) {
      return new PointOutcome(point, List.of(), null, error);
    }
  }
}
