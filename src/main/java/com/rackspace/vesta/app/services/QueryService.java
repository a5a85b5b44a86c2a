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

import com.rackspace.vesta.app.exceptions.DegradedServiceException;
import com.rackspace.vesta.app.model.CacheEntry;
import com.rackspace.vesta.app.model.DispatchMode;
import com.rackspace.vesta.app.model.DispatchResult;
import com.rackspace.vesta.app.model.FetchPlan;
import com.rackspace.vesta.app.model.QueryRequest;
import com.rackspace.vesta.app.model.QueryResponse;
import com.rackspace.vesta.app.model.Sample;
import com.rackspace.vesta.app.model.SampleValue;
import com.rackspace.vesta.app.model.SeriesResult;
import com.rackspace.vesta.app.model.TimeRange;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * The read path behind the query endpoint.
 * <p>
 * A query is answered from the cache when its fingerprint is present. Otherwise cached results
 * of the same series that overlap the range are reused and only the remaining gaps are given
 * to the {@link SizeDispatcher}. A queued dispatch is answered immediately with the job's id.
 * </p>
 */
@Service
@Slf4j
public class QueryService {

  public static final String SOURCE_CACHE = "cache";
  public static final String SOURCE_UPSTREAM = "upstream";
  public static final String SOURCE_MIXED = "cache+upstream";

  private final TierRouter tierRouter;
  private final FingerprintService fingerprintService;
  private final QueryCacheService queryCacheService;
  private final SizeDispatcher sizeDispatcher;
  private final MeterRegistry meterRegistry;

  @Autowired
  public QueryService(TierRouter tierRouter,
                      FingerprintService fingerprintService,
                      QueryCacheService queryCacheService,
                      SizeDispatcher sizeDispatcher,
                      MeterRegistry meterRegistry) {
    this.tierRouter = tierRouter;
    this.fingerprintService = fingerprintService;
    this.queryCacheService = queryCacheService;
    this.sizeDispatcher = sizeDispatcher;
    this.meterRegistry = meterRegistry;
  }

  public Mono<QueryResponse> query(QueryRequest query) {
    return Mono.defer(() -> {
      validate(query);
      return lookup(new QueryRequest()
          .setSite(query.getSite())
          .setPoints(query.getPoints().stream().distinct().collect(Collectors.toList()))
          .setStartMs(query.getStartMs())
          .setEndMs(query.getEndMs())
          .setResolution(query.getResolution()));
    });
  }

  private Mono<QueryResponse> lookup(QueryRequest request) {
    final Duration resolution = sizeDispatcher.resolutionOf(request);
    final List<FetchPlan> plans = tierRouter.cachePlans(request.getStartMs(),
        request.getEndMs());
    final String fingerprint = fingerprintService.fingerprint(request.getSite(),
        request.getPoints(), request.getStartMs(), request.getEndMs(), plans, resolution);
    final List<String> warnings = new ArrayList<>();

    return queryCacheService.get(fingerprint)
        .onErrorResume(DegradedServiceException.class, e -> {
          log.warn("Cache lookup failed for fingerprint={}, continuing without it",
              fingerprint, e);
          warnings.add(e.getMessage());
          return Mono.empty();
        })
        .map(entry -> {
          countQuery(SOURCE_CACHE);
          return QueryResponse.ok(queryCacheService.decode(entry), entry.getSource(),
              SOURCE_CACHE, fingerprint);
        })
        .switchIfEmpty(Mono.defer(() -> queryMiss(request, resolution, fingerprint, warnings)))
        .map(response -> {
          response.getWarnings().addAll(warnings);
          return response.setDegraded(!response.getWarnings().isEmpty());
        });
  }

  private Mono<QueryResponse> queryMiss(QueryRequest request, Duration resolution,
                                        String fingerprint, List<String> warnings) {
    final String seriesKey = fingerprintService.seriesKey(request.getSite(),
        request.getPoints(), resolution);

    return queryCacheService.findOverlapping(seriesKey, request.getStartMs(), request.getEndMs())
        .collectList()
        .onErrorResume(DegradedServiceException.class, e -> {
          log.warn("Overlap lookup failed for seriesKey={}", seriesKey, e);
          warnings.add(e.getMessage());
          return Mono.just(List.of());
        })
        .flatMap(overlapping -> {
          final CachedCoverage coverage = collectCoverage(request, overlapping);
          final List<TimeRange> gaps = gaps(request.getStartMs(), request.getEndMs(),
              coverage.ranges);
          if (gaps.isEmpty()) {
            log.debug("Query fingerprint={} fully covered by {} cached entries", fingerprint,
                coverage.ranges.size());
            return complete(request, fingerprint, seriesKey, DispatchMode.direct, SOURCE_CACHE,
                merge(request, coverage.samples, new DispatchResult()), warnings);
          }
          return sizeDispatcher.dispatch(request, gaps, fingerprint)
              .flatMap(dispatched -> {
                if (dispatched.getMode() == DispatchMode.queued) {
                  countQuery(DispatchMode.queued.name());
                  return Mono.just(QueryResponse.processing(dispatched.getJobId(), fingerprint));
                }
                warnings.addAll(dispatched.getWarnings());
                return complete(request, fingerprint, seriesKey, dispatched.getMode(),
                    coverage.ranges.isEmpty() ? SOURCE_UPSTREAM : SOURCE_MIXED,
                    merge(request, coverage.samples, dispatched), warnings);
              });
        });
  }

  private Mono<QueryResponse> complete(QueryRequest request, String fingerprint,
                                       String seriesKey, DispatchMode mode, String source,
                                       SeriesResult result, List<String> warnings) {
    countQuery(mode.name());
    final QueryResponse response = QueryResponse.ok(result, mode, source, fingerprint);
    if (!result.getErrors().isEmpty() || !warnings.isEmpty()) {
      // partial or possibly unstored results are not cached
      return Mono.just(response);
    }
    return queryCacheService.put(queryCacheService.newEntry(fingerprint, seriesKey,
            request.getPoints(), result, mode))
        .thenReturn(response)
        .onErrorResume(DegradedServiceException.class, e -> {
          log.warn("Unable to cache result for fingerprint={}", fingerprint, e);
          warnings.add(e.getMessage());
          return Mono.just(response);
        });
  }

  /**
   * Collects the samples of cached entries that fall inside the query, and the ranges those
   * entries cover. Entries that recorded point errors do not cover anything.
   */
  private CachedCoverage collectCoverage(QueryRequest request, List<CacheEntry> entries) {
    final CachedCoverage coverage = new CachedCoverage();
    for (CacheEntry entry : entries) {
      final SeriesResult cached = queryCacheService.decode(entry);
      if (!cached.getErrors().isEmpty()) {
        continue;
      }
      final TimeRange covered = new TimeRange(
          Math.max(entry.getStartMs(), request.getStartMs()),
          Math.min(entry.getEndMs(), request.getEndMs()));
      if (covered.durationMs() <= 0) {
        continue;
      }
      coverage.ranges.add(covered);
      cached.getSeries().forEach((point, values) -> values.stream()
          .filter(value -> covered.contains(value.getTimestampMs()))
          .forEach(value -> coverage.samples.add(value.toSample(request.getSite(), point))));
    }
    return coverage;
  }

  /**
   * @return the parts of <code>[startMs, endMs)</code> not covered by any of the ranges, in
   * ascending order
   */
  static List<TimeRange> gaps(long startMs, long endMs, List<TimeRange> covered) {
    final List<TimeRange> sorted = new ArrayList<>(covered);
    sorted.sort(Comparator.comparingLong(TimeRange::getStartMs));
    final List<TimeRange> gaps = new ArrayList<>();
    long position = startMs;
    for (TimeRange range : sorted) {
      if (range.getStartMs() > position) {
        gaps.add(new TimeRange(position, Math.min(range.getStartMs(), endMs)));
      }
      position = Math.max(position, range.getEndMs());
      if (position >= endMs) {
        break;
      }
    }
    if (position < endMs) {
      gaps.add(new TimeRange(position, endMs));
    }
    return gaps;
  }

  /**
   * Combines cached and freshly fetched samples per requested point, ascending by timestamp.
   * A fetched sample replaces a cached one with the same timestamp.
   */
  static SeriesResult merge(QueryRequest request, List<Sample> cached,
                            DispatchResult dispatched) {
    final Map<String, TreeMap<Long, SampleValue>> byPoint = new TreeMap<>();
    cached.forEach(sample -> byPoint.computeIfAbsent(sample.getPoint(), p -> new TreeMap<>())
        .put(sample.getTimestampMs(), sample.toValue()));
    dispatched.getSamples().forEach((point, samples) -> samples.forEach(sample ->
        byPoint.computeIfAbsent(point, p -> new TreeMap<>())
            .put(sample.getTimestampMs(), sample.toValue())));

    final SeriesResult result = new SeriesResult()
        .setSite(request.getSite())
        .setStartMs(request.getStartMs())
        .setEndMs(request.getEndMs());
    for (String point : request.getPoints()) {
      if (dispatched.getErrors().containsKey(point)) {
        result.getErrors().put(point, dispatched.getErrors().get(point));
      }
      final TreeMap<Long, SampleValue> values = byPoint.get(point);
      result.getSeries().put(point, values == null ? List.of() : new ArrayList<>(values.values()));
    }
    return result;
  }

  private void validate(QueryRequest request) {
    if (StringUtils.isBlank(request.getSite())) {
      throw new IllegalArgumentException("site is required");
    }
    if (request.getPoints() == null || request.getPoints().isEmpty()
        || request.getPoints().stream().anyMatch(StringUtils::isBlank)) {
      throw new IllegalArgumentException("at least one non-blank point is required");
    }
    if (request.getEndMs() <= request.getStartMs()) {
      throw new IllegalArgumentException("end must be after start");
    }
    if (request.getResolution() != null
        && (request.getResolution().isNegative() || request.getResolution().isZero())) {
      throw new IllegalArgumentException("resolution must be positive");
    }
  }

  private void countQuery(String mode) {
    meterRegistry.counter("vesta.query", "mode", mode).increment();
  }

  private static class CachedCoverage {
    final List<TimeRange> ranges = new ArrayList<>();
    final List<Sample> samples = new ArrayList<>();
  }
}
