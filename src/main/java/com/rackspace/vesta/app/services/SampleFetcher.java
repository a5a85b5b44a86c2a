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

import com.rackspace.vesta.app.model.FetchPlan;
import com.rackspace.vesta.app.model.FetchResult;
import com.rackspace.vesta.app.model.Sample;
import com.rackspace.vesta.app.model.TimeRange;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Fetches, normalizes and stitches the samples of a set of points over one or more ranges.
 * Every range is routed to its tiers at the time it is fetched.
 */
@Service
@Slf4j
public class SampleFetcher {

  static final String TRUNCATED_MESSAGE =
      "Series incomplete, upstream pagination of the %s tier stopped at the page limit";

  private final TierRouter tierRouter;
  private final UpstreamClient upstreamClient;
  private final SampleNormalizer sampleNormalizer;

  @Autowired
  public SampleFetcher(TierRouter tierRouter,
                       UpstreamClient upstreamClient,
                       SampleNormalizer sampleNormalizer) {
    this.tierRouter = tierRouter;
    this.upstreamClient = upstreamClient;
    this.sampleNormalizer = sampleNormalizer;
  }

  /**
   * @return samples per point in ascending timestamp order, where points without samples are
   * absent, and the points whose upstream pagination stopped at the page limit
   */
  public Mono<FetchResult> fetch(String site, List<String> points, List<TimeRange> ranges) {
    final Set<String> requested = new HashSet<>(points);
    return Mono.defer(() -> {
      final Map<String, String> truncated = new LinkedHashMap<>();
      return Flux.fromIterable(ranges)
          .concatMapIterable(range ->
              tierRouter.route(site, points, range.getStartMs(), range.getEndMs()))
          .concatMap(plan -> fetchPlan(site, points, requested, plan, truncated))
          .collectList()
          .map(samples -> FetchResult.of(TierRouter.stitch(samples)).setTruncated(truncated))
          .doOnNext(result -> log.debug("Fetched site={} points={} ranges={} truncated={}",
              site, result.getSamples().keySet(), ranges, result.getTruncated().keySet()));
    });
  }

  private Flux<Sample> fetchPlan(String site, List<String> points, Set<String> requested,
                                 FetchPlan plan, Map<String, String> truncated) {
    return upstreamClient.fetchAll(site, points, plan)
        .concatMapIterable(page -> {
          if (page.isTruncated()) {
            final String message = String.format(TRUNCATED_MESSAGE, plan.getTier());
            (page.getTruncatedPoints().isEmpty() ? points : page.getTruncatedPoints())
                .forEach(point -> truncated.putIfAbsent(point, message));
            return List.<Sample>of();
          }
          return sampleNormalizer.normalize(site, plan, requested, page.getPointSamples());
        });
  }
}
