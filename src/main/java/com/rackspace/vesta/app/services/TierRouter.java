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
import com.rackspace.vesta.app.model.FetchPlan;
import com.rackspace.vesta.app.model.Sample;
import com.rackspace.vesta.app.model.Tier;
import com.rackspace.vesta.app.utils.DateTimeUtils;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Decides which upstream tier serves each part of a query range.
 * <p>
 * Everything older than <code>now - lagThreshold</code> is read from the raw tier, everything
 * at or after it from the aggregated tier. The boundary belongs to the aggregated side.
 * </p>
 * <p>
 * Cache fingerprints use {@link #cachePlans} instead, which split at the boundary aligned down
 * to <code>tierBoundaryAlignment</code> so that repeated queries keep one fingerprint for the
 * length of an alignment window. Fetching always uses the exact boundary.
 * </p>
 */
@Service
@Slf4j
public class TierRouter {

  private final AppProperties appProperties;
  private final Clock clock;

  @Autowired
  public TierRouter(AppProperties appProperties, Clock clock) {
    this.appProperties = appProperties;
    this.clock = clock;
  }

  /**
   * @return the current raw/aggregated boundary in epoch millis
   */
  public long boundary() {
    return clock.millis() - appProperties.getLagThreshold().toMillis();
  }

  /**
   * @return the boundary aligned down to <code>tierBoundaryAlignment</code>
   */
  public long alignedBoundary() {
    return DateTimeUtils.alignDown(boundary(), appProperties.getTierBoundaryAlignment());
  }

  /**
   * Splits <code>[startMs, endMs)</code> into at most one raw and one aggregated plan. The
   * plans are contiguous, never overlap and together cover exactly the requested range.
   */
  public List<FetchPlan> route(String site, List<String> points, long startMs, long endMs) {
    final List<FetchPlan> plans = split(startMs, endMs, boundary());
    log.trace("Routed site={} points={} [{}, {}) to plans={}", site, points, startMs, endMs,
        plans);
    return plans;
  }

  /**
   * Same as {@link #route} but split at {@link #alignedBoundary()}. Only for deriving cache
   * keys; never fetch with these.
   */
  public List<FetchPlan> cachePlans(long startMs, long endMs) {
    return split(startMs, endMs, alignedBoundary());
  }

  private static List<FetchPlan> split(long startMs, long endMs, long boundary) {
    if (endMs <= startMs) {
      throw new IllegalArgumentException("Query end must be after start");
    }
    final List<FetchPlan> plans = new ArrayList<>(2);
    if (startMs < boundary) {
      plans.add(new FetchPlan(Tier.raw, startMs, Math.min(endMs, boundary)));
    }
    if (endMs > boundary) {
      plans.add(new FetchPlan(Tier.aggregated, Math.max(startMs, boundary), endMs));
    }
    return plans;
  }

  /**
   * Groups samples by point in ascending timestamp order. When both tiers returned a sample
   * for the same point and timestamp the aggregated one is kept.
   */
  public static Map<String, List<Sample>> stitch(Collection<Sample> samples) {
    final Map<String, List<Sample>> byPoint = new LinkedHashMap<>();
    samples.stream()
        .sorted(Comparator.comparing(Sample::getPoint)
            .thenComparingLong(Sample::getTimestampMs)
            // aggregated first so it wins the de-duplication below
            .thenComparing(sample -> sample.getTier() == Tier.aggregated ? 0 : 1))
        .forEach(sample -> {
          final List<Sample> series = byPoint.computeIfAbsent(sample.getPoint(),
              k -> new ArrayList<>());
          if (series.isEmpty()
              || series.get(series.size() - 1).getTimestampMs() != sample.getTimestampMs()) {
            series.add(sample);
          }
        });
    return byPoint;
  }
}
