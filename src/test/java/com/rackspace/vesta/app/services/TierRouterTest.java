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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.vesta.app.MutableClock;
import com.rackspace.vesta.app.config.AppProperties;
import com.rackspace.vesta.app.model.FetchPlan;
import com.rackspace.vesta.app.model.Quality;
import com.rackspace.vesta.app.model.Sample;
import com.rackspace.vesta.app.model.Tier;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TierRouterTest {

  static final Instant NOW = Instant.parse("2024-03-10T12:07:30Z");
  static final long HOUR = Duration.ofHours(1).toMillis();
  static final long MINUTE = Duration.ofMinutes(1).toMillis();
  // now - 48h
  static final long BOUNDARY = Instant.parse("2024-03-08T12:07:30Z").toEpochMilli();
  // now - 48h aligned down to 15 minutes
  static final long ALIGNED_BOUNDARY = Instant.parse("2024-03-08T12:00:00Z").toEpochMilli();

  final AppProperties appProperties = new AppProperties()
      .setLagThreshold(Duration.ofHours(48))
      .setTierBoundaryAlignment(Duration.ofMinutes(15));
  final MutableClock clock = new MutableClock(NOW);
  final TierRouter tierRouter = new TierRouter(appProperties, clock);

  @Test
  void boundaryIsNowMinusLag() {
    assertThat(tierRouter.boundary()).isEqualTo(BOUNDARY);
    assertThat(tierRouter.alignedBoundary()).isEqualTo(ALIGNED_BOUNDARY);
  }

  @Nested
  class route {

    @Test
    void fiftyHoursSplitAtFortyEightHourMark() {
      final long now = NOW.toEpochMilli();
      final List<FetchPlan> plans = tierRouter.route("S1", List.of("P1"), now - 50 * HOUR, now);

      assertThat(plans).containsExactly(
          new FetchPlan(Tier.raw, now - 50 * HOUR, now - 48 * HOUR),
          new FetchPlan(Tier.aggregated, now - 48 * HOUR, now)
      );
      assertThat(plans.get(0).durationMs()).isEqualTo(2 * HOUR);
      assertThat(plans.get(1).durationMs()).isEqualTo(48 * HOUR);
    }

    @Test
    void justOlderThanLagIsRawOnly() {
      // inside the alignment window but still older than now - 48h
      assertThat(tierRouter.route("S1", List.of("P1"), BOUNDARY - 5 * MINUTE,
          BOUNDARY - MINUTE))
          .containsExactly(new FetchPlan(Tier.raw, BOUNDARY - 5 * MINUTE, BOUNDARY - MINUTE));
    }

    @Test
    void entirelyOlderIsRawOnly() {
      assertThat(tierRouter.route("S1", List.of("P1"), BOUNDARY - 5 * HOUR, BOUNDARY - HOUR))
          .containsExactly(new FetchPlan(Tier.raw, BOUNDARY - 5 * HOUR, BOUNDARY - HOUR));
    }

    @Test
    void endingAtBoundaryIsRawOnly() {
      assertThat(tierRouter.route("S1", List.of("P1"), BOUNDARY - HOUR, BOUNDARY))
          .containsExactly(new FetchPlan(Tier.raw, BOUNDARY - HOUR, BOUNDARY));
    }

    @Test
    void startingAtBoundaryIsAggregatedOnly() {
      assertThat(tierRouter.route("S1", List.of("P1"), BOUNDARY, BOUNDARY + HOUR))
          .containsExactly(new FetchPlan(Tier.aggregated, BOUNDARY, BOUNDARY + HOUR));
    }

    @Test
    void entirelyNewerIsAggregatedOnly() {
      assertThat(tierRouter.route("S1", List.of("P1"), BOUNDARY + HOUR, NOW.toEpochMilli()))
          .containsExactly(new FetchPlan(Tier.aggregated, BOUNDARY + HOUR, NOW.toEpochMilli()));
    }

    @Test
    void emptyRangeRejected() {
      assertThatThrownBy(() -> tierRouter.route("S1", List.of("P1"), BOUNDARY, BOUNDARY))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  class cachePlans {

    @Test
    void splitAtAlignedBoundary() {
      final long now = NOW.toEpochMilli();

      assertThat(tierRouter.cachePlans(now - 50 * HOUR, now)).containsExactly(
          new FetchPlan(Tier.raw, now - 50 * HOUR, ALIGNED_BOUNDARY),
          new FetchPlan(Tier.aggregated, ALIGNED_BOUNDARY, now)
      );
    }

    @Test
    void stableWithinAlignmentWindowWhileRoutingMoves() {
      final long start = ALIGNED_BOUNDARY - HOUR;
      final long end = ALIGNED_BOUNDARY + HOUR;
      final List<FetchPlan> cacheBefore = tierRouter.cachePlans(start, end);
      final List<FetchPlan> routeBefore = tierRouter.route("S1", List.of("P1"), start, end);

      clock.advance(Duration.ofMinutes(5));

      assertThat(tierRouter.cachePlans(start, end)).isEqualTo(cacheBefore);
      assertThat(tierRouter.route("S1", List.of("P1"), start, end))
          .isNotEqualTo(routeBefore);

      clock.advance(Duration.ofMinutes(5));

      assertThat(tierRouter.cachePlans(start, end)).isNotEqualTo(cacheBefore);
    }
  }

  @Nested
  class stitch {

    @Test
    void ascendingWithAggregatedWinningAtBoundary() {
      final Map<String, List<Sample>> result = TierRouter.stitch(List.of(
          sample("P1", BOUNDARY + HOUR, 3, Tier.aggregated),
          sample("P1", BOUNDARY, 2, Tier.aggregated),
          sample("P1", BOUNDARY, 20, Tier.raw),
          sample("P1", BOUNDARY - HOUR, 1, Tier.raw)
      ));

      assertThat(result.get("P1"))
          .extracting(Sample::getTimestampMs)
          .containsExactly(BOUNDARY - HOUR, BOUNDARY, BOUNDARY + HOUR);
      assertThat(result.get("P1").get(1).getTier()).isEqualTo(Tier.aggregated);
      assertThat(result.get("P1").get(1).getValue()).isEqualTo(2.0);
    }

    @Test
    void groupsByPoint() {
      final Map<String, List<Sample>> result = TierRouter.stitch(List.of(
          sample("P2", 2, 1, Tier.raw),
          sample("P1", 3, 1, Tier.raw),
          sample("P2", 1, 1, Tier.raw)
      ));

      assertThat(result).containsOnlyKeys("P1", "P2");
      assertThat(result.get("P2")).extracting(Sample::getTimestampMs).containsExactly(1L, 2L);
    }
  }

  static Sample sample(String point, long timestampMs, double value, Tier tier) {
    return new Sample("S1", point, timestampMs, value, Quality.good, tier);
  }
}
