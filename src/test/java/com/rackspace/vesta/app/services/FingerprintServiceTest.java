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

import com.rackspace.vesta.app.model.FetchPlan;
import com.rackspace.vesta.app.model.Tier;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class FingerprintServiceTest {

  static final Duration MINUTE = Duration.ofMinutes(1);
  static final List<FetchPlan> PLANS = List.of(
      new FetchPlan(Tier.raw, 1000, 5000),
      new FetchPlan(Tier.aggregated, 5000, 9000)
  );

  final FingerprintService fingerprintService = new FingerprintService();

  @Test
  void pointOrderDoesNotMatter() {
    assertThat(fingerprintService.fingerprint("S1", List.of("P2", "P1", "P3"), 1000, 9000, PLANS,
        MINUTE)).isEqualTo(
        fingerprintService.fingerprint("S1", List.of("P1", "P3", "P2"), 1000, 9000, PLANS,
            MINUTE));
  }

  @Test
  void duplicatePointsDoNotMatter() {
    assertThat(fingerprintService.fingerprint("S1", List.of("P1", "P1"), 1000, 9000, PLANS,
        MINUTE)).isEqualTo(
        fingerprintService.fingerprint("S1", List.of("P1"), 1000, 9000, PLANS, MINUTE));
  }

  @Test
  void prefixedWithSite() {
    assertThat(fingerprintService.fingerprint("S1", List.of("P1"), 1000, 9000, PLANS, MINUTE))
        .startsWith("S1:");
    assertThat(fingerprintService.seriesKey("S1", List.of("P1"), MINUTE))
        .startsWith("S1:")
        .hasSize("S1:".length() + 32);
  }

  @Test
  void everyParameterContributes() {
    final String base = fingerprintService.fingerprint("S1", List.of("P1"), 1000, 9000, PLANS,
        MINUTE);

    assertThat(fingerprintService.fingerprint("S2", List.of("P1"), 1000, 9000, PLANS, MINUTE))
        .isNotEqualTo(base);
    assertThat(fingerprintService.fingerprint("S1", List.of("P2"), 1000, 9000, PLANS, MINUTE))
        .isNotEqualTo(base);
    assertThat(fingerprintService.fingerprint("S1", List.of("P1"), 1001, 9000, PLANS, MINUTE))
        .isNotEqualTo(base);
    assertThat(fingerprintService.fingerprint("S1", List.of("P1"), 1000, 9001, PLANS, MINUTE))
        .isNotEqualTo(base);
    assertThat(fingerprintService.fingerprint("S1", List.of("P1"), 1000, 9000,
        List.of(new FetchPlan(Tier.aggregated, 1000, 9000)), MINUTE))
        .isNotEqualTo(base);
    assertThat(fingerprintService.fingerprint("S1", List.of("P1"), 1000, 9000, PLANS,
        Duration.ofMinutes(5)))
        .isNotEqualTo(base);
  }

  @Test
  void pointNamesAreNotAmbiguous() {
    assertThat(fingerprintService.seriesKey("S1", List.of("a,b"), MINUTE))
        .isNotEqualTo(fingerprintService.seriesKey("S1", List.of("a", "b"), MINUTE));
  }

  @Test
  void seriesKeyIgnoresRange() {
    assertThat(fingerprintService.seriesKey("S1", List.of("P2", "P1"), MINUTE))
        .isEqualTo(fingerprintService.seriesKey("S1", List.of("P1", "P2"), MINUTE));
  }
}
