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
import com.rackspace.vesta.app.model.Quality;
import com.rackspace.vesta.app.model.RawSample;
import com.rackspace.vesta.app.model.Sample;
import com.rackspace.vesta.app.model.Tier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SampleNormalizerTest {

  static final long START = Instant.parse("2024-01-15T00:00:00Z").toEpochMilli();
  static final long END = Instant.parse("2024-01-16T00:00:00Z").toEpochMilli();
  static final FetchPlan PLAN = new FetchPlan(Tier.raw, START, END);

  final MeterRegistry meterRegistry = new SimpleMeterRegistry();
  final SampleNormalizer sampleNormalizer = new SampleNormalizer(meterRegistry);

  @Test
  void valuesAndQualities() {
    final List<Sample> samples = sampleNormalizer.normalize("S1", PLAN, Set.of(), List.of(
        raw("P1", "2024-01-15T01:00:00Z", 12.5),
        raw("P1", "2024-01-15T02:00:00Z", "7.25"),
        raw("P1", "2024-01-15T03:00:00Z", true),
        raw("P1", "2024-01-15T04:00:00Z", null),
        raw("P1", "2024-01-15T05:00:00Z", "n/a"),
        raw("P1", "2024-01-15T06:00:00Z", "Infinity")
    ));

    assertThat(samples).extracting(Sample::getQuality).containsExactly(
        Quality.good, Quality.good, Quality.uncertain, Quality.bad, Quality.bad, Quality.bad);
    assertThat(samples.get(0).getValue()).isEqualTo(12.5);
    assertThat(samples.get(1).getValue()).isEqualTo(7.25);
    assertThat(samples.get(2).getValue()).isEqualTo(1.0);
    assertThat(samples.subList(3, 6)).allMatch(sample -> Double.isNaN(sample.getValue()));
    assertThat(samples).allMatch(sample -> sample.getTier() == Tier.raw
        && sample.getSite().equals("S1"));
  }

  @Test
  void malformedSamplesAreDroppedAndCounted() {
    final List<Sample> samples = sampleNormalizer.normalize("S1", PLAN, Set.of(), Arrays.asList(
        raw("P1", "2024-01-15T01:00:00Z", 1),
        raw("P1", "not a time", 2),
        raw(" ", "2024-01-15T01:00:00Z", 3),
        null
    ));

    assertThat(samples).hasSize(1);
    assertThat(meterRegistry.get("vesta.samples.malformed").counter().count()).isEqualTo(3);
  }

  @Test
  void skipsUnrequestedPointsAndOutOfRange() {
    final List<Sample> samples = sampleNormalizer.normalize("S1", PLAN, Set.of("P1"), List.of(
        raw("P1", START, 1),
        raw("P2", START, 2),
        raw("P1", START - 1, 3),
        raw("P1", END, 4),
        raw("P1", END - 1, 5)
    ));

    assertThat(samples).extracting(Sample::getTimestampMs).containsExactly(START, END - 1);
    assertThat(meterRegistry.get("vesta.samples.malformed").counter().count()).isZero();
  }

  static RawSample raw(String name, Object time, Object value) {
    return new RawSample().setName(name).setTime(time).setValue(value);
  }
}
