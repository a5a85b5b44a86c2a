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

import com.datastax.oss.driver.api.core.CqlSession;
import com.rackspace.vesta.app.CassandraContainerSetup;
import com.rackspace.vesta.app.MutableClock;
import com.rackspace.vesta.app.config.AppProperties;
import com.rackspace.vesta.app.config.DataTablesPopulator;
import com.rackspace.vesta.app.model.Quality;
import com.rackspace.vesta.app.model.Sample;
import com.rackspace.vesta.app.model.Tier;
import com.rackspace.vesta.app.utils.TimestampNormalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.apache.commons.lang3.RandomStringUtils;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.data.cassandra.core.cql.session.DefaultBridgedReactiveSession;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.test.StepVerifier;

@Testcontainers(disabledWithoutDocker = true)
class SampleStorageServiceTest {

  static final long DAY_MS = Duration.ofDays(1).toMillis();

  static CqlSession session;
  static final MutableClock clock = new MutableClock(Instant.parse("2024-01-15T00:00:00Z"));
  static SampleStorageService storageService;

  @BeforeAll
  static void setUp() {
    final AppProperties appProperties = new AppProperties();
    session = CassandraContainerSetup.newSession();
    new DataTablesPopulator(appProperties).populate(session);
    storageService = new SampleStorageService(
        new ReactiveCqlTemplate(new DefaultBridgedReactiveSession(session)),
        new DataTablesStatements(), new TimeSlotPartitioner(appProperties), appProperties,
        clock, new SimpleMeterRegistry());
  }

  @AfterAll
  static void tearDown() {
    session.close();
  }

  @Test
  void storesAndReadsAcrossPartitions() {
    final String site = RandomStringUtils.randomAlphanumeric(8);
    final long base = Instant.parse("2024-01-10T00:00:00Z").toEpochMilli();
    final List<Sample> samples = List.of(
        new Sample(site, "P1", base + 1, 1.0, Quality.good, Tier.raw),
        new Sample(site, "P1", base + DAY_MS + 2, 2.0, Quality.uncertain, Tier.raw),
        new Sample(site, "P1", base + 2 * DAY_MS + 3, 3.0, Quality.good, Tier.aggregated));

    StepVerifier.create(storageService.upsert(samples))
        .expectNext(3L)
        .verifyComplete();

    StepVerifier.create(storageService.query(site, "P1", base, base + 3 * DAY_MS).collectList())
        .assertNext(found -> {
          assertThat(found).extracting(Sample::getTimestampMs)
              .containsExactly(base + 1, base + DAY_MS + 2, base + 2 * DAY_MS + 3);
          assertThat(found.get(1).getQuality()).isEqualTo(Quality.uncertain);
          assertThat(found.get(2).getTier()).isEqualTo(Tier.aggregated);
        })
        .verifyComplete();
  }

  @Test
  void rewriteKeepsLaterValueWithinSameMillisecond() {
    final String site = RandomStringUtils.randomAlphanumeric(8);
    final long timestamp = Instant.parse("2024-01-12T10:15:00.123Z").toEpochMilli();

    // the clock does not move between the writes and the larger value is written first
    StepVerifier.create(storageService.upsert(List.of(
            new Sample(site, "P1", timestamp, 5.0, Quality.good, Tier.raw))))
        .expectNext(1L)
        .verifyComplete();
    StepVerifier.create(storageService.upsert(List.of(
            new Sample(site, "P1", timestamp, 3.0, Quality.good, Tier.raw))))
        .expectNext(1L)
        .verifyComplete();

    StepVerifier.create(storageService.query(site, "P1", timestamp, timestamp + 1).collectList())
        .assertNext(found -> {
          assertThat(found).hasSize(1);
          assertThat(found.get(0).getValue()).isEqualTo(3.0);
          assertThat(found.get(0).getTimestampMs()).isEqualTo(timestamp);
        })
        .verifyComplete();
  }

  @Test
  void duplicatesWithinOneCallKeepLastOccurrence() {
    final String site = RandomStringUtils.randomAlphanumeric(8);
    final long timestamp = Instant.parse("2024-01-12T11:00:00Z").toEpochMilli();

    StepVerifier.create(storageService.upsert(List.of(
            new Sample(site, "P1", timestamp, 9.0, Quality.good, Tier.raw),
            new Sample(site, "P1", timestamp, 4.0, Quality.uncertain, Tier.raw))))
        .expectNext(1L)
        .verifyComplete();

    StepVerifier.create(storageService.query(site, "P1", timestamp, timestamp + 1).collectList())
        .assertNext(found -> {
          assertThat(found).hasSize(1);
          assertThat(found.get(0).getValue()).isEqualTo(4.0);
          assertThat(found.get(0).getQuality()).isEqualTo(Quality.uncertain);
        })
        .verifyComplete();
  }

  @Test
  void normalizedTimestampsReadBackUnchanged() {
    final String site = RandomStringUtils.randomAlphanumeric(8);
    final long withOffset = TimestampNormalizer.toEpochMillis("2024-01-12T10:15:00.123456+02:00");
    final long halfMilli = TimestampNormalizer.toEpochMillis("2024-01-12T08:16:00.1235Z");
    final long epochSeconds = TimestampNormalizer.toEpochMillis(1705047420.0017);
    assertThat(withOffset).isEqualTo(Instant.parse("2024-01-12T08:15:00.123Z").toEpochMilli());
    assertThat(halfMilli).isEqualTo(Instant.parse("2024-01-12T08:16:00.124Z").toEpochMilli());
    assertThat(epochSeconds).isEqualTo(1705047420002L);

    StepVerifier.create(storageService.upsert(List.of(
            new Sample(site, "P1", withOffset, 1.0, Quality.good, Tier.raw),
            new Sample(site, "P1", halfMilli, 2.0, Quality.good, Tier.raw),
            new Sample(site, "P1", epochSeconds, 3.0, Quality.good, Tier.raw))))
        .expectNext(3L)
        .verifyComplete();

    StepVerifier.create(storageService.query(site, "P1", withOffset, epochSeconds + 1)
            .map(Sample::getTimestampMs)
            .collectList())
        .assertNext(found -> assertThat(found)
            .containsExactly(withOffset, halfMilli, epochSeconds))
        .verifyComplete();
  }

  @Test
  void writeTimesStrictlyIncreaseOnFixedClock() {
    final long first = storageService.nextWriteTimeMicros();
    final long second = storageService.nextWriteTimeMicros();

    assertThat(second).isGreaterThan(first);
  }

  @Test
  void stitchesTiersPerPoint() {
    final String site = RandomStringUtils.randomAlphanumeric(8);
    final long timestamp = Instant.parse("2024-01-13T00:00:00Z").toEpochMilli();

    StepVerifier.create(storageService.upsert(List.of(
            new Sample(site, "P1", timestamp, 1.0, Quality.good, Tier.raw),
            new Sample(site, "P1", timestamp, 2.0, Quality.good, Tier.aggregated),
            new Sample(site, "P2", timestamp + 60_000, 3.0, Quality.good, Tier.raw))))
        .expectNext(3L)
        .verifyComplete();

    StepVerifier.create(storageService.query(site, List.of("P1", "P2"), timestamp,
            timestamp + DAY_MS))
        .assertNext(series -> {
          assertThat(series.get("P1")).hasSize(1);
          assertThat(series.get("P1").get(0).getTier()).isEqualTo(Tier.aggregated);
          assertThat(series.get("P2")).extracting(Sample::getValue).containsExactly(3.0);
        })
        .verifyComplete();
  }
}
