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

import com.datastax.oss.driver.api.core.cql.BatchStatementBuilder;
import com.datastax.oss.driver.api.core.cql.BatchableStatement;
import com.datastax.oss.driver.api.core.cql.BatchType;
import com.datastax.oss.driver.api.core.cql.SimpleStatementBuilder;
import com.datastax.oss.driver.api.core.cql.Statement;
import com.google.common.collect.Lists;
import com.rackspace.vesta.app.config.AppProperties;
import com.rackspace.vesta.app.exceptions.StorageWriteFailedException;
import com.rackspace.vesta.app.model.Quality;
import com.rackspace.vesta.app.model.Sample;
import com.rackspace.vesta.app.model.Tier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable store of normalized samples keyed by <code>(site, point, timestampMs, tier)</code>.
 * <p>
 * Writes are upserts: re-writing a sample replaces the stored value. Each statement carries
 * an explicit Cassandra write time taken from a strictly increasing microsecond counter seeded
 * by the clock, so a later write always outranks an earlier one from this process even within
 * the same millisecond. Equal write times would otherwise be resolved by comparing values.
 * </p>
 */
@Service
@Slf4j
public class SampleStorageService {

  /**
   * Statements per unlogged batch. Batches only ever target one partition.
   */
  static final int BATCH_SIZE = 100;
  private static final int WRITE_CONCURRENCY = 16;

  private final ReactiveCqlTemplate cqlTemplate;
  private final DataTablesStatements dataTablesStatements;
  private final TimeSlotPartitioner timeSlotPartitioner;
  private final AppProperties appProperties;
  private final Clock clock;
  private final Counter dbWriteErrorsCounter;
  private final Counter dbReadErrorsCounter;
  private final AtomicLong lastWriteTimeMicros = new AtomicLong();

  @Autowired
  public SampleStorageService(ReactiveCqlTemplate cqlTemplate,
                              DataTablesStatements dataTablesStatements,
                              TimeSlotPartitioner timeSlotPartitioner,
                              AppProperties appProperties,
                              Clock clock,
                              MeterRegistry meterRegistry) {
    this.cqlTemplate = cqlTemplate;
    this.dataTablesStatements = dataTablesStatements;
    this.timeSlotPartitioner = timeSlotPartitioner;
    this.appProperties = appProperties;
    this.clock = clock;
    dbWriteErrorsCounter = meterRegistry.counter("vesta.db.operation.errors", "type", "write");
    dbReadErrorsCounter = meterRegistry.counter("vesta.db.operation.errors", "type", "read");
  }

  /**
   * Upserts the given samples. When the collection holds the same
   * <code>(site, point, timestampMs, tier)</code> more than once, the last occurrence is
   * the one stored.
   *
   * @return the number of distinct samples written
   * @throws StorageWriteFailedException via the returned mono when retries are exhausted
   */
  public Mono<Long> upsert(Collection<Sample> samples) {
    if (samples.isEmpty()) {
      return Mono.just(0L);
    }
    final Collection<Sample> latest = samples.stream()
        .collect(Collectors.toMap(
            sample -> new SampleKey(sample.getSite(), sample.getPoint(),
                sample.getTimestampMs(), sample.getTier()),
            Function.identity(),
            (earlier, later) -> later,
            LinkedHashMap::new
        ))
        .values();

    final Map<PartitionKey, List<Sample>> byPartition = latest.stream()
        .collect(Collectors.groupingBy(
            sample -> new PartitionKey(sample.getSite(), sample.getPoint(),
                timeSlotPartitioner.timeSlot(sample.getTimestampMs())),
            LinkedHashMap::new,
            Collectors.toList()
        ));

    return Flux.fromIterable(byPartition.entrySet())
        .flatMapIterable(entry -> Lists.partition(entry.getValue(), BATCH_SIZE))
        .flatMap(this::storeBatch, WRITE_CONCURRENCY)
        .reduce(0L, Long::sum)
        .onErrorMap(e -> !(e instanceof StorageWriteFailedException),
            e -> new StorageWriteFailedException(
                "Failed to store " + samples.size() + " samples", e))
        .name("storeSamples")
        .metrics();
  }

  private Mono<Long> storeBatch(List<Sample> chunk) {
    final BatchStatementBuilder batchStatementBuilder = new BatchStatementBuilder(
        BatchType.UNLOGGED);
    chunk.forEach(sample -> batchStatementBuilder.addStatement(insertStatement(sample,
        nextWriteTimeMicros())));
    final Statement<?> batch = batchStatementBuilder.build();

    return cqlTemplate.execute(batch)
        .retryWhen(appProperties.getRetryStorageWrite().build())
        .doOnError(e -> {
          dbWriteErrorsCounter.increment();
          log.warn("Storing batch of {} samples failed", chunk.size(), e);
        })
        .thenReturn((long) chunk.size())
        .checkpoint();
  }

  private BatchableStatement<?> insertStatement(Sample sample, long writeTimeMicros) {
    return new SimpleStatementBuilder(dataTablesStatements.sampleInsert())
        .addPositionalValues(
            // SITE, POINT, TIME_PARTITION_SLOT, TIMESTAMP, TIER, VALUE, QUALITY, write time
            sample.getSite(),
            sample.getPoint(),
            timeSlotPartitioner.timeSlot(sample.getTimestampMs()),
            sample.getTimestampMs(),
            sample.getTier().name(),
            sample.getValue(),
            sample.getQuality().name(),
            writeTimeMicros
        )
        .build();
  }

  /**
   * @return a write time strictly greater than any previously issued by this instance
   */
  long nextWriteTimeMicros() {
    final long nowMicros = TimeUnit.MILLISECONDS.toMicros(clock.millis());
    return lastWriteTimeMicros.updateAndGet(last -> Math.max(nowMicros, last + 1));
  }

  /**
   * Reads the stored samples of one point in <code>[startMs, endMs)</code>, ascending by
   * timestamp. A timestamp stored under both tiers appears once per tier.
   */
  public Flux<Sample> query(String site, String point, long startMs, long endMs) {
    return Flux.fromIterable(timeSlotPartitioner.partitionsOverRange(startMs, endMs))
        .concatMap(timeSlot ->
            cqlTemplate.queryForRows(dataTablesStatements.sampleQuery(),
                    site, point, timeSlot, startMs, endMs)
                .map(row -> new Sample(
                    site,
                    point,
                    row.getLong(0),
                    row.getDouble(2),
                    Quality.valueOf(Objects.requireNonNull(row.getString(3))),
                    Tier.valueOf(Objects.requireNonNull(row.getString(1)))
                ))
        )
        .retryWhen(appProperties.getRetryStorageRead().build())
        .doOnError(e -> dbReadErrorsCounter.increment())
        .checkpoint();
  }

  /**
   * Reads several points and stitches each into one ascending series.
   */
  public Mono<Map<String, List<Sample>>> query(String site, List<String> points, long startMs,
                                               long endMs) {
    return Flux.fromIterable(points)
        .concatMap(point -> query(site, point, startMs, endMs))
        .collectList()
        .map(TierRouter::stitch)
        .name("querySamples")
        .metrics();
  }

  @Value
  private static class SampleKey {
    String site;
    String point;
    long timestampMs;
    Tier tier;
  }

  @Value
  private static class PartitionKey {
    String site;
    String point;
    long timeSlot;
  }
}
