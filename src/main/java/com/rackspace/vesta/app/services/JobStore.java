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

import static com.rackspace.vesta.app.services.DataTablesStatements.*;

import com.datastax.oss.driver.api.core.cql.Row;
import com.rackspace.vesta.app.model.Job;
import com.rackspace.vesta.app.model.JobStatus;
import com.rackspace.vesta.app.model.TimeRange;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Persists jobs in Cassandra. Every status change is a lightweight transaction conditioned on
 * the current status, and on the owner while processing, so that two workers can never both
 * hold or finish the same job. Each transition method emits whether it was applied.
 */
@Service
@Slf4j
public class JobStore {

  private final ReactiveCqlTemplate cqlTemplate;
  private final DataTablesStatements dataTablesStatements;
  private final Counter dbErrorsCounter;

  @Autowired
  public JobStore(ReactiveCqlTemplate cqlTemplate,
                  DataTablesStatements dataTablesStatements,
                  MeterRegistry meterRegistry) {
    this.cqlTemplate = cqlTemplate;
    this.dataTablesStatements = dataTablesStatements;
    dbErrorsCounter = meterRegistry.counter("vesta.db.operation.errors", "type", "job");
  }

  public Mono<Boolean> insert(Job job) {
    return execute(dataTablesStatements.jobInsert(), jobValues(job).toArray());
  }

  public Mono<Job> find(UUID id) {
    return cqlTemplate.queryForRows(dataTablesStatements.jobSelect(), id)
        .next()
        .map(row -> toJob(row, false))
        .doOnError(e -> dbErrorsCounter.increment());
  }

  public Mono<Job> findArchived(UUID id) {
    return cqlTemplate.queryForRows(dataTablesStatements.historySelect(), id)
        .next()
        .map(row -> toJob(row, true))
        .doOnError(e -> dbErrorsCounter.increment());
  }

  /**
   * Compare-and-set from queued to processing.
   */
  public Mono<Boolean> claim(UUID id, String owner, Instant startedAt) {
    return execute(dataTablesStatements.jobClaim(), owner, startedAt, id);
  }

  public Mono<Boolean> saveProgress(Job job, String owner) {
    return execute(dataTablesStatements.jobProgress(),
        job.getCursor(), job.getTotalBatches(), job.getSampleCount(), job.getPointErrors(),
        job.getId(), owner);
  }

  /**
   * Returns a processing job to queued, persisting its progress and retry state.
   */
  public Mono<Boolean> release(Job job, String owner) {
    return execute(dataTablesStatements.jobRelease(),
        job.getRetryCount(), job.getError(), job.getCursor(), job.getTotalBatches(),
        job.getSampleCount(), job.getPointErrors(), job.getId(), owner);
  }

  /**
   * Moves a processing job to the terminal status already set on it.
   */
  public Mono<Boolean> finish(Job job, String owner) {
    if (!job.getStatus().isTerminal()) {
      return Mono.error(new IllegalArgumentException(
          "Cannot finish job with non-terminal status " + job.getStatus()));
    }
    return execute(dataTablesStatements.jobFinish(),
        job.getStatus().name(), job.getRetryCount(), job.getError(), job.getCursor(),
        job.getTotalBatches(), job.getSampleCount(), job.getPointErrors(),
        job.getCompletedAt(), job.getId(), owner);
  }

  public Mono<Boolean> cancelQueued(UUID id, String reason, Instant completedAt) {
    return execute(dataTablesStatements.jobCancelQueued(), reason, completedAt, id);
  }

  public Mono<Boolean> requestCancel(UUID id) {
    return execute(dataTablesStatements.jobFlagCancel(), id);
  }

  public Mono<Boolean> isCancelRequested(UUID id) {
    return cqlTemplate.queryForRows(dataTablesStatements.jobCancelRequested(), id)
        .next()
        .map(row -> row.getBoolean(0))
        .defaultIfEmpty(true);
  }

  /**
   * Returns an abandoned processing job to queued, if it is still held by the given owner.
   */
  public Mono<Boolean> recover(UUID id, String owner) {
    return execute(dataTablesStatements.jobRecover(), id, owner);
  }

  public Mono<Boolean> delete(UUID id) {
    return execute(dataTablesStatements.jobDelete(), id);
  }

  /**
   * Copies the job into the history table where it outlives the purge of the live row.
   */
  public Mono<Boolean> archive(Job job, Instant archivedAt) {
    final List<Object> values = jobValues(job);
    values.add(archivedAt);
    return execute(dataTablesStatements.historyInsert(), values.toArray());
  }

  private Mono<Boolean> execute(String cql, Object... args) {
    return cqlTemplate.execute(cql, args)
        .doOnError(e -> {
          dbErrorsCounter.increment();
          log.warn("Job statement failed: {}", cql, e);
        })
        .checkpoint();
  }

  private static List<Object> jobValues(Job job) {
    final List<Object> values = new ArrayList<>();
    // same order as the job columns
    values.add(job.getId());
    values.add(job.getSite());
    values.add(job.getPoints());
    values.add(job.getRanges().stream().map(TimeRange::encode).collect(Collectors.toList()));
    values.add(job.getStartMs());
    values.add(job.getEndMs());
    values.add(job.getResolution().toMillis());
    values.add(job.getStatus().name());
    values.add(job.getCacheKey());
    values.add(job.getSampleCount());
    values.add(job.getRetryCount());
    values.add(job.getCursor());
    values.add(job.getTotalBatches());
    values.add(job.isCancelRequested());
    values.add(job.getOwner());
    values.add(job.getError());
    values.add(job.getPointErrors());
    values.add(job.getCreatedAt());
    values.add(job.getStartedAt());
    values.add(job.getCompletedAt());
    return values;
  }

  static Job toJob(Row row, boolean archived) {
    final Map<String, String> pointErrors = row.getMap(POINT_ERRORS, String.class, String.class);
    final Job job = new Job()
        .setId(row.getUuid(ID))
        .setSite(row.getString(SITE))
        .setPoints(new ArrayList<>(row.getList(POINTS, String.class)))
        .setRanges(row.getList(RANGES, String.class).stream()
            .map(TimeRange::parse)
            .collect(Collectors.toList()))
        .setStartMs(row.getLong(START_MS))
        .setEndMs(row.getLong(END_MS))
        .setResolution(Duration.ofMillis(row.getLong(RESOLUTION_MS)))
        .setStatus(JobStatus.valueOf(row.getString(STATUS)))
        .setCacheKey(row.getString(CACHE_KEY))
        .setSampleCount(row.getLong(SAMPLE_COUNT))
        .setRetryCount(row.getInt(RETRY_COUNT))
        .setCursor(row.getInt(BATCH_CURSOR))
        .setTotalBatches(row.getInt(TOTAL_BATCHES))
        .setCancelRequested(row.getBoolean(CANCEL_REQUESTED))
        .setOwner(row.getString(OWNER))
        .setError(row.getString(ERROR))
        .setPointErrors(pointErrors == null ? new LinkedHashMap<>() : new LinkedHashMap<>(pointErrors))
        .setCreatedAt(row.getInstant(CREATED_AT))
        .setStartedAt(row.getInstant(STARTED_AT))
        .setCompletedAt(row.getInstant(COMPLETED_AT));
    if (archived) {
      job.setArchivedAt(row.getInstant(ARCHIVED_AT));
    }
    return job;
  }
}
