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

import com.rackspace.vesta.app.entities.DeadLetter;
import com.rackspace.vesta.app.exceptions.JobNotFoundException;
import com.rackspace.vesta.app.exceptions.StorageWriteFailedException;
import com.rackspace.vesta.app.exceptions.UpstreamRejectedException;
import com.rackspace.vesta.app.exceptions.UpstreamTransientException;
import com.rackspace.vesta.app.model.ErrorType;
import com.rackspace.vesta.app.model.Job;
import com.rackspace.vesta.app.model.JobStatus;
import com.rackspace.vesta.app.model.JobStatusView;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.ReactiveCassandraTemplate;
import org.springframework.data.cassandra.core.query.Criteria;
import org.springframework.data.cassandra.core.query.Query;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Records jobs that exhausted their retries and supports inspecting and re-submitting them.
 */
@Service
@Slf4j
public class DeadLetterService {

  static final int LOOKBACK_DAYS = 30;

  private final ReactiveCassandraTemplate cassandraTemplate;
  private final JobStore jobStore;
  private final JobService jobService;
  private final Clock clock;

  @Autowired
  public DeadLetterService(ReactiveCassandraTemplate cassandraTemplate,
                           JobStore jobStore,
                           JobService jobService,
                           Clock clock) {
    this.cassandraTemplate = cassandraTemplate;
    this.jobStore = jobStore;
    this.jobService = jobService;
    this.clock = clock;
  }

  /**
   * Records the failed job. The job's completion time is used as the failure time so the
   * record can be found again from the archived job.
   */
  public Mono<DeadLetter> record(Job job, Throwable cause) {
    final Instant failedAt = job.getCompletedAt() != null ? job.getCompletedAt() :
        clock.instant();
    final DeadLetter deadLetter = new DeadLetter();
    deadLetter.setDay(dayOf(failedAt));
    deadLetter.setFailedAt(failedAt);
    deadLetter.setJobId(job.getId());
    deadLetter.setSite(job.getSite());
    deadLetter.setPoints(job.getPoints());
    deadLetter.setStartMs(job.getStartMs());
    deadLetter.setEndMs(job.getEndMs());
    deadLetter.setCacheKey(job.getCacheKey());
    deadLetter.setError(job.getError());
    deadLetter.setErrorType(classify(cause));
    deadLetter.setRetryCount(job.getRetryCount());

    log.warn("Dead-lettering job={} after {} retries errorType={}: {}",
        job.getId(), job.getRetryCount(), deadLetter.getErrorType(), job.getError());
    return cassandraTemplate.insert(deadLetter);
  }

  /**
   * @return up to <code>limit</code> dead letters, most recent first
   */
  public Flux<DeadLetter> listRecent(int limit) {
    if (limit <= 0) {
      return Flux.error(new IllegalArgumentException("limit must be positive"));
    }
    final LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    return Flux.range(0, LOOKBACK_DAYS)
        .map(daysAgo -> today.minusDays(daysAgo).toString())
        .concatMap(day -> cassandraTemplate.select(
            Query.query(Criteria.where("day").is(day)).limit(limit),
            DeadLetter.class), 1)
        .take(limit);
  }

  /**
   * Submits the dead-lettered job's parameters as a new job.
   *
   * @return status of the new job, or of an existing live job for the same query
   */
  public Mono<JobStatusView> requeue(UUID jobId) {
    return jobStore.findArchived(jobId)
        .filter(job -> job.getStatus() == JobStatus.failed)
        .switchIfEmpty(Mono.error(new JobNotFoundException(jobId)))
        .flatMap(failed -> jobService.resubmit(failed)
            .flatMap(newJobId -> markRequeued(failed, newJobId)
                .then(jobService.status(newJobId))));
  }

  private Mono<DeadLetter> markRequeued(Job failed, UUID newJobId) {
    if (failed.getCompletedAt() == null) {
      return Mono.empty();
    }
    return cassandraTemplate.selectOne(
            Query.query(
                Criteria.where("day").is(dayOf(failed.getCompletedAt())),
                Criteria.where("failedAt").is(failed.getCompletedAt()),
                Criteria.where("jobId").is(failed.getId())
            ),
            DeadLetter.class)
        .flatMap(deadLetter -> cassandraTemplate.update(deadLetter.setRequeuedAs(newJobId)))
        .doOnNext(deadLetter -> log.info("Requeued dead-lettered job={} as job={}",
            failed.getId(), newJobId));
  }

  /**
   * Classifies the final failure of a job.
   */
  public static ErrorType classify(Throwable cause) {
    if (cause == null) {
      return ErrorType.UNKNOWN;
    }
    if (cause instanceof UpstreamRejectedException) {
      return ErrorType.USER_ERROR;
    }
    if (cause instanceof UpstreamTransientException) {
      final int status = ((UpstreamTransientException) cause).getStatus();
      return status == 500 || status == 502 ? ErrorType.SYSTEM_ERROR : ErrorType.RECOVERABLE;
    }
    if (cause instanceof TimeoutException) {
      return ErrorType.RECOVERABLE;
    }
    if (cause instanceof StorageWriteFailedException) {
      return ErrorType.SYSTEM_ERROR;
    }
    if (cause instanceof IllegalArgumentException) {
      return ErrorType.USER_ERROR;
    }
    return classifyMessage(cause.getMessage());
  }

  static ErrorType classifyMessage(String message) {
    final String text = StringUtils.defaultString(message).toLowerCase(Locale.ROOT);
    if (StringUtils.containsAny(text, "timeout", "timed out", "rate limit", "503", "504")) {
      return ErrorType.RECOVERABLE;
    }
    if (StringUtils.containsAny(text, "invalid", "not found", "400", "401", "403", "404")) {
      return ErrorType.USER_ERROR;
    }
    if (StringUtils.containsAny(text, "internal", "500", "502")) {
      return ErrorType.SYSTEM_ERROR;
    }
    return ErrorType.UNKNOWN;
  }

  static String dayOf(Instant instant) {
    return LocalDate.ofInstant(instant, ZoneOffset.UTC).toString();
  }
}
