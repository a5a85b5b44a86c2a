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

import com.rackspace.vesta.app.config.JobProperties;
import com.rackspace.vesta.app.exceptions.DegradedServiceException;
import com.rackspace.vesta.app.exceptions.JobNotFoundException;
import com.rackspace.vesta.app.model.Job;
import com.rackspace.vesta.app.model.JobStatus;
import com.rackspace.vesta.app.model.JobStatusView;
import com.rackspace.vesta.app.model.TimeRange;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Submission, status and cancellation of jobs. Processing is done by {@link JobWorker}.
 */
@Service
@Slf4j
public class JobService {

  static final String CANCELLED = "cancelled";

  private final JobStore jobStore;
  private final JobQueue jobQueue;
  private final JobProperties jobProperties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  @Autowired
  public JobService(JobStore jobStore,
                    JobQueue jobQueue,
                    JobProperties jobProperties,
                    Clock clock,
                    MeterRegistry meterRegistry) {
    this.jobStore = jobStore;
    this.jobQueue = jobQueue;
    this.jobProperties = jobProperties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Enqueues a job fetching the given ranges, unless a queued or processing job already
   * exists for the same cache key, in which case that job's id is returned.
   */
  public Mono<UUID> submit(String site, List<String> points, List<TimeRange> ranges,
                           long startMs, long endMs, Duration resolution, String cacheKey) {
    return findLiveJob(cacheKey)
        .map(Job::getId)
        .doOnNext(existing -> log.debug("Reusing live job={} for cacheKey={}", existing, cacheKey))
        .switchIfEmpty(Mono.defer(() ->
            create(site, points, ranges, startMs, endMs, resolution, cacheKey)))
        .onErrorMap(e -> !(e instanceof IllegalArgumentException),
            e -> new DegradedServiceException("Unable to enqueue job", e));
  }

  /**
   * Submits the parameters of a finished job again, with fresh retry state.
   */
  public Mono<UUID> resubmit(Job previous) {
    return submit(previous.getSite(), previous.getPoints(), previous.getRanges(),
        previous.getStartMs(), previous.getEndMs(), previous.getResolution(),
        previous.getCacheKey());
  }

  private Mono<Job> findLiveJob(String cacheKey) {
    return jobQueue.findLive(cacheKey)
        .flatMap(jobStore::find)
        .filter(job -> job.getStatus() == JobStatus.queued
            || job.getStatus() == JobStatus.processing);
  }

  private Mono<UUID> create(String site, List<String> points, List<TimeRange> ranges,
                            long startMs, long endMs, Duration resolution, String cacheKey) {
    if (points.isEmpty() || ranges.isEmpty()) {
      return Mono.error(new IllegalArgumentException("A job needs at least one point and range"));
    }
    final Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    final Job job = new Job()
        .setId(UUID.randomUUID())
        .setSite(site)
        .setPoints(new ArrayList<>(points))
        .setRanges(new ArrayList<>(ranges))
        .setStartMs(startMs)
        .setEndMs(endMs)
        .setResolution(resolution)
        .setStatus(JobStatus.queued)
        .setCacheKey(cacheKey)
        .setTotalBatches(totalBatches(points.size(), ranges.size()))
        .setPointErrors(new LinkedHashMap<>())
        .setCreatedAt(now);

    return jobStore.insert(job)
        .flatMap(inserted -> jobQueue.registerLive(cacheKey, job.getId(), liveTtl()))
        .flatMap(registered -> {
          if (registered) {
            return enqueue(job, now);
          }
          // another submission won the race; use its job if it is still live
          return findLiveJob(cacheKey)
              .flatMap(winner -> supersede(job, winner.getId(), now).thenReturn(winner.getId()))
              .switchIfEmpty(Mono.defer(() ->
                  jobQueue.replaceLive(cacheKey, job.getId(), liveTtl())
                      .then(enqueue(job, now))));
        });
  }

  private Mono<Boolean> supersede(Job job, UUID winner, Instant now) {
    final String reason = "superseded by " + winner;
    log.debug("Job={} lost the submission race to job={}", job.getId(), winner);
    return jobStore.cancelQueued(job.getId(), reason, now)
        .filter(Boolean::booleanValue)
        .flatMap(applied -> {
          job.setStatus(JobStatus.failed).setError(reason).setCompletedAt(now);
          return jobStore.archive(job, now)
              .then(jobQueue.retainUntilPurge(job.getId(), now));
        })
        .defaultIfEmpty(false);
  }

  private Mono<UUID> enqueue(Job job, Instant now) {
    return jobQueue.enqueue(job.getId(), now)
        .doOnNext(queued -> {
          recordTransition(JobStatus.queued);
          log.info("Queued job={} site={} points={} ranges={} batches={}", job.getId(),
              job.getSite(), job.getPoints().size(), job.getRanges().size(),
              job.getTotalBatches());
        })
        .thenReturn(job.getId());
  }

  int totalBatches(int points, int ranges) {
    final int chunks = (points + jobProperties.getPointsPerBatch() - 1)
        / jobProperties.getPointsPerBatch();
    return chunks * ranges;
  }

  private Duration liveTtl() {
    return jobProperties.getRetention();
  }

  /**
   * Looks the job up in the live table, then in the history table.
   */
  public Mono<JobStatusView> status(UUID jobId) {
    return jobStore.find(jobId)
        .switchIfEmpty(Mono.defer(() -> jobStore.findArchived(jobId)))
        .map(JobService::toView)
        .switchIfEmpty(Mono.error(new JobNotFoundException(jobId)));
  }

  /**
   * Cancels a job. A queued job fails immediately; a processing job is flagged and stops
   * before its next sub-batch. Finished jobs are left unchanged.
   */
  public Mono<JobStatusView> cancel(UUID jobId) {
    return jobStore.find(jobId)
        .switchIfEmpty(Mono.error(new JobNotFoundException(jobId)))
        .flatMap(job -> {
          if (job.getStatus() == JobStatus.queued) {
            final Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            return jobStore.cancelQueued(jobId, CANCELLED, now)
                .flatMap(applied -> applied ?
                    afterQueuedCancel(job.setStatus(JobStatus.failed).setError(CANCELLED)
                        .setCompletedAt(now)) :
                    jobStore.requestCancel(jobId));
          }
          if (job.getStatus() == JobStatus.processing) {
            return jobStore.requestCancel(jobId)
                .doOnNext(flagged -> log.info("Requested cancellation of processing job={}",
                    jobId));
          }
          return Mono.just(false);
        })
        .then(Mono.defer(() -> status(jobId)));
  }

  private Mono<Boolean> afterQueuedCancel(Job job) {
    log.info("Cancelled queued job={}", job.getId());
    recordTransition(JobStatus.failed);
    return Mono.when(
            jobQueue.take(job.getId()),
            jobStore.archive(job, job.getCompletedAt()),
            jobQueue.retainUntilPurge(job.getId(), job.getCompletedAt()),
            jobQueue.forgetLive(job.getCacheKey(), job.getId())
        )
        .thenReturn(true);
  }

  void recordTransition(JobStatus status) {
    meterRegistry.counter("vesta.jobs.transitions", "status", status.name()).increment();
  }

  static JobStatusView toView(Job job) {
    final int total = job.getTotalBatches();
    return new JobStatusView()
        .setJobId(job.getId())
        .setSite(job.getSite())
        .setPoints(job.getPoints())
        .setStartMs(job.getStartMs())
        .setEndMs(job.getEndMs())
        .setStatus(job.getStatus())
        .setSampleCount(job.getSampleCount())
        .setRetryCount(job.getRetryCount())
        .setCompletedBatches(job.getCursor())
        .setTotalBatches(total)
        .setProgress(total == 0 ? 0 : Math.min(1.0, (double) job.getCursor() / total))
        .setMessage(message(job))
        .setError(job.getError())
        .setPointErrors(job.getPointErrors().isEmpty() ? null : job.getPointErrors())
        .setCreatedAt(job.getCreatedAt())
        .setStartedAt(job.getStartedAt())
        .setCompletedAt(job.getCompletedAt())
        .setArchived(job.getArchivedAt() != null);
  }

  static String message(Job job) {
    switch (job.getStatus()) {
      case queued:
        return job.getRetryCount() > 0 ?
            String.format("Waiting to retry (attempt %d)", job.getRetryCount() + 1) :
            "Waiting for a worker";
      case processing:
        return String.format("Fetched %d of %d batches", job.getCursor(),
            job.getTotalBatches());
      case completed:
        return String.format("Completed with %d samples", job.getSampleCount());
      case completed_with_errors:
        return String.format("Completed with %d samples and errors", job.getSampleCount());
      default:
        return CANCELLED.equals(job.getError()) ? "Cancelled" : "Failed";
    }
  }
}
