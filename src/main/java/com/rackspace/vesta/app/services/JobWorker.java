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

import com.google.common.collect.Lists;
import com.rackspace.vesta.app.config.JobProperties;
import com.rackspace.vesta.app.exceptions.DegradedServiceException;
import com.rackspace.vesta.app.exceptions.JobCancelledException;
import com.rackspace.vesta.app.exceptions.UpstreamRejectedException;
import com.rackspace.vesta.app.model.DispatchMode;
import com.rackspace.vesta.app.model.Job;
import com.rackspace.vesta.app.model.JobStatus;
import com.rackspace.vesta.app.model.Sample;
import com.rackspace.vesta.app.model.SeriesResult;
import com.rackspace.vesta.app.model.TimeRange;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import javax.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.RetryBackoffSpec;

/**
 * Takes due jobs off the queue and processes them.
 * <p>
 * A job's points are split into sub-batches of <code>pointsPerBatch</code> points per range.
 * Sub-batches run with bounded concurrency and are committed in order: the job's cursor is
 * the number of leading sub-batches completed. New sub-batches stop starting once the
 * invocation's time budget is spent or cancellation is requested; an unfinished job goes back
 * to the queue and resumes from its cursor.
 * </p>
 * <p>
 * A failed sub-batch fails the invocation. The job is re-queued with exponential backoff
 * until it has failed <code>maxRetries + 1</code> times, after which it either completes with
 * errors, if any sub-batch succeeded, or fails and is dead-lettered.
 * </p>
 */
@Service
@Slf4j
@Profile("worker")
public class JobWorker {

  private final JobStore jobStore;
  private final JobQueue jobQueue;
  private final JobService jobService;
  private final DeadLetterService deadLetterService;
  private final SampleFetcher sampleFetcher;
  private final SampleStorageService sampleStorageService;
  private final QueryCacheService queryCacheService;
  private final FingerprintService fingerprintService;
  private final JobProperties properties;
  private final ScheduledExecutorService executor;
  private final Clock clock;
  private final String owner;
  private final AtomicInteger inFlight = new AtomicInteger();

  @Autowired
  public JobWorker(JobStore jobStore,
                   JobQueue jobQueue,
                   JobService jobService,
                   DeadLetterService deadLetterService,
                   SampleFetcher sampleFetcher,
                   SampleStorageService sampleStorageService,
                   QueryCacheService queryCacheService,
                   FingerprintService fingerprintService,
                   JobProperties properties,
                   ScheduledExecutorService executor,
                   Clock clock) {
    this.jobStore = jobStore;
    this.jobQueue = jobQueue;
    this.jobService = jobService;
    this.deadLetterService = deadLetterService;
    this.sampleFetcher = sampleFetcher;
    this.sampleStorageService = sampleStorageService;
    this.queryCacheService = queryCacheService;
    this.fingerprintService = fingerprintService;
    this.properties = properties;
    this.executor = executor;
    this.clock = clock;
    this.owner = localHostName() + "-" + RandomStringUtils.randomAlphanumeric(6);
  }

  @PostConstruct
  public void setupScheduler() {
    log.info("Job worker owner={} pollInterval={} pollLimit={} workerConcurrency={} "
            + "pointsPerBatch={} batchTimeBudget={} maxRetries={}",
        owner, properties.getPollInterval(), properties.getPollLimit(),
        properties.getWorkerConcurrency(), properties.getPointsPerBatch(),
        properties.getBatchTimeBudget(), properties.getMaxRetries());
    scheduleNextPoll();
  }

  public String getOwner() {
    return owner;
  }

  private void scheduleNextPoll() {
    if (executor.isShutdown()) {
      return;
    }
    executor.schedule(this::poll, properties.getPollInterval().toMillis(),
        TimeUnit.MILLISECONDS);
  }

  void poll() {
    final int capacity = properties.getPollLimit() - inFlight.get();
    if (capacity <= 0) {
      scheduleNextPoll();
      return;
    }
    jobQueue.due(clock.instant(), capacity)
        .concatMap(jobId -> jobQueue.take(jobId)
            .filter(Boolean::booleanValue)
            .map(taken -> jobId))
        .doOnNext(jobId -> {
          inFlight.incrementAndGet();
          process(jobId)
              .doFinally(signal -> inFlight.decrementAndGet())
              .subscribe(
                  status -> log.debug("Job={} left invocation as {}", jobId, status),
                  e -> log.error("Processing job={} failed unexpectedly", jobId, e)
              );
        })
        .doFinally(signal -> scheduleNextPoll())
        .subscribe(
            jobId -> log.trace("Dispatched job={}", jobId),
            e -> log.warn("Polling the job queue failed", e)
        );
  }

  /**
   * Claims and runs one invocation of the job, which must already have been taken off the
   * queue.
   *
   * @return the job's status after the invocation, empty if it could not be claimed
   */
  public Mono<JobStatus> process(UUID jobId) {
    final Instant now = clock.instant();
    return jobQueue.lease(jobId, now.plus(properties.getLeaseDuration()))
        .then(jobStore.claim(jobId, owner, now.truncatedTo(ChronoUnit.MILLIS)))
        .flatMap(claimed -> {
          if (!claimed) {
            log.debug("Job={} was no longer queued", jobId);
            return jobQueue.releaseLease(jobId).then(Mono.empty());
          }
          jobService.recordTransition(JobStatus.processing);
          return jobStore.find(jobId)
              .flatMap(job -> runInvocation(job.setStatus(JobStatus.processing).setOwner(owner)));
        });
  }

  private Mono<JobStatus> runInvocation(Job job) {
    final Instant deadline = clock.instant().plus(properties.getBatchTimeBudget());
    final List<SubBatch> batches = subBatches(job);
    job.setTotalBatches(batches.size());
    log.info("Processing job={} from batch {} of {} retryCount={}", job.getId(),
        job.getCursor(), batches.size(), job.getRetryCount());

    return Flux.range(job.getCursor(), batches.size() - job.getCursor())
        .takeWhile(index -> clock.instant().isBefore(deadline))
        .flatMapSequential(index -> checkNotCancelled(job.getId())
                .then(Mono.defer(() -> runSubBatch(job, batches.get(index)))),
            properties.getWorkerConcurrency())
        .concatMap(outcome -> commit(job, outcome))
        .then(Mono.defer(() -> job.getCursor() >= batches.size() ?
            complete(job) : checkpoint(job)))
        .onErrorResume(OwnershipLostException.class, e -> {
          log.warn("Job={} is no longer owned by {}, abandoning invocation", job.getId(), owner);
          return jobQueue.releaseLease(job.getId()).then(Mono.empty());
        })
        .onErrorResume(JobCancelledException.class, e -> cancelled(job))
        .onErrorResume(e -> !(e instanceof OwnershipLostException), e -> failed(job, e));
  }

  List<SubBatch> subBatches(Job job) {
    final List<List<String>> chunks = Lists.partition(job.getPoints(),
        properties.getPointsPerBatch());
    final List<SubBatch> batches = new ArrayList<>();
    for (TimeRange range : job.getRanges()) {
      for (List<String> chunk : chunks) {
        batches.add(new SubBatch(batches.size(), chunk, range));
      }
    }
    return batches;
  }

  private Mono<Void> checkNotCancelled(UUID jobId) {
    return jobStore.isCancelRequested(jobId)
        .flatMap(cancelled -> cancelled ?
            Mono.error(new JobCancelledException(jobId)) : Mono.empty());
  }

  private Mono<BatchOutcome> runSubBatch(Job job, SubBatch batch) {
    log.debug("Job={} batch={} fetching {} points over {}", job.getId(), batch.index,
        batch.points.size(), batch.range);
    return sampleFetcher.fetch(job.getSite(), batch.points, List.of(batch.range))
        .map(fetched -> new BatchOutcome(batch.index, fetched.getSamples(),
            fetched.getTruncated()))
        .onErrorResume(UpstreamRejectedException.class, e -> batch.points.size() > 1 ?
            isolateRejectedPoints(job, batch) :
            Mono.just(new BatchOutcome(batch.index, Map.of(),
                Map.of(batch.points.get(0), e.getMessage()))))
        .flatMap(outcome -> sampleStorageService.upsert(outcome.allSamples())
            .map(stored -> outcome.setStored(stored)));
  }

  /**
   * Fetches the points of a rejected sub-batch one by one so that only the offending points
   * are reported.
   */
  private Mono<BatchOutcome> isolateRejectedPoints(Job job, SubBatch batch) {
    final Map<String, List<Sample>> samples = new LinkedHashMap<>();
    final Map<String, String> errors = new LinkedHashMap<>();
    return Flux.fromIterable(batch.points)
        .concatMap(point -> sampleFetcher.fetch(job.getSite(), List.of(point),
                List.of(batch.range))
            .doOnNext(fetched -> {
              samples.putAll(fetched.getSamples());
              errors.putAll(fetched.getTruncated());
            })
            .onErrorResume(UpstreamRejectedException.class, e -> {
              errors.put(point, e.getMessage());
              return Mono.empty();
            }))
        .then(Mono.fromSupplier(() -> new BatchOutcome(batch.index, samples, errors)));
  }

  private Mono<BatchOutcome> commit(Job job, BatchOutcome outcome) {
    job.setCursor(outcome.index + 1);
    job.setSampleCount(job.getSampleCount() + outcome.stored);
    job.getPointErrors().putAll(outcome.pointErrors);
    return jobStore.saveProgress(job, owner)
        .flatMap(applied -> applied ?
            jobQueue.lease(job.getId(), clock.instant().plus(properties.getLeaseDuration())) :
            Mono.error(new OwnershipLostException()))
        .thenReturn(outcome);
  }

  private Mono<JobStatus> checkpoint(Job job) {
    log.info("Job={} used its time budget at batch {} of {}, re-queueing", job.getId(),
        job.getCursor(), job.getTotalBatches());
    return requeue(job, clock.instant());
  }

  private Mono<JobStatus> complete(Job job) {
    final JobStatus status = job.getPointErrors().isEmpty() ?
        JobStatus.completed : JobStatus.completed_with_errors;
    return sampleStorageService.query(job.getSite(), job.getPoints(), job.getStartMs(),
            job.getEndMs())
        .map(stored -> toResult(job, stored))
        .flatMap(result -> cacheResult(job, result).thenReturn(result))
        .flatMap(result -> {
          job.setSampleCount(result.sampleCount());
          job.setError(status == JobStatus.completed_with_errors ?
              String.format("%d points failed", job.getPointErrors().size()) : null);
          return finish(job, status, null);
        });
  }

  private Mono<Boolean> cacheResult(Job job, SeriesResult result) {
    return queryCacheService.put(queryCacheService.newEntry(job.getCacheKey(),
            seriesKeyOf(job), job.getPoints(), result, DispatchMode.queued))
        .thenReturn(true)
        .onErrorResume(DegradedServiceException.class, e -> {
          log.warn("Unable to cache result of job={}", job.getId(), e);
          return Mono.just(false);
        });
  }

  private String seriesKeyOf(Job job) {
    return fingerprintService.seriesKey(job.getSite(), job.getPoints(), job.getResolution());
  }

  private Mono<JobStatus> cancelled(Job job) {
    log.info("Job={} cancelled at batch {} of {}", job.getId(), job.getCursor(),
        job.getTotalBatches());
    job.setError(JobService.CANCELLED);
    return finish(job, JobStatus.failed, null);
  }

  private Mono<JobStatus> failed(Job job, Throwable cause) {
    final int retryCount = job.getRetryCount() + 1;
    job.setRetryCount(retryCount);
    job.setError(StringUtils.abbreviate(
        StringUtils.defaultIfBlank(cause.getMessage(), cause.getClass().getSimpleName()), 500));

    if (retryCount <= properties.getMaxRetries()) {
      final Duration backoff = retryBackoff(retryCount);
      log.warn("Job={} failed attempt {}, retrying in {}: {}", job.getId(), retryCount,
          backoff, job.getError());
      return requeue(job, clock.instant().plus(backoff));
    }
    if (job.getCursor() > 0) {
      log.warn("Job={} exhausted retries after {} of {} batches", job.getId(), job.getCursor(),
          job.getTotalBatches());
      return finish(job, JobStatus.completed_with_errors, null);
    }
    log.error("Job={} failed permanently after {} attempts", job.getId(), retryCount, cause);
    return finish(job, JobStatus.failed, cause);
  }

  Duration retryBackoff(int retryCount) {
    final long multiplier = 1L << Math.min(30, retryCount - 1);
    final Duration backoff = properties.getRetryBackoff().multipliedBy(multiplier);
    return backoff.compareTo(properties.getMaxRetryBackoff()) > 0 ?
        properties.getMaxRetryBackoff() : backoff;
  }

  private Mono<JobStatus> requeue(Job job, Instant notBefore) {
    job.setStatus(JobStatus.queued);
    return jobStore.release(job, owner)
        .flatMap(applied -> {
          if (!applied) {
            return Mono.error(new OwnershipLostException());
          }
          jobService.recordTransition(JobStatus.queued);
          return jobQueue.enqueue(job.getId(), notBefore)
              .then(jobQueue.releaseLease(job.getId()))
              .thenReturn(JobStatus.queued);
        })
        .onErrorResume(OwnershipLostException.class, e -> jobQueue.releaseLease(job.getId())
            .then(Mono.empty()));
  }

  /**
   * Moves the job to a terminal status. The compare-and-set guarantees only one worker
   * performs the follow-up, so a failure is dead-lettered exactly once.
   */
  private Mono<JobStatus> finish(Job job, JobStatus status, Throwable deadLetterCause) {
    final Instant completedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    job.setStatus(status).setCompletedAt(completedAt);
    return jobStore.finish(job, owner)
        .flatMap(applied -> {
          if (!applied) {
            log.warn("Job={} changed while finishing as {}, leaving it", job.getId(), status);
            return jobQueue.releaseLease(job.getId()).then(Mono.empty());
          }
          jobService.recordTransition(status);
          log.info("Job={} finished as {} with {} samples", job.getId(), status,
              job.getSampleCount());
          // every follow-up is keyed by job id and completion time, so retrying is idempotent
          final RetryBackoffSpec retry = properties.getRetryFinish().build();
          final Mono<?> deadLetter = status == JobStatus.failed && deadLetterCause != null ?
              Mono.defer(() -> deadLetterService.record(job, deadLetterCause)).retryWhen(retry)
              : Mono.empty();
          return deadLetter
              .then(Mono.defer(() -> jobStore.archive(job, completedAt)).retryWhen(retry))
              .then(Mono.defer(() -> jobQueue.retainUntilPurge(job.getId(), completedAt))
                  .retryWhen(retry))
              .then(Mono.defer(() -> jobQueue.forgetLive(job.getCacheKey(), job.getId()))
                  .retryWhen(retry))
              .then(jobQueue.releaseLease(job.getId()))
              .doOnError(e -> log.error("Follow-up of job={} finished as {} failed", job.getId(),
                  status, e))
              .thenReturn(status);
        });
  }

  static SeriesResult toResult(Job job, Map<String, List<Sample>> stored) {
    final SeriesResult result = new SeriesResult()
        .setSite(job.getSite())
        .setStartMs(job.getStartMs())
        .setEndMs(job.getEndMs());
    for (String point : job.getPoints()) {
      result.getSeries().put(point, stored.getOrDefault(point, List.of()).stream()
          .map(Sample::toValue)
          .collect(Collectors.toList()));
    }
    result.getErrors().putAll(job.getPointErrors());
    job.getPointErrors().keySet().forEach(point -> result.getSeries().remove(point));
    return result;
  }

  private static String localHostName() {
    final String hostname = System.getenv("HOSTNAME");
    if (StringUtils.isNotBlank(hostname)) {
      return hostname;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      log.warn("Unable to resolve local host name, using a generated worker name", e);
      return "worker";
    }
  }

  static class SubBatch {
    final int index;
    final List<String> points;
    final TimeRange range;

    SubBatch(int index, List<String> points, TimeRange range) {
      this.index = index;
      this.points = points;
      this.range = range;
    }
  }

  static class BatchOutcome {
    final int index;
    final Map<String, List<Sample>> samples;
    final Map<String, String> pointErrors;
    long stored;

    BatchOutcome(int index, Map<String, List<Sample>> samples, Map<String, String> pointErrors) {
      this.index = index;
      this.samples = samples;
      this.pointErrors = pointErrors;
    }

    List<Sample> allSamples() {
      return samples.values().stream()
          .flatMap(List::stream)
          .collect(Collectors.toList());
    }

    BatchOutcome setStored(long stored) {
      this.stored = stored;
      return this;
    }
  }

  static class OwnershipLostException extends RuntimeException {
    OwnershipLostException() {
      super("Job ownership lost");
    }
  }
}
