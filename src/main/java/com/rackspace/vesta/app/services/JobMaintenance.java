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
import com.rackspace.vesta.app.model.JobStatus;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Re-queues jobs whose worker stopped renewing its lease and purges finished jobs from the
 * live table once their retention has passed. Purged jobs remain readable from history.
 */
@Service
@Slf4j
@Profile("worker")
public class JobMaintenance {

  private final JobStore jobStore;
  private final JobQueue jobQueue;
  private final JobService jobService;
  private final JobProperties properties;
  private final ScheduledExecutorService executor;
  private final Clock clock;

  @Autowired
  public JobMaintenance(JobStore jobStore,
                        JobQueue jobQueue,
                        JobService jobService,
                        JobProperties properties,
                        ScheduledExecutorService executor,
                        Clock clock) {
    this.jobStore = jobStore;
    this.jobQueue = jobQueue;
    this.jobService = jobService;
    this.properties = properties;
    this.executor = executor;
    this.clock = clock;
  }

  @PostConstruct
  public void setupSchedulers() {
    log.info("Checking job leases every {} and purging jobs older than {} every {}",
        properties.getLeaseCheckInterval(), properties.getRetention(),
        properties.getArchiveSweepInterval());
    scheduleLeaseCheck();
    schedulePurge();
  }

  private void scheduleLeaseCheck() {
    if (executor.isShutdown()) {
      return;
    }
    executor.schedule(this::checkLeases, properties.getLeaseCheckInterval().toMillis(),
        TimeUnit.MILLISECONDS);
  }

  private void schedulePurge() {
    if (executor.isShutdown()) {
      return;
    }
    executor.schedule(this::purge, properties.getArchiveSweepInterval().toMillis(),
        TimeUnit.MILLISECONDS);
  }

  void checkLeases() {
    recoverExpiredLeases()
        .doFinally(signal -> scheduleLeaseCheck())
        .subscribe(
            recovered -> {
              if (recovered > 0) {
                log.info("Re-queued {} jobs with expired leases", recovered);
              }
            },
            e -> log.warn("Checking job leases failed", e)
        );
  }

  void purge() {
    purgeExpired()
        .doFinally(signal -> schedulePurge())
        .subscribe(
            purged -> log.debug("Purged {} finished jobs", purged),
            e -> log.warn("Purging finished jobs failed", e)
        );
  }

  public Mono<Long> recoverExpiredLeases() {
    return jobQueue.expiredLeases(clock.instant())
        .concatMap(this::recover)
        .filter(Boolean::booleanValue)
        .count();
  }

  private Mono<Boolean> recover(UUID jobId) {
    return jobStore.find(jobId)
        .flatMap(job -> {
          if (job.getStatus() == JobStatus.processing) {
            log.warn("Lease of job={} held by {} expired, re-queueing", jobId, job.getOwner());
            return jobStore.recover(jobId, job.getOwner())
                .flatMap(applied -> {
                  if (!applied) {
                    return Mono.just(false);
                  }
                  jobService.recordTransition(JobStatus.queued);
                  return jobQueue.enqueue(jobId, clock.instant()).thenReturn(true);
                });
          } else if (job.getStatus() == JobStatus.queued) {
            // taken off the queue but never claimed
            return jobQueue.enqueue(jobId, clock.instant()).thenReturn(true);
          }
          return Mono.just(false);
        })
        .defaultIfEmpty(false)
        .flatMap(recovered -> jobQueue.releaseLease(jobId).thenReturn(recovered));
  }

  public Mono<Long> purgeExpired() {
    return jobQueue.completedBefore(clock.instant().minus(properties.getRetention()))
        .concatMap(jobId -> jobStore.delete(jobId)
            .then(jobQueue.purged(jobId)))
        .count();
  }
}
