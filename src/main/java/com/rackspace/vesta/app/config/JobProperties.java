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

package com.rackspace.vesta.app.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("vesta.jobs")
@Component
@Data
@Validated
public class JobProperties {

  /**
   * Number of times a failing job is returned to the queue before it is failed and
   * dead-lettered.
   */
  @Min(0)
  int maxRetries = 3;

  /**
   * Concurrent sub-batches processed for one job invocation.
   */
  @Min(1)
  int workerConcurrency = 10;

  /**
   * Points fetched together in one job sub-batch.
   */
  @Min(1)
  int pointsPerBatch = 50;

  /**
   * Wall-clock budget of one job invocation. When exhausted the job persists its cursor and
   * goes back to the queue to resume later.
   */
  @NotNull
  Duration batchTimeBudget = Duration.ofSeconds(30);

  @NotNull
  Duration pollInterval = Duration.ofSeconds(2);

  /**
   * Maximum number of due jobs taken from the queue per poll.
   */
  @Min(1)
  int pollLimit = 4;

  /**
   * Base delay before a failed job is retried, doubled for every retry.
   */
  @NotNull
  Duration retryBackoff = Duration.ofSeconds(2);

  @NotNull
  Duration maxRetryBackoff = Duration.ofMinutes(5);

  /**
   * How long a worker may hold a job before it is considered abandoned and re-queued.
   */
  @NotNull
  Duration leaseDuration = Duration.ofMinutes(5);

  /**
   * How long finished jobs stay in the live table after completion.
   */
  @NotNull
  @DurationUnit(ChronoUnit.DAYS)
  Duration retention = Duration.ofDays(7);

  /**
   * How often expired leases are checked for jobs abandoned by a worker.
   */
  @NotNull
  Duration leaseCheckInterval = Duration.ofMinutes(1);

  @NotNull
  Duration archiveSweepInterval = Duration.ofMinutes(10);

  /**
   * Retry of the writes that follow a job reaching a terminal status: dead letter, archive
   * and retention bookkeeping.
   */
  @NotNull
  RetrySpec retryFinish = new RetrySpec()
      .setMaxAttempts(5)
      .setMinBackoff(Duration.ofMillis(100));

  /**
   * Threads used by the scheduler that drives polling and sweeps.
   */
  @Min(1)
  int processingThreads = Runtime.getRuntime().availableProcessors();
}
