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

@ConfigurationProperties("vesta")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * Age before which the upstream raw tier is guaranteed to be populated. Samples newer than
   * <code>now - lagThreshold</code> are only available from the aggregated tier.
   */
  @NotNull
  @DurationUnit(ChronoUnit.MILLIS)
  Duration lagThreshold = Duration.ofHours(48);

  /**
   * Width the raw/aggregated boundary is aligned down to when deriving cache fingerprints,
   * so that repeated queries keep one fingerprint for the duration of an alignment window.
   * Routing of fetches is not aligned.
   */
  @NotNull
  Duration tierBoundaryAlignment = Duration.ofMinutes(15);

  /**
   * Estimated sample counts below this are fetched inline with a single upstream pass.
   */
  @Min(1)
  long directThreshold = 1_000;

  /**
   * Estimated sample counts below this, and at or above <code>directThreshold</code>, are
   * fetched with a bounded parallel fan-out per point. Anything larger becomes a job.
   */
  @Min(1)
  long batchThreshold = 100_000;

  /**
   * Upper bound of concurrent per-point upstream fetches for a batched request.
   */
  @Min(1)
  int maxBatchConcurrency = 50;

  /**
   * Sample spacing assumed when a query does not specify its resolution.
   */
  @NotNull
  Duration defaultResolution = Duration.ofMinutes(1);

  /**
   * Width of the time slots used to partition the samples table.
   */
  @NotNull
  Duration samplePartitionWidth = Duration.ofDays(1);

  /**
   * Default TTL applied to the samples table when it is first created.
   */
  @NotNull
  Duration sampleTtl = Duration.ofDays(400);

  @Min(60)
  int dataTableGcGraceSeconds = 86400;

  @NotNull
  RetrySpec retryStorageWrite = new RetrySpec()
      .setMaxAttempts(5)
      .setMinBackoff(Duration.ofMillis(100));

  @NotNull
  RetrySpec retryStorageRead = new RetrySpec()
      .setMaxAttempts(3)
      .setMinBackoff(Duration.ofMillis(100));
}
