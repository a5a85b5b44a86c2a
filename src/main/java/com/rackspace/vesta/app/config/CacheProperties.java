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

@ConfigurationProperties("vesta.cache")
@Component
@Data
@Validated
public class CacheProperties {

  @NotNull
  @DurationUnit(ChronoUnit.MILLIS)
  Duration ttl = Duration.ofHours(1);

  /**
   * Maximum number of query results held in process.
   */
  @Min(0)
  long localMaxEntries = 5000;

  /**
   * Total payload bytes allowed in the durable cache level before least recently used
   * entries are evicted by the sweep.
   */
  @Min(0)
  long durableMaxBytes = 512L * 1024 * 1024;

  @NotNull
  Duration sweepInterval = Duration.ofMinutes(1);

  /**
   * Key prefix applied to everything the cache writes into Redis.
   */
  @NotNull
  String keyPrefix = "vesta";
}
