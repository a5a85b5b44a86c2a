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
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("vesta.upstream")
@Component
@Data
@Validated
public class UpstreamProperties {

  /**
   * Base URL of the metering API, for example <code>https://api.example.com/api</code>.
   */
  @NotBlank
  String baseUrl = "http://localhost:8081/api";

  /**
   * Bearer token sent with every upstream request, if set.
   */
  String token;

  /**
   * Number of samples requested per page.
   */
  @Min(1)
  int pageSize = 100_000;

  /**
   * Largest page the upstream API is known to serve.
   */
  @Min(1)
  int maxPageSize = 1_000_000;

  @NotNull
  Duration pageTimeout = Duration.ofSeconds(30);

  /**
   * Total attempts for one page, including the first.
   */
  @Min(1)
  int maxAttempts = 3;

  @NotNull
  Duration minBackoff = Duration.ofSeconds(1);

  @DecimalMin("1.0")
  double backoffFactor = 2.0;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  double jitter = 0.5;

  /**
   * Upper bound on the server supplied Retry-After that will be honored.
   */
  @NotNull
  Duration maxRetryAfter = Duration.ofMinutes(2);

  /**
   * Safety bound on the number of pages followed for one range.
   */
  @Min(1)
  int maxPages = 200;

  /**
   * Point filters longer than this are split across multiple paginated ranges.
   */
  @Min(1)
  int maxPointsPerRequest = 400;

  /**
   * Largest response body buffered for one page.
   */
  @Min(1)
  int maxResponseBytes = 64 * 1024 * 1024;
}
