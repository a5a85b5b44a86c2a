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

package com.rackspace.vesta.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusView {
  UUID jobId;
  String site;
  List<String> points;
  long startMs;
  long endMs;
  JobStatus status;
  long sampleCount;
  int retryCount;
  /**
   * Completed sub-batches out of <code>totalBatches</code>.
   */
  int completedBatches;
  int totalBatches;
  /**
   * Fraction of sub-batches completed, between 0 and 1.
   */
  double progress;
  String message;
  String error;
  Map<String, String> pointErrors;
  Instant createdAt;
  Instant startedAt;
  Instant completedAt;
  boolean archived;
}
