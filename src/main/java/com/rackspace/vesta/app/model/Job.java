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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Data;

/**
 * A unit of deferred fetch work. Rows live in the <code>jobs</code> table while active and are
 * copied to <code>job_history</code> when they reach a terminal status.
 */
@Data
public class Job {
  UUID id;
  String site;
  List<String> points = new ArrayList<>();
  /**
   * Sub-ranges of <code>[startMs, endMs)</code> that actually need fetching. Parts of the
   * request already satisfied by the cache are left out.
   */
  List<TimeRange> ranges = new ArrayList<>();
  long startMs;
  long endMs;
  Duration resolution;
  JobStatus status;
  /**
   * Fingerprint of the query this job satisfies. The result is cached under it.
   */
  String cacheKey;
  long sampleCount;
  int retryCount;
  /**
   * Number of leading sub-batches that have completed. A resumed job continues from here.
   */
  int cursor;
  int totalBatches;
  boolean cancelRequested;
  String owner;
  String error;
  Map<String, String> pointErrors = new LinkedHashMap<>();
  Instant createdAt;
  Instant startedAt;
  Instant completedAt;
  Instant archivedAt;
}
