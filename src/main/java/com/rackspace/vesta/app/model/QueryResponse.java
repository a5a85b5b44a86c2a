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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {

  public static final String STATUS_OK = "ok";
  public static final String STATUS_PROCESSING = "processing";

  String status;
  DispatchMode mode;
  /**
   * One of <code>cache</code>, <code>upstream</code> or <code>cache+upstream</code>.
   */
  String source;
  UUID jobId;
  String fingerprint;
  Map<String, List<SampleValue>> samples;
  Map<String, String> errors;
  boolean degraded;
  List<String> warnings = new ArrayList<>();

  public static QueryResponse processing(UUID jobId, String fingerprint) {
    return new QueryResponse()
        .setStatus(STATUS_PROCESSING)
        .setMode(DispatchMode.queued)
        .setJobId(jobId)
        .setFingerprint(fingerprint);
  }

  public static QueryResponse ok(SeriesResult result, DispatchMode mode, String source,
                                 String fingerprint) {
    return new QueryResponse()
        .setStatus(STATUS_OK)
        .setMode(mode)
        .setSource(source)
        .setFingerprint(fingerprint)
        .setSamples(new LinkedHashMap<>(result.getSeries()))
        .setErrors(result.getErrors().isEmpty() ? null : new LinkedHashMap<>(result.getErrors()));
  }
}
