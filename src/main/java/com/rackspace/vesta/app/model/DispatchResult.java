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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Data;

@Data
public class DispatchResult {
  DispatchMode mode;
  long estimatedSamples;
  /**
   * Fetched samples per point, ascending by timestamp. Empty when queued.
   */
  Map<String, List<Sample>> samples = new LinkedHashMap<>();
  /**
   * Per point error messages for points that failed while others succeeded.
   */
  Map<String, String> errors = new LinkedHashMap<>();
  UUID jobId;
  List<String> warnings = new ArrayList<>();

  public boolean isDegraded() {
    return !warnings.isEmpty();
  }
}
