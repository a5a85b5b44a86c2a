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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Samples grouped per point plus the points that could not be fetched. This is also the
 * payload stored in the query cache.
 */
@Data
public class SeriesResult {
  String site;
  long startMs;
  long endMs;
  Map<String, List<SampleValue>> series = new LinkedHashMap<>();
  Map<String, String> errors = new LinkedHashMap<>();

  public long sampleCount() {
    return series.values().stream().mapToLong(List::size).sum();
  }
}
