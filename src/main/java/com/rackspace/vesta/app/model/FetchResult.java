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
 * Samples fetched from upstream, per point in ascending timestamp order, together with the
 * points whose series stopped short because pagination hit its page limit.
 */
@Data
public class FetchResult {
  Map<String, List<Sample>> samples = new LinkedHashMap<>();
  /**
   * Point to message for series known to be incomplete.
   */
  Map<String, String> truncated = new LinkedHashMap<>();

  public static FetchResult of(Map<String, List<Sample>> samples) {
    return new FetchResult().setSamples(new LinkedHashMap<>(samples));
  }
}
