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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class UpstreamPage {
  @JsonProperty("point_samples")
  List<RawSample> pointSamples = new ArrayList<>();

  @JsonProperty("next_cursor")
  String nextCursor;

  @JsonProperty("has_more")
  boolean hasMore;

  /**
   * Set only on the empty marker page emitted after pagination stopped at the page limit.
   */
  @JsonIgnore
  boolean truncated;

  /**
   * Points of the truncated request. Empty when the request named no points.
   */
  @JsonIgnore
  List<String> truncatedPoints = List.of();

  public static UpstreamPage truncationMarker(List<String> points) {
    return new UpstreamPage()
        .setTruncated(true)
        .setTruncatedPoints(points);
  }
}
