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

import lombok.Value;

/**
 * Half-open millisecond range, <code>[startMs, endMs)</code>.
 */
@Value
public class TimeRange {
  long startMs;
  long endMs;

  public long durationMs() {
    return endMs - startMs;
  }

  public boolean contains(long timestampMs) {
    return timestampMs >= startMs && timestampMs < endMs;
  }

  public static TimeRange parse(String encoded) {
    final int sep = encoded.indexOf(':');
    if (sep <= 0) {
      throw new IllegalArgumentException("Invalid encoded time range: " + encoded);
    }
    return new TimeRange(
        Long.parseLong(encoded.substring(0, sep)),
        Long.parseLong(encoded.substring(sep + 1))
    );
  }

  public String encode() {
    return startMs + ":" + endMs;
  }
}
