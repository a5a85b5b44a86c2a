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
import java.util.List;
import lombok.Data;

/**
 * A cached query result. The payload is the serialized {@link SeriesResult}; the other fields
 * describe what it covers so that later queries over an overlapping range can reuse it.
 */
@Data
public class CacheEntry {
  String fingerprint;
  /**
   * Identifies the site, sorted point set and resolution independent of the range.
   */
  String seriesKey;
  String site;
  List<String> points;
  long startMs;
  long endMs;
  byte[] payload;
  Instant createdAt;
  Duration ttl;
  DispatchMode source;

  public Instant expiresAt() {
    return createdAt.plus(ttl);
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt());
  }

  public TimeRange range() {
    return new TimeRange(startMs, endMs);
  }
}
