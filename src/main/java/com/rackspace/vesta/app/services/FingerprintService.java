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

package com.rackspace.vesta.app.services;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.rackspace.vesta.app.model.FetchPlan;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Derives cache keys from query parameters.
 * <p>
 * Fingerprints are prefixed with the site so that invalidating by site is a prefix match.
 * The point list is sorted and de-duplicated first so the caller's ordering does not matter.
 * </p>
 */
@Service
public class FingerprintService {

  private static final Charset HASHING_CHARSET = StandardCharsets.UTF_8;
  private static final char SEPARATOR = ':';

  private final HashFunction hashFunction = Hashing.sha256();

  public String fingerprint(String site, Collection<String> points, long startMs, long endMs,
                            List<FetchPlan> plans, Duration resolution) {
    final Hasher hasher = hasher(site, points, resolution)
        .putLong(startMs)
        .putLong(endMs)
        .putInt(plans.size());
    plans.forEach(plan -> hasher
        .putString(plan.getTier().name(), HASHING_CHARSET)
        .putLong(plan.getStartMs())
        .putLong(plan.getEndMs()));
    return site + SEPARATOR + hasher.hash();
  }

  /**
   * Identifies a site, point set and resolution regardless of the range. Cache entries with
   * the same series key can satisfy parts of each other's ranges.
   */
  public String seriesKey(String site, Collection<String> points, Duration resolution) {
    return site + SEPARATOR + hasher(site, points, resolution).hash().toString().substring(0, 32);
  }

  public static List<String> canonicalPoints(Collection<String> points) {
    return points.stream()
        .distinct()
        .sorted()
        .collect(Collectors.toList());
  }

  private Hasher hasher(String site, Collection<String> points, Duration resolution) {
    final List<String> canonical = canonicalPoints(points);
    final Hasher hasher = hashFunction.newHasher()
        .putInt(site.length())
        .putString(site, HASHING_CHARSET)
        .putInt(canonical.size());
    canonical.forEach(point -> hasher
        .putInt(point.length())
        .putString(point, HASHING_CHARSET));
    return hasher.putLong(resolution.toMillis());
  }
}
