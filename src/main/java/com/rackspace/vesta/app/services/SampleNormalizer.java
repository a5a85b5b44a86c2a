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

import com.rackspace.vesta.app.exceptions.MalformedTimestampException;
import com.rackspace.vesta.app.model.FetchPlan;
import com.rackspace.vesta.app.model.Quality;
import com.rackspace.vesta.app.model.RawSample;
import com.rackspace.vesta.app.model.Sample;
import com.rackspace.vesta.app.utils.TimestampNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Converts upstream samples into {@link Sample}s of one fetch plan.
 * <p>
 * Samples with an unparseable timestamp are dropped and counted. Samples outside the plan's
 * range or for points that were not requested are skipped. Values that are not usable
 * numbers are kept as NaN with {@link Quality#bad} so gaps stay visible.
 * </p>
 */
@Component
@Slf4j
public class SampleNormalizer {

  private final Counter malformedCounter;

  @Autowired
  public SampleNormalizer(MeterRegistry meterRegistry) {
    malformedCounter = meterRegistry.counter("vesta.samples.malformed");
  }

  public List<Sample> normalize(String site, FetchPlan plan, Set<String> requestedPoints,
                                Collection<RawSample> rawSamples) {
    final List<Sample> samples = new ArrayList<>(rawSamples.size());
    int malformed = 0;
    for (RawSample raw : rawSamples) {
      if (raw == null || StringUtils.isBlank(raw.getName())) {
        malformed++;
        continue;
      }
      if (!requestedPoints.isEmpty() && !requestedPoints.contains(raw.getName())) {
        continue;
      }
      final long timestampMs;
      try {
        timestampMs = TimestampNormalizer.toEpochMillis(raw.getTime());
      } catch (MalformedTimestampException e) {
        log.trace("Dropping sample of point={}", raw.getName(), e);
        malformed++;
        continue;
      }
      if (timestampMs < plan.getStartMs() || timestampMs >= plan.getEndMs()) {
        continue;
      }
      samples.add(toSample(site, plan, raw, timestampMs));
    }
    if (malformed > 0) {
      malformedCounter.increment(malformed);
      log.warn("Dropped {} malformed samples from site={} tier={}", malformed, site,
          plan.getTier());
    }
    return samples;
  }

  private static Sample toSample(String site, FetchPlan plan, RawSample raw, long timestampMs) {
    final Object value = raw.getValue();
    double numeric = Double.NaN;
    Quality quality = Quality.bad;
    if (value instanceof Boolean) {
      numeric = ((Boolean) value) ? 1 : 0;
      quality = Quality.uncertain;
    } else if (value instanceof Number) {
      numeric = ((Number) value).doubleValue();
      quality = Quality.good;
    } else if (value instanceof String) {
      try {
        numeric = Double.parseDouble(((String) value).trim());
        quality = Quality.good;
      } catch (NumberFormatException e) {
        numeric = Double.NaN;
      }
    }
    if (!Double.isFinite(numeric)) {
      numeric = Double.NaN;
      quality = Quality.bad;
    }
    return new Sample(site, raw.getName(), timestampMs, numeric, quality, plan.getTier());
  }
}
