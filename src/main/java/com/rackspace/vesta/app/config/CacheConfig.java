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

package com.rackspace.vesta.app.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.rackspace.vesta.app.model.CacheEntry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

  private final MeterRegistry meterRegistry;
  private final CacheProperties cacheProperties;
  private final Clock clock;

  @Autowired
  public CacheConfig(MeterRegistry meterRegistry,
                     CacheProperties cacheProperties,
                     Clock clock) {
    this.meterRegistry = meterRegistry;
    this.cacheProperties = cacheProperties;
    this.clock = clock;
  }

  /**
   * In-process level of the query cache. Size bounded with Caffeine's recency/frequency
   * eviction and expired per entry from the entry's own creation time and TTL.
   */
  @Bean
  public Cache<String, CacheEntry> queryResultCache() {
    final Cache<String, CacheEntry> cache = Caffeine
        .newBuilder()
        .maximumSize(cacheProperties.getLocalMaxEntries())
        .expireAfter(new EntryExpiry(clock))
        .ticker(clockTicker(clock))
        .recordStats()
        .build();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "queryResultCache");
    return cache;
  }

  static Ticker clockTicker(Clock clock) {
    return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
  }

  static class EntryExpiry implements Expiry<String, CacheEntry> {

    private final Clock clock;

    EntryExpiry(Clock clock) {
      this.clock = clock;
    }

    @Override
    public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
      return remainingNanos(value);
    }

    @Override
    public long expireAfterUpdate(String key, CacheEntry value, long currentTime,
                                  long currentDuration) {
      return remainingNanos(value);
    }

    @Override
    public long expireAfterRead(String key, CacheEntry value, long currentTime,
                                long currentDuration) {
      return currentDuration;
    }

    private long remainingNanos(CacheEntry value) {
      final Duration remaining = Duration.between(clock.instant(), value.expiresAt());
      return remaining.isNegative() ? 0 : remaining.toNanos();
    }
  }
}
