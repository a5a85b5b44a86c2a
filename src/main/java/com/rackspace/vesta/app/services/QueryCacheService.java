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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.rackspace.vesta.app.config.CacheProperties;
import com.rackspace.vesta.app.exceptions.DegradedServiceException;
import com.rackspace.vesta.app.model.CacheEntry;
import com.rackspace.vesta.app.model.DispatchMode;
import com.rackspace.vesta.app.model.SeriesResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Two level cache of query results: an in-process Caffeine cache in front of the durable
 * Redis store. Entries expire after their TTL; a later put under the same fingerprint
 * replaces the earlier one.
 * <p>
 * Failures of the durable level are reported as {@link DegradedServiceException} so callers
 * can continue without the cache and flag their answer as degraded.
 * </p>
 */
@Service
@Slf4j
public class QueryCacheService {

  private final Cache<String, CacheEntry> localCache;
  private final RedisCacheStore durableStore;
  private final ObjectMapper objectMapper;
  private final CacheProperties cacheProperties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  @Autowired
  public QueryCacheService(Cache<String, CacheEntry> queryResultCache,
                           RedisCacheStore durableStore,
                           ObjectMapper objectMapper,
                           CacheProperties cacheProperties,
                           Clock clock,
                           MeterRegistry meterRegistry) {
    this.localCache = queryResultCache;
    this.durableStore = durableStore;
    this.objectMapper = objectMapper;
    this.cacheProperties = cacheProperties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  public Mono<CacheEntry> get(String fingerprint) {
    final CacheEntry local = localCache.getIfPresent(fingerprint);
    if (local != null && !local.isExpired(clock.instant())) {
      recordLookup("local", "hit");
      return Mono.just(local);
    }
    return durableStore.get(fingerprint)
        .doOnNext(entry -> {
          recordLookup("durable", "hit");
          localCache.put(fingerprint, entry);
        })
        .switchIfEmpty(Mono.fromRunnable(() -> recordLookup("durable", "miss")))
        .onErrorMap(e -> !(e instanceof DegradedServiceException),
            e -> new DegradedServiceException("Durable cache lookup failed", e));
  }

  /**
   * Builds an entry for the result, stored with the configured TTL.
   */
  public CacheEntry newEntry(String fingerprint, String seriesKey, List<String> points,
                             SeriesResult result, DispatchMode source) {
    return new CacheEntry()
        .setFingerprint(fingerprint)
        .setSeriesKey(seriesKey)
        .setSite(result.getSite())
        .setPoints(FingerprintService.canonicalPoints(points))
        .setStartMs(result.getStartMs())
        .setEndMs(result.getEndMs())
        .setPayload(encode(result))
        .setCreatedAt(clock.instant())
        .setTtl(cacheProperties.getTtl())
        .setSource(source);
  }

  /**
   * Stores the entry in both levels. The local level is always updated, even when the
   * durable write fails.
   */
  public Mono<Void> put(CacheEntry entry) {
    localCache.put(entry.getFingerprint(), entry);
    return durableStore.put(entry)
        .onErrorMap(e -> new DegradedServiceException("Durable cache write failed", e));
  }

  /**
   * Finds unexpired entries of the same series overlapping <code>[startMs, endMs)</code>,
   * checking the local level first.
   */
  public Flux<CacheEntry> findOverlapping(String seriesKey, long startMs, long endMs) {
    final Set<String> seen = new HashSet<>();
    final Flux<CacheEntry> local = Flux.fromStream(() -> localCache.asMap().values().stream()
        .filter(entry -> entry.getSeriesKey().equals(seriesKey))
        .filter(entry -> entry.getStartMs() < endMs && entry.getEndMs() > startMs)
        .filter(entry -> !entry.isExpired(clock.instant())));
    return Flux.concat(local, durableStore.findOverlapping(seriesKey, startMs, endMs)
            .onErrorMap(e -> new DegradedServiceException("Durable cache lookup failed", e)))
        .filter(entry -> seen.add(entry.getFingerprint()));
  }

  /**
   * Removes all entries of the site referencing a point that starts with the prefix.
   *
   * @return the number of distinct entries removed from either level
   */
  public Mono<Long> invalidate(String site, String pointPrefix) {
    if (StringUtils.isBlank(site)) {
      return Mono.error(new IllegalArgumentException("site is required"));
    }
    final String prefix = StringUtils.defaultString(pointPrefix);
    final Set<String> removed = new HashSet<>();
    localCache.asMap().values().removeIf(entry -> {
      final boolean matches = entry.getSite().equals(site)
          && entry.getPoints().stream().anyMatch(point -> point.startsWith(prefix));
      if (matches) {
        removed.add(entry.getFingerprint());
      }
      return matches;
    });
    return durableStore.invalidate(site, prefix)
        .doOnNext(removed::add)
        .then(Mono.fromSupplier(() -> (long) removed.size()))
        .doOnNext(count -> log.info("Invalidated {} cache entries of site={} pointPrefix={}",
            count, site, prefix))
        .onErrorMap(e -> new DegradedServiceException("Durable cache invalidation failed", e));
  }

  /**
   * Evicts durable entries beyond the configured size bound and drops expired local ones.
   */
  public Mono<Long> sweep() {
    localCache.cleanUp();
    return durableStore.sweep(cacheProperties.getDurableMaxBytes());
  }

  public byte[] encode(SeriesResult result) {
    try {
      return objectMapper.writeValueAsBytes(result);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public SeriesResult decode(CacheEntry entry) {
    try {
      return objectMapper.readValue(entry.getPayload(), SeriesResult.class);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void recordLookup(String level, String result) {
    meterRegistry.counter("vesta.cache.lookups", "level", level, "result", result).increment();
  }
}
