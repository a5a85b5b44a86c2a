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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.vesta.app.config.CacheProperties;
import com.rackspace.vesta.app.model.CacheEntry;
import com.rackspace.vesta.app.model.TimeRange;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable level of the query cache, kept in Redis.
 * <p>
 * Keys, relative to the configured prefix:
 * <ul>
 *   <li><code>cache:entry:{fingerprint}</code> the serialized entry, expiring with its TTL</li>
 *   <li><code>cache:sizes</code> hash of fingerprint to payload bytes</li>
 *   <li><code>cache:lru</code> sorted set of fingerprint scored by last access</li>
 *   <li><code>cache:expiry</code> sorted set of fingerprint scored by expiry</li>
 *   <li><code>cache:series:{seriesKey}</code> hash of fingerprint to
 *   <code>start:end:expiresAt</code>, used to find entries covering part of a range</li>
 *   <li><code>cache:point:{site}|{point}</code> set of fingerprints referencing that point</li>
 * </ul>
 * The bookkeeping structures are eventually consistent with the entries: readers always
 * re-check expiry and tolerate references to entries that no longer exist.
 * </p>
 */
@Component
@Slf4j
public class RedisCacheStore {

  private static final String SITE_POINT_SEPARATOR = "|";

  private final ReactiveStringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String prefix;

  @Autowired
  public RedisCacheStore(ReactiveStringRedisTemplate redisTemplate,
                         ObjectMapper objectMapper,
                         CacheProperties cacheProperties,
                         Clock clock) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.prefix = cacheProperties.getKeyPrefix() + ":cache:";
  }

  public Mono<CacheEntry> get(String fingerprint) {
    return redisTemplate.opsForValue().get(entryKey(fingerprint))
        .map(this::readEntry)
        .filter(entry -> !entry.isExpired(clock.instant()))
        .flatMap(entry -> touch(fingerprint).thenReturn(entry));
  }

  public Mono<Void> put(CacheEntry entry) {
    final Duration remaining = Duration.between(clock.instant(), entry.expiresAt());
    if (remaining.isNegative() || remaining.isZero()) {
      return Mono.empty();
    }
    final String fingerprint = entry.getFingerprint();
    final String json = writeEntry(entry);
    final ReactiveHashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
    final String seriesKey = seriesKey(entry.getSeriesKey());

    return redisTemplate.opsForValue().set(entryKey(fingerprint), json, remaining)
        .then(Mono.when(
            hashOps.put(sizesKey(), fingerprint, Long.toString(entry.getPayload().length)),
            redisTemplate.opsForZSet().add(lruKey(), fingerprint, clock.millis()),
            redisTemplate.opsForZSet().add(expiryKey(), fingerprint,
                entry.expiresAt().toEpochMilli()),
            hashOps.put(seriesKey, fingerprint, rangeValue(entry))
                .then(extendExpiry(seriesKey, remaining)),
            Flux.fromIterable(entry.getPoints())
                .flatMap(point -> {
                  final String key = pointKey(entry.getSite(), point);
                  return redisTemplate.opsForSet().add(key, fingerprint)
                      .then(extendExpiry(key, remaining));
                })
        ));
  }

  /**
   * Finds unexpired entries of the series that overlap <code>[startMs, endMs)</code>.
   */
  public Flux<CacheEntry> findOverlapping(String seriesKey, long startMs, long endMs) {
    final ReactiveHashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
    final long now = clock.millis();
    final String key = seriesKey(seriesKey);
    return hashOps.entries(key)
        .filter(indexed -> {
          final String[] parts = indexed.getValue().split(":");
          if (parts.length != 3 || Long.parseLong(parts[2]) <= now) {
            return false;
          }
          return Long.parseLong(parts[0]) < endMs && Long.parseLong(parts[1]) > startMs;
        })
        .map(indexed -> entryKey(indexed.getKey()))
        .collectList()
        .filter(keys -> !keys.isEmpty())
        .flatMapMany(keys -> redisTemplate.opsForValue().multiGet(keys))
        .flatMapIterable(values -> values)
        .filter(Objects::nonNull)
        .map(this::readEntry)
        .filter(entry -> !entry.isExpired(clock.instant()));
  }

  /**
   * Removes every entry referencing a point of the site whose name starts with the prefix.
   * An empty prefix removes all of the site's entries.
   *
   * @return the fingerprints removed
   */
  public Flux<String> invalidate(String site, String pointPrefix) {
    final String pattern = prefix + "point:" + escapeGlob(site) + SITE_POINT_SEPARATOR
        + escapeGlob(StringUtils.defaultString(pointPrefix)) + "*";
    return redisTemplate.scan(ScanOptions.scanOptions().match(pattern).count(500).build())
        .concatMap(pointKey -> redisTemplate.opsForSet().members(pointKey)
            .collectList()
            .flatMapMany(members -> redisTemplate.delete(pointKey)
                .thenMany(Flux.fromIterable(members))))
        .distinct()
        .concatMap(fingerprint -> remove(fingerprint).thenReturn(fingerprint));
  }

  /**
   * Drops bookkeeping of expired entries, then evicts least recently used entries until the
   * total payload size is within the bound.
   *
   * @return number of entries evicted to satisfy the size bound
   */
  public Mono<Long> sweep(long maxBytes) {
    final Range<Double> expired = Range.leftUnbounded(
        Range.Bound.inclusive((double) clock.millis()));
    return redisTemplate.opsForZSet().rangeByScore(expiryKey(), expired)
        .concatMap(this::remove)
        .count()
        .doOnNext(count -> {
          if (count > 0) {
            log.debug("Removed bookkeeping of {} expired cache entries", count);
          }
        })
        .then(totalBytes())
        .flatMap(total -> total <= maxBytes ? Mono.just(0L) : evict(total - maxBytes));
  }

  public Mono<Long> totalBytes() {
    final ReactiveHashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
    return hashOps.values(sizesKey())
        .map(Long::parseLong)
        .reduce(0L, Long::sum);
  }

  private Mono<Long> evict(long excessBytes) {
    final AtomicLong excess = new AtomicLong(excessBytes);
    return redisTemplate.opsForZSet().range(lruKey(), Range.unbounded())
        .concatMap(fingerprint -> Mono.defer(() -> excess.get() > 0 ?
            remove(fingerprint).doOnNext(excess::addAndGet) : Mono.empty()))
        .count()
        .doOnNext(count -> log.info("Evicted {} least recently used cache entries", count));
  }

  /**
   * @return the negated payload size released, or zero if unknown
   */
  Mono<Long> remove(String fingerprint) {
    final ReactiveHashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
    return redisTemplate.opsForValue().get(entryKey(fingerprint))
        .map(this::readEntry)
        .flatMap(entry -> hashOps.remove(seriesKey(entry.getSeriesKey()), fingerprint))
        .then(hashOps.get(sizesKey(), fingerprint).map(size -> -Long.parseLong(size))
            .defaultIfEmpty(0L))
        .flatMap(released -> Mono.when(
            redisTemplate.delete(entryKey(fingerprint)),
            hashOps.remove(sizesKey(), fingerprint),
            redisTemplate.opsForZSet().remove(lruKey(), fingerprint),
            redisTemplate.opsForZSet().remove(expiryKey(), fingerprint)
        ).thenReturn(released));
  }

  private Mono<Boolean> touch(String fingerprint) {
    return redisTemplate.opsForZSet().add(lruKey(), fingerprint, clock.millis());
  }

  private Mono<Boolean> extendExpiry(String key, Duration atLeast) {
    return redisTemplate.getExpire(key)
        .defaultIfEmpty(Duration.ZERO)
        .flatMap(current -> current.compareTo(atLeast) >= 0 ?
            Mono.just(true) : redisTemplate.expire(key, atLeast));
  }

  private CacheEntry readEntry(String json) {
    try {
      return objectMapper.readValue(json, CacheEntry.class);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to read cache entry", e);
    }
  }

  private String writeEntry(CacheEntry entry) {
    try {
      return objectMapper.writeValueAsString(entry);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write cache entry", e);
    }
  }

  private static String rangeValue(CacheEntry entry) {
    return new TimeRange(entry.getStartMs(), entry.getEndMs()).encode()
        + ":" + entry.expiresAt().toEpochMilli();
  }

  static String escapeGlob(String value) {
    return value.replaceAll("([*?\\[\\]\\\\])", "\\\\$1");
  }

  String entryKey(String fingerprint) {
    return prefix + "entry:" + fingerprint;
  }

  String sizesKey() {
    return prefix + "sizes";
  }

  String lruKey() {
    return prefix + "lru";
  }

  String expiryKey() {
    return prefix + "expiry";
  }

  String seriesKey(String seriesKey) {
    return prefix + "series:" + seriesKey;
  }

  String pointKey(String site, String point) {
    return prefix + "point:" + site + SITE_POINT_SEPARATOR + point;
  }
}
