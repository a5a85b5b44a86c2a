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

import com.rackspace.vesta.app.config.CacheProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.RedisZSetCommands.Limit;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis side of the job system: the ready queue, worker leases, the retention index and the
 * cache-key to live job index. Job state itself lives in {@link JobStore}.
 */
@Service
@Slf4j
public class JobQueue {

  private final ReactiveStringRedisTemplate redisTemplate;
  private final String prefix;

  @Autowired
  public JobQueue(ReactiveStringRedisTemplate redisTemplate, CacheProperties cacheProperties) {
    this.redisTemplate = redisTemplate;
    this.prefix = cacheProperties.getKeyPrefix() + ":jobs:";
  }

  /**
   * Makes the job available to workers at or after the given time.
   */
  public Mono<Boolean> enqueue(UUID jobId, Instant notBefore) {
    return redisTemplate.opsForZSet().add(queueKey(), jobId.toString(), notBefore.toEpochMilli());
  }

  public Flux<UUID> due(Instant now, int limit) {
    return redisTemplate.opsForZSet()
        .rangeByScore(queueKey(),
            Range.leftUnbounded(Range.Bound.inclusive((double) now.toEpochMilli())),
            Limit.limit().count(limit))
        .map(UUID::fromString);
  }

  /**
   * Removes the job from the queue. Only one caller observes true for a given enqueue.
   */
  public Mono<Boolean> take(UUID jobId) {
    return redisTemplate.opsForZSet().remove(queueKey(), jobId.toString())
        .map(removed -> removed > 0);
  }

  public Mono<Boolean> lease(UUID jobId, Instant until) {
    return redisTemplate.opsForZSet().add(leasesKey(), jobId.toString(), until.toEpochMilli());
  }

  public Mono<Boolean> releaseLease(UUID jobId) {
    return redisTemplate.opsForZSet().remove(leasesKey(), jobId.toString())
        .map(removed -> removed > 0);
  }

  public Flux<UUID> expiredLeases(Instant now) {
    return redisTemplate.opsForZSet()
        .rangeByScore(leasesKey(),
            Range.leftUnbounded(Range.Bound.exclusive((double) now.toEpochMilli())))
        .map(UUID::fromString);
  }

  public Mono<Boolean> retainUntilPurge(UUID jobId, Instant completedAt) {
    return redisTemplate.opsForZSet()
        .add(retentionKey(), jobId.toString(), completedAt.toEpochMilli());
  }

  /**
   * @return jobs that completed before the cutoff
   */
  public Flux<UUID> completedBefore(Instant cutoff) {
    return redisTemplate.opsForZSet()
        .rangeByScore(retentionKey(),
            Range.leftUnbounded(Range.Bound.exclusive((double) cutoff.toEpochMilli())))
        .map(UUID::fromString);
  }

  public Mono<Boolean> purged(UUID jobId) {
    return redisTemplate.opsForZSet().remove(retentionKey(), jobId.toString())
        .map(removed -> removed > 0);
  }

  public Mono<UUID> findLive(String cacheKey) {
    return redisTemplate.opsForValue().get(liveKey(cacheKey))
        .map(UUID::fromString);
  }

  /**
   * Records the job as the live one for its cache key unless another job already is.
   */
  public Mono<Boolean> registerLive(String cacheKey, UUID jobId, Duration ttl) {
    return redisTemplate.opsForValue().setIfAbsent(liveKey(cacheKey), jobId.toString(), ttl);
  }

  public Mono<Boolean> replaceLive(String cacheKey, UUID jobId, Duration ttl) {
    return redisTemplate.opsForValue().set(liveKey(cacheKey), jobId.toString(), ttl);
  }

  /**
   * Clears the live job of the cache key, only if it is still the given job.
   */
  public Mono<Boolean> forgetLive(String cacheKey, UUID jobId) {
    final String key = liveKey(cacheKey);
    return redisTemplate.opsForValue().get(key)
        .filter(current -> current.equals(jobId.toString()))
        .flatMap(current -> redisTemplate.delete(key).map(deleted -> deleted > 0))
        .defaultIfEmpty(false);
  }

  String queueKey() {
    return prefix + "queue";
  }

  String leasesKey() {
    return prefix + "leases";
  }

  String retentionKey() {
    return prefix + "retention";
  }

  String liveKey(String cacheKey) {
    return prefix + "live:" + cacheKey;
  }
}
