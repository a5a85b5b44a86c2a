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
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

/**
 * Periodically enforces the durable cache's size bound. Runs alongside, never in front of,
 * cache reads.
 */
@Service
@Slf4j
@Profile("worker")
public class CacheSweeper {

  private final QueryCacheService queryCacheService;
  private final CacheProperties cacheProperties;
  private final ScheduledExecutorService executor;

  @Autowired
  public CacheSweeper(QueryCacheService queryCacheService,
                      CacheProperties cacheProperties,
                      ScheduledExecutorService executor) {
    this.queryCacheService = queryCacheService;
    this.cacheProperties = cacheProperties;
    this.executor = executor;
  }

  @PostConstruct
  public void setupScheduler() {
    log.info("Sweeping the durable cache every {} with maxBytes={}",
        cacheProperties.getSweepInterval(), cacheProperties.getDurableMaxBytes());
    scheduleNext();
  }

  private void scheduleNext() {
    if (executor.isShutdown()) {
      return;
    }
    executor.schedule(this::sweep, cacheProperties.getSweepInterval().toMillis(),
        TimeUnit.MILLISECONDS);
  }

  void sweep() {
    queryCacheService.sweep()
        .name("cacheSweep")
        .metrics()
        .doFinally(signal -> scheduleNext())
        .subscribe(
            evicted -> log.debug("Cache sweep evicted={}", evicted),
            e -> log.warn("Cache sweep failed", e)
        );
  }
}
