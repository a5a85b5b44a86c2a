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

package com.rackspace.vesta.app.web;

import com.rackspace.vesta.app.model.InvalidationResult;
import com.rackspace.vesta.app.services.QueryCacheService;
import io.swagger.annotations.ApiOperation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/cache")
@Profile("query")
public class CacheController {

  private final QueryCacheService queryCacheService;

  @Autowired
  public CacheController(QueryCacheService queryCacheService) {
    this.queryCacheService = queryCacheService;
  }

  @DeleteMapping
  @ApiOperation(value = "Invalidates cached results of a site that include a point starting "
      + "with the prefix")
  public Mono<InvalidationResult> invalidate(@RequestParam String site,
                                             @RequestParam(defaultValue = "") String pointPrefix) {
    return queryCacheService.invalidate(site, pointPrefix)
        .map(count -> new InvalidationResult()
            .setSite(site)
            .setPointPrefix(pointPrefix)
            .setInvalidated(count));
  }
}
