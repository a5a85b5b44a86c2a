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

import com.rackspace.vesta.app.model.QueryRequest;
import com.rackspace.vesta.app.model.QueryResponse;
import com.rackspace.vesta.app.services.QueryService;
import com.rackspace.vesta.app.utils.DateTimeUtils;
import io.swagger.annotations.ApiOperation;
import io.swagger.annotations.ApiParam;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Time-series query API. Answers inline with samples, or with 202 and a job id when the
 * request was large enough to be queued.
 */
@RestController
@RequestMapping("/api/query")
@Profile("query")
public class QueryController {

  private final QueryService queryService;
  private final Clock clock;

  @Autowired
  public QueryController(QueryService queryService, Clock clock) {
    this.queryService = queryService;
    this.clock = clock;
  }

  @GetMapping
  @ApiOperation(value = "Queries the samples of one or more points of a site")
  public Mono<ResponseEntity<QueryResponse>> query(
      @RequestParam String site,
      @ApiParam(value = "Point names, repeated or comma separated")
      @RequestParam List<String> points,
      @ApiParam(value = "Epoch millis, ISO-8601 or relative such as 2d-ago")
      @RequestParam String start,
      @ApiParam(value = "Epoch millis, ISO-8601 or relative, defaults to now")
      @RequestParam(required = false) String end,
      @ApiParam(value = "ISO-8601 duration or millis, defaults to the configured resolution")
      @RequestParam(required = false) String resolution) {

    final Instant startTime = DateTimeUtils.parseInstant(start, clock);
    final Instant endTime = DateTimeUtils.parseInstant(end, clock);

    final QueryRequest request = new QueryRequest()
        .setSite(site)
        .setPoints(points.stream()
            .flatMap(value -> List.of(StringUtils.split(value, ',')).stream())
            .map(String::trim)
            .filter(StringUtils::isNotEmpty)
            .collect(Collectors.toList()))
        .setStartMs(startTime.toEpochMilli())
        .setEndMs(endTime.toEpochMilli())
        .setResolution(parseResolution(resolution));

    return queryService.query(request)
        .map(response -> QueryResponse.STATUS_PROCESSING.equals(response.getStatus()) ?
            ResponseEntity.status(HttpStatus.ACCEPTED).body(response) :
            ResponseEntity.ok(response));
  }

  static Duration parseResolution(String resolution) {
    if (StringUtils.isBlank(resolution)) {
      return null;
    }
    if (StringUtils.isNumeric(resolution)) {
      return Duration.ofMillis(Long.parseLong(resolution));
    }
    try {
      return Duration.parse(resolution);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid resolution: " + resolution, e);
    }
  }
}
