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

import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Copies the request and trace ids of the caller into the MDC.
 */
@Component
public class MDCFilter implements WebFilter {

  public static final String X_REQUEST_ID = "X-Request-Id";
  public static final String X_B3_TRACE_ID = "X-B3-TraceId";

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    final String requestId = exchange.getRequest().getHeaders().getFirst(X_REQUEST_ID);
    MDC.put(X_REQUEST_ID, requestId);
    MDC.put(X_B3_TRACE_ID, exchange.getRequest().getHeaders().getFirst(X_B3_TRACE_ID));
    if (requestId != null) {
      exchange.getResponse().getHeaders().set(X_REQUEST_ID, requestId);
    }
    return chain.filter(exchange);
  }
}
