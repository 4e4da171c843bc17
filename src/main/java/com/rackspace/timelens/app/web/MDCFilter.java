/*
 * Copyright 2021 Rackspace US, Inc.
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
 *
 */

package com.rackspace.timelens.app.web;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

@Component
@Slf4j
public class MDCFilter implements WebFilter {

  private static final String X_B3_TRACE_ID = "X-B3-TraceId";

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    final String traceId = exchange.getRequest().getHeaders().getFirst(X_B3_TRACE_ID);
    if (traceId != null) {
      MDC.put(X_B3_TRACE_ID, traceId);
    } else {
      MDC.remove(X_B3_TRACE_ID);
    }
    log.trace("{} {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath());
    return chain.filter(exchange);
  }
}
