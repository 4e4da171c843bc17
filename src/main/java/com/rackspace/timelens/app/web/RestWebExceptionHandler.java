/*
 * Copyright 2020 Rackspace US, Inc.
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


package com.rackspace.timelens.app.web;

import com.rackspace.timelens.app.services.ProviderUnavailableException;
import com.rackspace.timelens.app.services.ViewportLimitException;
import com.rackspace.timelens.app.services.ViewportNotFoundException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.error.ErrorAttributeOptions.Include;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@Slf4j
@Component
@Order(-2)//So that our exception handler gets picked before DefaultErrorWebExceptionHandler
public class RestWebExceptionHandler extends AbstractErrorWebExceptionHandler {

  static final String UNEXPECTED_ERROR_MESSAGE = "Service encountered an unexpected "
      + "condition which prevented it from fulfilling the request.";

  public RestWebExceptionHandler(
      ErrorAttributes errorAttributes,
      WebProperties webProperties,
      ApplicationContext applicationContext,
      ServerCodecConfigurer serverCodecConfigurer) {
    super(errorAttributes, webProperties.getResources(), applicationContext);
    this.setMessageWriters(serverCodecConfigurer.getWriters());
  }

  @Override
  protected RouterFunction<ServerResponse> getRoutingFunction(
      ErrorAttributes errorAttributes) {
    return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
  }

  private Mono<ServerResponse> renderErrorResponse(ServerRequest serverRequest) {
    final Map<String, Object> body = getErrorAttributes(serverRequest, ErrorAttributeOptions.of(
        Include.EXCEPTION, Include.MESSAGE));
    final Throwable error = getError(serverRequest);
    final HttpStatus status = statusFor(error);
    logErrorMessage(serverRequest, error, status);

    if (status.is5xxServerError() && status != HttpStatus.SERVICE_UNAVAILABLE) {
      body.put("message", UNEXPECTED_ERROR_MESSAGE);
    } else if (error instanceof ResponseStatusException) {
      body.put("message", ((ResponseStatusException) error).getReason());
    }
    body.put("status", status.value());
    body.put("error", status.getReasonPhrase());
    return ServerResponse.status(status).body(BodyInserters.fromValue(body));
  }

  /**
   * Maps the exception to the response status. Exceptions are matched by type so that
   * subclasses, such as stale chunk ids, share the status of their parent.
   */
  static HttpStatus statusFor(Throwable error) {
    if (error instanceof ViewportNotFoundException) {
      return HttpStatus.NOT_FOUND;
    }
    if (error instanceof ProviderUnavailableException) {
      return HttpStatus.SERVICE_UNAVAILABLE;
    }
    if (error instanceof ViewportLimitException) {
      return HttpStatus.TOO_MANY_REQUESTS;
    }
    if (error instanceof IllegalArgumentException
        || error instanceof ServerWebInputException
        || error instanceof TypeMismatchException) {
      return HttpStatus.BAD_REQUEST;
    }
    if (error instanceof ResponseStatusException) {
      return ((ResponseStatusException) error).getStatus();
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  private void logErrorMessage(ServerRequest serverRequest, Throwable error, HttpStatus status) {
    if (status.is4xxClientError()) {
      // avoid logs cluttering for bad requests
      log.trace("Web request for uri {} failed with {}", serverRequest.uri(), status, error);
      return;
    }
    log.warn("Web request for uri {} failed with {}", serverRequest.uri(), status, error);
  }
}
