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

import com.rackspace.vesta.app.exceptions.JobNotFoundException;
import com.rackspace.vesta.app.model.ApiErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

@ControllerAdvice
public class RestExceptionAdvice {

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgumentException(
      IllegalArgumentException e) {
    return respond(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleJobNotFound(JobNotFoundException e) {
    return respond(HttpStatus.NOT_FOUND, e.getMessage());
  }

  private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String message) {
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse()
            .setStatus(status.value())
            .setError(status.getReasonPhrase())
            .setMessage(message));
  }
}
