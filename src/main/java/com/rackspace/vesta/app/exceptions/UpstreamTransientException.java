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

package com.rackspace.vesta.app.exceptions;

/**
 * A retryable upstream failure (timeout, throttling or a 5xx) that persisted after all
 * attempts.
 */
public class UpstreamTransientException extends RuntimeException {

  private final int status;

  public UpstreamTransientException(int status, String message) {
    super(message);
    this.status = status;
  }

  public UpstreamTransientException(String message, Throwable cause) {
    super(message, cause);
    this.status = 0;
  }

  /**
   * @return the last upstream HTTP status seen, or 0 when no response was received
   */
  public int getStatus() {
    return status;
  }
}
