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
 * Thrown when a timestamp cannot be interpreted in any of the accepted formats.
 */
public class MalformedTimestampException extends IllegalArgumentException {

  private final transient Object input;

  public MalformedTimestampException(Object input, String reason) {
    super("Malformed timestamp '" + input + "': " + reason);
    this.input = input;
  }

  public MalformedTimestampException(Object input, Throwable cause) {
    super("Malformed timestamp '" + input + "'", cause);
    this.input = input;
  }

  public Object getInput() {
    return input;
  }
}
