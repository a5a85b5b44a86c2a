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

package com.rackspace.vesta.app.model;

import lombok.Value;

/**
 * A normalized measurement. Identity is <code>(site, point, timestampMs, tier)</code>.
 */
@Value
public class Sample {
  String site;
  String point;
  long timestampMs;
  double value;
  Quality quality;
  Tier tier;

  public SampleValue toValue() {
    return new SampleValue(timestampMs, value, quality, tier);
  }
}
