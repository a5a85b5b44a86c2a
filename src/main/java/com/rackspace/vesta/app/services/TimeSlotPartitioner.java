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

import com.rackspace.vesta.app.config.AppProperties;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps sample timestamps to the time slot partitions of the samples table.
 */
@Component
public class TimeSlotPartitioner {

  private final long partitionWidthMs;

  @Autowired
  public TimeSlotPartitioner(AppProperties appProperties) {
    this.partitionWidthMs = appProperties.getSamplePartitionWidth().toMillis();
    if (partitionWidthMs <= 0) {
      throw new IllegalArgumentException("samplePartitionWidth must be positive");
    }
  }

  public long timeSlot(long timestampMs) {
    return Math.floorDiv(timestampMs, partitionWidthMs) * partitionWidthMs;
  }

  /**
   * @return the ascending time slots that intersect <code>[startMs, endMs)</code>
   */
  public List<Long> partitionsOverRange(long startMs, long endMs) {
    final List<Long> slots = new ArrayList<>();
    if (endMs <= startMs) {
      return slots;
    }
    for (long slot = timeSlot(startMs); slot < endMs; slot += partitionWidthMs) {
      slots.add(slot);
    }
    return slots;
  }
}
