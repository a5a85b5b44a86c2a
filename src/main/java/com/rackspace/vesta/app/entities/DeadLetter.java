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

package com.rackspace.vesta.app.entities;

import com.rackspace.vesta.app.model.ErrorType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Data;
import org.springframework.data.cassandra.core.cql.Ordering;
import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * A job that exhausted its retries. Partitioned by UTC day so the most recent failures can be
 * listed without scanning the table.
 */
@Table("dead_letters")
@Data
public class DeadLetter {
  @PrimaryKeyColumn(type = PrimaryKeyType.PARTITIONED, ordinal = 0)
  String day;

  @PrimaryKeyColumn(value = "failed_at", type = PrimaryKeyType.CLUSTERED, ordinal = 1,
      ordering = Ordering.DESCENDING)
  Instant failedAt;

  @PrimaryKeyColumn(value = "job_id", type = PrimaryKeyType.CLUSTERED, ordinal = 2)
  UUID jobId;

  String site;

  List<String> points;

  @Column("start_ms")
  long startMs;

  @Column("end_ms")
  long endMs;

  @Column("cache_key")
  String cacheKey;

  String error;

  @Column("error_type")
  ErrorType errorType;

  @Column("retry_count")
  int retryCount;

  @Column("requeued_as")
  UUID requeuedAs;
}
