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

import org.springframework.stereotype.Component;

/**
 * Provides a consolidated declaration of the CQL statements that execute against the samples
 * and jobs tables.
 */
@Component
public class DataTablesStatements {

  public static final String SAMPLES_TABLE = "samples";
  public static final String JOBS_TABLE = "jobs";
  public static final String JOB_HISTORY_TABLE = "job_history";
  public static final String DEAD_LETTERS_TABLE = "dead_letters";

  public static final String SITE = "site";
  public static final String POINT = "point";
  public static final String TIME_PARTITION_SLOT = "time_slot";
  public static final String TIMESTAMP = "ts";
  public static final String TIER = "tier";
  public static final String VALUE = "value";
  public static final String QUALITY = "quality";

  public static final String ID = "id";
  public static final String POINTS = "points";
  public static final String RANGES = "ranges";
  public static final String START_MS = "start_ms";
  public static final String END_MS = "end_ms";
  public static final String RESOLUTION_MS = "resolution_ms";
  public static final String STATUS = "status";
  public static final String CACHE_KEY = "cache_key";
  public static final String SAMPLE_COUNT = "sample_count";
  public static final String RETRY_COUNT = "retry_count";
  public static final String BATCH_CURSOR = "batch_cursor";
  public static final String TOTAL_BATCHES = "total_batches";
  public static final String CANCEL_REQUESTED = "cancel_requested";
  public static final String OWNER = "owner";
  public static final String ERROR = "error";
  public static final String POINT_ERRORS = "point_errors";
  public static final String CREATED_AT = "created_at";
  public static final String STARTED_AT = "started_at";
  public static final String COMPLETED_AT = "completed_at";
  public static final String ARCHIVED_AT = "archived_at";

  private static final String JOB_COLUMNS = String.join(",",
      ID, SITE, POINTS, RANGES, START_MS, END_MS, RESOLUTION_MS, STATUS, CACHE_KEY, SAMPLE_COUNT,
      RETRY_COUNT, BATCH_CURSOR, TOTAL_BATCHES, CANCEL_REQUESTED, OWNER, ERROR, POINT_ERRORS,
      CREATED_AT, STARTED_AT, COMPLETED_AT
  );
  private static final String JOB_PLACEHOLDERS = "?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?";

  // Sample writes carry an explicit, strictly increasing write timestamp
  private static final String SAMPLE_INSERT = "INSERT INTO " + SAMPLES_TABLE + " ("
      + String.join(",", SITE, POINT, TIME_PARTITION_SLOT, TIMESTAMP, TIER, VALUE, QUALITY)
      + ") VALUES (?, ?, ?, ?, ?, ?, ?) USING TIMESTAMP ?";

  private static final String SAMPLE_QUERY = "SELECT "
      + String.join(",", TIMESTAMP, TIER, VALUE, QUALITY)
      + " FROM " + SAMPLES_TABLE + " WHERE " + SITE + " = ? AND " + POINT + " = ?"
      + " AND " + TIME_PARTITION_SLOT + " = ? AND " + TIMESTAMP + " >= ? AND "
      + TIMESTAMP + " < ?";

  private static final String JOB_INSERT = "INSERT INTO " + JOBS_TABLE
      + " (" + JOB_COLUMNS + ") VALUES (" + JOB_PLACEHOLDERS + ") IF NOT EXISTS";

  private static final String JOB_SELECT = "SELECT " + JOB_COLUMNS + " FROM " + JOBS_TABLE
      + " WHERE " + ID + " = ?";

  private static final String JOB_CLAIM = "UPDATE " + JOBS_TABLE
      + " SET status = 'processing', owner = ?, started_at = ?, cancel_requested = false"
      + " WHERE id = ? IF status = 'queued'";

  private static final String JOB_PROGRESS = "UPDATE " + JOBS_TABLE
      + " SET batch_cursor = ?, total_batches = ?, sample_count = ?, point_errors = ?"
      + " WHERE id = ? IF status = 'processing' AND owner = ?";

  private static final String JOB_RELEASE = "UPDATE " + JOBS_TABLE
      + " SET status = 'queued', owner = null, retry_count = ?, error = ?, batch_cursor = ?,"
      + " total_batches = ?, sample_count = ?, point_errors = ?"
      + " WHERE id = ? IF status = 'processing' AND owner = ?";

  private static final String JOB_FINISH = "UPDATE " + JOBS_TABLE
      + " SET status = ?, owner = null, retry_count = ?, error = ?, batch_cursor = ?,"
      + " total_batches = ?, sample_count = ?, point_errors = ?, completed_at = ?"
      + " WHERE id = ? IF status = 'processing' AND owner = ?";

  private static final String JOB_CANCEL_QUEUED = "UPDATE " + JOBS_TABLE
      + " SET status = 'failed', error = ?, completed_at = ? WHERE id = ? IF status = 'queued'";

  private static final String JOB_FLAG_CANCEL = "UPDATE " + JOBS_TABLE
      + " SET cancel_requested = true WHERE id = ? IF status = 'processing'";

  private static final String JOB_CANCEL_REQUESTED = "SELECT " + CANCEL_REQUESTED
      + " FROM " + JOBS_TABLE + " WHERE " + ID + " = ?";

  private static final String JOB_RECOVER = "UPDATE " + JOBS_TABLE
      + " SET status = 'queued', owner = null WHERE id = ? IF status = 'processing' AND owner = ?";

  private static final String JOB_DELETE = "DELETE FROM " + JOBS_TABLE + " WHERE id = ? IF EXISTS";

  private static final String HISTORY_INSERT = "INSERT INTO " + JOB_HISTORY_TABLE
      + " (" + JOB_COLUMNS + "," + ARCHIVED_AT + ") VALUES (" + JOB_PLACEHOLDERS + ",?)";

  private static final String HISTORY_SELECT = "SELECT " + JOB_COLUMNS + "," + ARCHIVED_AT
      + " FROM " + JOB_HISTORY_TABLE + " WHERE " + ID + " = ?";

  /**
   * @return INSERT CQL statement with placeholders site, point, timeSlot, timestamp, tier,
   * value, quality, writeTimeMicros
   */
  public String sampleInsert() {
    return SAMPLE_INSERT;
  }

  /**
   * @return SELECT CQL statement with placeholders site, point, timeSlot, starting timestamp,
   * ending timestamp and returns ts, tier, value, quality
   */
  public String sampleQuery() {
    return SAMPLE_QUERY;
  }

  /**
   * @return conditional INSERT of every job column, in declaration order
   */
  public String jobInsert() {
    return JOB_INSERT;
  }

  public String jobSelect() {
    return JOB_SELECT;
  }

  /**
   * @return compare-and-set from queued to processing with placeholders owner, startedAt, id
   */
  public String jobClaim() {
    return JOB_CLAIM;
  }

  /**
   * @return placeholders cursor, totalBatches, sampleCount, pointErrors, id, owner
   */
  public String jobProgress() {
    return JOB_PROGRESS;
  }

  /**
   * @return processing back to queued with placeholders retryCount, error, cursor,
   * totalBatches, sampleCount, pointErrors, id, owner
   */
  public String jobRelease() {
    return JOB_RELEASE;
  }

  /**
   * @return processing to a terminal status with placeholders status, retryCount, error,
   * cursor, totalBatches, sampleCount, pointErrors, completedAt, id, owner
   */
  public String jobFinish() {
    return JOB_FINISH;
  }

  /**
   * @return queued to failed with placeholders error, completedAt, id
   */
  public String jobCancelQueued() {
    return JOB_CANCEL_QUEUED;
  }

  public String jobFlagCancel() {
    return JOB_FLAG_CANCEL;
  }

  public String jobCancelRequested() {
    return JOB_CANCEL_REQUESTED;
  }

  /**
   * @return abandoned processing back to queued with placeholders id, owner
   */
  public String jobRecover() {
    return JOB_RECOVER;
  }

  public String jobDelete() {
    return JOB_DELETE;
  }

  /**
   * @return INSERT of every job column followed by archivedAt
   */
  public String historyInsert() {
    return HISTORY_INSERT;
  }

  public String historySelect() {
    return HISTORY_SELECT;
  }
}
