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

package com.rackspace.vesta.app.config;

import static com.rackspace.vesta.app.services.DataTablesStatements.*;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.type.DataTypes;
import com.rackspace.vesta.app.services.DataTablesStatements;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.Ordering;
import org.springframework.data.cassandra.core.cql.generator.CreateTableCqlGenerator;
import org.springframework.data.cassandra.core.cql.keyspace.CreateTableSpecification;
import org.springframework.data.cassandra.core.cql.keyspace.DefaultOption;
import org.springframework.data.cassandra.core.cql.keyspace.Option;
import org.springframework.data.cassandra.core.cql.keyspace.TableOption;
import org.springframework.data.cassandra.core.cql.keyspace.TableOption.CompactionOption;
import org.springframework.data.cassandra.core.cql.session.init.KeyspacePopulator;
import org.springframework.data.cassandra.core.cql.session.init.ScriptException;
import org.springframework.stereotype.Component;

/**
 * Creates the samples, jobs, job history and dead-letter tables on startup. The samples table
 * gets a default TTL and time-window compaction sized from that TTL.
 * @see DataTablesStatements
 */
@Component
@Slf4j
public class DataTablesPopulator implements KeyspacePopulator {

  private static final DefaultOption COMPACTION_WINDOW_UNIT = new DefaultOption("compaction_window_unit", String.class, true, false, true);
  /**
   * value is number of the compaction_window_unit increments.
   */
  private static final DefaultOption COMPACTION_WINDOW_SIZE = new DefaultOption("compaction_window_size", Long.class, true, false, false);
  private static final String DEFAULT_TIME_TO_LIVE = "default_time_to_live";

  private final AppProperties appProperties;

  @Autowired
  public DataTablesPopulator(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  @Override
  public void populate(CqlSession session) throws ScriptException {
    tableSpecifications().forEach(spec -> createTable(spec, session));
  }

  List<CreateTableSpecification> tableSpecifications() {
    return List.of(
        samplesTableSpec(appProperties.getSampleTtl()),
        jobsTableSpec(JOBS_TABLE, false),
        jobsTableSpec(JOB_HISTORY_TABLE, true),
        deadLettersTableSpec()
    );
  }

  private void createTable(CreateTableSpecification createTableSpec,
                           CqlSession session) {
    log.debug("Ensuring table {} exists", createTableSpec.getName());
    // Cassandra doesn't like reactive version of create table
    session.execute(CreateTableCqlGenerator.toCql(createTableSpec));
  }

  private CreateTableSpecification samplesTableSpec(Duration ttl) {
    return CreateTableSpecification
        .createTable(SAMPLES_TABLE)
        .ifNotExists()
        .partitionKeyColumn(SITE, DataTypes.TEXT)
        .partitionKeyColumn(POINT, DataTypes.TEXT)
        .partitionKeyColumn(TIME_PARTITION_SLOT, DataTypes.BIGINT)
        .clusteredKeyColumn(TIMESTAMP, DataTypes.BIGINT)
        .clusteredKeyColumn(TIER, DataTypes.TEXT)
        .column(VALUE, DataTypes.DOUBLE)
        .column(QUALITY, DataTypes.TEXT)
        .with(DEFAULT_TIME_TO_LIVE, ttl.getSeconds(), false, false)
        .with(TableOption.COMPACTION, compactionOptions(ttl))
        .with(TableOption.GC_GRACE_SECONDS, appProperties.getDataTableGcGraceSeconds());
  }

  private CreateTableSpecification jobsTableSpec(String tableName, boolean history) {
    final CreateTableSpecification spec = CreateTableSpecification
        .createTable(tableName)
        .ifNotExists()
        .partitionKeyColumn(ID, DataTypes.UUID)
        .column(SITE, DataTypes.TEXT)
        .column(POINTS, DataTypes.listOf(DataTypes.TEXT))
        .column(RANGES, DataTypes.listOf(DataTypes.TEXT))
        .column(START_MS, DataTypes.BIGINT)
        .column(END_MS, DataTypes.BIGINT)
        .column(RESOLUTION_MS, DataTypes.BIGINT)
        .column(STATUS, DataTypes.TEXT)
        .column(CACHE_KEY, DataTypes.TEXT)
        .column(SAMPLE_COUNT, DataTypes.BIGINT)
        .column(RETRY_COUNT, DataTypes.INT)
        .column(BATCH_CURSOR, DataTypes.INT)
        .column(TOTAL_BATCHES, DataTypes.INT)
        .column(CANCEL_REQUESTED, DataTypes.BOOLEAN)
        .column(OWNER, DataTypes.TEXT)
        .column(ERROR, DataTypes.TEXT)
        .column(POINT_ERRORS, DataTypes.mapOf(DataTypes.TEXT, DataTypes.TEXT))
        .column(CREATED_AT, DataTypes.TIMESTAMP)
        .column(STARTED_AT, DataTypes.TIMESTAMP)
        .column(COMPLETED_AT, DataTypes.TIMESTAMP);
    if (history) {
      spec.column(ARCHIVED_AT, DataTypes.TIMESTAMP);
    }
    return spec;
  }

  private CreateTableSpecification deadLettersTableSpec() {
    return CreateTableSpecification
        .createTable(DEAD_LETTERS_TABLE)
        .ifNotExists()
        .partitionKeyColumn("day", DataTypes.TEXT)
        .clusteredKeyColumn("failed_at", DataTypes.TIMESTAMP, Ordering.DESCENDING)
        .clusteredKeyColumn("job_id", DataTypes.UUID)
        .column(SITE, DataTypes.TEXT)
        .column(POINTS, DataTypes.listOf(DataTypes.TEXT))
        .column(START_MS, DataTypes.BIGINT)
        .column(END_MS, DataTypes.BIGINT)
        .column(CACHE_KEY, DataTypes.TEXT)
        .column(ERROR, DataTypes.TEXT)
        .column("error_type", DataTypes.TEXT)
        .column(RETRY_COUNT, DataTypes.INT)
        .column("requeued_as", DataTypes.UUID);
  }

  private Map<Option, Object> compactionOptions(Duration ttl) {
    // Docs recommend 20 - 30 windows
    final Duration calculatedWindowSize = ttl.dividedBy(30);

    final TimeUnit windowUnit;
    final long windowSize;
    if (calculatedWindowSize.compareTo(Duration.ofDays(1)) > 0) {
      windowUnit = TimeUnit.DAYS;
      windowSize = calculatedWindowSize.toDays();
    } else if (calculatedWindowSize.compareTo(Duration.ofHours(1)) > 0) {
      windowUnit = TimeUnit.HOURS;
      windowSize = calculatedWindowSize.toHours();
    } else {
      windowUnit = TimeUnit.MINUTES;
      windowSize = Math.max(1, calculatedWindowSize.toMinutes());
    }

    return Map.of(
        CompactionOption.CLASS, "TimeWindowCompactionStrategy",
        COMPACTION_WINDOW_UNIT, windowUnit,
        COMPACTION_WINDOW_SIZE, nicerWindowSizeValues(windowSize)
    );
  }

  /**
   * Rounds to 10's, 5, or original value otherwise.
   */
  static long nicerWindowSizeValues(long value) {
    if (value >= 10) {
      return value - (value % 10);
    } else if (value >= 5) {
      return 5;
    } else {
      return value;
    }
  }
}
