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

package com.rackspace.vesta.app;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import java.net.InetSocketAddress;
import org.testcontainers.containers.CassandraContainer;

/**
 * Shares one Cassandra container across the storage tests and hands out sessions bound to a
 * freshly created test keyspace.
 */
public final class CassandraContainerSetup {

  public static final String DOCKER_IMAGE = "cassandra:3.11";
  public static final String KEYSPACE = "vesta_test";
  public static final String DATACENTER = "datacenter1";

  private static CassandraContainer<?> container;

  private CassandraContainerSetup() {
  }

  public static synchronized CqlSession newSession() {
    if (container == null) {
      container = new CassandraContainer<>(DOCKER_IMAGE);
      container.start();
      try (CqlSession session = builder().build()) {
        session.execute("CREATE KEYSPACE IF NOT EXISTS " + KEYSPACE
            + " WITH replication = {'class': 'SimpleStrategy', 'replication_factor': 1}");
      }
    }
    return builder().withKeyspace(KEYSPACE).build();
  }

  private static CqlSessionBuilder builder() {
    return CqlSession.builder()
        .addContactPoint(new InetSocketAddress(container.getHost(),
            container.getMappedPort(CassandraContainer.CQL_PORT)))
        .withLocalDatacenter(DATACENTER);
  }
}
