/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.cpcl.examples.gettingstarted;

import org.apache.cassandra.thrift.KsDef;
import org.cpcl.CassandraClient;
import org.cpcl.ClientRegistry;
import org.cpcl.Cpcl;
import org.cpcl.codec.DataType;
import org.cpcl.columnfamily.ColumnDefinition;
import org.cpcl.connection.Operations;
import org.cpcl.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class GettingStarted {

    private static final String KEYSPACE = "GettingStarted";
    private static final String COLUMN_FAMILY = "users";

    private static final Logger log = LoggerFactory.getLogger(GettingStarted.class);

    private GettingStarted() {}

    public static void main(String[] args) {
        log.info("Using {}", Cpcl.versionInfo());

        var client = ClientRegistry.register(Cpcl.clientBuilder()
                .server("localhost", 9160)
                .maxCallRetries(3)
                .build());

        try {
            prepareSchema(client);
            writeUsers(client);
            readUsers(client);
        } finally {
            ClientRegistry.reset();
        }
    }

    private static void prepareSchema(CassandraClient client) {
        List<KsDef> keyspaces = client.call(Operations.DESCRIBE_KEYSPACES);
        if (keyspaces.stream().anyMatch(ks -> KEYSPACE.equals(ks.getName()))) {
            log.info("Keyspace {} exists, dropping it.", KEYSPACE);
            client.dropKeyspace(KEYSPACE);
        }
        client.createKeyspace(KEYSPACE, 1);
        client.createStandardColumnFamily(
                KEYSPACE,
                COLUMN_FAMILY,
                List.of(ColumnDefinition.indexed("city", DataType.UTF8), ColumnDefinition.of("age", DataType.LONG)));
        client.useKeyspace(KEYSPACE);
        log.info("Created keyspace {} with column family {}.", KEYSPACE, COLUMN_FAMILY);
    }

    private static void writeUsers(CassandraClient client) {
        client.set("users.john", Map.of("email", "john@example.com", "city", "Oslo", "age", 34L));
        client.set("users.jane", Map.of("email", "jane@example.com", "city", "Lima", "age", 29L));
        client.cf(COLUMN_FAMILY).set("jim", Map.of("email", "jim@example.com", "city", "Oslo", "age", 51L));
        log.info("Wrote 3 users.");
    }

    private static void readUsers(CassandraClient client) {
        Optional<Row> john = client.get("users.john:email,age");
        log.info("john: {}", john.orElse(null));

        Optional<Row> jane = client.get("users.jane");
        log.info("jane: {}", jane.orElse(null));

        client.cf(COLUMN_FAMILY)
                .getWhere(Map.of("city", "Oslo"))
                .forEachRemaining(row -> log.info("Lives in Oslo: {} {}", row.key(), row.row()));

        log.info("john has {} columns.", client.cf(COLUMN_FAMILY).count("john"));
    }
}
