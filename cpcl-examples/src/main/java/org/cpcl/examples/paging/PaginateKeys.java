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

package org.cpcl.examples.paging;

import org.cpcl.CassandraClient;
import org.cpcl.Cpcl;
import org.cpcl.model.ColumnSlice;
import org.cpcl.model.KeyedRow;
import org.cpcl.paging.PagingIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static org.apache.cassandra.thrift.ConsistencyLevel.ONE;

/**
 * Walks all rows of a column family page by page, and all rows matching an index condition.
 * Expects the keyspace created by the getting started example.
 */
public final class PaginateKeys {

    private static final String KEYSPACE = "GettingStarted";
    private static final String COLUMN_FAMILY = "users";
    private static final int PAGE_SIZE = 2;
    private static final int ROWS = 10;

    private static final Logger log = LoggerFactory.getLogger(PaginateKeys.class);

    private PaginateKeys() {}

    public static void main(String[] args) {
        try (CassandraClient client = Cpcl.clientBuilder()
                .server("localhost", 9160)
                .keyspace(KEYSPACE)
                .buildAndConnect()) {
            insertRows(client);
            paginateAll(client);
            paginateIndexed(client);
        }
    }

    private static void insertRows(CassandraClient client) {
        var users = client.cf(COLUMN_FAMILY);
        for (int i = 0; i < ROWS; i++) {
            users.set("user-" + i, Map.of("email", "user" + i + "@example.com", "city", i % 2 == 0 ? "Oslo" : "Lima"));
        }
        log.info("Inserted {} rows.", ROWS);
    }

    private static void paginateAll(CassandraClient client) {
        PagingIterator rows = client.cf(COLUMN_FAMILY)
                .getKeyRange("", "", null, ColumnSlice.all(), null, ONE, PAGE_SIZE);

        while (rows.hasNext()) {
            KeyedRow row = rows.next();
            log.info("Row {}: {}", row.key(), row.row());
        }
        log.info("Visited {} rows in pages of {}.", rows.getRowsSeen(), PAGE_SIZE);
    }

    private static void paginateIndexed(CassandraClient client) {
        long count = client.cf(COLUMN_FAMILY)
                .getWhere(Map.of("city", "Oslo"))
                .stream()
                .peek(row -> log.info("{} lives in Oslo", row.key()))
                .count();
        log.info("{} users live in Oslo.", count);
    }
}
