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

package org.cpcl;

/**
 * Main entry point for creating CPCL clients.
 *
 * <pre>{@code
 * var client = Cpcl.clientBuilder()
 *     .server("10.0.0.1", 9160)
 *     .server("10.0.0.2", 9160)
 *     .keyspace("Shop")
 *     .buildAndConnect();
 *
 * client.set("user.john", Map.of("email", "john@example.com", "age", "34"));
 * Optional<Row> john = client.get("user.john:email,age");
 * }</pre>
 *
 * <h2>Version Information</h2>
 * <pre>{@code
 * String version = Cpcl.version();          // e.g., "0.1.0"
 * CpclVersion info = Cpcl.versionInfo();    // Full version details
 * }</pre>
 *
 * @see CassandraClientBuilder
 * @see ClientRegistry
 */
public final class Cpcl {

    private Cpcl() {}

    public static CassandraClientBuilder clientBuilder() {
        return new CassandraClientBuilder();
    }

    public static String version() {
        return CpclVersion.getInstance().getVersion();
    }

    public static CpclVersion versionInfo() {
        return CpclVersion.getInstance();
    }
}
