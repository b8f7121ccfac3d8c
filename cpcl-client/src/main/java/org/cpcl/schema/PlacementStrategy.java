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

package org.cpcl.schema;

/**
 * Replica placement strategies a keyspace can be created with.
 */
public enum PlacementStrategy {
    SIMPLE("org.apache.cassandra.locator.SimpleStrategy"),
    NETWORK_TOPOLOGY("org.apache.cassandra.locator.NetworkTopologyStrategy"),
    OLD_NETWORK_TOPOLOGY("org.apache.cassandra.locator.OldNetworkTopologyStrategy");

    private final String className;

    PlacementStrategy(String className) {
        this.className = className;
    }

    public String getClassName() {
        return className;
    }

    /**
     * Whether the strategy is configured through a single {@code replication_factor} option;
     * network topology placement takes per-datacenter factors instead.
     *
     * @return {@code true} if the strategy takes a replication factor
     */
    public boolean usesReplicationFactor() {
        return this != NETWORK_TOPOLOGY;
    }
}
