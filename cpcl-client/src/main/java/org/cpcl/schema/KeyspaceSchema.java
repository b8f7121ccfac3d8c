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

import org.apache.cassandra.thrift.CfDef;
import org.apache.cassandra.thrift.KsDef;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Schema of a keyspace, as described by the server.
 *
 * @param name                     the keyspace name
 * @param placementStrategy        the replica placement strategy class
 * @param placementStrategyOptions the strategy options
 * @param replicationFactor        the replication factor, {@code null} when the strategy does not use one
 * @param columnFamilies           column family schemas by name, in server order
 */
public record KeyspaceSchema(
        String name,
        String placementStrategy,
        Map<String, String> placementStrategyOptions,
        Integer replicationFactor,
        Map<String, ColumnFamilySchema> columnFamilies) {

    static final String REPLICATION_FACTOR_OPTION = "replication_factor";

    public static KeyspaceSchema fromKsDef(KsDef definition) {
        Map<String, String> options = definition.getStrategy_options() == null
                ? Map.of()
                : Map.copyOf(definition.getStrategy_options());

        Integer replicationFactor = null;
        if (definition.isSetReplication_factor()) {
            replicationFactor = definition.getReplication_factor();
        } else if (NumberUtils.isDigits(options.get(REPLICATION_FACTOR_OPTION))) {
            replicationFactor = Integer.valueOf(options.get(REPLICATION_FACTOR_OPTION));
        }

        Map<String, ColumnFamilySchema> columnFamilies = new LinkedHashMap<>();
        if (definition.getCf_defs() != null) {
            for (CfDef cfDef : definition.getCf_defs()) {
                columnFamilies.put(cfDef.getName(), ColumnFamilySchema.fromCfDef(cfDef));
            }
        }

        return new KeyspaceSchema(
                definition.getName(),
                definition.getStrategy_class(),
                options,
                replicationFactor,
                Collections.unmodifiableMap(columnFamilies));
    }

    public Optional<ColumnFamilySchema> columnFamily(String columnFamily) {
        return Optional.ofNullable(columnFamilies.get(columnFamily));
    }
}
