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

import org.cpcl.exception.CpclColumnFamilyNotFoundException;
import org.cpcl.exception.CpclInvalidRequestException;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link SchemaProvider} reading from a {@link SchemaCache} for whatever keyspace is active.
 */
public class KeyspaceSchemaProvider implements SchemaProvider {

    private final SchemaCache cache;
    private final Supplier<Optional<String>> currentKeyspace;

    public KeyspaceSchemaProvider(SchemaCache cache, Supplier<Optional<String>> currentKeyspace) {
        this.cache = cache;
        this.currentKeyspace = currentKeyspace;
    }

    @Override
    public ColumnFamilySchema getColumnFamilySchema(String columnFamily, boolean useCache) {
        String keyspace = currentKeyspace.get()
                .orElseThrow(() -> new CpclInvalidRequestException(
                        "Unable to read schema of \"" + columnFamily + "\", no keyspace has been set"));
        return cache.get(keyspace, useCache)
                .columnFamily(columnFamily)
                .orElseThrow(() -> new CpclColumnFamilyNotFoundException(keyspace, columnFamily));
    }
}
