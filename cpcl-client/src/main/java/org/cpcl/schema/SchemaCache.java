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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.apache.cassandra.thrift.KsDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Function;

/**
 * Keyspace schemas memoized for a fixed time after they were loaded.
 */
public class SchemaCache {

    private static final Logger log = LoggerFactory.getLogger(SchemaCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(3600);

    private final Function<String, KsDef> describeKeyspace;
    private final Cache<String, KeyspaceSchema> cache;

    /**
     * Creates a cache.
     *
     * @param describeKeyspace loads the definition of a keyspace from the server
     * @param ttl              how long a loaded schema stays valid
     */
    public SchemaCache(Function<String, KsDef> describeKeyspace, Duration ttl) {
        this(describeKeyspace, ttl, Ticker.systemTicker());
    }

    public SchemaCache(Function<String, KsDef> describeKeyspace, Duration ttl, Ticker ticker) {
        this.describeKeyspace = describeKeyspace;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Returns the schema of a keyspace.
     *
     * @param keyspace the keyspace name
     * @param useCache {@code false} to load from the server without reading or storing the cache
     * @return the schema
     */
    public KeyspaceSchema get(String keyspace, boolean useCache) {
        if (!useCache) {
            return load(keyspace);
        }
        return cache.get(keyspace, this::load);
    }

    public void invalidate(String keyspace) {
        cache.invalidate(keyspace);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private KeyspaceSchema load(String keyspace) {
        log.debug("Loading schema of keyspace {}", keyspace);
        return KeyspaceSchema.fromKsDef(describeKeyspace.apply(keyspace));
    }
}
