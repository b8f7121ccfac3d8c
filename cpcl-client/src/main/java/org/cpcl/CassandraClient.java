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

import org.apache.cassandra.thrift.ConsistencyLevel;
import org.apache.cassandra.thrift.KsDef;
import org.apache.commons.lang3.StringUtils;
import org.cpcl.codec.Codec;
import org.cpcl.codec.DataType;
import org.cpcl.codec.DataTypeCodec;
import org.cpcl.columnfamily.ColumnDefinition;
import org.cpcl.columnfamily.ColumnFamily;
import org.cpcl.columnfamily.ColumnFamilyDefinition;
import org.cpcl.config.RetryPolicy;
import org.cpcl.connection.Connection;
import org.cpcl.connection.ConnectionPool;
import org.cpcl.connection.KeyspaceContext;
import org.cpcl.connection.NodeDescriptor;
import org.cpcl.connection.Operations;
import org.cpcl.connection.TransportFactory;
import org.cpcl.dispatch.CallDispatcher;
import org.cpcl.dispatch.Sleeper;
import org.cpcl.exception.CpclInvalidArgumentException;
import org.cpcl.exception.CpclInvalidPatternException;
import org.cpcl.exception.CpclInvalidRequestException;
import org.cpcl.model.Row;
import org.cpcl.request.ParsedRequest;
import org.cpcl.request.RequestParser;
import org.cpcl.schema.KeyspaceSchema;
import org.cpcl.schema.KeyspaceSchemaProvider;
import org.cpcl.schema.PlacementStrategy;
import org.cpcl.schema.SchemaCache;
import org.cpcl.schema.SchemaProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client of one Cassandra cluster.
 *
 * <p>Owns the connection pool, the call dispatcher and the schema cache, and hands out
 * {@link ColumnFamily} instances for the active keyspace. Besides typed access it accepts
 * request strings of the form {@code family.key[.superColumn][:columns][|count[R]]}.
 *
 * <p>A client is meant to be used from one thread at a time.
 *
 * @see CassandraClientBuilder
 */
public class CassandraClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(CassandraClient.class);

    private final ConnectionPool pool;
    private final CallDispatcher dispatcher;
    private final SchemaCache schemaCache;
    private final SchemaProvider schemaProvider;
    private final Codec codec;
    private final boolean autopack;
    private final Map<String, KeyspaceContext> registeredKeyspaces = new HashMap<>();
    private final Map<String, ColumnFamily> columnFamilies = new ConcurrentHashMap<>();
    private int defaultColumnCount;
    private RequestParser requestParser;

    CassandraClient(
            List<NodeDescriptor> servers,
            TransportFactory transportFactory,
            Random random,
            RetryPolicy retryPolicy,
            Sleeper sleeper,
            Duration schemaCacheTtl,
            boolean autopack,
            int defaultColumnCount) {
        this.pool = new ConnectionPool(transportFactory, random);
        servers.forEach(pool::registerServer);
        this.dispatcher = new CallDispatcher(pool, retryPolicy, sleeper);
        this.schemaCache = new SchemaCache(this::describeKeyspace, schemaCacheTtl);
        this.schemaProvider = new KeyspaceSchemaProvider(schemaCache, pool::getCurrentKeyspace);
        this.codec = DataTypeCodec.getInstance();
        this.autopack = autopack;
        this.defaultColumnCount = defaultColumnCount;
        this.requestParser = new RequestParser(defaultColumnCount);
    }

    public static CassandraClientBuilder builder() {
        return new CassandraClientBuilder();
    }

    /**
     * Registers credentials used whenever the keyspace gets selected.
     *
     * @param keyspace the keyspace name
     * @param username the username
     * @param password the password
     * @return this client
     */
    public CassandraClient registerKeyspace(String keyspace, String username, String password) {
        registeredKeyspaces.put(keyspace, new KeyspaceContext(keyspace, username, password));
        return this;
    }

    /**
     * Selects the active keyspace, logging in with registered credentials if there are any.
     *
     * @param keyspace the keyspace name
     * @return this client
     */
    public CassandraClient useKeyspace(String keyspace) {
        KeyspaceContext context = registeredKeyspaces.get(keyspace);
        return useKeyspace(context == null ? KeyspaceContext.of(keyspace) : context);
    }

    /**
     * Selects the active keyspace with explicit credentials, which are registered for later use.
     *
     * @param keyspace the keyspace name
     * @param username the username, blank for none
     * @param password the password
     * @return this client
     */
    public CassandraClient useKeyspace(String keyspace, String username, String password) {
        if (StringUtils.isEmpty(username)) {
            return useKeyspace(keyspace);
        }
        registerKeyspace(keyspace, username, password);
        return useKeyspace(registeredKeyspaces.get(keyspace));
    }

    private CassandraClient useKeyspace(KeyspaceContext context) {
        log.debug("Selecting keyspace {}", context);
        pool.useKeyspace(context);
        columnFamilies.clear();
        return this;
    }

    public Optional<String> getCurrentKeyspace() {
        return pool.getCurrentKeyspace();
    }

    public ConnectionPool getPool() {
        return pool;
    }

    public Connection getConnection() {
        return pool.getConnection();
    }

    public void closeConnections() {
        pool.closeConnections();
    }

    /**
     * Invokes a raw Thrift operation with retries.
     *
     * @param operation the operation name, see {@link Operations}
     * @param args      the operation arguments
     * @param <T>       the result type
     * @return the operation result
     */
    public <T> T call(String operation, Object... args) {
        return dispatcher.call(operation, args);
    }

    public CallDispatcher getDispatcher() {
        return dispatcher;
    }

    public void setMaxCallRetries(int maxCallRetries) {
        dispatcher.setMaxCallRetries(maxCallRetries);
    }

    public int getMaxCallRetries() {
        return dispatcher.getMaxCallRetries();
    }

    public int getDefaultColumnCount() {
        return defaultColumnCount;
    }

    public void setDefaultColumnCount(int defaultColumnCount) {
        if (defaultColumnCount <= 0) {
            throw new CpclInvalidArgumentException("Default column count must be positive");
        }
        this.defaultColumnCount = defaultColumnCount;
        this.requestParser = new RequestParser(defaultColumnCount);
        columnFamilies.clear();
    }

    public boolean isAutopack() {
        return autopack;
    }

    public Codec getCodec() {
        return codec;
    }

    public String getVersion() {
        return dispatcher.call(Operations.DESCRIBE_VERSION);
    }

    public KsDef describeKeyspace() {
        return describeKeyspace(requireKeyspace("describe_keyspace"));
    }

    public KsDef describeKeyspace(String keyspace) {
        return dispatcher.call(Operations.DESCRIBE_KEYSPACE, keyspace);
    }

    public KeyspaceSchema getKeyspaceSchema() {
        return getKeyspaceSchema(requireKeyspace("describe_keyspace"), true);
    }

    /**
     * Returns the schema of a keyspace.
     *
     * @param keyspace the keyspace name
     * @param useCache whether a cached schema may be returned
     * @return the schema
     */
    public KeyspaceSchema getKeyspaceSchema(String keyspace, boolean useCache) {
        return schemaCache.get(keyspace, useCache);
    }

    public SchemaProvider getSchemaProvider() {
        return schemaProvider;
    }

    /**
     * Returns the column family of the active keyspace with the given name. Instances are reused
     * until the keyspace changes.
     *
     * @param name the column family name
     * @return the column family
     */
    public ColumnFamily cf(String name) {
        if (StringUtils.isBlank(name)) {
            throw new CpclInvalidArgumentException("Column family name cannot be blank");
        }
        return columnFamilies.computeIfAbsent(name, cfName ->
                new ColumnFamily(cfName, dispatcher, schemaProvider, codec, autopack, defaultColumnCount));
    }

    public RequestParser getRequestParser() {
        return requestParser;
    }

    /**
     * Reads the row a request string describes.
     *
     * @param request the request, e.g. {@code user.john:email,age} or {@code user.john:a-z|10R}
     * @return the row, empty if nothing was found
     * @throws CpclInvalidPatternException if the request is malformed
     */
    public Optional<Row> get(String request) {
        return get(request, ConsistencyLevel.ONE);
    }

    public Optional<Row> get(String request, ConsistencyLevel consistency) {
        ParsedRequest parsed = requestParser.parse(request);
        return cf(parsed.columnFamily()).get(parsed.key(), parsed.toSlice(), parsed.superColumn(), consistency);
    }

    /**
     * Writes columns to the row a {@code family.key} string names.
     *
     * @param request the column family and row key, e.g. {@code user.john}
     * @param columns the columns to write, nested maps for super column families
     */
    public void set(String request, Map<?, ?> columns) {
        set(request, columns, ConsistencyLevel.ONE);
    }

    public void set(String request, Map<?, ?> columns, ConsistencyLevel consistency) {
        int separator = RequestParser.indexOfUnescapedDot(request);
        if (separator <= 0 || separator == request.length() - 1) {
            throw new CpclInvalidPatternException(
                    "Invalid set request \"" + request + "\" provided, expected family.key", request);
        }
        String family = RequestParser.unescape(request.substring(0, separator));
        String key = RequestParser.unescape(request.substring(separator + 1));
        cf(family).set(key, columns, consistency, null, null);
    }

    /**
     * Creates a keyspace with the simple placement strategy.
     *
     * @param name              the keyspace name
     * @param replicationFactor the replication factor
     * @return the new schema version
     */
    public String createKeyspace(String name, int replicationFactor) {
        return createKeyspace(name, replicationFactor, PlacementStrategy.SIMPLE, Map.of());
    }

    public String createKeyspace(
            String name, int replicationFactor, PlacementStrategy strategy, Map<String, String> strategyOptions) {
        String version = dispatcher.call(
                Operations.SYSTEM_ADD_KEYSPACE, keyspaceDefinition(name, replicationFactor, strategy, strategyOptions));
        log.info("Created keyspace {}", name);
        schemaCache.invalidate(name);
        return version;
    }

    public String updateKeyspace(
            String name, int replicationFactor, PlacementStrategy strategy, Map<String, String> strategyOptions) {
        String version = dispatcher.call(
                Operations.SYSTEM_UPDATE_KEYSPACE,
                keyspaceDefinition(name, replicationFactor, strategy, strategyOptions));
        log.info("Updated keyspace {}", name);
        schemaCache.invalidate(name);
        return version;
    }

    public String dropKeyspace(String name) {
        String version = dispatcher.call(Operations.SYSTEM_DROP_KEYSPACE, name);
        log.info("Dropped keyspace {}", name);
        schemaCache.invalidate(name);
        return version;
    }

    /**
     * Creates a column family. Without an explicit keyspace on the definition it goes to the
     * active keyspace.
     *
     * @param definition the column family definition
     * @return the new schema version
     */
    public String createColumnFamily(ColumnFamilyDefinition definition) {
        var cfDef = definition.toCfDef(getCurrentKeyspace().orElse(null));
        String version = dispatcher.call(Operations.SYSTEM_ADD_COLUMN_FAMILY, cfDef);
        log.info("Created column family {}.{}", cfDef.getKeyspace(), cfDef.getName());
        schemaCache.invalidate(cfDef.getKeyspace());
        return version;
    }

    public String createStandardColumnFamily(String keyspace, String name, List<ColumnDefinition> columns) {
        return createColumnFamily(ColumnFamilyDefinition.standard(name)
                .keyspace(keyspace)
                .comparatorType(DataType.UTF8)
                .defaultValidationType(DataType.UTF8)
                .columns(columns)
                .build());
    }

    public String createSuperColumnFamily(String keyspace, String name, List<ColumnDefinition> columns) {
        return createColumnFamily(ColumnFamilyDefinition.superColumnFamily(name)
                .keyspace(keyspace)
                .comparatorType(DataType.UTF8)
                .subcomparatorType(DataType.UTF8)
                .defaultValidationType(DataType.UTF8)
                .columns(columns)
                .build());
    }

    /**
     * Drops a column family of the active keyspace.
     *
     * @param name the column family name
     * @return the new schema version
     */
    public String dropColumnFamily(String name) {
        String keyspace = requireKeyspace(Operations.SYSTEM_DROP_COLUMN_FAMILY);
        String version = dispatcher.call(Operations.SYSTEM_DROP_COLUMN_FAMILY, name);
        log.info("Dropped column family {}.{}", keyspace, name);
        columnFamilies.remove(name);
        schemaCache.invalidate(keyspace);
        return version;
    }

    public void truncate(String columnFamily) {
        cf(columnFamily).truncate();
    }

    @Override
    public void close() {
        columnFamilies.clear();
        schemaCache.invalidateAll();
        pool.close();
    }

    private String requireKeyspace(String operation) {
        return getCurrentKeyspace().orElseThrow(() -> CpclInvalidRequestException.noKeyspace(operation));
    }

    private static KsDef keyspaceDefinition(
            String name, int replicationFactor, PlacementStrategy strategy, Map<String, String> strategyOptions) {
        if (StringUtils.isBlank(name)) {
            throw new CpclInvalidArgumentException("Keyspace name cannot be blank");
        }
        if (replicationFactor < 1) {
            throw new CpclInvalidArgumentException("Replication factor must be at least 1");
        }
        KsDef definition = new KsDef(name, strategy.getClassName(), new ArrayList<>());
        Map<String, String> options = new HashMap<>(strategyOptions);
        if (strategy.usesReplicationFactor()) {
            options.put("replication_factor", Integer.toString(replicationFactor));
        }
        definition.setStrategy_options(options);
        return definition;
    }
}
