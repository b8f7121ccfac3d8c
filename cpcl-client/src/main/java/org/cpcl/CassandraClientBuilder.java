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

import org.apache.commons.lang3.StringUtils;
import org.cpcl.config.ClusterConfig;
import org.cpcl.config.RetryPolicy;
import org.cpcl.connection.NodeDescriptor;
import org.cpcl.connection.ThriftTransportFactory;
import org.cpcl.connection.TransportFactory;
import org.cpcl.dispatch.Sleeper;
import org.cpcl.exception.CpclInvalidArgumentException;
import org.cpcl.model.ColumnSlice;
import org.cpcl.schema.SchemaCache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Builder for creating configured {@link CassandraClient} instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Basic usage, keyspace selected explicitly
 * var client = CassandraClient.builder()
 *     .server("127.0.0.1", 9160)
 *     .build();
 * client.useKeyspace("Shop");
 *
 * // Keyspace with credentials, selected while building
 * var client = CassandraClient.builder()
 *     .server(new NodeDescriptor("10.0.0.1", 9160, true, 1000, 5000))
 *     .credentials("Shop", "shop", "secret")
 *     .keyspace("Shop")
 *     .buildAndConnect();
 *
 * // From a configuration file
 * var client = CassandraClient.builder()
 *     .fromConfig(ClusterConfig.load(Path.of("cluster.json")))
 *     .buildAndConnect();
 * }</pre>
 *
 * @see CassandraClient#builder()
 */
public final class CassandraClientBuilder {

    private final List<NodeDescriptor> servers = new ArrayList<>();
    private final Map<String, String[]> credentials = new LinkedHashMap<>();
    private RetryPolicy retryPolicy = RetryPolicy.exponentialBackoff();
    private Integer maxCallRetries;
    private int defaultColumnCount = ColumnSlice.DEFAULT_COUNT;
    private Duration schemaCacheTtl = SchemaCache.DEFAULT_TTL;
    private boolean autopack = true;
    private String keyspace;
    private TransportFactory transportFactory = new ThriftTransportFactory();
    private Random random = new Random();
    private Sleeper sleeper = Sleeper.SYSTEM;

    CassandraClientBuilder() {}

    /**
     * Adds a server with framed transport and no timeouts.
     *
     * @param host the host address
     * @param port the Thrift port
     * @return this builder
     */
    public CassandraClientBuilder server(String host, int port) {
        return server(NodeDescriptor.of(host, port));
    }

    public CassandraClientBuilder server(NodeDescriptor node) {
        this.servers.add(node);
        return this;
    }

    public CassandraClientBuilder servers(List<NodeDescriptor> nodes) {
        this.servers.addAll(nodes);
        return this;
    }

    /**
     * Sets the retry policy of RPC calls.
     *
     * @param retryPolicy the retry policy to use
     * @return this builder
     */
    public CassandraClientBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
    }

    /**
     * Overrides the number of attempts of the retry policy.
     *
     * @param maxCallRetries attempts per call
     * @return this builder
     */
    public CassandraClientBuilder maxCallRetries(int maxCallRetries) {
        this.maxCallRetries = maxCallRetries;
        return this;
    }

    public CassandraClientBuilder defaultColumnCount(int defaultColumnCount) {
        this.defaultColumnCount = defaultColumnCount;
        return this;
    }

    public CassandraClientBuilder schemaCacheTtl(Duration schemaCacheTtl) {
        this.schemaCacheTtl = schemaCacheTtl;
        return this;
    }

    /**
     * Enables or disables packing and unpacking of column names and values.
     *
     * @param autopack whether to convert names and values using the schema
     * @return this builder
     */
    public CassandraClientBuilder autopack(boolean autopack) {
        this.autopack = autopack;
        return this;
    }

    /**
     * Sets the keyspace selected by {@link #buildAndConnect()}.
     *
     * @param keyspace the keyspace name
     * @return this builder
     */
    public CassandraClientBuilder keyspace(String keyspace) {
        this.keyspace = keyspace;
        return this;
    }

    /**
     * Registers login credentials for a keyspace.
     *
     * @param keyspace the keyspace name
     * @param username the username
     * @param password the password
     * @return this builder
     */
    public CassandraClientBuilder credentials(String keyspace, String username, String password) {
        this.credentials.put(keyspace, new String[] {username, password});
        return this;
    }

    public CassandraClientBuilder transportFactory(TransportFactory transportFactory) {
        this.transportFactory = transportFactory;
        return this;
    }

    public CassandraClientBuilder random(Random random) {
        this.random = random;
        return this;
    }

    public CassandraClientBuilder sleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }

    /**
     * Applies every setting present in a configuration.
     *
     * @param config the configuration
     * @return this builder
     */
    public CassandraClientBuilder fromConfig(ClusterConfig config) {
        servers(config.nodeDescriptors());
        config.defaultKeyspace().ifPresent(this::keyspace);
        if (config.maxCallRetries() != null) {
            maxCallRetries(config.maxCallRetries());
        }
        if (config.defaultColumnCount() != null) {
            defaultColumnCount(config.defaultColumnCount());
        }
        if (config.schemaCacheTtlSeconds() != null) {
            schemaCacheTtl(Duration.ofSeconds(config.schemaCacheTtlSeconds()));
        }
        if (config.autopack() != null) {
            autopack(config.autopack());
        }
        config.credentials().forEach((name, login) -> credentials(name, login.username(), login.password()));
        return this;
    }

    /**
     * Builds a client without connecting. The first call opens connections as needed.
     *
     * @return a new client
     * @throws CpclInvalidArgumentException if the configuration is invalid
     */
    public CassandraClient build() {
        if (servers.isEmpty()) {
            throw new CpclInvalidArgumentException("At least one server must be configured");
        }
        if (retryPolicy == null) {
            throw new CpclInvalidArgumentException("Retry policy cannot be null");
        }
        if (defaultColumnCount <= 0) {
            throw new CpclInvalidArgumentException("Default column count must be positive");
        }
        if (schemaCacheTtl == null || schemaCacheTtl.isNegative()) {
            throw new CpclInvalidArgumentException("Schema cache TTL cannot be negative");
        }
        RetryPolicy policy = maxCallRetries == null ? retryPolicy : retryPolicy.withMaxAttempts(maxCallRetries);

        CassandraClient client = new CassandraClient(
                servers, transportFactory, random, policy, sleeper, schemaCacheTtl, autopack, defaultColumnCount);
        credentials.forEach((name, login) -> client.registerKeyspace(name, login[0], login[1]));
        return client;
    }

    /**
     * Builds the client and selects the configured keyspace, which connects to one server.
     *
     * @return a new client with the keyspace active
     * @throws CpclInvalidArgumentException if no keyspace was configured
     */
    public CassandraClient buildAndConnect() {
        if (StringUtils.isBlank(keyspace)) {
            throw new CpclInvalidArgumentException(
                    "A keyspace must be provided to use buildAndConnect(). Use keyspace(name).");
        }
        CassandraClient client = build();
        client.useKeyspace(keyspace);
        return client;
    }
}
