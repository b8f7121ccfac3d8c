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

package org.cpcl.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.cpcl.connection.NodeDescriptor;
import org.cpcl.exception.CpclInvalidArgumentException;
import tools.jackson.core.JacksonException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * File-based client configuration.
 *
 * <p>Example:
 * <pre>{@code
 * {
 *   "servers": [
 *     { "host": "10.0.0.1", "port": 9160, "use-framed-transport": true, "receive-timeout-ms": 2000 },
 *     { "host": "10.0.0.2" }
 *   ],
 *   "keyspace": "Shop",
 *   "max-call-retries": 5,
 *   "default-column-count": 100,
 *   "schema-cache-ttl-seconds": 3600,
 *   "credentials": { "Shop": { "username": "shop", "password": "secret" } }
 * }
 * }</pre>
 *
 * @see org.cpcl.CassandraClientBuilder#fromConfig(ClusterConfig)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterConfig(
        List<ServerConfig> servers,
        String keyspace,
        Integer maxCallRetries,
        Integer defaultColumnCount,
        Long schemaCacheTtlSeconds,
        Boolean autopack,
        Map<String, Credentials> credentials) {

    /**
     * Login data registered for one keyspace.
     *
     * @param username the user name
     * @param password the password
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Credentials(String username, String password) {}

    public ClusterConfig {
        servers = servers == null ? List.of() : List.copyOf(servers);
        credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
    }

    /**
     * Reads a configuration from a JSON file.
     *
     * @param path the file to read
     * @return the parsed configuration
     * @throws CpclInvalidArgumentException if the file cannot be read or is not valid
     */
    public static ClusterConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new CpclInvalidArgumentException("Unable to read cluster configuration " + path, e);
        }
    }

    /**
     * Reads a configuration from a JSON stream.
     *
     * @param in the stream to read, left open
     * @return the parsed configuration
     * @throws CpclInvalidArgumentException if the content is not a valid configuration
     */
    public static ClusterConfig read(InputStream in) {
        try {
            return ConfigMapperFactory.getInstance().readValue(in, ClusterConfig.class);
        } catch (JacksonException e) {
            throw new CpclInvalidArgumentException("Invalid cluster configuration: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a configuration from a JSON string.
     *
     * @param json the JSON document
     * @return the parsed configuration
     */
    public static ClusterConfig parse(String json) {
        try {
            return ConfigMapperFactory.getInstance().readValue(json, ClusterConfig.class);
        } catch (JacksonException e) {
            throw new CpclInvalidArgumentException("Invalid cluster configuration: " + e.getOriginalMessage(), e);
        }
    }

    public List<NodeDescriptor> nodeDescriptors() {
        return servers.stream().map(ServerConfig::toNodeDescriptor).toList();
    }

    public Optional<String> defaultKeyspace() {
        return Optional.ofNullable(keyspace);
    }
}
