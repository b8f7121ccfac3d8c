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

package org.cpcl.connection;

import org.apache.thrift.TException;
import org.apache.thrift.transport.TTransportException;
import org.cpcl.exception.CpclAuthenticationException;
import org.cpcl.exception.CpclConnectionFailedException;
import org.cpcl.exception.CpclKeyspaceSelectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Keeps at most one live connection per registered server and hands out a random one.
 *
 * <p>Closed connections are evicted lazily, when a lookup finds them. Every new connection
 * is switched to the active keyspace before it is handed out. Not thread-safe.
 */
public class ConnectionPool implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final List<NodeDescriptor> servers = new ArrayList<>();
    private final Map<Integer, Connection> connections = new HashMap<>();
    private final TransportFactory transportFactory;
    private final Random random;
    private KeyspaceContext keyspaceContext;

    public ConnectionPool(TransportFactory transportFactory) {
        this(transportFactory, new Random());
    }

    public ConnectionPool(TransportFactory transportFactory, Random random) {
        this.transportFactory = transportFactory;
        this.random = random;
    }

    /**
     * Appends a server to the pool.
     *
     * @param node the server to add
     * @return this pool
     */
    public ConnectionPool registerServer(NodeDescriptor node) {
        servers.add(node);
        log.debug("Registered server {} at index {}", node, servers.size() - 1);
        return this;
    }

    public ConnectionPool registerServer(String host, int port) {
        return registerServer(NodeDescriptor.of(host, port));
    }

    public List<NodeDescriptor> getServers() {
        return Collections.unmodifiableList(servers);
    }

    /**
     * Stores the keyspace context and applies it to every open connection.
     *
     * <p>One connection is obtained eagerly, so a pool without live connections still verifies
     * the keyspace right away. A connection whose transport fails while switching is closed;
     * the next lookup evicts it.
     *
     * @param context the keyspace and credentials
     * @return this pool
     */
    public ConnectionPool useKeyspace(KeyspaceContext context) {
        this.keyspaceContext = context;
        List<Connection> existing = new ArrayList<>(connections.values());
        getConnection();

        for (Connection connection : existing) {
            if (!connection.isOpen()) {
                continue;
            }
            try {
                connection.useKeyspace(context);
            } catch (TTransportException e) {
                log.warn("Switching {} to keyspace {} failed, closing it: {}",
                        connection.getNode(), context.keyspace(), e.getMessage());
                connection.close();
            } catch (TException e) {
                log.warn("Switching {} to keyspace {} failed, closing it", connection.getNode(), context.keyspace(), e);
                connection.close();
            }
        }
        return this;
    }

    public Optional<KeyspaceContext> getKeyspaceContext() {
        return Optional.ofNullable(keyspaceContext);
    }

    public Optional<String> getCurrentKeyspace() {
        return getKeyspaceContext().map(KeyspaceContext::keyspace);
    }

    /**
     * Returns a live connection to a randomly chosen server.
     *
     * <p>Makes up to twice as many attempts as there are servers. A tracked connection that turned
     * out closed is evicted, which uses up the attempt. A server that fails to connect or to switch
     * keyspace at the transport level is skipped for this attempt.
     *
     * @return an open connection with the active keyspace applied
     * @throws CpclConnectionFailedException  if no servers are registered or all attempts failed
     * @throws CpclKeyspaceSelectionException if a server refuses to switch to the active keyspace
     * @throws CpclAuthenticationException    if a server rejects the active credentials
     */
    public Connection getConnection() {
        if (servers.isEmpty()) {
            throw CpclConnectionFailedException.emptyPool();
        }

        int serverCount = servers.size();
        TException lastFailure = null;

        for (int attempt = 0; attempt < serverCount * 2; attempt++) {
            int index = random.nextInt(serverCount);
            Connection tracked = connections.get(index);

            if (tracked != null) {
                if (tracked.isOpen()) {
                    return tracked;
                }
                log.debug("Evicting closed connection to {}", tracked.getNode());
                tracked.close();
                connections.remove(index);
                continue;
            }

            NodeDescriptor node = servers.get(index);
            Connection connection = null;
            try {
                connection = new Connection(node, transportFactory);
                if (keyspaceContext != null) {
                    connection.useKeyspace(keyspaceContext);
                }
                connections.put(index, connection);
                return connection;
            } catch (TException e) {
                lastFailure = e;
                log.warn("Connecting to {} failed: {}", node, e.getMessage());
                if (connection != null) {
                    connection.close();
                }
            } catch (RuntimeException e) {
                if (connection != null) {
                    connection.close();
                }
                throw e;
            }
        }

        CpclConnectionFailedException failure = CpclConnectionFailedException.allNodesFailed(serverCount);
        if (lastFailure != null) {
            failure.initCause(lastFailure);
        }
        throw failure;
    }

    int trackedConnections() {
        return connections.size();
    }

    /**
     * Closes every tracked connection and forgets it.
     */
    public void closeConnections() {
        for (Connection connection : connections.values()) {
            connection.close();
        }
        connections.clear();
    }

    @Override
    public void close() {
        closeConnections();
    }
}
