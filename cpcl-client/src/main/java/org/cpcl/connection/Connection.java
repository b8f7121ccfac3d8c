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

import org.apache.cassandra.thrift.AuthenticationException;
import org.apache.cassandra.thrift.AuthenticationRequest;
import org.apache.cassandra.thrift.AuthorizationException;
import org.apache.cassandra.thrift.InvalidRequestException;
import org.apache.thrift.TException;
import org.apache.thrift.transport.TTransportException;
import org.cpcl.exception.CpclAuthenticationException;
import org.cpcl.exception.CpclConnectionClosedException;
import org.cpcl.exception.CpclKeyspaceSelectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.HashMap;
import java.util.Map;

/**
 * A single session to one node.
 *
 * <p>The transport is opened by the constructor; a connection that could be constructed is
 * open. Once closed, a connection stays closed and refuses to hand out its client.
 */
public class Connection implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    static final int KEYSPACE_SELECT_ATTEMPTS = 3;

    private final NodeDescriptor node;
    private final Transport transport;
    private boolean open;

    /**
     * Opens a connection to the given node.
     *
     * @param node             the node to connect to
     * @param transportFactory the factory creating the transport
     * @throws TTransportException if the node cannot be reached
     */
    public Connection(NodeDescriptor node, TransportFactory transportFactory) throws TTransportException {
        this.node = node;
        this.transport = transportFactory.open(node);
        this.open = true;
        log.debug("Connected to {}", node);
    }

    public NodeDescriptor getNode() {
        return node;
    }

    public Transport getTransport() {
        return transport;
    }

    public boolean isOpen() {
        return open && transport.isOpen();
    }

    /**
     * Returns the RPC stub of this connection.
     *
     * @return the stub
     * @throws CpclConnectionClosedException if the connection has been closed
     */
    public RpcStub getClient() {
        if (!open) {
            throw new CpclConnectionClosedException("Connection to " + node + " has been closed");
        }
        return transport.client();
    }

    /**
     * Switches this connection to a keyspace and logs in when the context carries credentials.
     *
     * <p>Selecting the keyspace is attempted up to three times when the server rejects it; the
     * login is attempted once.
     *
     * @param context the keyspace and credentials to apply
     * @throws CpclKeyspaceSelectionException if every selection attempt was rejected
     * @throws CpclAuthenticationException    if the server rejects the credentials
     * @throws TException                     on transport or protocol failures
     */
    public void useKeyspace(KeyspaceContext context) throws TException {
        RpcStub client = getClient();
        InvalidRequestException lastRejection = null;
        boolean selected = false;

        for (int attempt = 1; attempt <= KEYSPACE_SELECT_ATTEMPTS && !selected; attempt++) {
            try {
                client.invoke(Operations.SET_KEYSPACE, context.keyspace());
                selected = true;
            } catch (InvalidRequestException e) {
                lastRejection = e;
                log.debug("Selecting keyspace {} on {} rejected (attempt {}): {}",
                        context.keyspace(), node, attempt, e.getWhy());
            }
        }

        if (!selected) {
            throw new CpclKeyspaceSelectionException(context.keyspace(), KEYSPACE_SELECT_ATTEMPTS, lastRejection);
        }

        if (context.hasCredentials()) {
            Map<String, String> credentials = new HashMap<>();
            credentials.put("username", context.username());
            credentials.put("password", context.password());
            try {
                client.invoke(Operations.LOGIN, new AuthenticationRequest(credentials));
            } catch (AuthenticationException e) {
                throw new CpclAuthenticationException(
                        "Login as \"" + context.username() + "\" failed on " + node + ": " + e.getWhy(), e);
            } catch (AuthorizationException e) {
                throw new CpclAuthenticationException("User \"" + context.username()
                        + "\" is not authorized for keyspace \"" + context.keyspace() + "\": " + e.getWhy(), e);
            }
        }
    }

    /**
     * Flushes and closes the transport. Closing a closed connection does nothing.
     */
    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        try {
            transport.flush();
        } catch (TTransportException e) {
            log.debug("Flushing connection to {} before close failed: {}", node, e.getMessage());
        } finally {
            transport.close();
        }
        log.debug("Closed connection to {}", node);
    }

    @Override
    public String toString() {
        return "Connection{node=" + node + ", open=" + open + '}';
    }
}
