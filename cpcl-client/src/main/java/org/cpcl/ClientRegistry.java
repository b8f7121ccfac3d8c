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

import org.cpcl.exception.CpclInvalidArgumentException;
import org.cpcl.exception.CpclInvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide registry of named clients, so that code far from where a client was built can
 * look it up by name.
 */
public final class ClientRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClientRegistry.class);

    public static final String DEFAULT_NAME = "main";

    private static final Map<String, CassandraClient> CLIENTS = new LinkedHashMap<>();

    private ClientRegistry() {}

    /**
     * Registers a client under the default name, replacing any client registered there.
     *
     * @param client the client
     * @return the client
     */
    public static CassandraClient register(CassandraClient client) {
        return register(DEFAULT_NAME, client);
    }

    public static synchronized CassandraClient register(String name, CassandraClient client) {
        if (name == null || name.isEmpty()) {
            throw new CpclInvalidArgumentException("Client name cannot be empty");
        }
        if (client == null) {
            throw new CpclInvalidArgumentException("Client cannot be null");
        }
        CassandraClient previous = CLIENTS.put(name, client);
        if (previous != null && previous != client) {
            log.debug("Replaced client registered as {}", name);
        }
        return client;
    }

    public static CassandraClient get() {
        return get(DEFAULT_NAME);
    }

    /**
     * Looks up a registered client.
     *
     * @param name the name it was registered under
     * @return the client
     * @throws CpclInvalidRequestException if nothing is registered under the name
     */
    public static synchronized CassandraClient get(String name) {
        CassandraClient client = CLIENTS.get(name);
        if (client == null) {
            throw new CpclInvalidRequestException("No client registered as \"" + name + "\"");
        }
        return client;
    }

    public static synchronized boolean contains(String name) {
        return CLIENTS.containsKey(name);
    }

    public static synchronized Set<String> names() {
        return Set.copyOf(CLIENTS.keySet());
    }

    /**
     * Removes a client without closing it.
     *
     * @param name the name it was registered under
     * @return the removed client, {@code null} if there was none
     */
    public static synchronized CassandraClient remove(String name) {
        return CLIENTS.remove(name);
    }

    /**
     * Closes and removes every registered client.
     */
    public static void reset() {
        List<CassandraClient> clients;
        synchronized (ClientRegistry.class) {
            clients = new ArrayList<>(CLIENTS.values());
            CLIENTS.clear();
        }
        for (CassandraClient client : clients) {
            client.close();
        }
    }
}
