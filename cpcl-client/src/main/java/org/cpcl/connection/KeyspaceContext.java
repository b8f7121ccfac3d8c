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

import org.apache.commons.lang3.StringUtils;
import org.cpcl.exception.CpclInvalidArgumentException;

/**
 * The keyspace every connection of a pool works in, with optional login credentials.
 *
 * @param keyspace the keyspace name
 * @param username the user name, {@code null} for anonymous access
 * @param password the password, {@code null} for anonymous access
 */
public record KeyspaceContext(String keyspace, String username, String password) {

    public KeyspaceContext {
        if (StringUtils.isBlank(keyspace)) {
            throw new CpclInvalidArgumentException("Keyspace cannot be null or empty");
        }
    }

    public static KeyspaceContext of(String keyspace) {
        return new KeyspaceContext(keyspace, null, null);
    }

    public boolean hasCredentials() {
        return StringUtils.isNotEmpty(username);
    }

    @Override
    public String toString() {
        return "KeyspaceContext{keyspace=" + keyspace + ", username=" + username + '}';
    }
}
