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

import java.util.Optional;

/**
 * Address and transport settings of one backend node.
 *
 * @param host               the host name or address
 * @param port               the Thrift RPC port
 * @param useFramedTransport whether requests are framed
 * @param sendTimeoutMs      timeout for connecting and writing, {@code null} for none
 * @param receiveTimeoutMs   timeout for reading a response, {@code null} for none
 */
public record NodeDescriptor(
        String host, int port, boolean useFramedTransport, Integer sendTimeoutMs, Integer receiveTimeoutMs) {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 9160;

    public NodeDescriptor {
        if (StringUtils.isBlank(host)) {
            throw new CpclInvalidArgumentException("Host cannot be null or empty");
        }
        if (port <= 0 || port > 65535) {
            throw new CpclInvalidArgumentException("Port must be between 1 and 65535, got " + port);
        }
        if (sendTimeoutMs != null && sendTimeoutMs < 0) {
            throw new CpclInvalidArgumentException("Send timeout cannot be negative");
        }
        if (receiveTimeoutMs != null && receiveTimeoutMs < 0) {
            throw new CpclInvalidArgumentException("Receive timeout cannot be negative");
        }
    }

    public static NodeDescriptor of(String host, int port) {
        return new NodeDescriptor(host, port, true, null, null);
    }

    public static NodeDescriptor localhost() {
        return of(DEFAULT_HOST, DEFAULT_PORT);
    }

    public Optional<Integer> sendTimeout() {
        return Optional.ofNullable(sendTimeoutMs);
    }

    public Optional<Integer> receiveTimeout() {
        return Optional.ofNullable(receiveTimeoutMs);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
