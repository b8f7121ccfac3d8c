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

/**
 * One entry of the {@code servers} list of a cluster configuration file.
 *
 * <p>Every field is optional; missing values fall back to {@code 127.0.0.1:9160} with framed
 * transport and no timeouts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(
        String host, Integer port, Boolean useFramedTransport, Integer sendTimeoutMs, Integer receiveTimeoutMs) {

    public NodeDescriptor toNodeDescriptor() {
        return new NodeDescriptor(
                host == null ? NodeDescriptor.DEFAULT_HOST : host,
                port == null ? NodeDescriptor.DEFAULT_PORT : port,
                useFramedTransport == null || useFramedTransport,
                sendTimeoutMs,
                receiveTimeoutMs);
    }
}
