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

import org.apache.thrift.transport.TFramedTransport;
import org.apache.thrift.transport.TSocket;
import org.apache.thrift.transport.TTransportException;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThriftTransportFactoryTest {

    private final ThriftTransportFactory factory = new ThriftTransportFactory();

    @Test
    void shouldOpenFramedTransport() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            // given
            NodeDescriptor node = new NodeDescriptor("127.0.0.1", server.getLocalPort(), true, 1000, 1000);

            // when
            Transport transport = factory.open(node);

            // then
            assertThat(transport.isOpen()).isTrue();
            assertThat(((ThriftTransport) transport).underlying()).isInstanceOf(TFramedTransport.class);
            assertThat(transport.client()).isInstanceOf(ThriftRpcStub.class);
            transport.close();
            assertThat(transport.isOpen()).isFalse();
        }
    }

    @Test
    void shouldOpenBufferedTransport() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            // given
            NodeDescriptor node = new NodeDescriptor("127.0.0.1", server.getLocalPort(), false, null, null);

            // when
            Transport transport = factory.open(node);

            // then
            assertThat(((ThriftTransport) transport).underlying()).isInstanceOf(TSocket.class);
            transport.close();
        }
    }

    @Test
    void shouldFailWhenNothingListens() throws Exception {
        // given
        int port;
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }
        NodeDescriptor node = new NodeDescriptor("127.0.0.1", port, true, 500, null);

        // when & then
        assertThatThrownBy(() -> factory.open(node))
                .isInstanceOf(TTransportException.class)
                .hasMessage("Cannot connect to 127.0.0.1:" + port);
    }
}
