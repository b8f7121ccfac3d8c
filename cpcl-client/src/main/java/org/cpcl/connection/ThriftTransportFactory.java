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

import org.apache.cassandra.thrift.Cassandra;
import org.apache.thrift.protocol.TBinaryProtocol;
import org.apache.thrift.transport.TFramedTransport;
import org.apache.thrift.transport.TSocket;
import org.apache.thrift.transport.TTransport;
import org.apache.thrift.transport.TTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Opens Thrift binary-protocol sessions over TCP.
 *
 * <p>The send timeout bounds connection establishment and the receive timeout becomes the
 * socket read timeout. Framed nodes get a {@link TFramedTransport}; the others talk through
 * the buffered {@link TSocket} directly.
 */
public final class ThriftTransportFactory implements TransportFactory {

    private static final Logger log = LoggerFactory.getLogger(ThriftTransportFactory.class);

    @Override
    public Transport open(NodeDescriptor node) throws TTransportException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            if (node.receiveTimeoutMs() != null) {
                socket.setSoTimeout(node.receiveTimeoutMs());
            }
            socket.connect(
                    new InetSocketAddress(node.host(), node.port()),
                    node.sendTimeout().orElse(0));
        } catch (IOException e) {
            TTransportException failure =
                    new TTransportException(TTransportException.NOT_OPEN, "Cannot connect to " + node, e);
            try {
                socket.close();
            } catch (IOException closeError) {
                failure.addSuppressed(closeError);
            }
            throw failure;
        }

        TTransport transport = new TSocket(socket);
        if (node.useFramedTransport()) {
            transport = new TFramedTransport(transport);
        }
        log.debug("Opened {} transport to {}", node.useFramedTransport() ? "framed" : "buffered", node);

        Cassandra.Client client = new Cassandra.Client(new TBinaryProtocol(transport));
        return new ThriftTransport(transport, new ThriftRpcStub(client));
    }
}
