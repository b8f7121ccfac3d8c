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

import org.apache.thrift.transport.TTransportException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Opens {@link FakeTransport}s sharing one stub. Hosts marked unreachable refuse to connect.
 */
public class FakeTransportFactory implements TransportFactory {

    private final FakeRpcStub stub;
    private final Set<String> unreachableHosts = new HashSet<>();
    private final List<NodeDescriptor> attempts = new ArrayList<>();
    private final List<FakeTransport> opened = new ArrayList<>();

    public FakeTransportFactory() {
        this(new FakeRpcStub());
    }

    public FakeTransportFactory(FakeRpcStub stub) {
        this.stub = stub;
    }

    public FakeTransportFactory unreachable(String host) {
        unreachableHosts.add(host);
        return this;
    }

    public FakeRpcStub stub() {
        return stub;
    }

    public List<NodeDescriptor> attempts() {
        return attempts;
    }

    public long attemptsTo(String host) {
        return attempts.stream().filter(node -> node.host().equals(host)).count();
    }

    public List<FakeTransport> opened() {
        return opened;
    }

    @Override
    public Transport open(NodeDescriptor node) throws TTransportException {
        attempts.add(node);
        if (unreachableHosts.contains(node.host())) {
            throw new TTransportException(TTransportException.NOT_OPEN, "Cannot connect to " + node);
        }
        FakeTransport transport = new FakeTransport(node, stub);
        opened.add(transport);
        return transport;
    }
}
