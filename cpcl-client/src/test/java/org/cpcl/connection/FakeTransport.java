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

public class FakeTransport implements Transport {

    private final NodeDescriptor node;
    private final RpcStub stub;
    private boolean open = true;
    private boolean failFlush;
    private int closeCount;

    public FakeTransport(NodeDescriptor node, RpcStub stub) {
        this.node = node;
        this.stub = stub;
    }

    public NodeDescriptor node() {
        return node;
    }

    /** Simulates the server dropping the socket. */
    public void drop() {
        open = false;
    }

    public void failFlush() {
        failFlush = true;
    }

    public int closeCount() {
        return closeCount;
    }

    @Override
    public RpcStub client() {
        return stub;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void flush() throws TTransportException {
        if (failFlush) {
            throw new TTransportException(TTransportException.UNKNOWN, "Broken pipe");
        }
    }

    @Override
    public void close() {
        open = false;
        closeCount++;
    }
}
