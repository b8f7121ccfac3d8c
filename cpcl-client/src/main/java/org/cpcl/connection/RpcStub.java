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

/**
 * Invokes named RPC operations on one server session.
 *
 * <p>Every exception the server or the wire raises surfaces as a {@link TException}. Client-side
 * misuse, such as an unknown operation name, surfaces as an unchecked
 * {@link org.cpcl.exception.CpclException}.
 */
@FunctionalInterface
public interface RpcStub {

    /**
     * Invokes an operation.
     *
     * @param operation the RPC operation name, for example {@code get_slice}
     * @param args      the operation arguments in declaration order
     * @return the operation result, {@code null} for void operations
     * @throws TException if the server or the transport reports a failure
     */
    Object invoke(String operation, Object... args) throws TException;
}
