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
import org.apache.thrift.TException;
import org.cpcl.exception.CpclClientException;
import org.cpcl.exception.CpclInvalidRequestException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;

/**
 * Dispatches operation names onto the generated {@link Cassandra.Iface} methods.
 */
public final class ThriftRpcStub implements RpcStub {

    private static final Map<String, Method> OPERATIONS = new HashMap<>();

    static {
        for (Method method : Cassandra.Iface.class.getMethods()) {
            OPERATIONS.put(method.getName(), method);
        }
    }

    private final Cassandra.Iface client;

    public ThriftRpcStub(Cassandra.Iface client) {
        this.client = client;
    }

    @Override
    public Object invoke(String operation, Object... args) throws TException {
        Method method = OPERATIONS.get(operation);
        if (method == null) {
            throw new CpclInvalidRequestException("Unknown operation \"" + operation + "\"");
        }
        if (method.getParameterCount() != args.length) {
            throw new CpclInvalidRequestException("Operation \"" + operation + "\" expects "
                    + method.getParameterCount() + " arguments, got " + args.length);
        }
        try {
            return method.invoke(client, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TException) {
                throw (TException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CpclClientException("Operation \"" + operation + "\" failed", cause);
        } catch (IllegalArgumentException e) {
            throw new CpclInvalidRequestException("Invalid arguments for operation \"" + operation + "\"", e);
        } catch (IllegalAccessException e) {
            throw new CpclClientException("Operation \"" + operation + "\" is not accessible", e);
        }
    }
}
