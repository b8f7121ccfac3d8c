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

package org.cpcl.exception;

import org.apache.thrift.TApplicationException;
import org.apache.thrift.protocol.TProtocolException;
import org.apache.thrift.transport.TTransportException;

/**
 * Exception thrown when an RPC call failed on every attempt of its retry budget.
 *
 * <p>The last failure is attached as the cause. Its numeric code is exposed through
 * {@link #getErrorCode()}: the Thrift exception type for transport, protocol and
 * application errors, {@code 0} for anything else.
 */
public class CpclMaxRetriesException extends CpclClientException {

    private final String operation;
    private final int attempts;
    private final int errorCode;

    public CpclMaxRetriesException(String operation, int attempts, Throwable cause) {
        super("Failed calling \"" + operation + "\" the maximum of " + attempts + " times", cause);
        this.operation = operation;
        this.attempts = attempts;
        this.errorCode = codeOf(cause);
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getErrorCode() {
        return errorCode;
    }

    static int codeOf(Throwable cause) {
        if (cause instanceof TTransportException) {
            return ((TTransportException) cause).getType();
        }
        if (cause instanceof TProtocolException) {
            return ((TProtocolException) cause).getType();
        }
        if (cause instanceof TApplicationException) {
            return ((TApplicationException) cause).getType();
        }
        return 0;
    }
}
