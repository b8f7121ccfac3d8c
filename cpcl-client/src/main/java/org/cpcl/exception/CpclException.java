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

/**
 * Base exception class for all CPCL client exceptions.
 *
 * <p>This is the root of the CPCL exception hierarchy. Every exception thrown by the client
 * extends this class, so callers can catch all CPCL-related failures with a single catch block.
 * Checked Thrift exceptions never leave the connection layer without being wrapped in one of
 * the subclasses.
 */
public abstract class CpclException extends RuntimeException {

    /**
     * Constructs a new CpclException with the specified message.
     *
     * @param message the detail message
     */
    protected CpclException(String message) {
        super(message);
    }

    /**
     * Constructs a new CpclException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    protected CpclException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new CpclException with the specified cause.
     *
     * @param cause the cause of the exception
     */
    protected CpclException(Throwable cause) {
        super(cause);
    }
}
