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
 * Exception thrown when a request violates a client-side precondition.
 *
 * <p>Such requests never reach the network and are never retried.
 */
public class CpclInvalidRequestException extends CpclClientException {

    /**
     * Constructs the exception raised for a keyspace-scoped operation without an active keyspace.
     *
     * @param operation the requested RPC operation
     * @return the exception
     */
    public static CpclInvalidRequestException noKeyspace(String operation) {
        return new CpclInvalidRequestException(
                "Unable to call \"" + operation + "\", no keyspace has been set");
    }

    public CpclInvalidRequestException(String message) {
        super(message);
    }

    public CpclInvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
