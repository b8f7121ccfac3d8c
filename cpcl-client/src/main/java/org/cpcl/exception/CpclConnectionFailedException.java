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
 * Exception thrown when no server of the pool could be reached.
 */
public class CpclConnectionFailedException extends CpclClientException {

    private static final String EMPTY_POOL_MESSAGE = "Unable to create connection, the cluster server pool is empty";

    /**
     * Constructs a new CpclConnectionFailedException for a pool without registered servers.
     *
     * @return the exception
     */
    public static CpclConnectionFailedException emptyPool() {
        return new CpclConnectionFailedException(EMPTY_POOL_MESSAGE);
    }

    /**
     * Constructs a new CpclConnectionFailedException after every connection attempt failed.
     *
     * @param serverCount the number of registered servers
     * @return the exception
     */
    public static CpclConnectionFailedException allNodesFailed(int serverCount) {
        return new CpclConnectionFailedException("Connecting to any of the " + serverCount + " nodes failed");
    }

    public CpclConnectionFailedException(String message) {
        super(message);
    }

    public CpclConnectionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
