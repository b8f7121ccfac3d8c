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

package org.cpcl.dispatch;

import org.apache.thrift.TException;
import org.apache.thrift.protocol.TProtocolException;
import org.apache.thrift.transport.TTransportException;
import org.cpcl.config.RetryPolicy;
import org.cpcl.connection.Connection;
import org.cpcl.connection.ConnectionPool;
import org.cpcl.connection.Operations;
import org.cpcl.exception.CpclClientException;
import org.cpcl.exception.CpclException;
import org.cpcl.exception.CpclInvalidArgumentException;
import org.cpcl.exception.CpclInvalidRequestException;
import org.cpcl.exception.CpclMaxRetriesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;

/**
 * Executes named RPC operations with bounded retries.
 *
 * <p>Each attempt takes a connection from the pool and invokes the operation on its stub.
 * Anything the stub throws, other than a client-side {@link CpclException}, counts as a
 * transient failure and is followed by a backoff pause and another attempt. Transport and
 * protocol failures leave the socket out of step with the server, so that connection is closed
 * and the pool replaces it on the next attempt. A pool that
 * cannot produce a connection ends the call at once. Attempts never overlap.
 */
public class CallDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CallDispatcher.class);

    static final Set<String> KEYSPACE_REQUIRED = Set.of(
            Operations.LOGIN,
            Operations.GET,
            Operations.GET_SLICE,
            Operations.GET_COUNT,
            Operations.MULTIGET_SLICE,
            Operations.MULTIGET_COUNT,
            Operations.GET_INDEXED_SLICES,
            Operations.GET_RANGE_SLICES,
            Operations.INSERT,
            Operations.REMOVE,
            Operations.BATCH_MUTATE,
            Operations.TRUNCATE,
            Operations.DESCRIBE_SPLITS);

    private final ConnectionPool pool;
    private final Sleeper sleeper;
    private RetryPolicy retryPolicy;

    public CallDispatcher(ConnectionPool pool, RetryPolicy retryPolicy) {
        this(pool, retryPolicy, Sleeper.SYSTEM);
    }

    public CallDispatcher(ConnectionPool pool, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.pool = pool;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public static boolean requiresKeyspace(String operation) {
        return KEYSPACE_REQUIRED.contains(operation);
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public void setRetryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    /**
     * Sets how many attempts a call makes before giving up.
     *
     * @param maxCallRetries the attempt budget, at least 1
     */
    public void setMaxCallRetries(int maxCallRetries) {
        if (maxCallRetries < 1) {
            throw new CpclInvalidArgumentException("Max call retries must be at least 1, got " + maxCallRetries);
        }
        this.retryPolicy = retryPolicy.withMaxAttempts(maxCallRetries);
    }

    public int getMaxCallRetries() {
        return retryPolicy.getMaxAttempts();
    }

    /**
     * Calls an RPC operation.
     *
     * @param operation the operation name
     * @param args      the operation arguments
     * @param <T>       the expected result type
     * @return the operation result
     * @throws CpclInvalidRequestException if the operation needs a keyspace and none is active
     * @throws CpclMaxRetriesException     if every attempt failed
     */
    @SuppressWarnings("unchecked")
    public <T> T call(String operation, Object... args) {
        if (requiresKeyspace(operation) && pool.getCurrentKeyspace().isEmpty()) {
            throw CpclInvalidRequestException.noKeyspace(operation);
        }

        int maxAttempts = retryPolicy.getMaxAttempts();
        Throwable lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            CallResult result = attempt(operation, args);
            switch (result.kind()) {
                case OK -> {
                    return (T) result.value();
                }
                case FATAL_FAILURE -> throw result.fatal();
                case TRANSIENT_FAILURE -> {
                    lastFailure = result.failure();
                    log.warn("Calling {} failed (attempt {} of {}): {}",
                            operation, attempt, maxAttempts, lastFailure.toString());
                    if (attempt < maxAttempts) {
                        pause(operation, retryPolicy.delayAfter(attempt));
                    }
                }
            }
        }

        throw new CpclMaxRetriesException(operation, maxAttempts, lastFailure);
    }

    CallResult attempt(String operation, Object[] args) {
        Connection connection;
        try {
            connection = pool.getConnection();
        } catch (CpclException e) {
            return CallResult.fatalFailure(e);
        }

        try {
            return CallResult.ok(connection.getClient().invoke(operation, args));
        } catch (CpclException e) {
            return CallResult.fatalFailure(e);
        } catch (TException | RuntimeException e) {
            if (e instanceof TTransportException || e instanceof TProtocolException) {
                log.debug("Discarding connection to {} after {}", connection.getNode(), e.toString());
                connection.close();
            }
            return CallResult.transientFailure(e);
        }
    }

    private void pause(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CpclClientException("Interrupted while retrying \"" + operation + "\"", e);
        }
    }
}
