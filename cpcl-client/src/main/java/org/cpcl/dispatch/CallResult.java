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

import org.cpcl.exception.CpclException;

/**
 * Outcome of a single RPC attempt.
 *
 * <p>{@link Kind#OK} carries the RPC result, {@link Kind#TRANSIENT_FAILURE} a failure worth
 * another attempt and {@link Kind#FATAL_FAILURE} a client-side error that no retry can fix.
 *
 * @param kind    the outcome
 * @param value   the RPC result, only for {@code OK}
 * @param failure the failure, only for the failure kinds
 */
public record CallResult(Kind kind, Object value, Throwable failure) {

    public enum Kind {
        OK,
        TRANSIENT_FAILURE,
        FATAL_FAILURE
    }

    public static CallResult ok(Object value) {
        return new CallResult(Kind.OK, value, null);
    }

    public static CallResult transientFailure(Throwable cause) {
        return new CallResult(Kind.TRANSIENT_FAILURE, null, cause);
    }

    public static CallResult fatalFailure(CpclException cause) {
        return new CallResult(Kind.FATAL_FAILURE, null, cause);
    }

    CpclException fatal() {
        return (CpclException) failure;
    }
}
