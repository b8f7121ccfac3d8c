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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CpclExceptionTest {

    @Test
    void shouldDescribeConnectionFailures() {
        assertThat(CpclConnectionFailedException.emptyPool())
                .hasMessage("Unable to create connection, the cluster server pool is empty")
                .isInstanceOf(CpclClientException.class);
        assertThat(CpclConnectionFailedException.allNodesFailed(4))
                .hasMessage("Connecting to any of the 4 nodes failed");
        assertThat(new CpclConnectionClosedException()).hasMessage("The connection has been closed");
    }

    @Test
    void shouldDescribeMissingKeyspace() {
        assertThat(CpclInvalidRequestException.noKeyspace("batch_mutate"))
                .hasMessage("Unable to call \"batch_mutate\", no keyspace has been set");
    }

    @Test
    void shouldCarryRetryDetails() {
        // given
        TTransportException cause = new TTransportException(TTransportException.TIMED_OUT, "read timed out");

        // when
        CpclMaxRetriesException exception = new CpclMaxRetriesException("get_slice", 3, cause);

        // then
        assertThat(exception)
                .hasMessage("Failed calling \"get_slice\" the maximum of 3 times")
                .hasCause(cause);
        assertThat(exception.getOperation()).isEqualTo("get_slice");
        assertThat(exception.getAttempts()).isEqualTo(3);
        assertThat(exception.getErrorCode()).isEqualTo(TTransportException.TIMED_OUT);
    }

    @Test
    void shouldTakeErrorCodeFromThriftFailures() {
        assertThat(new CpclMaxRetriesException("get", 1, new TProtocolException(TProtocolException.BAD_VERSION))
                .getErrorCode()).isEqualTo(TProtocolException.BAD_VERSION);
        assertThat(new CpclMaxRetriesException("get", 1, new TApplicationException(TApplicationException.INTERNAL_ERROR))
                .getErrorCode()).isEqualTo(TApplicationException.INTERNAL_ERROR);
        assertThat(new CpclMaxRetriesException("get", 1, new IllegalStateException()).getErrorCode()).isZero();
    }

    @Test
    void shouldNameColumnFamilyAndKeyspace() {
        assertThat(new CpclColumnFamilyNotFoundException("Shop", "orders"))
                .hasMessage("Schema for column family \"orders\" not found in keyspace \"Shop\"");
        assertThat(new CpclKeyspaceSelectionException("Shop", 3, null))
                .hasMessage("Using keyspace \"Shop\" failed after 3 attempts");
        assertThat(new CpclInvalidPatternException("bad", "user").getPattern()).isEqualTo("user");
    }
}
