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

import org.apache.cassandra.thrift.InvalidRequestException;
import org.apache.thrift.transport.TTransportException;
import org.cpcl.exception.CpclConnectionFailedException;
import org.cpcl.exception.CpclKeyspaceSelectionException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionPoolTest {

    @Test
    void shouldFailOnEmptyPool() {
        // given
        ConnectionPool pool = new ConnectionPool(new FakeTransportFactory());

        // when & then
        assertThatThrownBy(pool::getConnection)
                .isInstanceOf(CpclConnectionFailedException.class)
                .hasMessage("Unable to create connection, the cluster server pool is empty");
    }

    @Test
    void shouldMakeTwoAttemptsPerServerBeforeGivingUp() {
        // given
        FakeTransportFactory factory = new FakeTransportFactory()
                .unreachable("10.0.0.1")
                .unreachable("10.0.0.2")
                .unreachable("10.0.0.3");
        ConnectionPool pool = new ConnectionPool(factory, new Random(7))
                .registerServer("10.0.0.1", 9160)
                .registerServer("10.0.0.2", 9160)
                .registerServer("10.0.0.3", 9160);

        // when & then
        assertThatThrownBy(pool::getConnection)
                .isInstanceOf(CpclConnectionFailedException.class)
                .hasMessage("Connecting to any of the 3 nodes failed")
                .hasCauseInstanceOf(TTransportException.class);
        assertThat(factory.attempts()).hasSize(6);
    }

    @Test
    void shouldReuseOpenConnection() {
        // given
        FakeTransportFactory factory = new FakeTransportFactory();
        ConnectionPool pool = new ConnectionPool(factory).registerServer("10.0.0.1", 9160);

        // when
        Connection first = pool.getConnection();
        Connection second = pool.getConnection();

        // then
        assertThat(second).isSameAs(first);
        assertThat(factory.attempts()).hasSize(1);
        assertThat(pool.trackedConnections()).isEqualTo(1);
    }

    @Test
    void shouldEvictClosedConnectionAndReconnect() {
        // given
        FakeTransportFactory factory = new FakeTransportFactory();
        ConnectionPool pool = new ConnectionPool(factory).registerServer("10.0.0.1", 9160);
        Connection first = pool.getConnection();
        factory.opened().get(0).drop();

        // when
        Connection second = pool.getConnection();

        // then
        assertThat(second).isNotSameAs(first);
        assertThat(second.isOpen()).isTrue();
        assertThat(factory.attempts()).hasSize(2);
        assertThat(factory.opened().get(0).closeCount()).isEqualTo(1);
    }

    @Test
    void shouldSkipUnreachableServer() {
        // given
        FakeTransportFactory factory = new FakeTransportFactory().unreachable("10.0.0.1");
        ConnectionPool pool = new ConnectionPool(factory, new SequenceRandom(0, 1))
                .registerServer("10.0.0.1", 9160)
                .registerServer("10.0.0.2", 9160);

        // when
        Connection connection = pool.getConnection();

        // then
        assertThat(connection.getNode().host()).isEqualTo("10.0.0.2");
        assertThat(factory.attempts()).extracting(NodeDescriptor::host).containsExactly("10.0.0.1", "10.0.0.2");
    }

    @Test
    void shouldSelectBothServersOverManyTrials() {
        // given
        FakeTransportFactory factory = new FakeTransportFactory().unreachable("10.0.0.1");
        Random random = new Random(20240101L);
        int successes = 0;

        // when
        for (int trial = 0; trial < 1000; trial++) {
            ConnectionPool pool = new ConnectionPool(factory, random)
                    .registerServer("10.0.0.1", 9160)
                    .registerServer("10.0.0.2", 9160);
            try {
                pool.getConnection();
                successes++;
            } catch (CpclConnectionFailedException e) {
                assertThat(e).hasMessage("Connecting to any of the 2 nodes failed");
            }
        }

        // then
        assertThat(factory.attemptsTo("10.0.0.1")).isPositive();
        assertThat(factory.attemptsTo("10.0.0.2")).isPositive();
        assertThat(successes).isGreaterThan(900);
    }

    @Nested
    class Keyspaces {

        @Test
        void shouldApplyKeyspaceToNewConnections() {
            // given
            FakeTransportFactory factory = new FakeTransportFactory();
            ConnectionPool pool = new ConnectionPool(factory, new SequenceRandom(0, 1))
                    .registerServer("10.0.0.1", 9160)
                    .registerServer("10.0.0.2", 9160);

            // when
            pool.useKeyspace(KeyspaceContext.of("Shop"));
            Connection second = pool.getConnection();

            // then
            assertThat(second.getNode().host()).isEqualTo("10.0.0.2");
            assertThat(factory.stub().count(Operations.SET_KEYSPACE)).isEqualTo(2);
            assertThat(pool.getCurrentKeyspace()).contains("Shop");
        }

        @Test
        void shouldSwitchExistingConnections() {
            // given
            FakeTransportFactory factory = new FakeTransportFactory();
            ConnectionPool pool = new ConnectionPool(factory, new SequenceRandom(0, 1, 0))
                    .registerServer("10.0.0.1", 9160)
                    .registerServer("10.0.0.2", 9160);
            pool.getConnection();
            pool.getConnection();

            // when
            pool.useKeyspace(KeyspaceContext.of("Shop"));

            // then
            assertThat(factory.stub().invocations(Operations.SET_KEYSPACE)).hasSize(2);
            assertThat(pool.trackedConnections()).isEqualTo(2);
        }

        @Test
        void shouldCloseConnectionThatRefusesKeyspace() {
            // given
            FakeTransportFactory factory = new FakeTransportFactory();
            factory.stub().failing(Operations.SET_KEYSPACE, new InvalidRequestException("unknown keyspace"));
            ConnectionPool pool = new ConnectionPool(factory).registerServer("10.0.0.1", 9160);

            // when & then
            assertThatThrownBy(() -> pool.useKeyspace(KeyspaceContext.of("Nope")))
                    .isInstanceOf(CpclKeyspaceSelectionException.class);
            assertThat(factory.opened().get(0).closeCount()).isEqualTo(1);
            assertThat(pool.trackedConnections()).isZero();
        }

        @Test
        void shouldReportNoKeyspaceInitially() {
            // given
            ConnectionPool pool = new ConnectionPool(new FakeTransportFactory());

            // when & then
            assertThat(pool.getCurrentKeyspace()).isEmpty();
            assertThat(pool.getKeyspaceContext()).isEmpty();
        }
    }

    @Test
    void shouldCloseAllConnections() {
        // given
        FakeTransportFactory factory = new FakeTransportFactory();
        ConnectionPool pool = new ConnectionPool(factory, new SequenceRandom(0, 1))
                .registerServer("10.0.0.1", 9160)
                .registerServer("10.0.0.2", 9160);
        pool.getConnection();
        pool.getConnection();

        // when
        pool.close();

        // then
        assertThat(pool.trackedConnections()).isZero();
        assertThat(factory.opened()).allSatisfy(transport -> assertThat(transport.closeCount()).isEqualTo(1));
    }
}
