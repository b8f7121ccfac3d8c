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

package org.cpcl;

import org.apache.cassandra.thrift.AuthenticationRequest;
import org.apache.cassandra.thrift.CfDef;
import org.apache.cassandra.thrift.Column;
import org.apache.cassandra.thrift.ColumnOrSuperColumn;
import org.apache.cassandra.thrift.KsDef;
import org.apache.cassandra.thrift.Mutation;
import org.apache.cassandra.thrift.SlicePredicate;
import org.apache.cassandra.thrift.TimedOutException;
import org.cpcl.codec.DataType;
import org.cpcl.columnfamily.ColumnDefinition;
import org.cpcl.config.ClusterConfig;
import org.cpcl.connection.FakeRpcStub;
import org.cpcl.connection.FakeTransportFactory;
import org.cpcl.connection.NodeDescriptor;
import org.cpcl.connection.Operations;
import org.cpcl.exception.CpclInvalidArgumentException;
import org.cpcl.exception.CpclInvalidPatternException;
import org.cpcl.exception.CpclInvalidRequestException;
import org.cpcl.exception.CpclMaxRetriesException;
import org.cpcl.model.Row;
import org.cpcl.schema.PlacementStrategy;
import org.cpcl.schema.SchemaFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.cpcl.schema.SchemaFixtures.utf8;

class CassandraClientTest {

    private FakeTransportFactory factory;
    private FakeRpcStub stub;
    private CassandraClient client;

    @BeforeEach
    void setUp() {
        factory = new FakeTransportFactory();
        stub = factory.stub();
        stub.on(Operations.DESCRIBE_KEYSPACE, args -> SchemaFixtures.shop());
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    private CassandraClientBuilder builder() {
        return CassandraClient.builder()
                .server("10.0.0.1", 9160)
                .transportFactory(factory)
                .sleeper(delay -> {});
    }

    @Nested
    class Building {

        @Test
        void shouldRequireServer() {
            assertThatThrownBy(() -> CassandraClient.builder().build())
                    .isInstanceOf(CpclInvalidArgumentException.class)
                    .hasMessage("At least one server must be configured");
        }

        @Test
        void shouldRequireKeyspaceToConnect() {
            assertThatThrownBy(() -> builder().buildAndConnect())
                    .isInstanceOf(CpclInvalidArgumentException.class);
        }

        @Test
        void shouldNotConnectOnBuild() {
            // when
            client = builder().build();

            // then
            assertThat(factory.attempts()).isEmpty();
            assertThat(client.getCurrentKeyspace()).isEmpty();
        }

        @Test
        void shouldSelectKeyspaceOnConnect() {
            // when
            client = builder().keyspace("Shop").buildAndConnect();

            // then
            assertThat(client.getCurrentKeyspace()).contains("Shop");
            assertThat(stub.last(Operations.SET_KEYSPACE).args()).containsExactly("Shop");
        }

        @Test
        void shouldLoginWithRegisteredCredentials() {
            // when
            client = builder().credentials("Shop", "shop", "secret").keyspace("Shop").buildAndConnect();

            // then
            AuthenticationRequest request = stub.last(Operations.LOGIN).arg(0);
            assertThat(request.getCredentials()).containsEntry("username", "shop");
        }

        @Test
        void shouldApplyMaxCallRetries() {
            // given
            client = builder().maxCallRetries(2).build();
            stub.failing(Operations.DESCRIBE_VERSION, new TimedOutException());

            // when & then
            assertThatThrownBy(client::getVersion).isInstanceOf(CpclMaxRetriesException.class);
            assertThat(stub.count(Operations.DESCRIBE_VERSION)).isEqualTo(2);
            assertThat(client.getMaxCallRetries()).isEqualTo(2);
        }

        @Test
        void shouldBuildFromConfiguration() {
            // given
            ClusterConfig config = ClusterConfig.parse("{\"servers\": [{\"host\": \"10.0.0.9\"}],"
                    + " \"keyspace\": \"Shop\", \"default-column-count\": 25,"
                    + " \"credentials\": {\"Shop\": {\"username\": \"shop\", \"password\": \"secret\"}}}");

            // when
            client = CassandraClient.builder()
                    .fromConfig(config)
                    .transportFactory(factory)
                    .buildAndConnect();

            // then
            assertThat(factory.attempts()).extracting(NodeDescriptor::host).containsExactly("10.0.0.9");
            assertThat(client.getDefaultColumnCount()).isEqualTo(25);
            assertThat(stub.count(Operations.LOGIN)).isEqualTo(1);
        }
    }

    @Nested
    class Keyspaces {

        @Test
        void shouldRegisterCredentialsOfExplicitLogin() {
            // given
            client = builder().build();

            // when
            client.useKeyspace("Shop", "shop", "secret");
            client.useKeyspace("Other");
            client.useKeyspace("Shop");

            // then
            assertThat(stub.count(Operations.LOGIN)).isEqualTo(2);
            assertThat(client.getCurrentKeyspace()).contains("Shop");
        }

        @Test
        void shouldReuseColumnFamilyUntilKeyspaceChanges() {
            // given
            client = builder().keyspace("Shop").buildAndConnect();

            // when
            var first = client.cf("users");
            var second = client.cf("users");
            client.useKeyspace("Shop");
            var third = client.cf("users");

            // then
            assertThat(second).isSameAs(first);
            assertThat(third).isNotSameAs(first);
        }

        @Test
        void shouldReadSchemaOnceWhileCached() {
            // given
            client = builder().keyspace("Shop").buildAndConnect();

            // when
            client.getKeyspaceSchema();
            client.getKeyspaceSchema("Shop", true);
            client.getKeyspaceSchema("Shop", false);

            // then
            assertThat(stub.count(Operations.DESCRIBE_KEYSPACE)).isEqualTo(2);
        }

        @Test
        void shouldRequireKeyspaceForSchema() {
            // given
            client = builder().build();

            // when & then
            assertThatThrownBy(client::getKeyspaceSchema).isInstanceOf(CpclInvalidRequestException.class);
            assertThatThrownBy(() -> client.dropColumnFamily("users"))
                    .isInstanceOf(CpclInvalidRequestException.class);
            assertThat(stub.invocations()).isEmpty();
        }
    }

    @Nested
    class RequestStrings {

        @BeforeEach
        void connect() {
            client = builder().keyspace("Shop").buildAndConnect();
        }

        @Test
        void shouldReadListedColumns() {
            // given
            stub.returning(Operations.GET_SLICE, List.of());

            // when
            var row = client.get("users.john:email,age");

            // then
            assertThat(row).isEmpty();
            FakeRpcStub.Invocation call = stub.last(Operations.GET_SLICE);
            assertThat(call.<ByteBuffer>arg(0)).isEqualTo(utf8("john"));
            SlicePredicate predicate = call.arg(2);
            assertThat(predicate.getColumn_names()).containsExactly(utf8("email"), utf8("age"));
        }

        @Test
        void shouldReadReversedRange() {
            // given
            stub.returning(Operations.GET_SLICE, List.of());

            // when
            client.get("users.john:a-m|5R");

            // then
            SlicePredicate predicate = stub.last(Operations.GET_SLICE).arg(2);
            assertThat(predicate.getSlice_range().isReversed()).isTrue();
            assertThat(predicate.getSlice_range().getCount()).isEqualTo(5);
        }

        @Test
        void shouldWriteColumnsOfEscapedKey() {
            // when
            client.set("users.john\\.doe", Map.of("age", 34));

            // then
            Map<ByteBuffer, Map<String, List<Mutation>>> mutationMap = stub.last(Operations.BATCH_MUTATE).arg(0);
            assertThat(mutationMap).containsOnlyKeys(utf8("john.doe"));
            assertThat(mutationMap.get(utf8("john.doe"))).containsOnlyKeys("users");
        }

        @Test
        void shouldRejectSetWithoutKey() {
            assertThatThrownBy(() -> client.set("users", Map.of("age", 34)))
                    .isInstanceOf(CpclInvalidPatternException.class);
            assertThatThrownBy(() -> client.set("users.", Map.of("age", 34)))
                    .isInstanceOf(CpclInvalidPatternException.class);
        }

        @Test
        void shouldUseDefaultColumnCount() {
            // given
            stub.returning(Operations.GET_SLICE, List.of());
            client.setDefaultColumnCount(7);

            // when
            client.get("users.john");

            // then
            SlicePredicate predicate = stub.last(Operations.GET_SLICE).arg(2);
            assertThat(predicate.getSlice_range().getCount()).isEqualTo(7);
        }

        @Test
        void shouldReturnDecodedRow() {
            // given
            stub.returning(Operations.GET_SLICE, List.of(new ColumnOrSuperColumn()
                    .setColumn(new Column(utf8("email"))
                            .setValue(utf8("john@example.com"))
                            .setTimestamp(1L))));

            // when
            Row row = client.get("users.john:email").orElseThrow();

            // then
            assertThat(((Row.Columns) row).get("email")).isEqualTo("john@example.com");
        }
    }

    @Nested
    class Definitions {

        @BeforeEach
        void connect() {
            client = builder().keyspace("Shop").buildAndConnect();
        }

        @Test
        void shouldCreateSimpleKeyspace() {
            // when
            client.createKeyspace("Logs", 2);

            // then
            KsDef ksDef = stub.last(Operations.SYSTEM_ADD_KEYSPACE).arg(0);
            assertThat(ksDef.getName()).isEqualTo("Logs");
            assertThat(ksDef.getStrategy_class()).isEqualTo(PlacementStrategy.SIMPLE.getClassName());
            assertThat(ksDef.getStrategy_options()).containsEntry("replication_factor", "2");
            assertThat(ksDef.getCf_defs()).isEmpty();
        }

        @Test
        void shouldCreateNetworkTopologyKeyspaceWithoutReplicationFactor() {
            // when
            client.createKeyspace("Logs", 1, PlacementStrategy.NETWORK_TOPOLOGY, Map.of("DC1", "3"));

            // then
            KsDef ksDef = stub.last(Operations.SYSTEM_ADD_KEYSPACE).arg(0);
            assertThat(ksDef.getStrategy_options()).containsOnly(Map.entry("DC1", "3"));
        }

        @Test
        void shouldRejectInvalidReplicationFactor() {
            assertThatThrownBy(() -> client.createKeyspace("Logs", 0))
                    .isInstanceOf(CpclInvalidArgumentException.class);
            assertThat(stub.count(Operations.SYSTEM_ADD_KEYSPACE)).isZero();
        }

        @Test
        void shouldCreateColumnFamilyAndRefreshSchema() {
            // given
            client.getKeyspaceSchema();

            // when
            client.createStandardColumnFamily(
                    null, "orders", List.of(ColumnDefinition.indexed("status", DataType.UTF8)));
            client.getKeyspaceSchema();

            // then
            CfDef cfDef = stub.last(Operations.SYSTEM_ADD_COLUMN_FAMILY).arg(0);
            assertThat(cfDef.getKeyspace()).isEqualTo("Shop");
            assertThat(cfDef.getName()).isEqualTo("orders");
            assertThat(cfDef.getColumn_metadata()).hasSize(1);
            assertThat(stub.count(Operations.DESCRIBE_KEYSPACE)).isEqualTo(2);
        }

        @Test
        void shouldCreateSuperColumnFamily() {
            // when
            client.createSuperColumnFamily("Shop", "daily", List.of());

            // then
            CfDef cfDef = stub.last(Operations.SYSTEM_ADD_COLUMN_FAMILY).arg(0);
            assertThat(cfDef.getColumn_type()).isEqualTo("Super");
            assertThat(cfDef.getSubcomparator_type()).isEqualTo("UTF8Type");
        }

        @Test
        void shouldDropDefinitions() {
            // when
            client.dropColumnFamily("users");
            client.dropKeyspace("Logs");

            // then
            assertThat(stub.last(Operations.SYSTEM_DROP_COLUMN_FAMILY).args()).containsExactly("users");
            assertThat(stub.last(Operations.SYSTEM_DROP_KEYSPACE).args()).containsExactly("Logs");
        }

        @Test
        void shouldTruncateColumnFamily() {
            // when
            client.truncate("users");

            // then
            assertThat(stub.last(Operations.TRUNCATE).args()).containsExactly("users");
        }
    }
}
