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

/**
 * Names of the RPC operations of the Cassandra Thrift interface used by the client.
 */
public final class Operations {

    public static final String LOGIN = "login";
    public static final String SET_KEYSPACE = "set_keyspace";
    public static final String GET = "get";
    public static final String GET_SLICE = "get_slice";
    public static final String GET_COUNT = "get_count";
    public static final String MULTIGET_SLICE = "multiget_slice";
    public static final String MULTIGET_COUNT = "multiget_count";
    public static final String GET_RANGE_SLICES = "get_range_slices";
    public static final String GET_INDEXED_SLICES = "get_indexed_slices";
    public static final String INSERT = "insert";
    public static final String REMOVE = "remove";
    public static final String BATCH_MUTATE = "batch_mutate";
    public static final String TRUNCATE = "truncate";
    public static final String DESCRIBE_SPLITS = "describe_splits";
    public static final String DESCRIBE_KEYSPACE = "describe_keyspace";
    public static final String DESCRIBE_KEYSPACES = "describe_keyspaces";
    public static final String DESCRIBE_VERSION = "describe_version";
    public static final String DESCRIBE_CLUSTER_NAME = "describe_cluster_name";
    public static final String SYSTEM_ADD_KEYSPACE = "system_add_keyspace";
    public static final String SYSTEM_UPDATE_KEYSPACE = "system_update_keyspace";
    public static final String SYSTEM_DROP_KEYSPACE = "system_drop_keyspace";
    public static final String SYSTEM_ADD_COLUMN_FAMILY = "system_add_column_family";
    public static final String SYSTEM_DROP_COLUMN_FAMILY = "system_drop_column_family";

    private Operations() {}
}
