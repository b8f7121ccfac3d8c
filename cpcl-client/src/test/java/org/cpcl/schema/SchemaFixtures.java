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

package org.cpcl.schema;

import org.apache.cassandra.thrift.CfDef;
import org.apache.cassandra.thrift.ColumnDef;
import org.apache.cassandra.thrift.IndexType;
import org.apache.cassandra.thrift.KsDef;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyspace definitions as a server would describe them.
 */
public final class SchemaFixtures {

    public static final String MARSHAL = "org.apache.cassandra.db.marshal.";

    private SchemaFixtures() {}

    /** Standard column family with UTF-8 names and values; {@code age} is a long, {@code city} is indexed. */
    public static CfDef users() {
        CfDef users = new CfDef("Shop", "users");
        users.setColumn_type("Standard");
        users.setComparator_type(MARSHAL + "UTF8Type");
        users.setDefault_validation_class(MARSHAL + "UTF8Type");
        users.setColumn_metadata(List.of(
                new ColumnDef(utf8("age"), MARSHAL + "LongType"),
                new ColumnDef(utf8("city"), MARSHAL + "UTF8Type").setIndex_type(IndexType.KEYS)));
        return users;
    }

    /** Super column family keyed by UTF-8 names; sub column {@code visits} is a long. */
    public static CfDef events() {
        CfDef events = new CfDef("Shop", "events");
        events.setColumn_type("Super");
        events.setComparator_type(MARSHAL + "UTF8Type");
        events.setSubcomparator_type(MARSHAL + "UTF8Type");
        events.setDefault_validation_class(MARSHAL + "UTF8Type");
        events.setColumn_metadata(List.of(new ColumnDef(utf8("visits"), MARSHAL + "LongType")));
        return events;
    }

    public static KsDef shop() {
        KsDef shop = new KsDef("Shop", "org.apache.cassandra.locator.SimpleStrategy", List.of(users(), events()));
        Map<String, String> options = new HashMap<>();
        options.put("replication_factor", "3");
        shop.setStrategy_options(options);
        return shop;
    }

    public static ByteBuffer utf8(String value) {
        return ByteBuffer.wrap(value.getBytes(StandardCharsets.UTF_8));
    }
}
