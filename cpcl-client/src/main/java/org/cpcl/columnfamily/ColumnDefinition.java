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

package org.cpcl.columnfamily;

import org.apache.cassandra.thrift.ColumnDef;
import org.apache.cassandra.thrift.IndexType;
import org.cpcl.codec.DataType;
import org.cpcl.codec.DataTypeCodec;

/**
 * Declares the value type and optional secondary index of one column.
 *
 * @param name       the column name
 * @param valueType  the validation type of its values
 * @param indexType  the index type, {@code null} for an unindexed column
 * @param indexName  the index name, {@code null} to let the server choose
 */
public record ColumnDefinition(Object name, DataType valueType, IndexType indexType, String indexName) {

    public static ColumnDefinition of(Object name, DataType valueType) {
        return new ColumnDefinition(name, valueType, null, null);
    }

    public static ColumnDefinition indexed(Object name, DataType valueType) {
        return new ColumnDefinition(name, valueType, IndexType.KEYS, null);
    }

    public static ColumnDefinition indexed(Object name, DataType valueType, String indexName) {
        return new ColumnDefinition(name, valueType, IndexType.KEYS, indexName);
    }

    ColumnDef toColumnDef(DataType nameType) {
        ColumnDef definition = new ColumnDef(
                DataTypeCodec.getInstance().pack(name, nameType), valueType.getClassName());
        if (indexType != null) {
            definition.setIndex_type(indexType);
        }
        if (indexName != null) {
            definition.setIndex_name(indexName);
        }
        return definition;
    }
}
