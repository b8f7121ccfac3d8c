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
import org.cpcl.codec.DataType;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;

/**
 * Type information of one column family.
 *
 * <p>For a super column family {@code nameType} is the type of the super column names and
 * {@code subNameType} the type of the column names inside them; for a standard column family
 * {@code subNameType} is {@code null}.
 *
 * @param name                the column family name
 * @param superColumnFamily   whether rows hold super columns
 * @param nameType            the comparator type
 * @param subNameType         the sub-comparator type of a super column family
 * @param defaultValueType    the default validation type of column values
 * @param columnValueTypes    validation types of individually declared columns, keyed by packed name
 */
public record ColumnFamilySchema(
        String name,
        boolean superColumnFamily,
        DataType nameType,
        DataType subNameType,
        DataType defaultValueType,
        Map<ByteBuffer, DataType> columnValueTypes) {

    static final String SUPER = "Super";

    public ColumnFamilySchema {
        columnValueTypes = Map.copyOf(columnValueTypes);
    }

    public static ColumnFamilySchema fromCfDef(CfDef definition) {
        boolean isSuper = SUPER.equals(definition.getColumn_type());
        Map<ByteBuffer, DataType> valueTypes = new HashMap<>();
        if (definition.getColumn_metadata() != null) {
            for (ColumnDef column : definition.getColumn_metadata()) {
                valueTypes.put(
                        ByteBuffer.wrap(column.getName()), DataType.fromClassName(column.getValidation_class()));
            }
        }
        return new ColumnFamilySchema(
                definition.getName(),
                isSuper,
                DataType.fromClassName(definition.getComparator_type()),
                isSuper ? DataType.fromClassName(definition.getSubcomparator_type()) : null,
                DataType.fromClassName(definition.getDefault_validation_class()),
                valueTypes);
    }

    /**
     * Returns the type of the names that carry values: sub-column names in a super column
     * family, column names otherwise.
     *
     * @return the value-bearing column name type
     */
    public DataType valueColumnNameType() {
        return superColumnFamily ? subNameType : nameType;
    }

    /**
     * Looks up the validation type of a column.
     *
     * @param packedName the column name as stored
     * @return the declared type, or the default validation type
     */
    public DataType valueType(ByteBuffer packedName) {
        return columnValueTypes.getOrDefault(packedName, defaultValueType);
    }
}
