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

import org.cpcl.codec.DataType;
import org.cpcl.codec.DataTypeCodec;

/**
 * Answers type questions about the column families of the active keyspace.
 */
public interface SchemaProvider {

    /**
     * Returns the schema of a column family.
     *
     * @param columnFamily the column family name
     * @param useCache     whether a cached keyspace schema may be used
     * @return the schema
     * @throws org.cpcl.exception.CpclColumnFamilyNotFoundException if the keyspace has no such column family
     */
    ColumnFamilySchema getColumnFamilySchema(String columnFamily, boolean useCache);

    default ColumnFamilySchema getColumnFamilySchema(String columnFamily) {
        return getColumnFamilySchema(columnFamily, true);
    }

    default DataType getColumnNameType(String columnFamily) {
        return getColumnFamilySchema(columnFamily).nameType();
    }

    /**
     * Returns the validation type of a column's values, {@code BytesType} unless the schema
     * says otherwise.
     *
     * @param columnFamily the column family name
     * @param columnName   the column name, unpacked
     * @return the value type
     */
    default DataType getColumnValueType(String columnFamily, Object columnName) {
        ColumnFamilySchema schema = getColumnFamilySchema(columnFamily);
        return schema.valueType(DataTypeCodec.getInstance().pack(columnName, schema.valueColumnNameType()));
    }
}
