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

package org.cpcl.model;

import org.apache.cassandra.thrift.Column;
import org.apache.cassandra.thrift.ColumnOrSuperColumn;
import org.apache.cassandra.thrift.CounterColumn;
import org.apache.cassandra.thrift.CounterSuperColumn;
import org.apache.cassandra.thrift.KeySlice;
import org.apache.cassandra.thrift.SuperColumn;
import org.cpcl.codec.Codec;
import org.cpcl.codec.DataType;
import org.cpcl.schema.ColumnFamilySchema;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns slice responses into {@link Row}s.
 *
 * <p>Whether a row holds super columns is decided by the schema. With autopack enabled names and
 * values are unpacked with their schema types; otherwise they stay raw {@link ByteBuffer}s.
 */
public final class RowDecoder {

    private final ColumnFamilySchema schema;
    private final Codec codec;
    private final boolean autopack;

    public RowDecoder(ColumnFamilySchema schema, Codec codec, boolean autopack) {
        this.schema = schema;
        this.codec = codec;
        this.autopack = autopack;
    }

    /**
     * Decodes the columns of one row.
     *
     * @param columns             the slice response
     * @param withinSuperColumn   whether the slice was read from inside one super column
     * @return the row, empty when the response is
     */
    public Row decode(List<ColumnOrSuperColumn> columns, boolean withinSuperColumn) {
        if (schema.superColumnFamily() && !withinSuperColumn) {
            Map<Object, Map<Object, Object>> superColumns = new LinkedHashMap<>();
            for (ColumnOrSuperColumn item : columns) {
                if (item.isSetSuper_column()) {
                    SuperColumn superColumn = item.getSuper_column();
                    superColumns.put(
                            name(superColumn.bufferForName(), schema.nameType()),
                            decodeColumns(superColumn.getColumns()));
                } else if (item.isSetCounter_super_column()) {
                    CounterSuperColumn superColumn = item.getCounter_super_column();
                    Map<Object, Object> counters = new LinkedHashMap<>();
                    for (CounterColumn counter : superColumn.getColumns()) {
                        counters.put(name(counter.bufferForName(), schema.subNameType()), counter.getValue());
                    }
                    superColumns.put(name(superColumn.bufferForName(), schema.nameType()), counters);
                }
            }
            return Row.superColumns(superColumns);
        }

        Map<Object, Object> values = new LinkedHashMap<>();
        for (ColumnOrSuperColumn item : columns) {
            if (item.isSetColumn()) {
                putColumn(values, item.getColumn());
            } else if (item.isSetCounter_column()) {
                CounterColumn counter = item.getCounter_column();
                values.put(name(counter.bufferForName(), schema.valueColumnNameType()), counter.getValue());
            }
        }
        return Row.columns(values);
    }

    /**
     * Decodes the rows of a multi-row response, keeping server order.
     *
     * @param slices            the response
     * @param withinSuperColumn whether every slice was read from inside one super column
     * @return the rows with their keys
     */
    public List<KeyedRow> decodeKeySlices(List<KeySlice> slices, boolean withinSuperColumn) {
        List<KeyedRow> rows = new ArrayList<>(slices.size());
        for (KeySlice slice : slices) {
            rows.add(KeyedRow.fromRawKey(slice.getKey(), decode(slice.getColumns(), withinSuperColumn)));
        }
        return rows;
    }

    private Map<Object, Object> decodeColumns(List<Column> columns) {
        Map<Object, Object> values = new LinkedHashMap<>();
        for (Column column : columns) {
            putColumn(values, column);
        }
        return values;
    }

    private void putColumn(Map<Object, Object> values, Column column) {
        ByteBuffer name = column.bufferForName();
        Object value = autopack
                ? codec.unpack(column.bufferForValue(), schema.valueType(name))
                : column.bufferForValue();
        values.put(name(name, schema.valueColumnNameType()), value);
    }

    private Object name(ByteBuffer name, DataType type) {
        return autopack ? codec.unpack(name, type) : name;
    }
}
