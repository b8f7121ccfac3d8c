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

import org.apache.cassandra.thrift.Column;
import org.apache.cassandra.thrift.ColumnOrSuperColumn;
import org.apache.cassandra.thrift.ColumnParent;
import org.apache.cassandra.thrift.ColumnPath;
import org.apache.cassandra.thrift.ConsistencyLevel;
import org.apache.cassandra.thrift.Deletion;
import org.apache.cassandra.thrift.IndexExpression;
import org.apache.cassandra.thrift.Mutation;
import org.apache.cassandra.thrift.SlicePredicate;
import org.apache.cassandra.thrift.SliceRange;
import org.apache.cassandra.thrift.SuperColumn;
import org.cpcl.codec.Codec;
import org.cpcl.codec.DataType;
import org.cpcl.connection.Operations;
import org.cpcl.dispatch.CallDispatcher;
import org.cpcl.exception.CpclInvalidArgumentException;
import org.cpcl.exception.CpclInvalidRequestException;
import org.cpcl.model.ColumnSlice;
import org.cpcl.model.IndexCondition;
import org.cpcl.model.Row;
import org.cpcl.model.RowDecoder;
import org.cpcl.model.RowKeys;
import org.cpcl.paging.IndexedPagingIterator;
import org.cpcl.paging.KeyRangePagingIterator;
import org.cpcl.paging.PagingIterator;
import org.cpcl.schema.ColumnFamilySchema;
import org.cpcl.schema.SchemaProvider;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to one column family of the active keyspace.
 *
 * <p>Column names and values are packed and unpacked with the types the schema declares, unless
 * autopack is disabled; then they must be passed as {@link ByteBuffer} or {@code byte[]} and come
 * back as {@link ByteBuffer}. Row keys are strings.
 */
public class ColumnFamily {

    private final String name;
    private final CallDispatcher dispatcher;
    private final SchemaProvider schemaProvider;
    private final Codec codec;
    private final boolean autopack;
    private final ConsistencyLevel defaultReadConsistency;
    private final ConsistencyLevel defaultWriteConsistency;
    private final int defaultColumnCount;
    private final Clock clock;

    public ColumnFamily(
            String name,
            CallDispatcher dispatcher,
            SchemaProvider schemaProvider,
            Codec codec,
            boolean autopack,
            int defaultColumnCount) {
        this(
                name,
                dispatcher,
                schemaProvider,
                codec,
                autopack,
                ConsistencyLevel.ONE,
                ConsistencyLevel.ONE,
                defaultColumnCount,
                Clock.systemUTC());
    }

    public ColumnFamily(
            String name,
            CallDispatcher dispatcher,
            SchemaProvider schemaProvider,
            Codec codec,
            boolean autopack,
            ConsistencyLevel defaultReadConsistency,
            ConsistencyLevel defaultWriteConsistency,
            int defaultColumnCount,
            Clock clock) {
        this.name = name;
        this.dispatcher = dispatcher;
        this.schemaProvider = schemaProvider;
        this.codec = codec;
        this.autopack = autopack;
        this.defaultReadConsistency = defaultReadConsistency;
        this.defaultWriteConsistency = defaultWriteConsistency;
        this.defaultColumnCount = defaultColumnCount;
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    public boolean isAutopack() {
        return autopack;
    }

    public ColumnFamilySchema getSchema() {
        return schemaProvider.getColumnFamilySchema(name);
    }

    public ColumnFamilySchema getSchema(boolean useCache) {
        return schemaProvider.getColumnFamilySchema(name, useCache);
    }

    public DataType getColumnNameType() {
        return schemaProvider.getColumnNameType(name);
    }

    public DataType getColumnValueType(Object columnName) {
        return schemaProvider.getColumnValueType(name, columnName);
    }

    // reads

    public Optional<Row> getAll(String key) {
        return get(key, ColumnSlice.all(defaultColumnCount), null, null);
    }

    public Optional<Row> getAll(String key, Object superColumn) {
        return get(key, ColumnSlice.all(defaultColumnCount), superColumn, null);
    }

    public Optional<Row> getColumns(String key, List<?> columns) {
        return get(key, ColumnSlice.names(columns), null, null);
    }

    public Optional<Row> getColumns(String key, List<?> columns, Object superColumn) {
        return get(key, ColumnSlice.names(columns), superColumn, null);
    }

    public Optional<Row> getColumnRange(String key, Object startColumn, Object endColumn) {
        return get(key, ColumnSlice.range(startColumn, endColumn, false, defaultColumnCount), null, null);
    }

    public Optional<Row> getColumnRange(String key, Object startColumn, Object endColumn, Object superColumn) {
        return get(key, ColumnSlice.range(startColumn, endColumn, false, defaultColumnCount), superColumn, null);
    }

    /**
     * Reads a slice of one row.
     *
     * @param key         the row key
     * @param slice       the columns to read
     * @param superColumn the super column to read inside, {@code null} for the row itself
     * @param consistency the consistency level, {@code null} for the default
     * @return the row, empty when nothing was found
     */
    public Optional<Row> get(String key, ColumnSlice slice, Object superColumn, ConsistencyLevel consistency) {
        ColumnFamilySchema schema = getSchema();
        List<ColumnOrSuperColumn> columns = dispatcher.call(
                Operations.GET_SLICE,
                RowKeys.encode(key),
                columnParent(schema, superColumn),
                slicePredicate(schema, slice, superColumn != null),
                readConsistency(consistency));

        if (columns == null || columns.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(decoder(schema).decode(columns, superColumn != null));
    }

    /**
     * Reads the same slice of several rows.
     *
     * @param keys        the row keys
     * @param slice       the columns to read
     * @param superColumn the super column to read inside, {@code null} for the rows themselves
     * @param consistency the consistency level, {@code null} for the default
     * @return the non-empty rows by key, in request order
     */
    public Map<String, Row> getMultiple(
            List<String> keys, ColumnSlice slice, Object superColumn, ConsistencyLevel consistency) {
        ColumnFamilySchema schema = getSchema();
        List<ByteBuffer> packedKeys = new ArrayList<>(keys.size());
        for (String key : keys) {
            packedKeys.add(RowKeys.encode(key));
        }

        Map<ByteBuffer, List<ColumnOrSuperColumn>> response = dispatcher.call(
                Operations.MULTIGET_SLICE,
                packedKeys,
                columnParent(schema, superColumn),
                slicePredicate(schema, slice, superColumn != null),
                readConsistency(consistency));

        RowDecoder decoder = decoder(schema);
        Map<String, Row> rows = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            List<ColumnOrSuperColumn> columns = response.get(packedKeys.get(i));
            if (columns != null && !columns.isEmpty()) {
                rows.put(keys.get(i), decoder.decode(columns, superColumn != null));
            }
        }
        return rows;
    }

    public Map<String, Row> getMultiple(List<String> keys) {
        return getMultiple(keys, ColumnSlice.all(defaultColumnCount), null, null);
    }

    /**
     * Counts the columns of a row, or of a super column.
     *
     * @param key         the row key
     * @param superColumn the super column, {@code null} for the row
     * @param consistency the consistency level, {@code null} for the default
     * @return the column count
     */
    public int count(String key, Object superColumn, ConsistencyLevel consistency) {
        ColumnFamilySchema schema = getSchema();
        Integer count = dispatcher.call(
                Operations.GET_COUNT,
                RowKeys.encode(key),
                columnParent(schema, superColumn),
                slicePredicate(schema, ColumnSlice.all(Integer.MAX_VALUE), superColumn != null),
                readConsistency(consistency));
        return count;
    }

    public int count(String key) {
        return count(key, null, null);
    }

    /**
     * Finds rows through secondary indexes.
     *
     * @param conditions    the index expressions, all of which must hold
     * @param slice         the columns to read from each row
     * @param consistency   the consistency level, {@code null} for the default
     * @param pageSize      rows fetched per request
     * @param rowCountLimit the maximum number of rows, {@code null} for all
     * @return an iterator over the matching rows
     */
    public PagingIterator getWhere(
            List<IndexCondition> conditions,
            ColumnSlice slice,
            ConsistencyLevel consistency,
            int pageSize,
            Integer rowCountLimit) {
        if (conditions.isEmpty()) {
            throw new CpclInvalidRequestException("At least one index condition is required");
        }
        ColumnFamilySchema schema = getSchema();
        List<IndexExpression> expressions = new ArrayList<>(conditions.size());
        for (IndexCondition condition : conditions) {
            ByteBuffer column = packName(condition.column(), schema.valueColumnNameType());
            ByteBuffer value = packValue(condition.value(), schema.valueType(column));
            expressions.add(new IndexExpression(column, condition.operator(), value));
        }

        return new IndexedPagingIterator(
                dispatcher,
                columnParent(schema, null),
                expressions,
                slicePredicate(schema, slice, false),
                readConsistency(consistency),
                decoder(schema),
                pageSize,
                rowCountLimit);
    }

    public PagingIterator getWhere(List<IndexCondition> conditions) {
        return getWhere(conditions, ColumnSlice.all(defaultColumnCount), null, PagingIterator.DEFAULT_PAGE_SIZE, null);
    }

    public PagingIterator getWhere(Map<?, ?> equalities) {
        return getWhere(IndexCondition.allEqual(equalities));
    }

    /**
     * Iterates the rows of a key range.
     *
     * @param startKey      the first key, inclusive; {@code null} or empty for the beginning
     * @param endKey        the last key, inclusive; {@code null} or empty for the end
     * @param rowCountLimit the maximum number of rows, {@code null} for all
     * @param slice         the columns to read from each row
     * @param superColumn   the super column to read inside, {@code null} for the rows themselves
     * @param consistency   the consistency level, {@code null} for the default
     * @param pageSize      rows fetched per request
     * @return an iterator over the rows
     */
    public PagingIterator getKeyRange(
            String startKey,
            String endKey,
            Integer rowCountLimit,
            ColumnSlice slice,
            Object superColumn,
            ConsistencyLevel consistency,
            int pageSize) {
        ColumnFamilySchema schema = getSchema();
        return new KeyRangePagingIterator(
                dispatcher,
                columnParent(schema, superColumn),
                slicePredicate(schema, slice, superColumn != null),
                startKey,
                endKey,
                readConsistency(consistency),
                decoder(schema),
                pageSize,
                rowCountLimit);
    }

    public PagingIterator getKeyRange(String startKey, String endKey) {
        return getKeyRange(
                startKey, endKey, null, ColumnSlice.all(defaultColumnCount), null, null,
                PagingIterator.DEFAULT_PAGE_SIZE);
    }

    public PagingIterator getKeyRange() {
        return getKeyRange(null, null);
    }

    // writes

    public void set(String key, Map<?, ?> columns) {
        set(key, columns, null, null, null);
    }

    public void set(String key, Row row, ConsistencyLevel consistency) {
        set(key, row.asMap(), consistency, null, null);
    }

    /**
     * Writes columns of one row. In a super column family the map holds super column names
     * mapped to maps of columns.
     *
     * @param key         the row key
     * @param columns     the columns to write
     * @param consistency the consistency level, {@code null} for the default
     * @param timestamp   the write timestamp in microseconds, {@code null} for now
     * @param ttl         the time to live in seconds, {@code null} for none
     */
    public void set(String key, Map<?, ?> columns, ConsistencyLevel consistency, Long timestamp, Integer ttl) {
        ColumnFamilySchema schema = getSchema();
        long writeTime = timestamp == null ? currentTimestamp() : timestamp;
        List<Mutation> mutations = new ArrayList<>(columns.size());

        for (Map.Entry<?, ?> entry : columns.entrySet()) {
            ColumnOrSuperColumn item = new ColumnOrSuperColumn();
            if (schema.superColumnFamily()) {
                if (!(entry.getValue() instanceof Map)) {
                    throw new CpclInvalidArgumentException("Column family \"" + name
                            + "\" holds super columns, expected a map of columns for " + entry.getKey());
                }
                List<Column> subColumns = new ArrayList<>();
                for (Map.Entry<?, ?> subEntry : ((Map<?, ?>) entry.getValue()).entrySet()) {
                    subColumns.add(column(schema, subEntry.getKey(), subEntry.getValue(), writeTime, ttl));
                }
                item.setSuper_column(new SuperColumn(packName(entry.getKey(), schema.nameType()), subColumns));
            } else {
                item.setColumn(column(schema, entry.getKey(), entry.getValue(), writeTime, ttl));
            }
            Mutation mutation = new Mutation();
            mutation.setColumn_or_supercolumn(item);
            mutations.add(mutation);
        }

        batchMutate(key, mutations, writeConsistency(consistency));
    }

    /**
     * Removes a whole row, a super column, or listed columns.
     *
     * @param key         the row key
     * @param columns     the columns to remove, {@code null} or empty for everything
     * @param superColumn the super column to remove from, {@code null} for the row
     * @param consistency the consistency level, {@code null} for the default
     */
    public void remove(String key, List<?> columns, Object superColumn, ConsistencyLevel consistency) {
        ColumnFamilySchema schema = getSchema();
        long timestamp = currentTimestamp();

        if (columns == null || columns.isEmpty()) {
            ColumnPath path = new ColumnPath(name);
            if (superColumn != null) {
                path.setSuper_column(packSuperColumn(schema, superColumn));
            }
            dispatcher.call(Operations.REMOVE, RowKeys.encode(key), path, timestamp, writeConsistency(consistency));
            return;
        }

        Deletion deletion = new Deletion();
        deletion.setTimestamp(timestamp);
        if (superColumn != null) {
            deletion.setSuper_column(packSuperColumn(schema, superColumn));
        }
        deletion.setPredicate(slicePredicate(schema, ColumnSlice.names(columns), superColumn != null));

        Mutation mutation = new Mutation();
        mutation.setDeletion(deletion);
        batchMutate(key, List.of(mutation), writeConsistency(consistency));
    }

    public void remove(String key) {
        remove(key, null, null, null);
    }

    public void truncate() {
        dispatcher.call(Operations.TRUNCATE, name);
    }

    // thrift structures

    ColumnParent columnParent(ColumnFamilySchema schema, Object superColumn) {
        ColumnParent parent = new ColumnParent(name);
        if (superColumn != null) {
            parent.setSuper_column(packSuperColumn(schema, superColumn));
        }
        return parent;
    }

    SlicePredicate slicePredicate(ColumnFamilySchema schema, ColumnSlice slice, boolean withinSuperColumn) {
        DataType nameType = withinSuperColumn ? schema.subNameType() : schema.nameType();
        SlicePredicate predicate = new SlicePredicate();
        if (slice.isNames()) {
            List<ByteBuffer> names = new ArrayList<>(slice.names().size());
            for (Object column : slice.names()) {
                names.add(packName(column, nameType));
            }
            predicate.setColumn_names(names);
        } else {
            predicate.setSlice_range(new SliceRange(
                    slice.start() == null ? empty() : packName(slice.start(), nameType),
                    slice.finish() == null ? empty() : packName(slice.finish(), nameType),
                    slice.reversed(),
                    slice.count()));
        }
        return predicate;
    }

    private Column column(ColumnFamilySchema schema, Object columnName, Object value, long timestamp, Integer ttl) {
        ByteBuffer packedName = packName(columnName, schema.valueColumnNameType());
        Column column = new Column(packedName);
        column.setValue(packValue(value, schema.valueType(packedName)));
        column.setTimestamp(timestamp);
        if (ttl != null) {
            column.setTtl(ttl);
        }
        return column;
    }

    private ByteBuffer packSuperColumn(ColumnFamilySchema schema, Object superColumn) {
        if (!schema.superColumnFamily()) {
            throw new CpclInvalidRequestException(
                    "Column family \"" + name + "\" is not a super column family, cannot address " + superColumn);
        }
        return packName(superColumn, schema.nameType());
    }

    private void batchMutate(String key, List<Mutation> mutations, ConsistencyLevel consistency) {
        Map<String, List<Mutation>> byColumnFamily = Collections.singletonMap(name, mutations);
        Map<ByteBuffer, Map<String, List<Mutation>>> mutationMap = new HashMap<>();
        mutationMap.put(RowKeys.encode(key), byColumnFamily);
        dispatcher.call(Operations.BATCH_MUTATE, mutationMap, consistency);
    }

    private ByteBuffer packName(Object columnName, DataType type) {
        return autopack ? codec.pack(columnName, type) : raw(columnName, "column names");
    }

    private ByteBuffer packValue(Object value, DataType type) {
        return autopack ? codec.pack(value, type) : raw(value, "column values");
    }

    private static ByteBuffer raw(Object value, String what) {
        if (value instanceof ByteBuffer) {
            return ((ByteBuffer) value).duplicate();
        }
        if (value instanceof byte[]) {
            return ByteBuffer.wrap((byte[]) value);
        }
        throw new CpclInvalidArgumentException("Autopack is disabled, " + what + " must be given as bytes");
    }

    private RowDecoder decoder(ColumnFamilySchema schema) {
        return new RowDecoder(schema, codec, autopack);
    }

    private ConsistencyLevel readConsistency(ConsistencyLevel consistency) {
        return consistency == null ? defaultReadConsistency : consistency;
    }

    private ConsistencyLevel writeConsistency(ConsistencyLevel consistency) {
        return consistency == null ? defaultWriteConsistency : consistency;
    }

    private long currentTimestamp() {
        Instant now = clock.instant();
        return now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000L;
    }

    private static ByteBuffer empty() {
        return ByteBuffer.allocate(0);
    }

    @Override
    public String toString() {
        return "ColumnFamily{name=" + name + ", autopack=" + autopack + '}';
    }
}
