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

package org.cpcl.record;

import org.apache.cassandra.thrift.ConsistencyLevel;
import org.cpcl.CassandraClient;
import org.cpcl.ClientRegistry;
import org.cpcl.columnfamily.ColumnFamily;
import org.cpcl.exception.CpclInvalidArgumentException;
import org.cpcl.model.ColumnSlice;
import org.cpcl.model.Row;
import org.cpcl.request.RequestParser;
import tools.jackson.core.JacksonException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Loads, inserts and removes records of one type.
 *
 * <p>Reads request only the columns the record type declares; a type without properties reads
 * whole rows. A repository created without a client resolves the registry's default client on
 * every call.
 *
 * @param <T> the record type
 */
public final class RecordRepository<T extends CassandraRecord> {

    static final int DEFAULT_COLUMN_LIMIT = 100;
    static final int DEFAULT_PAGE_SIZE = 100;

    private final Class<T> type;
    private final CassandraClient client;

    private RecordRepository(Class<T> type, CassandraClient client) {
        if (type == null) {
            throw new CpclInvalidArgumentException("Record type cannot be null");
        }
        this.type = type;
        this.client = client;
    }

    public static <T extends CassandraRecord> RecordRepository<T> of(Class<T> type) {
        return new RecordRepository<>(type, null);
    }

    public static <T extends CassandraRecord> RecordRepository<T> of(Class<T> type, CassandraClient client) {
        if (client == null) {
            throw new CpclInvalidArgumentException("Client cannot be null");
        }
        return new RecordRepository<>(type, client);
    }

    public CassandraClient client() {
        return client != null ? client : ClientRegistry.get();
    }

    public String columnFamilyName() {
        return create().columnFamilyName();
    }

    /**
     * Returns the columns the record type declares.
     *
     * @return the property names
     */
    public List<String> columnNames() {
        return new ArrayList<>(CassandraRecord.properties(create()).keySet());
    }

    /**
     * Creates an empty record bound to this repository's client.
     *
     * @return the new record
     */
    public T create() {
        T record;
        try {
            record = RecordMapperFactory.getInstance().convertValue(Map.of(), type);
        } catch (JacksonException | IllegalArgumentException e) {
            throw new CpclInvalidArgumentException(
                    "Cannot create " + type.getSimpleName() + ", a public no-argument constructor is required", e);
        }
        record.client(client);
        return record;
    }

    public T create(String key) {
        T record = create();
        record.key(key);
        return record;
    }

    public Optional<T> load(String rowKey) {
        return load(rowKey, null);
    }

    /**
     * Loads a record. A key of the form {@code key.superColumn} reads inside that super column;
     * dots inside keys are escaped with a backslash as in request strings.
     *
     * @param rowKey      the row key, optionally followed by a super column
     * @param consistency the consistency level, {@code null} for the default
     * @return the record, empty when the row has none of the declared columns
     */
    public Optional<T> load(String rowKey, ConsistencyLevel consistency) {
        int separator = RequestParser.indexOfUnescapedDot(rowKey);
        if (separator < 0) {
            return load(RequestParser.unescape(rowKey), null, consistency);
        }
        return load(
                RequestParser.unescape(rowKey.substring(0, separator)),
                RequestParser.unescape(rowKey.substring(separator + 1)),
                consistency);
    }

    public Optional<T> load(String key, Object superColumn, ConsistencyLevel consistency) {
        return columnFamily().get(key, declaredColumns(), superColumn, consistency).map(row -> toRecord(key, row));
    }

    /**
     * Reads every column of a row into a record. Columns without a property are dropped.
     *
     * @param key the row key
     * @return the record, empty when the row does not exist
     */
    public Optional<T> getAll(String key) {
        return columnFamily().getAll(key).map(row -> toRecord(key, row));
    }

    /**
     * Iterates the records of a key range, fetching rows page by page.
     *
     * @param startKey    the first key, inclusive; {@code null} for the beginning
     * @param endKey      the last key, inclusive; {@code null} for the end
     * @param consistency the consistency level, {@code null} for the default
     * @return the records in key order
     */
    public Stream<T> getKeyRange(String startKey, String endKey, ConsistencyLevel consistency) {
        return columnFamily()
                .getKeyRange(startKey, endKey, null, declaredColumns(), null, consistency, DEFAULT_PAGE_SIZE)
                .stream()
                .map(row -> toRecord(row.key(), row.row()));
    }

    /**
     * Reads a range of columns of one row as they are stored. Meant for rows whose column names
     * are data, such as time series, which do not map onto properties.
     *
     * @param key         the row key
     * @param startColumn the first column, {@code null} for the beginning
     * @param endColumn   the last column, {@code null} for the end
     * @param limit       the maximum number of columns
     * @param consistency the consistency level, {@code null} for the default
     * @return the row, empty when nothing was found
     */
    public Optional<Row> getColumnRange(
            String key, Object startColumn, Object endColumn, int limit, ConsistencyLevel consistency) {
        return columnFamily().get(key, ColumnSlice.range(startColumn, endColumn, false, limit), null, consistency);
    }

    public T insert(String key, Map<?, ?> data, ConsistencyLevel consistency) {
        T record = create();
        record.save(key, data, consistency);
        return record;
    }

    public void remove(String key, List<?> columns, ConsistencyLevel consistency) {
        create(key).delete(columns, consistency);
    }

    public void removeSuper(String key, Object superColumn, List<?> columns, ConsistencyLevel consistency) {
        create(key).deleteSuper(superColumn, columns, consistency);
    }

    private ColumnFamily columnFamily() {
        return client().cf(columnFamilyName());
    }

    private ColumnSlice declaredColumns() {
        List<String> columns = columnNames();
        return columns.isEmpty() ? ColumnSlice.all(DEFAULT_COLUMN_LIMIT) : ColumnSlice.names(columns);
    }

    private T toRecord(String key, Row row) {
        T record = create(key);
        record.populate(row.asMap());
        return record;
    }
}
