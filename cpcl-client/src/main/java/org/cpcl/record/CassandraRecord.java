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
import org.apache.commons.lang3.StringUtils;
import org.cpcl.CassandraClient;
import org.cpcl.ClientRegistry;
import org.cpcl.columnfamily.ColumnFamily;
import org.cpcl.exception.CpclInvalidArgumentException;
import org.cpcl.exception.CpclInvalidRequestException;
import tools.jackson.core.JacksonException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base class for rows mapped onto plain Java objects.
 *
 * <p>Public fields (or bean properties) of a subclass are the columns of one row. The column
 * family name is derived from the class name: a trailing {@code Model} or {@code Record} is
 * dropped and the camel-case words are joined by underscores, so {@code UserProfileModel} maps to
 * {@code user_profile}. Override {@link #columnFamilyName()} to choose another name.
 *
 * <p>A record without an explicit client uses the default client of the {@link ClientRegistry}.
 * Subclasses need a public no-argument constructor. Use {@link RecordRepository} to load records.
 *
 * <pre>{@code
 * public class UserModel extends CassandraRecord {
 *     public String email;
 *     public Long age;
 * }
 *
 * RecordRepository<UserModel> users = RecordRepository.of(UserModel.class);
 * users.insert("john", Map.of("email", "john@example.com", "age", 34), null);
 * users.load("john").ifPresent(user -> log.info("{}", user.email));
 * }</pre>
 */
public abstract class CassandraRecord {

    private static final List<String> CLASS_SUFFIXES = List.of("Model", "Record");

    private String key;
    private CassandraClient client;

    protected CassandraRecord() {}

    public String key() {
        return key;
    }

    public void key(String key) {
        this.key = key;
    }

    /**
     * Returns the client this record reads and writes through.
     *
     * @return the explicit client, or the registry's default client
     */
    public CassandraClient client() {
        return client != null ? client : ClientRegistry.get();
    }

    public void client(CassandraClient client) {
        this.client = client;
    }

    protected String columnFamilyName() {
        return defaultColumnFamilyName(getClass());
    }

    /**
     * Copies column values onto the matching properties. Columns without a property are ignored.
     *
     * @param data column values by name
     * @return this record
     */
    public CassandraRecord populate(Map<?, ?> data) {
        try {
            RecordMapperFactory.getInstance().updateValue(this, data);
        } catch (JacksonException | IllegalArgumentException e) {
            throw new CpclInvalidArgumentException(
                    "Cannot populate " + getClass().getSimpleName() + " from columns " + data.keySet(), e);
        }
        return this;
    }

    /**
     * Returns the properties that hold a value, as columns to write.
     *
     * @return column values by name
     */
    public Map<String, Object> columns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        properties(this).forEach((name, value) -> {
            if (value != null) {
                columns.put(name, value);
            }
        });
        return columns;
    }

    public void save() {
        save(null, null, null);
    }

    public void save(String newKey) {
        save(newKey, null, null);
    }

    /**
     * Writes the properties holding a value to the record's row.
     *
     * @param newKey      the row key to save under, {@code null} to keep the current one
     * @param data        column values to populate first, {@code null} for none
     * @param consistency the consistency level, {@code null} for the default
     */
    public void save(String newKey, Map<?, ?> data, ConsistencyLevel consistency) {
        if (newKey != null) {
            key = newKey;
        }
        if (data != null) {
            populate(data);
        }
        requireKey("save");
        Map<String, Object> columns = columns();
        if (columns.isEmpty()) {
            throw new CpclInvalidRequestException(
                    "Cannot save " + getClass().getSimpleName() + " \"" + key + "\" without columns");
        }
        columnFamily().set(key, columns, consistency, null, null);
    }

    public void delete() {
        delete(null, null);
    }

    /**
     * Removes the record's row, or listed columns of it.
     *
     * @param columns     the columns to remove, {@code null} or empty for the whole row
     * @param consistency the consistency level, {@code null} for the default
     */
    public void delete(List<?> columns, ConsistencyLevel consistency) {
        requireKey("delete");
        columnFamily().remove(key, columns, null, consistency);
    }

    /**
     * Removes a super column of the record's row, or listed columns inside it.
     *
     * @param superColumn the super column
     * @param columns     the sub-columns to remove, {@code null} or empty for the whole super column
     * @param consistency the consistency level, {@code null} for the default
     */
    public void deleteSuper(Object superColumn, List<?> columns, ConsistencyLevel consistency) {
        if (superColumn == null) {
            throw new CpclInvalidArgumentException("Super column cannot be null");
        }
        requireKey("delete");
        columnFamily().remove(key, columns, superColumn, consistency);
    }

    ColumnFamily columnFamily() {
        return client().cf(columnFamilyName());
    }

    private void requireKey(String action) {
        if (StringUtils.isEmpty(key)) {
            throw new CpclInvalidRequestException(
                    "Cannot " + action + " " + getClass().getSimpleName() + " without a row key");
        }
    }

    static String defaultColumnFamilyName(Class<?> type) {
        String name = type.getSimpleName();
        for (String suffix : CLASS_SUFFIXES) {
            if (name.length() > suffix.length() && name.endsWith(suffix)) {
                name = name.substring(0, name.length() - suffix.length());
                break;
            }
        }
        return String.join("_", StringUtils.splitByCharacterTypeCamelCase(name)).toLowerCase(Locale.ROOT);
    }

    /**
     * Returns every property of a record, including those without a value.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> properties(CassandraRecord record) {
        try {
            return RecordMapperFactory.getInstance().convertValue(record, Map.class);
        } catch (JacksonException | IllegalArgumentException e) {
            throw new CpclInvalidArgumentException(
                    "Cannot read the columns of " + record.getClass().getSimpleName(), e);
        }
    }
}
