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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The data of one row: either plain columns or super columns, as the column family schema
 * dictates. Column order is the order the server returned.
 */
public sealed interface Row permits Row.Columns, Row.SuperColumns {

    boolean isEmpty();

    boolean isSuper();

    int size();

    /**
     * Returns the row as a map, column values by name or sub-column maps by super column name.
     *
     * @return an unmodifiable view of the row
     */
    Map<Object, ?> asMap();

    static Columns columns(Map<?, ?> columns) {
        return new Columns(Collections.unmodifiableMap(new LinkedHashMap<Object, Object>(columns)));
    }

    static SuperColumns superColumns(Map<?, ? extends Map<?, ?>> superColumns) {
        Map<Object, Map<Object, Object>> copy = new LinkedHashMap<>();
        superColumns.forEach((name, columns) ->
                copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<Object, Object>(columns))));
        return new SuperColumns(Collections.unmodifiableMap(copy));
    }

    /**
     * A row of a standard column family, or the content of one super column.
     *
     * @param columns column values by column name
     */
    record Columns(Map<Object, Object> columns) implements Row {

        public Object get(Object name) {
            return columns.get(name);
        }

        @Override
        public boolean isEmpty() {
            return columns.isEmpty();
        }

        @Override
        public boolean isSuper() {
            return false;
        }

        @Override
        public int size() {
            return columns.size();
        }

        @Override
        public Map<Object, ?> asMap() {
            return columns;
        }
    }

    /**
     * A row of a super column family.
     *
     * @param superColumns sub-column maps by super column name
     */
    record SuperColumns(Map<Object, Map<Object, Object>> superColumns) implements Row {

        public Map<Object, Object> get(Object superColumn) {
            return superColumns.get(superColumn);
        }

        @Override
        public boolean isEmpty() {
            return superColumns.isEmpty();
        }

        @Override
        public boolean isSuper() {
            return true;
        }

        @Override
        public int size() {
            return superColumns.size();
        }

        @Override
        public Map<Object, ?> asMap() {
            return superColumns;
        }
    }
}
