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

package org.cpcl.request;

import org.cpcl.model.ColumnSlice;

import java.util.List;

/**
 * The parts of a request string.
 *
 * @param columnFamily the column family name
 * @param key          the row key
 * @param superColumn  the super column name, {@code null} if none
 * @param columns      the listed columns, {@code null} if none were listed
 * @param startColumn  the first column of a range, {@code null} if no range
 * @param endColumn    the last column of a range, {@code null} if no range
 * @param reversed     whether the range is read backwards
 * @param columnCount  the maximum number of columns
 */
public record ParsedRequest(
        String columnFamily,
        String key,
        String superColumn,
        List<String> columns,
        String startColumn,
        String endColumn,
        boolean reversed,
        int columnCount) {

    public boolean isRange() {
        return startColumn != null || endColumn != null;
    }

    /**
     * Converts the column selection into a slice. Empty range bounds mean an open range.
     *
     * @return the slice
     */
    public ColumnSlice toSlice() {
        if (columns != null) {
            return ColumnSlice.names(columns);
        }
        return ColumnSlice.range(emptyToNull(startColumn), emptyToNull(endColumn), reversed, columnCount);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
