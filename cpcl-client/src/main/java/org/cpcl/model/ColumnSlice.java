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

import org.cpcl.exception.CpclInvalidRequestException;

import java.util.List;

/**
 * Selects the columns of a row to read: either a list of names or a name range.
 *
 * <p>A slice with neither selects the whole row from the beginning, up to {@code count} columns.
 *
 * @param names    the column names, {@code null} for a range slice
 * @param start    the first column of the range, {@code null} for the beginning
 * @param finish   the last column of the range, {@code null} for the end
 * @param reversed whether the range is read backwards
 * @param count    the maximum number of columns of a range slice
 */
public record ColumnSlice(List<?> names, Object start, Object finish, boolean reversed, int count) {

    public static final int DEFAULT_COUNT = 100;

    public ColumnSlice {
        if (names != null && (start != null || finish != null)) {
            throw new CpclInvalidRequestException("Requesting both a list of columns and a column range is not supported");
        }
        if (count < 0) {
            throw new CpclInvalidRequestException("Column count cannot be negative, got " + count);
        }
        names = names == null ? null : List.copyOf(names);
    }

    public static ColumnSlice all() {
        return all(DEFAULT_COUNT);
    }

    public static ColumnSlice all(int count) {
        return new ColumnSlice(null, null, null, false, count);
    }

    public static ColumnSlice names(List<?> names) {
        return new ColumnSlice(names, null, null, false, names.size());
    }

    public static ColumnSlice names(Object... names) {
        return names(List.of(names));
    }

    public static ColumnSlice range(Object start, Object finish) {
        return new ColumnSlice(null, start, finish, false, DEFAULT_COUNT);
    }

    public static ColumnSlice range(Object start, Object finish, boolean reversed, int count) {
        return new ColumnSlice(null, start, finish, reversed, count);
    }

    public boolean isNames() {
        return names != null;
    }
}
