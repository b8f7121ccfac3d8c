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

import org.apache.cassandra.thrift.IndexOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One expression of a secondary index query.
 *
 * @param column   the indexed column name
 * @param operator the comparison operator
 * @param value    the value to compare with
 */
public record IndexCondition(Object column, IndexOperator operator, Object value) {

    public static IndexCondition eq(Object column, Object value) {
        return new IndexCondition(column, IndexOperator.EQ, value);
    }

    public static IndexCondition of(Object column, IndexOperator operator, Object value) {
        return new IndexCondition(column, operator, value);
    }

    /**
     * Turns a column to value map into equality conditions.
     *
     * @param equalities the required column values
     * @return the conditions, in map iteration order
     */
    public static List<IndexCondition> allEqual(Map<?, ?> equalities) {
        List<IndexCondition> conditions = new ArrayList<>();
        equalities.forEach((column, value) -> conditions.add(eq(column, value)));
        return conditions;
    }
}
