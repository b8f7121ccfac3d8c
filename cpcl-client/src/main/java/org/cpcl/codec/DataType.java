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

package org.cpcl.codec;

import org.apache.commons.lang3.StringUtils;

/**
 * Marshal types a column name or value can have.
 */
public enum DataType {
    ASCII("AsciiType"),
    BYTES("BytesType"),
    LEXICAL_UUID("LexicalUUIDType"),
    LONG("LongType"),
    INTEGER("IntegerType"),
    TIME_UUID("TimeUUIDType"),
    UTF8("UTF8Type");

    private final String className;

    DataType(String className) {
        this.className = className;
    }

    /**
     * Returns the simple marshal class name, for example {@code UTF8Type}.
     *
     * @return the class name
     */
    public String getClassName() {
        return className;
    }

    /**
     * Resolves a marshal class name as reported by the server schema.
     *
     * <p>Fully qualified names such as {@code org.apache.cassandra.db.marshal.LongType} are
     * accepted. Blank and unknown names resolve to {@link #BYTES}.
     *
     * @param className the marshal class name
     * @return the data type
     */
    public static DataType fromClassName(String className) {
        if (StringUtils.isBlank(className)) {
            return BYTES;
        }
        String simpleName = StringUtils.substringAfterLast(className, ".");
        if (simpleName.isEmpty()) {
            simpleName = className;
        }
        for (DataType type : values()) {
            if (type.className.equals(simpleName)) {
                return type;
            }
        }
        return BYTES;
    }

    public boolean isUuid() {
        return this == LEXICAL_UUID || this == TIME_UUID;
    }
}
