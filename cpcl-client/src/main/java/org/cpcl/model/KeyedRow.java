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

import java.nio.ByteBuffer;

/**
 * A row together with its key.
 *
 * @param key    the row key as text
 * @param row    the row data, empty for a deleted row
 * @param rawKey the key bytes as stored on the server
 */
public record KeyedRow(String key, Row row, ByteBuffer rawKey) {

    public KeyedRow {
        rawKey = rawKey.duplicate();
    }

    public KeyedRow(String key, Row row) {
        this(key, row, RowKeys.encode(key));
    }

    @Override
    public ByteBuffer rawKey() {
        return rawKey.duplicate();
    }

    public static KeyedRow fromRawKey(byte[] rawKey, Row row) {
        return new KeyedRow(RowKeys.decode(rawKey), row, ByteBuffer.wrap(rawKey));
    }
}
