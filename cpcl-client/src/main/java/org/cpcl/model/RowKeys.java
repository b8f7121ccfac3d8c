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
import java.nio.charset.StandardCharsets;

/**
 * Row keys are strings stored as UTF-8 bytes. Keys read back from the server keep their raw
 * bytes as well, since keys written by other clients need not be valid UTF-8.
 */
public final class RowKeys {

    private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

    private RowKeys() {}

    public static ByteBuffer encode(String key) {
        if (key == null || key.isEmpty()) {
            return EMPTY.duplicate();
        }
        return ByteBuffer.wrap(key.getBytes(StandardCharsets.UTF_8));
    }

    public static String decode(byte[] key) {
        return new String(key, StandardCharsets.UTF_8);
    }

    public static String decode(ByteBuffer key) {
        return StandardCharsets.UTF_8.decode(key.duplicate()).toString();
    }
}
