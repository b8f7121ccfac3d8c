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

import java.nio.ByteBuffer;

/**
 * Converts between Java values and their wire representation.
 */
public interface Codec {

    /**
     * Serializes a value as the given type.
     *
     * @param value the value, or an already packed {@link ByteBuffer} which is passed through
     * @param type  the target type
     * @return the packed bytes, positioned at zero
     * @throws org.cpcl.exception.CpclInvalidArgumentException if the value cannot represent the type
     */
    ByteBuffer pack(Object value, DataType type);

    /**
     * Deserializes bytes of the given type. The buffer position is left untouched.
     *
     * @param bytes the packed bytes
     * @param type  the type the bytes were packed as
     * @return the value
     * @throws org.cpcl.exception.CpclInvalidArgumentException if the bytes are malformed for the type
     */
    Object unpack(ByteBuffer bytes, DataType type);
}
