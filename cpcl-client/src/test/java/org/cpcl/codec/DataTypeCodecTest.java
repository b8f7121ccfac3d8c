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

import org.cpcl.exception.CpclInvalidArgumentException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataTypeCodecTest {

    private final DataTypeCodec codec = DataTypeCodec.getInstance();

    @Nested
    class Packing {

        @Test
        void shouldPackLongAsEightBigEndianBytes() {
            // when
            ByteBuffer packed = codec.pack(258L, DataType.LONG);

            // then
            assertThat(DataTypeCodec.toArray(packed)).containsExactly(0, 0, 0, 0, 0, 0, 1, 2);
        }

        @Test
        void shouldPackNumericStringAsLong() {
            assertThat(codec.unpack(codec.pack("42", DataType.LONG), DataType.LONG)).isEqualTo(42L);
        }

        @Test
        void shouldRejectLongOverflow() {
            assertThatThrownBy(() -> codec.pack(new BigInteger("9223372036854775808"), DataType.LONG))
                    .isInstanceOf(CpclInvalidArgumentException.class)
                    .hasMessageContaining("does not fit LongType");
        }

        @Test
        void shouldPackIntegerAsMinimalTwosComplement() {
            assertThat(DataTypeCodec.toArray(codec.pack(127, DataType.INTEGER))).containsExactly(0x7f);
            assertThat(DataTypeCodec.toArray(codec.pack(128, DataType.INTEGER))).containsExactly(0x00, 0x80);
            assertThat(DataTypeCodec.toArray(codec.pack(-1, DataType.INTEGER))).containsExactly(0xff);
        }

        @Test
        void shouldPackUuidFromString() {
            // given
            UUID uuid = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

            // when
            ByteBuffer packed = codec.pack(uuid.toString(), DataType.TIME_UUID);

            // then
            assertThat(packed.remaining()).isEqualTo(16);
            assertThat(codec.unpack(packed, DataType.TIME_UUID)).isEqualTo(uuid);
        }

        @Test
        void shouldRejectNonAsciiText() {
            assertThatThrownBy(() -> codec.pack("café", DataType.ASCII))
                    .isInstanceOf(CpclInvalidArgumentException.class)
                    .hasMessage("Value \"café\" is not valid AsciiType");
        }

        @Test
        void shouldPackUtf8Text() {
            assertThat(DataTypeCodec.toArray(codec.pack("café", DataType.UTF8)))
                    .isEqualTo("café".getBytes(StandardCharsets.UTF_8));
        }

        @Test
        void shouldPassByteBufferThrough() {
            // given
            ByteBuffer raw = ByteBuffer.wrap(new byte[] {1, 2, 3});

            // when
            ByteBuffer packed = codec.pack(raw, DataType.LONG);

            // then
            assertThat(packed).isEqualTo(raw).isNotSameAs(raw);
        }

        @Test
        void shouldRejectNull() {
            assertThatThrownBy(() -> codec.pack(null, DataType.UTF8))
                    .isInstanceOf(CpclInvalidArgumentException.class)
                    .hasMessage("Cannot pack null as UTF8Type");
        }

        @Test
        void shouldRejectUnsupportedInput() {
            assertThatThrownBy(() -> codec.pack(new Object(), DataType.BYTES))
                    .isInstanceOf(CpclInvalidArgumentException.class);
            assertThatThrownBy(() -> codec.pack("not-a-uuid", DataType.LEXICAL_UUID))
                    .isInstanceOf(CpclInvalidArgumentException.class);
        }
    }

    @Nested
    class Unpacking {

        @Test
        void shouldUnpackEmptyIntegerAsZero() {
            assertThat(codec.unpack(ByteBuffer.allocate(0), DataType.INTEGER)).isEqualTo(BigInteger.ZERO);
        }

        @Test
        void shouldRejectShortLong() {
            assertThatThrownBy(() -> codec.unpack(ByteBuffer.wrap(new byte[] {1, 2}), DataType.LONG))
                    .isInstanceOf(CpclInvalidArgumentException.class)
                    .hasMessage("LongType expects 8 bytes, got 2");
        }

        @Test
        void shouldUnpackBytesAsBuffer() {
            // when
            Object unpacked = codec.unpack(ByteBuffer.wrap(new byte[] {9, 8}), DataType.BYTES);

            // then
            assertThat(unpacked).isEqualTo(ByteBuffer.wrap(new byte[] {9, 8}));
        }

        @Test
        void shouldNotConsumeInputBuffer() {
            // given
            ByteBuffer packed = codec.pack("name", DataType.UTF8);

            // when
            codec.unpack(packed, DataType.UTF8);

            // then
            assertThat(codec.unpack(packed, DataType.UTF8)).isEqualTo("name");
        }
    }

    @Nested
    class TypeNames {

        @Test
        void shouldResolveQualifiedAndSimpleNames() {
            assertThat(DataType.fromClassName("org.apache.cassandra.db.marshal.UTF8Type")).isEqualTo(DataType.UTF8);
            assertThat(DataType.fromClassName("LongType")).isEqualTo(DataType.LONG);
            assertThat(DataType.fromClassName("TimeUUIDType")).isEqualTo(DataType.TIME_UUID);
        }

        @Test
        void shouldFallBackToBytes() {
            assertThat(DataType.fromClassName(null)).isEqualTo(DataType.BYTES);
            assertThat(DataType.fromClassName("org.apache.cassandra.db.marshal.DecimalType"))
                    .isEqualTo(DataType.BYTES);
        }
    }
}
