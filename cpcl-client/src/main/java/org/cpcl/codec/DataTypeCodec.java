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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Stateless {@link Codec} for the built-in marshal types.
 *
 * <ul>
 *   <li>{@code LongType}: 8 bytes, big-endian</li>
 *   <li>{@code IntegerType}: two's complement varint, unpacked as {@link BigInteger}</li>
 *   <li>{@code LexicalUUIDType}, {@code TimeUUIDType}: 16 bytes, unpacked as {@link UUID}</li>
 *   <li>{@code AsciiType}, {@code UTF8Type}: encoded text</li>
 *   <li>{@code BytesType}: raw bytes, unpacked as a {@link ByteBuffer}</li>
 * </ul>
 *
 * <p>Textual input is accepted for every type so values coming from request strings can be packed.
 */
public final class DataTypeCodec implements Codec {

    private static final DataTypeCodec INSTANCE = new DataTypeCodec();

    public static DataTypeCodec getInstance() {
        return INSTANCE;
    }

    @Override
    public ByteBuffer pack(Object value, DataType type) {
        if (value == null) {
            throw new CpclInvalidArgumentException("Cannot pack null as " + type.getClassName());
        }
        if (value instanceof ByteBuffer) {
            return ((ByteBuffer) value).duplicate();
        }
        return switch (type) {
            case LONG -> packLong(value);
            case INTEGER -> ByteBuffer.wrap(toBigInteger(value).toByteArray());
            case LEXICAL_UUID, TIME_UUID -> packUuid(value, type);
            case ASCII -> encode(text(value, type), StandardCharsets.US_ASCII, type);
            case UTF8 -> encode(text(value, type), StandardCharsets.UTF_8, type);
            case BYTES -> packBytes(value);
        };
    }

    @Override
    public Object unpack(ByteBuffer bytes, DataType type) {
        byte[] data = toArray(bytes);
        return switch (type) {
            case LONG -> {
                if (data.length != Long.BYTES) {
                    throw new CpclInvalidArgumentException("LongType expects 8 bytes, got " + data.length);
                }
                yield ByteBuffer.wrap(data).getLong();
            }
            case INTEGER -> data.length == 0 ? BigInteger.ZERO : new BigInteger(data);
            case LEXICAL_UUID, TIME_UUID -> {
                if (data.length != 16) {
                    throw new CpclInvalidArgumentException(
                            type.getClassName() + " expects 16 bytes, got " + data.length);
                }
                ByteBuffer buffer = ByteBuffer.wrap(data);
                yield new UUID(buffer.getLong(), buffer.getLong());
            }
            case ASCII -> new String(data, StandardCharsets.US_ASCII);
            case UTF8 -> new String(data, StandardCharsets.UTF_8);
            case BYTES -> ByteBuffer.wrap(data);
        };
    }

    /**
     * Copies the remaining bytes of a buffer without moving its position.
     *
     * @param buffer the buffer
     * @return the copied bytes
     */
    public static byte[] toArray(ByteBuffer buffer) {
        ByteBuffer copy = buffer.duplicate();
        byte[] data = new byte[copy.remaining()];
        copy.get(data);
        return data;
    }

    private static ByteBuffer packLong(Object value) {
        long number;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            number = ((Number) value).longValue();
        } else {
            BigInteger big = toBigInteger(value);
            if (big.bitLength() > 63) {
                throw new CpclInvalidArgumentException("Value " + value + " does not fit LongType");
            }
            number = big.longValue();
        }
        ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES);
        buffer.putLong(number);
        buffer.flip();
        return buffer;
    }

    private static BigInteger toBigInteger(Object value) {
        if (value instanceof BigInteger) {
            return (BigInteger) value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigDecimal) {
            try {
                return ((BigDecimal) value).toBigIntegerExact();
            } catch (ArithmeticException e) {
                throw new CpclInvalidArgumentException("Value " + value + " is not an integer", e);
            }
        }
        if (value instanceof CharSequence) {
            try {
                return new BigInteger(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new CpclInvalidArgumentException("Value \"" + value + "\" is not an integer", e);
            }
        }
        throw new CpclInvalidArgumentException(
                "Cannot pack " + value.getClass().getSimpleName() + " as an integer");
    }

    private static ByteBuffer packUuid(Object value, DataType type) {
        UUID uuid;
        if (value instanceof UUID) {
            uuid = (UUID) value;
        } else if (value instanceof CharSequence) {
            try {
                uuid = UUID.fromString(value.toString());
            } catch (IllegalArgumentException e) {
                throw new CpclInvalidArgumentException("Value \"" + value + "\" is not a UUID", e);
            }
        } else if (value instanceof byte[] && ((byte[]) value).length == 16) {
            return ByteBuffer.wrap(((byte[]) value).clone());
        } else {
            throw new CpclInvalidArgumentException(
                    "Cannot pack " + value.getClass().getSimpleName() + " as " + type.getClassName());
        }
        ByteBuffer buffer = ByteBuffer.allocate(16);
        buffer.putLong(uuid.getMostSignificantBits());
        buffer.putLong(uuid.getLeastSignificantBits());
        buffer.flip();
        return buffer;
    }

    private static ByteBuffer packBytes(Object value) {
        if (value instanceof byte[]) {
            return ByteBuffer.wrap(((byte[]) value).clone());
        }
        if (value instanceof CharSequence) {
            return ByteBuffer.wrap(value.toString().getBytes(StandardCharsets.UTF_8));
        }
        throw new CpclInvalidArgumentException("Cannot pack " + value.getClass().getSimpleName() + " as BytesType");
    }

    private static String text(Object value, DataType type) {
        if (value instanceof CharSequence || value instanceof Number || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, type == DataType.ASCII ? StandardCharsets.US_ASCII : StandardCharsets.UTF_8);
        }
        throw new CpclInvalidArgumentException(
                "Cannot pack " + value.getClass().getSimpleName() + " as " + type.getClassName());
    }

    private static ByteBuffer encode(String text, Charset charset, DataType type) {
        try {
            return charset.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(text));
        } catch (CharacterCodingException e) {
            throw new CpclInvalidArgumentException("Value \"" + text + "\" is not valid " + type.getClassName(), e);
        }
    }
}
