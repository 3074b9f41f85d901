/*
 * Copyright (C) 2025 The Certvet Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.certvet.ct;

import java.util.Arrays;

/**
 * Cursor over a window of a byte array, reading the TLS (RFC 5246 section 4) and DER
 * encodings SCT lists arrive in.
 *
 * <p>Every length read from the data is checked against the bytes left in the window before
 * anything is copied, so a declared length never drives an allocation on its own.
 */
final class ByteReader {
    private static final int DER_TAG_MASK = 0x3f;
    private static final int DER_TAG_OCTET_STRING = 0x04;
    private static final int DER_LENGTH_LONG_FORM_FLAG = 0x80;
    private static final int MAX_DER_LENGTH_BYTES = 4;

    private final byte[] data;
    private final int limit;
    private int position;

    ByteReader(byte[] data) {
        this(data, 0, data.length);
    }

    private ByteReader(byte[] data, int offset, int length) {
        this.data = data;
        this.position = offset;
        this.limit = offset + length;
    }

    int remaining() {
        return limit - position;
    }

    boolean hasRemaining() {
        return position < limit;
    }

    /**
     * Reads a big endian unsigned number of {@code width} bytes, at most 8.
     */
    long readUnsigned(int width) throws SerializationException {
        if (width < 1 || width > 8) {
            throw new IllegalArgumentException("Invalid width: " + width);
        }
        require(width);
        long result = 0;
        for (int i = 0; i < width; i++) {
            result = (result << 8) | (data[position++] & 0xff);
        }
        return result;
    }

    byte[] readBytes(int length) throws SerializationException {
        require(length);
        byte[] out = Arrays.copyOfRange(data, position, position + length);
        position += length;
        return out;
    }

    byte[] readRemaining() {
        byte[] out = Arrays.copyOfRange(data, position, limit);
        position = limit;
        return out;
    }

    /**
     * Reads a vector with a {@code width} byte length prefix and returns a reader over its body.
     */
    ByteReader readPrefixed(int width) throws SerializationException {
        return slice(readUnsigned(width));
    }

    /**
     * Reads a DER OCTET STRING and returns a reader over its contents. Indefinite lengths and
     * lengths wider than 4 bytes are rejected.
     */
    ByteReader readDerOctetString() throws SerializationException {
        int tag = (int) readUnsigned(1) & DER_TAG_MASK;
        if (tag != DER_TAG_OCTET_STRING) {
            throw new SerializationException("Wrong DER tag, expected OCTET STRING, got " + tag);
        }
        long length = readUnsigned(1);
        if ((length & DER_LENGTH_LONG_FORM_FLAG) != 0) {
            int lengthBytes = (int) length & ~DER_LENGTH_LONG_FORM_FLAG;
            if (lengthBytes == 0 || lengthBytes > MAX_DER_LENGTH_BYTES) {
                throw new SerializationException("Unsupported DER length of " + lengthBytes
                        + " bytes");
            }
            length = readUnsigned(lengthBytes);
        }
        return slice(length);
    }

    private ByteReader slice(long length) throws SerializationException {
        if (length > remaining()) {
            throw new SerializationException("Declared length " + length + " exceeds the "
                    + remaining() + " bytes left");
        }
        ByteReader body = new ByteReader(data, position, (int) length);
        position += (int) length;
        return body;
    }

    private void require(int length) throws SerializationException {
        if (length < 0) {
            throw new SerializationException("Negative length: " + length);
        }
        if (length > remaining()) {
            throw new SerializationException("Premature end of input, expected " + length
                    + " bytes, only " + remaining() + " left");
        }
    }
}
