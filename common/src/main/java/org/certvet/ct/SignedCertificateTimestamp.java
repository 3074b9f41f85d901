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

import java.time.Instant;
import java.util.Arrays;
import org.certvet.Preconditions;

/**
 * The parts of an RFC 6962 section 3.2 SignedCertificateTimestamp that trust decisions depend
 * on: the issuing log and the time of issuance. Extensions and signature are not interpreted.
 */
public final class SignedCertificateTimestamp {
    /** Where an SCT was found. It is not encoded in the SCT itself. */
    public enum Origin {
        EMBEDDED,
        TLS_EXTENSION
    }

    private static final int VERSION_V1 = 0;
    private static final int LOG_ID_LENGTH = 32;
    private static final int TIMESTAMP_LENGTH = 8;
    // version, log id, timestamp, extensions length and an empty signature's two length bytes
    private static final int MIN_SCT_LENGTH = 1 + LOG_ID_LENGTH + TIMESTAMP_LENGTH + 2 + 2;

    private final Instant timestamp;
    private final byte[] logId;
    private final Origin origin;

    public SignedCertificateTimestamp(Instant timestamp, byte[] logId, Origin origin) {
        Preconditions.checkNotNull(logId, "logId == null");
        Preconditions.checkArgument(logId.length == LOG_ID_LENGTH,
                "log id must be 32 bytes, got %s", logId.length);
        this.timestamp = Preconditions.checkNotNull(timestamp, "timestamp == null");
        this.logId = logId.clone();
        this.origin = Preconditions.checkNotNull(origin, "origin == null");
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public byte[] getLogId() {
        return logId.clone();
    }

    public Origin getOrigin() {
        return origin;
    }

    /**
     * Decode a TLS encoded SignedCertificateTimestamp structure.
     *
     * @throws SerializationException if {@code input} is shorter than the smallest possible SCT
     *     or is not a version 1 SCT
     */
    public static SignedCertificateTimestamp decode(byte[] input, Origin origin)
            throws SerializationException {
        if (input.length < MIN_SCT_LENGTH) {
            throw new SerializationException("SCT too short: " + input.length + " bytes");
        }
        ByteReader in = new ByteReader(input);
        int version = (int) in.readUnsigned(1);
        if (version != VERSION_V1) {
            throw new SerializationException("Unsupported SCT version " + version);
        }
        byte[] logId = in.readBytes(LOG_ID_LENGTH);
        long millis = in.readUnsigned(TIMESTAMP_LENGTH);
        return new SignedCertificateTimestamp(Instant.ofEpochMilli(millis), logId, origin);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SignedCertificateTimestamp)) {
            return false;
        }
        SignedCertificateTimestamp that = (SignedCertificateTimestamp) o;
        return timestamp.equals(that.timestamp) && Arrays.equals(logId, that.logId)
                && origin == that.origin;
    }

    @Override
    public int hashCode() {
        int result = timestamp.hashCode();
        result = 31 * result + Arrays.hashCode(logId);
        return 31 * result + origin.hashCode();
    }

    @Override
    public String toString() {
        return "SCT{" + origin + " @ " + timestamp + "}";
    }
}
