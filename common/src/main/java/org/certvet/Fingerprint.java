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

package org.certvet;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Arrays;

/**
 * SHA-256 fingerprint of a DER encoded certificate, used as the identity of a certificate
 * throughout the trust stores.
 *
 * <p>The canonical text form is 32 upper case hex pairs separated by colons, for example
 * {@code "D7:A7:A0:FB:...:5D"}. Instances are immutable and compare byte for byte.
 */
public final class Fingerprint {
    /** Number of octets in a SHA-256 digest. */
    public static final int LENGTH = 32;

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();
    private static final String SEPARATORS = ":- ";

    // Length of "AA:BB:...:FF" with exactly one separator between pairs.
    private static final int SEPARATED_LENGTH = LENGTH * 3 - 1;

    private final byte[] bytes;

    private Fingerprint(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Parses a fingerprint from its text form.
     *
     * <p>Two formats are accepted after trimming surrounding whitespace: 64 contiguous hex
     * characters, or 32 hex pairs joined by a single separator ({@code ':'}, {@code '-'} or
     * {@code ' '}) which must be the same throughout. Anything else, including doubled, leading,
     * trailing or mixed separators, is rejected.
     *
     * @throws FingerprintFormatException if {@code input} is not in one of the accepted formats
     */
    public static Fingerprint parse(String input) throws FingerprintFormatException {
        if (input == null) {
            throw new FingerprintFormatException("empty fingerprint");
        }
        String s = input.trim();
        if (s.isEmpty()) {
            throw new FingerprintFormatException("empty fingerprint");
        }

        byte[] result = new byte[LENGTH];
        if (s.length() == LENGTH * 2) {
            for (int i = 0; i < LENGTH; i++) {
                result[i] = decodePair(s, i * 2);
            }
            return new Fingerprint(result);
        }

        if (s.length() != SEPARATED_LENGTH) {
            throw invalidFormat();
        }
        char separator = s.charAt(2);
        if (SEPARATORS.indexOf(separator) < 0) {
            throw invalidFormat();
        }
        for (int i = 0; i < LENGTH; i++) {
            int offset = i * 3;
            result[i] = decodePair(s, offset);
            if (i < LENGTH - 1 && s.charAt(offset + 2) != separator) {
                throw invalidFormat();
            }
        }
        return new Fingerprint(result);
    }

    /**
     * Returns the fingerprint of {@code cert}, that is the SHA-256 digest of its DER encoding.
     */
    public static Fingerprint of(X509Certificate cert) throws CertificateEncodingException {
        return ofEncoded(cert.getEncoded());
    }

    /**
     * Returns the SHA-256 fingerprint of a DER encoded certificate.
     */
    public static Fingerprint ofEncoded(byte[] der) {
        try {
            return new Fingerprint(MessageDigest.getInstance("SHA-256").digest(der));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Wraps an existing 32 byte digest.
     *
     * @throws IllegalArgumentException if {@code digest} is not exactly 32 bytes long
     */
    public static Fingerprint fromBytes(byte[] digest) {
        Preconditions.checkNotNull(digest, "digest == null");
        Preconditions.checkArgument(digest.length == LENGTH,
                "fingerprint must be 32 bytes, got %s", digest.length);
        return new Fingerprint(digest.clone());
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * Returns the first {@code octets} pairs followed by {@code "..."}, for abbreviated display.
     * Non-positive values give an empty string and values of 32 or more give the full form.
     */
    public String truncate(int octets) {
        if (octets <= 0) {
            return "";
        }
        if (octets >= LENGTH) {
            return toString();
        }
        return format(octets) + "...";
    }

    private String format(int octets) {
        StringBuilder sb = new StringBuilder(octets * 3);
        for (int i = 0; i < octets; i++) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(HEX_DIGITS[(bytes[i] >> 4) & 0xf]);
            sb.append(HEX_DIGITS[bytes[i] & 0xf]);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Fingerprint)) {
            return false;
        }
        return Arrays.equals(bytes, ((Fingerprint) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return format(LENGTH);
    }

    private static byte decodePair(String s, int offset) throws FingerprintFormatException {
        int hi = hexValue(s.charAt(offset));
        int lo = hexValue(s.charAt(offset + 1));
        if (hi < 0 || lo < 0) {
            throw invalidFormat();
        }
        return (byte) ((hi << 4) | lo);
    }

    // Character.digit accepts non-ASCII digits, which must not pass here.
    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private static FingerprintFormatException invalidFormat() {
        return new FingerprintFormatException("invalid fingerprint format: must be 64 hex chars "
                + "or 32 hex pairs with consistent separator");
    }
}
