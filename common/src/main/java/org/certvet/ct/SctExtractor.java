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

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collects the SignedCertificateTimestamps a server presents for its certificate, either in
 * the TLS {@code signed_certificate_timestamp} extension or embedded in the leaf certificate.
 *
 * <p>Extraction never fails: SCTs which cannot be decoded are skipped.
 */
public final class SctExtractor {
    private static final Logger logger = Logger.getLogger(SctExtractor.class.getName());

    private static final String X509_SCT_LIST_OID = "1.3.6.1.4.1.11129.2.4.2";
    private static final int SCT_LIST_LENGTH_BYTES = 2;
    private static final int SERIALIZED_SCT_LENGTH_BYTES = 2;

    private SctExtractor() {}

    /**
     * Returns the SCTs from the TLS extension followed by the ones embedded in {@code leaf}.
     *
     * @param tlsSctBlobs individually serialized SCTs from the TLS handshake, may be {@code null}
     */
    public static List<SignedCertificateTimestamp> extract(
            X509Certificate leaf, List<byte[]> tlsSctBlobs) {
        List<SignedCertificateTimestamp> scts = new ArrayList<SignedCertificateTimestamp>();
        if (tlsSctBlobs != null) {
            scts.addAll(fromTlsExtension(tlsSctBlobs));
        }
        if (leaf != null) {
            scts.addAll(fromCertificate(leaf));
        }
        return scts;
    }

    /**
     * Decodes SCTs received individually in the TLS handshake.
     */
    public static List<SignedCertificateTimestamp> fromTlsExtension(List<byte[]> blobs) {
        List<SignedCertificateTimestamp> scts = new ArrayList<SignedCertificateTimestamp>();
        for (byte[] blob : blobs) {
            SignedCertificateTimestamp sct =
                    decodeOrNull(blob, SignedCertificateTimestamp.Origin.TLS_EXTENSION);
            if (sct != null) {
                scts.add(sct);
            }
        }
        return scts;
    }

    /**
     * Decodes the body of a TLS {@code signed_certificate_timestamp} extension, a
     * SignedCertificateTimestampList as described by RFC 6962 section 3.3.
     */
    public static List<SignedCertificateTimestamp> fromTlsExtensionList(byte[] data) {
        if (data == null) {
            return Collections.emptyList();
        }
        return readSctList(new ByteReader(data), SignedCertificateTimestamp.Origin.TLS_EXTENSION);
    }

    /**
     * Extracts the SCTs embedded in {@code cert}'s SCT list extension.
     *
     * <p>If the certificate has no such extension, or the extension is not a well formed octet
     * string, an empty list is returned.
     */
    public static List<SignedCertificateTimestamp> fromCertificate(X509Certificate cert) {
        byte[] extData = cert.getExtensionValue(X509_SCT_LIST_OID);
        if (extData == null) {
            return Collections.emptyList();
        }

        ByteReader list;
        try {
            // getExtensionValue wraps the extnValue OCTET STRING, which wraps the TLS list.
            list = new ByteReader(extData).readDerOctetString().readDerOctetString();
        } catch (SerializationException e) {
            logger.log(Level.FINE, "Ignoring malformed SCT list extension", e);
            return Collections.emptyList();
        }
        return readSctList(list, SignedCertificateTimestamp.Origin.EMBEDDED);
    }

    /*
     * Individual entries which fail to decode are skipped. A list whose declared length exceeds
     * the data yields nothing; an entry running past the end of the list stops reading but
     * keeps the entries decoded so far.
     */
    private static List<SignedCertificateTimestamp> readSctList(
            ByteReader input, SignedCertificateTimestamp.Origin origin) {
        List<SignedCertificateTimestamp> scts = new ArrayList<SignedCertificateTimestamp>();
        ByteReader list;
        try {
            list = input.readPrefixed(SCT_LIST_LENGTH_BYTES);
        } catch (SerializationException e) {
            logger.log(Level.FINE, "Unreadable SCT list header", e);
            return scts;
        }

        while (list.hasRemaining()) {
            byte[] entry;
            try {
                entry = list.readPrefixed(SERIALIZED_SCT_LENGTH_BYTES).readRemaining();
            } catch (SerializationException e) {
                logger.log(Level.FINE, "Truncated SCT list, keeping " + scts.size() + " SCTs", e);
                break;
            }
            SignedCertificateTimestamp sct = decodeOrNull(entry, origin);
            if (sct != null) {
                scts.add(sct);
            }
        }
        return scts;
    }

    private static SignedCertificateTimestamp decodeOrNull(
            byte[] encoded, SignedCertificateTimestamp.Origin origin) {
        try {
            return SignedCertificateTimestamp.decode(encoded, origin);
        } catch (SerializationException e) {
            logger.log(Level.FINE, "Skipping undecodable SCT", e);
            return null;
        }
    }
}
