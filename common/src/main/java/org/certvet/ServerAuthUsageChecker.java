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

import java.security.cert.CertPathValidatorException;
import java.security.cert.Certificate;
import java.security.cert.CertificateParsingException;
import java.security.cert.PKIXCertPathChecker;
import java.security.cert.PKIXReason;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Requires the end-entity certificate, if it has an extendedKeyUsage extension, to allow TLS
 * server authentication: anyExtendedKeyUsage, serverAuth, or the historical Server Gated
 * Cryptography purposes nsSGC and msSGC.
 */
final class ServerAuthUsageChecker extends PKIXCertPathChecker {
    private static final String EKU_OID = "2.5.29.37";

    private static final Set<String> ACCEPTED_USAGES = Collections.unmodifiableSet(
            new HashSet<String>(Arrays.asList(
                    "2.5.29.37.0",              // anyExtendedKeyUsage
                    "1.3.6.1.5.5.7.3.1",        // serverAuth
                    "2.16.840.1.113730.4.1",    // nsSGC
                    "1.3.6.1.4.1.311.10.3.3"))); // msSGC

    private static final Set<String> SUPPORTED_EXTENSIONS =
            Collections.singleton(EKU_OID);

    private final X509Certificate leaf;

    ServerAuthUsageChecker(X509Certificate leaf) {
        this.leaf = leaf;
    }

    @Override
    public void init(boolean forward) {}

    @Override
    public boolean isForwardCheckingSupported() {
        return true;
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return SUPPORTED_EXTENSIONS;
    }

    @Override
    public void check(Certificate c, Collection<String> unresolvedCritExts)
            throws CertPathValidatorException {
        if (!leaf.equals(c)) {
            return;
        }
        List<String> ekuOids;
        try {
            ekuOids = leaf.getExtendedKeyUsage();
        } catch (CertificateParsingException e) {
            throw new CertPathValidatorException("Malformed extendedKeyUsage", e, null, -1,
                    PKIXReason.INVALID_KEY_USAGE);
        }
        if (ekuOids == null) {
            return;
        }
        for (String ekuOid : ekuOids) {
            if (ACCEPTED_USAGES.contains(ekuOid)) {
                unresolvedCritExts.remove(EKU_OID);
                return;
            }
        }
        throw new CertPathValidatorException(
                "End-entity certificate does not allow server authentication", null, null, -1,
                PKIXReason.INVALID_KEY_USAGE);
    }
}
