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

import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A {@link CertificateRegistry} backed by an immutable map.
 */
public final class DefaultCertificateRegistry implements CertificateRegistry {
    private final Map<Fingerprint, X509Certificate> certificates;

    public DefaultCertificateRegistry(Map<Fingerprint, X509Certificate> certificates) {
        Preconditions.checkNotNull(certificates, "certificates == null");
        this.certificates = Collections.unmodifiableMap(
                new HashMap<Fingerprint, X509Certificate>(certificates));
    }

    @Override
    public X509Certificate lookup(Fingerprint fingerprint) {
        return certificates.get(fingerprint);
    }

    public int size() {
        return certificates.size();
    }
}
