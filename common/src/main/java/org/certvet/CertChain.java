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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.certvet.ct.SignedCertificateTimestamp;

/**
 * A certificate chain as presented by a server, with the SCTs that came with it.
 */
public final class CertChain {
    private final String endpoint;
    private final X509Certificate leaf;
    private final List<X509Certificate> intermediates;
    private final List<SignedCertificateTimestamp> scts;

    /**
     * @param endpoint the {@code host:port} the chain was fetched from
     * @param intermediates the remaining certificates in the order the server sent them
     */
    public CertChain(String endpoint, X509Certificate leaf, List<X509Certificate> intermediates,
            List<SignedCertificateTimestamp> scts) {
        this.endpoint = Preconditions.checkNotNull(endpoint, "endpoint == null");
        this.leaf = Preconditions.checkNotNull(leaf, "leaf == null");
        this.intermediates = intermediates == null
                ? Collections.<X509Certificate>emptyList()
                : Collections.unmodifiableList(new ArrayList<X509Certificate>(intermediates));
        this.scts = scts == null
                ? Collections.<SignedCertificateTimestamp>emptyList()
                : Collections.unmodifiableList(new ArrayList<SignedCertificateTimestamp>(scts));
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * Returns the host part of the endpoint, without port or IPv6 brackets.
     */
    public String getHost() {
        String host = endpoint;
        if (host.startsWith("[")) {
            int end = host.indexOf(']');
            return end > 0 ? host.substring(1, end) : host.substring(1);
        }
        int colon = host.lastIndexOf(':');
        if (colon >= 0 && host.indexOf(':') == colon) {
            host = host.substring(0, colon);
        }
        return host;
    }

    public X509Certificate getLeaf() {
        return leaf;
    }

    public List<X509Certificate> getIntermediates() {
        return intermediates;
    }

    public List<SignedCertificateTimestamp> getScts() {
        return scts;
    }
}
