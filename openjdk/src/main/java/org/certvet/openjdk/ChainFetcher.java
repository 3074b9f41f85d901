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

package org.certvet.openjdk;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.security.GeneralSecurityException;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.certvet.CertChain;
import org.certvet.ct.SctExtractor;

/**
 * Fetches a server's certificate chain with a TLS handshake through JSSE.
 *
 * <p>Every chain is accepted during the handshake, trust is decided afterwards against the
 * trust stores. JSSE does not expose SCTs received in the TLS extension, so only the SCTs
 * embedded in the leaf are collected.
 */
public final class ChainFetcher implements ChainSource {
    private static final Logger logger = Logger.getLogger(ChainFetcher.class.getName());

    private final int timeoutMillis;

    public ChainFetcher(int timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    /** Accepts any server chain. */
    static final class AcceptAllTrustManager implements X509TrustManager {
        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {}
    }

    @Override
    public CertChain fetch(Endpoint endpoint) throws IOException {
        SSLContext context;
        try {
            context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {new AcceptAllTrustManager()}, null);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS is not available", e);
        }

        Certificate[] peerCertificates;
        try (Socket rawSocket = new Socket()) {
            rawSocket.connect(
                    new InetSocketAddress(endpoint.getHost(), endpoint.getPort()), timeoutMillis);
            try (SSLSocket socket = (SSLSocket) context.getSocketFactory().createSocket(
                         rawSocket, endpoint.getHost(), endpoint.getPort(), false)) {
                socket.setSoTimeout(timeoutMillis);
                if (!endpoint.isIpLiteral()) {
                    SSLParameters params = socket.getSSLParameters();
                    params.setServerNames(Collections.singletonList(
                            new SNIHostName(endpoint.getHost())));
                    socket.setSSLParameters(params);
                }
                logger.fine("Starting TLS handshake with " + endpoint);
                socket.startHandshake();
                peerCertificates = socket.getSession().getPeerCertificates();
            }
        } catch (SocketTimeoutException e) {
            throw new IOException("TLS connection failed: timed out after " + timeoutMillis
                    + " ms connecting to " + endpoint, e);
        } catch (IOException e) {
            throw new IOException("TLS connection failed: " + e.getMessage(), e);
        }
        return toChain(endpoint, peerCertificates);
    }

    /*
     * The leaf comes first. Some stacks repeat a certificate object back to back, only one
     * copy is kept.
     */
    static CertChain toChain(Endpoint endpoint, Certificate[] peerCertificates)
            throws IOException {
        List<X509Certificate> certs = new ArrayList<X509Certificate>();
        for (int i = 0; i < peerCertificates.length; i++) {
            if (i > 0 && peerCertificates[i].equals(peerCertificates[i - 1])) {
                continue;
            }
            if (peerCertificates[i] instanceof X509Certificate) {
                certs.add((X509Certificate) peerCertificates[i]);
            }
        }
        if (certs.isEmpty()) {
            throw new IOException("no certificates received from " + endpoint);
        }
        X509Certificate leaf = certs.get(0);
        return new CertChain(endpoint.toString(), leaf, certs.subList(1, certs.size()),
                SctExtractor.extract(leaf, null));
    }
}
