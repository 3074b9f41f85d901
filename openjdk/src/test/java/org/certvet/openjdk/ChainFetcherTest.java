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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import org.certvet.CertChain;
import org.certvet.testing.IssuedCertificate;
import org.certvet.testing.SctBytes;
import org.certvet.testing.TestCertificates;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ChainFetcherTest {
    private static IssuedCertificate root;
    private static IssuedCertificate intermediate;
    private static IssuedCertificate leaf;

    @BeforeClass
    public static void setUpCertificates() {
        root = TestCertificates.root("Fetch Root");
        intermediate = TestCertificates.intermediate("Fetch Intermediate", root);
        leaf = TestCertificates.builder()
                .subject("CN=fetch.example.com")
                .addSubjectAltNameDnsName("fetch.example.com")
                .embeddedSctList(SctBytes.list(SctBytes.sct(SctBytes.logId(4), 1234L)))
                .issuer(intermediate)
                .build();
    }

    @Test
    public void toChain_splitsLeafAndDropsRepeats() throws Exception {
        Certificate[] peer = {leaf.getCertificate(), intermediate.getCertificate(),
                intermediate.getCertificate(), root.getCertificate()};

        CertChain chain =
                ChainFetcher.toChain(Endpoint.parse("fetch.example.com:8443"), peer);

        assertEquals("fetch.example.com:8443", chain.getEndpoint());
        assertEquals("fetch.example.com", chain.getHost());
        assertEquals(leaf.getCertificate(), chain.getLeaf());
        assertEquals(Arrays.asList(intermediate.getCertificate(), root.getCertificate()),
                chain.getIntermediates());
        assertEquals(1, chain.getScts().size());
        assertEquals(1234L, chain.getScts().get(0).getTimestamp().toEpochMilli());
    }

    @Test
    public void toChain_requiresCertificates() {
        try {
            ChainFetcher.toChain(Endpoint.parse("empty.example.com"), new Certificate[0]);
            fail();
        } catch (IOException e) {
            assertEquals("no certificates received from empty.example.com", e.getMessage());
        }
    }

    @Test
    public void fetch_refusedConnection() throws Exception {
        int port;
        // Bind and release a port so nothing is listening on it.
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        try {
            new ChainFetcher(2000).fetch(new Endpoint("127.0.0.1", port));
            fail();
        } catch (IOException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("TLS connection failed: "));
        }
    }

    @Test
    public void acceptAllTrustManagerAcceptsAnything() throws Exception {
        ChainFetcher.AcceptAllTrustManager tm = new ChainFetcher.AcceptAllTrustManager();
        tm.checkServerTrusted(new X509Certificate[0], "ECDHE_ECDSA");
        assertEquals(0, tm.getAcceptedIssuers().length);
    }
}
