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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import javax.security.auth.x500.X500Principal;
import org.certvet.testing.TestCertificates;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TrustStoreTest {
    private static Fingerprint fp(int fill) {
        byte[] b = new byte[32];
        Arrays.fill(b, (byte) fill);
        return Fingerprint.fromBytes(b);
    }

    @Test
    public void builderKeepsOrderAndDropsDuplicates() {
        Constraints c = new Constraints(null, Instant.parse("2025-01-01T00:00:00Z"), null);
        TrustStore store = TrustStore.builder(Platform.WINDOWS, "11")
                .addRoot(fp(3))
                .addRoot(fp(1), c)
                .addRoot(fp(3))
                .addRoot(fp(2), Constraints.NONE)
                .build();

        assertEquals(Arrays.asList(fp(3), fp(1), fp(2)), store.getFingerprints());
        assertEquals(c, store.getConstraints(fp(1)));
        assertSame(Constraints.NONE, store.getConstraints(fp(2)));
        assertEquals(Collections.singletonMap(fp(1), c), store.getAllConstraints());
        assertEquals(new PlatformVersion(Platform.WINDOWS, "11"), store.getPlatformVersion());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void fingerprintsAreUnmodifiable() {
        TrustStore.builder(Platform.IOS, "17").addRoot(fp(1)).build().getFingerprints().clear();
    }

    @Test
    public void certChainHost() {
        X509Certificate cert = TestCertificates.root("Chain Host").getCertificate();
        assertEquals("example.com", new CertChain("example.com", cert, null, null).getHost());
        assertEquals("example.com",
                new CertChain("example.com:8443", cert, null, null).getHost());
        assertEquals("2001:db8::1", new CertChain("[2001:db8::1]:443", cert, null, null)
                .getHost());
        assertEquals("2001:db8::1", new CertChain("2001:db8::1", cert, null, null).getHost());
    }

    @Test
    public void displayNames() {
        assertEquals("Chain Host",
                Names.displayName(TestCertificates.root("Chain Host").getCertificate()));
        assertEquals("Example Org", Names.displayName(TestCertificates.builder()
                .subject("O=Example Org, C=US").ca(true).build().getCertificate()));
        assertEquals("", Names.displayName(TestCertificates.builder()
                .subject("C=US").ca(true).build().getCertificate()));
        assertEquals("First", Names.firstAttribute(
                new X500Principal("CN=Second, OU=Unit, CN=First"), "CN"));
    }
}
