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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.certvet.ct.SignedCertificateTimestamp;
import org.certvet.testing.IssuedCertificate;
import org.certvet.testing.TestCertificates;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ChainValidatorTest {
    private static IssuedCertificate root;
    private static IssuedCertificate otherRoot;
    private static IssuedCertificate intermediate;
    private static IssuedCertificate leaf;
    private static Fingerprint rootFingerprint;
    private static Fingerprint otherRootFingerprint;

    private Instant now;
    private Clock clock;
    private DefaultCertificateRegistry registry;

    @BeforeClass
    public static void setUpCertificates() throws Exception {
        root = TestCertificates.root("Test Root");
        otherRoot = TestCertificates.root("Other Root");
        intermediate = TestCertificates.intermediate("Test Intermediate", root);
        leaf = TestCertificates.leaf("www.example.com", intermediate);
        rootFingerprint = Fingerprint.of(root.getCertificate());
        otherRootFingerprint = Fingerprint.of(otherRoot.getCertificate());
    }

    @Before
    public void setUp() {
        now = Instant.now();
        clock = Clock.fixed(now, ZoneOffset.UTC);
        Map<Fingerprint, X509Certificate> certs = new HashMap<Fingerprint, X509Certificate>();
        certs.put(rootFingerprint, root.getCertificate());
        certs.put(otherRootFingerprint, otherRoot.getCertificate());
        registry = new DefaultCertificateRegistry(certs);
    }

    private ChainValidator validator() {
        return ChainValidator.builder(registry).setClock(clock).build();
    }

    private static CertChain chain(IssuedCertificate leafCert, IssuedCertificate... rest) {
        List<X509Certificate> intermediates = new ArrayList<X509Certificate>();
        for (IssuedCertificate c : rest) {
            intermediates.add(c.getCertificate());
        }
        return new CertChain("www.example.com", leafCert.getCertificate(), intermediates, null);
    }

    private static TrustStore store(String version, Fingerprint... roots) {
        TrustStore.Builder builder = TrustStore.builder(Platform.IOS, version);
        for (Fingerprint fp : roots) {
            builder.addRoot(fp);
        }
        return builder.build();
    }

    private static TrustStore constrainedStore(Constraints constraints) {
        return TrustStore.builder(Platform.WINDOWS, "11")
                .addRoot(rootFingerprint, constraints)
                .build();
    }

    private TrustResult validateOne(CertChain chain, TrustStore store) throws Exception {
        List<TrustResult> results = validator().validate(chain, Collections.singletonList(store));
        assertEquals(1, results.size());
        return results.get(0);
    }

    @Test
    public void trustedThroughIntermediate() throws Exception {
        TrustResult result = validateOne(chain(leaf, intermediate), store("17", rootFingerprint));

        assertTrue(result.getFailureReason(), result.isTrusted());
        assertEquals("Test Root", result.getMatchedCa());
        assertEquals("", result.getFailureReason());
        assertEquals(Arrays.asList(leaf.getCertificate(), intermediate.getCertificate(),
                root.getCertificate()), result.getVerifiedChain());
    }

    @Test
    public void serverSentRootIsAccepted() throws Exception {
        TrustResult result = validateOne(
                chain(leaf, intermediate, root), store("17", rootFingerprint));
        assertTrue(result.getFailureReason(), result.isTrusted());
        assertEquals(3, result.getVerifiedChain().size());
    }

    @Test
    public void unknownAuthority() throws Exception {
        TrustResult result =
                validateOne(chain(leaf, intermediate), store("17", otherRootFingerprint));

        assertFalse(result.isTrusted());
        assertEquals("certificate signed by unknown authority", result.getFailureReason());
        assertEquals("", result.getMatchedCa());
        assertTrue(result.getVerifiedChain().isEmpty());
    }

    @Test
    public void missingIntermediateIsUnknownAuthority() throws Exception {
        TrustResult result = validateOne(chain(leaf), store("17", rootFingerprint));
        assertEquals("certificate signed by unknown authority", result.getFailureReason());
    }

    @Test
    public void noResolvableRoots() throws Exception {
        Fingerprint unknown = Fingerprint.fromBytes(new byte[32]);
        TrustResult result = validateOne(chain(leaf, intermediate), store("17", unknown));

        assertFalse(result.isTrusted());
        assertEquals("no valid root certificates in trust store", result.getFailureReason());
    }

    @Test
    public void rootKnownOnlyByFingerprint() throws Exception {
        registry = new DefaultCertificateRegistry(Collections.singletonMap(
                otherRootFingerprint, otherRoot.getCertificate()));

        TrustResult result = validateOne(chain(leaf, intermediate, root),
                store("17", rootFingerprint, otherRootFingerprint));

        assertFalse(result.isTrusted());
        assertEquals("chain roots at known CA (fingerprint " + rootFingerprint
                + ") but certificate data unavailable", result.getFailureReason());
    }

    @Test
    public void expiredLeaf() throws Exception {
        IssuedCertificate expired = TestCertificates.builder()
                .subject("CN=www.example.com")
                .addSubjectAltNameDnsName("www.example.com")
                .validity(now.minus(Duration.ofDays(30)), now.minus(Duration.ofDays(1)))
                .issuer(intermediate)
                .build();

        TrustResult result =
                validateOne(chain(expired, intermediate), store("17", rootFingerprint));

        assertEquals(VerificationFailure.EXPIRED.getMessage(), result.getFailureReason());
    }

    @Test
    public void intermediateWithoutBasicConstraints() throws Exception {
        IssuedCertificate notCa = TestCertificates.builder()
                .subject("CN=Not A CA")
                .keyUsage(KeyUsage.keyCertSign | KeyUsage.digitalSignature)
                .issuer(root)
                .build();
        IssuedCertificate leafUnderNotCa = TestCertificates.leaf("www.example.com", notCa);

        TrustResult result =
                validateOne(chain(leafUnderNotCa, notCa), store("17", rootFingerprint));

        assertEquals(VerificationFailure.NOT_AUTHORIZED_TO_SIGN.getMessage(),
                result.getFailureReason());
    }

    @Test
    public void pathLengthExceeded() throws Exception {
        IssuedCertificate constrained = TestCertificates.builder()
                .subject("CN=Constrained Intermediate")
                .ca(true)
                .pathLength(0)
                .issuer(root)
                .build();
        IssuedCertificate nested = TestCertificates.intermediate("Nested", constrained);
        IssuedCertificate deepLeaf = TestCertificates.leaf("www.example.com", nested);

        TrustResult result = validateOne(
                chain(deepLeaf, nested, constrained), store("17", rootFingerprint));

        assertEquals(VerificationFailure.TOO_MANY_INTERMEDIATES.getMessage(),
                result.getFailureReason());
    }

    @Test
    public void nameConstrainedIntermediate() throws Exception {
        IssuedCertificate constrained = TestCertificates.builder()
                .subject("CN=Example Org Only")
                .ca(true)
                .addPermittedDnsName("example.org")
                .issuer(root)
                .build();
        IssuedCertificate outside = TestCertificates.leaf("www.example.com", constrained);

        TrustResult result =
                validateOne(chain(outside, constrained), store("17", rootFingerprint));

        assertEquals(VerificationFailure.CA_NOT_AUTHORIZED_FOR_NAME.getMessage(),
                result.getFailureReason());
    }

    @Test
    public void reissuedRootWithSameKeyAnchorsExistingChains() throws Exception {
        IssuedCertificate reissued = TestCertificates.builder()
                .subject("CN=Test Root")
                .ca(true)
                .keyPair(root.getKeyPair())
                .serialNumber(BigInteger.valueOf(2))
                .validity(now.minus(Duration.ofDays(2)), now.plus(Duration.ofDays(3650)))
                .build();
        Fingerprint reissuedFingerprint = Fingerprint.of(reissued.getCertificate());
        registry = new DefaultCertificateRegistry(Collections.singletonMap(
                reissuedFingerprint, reissued.getCertificate()));

        TrustResult result =
                validateOne(chain(leaf, intermediate), store("17", reissuedFingerprint));

        assertTrue(result.getFailureReason(), result.isTrusted());
        assertEquals(reissued.getCertificate(), result.getVerifiedChain().get(2));
    }

    @Test(timeout = 5000)
    public void selfIssuedIntermediatesWithSharedNameAreNotPermuted() throws Exception {
        IssuedCertificate[] loops = new IssuedCertificate[12];
        for (int i = 0; i < loops.length; i++) {
            loops[i] = TestCertificates.root("Loop");
        }
        IssuedCertificate loopLeaf = TestCertificates.leaf("www.example.com", loops[5]);

        TrustResult result =
                validateOne(chain(loopLeaf, loops), store("17", otherRootFingerprint));

        assertFalse(result.isTrusted());
        assertEquals("certificate signed by unknown authority", result.getFailureReason());
    }

    @Test(timeout = 5000)
    public void mutuallyIssuingIntermediatesExhaustSignatureBudget() throws Exception {
        KeyPair shared = TestCertificates.generateKeyPair();
        IssuedCertificate a0 = TestCertificates.builder()
                .subject("CN=Ping").ca(true).keyPair(shared).build();
        IssuedCertificate b0 = TestCertificates.builder()
                .subject("CN=Pong").ca(true).keyPair(shared).build();
        List<IssuedCertificate> sent = new ArrayList<IssuedCertificate>();
        for (int i = 0; i < 6; i++) {
            sent.add(TestCertificates.builder().subject("CN=Ping").ca(true).keyPair(shared)
                    .issuer(b0).serialNumber(BigInteger.valueOf(100 + i)).build());
            sent.add(TestCertificates.builder().subject("CN=Pong").ca(true).keyPair(shared)
                    .issuer(a0).serialNumber(BigInteger.valueOf(200 + i)).build());
        }
        IssuedCertificate pingLeaf = TestCertificates.leaf("www.example.com", a0);

        TrustResult result = validateOne(
                chain(pingLeaf, sent.toArray(new IssuedCertificate[0])),
                store("17", rootFingerprint));

        assertFalse(result.isTrusted());
        assertEquals("path building exceeded 100 signature checks", result.getFailureReason());
    }

    @Test
    public void clientOnlyLeafIsRejected() throws Exception {
        IssuedCertificate clientLeaf = TestCertificates.builder()
                .subject("CN=client")
                .addExtendedKeyUsage(KeyPurposeId.id_kp_clientAuth, false)
                .issuer(intermediate)
                .build();

        TrustResult result =
                validateOne(chain(clientLeaf, intermediate), store("17", rootFingerprint));

        assertEquals(VerificationFailure.INCOMPATIBLE_USAGE.getMessage(),
                result.getFailureReason());
    }

    @Test
    public void leafWithoutExtendedKeyUsageIsAccepted() throws Exception {
        IssuedCertificate plain = TestCertificates.builder()
                .subject("CN=www.example.com")
                .issuer(intermediate)
                .build();
        assertTrue(validateOne(chain(plain, intermediate), store("17", rootFingerprint))
                .isTrusted());
    }

    @Test
    public void leafThatIsItselfARoot() throws Exception {
        TrustResult result = validateOne(chain(root), store("17", rootFingerprint));
        assertTrue(result.getFailureReason(), result.isTrusted());
        assertEquals(Collections.singletonList(root.getCertificate()),
                result.getVerifiedChain());
    }

    @Test
    public void distrustedRoot() throws Exception {
        Instant distrust = now.minus(Duration.ofDays(1));
        TrustResult result = validateOne(chain(leaf, intermediate),
                constrainedStore(new Constraints(null, distrust, null)));

        assertFalse(result.isTrusted());
        assertEquals("CA distrusted since " + Constraints.formatDate(distrust),
                result.getFailureReason());
        assertEquals("Test Root", result.getMatchedCa());
        assertEquals(3, result.getVerifiedChain().size());
    }

    @Test
    public void distrustDateInTheFuture() throws Exception {
        TrustResult result = validateOne(chain(leaf, intermediate),
                constrainedStore(new Constraints(null, now.plus(Duration.ofDays(1)), null)));
        assertTrue(result.getFailureReason(), result.isTrusted());
    }

    @Test
    public void sctRequiredButAbsent() throws Exception {
        Instant deadline = now.plus(Duration.ofDays(10));
        TrustResult result = validateOne(chain(leaf, intermediate),
                constrainedStore(new Constraints(null, null, deadline)));

        assertEquals("SCT required but none found (deadline: "
                + Constraints.formatDate(deadline) + ")", result.getFailureReason());
    }

    @Test
    public void sctAtDeadlineSatisfiesConstraint() throws Exception {
        Instant deadline = now.minus(Duration.ofDays(10));
        SignedCertificateTimestamp sct = new SignedCertificateTimestamp(
                deadline, new byte[32], SignedCertificateTimestamp.Origin.EMBEDDED);
        CertChain withSct = new CertChain("www.example.com", leaf.getCertificate(),
                Collections.singletonList(intermediate.getCertificate()),
                Collections.singletonList(sct));

        TrustResult result =
                validateOne(withSct, constrainedStore(new Constraints(null, null, deadline)));

        assertTrue(result.getFailureReason(), result.isTrusted());
    }

    @Test
    public void resultsFollowStoreOrderAndAreIndependent() throws Exception {
        Fingerprint unknown = Fingerprint.fromBytes(new byte[32]);
        List<TrustStore> stores = new ArrayList<TrustStore>();
        for (int i = 0; i < 12; i++) {
            stores.add(i % 3 == 0
                    ? store(Integer.toString(i), rootFingerprint)
                    : i % 3 == 1 ? store(Integer.toString(i), otherRootFingerprint)
                                 : store(Integer.toString(i), unknown));
        }

        List<TrustResult> results = ChainValidator.builder(registry)
                .setClock(clock)
                .setParallelism(4)
                .build()
                .validate(chain(leaf, intermediate), stores);

        assertEquals(stores.size(), results.size());
        for (int i = 0; i < results.size(); i++) {
            TrustResult r = results.get(i);
            assertEquals(stores.get(i).getPlatformVersion(), r.getPlatformVersion());
            assertEquals(Integer.toString(i), i % 3 == 0, r.isTrusted());
        }
        assertEquals("no valid root certificates in trust store",
                results.get(2).getFailureReason());
    }

    @Test
    public void hostnameVerification() throws Exception {
        CertChain wrongHost = new CertChain("other.example.com:8443", leaf.getCertificate(),
                Collections.singletonList(intermediate.getCertificate()), null);
        ChainValidator strict =
                ChainValidator.builder(registry).setClock(clock).setHostnameVerification(true)
                        .build();

        TrustResult result =
                strict.validate(wrongHost, Collections.singletonList(store("17", rootFingerprint)))
                        .get(0);
        assertEquals("certificate is not valid for other.example.com", result.getFailureReason());

        assertTrue(validateOne(wrongHost, store("17", rootFingerprint)).isTrusted());
        assertTrue(strict.validate(chain(leaf, intermediate),
                Collections.singletonList(store("17", rootFingerprint))).get(0).isTrusted());
    }

    @Test
    public void emptyStoreList() throws Exception {
        assertTrue(validator()
                .validate(chain(leaf, intermediate), Collections.<TrustStore>emptyList())
                .isEmpty());
    }

    @Test
    public void usesSuppliedRegistryAndExecutor() throws Exception {
        CertificateRegistry mockRegistry = mock(CertificateRegistry.class);
        when(mockRegistry.lookup(any(Fingerprint.class))).thenReturn(root.getCertificate());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            List<TrustResult> results = ChainValidator.builder(mockRegistry)
                    .setClock(clock)
                    .setExecutor(executor)
                    .build()
                    .validate(chain(leaf, intermediate),
                            Arrays.asList(store("16", rootFingerprint),
                                    store("17", rootFingerprint)));

            assertTrue(results.get(0).isTrusted());
            assertTrue(results.get(1).isTrusted());
            verify(mockRegistry, atLeastOnce()).lookup(rootFingerprint);
            assertFalse(executor.isShutdown());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveParallelism() {
        ChainValidator.builder(registry).setParallelism(0);
    }
}
