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
import static org.junit.Assert.assertNull;

import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.PKIXReason;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class VerificationFailureTest {
    private static CertPathValidatorException withReason(CertPathValidatorException.Reason r) {
        return new CertPathValidatorException("failed", null, null, -1, r);
    }

    @Test
    public void classifiesPkixReasons() {
        assertEquals(VerificationFailure.UNKNOWN_AUTHORITY,
                VerificationFailure.classify(withReason(PKIXReason.NO_TRUST_ANCHOR)));
        assertEquals(VerificationFailure.NOT_AUTHORIZED_TO_SIGN,
                VerificationFailure.classify(withReason(PKIXReason.NOT_CA_CERT)));
        assertEquals(VerificationFailure.TOO_MANY_INTERMEDIATES,
                VerificationFailure.classify(withReason(PKIXReason.PATH_TOO_LONG)));
        assertEquals(VerificationFailure.INCOMPATIBLE_USAGE,
                VerificationFailure.classify(withReason(PKIXReason.INVALID_KEY_USAGE)));
        assertEquals(VerificationFailure.NAME_MISMATCH,
                VerificationFailure.classify(withReason(PKIXReason.NAME_CHAINING)));
        assertEquals(VerificationFailure.CA_NOT_AUTHORIZED_FOR_NAME,
                VerificationFailure.classify(withReason(PKIXReason.INVALID_NAME)));
        assertNull(VerificationFailure.classify(withReason(PKIXReason.INVALID_POLICY)));
    }

    @Test
    public void classifiesValidityErrors() {
        assertEquals(VerificationFailure.EXPIRED, VerificationFailure.classify(
                withReason(CertPathValidatorException.BasicReason.EXPIRED)));
        assertEquals(VerificationFailure.EXPIRED, VerificationFailure.classify(
                withReason(CertPathValidatorException.BasicReason.NOT_YET_VALID)));
        assertEquals(VerificationFailure.EXPIRED,
                VerificationFailure.classify(new CertificateExpiredException("old")));
        assertEquals(VerificationFailure.EXPIRED, VerificationFailure.classify(
                new IllegalStateException(new CertificateNotYetValidException("early"))));
    }

    @Test
    public void describe() {
        assertEquals("certificate signed by unknown authority",
                VerificationFailure.describe(withReason(PKIXReason.NO_TRUST_ANCHOR)));
        assertEquals("boom", VerificationFailure.describe(new RuntimeException("boom")));
        assertEquals(NullPointerException.class.getName(),
                VerificationFailure.describe(new NullPointerException()));
        assertEquals("certificate is not valid for example.com",
                VerificationFailure.hostnameMismatch("example.com"));
    }
}
