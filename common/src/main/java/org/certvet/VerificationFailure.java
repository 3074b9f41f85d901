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
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.PKIXReason;

/**
 * Categories of chain verification failure, with the message reported for each.
 */
public enum VerificationFailure {
    UNKNOWN_AUTHORITY("certificate signed by unknown authority"),
    EXPIRED("certificate has expired or is not yet valid"),
    NOT_AUTHORIZED_TO_SIGN("certificate is not authorized to sign other certificates"),
    TOO_MANY_INTERMEDIATES("too many intermediates for path length constraint"),
    INCOMPATIBLE_USAGE("certificate specifies an incompatible key usage"),
    NAME_MISMATCH("issuer name does not match subject"),
    CA_NOT_AUTHORIZED_FOR_NAME("CA is not authorized for this name"),
    HOSTNAME_MISMATCH("certificate is not valid for %s");

    private final String message;

    VerificationFailure(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public static String hostnameMismatch(String host) {
        return String.format(HOSTNAME_MISMATCH.message, host);
    }

    /**
     * Maps a path building or validation error to a category by inspecting it and its causes.
     *
     * @return the category, or {@code null} if none applies
     */
    public static VerificationFailure classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof CertificateExpiredException
                    || t instanceof CertificateNotYetValidException) {
                return EXPIRED;
            }
            if (!(t instanceof CertPathValidatorException)) {
                continue;
            }
            CertPathValidatorException.Reason reason =
                    ((CertPathValidatorException) t).getReason();
            if (reason == CertPathValidatorException.BasicReason.EXPIRED
                    || reason == CertPathValidatorException.BasicReason.NOT_YET_VALID) {
                return EXPIRED;
            }
            if (reason instanceof PKIXReason) {
                switch ((PKIXReason) reason) {
                    case NO_TRUST_ANCHOR:
                        return UNKNOWN_AUTHORITY;
                    case NOT_CA_CERT:
                        return NOT_AUTHORIZED_TO_SIGN;
                    case PATH_TOO_LONG:
                        return TOO_MANY_INTERMEDIATES;
                    case INVALID_KEY_USAGE:
                        return INCOMPATIBLE_USAGE;
                    case NAME_CHAINING:
                        return NAME_MISMATCH;
                    case INVALID_NAME:
                        return CA_NOT_AUTHORIZED_FOR_NAME;
                    default:
                        break;
                }
            }
        }
        return null;
    }

    /**
     * Returns the message for {@code error}'s category, or its own message if it has none.
     */
    public static String describe(Throwable error) {
        VerificationFailure failure = classify(error);
        if (failure != null) {
            return failure.message;
        }
        if (error.getMessage() != null) {
            return error.getMessage();
        }
        return error.getClass().getName();
    }
}
