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

import java.time.Instant;
import org.certvet.ct.SignedCertificateTimestamp;

/**
 * Evaluates the date constraints of the root a chain verified to.
 */
final class ConstraintChecker {
    private ConstraintChecker() {}

    /**
     * Returns a description of the first violated constraint, checked in the order issuance
     * cutoff, distrust date, SCT deadline, or {@code null} if the chain satisfies them all.
     */
    static String check(CertChain chain, Constraints constraints, Instant now) {
        if (constraints.isEmpty()) {
            return null;
        }

        Instant notBeforeMax = constraints.getNotBeforeMax();
        if (notBeforeMax != null) {
            Instant issued = chain.getLeaf().getNotBefore().toInstant();
            if (issued.isAfter(notBeforeMax)) {
                return String.format("certificate issued after trust cutoff (%s > %s)",
                        Constraints.formatDate(issued), Constraints.formatDate(notBeforeMax));
            }
        }

        Instant distrustDate = constraints.getDistrustDate();
        if (distrustDate != null && now.isAfter(distrustDate)) {
            return String.format("CA distrusted since %s", Constraints.formatDate(distrustDate));
        }

        Instant sctNotAfter = constraints.getSctNotAfter();
        if (sctNotAfter != null) {
            if (chain.getScts().isEmpty()) {
                return String.format("SCT required but none found (deadline: %s)",
                        Constraints.formatDate(sctNotAfter));
            }
            for (SignedCertificateTimestamp sct : chain.getScts()) {
                if (!sct.getTimestamp().isAfter(sctNotAfter)) {
                    return null;
                }
            }
            return String.format("all SCTs issued after deadline (%s)",
                    Constraints.formatDate(sctNotAfter));
        }
        return null;
    }
}
