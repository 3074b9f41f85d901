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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All per-store results of one validation run, with what is needed to present them.
 */
public final class ValidationReport {
    private final CertChain chain;
    private final Instant timestamp;
    private final String toolVersion;
    private final List<TrustResult> results;

    public ValidationReport(CertChain chain, Instant timestamp, String toolVersion,
            List<TrustResult> results) {
        this.chain = Preconditions.checkNotNull(chain, "chain == null");
        this.timestamp = Preconditions.checkNotNull(timestamp, "timestamp == null");
        this.toolVersion = toolVersion == null ? "" : toolVersion;
        this.results = Collections.unmodifiableList(new ArrayList<TrustResult>(results));
    }

    public String getEndpoint() {
        return chain.getEndpoint();
    }

    public CertChain getChain() {
        return chain;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getToolVersion() {
        return toolVersion;
    }

    public List<TrustResult> getResults() {
        return results;
    }

    /** True if every store trusted the chain. Vacuously true for no results. */
    public boolean allPassed() {
        for (TrustResult r : results) {
            if (!r.isTrusted()) {
                return false;
            }
        }
        return true;
    }
}
