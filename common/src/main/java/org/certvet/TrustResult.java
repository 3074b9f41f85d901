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

/**
 * Outcome of validating one chain against one trust store.
 *
 * <p>A violated root constraint makes the result untrusted while still reporting the matched CA
 * and the verified path.
 */
public final class TrustResult {
    private final PlatformVersion platformVersion;
    private final boolean trusted;
    private final String matchedCa;
    private final List<X509Certificate> verifiedChain;
    private final String failureReason;

    private TrustResult(PlatformVersion platformVersion, boolean trusted, String matchedCa,
            List<X509Certificate> verifiedChain, String failureReason) {
        this.platformVersion =
                Preconditions.checkNotNull(platformVersion, "platformVersion == null");
        this.trusted = trusted;
        this.matchedCa = matchedCa == null ? "" : matchedCa;
        this.verifiedChain = verifiedChain == null
                ? Collections.<X509Certificate>emptyList()
                : Collections.unmodifiableList(new ArrayList<X509Certificate>(verifiedChain));
        this.failureReason = failureReason == null ? "" : failureReason;
    }

    public static TrustResult trusted(PlatformVersion platformVersion, String matchedCa,
            List<X509Certificate> verifiedChain) {
        return new TrustResult(platformVersion, true, matchedCa, verifiedChain, null);
    }

    public static TrustResult untrusted(PlatformVersion platformVersion, String failureReason) {
        return new TrustResult(platformVersion, false, null, null, failureReason);
    }

    /**
     * An untrusted result for a chain that did verify up to a root, but broke one of that root's
     * constraints.
     */
    public static TrustResult untrusted(PlatformVersion platformVersion, String failureReason,
            String matchedCa, List<X509Certificate> verifiedChain) {
        return new TrustResult(platformVersion, false, matchedCa, verifiedChain, failureReason);
    }

    public PlatformVersion getPlatformVersion() {
        return platformVersion;
    }

    public Platform getPlatform() {
        return platformVersion.getPlatform();
    }

    public String getVersion() {
        return platformVersion.getVersion();
    }

    public boolean isTrusted() {
        return trusted;
    }

    /** Display name of the root the chain verified to, or {@code ""}. */
    public String getMatchedCa() {
        return matchedCa;
    }

    /** Leaf first, root last; empty when no path was found. */
    public List<X509Certificate> getVerifiedChain() {
        return verifiedChain;
    }

    /** Empty for trusted results. */
    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return platformVersion + (trusted ? " PASS " + matchedCa : " FAIL " + failureReason);
    }
}
