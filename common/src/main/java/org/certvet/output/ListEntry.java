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

package org.certvet.output;

/**
 * One root certificate of one trust store, prepared for display.
 */
public final class ListEntry {
    private final String platform;
    private final String version;
    private final String fingerprint;
    private final String issuer;
    private final String constraints;

    public ListEntry(String platform, String version, String fingerprint, String issuer,
            String constraints) {
        this.platform = platform;
        this.version = version;
        this.fingerprint = fingerprint;
        this.issuer = issuer;
        this.constraints = constraints == null ? "" : constraints;
    }

    public String getPlatform() {
        return platform;
    }

    public String getVersion() {
        return version;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    /** Subject common name or organization of the root, {@code "-"} if the root is unknown. */
    public String getIssuer() {
        return issuer;
    }

    /** For example {@code "DT:2025-04-15,SCT:2025-04-15"}; empty when unconstrained. */
    public String getConstraints() {
        return constraints;
    }
}
