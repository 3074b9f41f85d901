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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The root certificates one platform version trusts, with any constraints it places on them.
 * Instances are immutable; use {@link Builder} to create them.
 */
public final class TrustStore {
    private final PlatformVersion platformVersion;
    private final List<Fingerprint> fingerprints;
    private final Map<Fingerprint, Constraints> constraints;

    private TrustStore(Builder builder) {
        this.platformVersion = new PlatformVersion(builder.platform, builder.version);
        this.fingerprints = Collections.unmodifiableList(
                new ArrayList<Fingerprint>(builder.fingerprints));
        this.constraints = Collections.unmodifiableMap(
                new LinkedHashMap<Fingerprint, Constraints>(builder.constraints));
    }

    public static Builder builder(Platform platform, String version) {
        return new Builder(platform, version);
    }

    public Platform getPlatform() {
        return platformVersion.getPlatform();
    }

    public String getVersion() {
        return platformVersion.getVersion();
    }

    public PlatformVersion getPlatformVersion() {
        return platformVersion;
    }

    /** Trusted roots in the order they were added, without duplicates. */
    public List<Fingerprint> getFingerprints() {
        return fingerprints;
    }

    /**
     * Returns the constraints on the root {@code fingerprint}, or {@link Constraints#NONE} if
     * it has none or is not in this store.
     */
    public Constraints getConstraints(Fingerprint fingerprint) {
        Constraints c = constraints.get(fingerprint);
        return c == null ? Constraints.NONE : c;
    }

    /** Only roots with at least one constraint set appear here. */
    public Map<Fingerprint, Constraints> getAllConstraints() {
        return constraints;
    }

    @Override
    public String toString() {
        return "TrustStore{" + platformVersion + ", " + fingerprints.size() + " roots}";
    }

    public static final class Builder {
        private final Platform platform;
        private final String version;
        private final Set<Fingerprint> fingerprints = new LinkedHashSet<Fingerprint>();
        private final Map<Fingerprint, Constraints> constraints =
                new LinkedHashMap<Fingerprint, Constraints>();

        private Builder(Platform platform, String version) {
            this.platform = Preconditions.checkNotNull(platform, "platform == null");
            this.version = Preconditions.checkNotNull(version, "version == null");
        }

        public Builder addRoot(Fingerprint fingerprint) {
            return addRoot(fingerprint, Constraints.NONE);
        }

        /**
         * Adds a trusted root. Adding the same root again keeps its position and replaces its
         * constraints when the new ones are not empty.
         */
        public Builder addRoot(Fingerprint fingerprint, Constraints rootConstraints) {
            Preconditions.checkNotNull(fingerprint, "fingerprint == null");
            fingerprints.add(fingerprint);
            if (rootConstraints != null && !rootConstraints.isEmpty()) {
                constraints.put(fingerprint, rootConstraints);
            }
            return this;
        }

        public TrustStore build() {
            return new TrustStore(this);
        }
    }
}
