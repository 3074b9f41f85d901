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

import java.util.Comparator;

/**
 * Identifies one root store snapshot: a platform and one of its versions.
 */
public final class PlatformVersion {
    /** Orders by platform identifier, then by {@link Versions#compare(String, String)}. */
    public static final Comparator<PlatformVersion> ORDER = new Comparator<PlatformVersion>() {
        @Override
        public int compare(PlatformVersion a, PlatformVersion b) {
            int result = a.platform.id().compareTo(b.platform.id());
            if (result != 0) {
                return result;
            }
            return Versions.compare(a.version, b.version);
        }
    };

    private final Platform platform;
    private final String version;

    public PlatformVersion(Platform platform, String version) {
        this.platform = Preconditions.checkNotNull(platform, "platform == null");
        this.version = Preconditions.checkNotNull(version, "version == null");
    }

    public Platform getPlatform() {
        return platform;
    }

    public String getVersion() {
        return version;
    }

    public boolean isCurrent() {
        return Versions.isCurrent(version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlatformVersion)) {
            return false;
        }
        PlatformVersion that = (PlatformVersion) o;
        return platform == that.platform && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return 31 * platform.hashCode() + version.hashCode();
    }

    @Override
    public String toString() {
        return platform.id() + " " + version;
    }
}
