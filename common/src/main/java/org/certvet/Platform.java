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

import java.util.Locale;

/**
 * Platforms whose root stores are tracked.
 */
public enum Platform {
    IOS("ios"),
    IPADOS("ipados"),
    MACOS("macos"),
    TVOS("tvos"),
    VISIONOS("visionos"),
    WATCHOS("watchos"),
    ANDROID("android"),
    CHROME("chrome"),
    WINDOWS("windows");

    private final String id;

    Platform(String id) {
        this.id = id;
    }

    /**
     * Returns the lower case identifier used in data files, filters and output.
     */
    public String id() {
        return id;
    }

    /**
     * Looks up a platform by identifier, ignoring case.
     *
     * @return the platform, or {@code null} if {@code id} does not name one
     */
    public static Platform lookup(String id) {
        if (id == null) {
            return null;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.id.equals(normalized)) {
                return platform;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return id;
    }
}
