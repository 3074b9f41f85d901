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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A dotted numeric platform version such as {@code 17}, {@code 17.4} or {@code 12.1.3}.
 *
 * <p>Parsing is lenient in the way semantic version libraries usually are: an optional leading
 * {@code v}, one to three numeric components with missing ones read as zero, and optional
 * {@code -prerelease} and {@code +build} suffixes. Build metadata does not take part in ordering.
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {
    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?"
            + "(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?"
            + "(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?");

    private final long major;
    private final long minor;
    private final long patch;
    private final String prerelease;
    private final String original;

    private SemanticVersion(long major, long minor, long patch, String prerelease,
            String original) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.prerelease = prerelease;
        this.original = original;
    }

    /**
     * Parses {@code version}, returning {@code null} if it is not a numeric version.
     */
    public static SemanticVersion tryParse(String version) {
        if (version == null) {
            return null;
        }
        Matcher m = VERSION_PATTERN.matcher(version);
        if (!m.matches()) {
            return null;
        }
        try {
            return new SemanticVersion(component(m.group(1)), component(m.group(2)),
                    component(m.group(3)), m.group(4), version);
        } catch (NumberFormatException e) {
            // Component does not fit in a long.
            return null;
        }
    }

    private static long component(String group) {
        return group == null ? 0 : Long.parseLong(group);
    }

    public long getMajor() {
        return major;
    }

    public long getMinor() {
        return minor;
    }

    public long getPatch() {
        return patch;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Long.compare(major, other.major);
        if (result == 0) {
            result = Long.compare(minor, other.minor);
        }
        if (result == 0) {
            result = Long.compare(patch, other.patch);
        }
        if (result == 0) {
            result = comparePrerelease(prerelease, other.prerelease);
        }
        return Integer.signum(result);
    }

    // A version without a prerelease sorts after any prerelease of the same core version.
    private static int comparePrerelease(String a, String b) {
        if (a == null || b == null) {
            if (a == b) {
                return 0;
            }
            return a == null ? 1 : -1;
        }
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        for (int i = 0; i < Math.min(left.length, right.length); i++) {
            int result = compareIdentifier(left[i], right[i]);
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.length, right.length);
    }

    private static int compareIdentifier(String a, String b) {
        boolean aNumeric = isNumeric(a);
        boolean bNumeric = isNumeric(b);
        if (aNumeric && bNumeric) {
            if (a.length() != b.length()) {
                return Integer.compare(a.length(), b.length());
            }
            return a.compareTo(b);
        }
        if (aNumeric != bNumeric) {
            return aNumeric ? -1 : 1;
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) < '0' || s.charAt(i) > '9') {
                return false;
            }
        }
        return !s.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SemanticVersion)) {
            return false;
        }
        return compareTo((SemanticVersion) o) == 0;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(major);
        result = 31 * result + Long.hashCode(minor);
        result = 31 * result + Long.hashCode(patch);
        return 31 * result + (prerelease == null ? 0 : prerelease.hashCode());
    }

    @Override
    public String toString() {
        return original;
    }
}
