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
 * Ordering of platform version strings.
 *
 * <p>Besides dotted numeric versions a store may be labelled {@link #CURRENT}, the rolling
 * release of a platform, which is greater than every numeric version.
 */
public final class Versions {
    /** Version label of a platform's rolling, latest release. */
    public static final String CURRENT = "current";

    /** {@link #compare(String, String)} as a comparator, ascending. */
    public static final Comparator<String> COMPARATOR = new Comparator<String>() {
        @Override
        public int compare(String a, String b) {
            return Versions.compare(a, b);
        }
    };

    private Versions() {}

    public static boolean isCurrent(String version) {
        return CURRENT.equals(version);
    }

    /**
     * Compares two version strings, returning -1, 0 or 1.
     *
     * <p>{@code "current"} equals itself and is greater than anything else. Numeric versions are
     * compared component by component, so {@code "15"} equals {@code "15.0.0"}. A version that
     * parses sorts before one that does not, and two unparseable strings fall back to plain
     * string order.
     */
    public static int compare(String a, String b) {
        boolean aCurrent = isCurrent(a);
        boolean bCurrent = isCurrent(b);
        if (aCurrent && bCurrent) {
            return 0;
        }
        if (aCurrent) {
            return 1;
        }
        if (bCurrent) {
            return -1;
        }

        SemanticVersion va = SemanticVersion.tryParse(a);
        SemanticVersion vb = SemanticVersion.tryParse(b);
        if (va != null && vb != null) {
            return va.compareTo(vb);
        }
        if (va != null) {
            return -1;
        }
        if (vb != null) {
            return 1;
        }
        return Integer.signum(a.compareTo(b));
    }
}
