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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.certvet.PlatformVersion;
import org.certvet.TrustResult;

/**
 * Display order of results: by platform identifier, then by version, oldest first.
 */
public final class ResultOrdering {
    public static final Comparator<TrustResult> COMPARATOR = new Comparator<TrustResult>() {
        @Override
        public int compare(TrustResult a, TrustResult b) {
            return PlatformVersion.ORDER.compare(a.getPlatformVersion(), b.getPlatformVersion());
        }
    };

    private ResultOrdering() {}

    /** Returns a sorted copy of {@code results}. */
    public static List<TrustResult> sort(List<TrustResult> results) {
        List<TrustResult> sorted = new ArrayList<TrustResult>(results);
        Collections.sort(sorted, COMPARATOR);
        return sorted;
    }
}
