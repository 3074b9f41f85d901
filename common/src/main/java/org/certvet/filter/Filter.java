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

package org.certvet.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.certvet.PlatformVersion;
import org.certvet.TrustStore;

/**
 * A parsed filter expression selecting trust stores by platform and version, for example
 * {@code "ios>=17, android>=10, chrome"}.
 *
 * <p>Terms naming the same platform must all hold. A store whose platform is not named by any
 * term is never selected.
 */
public final class Filter {
    private final List<FilterConstraint> constraints;

    public Filter(List<FilterConstraint> constraints) {
        this.constraints = Collections.unmodifiableList(
                new ArrayList<FilterConstraint>(constraints));
    }

    /**
     * Parses a filter expression.
     *
     * @throws FilterSyntaxException if the expression is blank or malformed
     */
    public static Filter parse(String expression) throws FilterSyntaxException {
        return new FilterParser(expression).parse();
    }

    public List<FilterConstraint> getConstraints() {
        return constraints;
    }

    public boolean matches(PlatformVersion pv) {
        if (constraints.isEmpty()) {
            return true;
        }
        boolean named = false;
        for (FilterConstraint c : constraints) {
            if (c.getPlatform() != pv.getPlatform()) {
                continue;
            }
            named = true;
            if (!c.matches(pv.getVersion())) {
                return false;
            }
        }
        return named;
    }

    /**
     * Returns the stores {@code filter} selects, in their original order. A {@code null}
     * filter selects everything and returns {@code stores} itself.
     */
    public static List<TrustStore> filterStores(List<TrustStore> stores, Filter filter) {
        if (filter == null) {
            return stores;
        }
        List<TrustStore> result = new ArrayList<TrustStore>();
        for (TrustStore store : stores) {
            if (filter.matches(store.getPlatformVersion())) {
                result.add(store);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (FilterConstraint c : constraints) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
