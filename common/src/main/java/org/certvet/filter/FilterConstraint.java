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

import org.certvet.Platform;
import org.certvet.Preconditions;
import org.certvet.SemanticVersion;
import org.certvet.Versions;

/**
 * One {@code platform [operator version]} term of a filter.
 */
public final class FilterConstraint {
    private final Platform platform;
    private final Operator operator;
    private final SemanticVersion version;
    private final boolean current;

    private FilterConstraint(Platform platform, Operator operator, SemanticVersion version,
            boolean current) {
        this.platform = Preconditions.checkNotNull(platform, "platform == null");
        this.operator = Preconditions.checkNotNull(operator, "operator == null");
        this.version = version;
        this.current = current;
    }

    /** Matches every version of {@code platform}. */
    public static FilterConstraint any(Platform platform) {
        return new FilterConstraint(platform, Operator.GREATER_EQUAL, null, false);
    }

    public static FilterConstraint of(Platform platform, Operator operator,
            SemanticVersion version) {
        Preconditions.checkNotNull(version, "version == null");
        return new FilterConstraint(platform, operator, version, false);
    }

    /** Compares against the {@code "current"} version. */
    public static FilterConstraint ofCurrent(Platform platform, Operator operator) {
        return new FilterConstraint(platform, operator, null, true);
    }

    public Platform getPlatform() {
        return platform;
    }

    public Operator getOperator() {
        return operator;
    }

    /** {@code null} for bare platform and {@code current} constraints. */
    public SemanticVersion getVersion() {
        return version;
    }

    public boolean isCurrent() {
        return current;
    }

    /** True for a bare platform term. */
    public boolean matchesAnyVersion() {
        return version == null && !current;
    }

    /**
     * Tests a store version against this term. The platform is not checked.
     */
    public boolean matches(String testVersion) {
        if (matchesAnyVersion()) {
            return true;
        }
        boolean testIsCurrent = Versions.isCurrent(testVersion);
        if (current || testIsCurrent) {
            return operator.evaluate(testIsCurrent, current, 0);
        }
        SemanticVersion tested = SemanticVersion.tryParse(testVersion);
        if (tested == null) {
            return false;
        }
        return operator.evaluate(false, false, tested.compareTo(version));
    }

    @Override
    public String toString() {
        if (matchesAnyVersion()) {
            return platform.id();
        }
        return platform.id() + operator.symbol() + (current ? Versions.CURRENT : version);
    }
}
