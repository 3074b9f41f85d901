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

import java.time.Clock;
import java.util.List;
import org.certvet.filter.Filter;
import org.certvet.filter.FilterSyntaxException;

/**
 * Validates a chain against the stores of a snapshot selected by an optional filter.
 */
public final class TrustChecker {
    private final TrustStoreSnapshot snapshot;
    private final ChainValidator validator;
    private final String toolVersion;
    private final Clock clock;

    public TrustChecker(TrustStoreSnapshot snapshot, ChainValidator validator,
            String toolVersion) {
        this(snapshot, validator, toolVersion, Clock.systemUTC());
    }

    public TrustChecker(TrustStoreSnapshot snapshot, ChainValidator validator,
            String toolVersion, Clock clock) {
        this.snapshot = Preconditions.checkNotNull(snapshot, "snapshot == null");
        this.validator = Preconditions.checkNotNull(validator, "validator == null");
        this.toolVersion = toolVersion;
        this.clock = Preconditions.checkNotNull(clock, "clock == null");
    }

    /**
     * Returns the stores selected by {@code filterExpression}, or all of them if it is
     * {@code null} or empty.
     */
    public List<TrustStore> selectStores(String filterExpression) throws FilterSyntaxException {
        Filter filter = null;
        if (filterExpression != null && !filterExpression.isEmpty()) {
            filter = Filter.parse(filterExpression);
        }
        return Filter.filterStores(snapshot.getStores(), filter);
    }

    /**
     * @throws FilterSyntaxException if {@code filterExpression} is malformed
     * @throws ValidationException if no store matches the filter, or validation was interrupted
     */
    public ValidationReport check(CertChain chain, String filterExpression)
            throws FilterSyntaxException, ValidationException {
        List<TrustStore> stores = selectStores(filterExpression);
        if (stores.isEmpty()) {
            throw new ValidationException("no trust stores match filter");
        }
        List<TrustResult> results = validator.validate(chain, stores);
        return new ValidationReport(chain, clock.instant(), toolVersion, results);
    }
}
