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

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Date based restrictions a platform places on one of its root CAs, beyond its mere presence in
 * the store. Every field is optional.
 */
public final class Constraints {
    /** Constraints with no field set. */
    public static final Constraints NONE = new Constraints(null, null, null);

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final Instant notBeforeMax;
    private final Instant distrustDate;
    private final Instant sctNotAfter;

    /**
     * @param notBeforeMax latest accepted leaf issuance date (Windows)
     * @param distrustDate instant after which the CA is not trusted at all (Windows)
     * @param sctNotAfter latest accepted SCT timestamp (Chrome)
     */
    public Constraints(Instant notBeforeMax, Instant distrustDate, Instant sctNotAfter) {
        this.notBeforeMax = notBeforeMax;
        this.distrustDate = distrustDate;
        this.sctNotAfter = sctNotAfter;
    }

    public Instant getNotBeforeMax() {
        return notBeforeMax;
    }

    public Instant getDistrustDate() {
        return distrustDate;
    }

    public Instant getSctNotAfter() {
        return sctNotAfter;
    }

    /** Formats a constraint date as {@code yyyy-MM-dd} in UTC. */
    public static String formatDate(Instant date) {
        return DATE_FORMAT.format(date);
    }

    public boolean isEmpty() {
        return notBeforeMax == null && distrustDate == null && sctNotAfter == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Constraints)) {
            return false;
        }
        Constraints that = (Constraints) o;
        return Objects.equals(notBeforeMax, that.notBeforeMax)
                && Objects.equals(distrustDate, that.distrustDate)
                && Objects.equals(sctNotAfter, that.sctNotAfter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(notBeforeMax, distrustDate, sctNotAfter);
    }

    @Override
    public String toString() {
        return "Constraints{notBeforeMax=" + notBeforeMax + ", distrustDate=" + distrustDate
                + ", sctNotAfter=" + sctNotAfter + "}";
    }
}
