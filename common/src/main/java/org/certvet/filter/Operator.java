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

/**
 * Comparison operators of the filter language.
 */
public enum Operator {
    EQUAL("="),
    GREATER(">"),
    LESS("<"),
    GREATER_EQUAL(">="),
    LESS_EQUAL("<=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Returns the operator written as {@code symbol}, or {@code null}.
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }

    /**
     * Decides whether a tested version satisfies {@code <this> <constraint version>}.
     *
     * <p>{@code "current"} is greater than every numeric version. When neither side is
     * {@code "current"}, {@code cmp} is the sign of comparing the tested version with the
     * constraint version and decides alone; otherwise it is ignored.
     *
     * @param testIsCurrent whether the tested version is {@code "current"}
     * @param constraintIsCurrent whether the constraint version is {@code "current"}
     * @param cmp comparison of two numeric versions, tested against constraint
     */
    public boolean evaluate(boolean testIsCurrent, boolean constraintIsCurrent, int cmp) {
        if (constraintIsCurrent) {
            switch (this) {
                case EQUAL:
                case GREATER_EQUAL:
                    return testIsCurrent;
                case GREATER:
                    return false;
                case LESS:
                    return !testIsCurrent;
                case LESS_EQUAL:
                    return true;
                default:
                    throw new AssertionError(this);
            }
        }
        if (testIsCurrent) {
            return this == GREATER || this == GREATER_EQUAL;
        }
        switch (this) {
            case EQUAL:
                return cmp == 0;
            case GREATER:
                return cmp > 0;
            case LESS:
                return cmp < 0;
            case GREATER_EQUAL:
                return cmp >= 0;
            case LESS_EQUAL:
                return cmp <= 0;
            default:
                throw new AssertionError(this);
        }
    }

    @Override
    public String toString() {
        return symbol;
    }
}
