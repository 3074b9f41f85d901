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
 * Thrown when a filter expression cannot be parsed.
 */
public class FilterSyntaxException extends Exception {
    private static final long serialVersionUID = -2675390364919873170L;

    private final String offendingText;

    public FilterSyntaxException(String message, String offendingText) {
        super(message);
        this.offendingText = offendingText;
    }

    /**
     * Returns the part of the expression that could not be parsed, or the whole expression.
     */
    public String getOffendingText() {
        return offendingText;
    }
}
