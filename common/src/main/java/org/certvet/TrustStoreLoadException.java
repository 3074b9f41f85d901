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

import java.io.IOException;

/**
 * Thrown when trust store data is malformed or inconsistent.
 */
public class TrustStoreLoadException extends IOException {
    private static final long serialVersionUID = 6400913405233046418L;

    private final String source;
    private final int line;

    public TrustStoreLoadException(String source, int line, String message) {
        this(source, line, message, null);
    }

    public TrustStoreLoadException(String source, int line, String message, Throwable cause) {
        super(source + ":" + line + ": " + message, cause);
        this.source = source;
        this.line = line;
    }

    /** Name of the file or resource being read. */
    public String getSource() {
        return source;
    }

    /** One-based line at which the offending record starts. */
    public int getLine() {
        return line;
    }
}
