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

package org.certvet.openjdk;

/**
 * Process exit statuses of the command line tool.
 */
public final class ExitCodes {
    public static final int SUCCESS = 0;

    /** The chain was rejected by at least one trust store. */
    public static final int TRUST_FAILURE = 1;

    /** Bad arguments, unreadable data or an unreachable endpoint. */
    public static final int INPUT_ERROR = 2;

    private ExitCodes() {}
}
