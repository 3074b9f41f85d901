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
 * Version of the running tool, taken from the jar manifest.
 */
final class ToolVersion {
    static final String DEVELOPMENT = "dev";

    private ToolVersion() {}

    static String get() {
        Package p = ToolVersion.class.getPackage();
        String version = p == null ? null : p.getImplementationVersion();
        return version == null || version.isEmpty() ? DEVELOPMENT : version;
    }
}
