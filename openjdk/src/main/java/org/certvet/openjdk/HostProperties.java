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

import java.io.File;
import java.util.logging.Logger;
import org.certvet.ChainValidator;
import org.certvet.Internal;

/**
 * Settings read from system properties, used when the command line does not override them.
 */
@Internal
final class HostProperties {
    private static final Logger logger = Logger.getLogger(HostProperties.class.getName());

    static final String DATA_DIR_PROPERTY_NAME = "certvet.data.dir";
    static final String TIMEOUT_PROPERTY_NAME = "certvet.timeout.ms";
    static final String PARALLELISM_PROPERTY_NAME = "certvet.parallelism";

    static final int DEFAULT_TIMEOUT_MILLIS = 10000;

    private HostProperties() {}

    /**
     * Returns the trust store data directory, or {@code null} to use the bundled data.
     */
    static File dataDirectory() {
        String dirName = System.getProperty(DATA_DIR_PROPERTY_NAME);
        if (dirName == null || dirName.trim().isEmpty()) {
            return null;
        }
        File f = new File(dirName.trim());
        if (!f.isDirectory()) {
            logger.warning(DATA_DIR_PROPERTY_NAME + " is not a directory: " + f);
        }
        return f;
    }

    static int timeoutMillis() {
        return positiveInt(TIMEOUT_PROPERTY_NAME, DEFAULT_TIMEOUT_MILLIS);
    }

    static int parallelism() {
        return positiveInt(PARALLELISM_PROPERTY_NAME, ChainValidator.DEFAULT_PARALLELISM);
    }

    private static int positiveInt(String name, int defaultValue) {
        String value = System.getProperty(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            int result = Integer.parseInt(value.trim());
            if (result > 0) {
                return result;
            }
        } catch (NumberFormatException e) {
            // Fall through to the warning below.
        }
        logger.warning("Ignoring invalid " + name + "=" + value + ", using " + defaultValue);
        return defaultValue;
    }
}
