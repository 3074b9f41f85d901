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

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Matches a host name or IP address against the subject alternative names of a certificate.
 */
final class HostnameMatcher {
    private static final Logger logger = Logger.getLogger(HostnameMatcher.class.getName());

    private static final int DNS_NAME_TYPE = 2;
    private static final int IP_ADDRESS_TYPE = 7;

    private HostnameMatcher() {}

    static boolean matches(X509Certificate cert, String host) {
        String normalized = host.toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        boolean ip = isIpLiteral(normalized);
        for (String name : getNames(cert, ip ? IP_ADDRESS_TYPE : DNS_NAME_TYPE)) {
            if (ip ? sameAddress(name, normalized) : matchesPattern(name, normalized)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> getNames(X509Certificate cert, int type) {
        List<String> result = new ArrayList<String>();
        Collection<List<?>> altNamePairs;
        try {
            altNamePairs = cert.getSubjectAlternativeNames();
        } catch (CertificateParsingException e) {
            logger.log(Level.FINE, "Unparseable subject alternative names", e);
            return result;
        }
        if (altNamePairs == null) {
            return result;
        }
        for (List<?> altNamePair : altNamePairs) {
            // (Integer type, String name) pairs.
            if (altNamePair.get(0).equals(type) && altNamePair.get(1) instanceof String) {
                result.add((String) altNamePair.get(1));
            }
        }
        return result;
    }

    // A single '*' may stand for the whole left-most label only.
    static boolean matchesPattern(String pattern, String host) {
        String p = pattern.toLowerCase(Locale.ROOT);
        if (p.endsWith(".")) {
            p = p.substring(0, p.length() - 1);
        }
        if (!p.startsWith("*.")) {
            return p.equals(host);
        }
        String suffix = p.substring(1);
        if (suffix.indexOf('*') >= 0 || suffix.indexOf('.', 1) < 0) {
            return false;
        }
        int firstDot = host.indexOf('.');
        return firstDot > 0 && host.substring(firstDot).equals(suffix);
    }

    private static boolean isIpLiteral(String host) {
        return host.indexOf(':') >= 0 || host.matches("[0-9.]+");
    }

    private static boolean sameAddress(String a, String b) {
        try {
            // Both are literals, so no lookup takes place.
            return InetAddress.getByName(a).equals(InetAddress.getByName(b));
        } catch (UnknownHostException e) {
            logger.log(Level.FINE, "Not an IP address: " + a, e);
            return false;
        }
    }
}
