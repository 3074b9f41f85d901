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

import java.security.cert.X509Certificate;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.security.auth.x500.X500Principal;

/**
 * Reads attributes out of certificate distinguished names.
 */
@Internal
public final class Names {
    private static final Logger logger = Logger.getLogger(Names.class.getName());

    private Names() {}

    /**
     * Returns a short display name for {@code cert}'s subject: its common name, else its first
     * organization, else {@code ""}.
     */
    public static String displayName(X509Certificate cert) {
        String cn = firstAttribute(cert.getSubjectX500Principal(), "CN");
        if (!cn.isEmpty()) {
            return cn;
        }
        return firstAttribute(cert.getSubjectX500Principal(), "O");
    }

    /**
     * Returns the value of the first {@code type} attribute in encoding order, or {@code ""}.
     */
    public static String firstAttribute(X500Principal principal, String type) {
        LdapName name;
        try {
            name = new LdapName(principal.getName(X500Principal.RFC2253));
        } catch (InvalidNameException e) {
            logger.log(Level.FINE, "Unparseable distinguished name " + principal, e);
            return "";
        }
        // getRdns() runs from the last RDN of the RFC 2253 string, which is the first encoded.
        for (Rdn rdn : name.getRdns()) {
            if (rdn.getType().equalsIgnoreCase(type) && rdn.getValue() instanceof String) {
                return (String) rdn.getValue();
            }
        }
        return "";
    }
}
