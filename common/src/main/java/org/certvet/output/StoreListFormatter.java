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

package org.certvet.output;

import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.certvet.CertificateRegistry;
import org.certvet.Constraints;
import org.certvet.Fingerprint;
import org.certvet.Names;
import org.certvet.TrustStore;
import org.certvet.Versions;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Renders the contents of trust stores, one entry per root per store.
 */
public final class StoreListFormatter implements Formatter {
    /** Octets of a fingerprint shown in narrow text output. */
    public static final int SHORT_FINGERPRINT_OCTETS = 4;

    private static final Comparator<ListEntry> ORDER = new Comparator<ListEntry>() {
        @Override
        public int compare(ListEntry a, ListEntry b) {
            int result = a.getPlatform().compareTo(b.getPlatform());
            if (result == 0) {
                result = Versions.compare(a.getVersion(), b.getVersion());
            }
            if (result == 0) {
                result = a.getIssuer().compareTo(b.getIssuer());
            }
            return result;
        }
    };

    private final List<ListEntry> entries;

    public StoreListFormatter(List<ListEntry> entries) {
        List<ListEntry> sorted = new ArrayList<ListEntry>(entries);
        Collections.sort(sorted, ORDER);
        this.entries = Collections.unmodifiableList(sorted);
    }

    /**
     * Builds the entries for {@code stores}.
     *
     * @param fullFingerprints whether to show whole fingerprints rather than their first octets
     */
    public static StoreListFormatter fromStores(List<TrustStore> stores,
            CertificateRegistry registry, boolean fullFingerprints) {
        List<ListEntry> entries = new ArrayList<ListEntry>();
        for (TrustStore store : stores) {
            for (Fingerprint fp : store.getFingerprints()) {
                String issuer = "-";
                X509Certificate cert = registry.lookup(fp);
                if (cert != null) {
                    String name = Names.displayName(cert);
                    if (!name.isEmpty()) {
                        issuer = name;
                    }
                }
                String displayed =
                        fullFingerprints ? fp.toString() : fp.truncate(SHORT_FINGERPRINT_OCTETS);
                entries.add(new ListEntry(store.getPlatform().id(), store.getVersion(), displayed,
                        issuer, describe(store.getConstraints(fp))));
            }
        }
        return new StoreListFormatter(entries);
    }

    static String describe(Constraints c) {
        if (c.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        append(sb, "NB:", c.getNotBeforeMax());
        append(sb, "DT:", c.getDistrustDate());
        append(sb, "SCT:", c.getSctNotAfter());
        return sb.toString();
    }

    private static void append(StringBuilder sb, String label, Instant date) {
        if (date == null) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(',');
        }
        sb.append(label).append(Constraints.formatDate(date));
    }

    public List<ListEntry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String formatText() {
        if (entries.isEmpty()) {
            return "";
        }
        TableWriter table = new TableWriter();
        table.header("PLATFORM", "VERSION", "FINGERPRINT", "CONSTRAINTS", "ISSUER");
        for (ListEntry e : entries) {
            String constraints = e.getConstraints().isEmpty() ? "-" : e.getConstraints();
            table.row(e.getPlatform(), e.getVersion(), e.getFingerprint(), constraints,
                    e.getIssuer());
        }
        return table.toString();
    }

    @Override
    public String formatJson() {
        JSONArray array = new JSONArray();
        for (ListEntry e : entries) {
            JSONObject json = new JSONObject();
            json.put("platform", e.getPlatform());
            json.put("version", e.getVersion());
            json.put("fingerprint", e.getFingerprint());
            json.put("issuer", e.getIssuer());
            if (!e.getConstraints().isEmpty()) {
                json.put("constraints", e.getConstraints());
            }
            array.put(json);
        }
        return entries.isEmpty() ? "[]" : array.toString(2);
    }
}
