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

import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.certvet.Fingerprint;
import org.certvet.Names;
import org.certvet.TrustResult;
import org.certvet.ValidationReport;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Renders a {@link ValidationReport}, one line or object per platform version.
 */
public final class ValidationReportFormatter implements Formatter {
    private static final Logger logger =
            Logger.getLogger(ValidationReportFormatter.class.getName());

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final ValidationReport report;
    private final List<TrustResult> results;

    public ValidationReportFormatter(ValidationReport report) {
        this.report = report;
        this.results = ResultOrdering.sort(report.getResults());
    }

    @Override
    public String formatText() {
        TableWriter table = new TableWriter();
        table.header("PLATFORM", "VERSION", "VALIDATION", "STATUS");
        for (TrustResult r : results) {
            if (r.isTrusted()) {
                table.row(r.getPlatform().id(), r.getVersion(), "PASS", r.getMatchedCa());
            } else {
                table.row(r.getPlatform().id(), r.getVersion(), "FAIL", r.getFailureReason());
            }
        }
        return table.toString();
    }

    @Override
    public String formatJson() {
        return toJson().toString(2);
    }

    JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("endpoint", report.getEndpoint());
        json.put("timestamp", TIMESTAMP_FORMAT.format(report.getTimestamp()));
        json.put("tool_version", report.getToolVersion());
        json.put("certificate", certificateJson(report.getChain().getLeaf()));

        JSONArray array = new JSONArray();
        for (TrustResult r : results) {
            JSONObject result = new JSONObject();
            result.put("platform", r.getPlatform().id());
            result.put("version", r.getVersion());
            result.put("trusted", r.isTrusted());
            if (!r.getMatchedCa().isEmpty()) {
                result.put("matched_ca", r.getMatchedCa());
            }
            if (!r.getFailureReason().isEmpty()) {
                result.put("failure_reason", r.getFailureReason());
            }
            array.put(result);
        }
        json.put("results", array);
        json.put("all_passed", report.allPassed());
        return json;
    }

    private static JSONObject certificateJson(X509Certificate leaf) {
        JSONObject cert = new JSONObject();
        cert.put("subject", Names.firstAttribute(leaf.getSubjectX500Principal(), "CN"));
        cert.put("issuer", Names.firstAttribute(leaf.getIssuerX500Principal(), "CN"));
        cert.put("expires", TIMESTAMP_FORMAT.format(leaf.getNotAfter().toInstant()));
        try {
            cert.put("fingerprint_sha256", Fingerprint.of(leaf).toString());
        } catch (CertificateEncodingException e) {
            logger.log(Level.FINE, "Cannot fingerprint " + leaf.getSubjectX500Principal(), e);
        }
        return cert;
    }
}
