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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads trust store snapshots from their CSV form.
 *
 * <p>{@value #CERTIFICATES_FILE} has a header row followed by {@code fingerprint,pem} records,
 * where line breaks inside the PEM are written as the two characters {@code \n}.
 * {@value #STORES_FILE} has a header row followed by
 * {@code platform,version,fingerprint,not_before_max,distrust_date,sct_not_after} records; the
 * dates are RFC 3339 timestamps or empty. Records sharing platform and version make up one
 * store.
 */
public final class TrustStoreLoader {
    private static final Logger logger = Logger.getLogger(TrustStoreLoader.class.getName());

    public static final String CERTIFICATES_FILE = "certificates.csv";
    public static final String STORES_FILE = "stores.csv";

    private static final String RESOURCE_DIR = "/org/certvet/data/";

    private static final int CERT_FINGERPRINT = 0;
    private static final int CERT_PEM = 1;

    private static final int STORE_PLATFORM = 0;
    private static final int STORE_VERSION = 1;
    private static final int STORE_FINGERPRINT = 2;
    private static final int STORE_NOT_BEFORE_MAX = 3;
    private static final int STORE_DISTRUST_DATE = 4;
    private static final int STORE_SCT_NOT_AFTER = 5;

    private static final Comparator<TrustStore> STORE_ORDER = new Comparator<TrustStore>() {
        @Override
        public int compare(TrustStore a, TrustStore b) {
            return PlatformVersion.ORDER.compare(a.getPlatformVersion(), b.getPlatformVersion());
        }
    };

    private TrustStoreLoader() {}

    /**
     * Loads {@value #CERTIFICATES_FILE} and {@value #STORES_FILE} from {@code dir}.
     */
    public static TrustStoreSnapshot load(Path dir) throws IOException {
        Path certificates = dir.resolve(CERTIFICATES_FILE);
        Path stores = dir.resolve(STORES_FILE);
        try (Reader certReader = Files.newBufferedReader(certificates, StandardCharsets.UTF_8);
                Reader storeReader = Files.newBufferedReader(stores, StandardCharsets.UTF_8)) {
            return load(certReader, certificates.toString(), storeReader, stores.toString());
        }
    }

    public static TrustStoreSnapshot loadFromClasspath() throws IOException {
        try (InputStream certs = openResource(CERTIFICATES_FILE);
                InputStream stores = openResource(STORES_FILE)) {
            return load(new InputStreamReader(certs, StandardCharsets.UTF_8),
                    RESOURCE_DIR + CERTIFICATES_FILE,
                    new InputStreamReader(stores, StandardCharsets.UTF_8),
                    RESOURCE_DIR + STORES_FILE);
        }
    }

    private static InputStream openResource(String name) throws IOException {
        InputStream in = TrustStoreLoader.class.getResourceAsStream(RESOURCE_DIR + name);
        if (in == null) {
            throw new IOException("Missing resource " + RESOURCE_DIR + name);
        }
        return in;
    }

    /**
     * Loads a snapshot from already opened record sets. The readers are not closed.
     *
     * @param certificatesSource name of the certificate records, for error messages
     * @param storesSource name of the store records, for error messages
     */
    public static TrustStoreSnapshot load(Reader certificates, String certificatesSource,
            Reader stores, String storesSource) throws IOException {
        Map<Fingerprint, X509Certificate> certs =
                readCertificates(new CsvReader(certificates, certificatesSource));
        List<TrustStore> storeList = readStores(new CsvReader(stores, storesSource));
        logger.fine("Loaded " + storeList.size() + " trust stores and " + certs.size()
                + " root certificates");
        return new TrustStoreSnapshot(storeList, new DefaultCertificateRegistry(certs));
    }

    static Map<Fingerprint, X509Certificate> readCertificates(CsvReader csv) throws IOException {
        CertificateFactory factory;
        try {
            factory = CertificateFactory.getInstance("X.509");
        } catch (CertificateException e) {
            throw new IllegalStateException("X.509 certificate factory unavailable", e);
        }

        Map<Fingerprint, X509Certificate> result =
                new LinkedHashMap<Fingerprint, X509Certificate>();
        skipHeader(csv);
        List<String> record;
        while ((record = csv.read()) != null) {
            requireFields(csv, record, CERT_PEM + 1);
            Fingerprint fp = parseFingerprint(csv, record.get(CERT_FINGERPRINT));
            String pem = record.get(CERT_PEM).replace("\\n", "\n");

            X509Certificate cert;
            try {
                cert = (X509Certificate) factory.generateCertificate(
                        new ByteArrayInputStream(pem.getBytes(StandardCharsets.US_ASCII)));
            } catch (CertificateException e) {
                throw new TrustStoreLoadException(csv.getSource(), csv.getRecordLine(),
                        "failed to parse certificate " + fp, e);
            }
            Fingerprint actual;
            try {
                actual = Fingerprint.of(cert);
            } catch (CertificateException e) {
                throw new TrustStoreLoadException(csv.getSource(), csv.getRecordLine(),
                        "failed to encode certificate " + fp, e);
            }
            if (!actual.equals(fp)) {
                throw new TrustStoreLoadException(csv.getSource(), csv.getRecordLine(),
                        "fingerprint " + fp + " does not match certificate (" + actual + ")");
            }
            result.put(fp, cert);
        }
        return result;
    }

    static List<TrustStore> readStores(CsvReader csv) throws IOException {
        Map<PlatformVersion, TrustStore.Builder> builders =
                new LinkedHashMap<PlatformVersion, TrustStore.Builder>();
        skipHeader(csv);
        List<String> record;
        while ((record = csv.read()) != null) {
            requireFields(csv, record, STORE_FINGERPRINT + 1);
            Platform platform = Platform.lookup(record.get(STORE_PLATFORM));
            if (platform == null) {
                logger.warning(csv.getSource() + ":" + csv.getRecordLine()
                        + ": skipping record for unknown platform \""
                        + record.get(STORE_PLATFORM) + "\"");
                continue;
            }
            String version = record.get(STORE_VERSION).trim();
            if (version.isEmpty()) {
                throw new TrustStoreLoadException(csv.getSource(), csv.getRecordLine(),
                        "empty version");
            }
            Fingerprint fp = parseFingerprint(csv, record.get(STORE_FINGERPRINT));
            Constraints constraints = new Constraints(
                    parseDate(csv, record, STORE_NOT_BEFORE_MAX, "not_before_max"),
                    parseDate(csv, record, STORE_DISTRUST_DATE, "distrust_date"),
                    parseDate(csv, record, STORE_SCT_NOT_AFTER, "sct_not_after"));

            PlatformVersion key = new PlatformVersion(platform, version);
            TrustStore.Builder builder = builders.get(key);
            if (builder == null) {
                builder = TrustStore.builder(platform, version);
                builders.put(key, builder);
            }
            builder.addRoot(fp, constraints);
        }

        List<TrustStore> stores = new ArrayList<TrustStore>(builders.size());
        for (TrustStore.Builder builder : builders.values()) {
            stores.add(builder.build());
        }
        Collections.sort(stores, STORE_ORDER);
        return stores;
    }

    private static void skipHeader(CsvReader csv) throws IOException {
        if (csv.read() == null) {
            throw new TrustStoreLoadException(csv.getSource(), 1, "missing header row");
        }
    }

    private static void requireFields(CsvReader csv, List<String> record, int count)
            throws TrustStoreLoadException {
        if (record.size() < count) {
            throw new TrustStoreLoadException(csv.getSource(), csv.getRecordLine(),
                    "expected at least " + count + " fields, got " + record.size());
        }
    }

    private static Fingerprint parseFingerprint(CsvReader csv, String text)
            throws TrustStoreLoadException {
        try {
            return Fingerprint.parse(text);
        } catch (FingerprintFormatException e) {
            throw new TrustStoreLoadException(csv.getSource(), csv.getRecordLine(),
                    "parse fingerprint " + text + ": " + e.getMessage(), e);
        }
    }

    private static Instant parseDate(CsvReader csv, List<String> record, int index, String column)
            throws TrustStoreLoadException {
        if (record.size() <= index || record.get(index).trim().isEmpty()) {
            return null;
        }
        String text = record.get(index).trim();
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new TrustStoreLoadException(csv.getSource(), csv.getRecordLine(),
                    "parse " + column + " " + text + ": " + e.getMessage(), e);
        }
    }
}
