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

import java.security.GeneralSecurityException;
import java.security.cert.CertPath;
import java.security.cert.CertPathBuilderException;
import java.security.cert.CertPathValidator;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.PKIXParameters;
import java.security.cert.PKIXReason;
import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates a server's certificate chain against any number of trust stores at once.
 *
 * <p>Each store is checked independently, on its own worker, and yields exactly one
 * {@link TrustResult}: a chain is trusted by a store if a path can be built from the leaf
 * through the intermediates the server sent to one of the store's roots, the path passes PKIX
 * validation (revocation excluded), the leaf is fit for TLS server authentication, and the
 * root's {@link Constraints} are met.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class ChainValidator {
    private static final Logger logger = Logger.getLogger(ChainValidator.class.getName());

    public static final int DEFAULT_PARALLELISM =
            Math.max(2, Runtime.getRuntime().availableProcessors());

    private final CertificateRegistry registry;
    private final Clock clock;
    private final int parallelism;
    private final ExecutorService executor;
    private final boolean hostnameVerification;

    private ChainValidator(Builder builder) {
        this.registry = builder.registry;
        this.clock = builder.clock;
        this.parallelism = builder.parallelism;
        this.executor = builder.executor;
        this.hostnameVerification = builder.hostnameVerification;
    }

    public static Builder builder(CertificateRegistry registry) {
        return new Builder(registry);
    }

    /**
     * Validates {@code chain} against every store in {@code stores}.
     *
     * @return one result per store, in the order of {@code stores}
     * @throws ValidationException if interrupted while waiting for the results
     */
    public List<TrustResult> validate(final CertChain chain, List<TrustStore> stores)
            throws ValidationException {
        Preconditions.checkNotNull(chain, "chain == null");
        Preconditions.checkNotNull(stores, "stores == null");
        if (stores.isEmpty()) {
            return Collections.emptyList();
        }

        List<Callable<TrustResult>> tasks = new ArrayList<Callable<TrustResult>>(stores.size());
        for (final TrustStore store : stores) {
            tasks.add(new Callable<TrustResult>() {
                @Override
                public TrustResult call() {
                    return validateStore(chain, store);
                }
            });
        }

        ExecutorService pool = executor;
        if (pool == null) {
            pool = Executors.newFixedThreadPool(
                    Math.min(stores.size(), parallelism), new WorkerThreadFactory());
        }
        try {
            List<Future<TrustResult>> futures = pool.invokeAll(tasks);
            List<TrustResult> results = new ArrayList<TrustResult>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(getResult(futures.get(i), stores.get(i)));
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ValidationException(
                    "Interrupted while validating " + chain.getEndpoint(), e);
        } finally {
            if (executor == null) {
                pool.shutdownNow();
            }
        }
    }

    private static TrustResult getResult(Future<TrustResult> future, TrustStore store)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.log(Level.WARNING, "Validation against " + store.getPlatformVersion()
                    + " failed unexpectedly", cause);
            return TrustResult.untrusted(store.getPlatformVersion(),
                    VerificationFailure.describe(cause));
        }
    }

    /**
     * Validates {@code chain} against a single store, on the calling thread.
     */
    TrustResult validateStore(CertChain chain, TrustStore store) {
        PlatformVersion pv = store.getPlatformVersion();

        List<X509Certificate> roots = new ArrayList<X509Certificate>();
        Set<Fingerprint> missing = new HashSet<Fingerprint>();
        for (Fingerprint fp : store.getFingerprints()) {
            X509Certificate cert = registry.lookup(fp);
            if (cert != null) {
                roots.add(cert);
            } else {
                missing.add(fp);
            }
        }
        if (roots.isEmpty()) {
            return TrustResult.untrusted(pv, "no valid root certificates in trust store");
        }

        List<X509Certificate> path;
        try {
            path = new PathBuilder(chain, roots, new Date(clock.millis())).build();
        } catch (GeneralSecurityException e) {
            logger.fine("Rejected chain for " + chain.getEndpoint() + " against " + pv + ": "
                    + e.getMessage());
            Fingerprint unavailableRoot = lastIntermediateIn(chain, missing);
            if (unavailableRoot != null) {
                return TrustResult.untrusted(pv, String.format("chain roots at known CA "
                        + "(fingerprint %s) but certificate data unavailable", unavailableRoot));
            }
            return TrustResult.untrusted(pv, VerificationFailure.describe(e));
        }

        if (hostnameVerification && !HostnameMatcher.matches(chain.getLeaf(), chain.getHost())) {
            return TrustResult.untrusted(pv, VerificationFailure.hostnameMismatch(chain.getHost()));
        }

        X509Certificate root = path.get(path.size() - 1);
        String matchedCa = Names.displayName(root);
        Fingerprint rootFingerprint;
        try {
            rootFingerprint = Fingerprint.of(root);
        } catch (CertificateEncodingException e) {
            return TrustResult.untrusted(pv, VerificationFailure.describe(e));
        }
        Constraints constraints = store.getConstraints(rootFingerprint);
        String violation = ConstraintChecker.check(chain, constraints, clock.instant());
        if (violation != null) {
            logger.fine(pv + " rejects " + chain.getEndpoint() + ": " + violation);
            return TrustResult.untrusted(pv, violation, matchedCa, path);
        }
        return TrustResult.trusted(pv, matchedCa, path);
    }

    /*
     * A server that sends its root as the last certificate makes the chain look unrooted when
     * the store knows the root only by fingerprint.
     */
    private static Fingerprint lastIntermediateIn(CertChain chain, Set<Fingerprint> missing) {
        List<X509Certificate> intermediates = chain.getIntermediates();
        if (intermediates.isEmpty() || missing.isEmpty()) {
            return null;
        }
        try {
            Fingerprint fp = Fingerprint.of(intermediates.get(intermediates.size() - 1));
            return missing.contains(fp) ? fp : null;
        } catch (CertificateEncodingException e) {
            logger.log(Level.FINE, "Cannot fingerprint last intermediate", e);
            return null;
        }
    }

    /**
     * Builds and validates a path from the leaf to one of a store's roots.
     */
    private static final class PathBuilder {
        // Bounds on the work a server's chain can cause, leaf included in the path length.
        private static final int MAX_PATH_LENGTH = 10;
        private static final int MAX_SIGNATURE_CHECKS = 100;

        private final X509Certificate leaf;
        private final List<X509Certificate> intermediates;
        private final List<X509Certificate> roots;
        private final Date date;
        private final CertificateFactory factory;
        private final CertPathValidator validator;
        private int signatureChecks;

        PathBuilder(CertChain chain, List<X509Certificate> roots, Date date)
                throws GeneralSecurityException {
            this.leaf = chain.getLeaf();
            this.intermediates = chain.getIntermediates();
            this.roots = roots;
            this.date = date;
            this.factory = CertificateFactory.getInstance("X.509");
            this.validator = CertPathValidator.getInstance("PKIX");
        }

        /**
         * @return the validated path, leaf first and root last
         */
        List<X509Certificate> build() throws GeneralSecurityException {
            if (roots.contains(leaf)) {
                leaf.checkValidity(date);
                return Collections.singletonList(leaf);
            }
            ArrayList<X509Certificate> untrustedChain = new ArrayList<X509Certificate>();
            untrustedChain.add(leaf);
            Set<X509Certificate> used = new HashSet<X509Certificate>();
            used.add(leaf);
            return buildRecursive(untrustedChain, used);
        }

        /*
         * Tries every root that issued the current end of the chain, then grows the chain with
         * each intermediate that signed it. A self-issued end is not grown further. If nothing
         * works the most specific error seen is thrown.
         */
        private List<X509Certificate> buildRecursive(ArrayList<X509Certificate> untrustedChain,
                Set<X509Certificate> used) throws GeneralSecurityException {
            GeneralSecurityException lastException = null;
            X509Certificate current = untrustedChain.get(untrustedChain.size() - 1);

            for (X509Certificate root : findIssuingRoots(current)) {
                if (used.contains(root)) {
                    continue;
                }
                try {
                    return verifyChain(untrustedChain, root);
                } catch (GeneralSecurityException e) {
                    lastException = moreSpecific(lastException, e);
                }
            }

            boolean selfIssued =
                    current.getIssuerX500Principal().equals(current.getSubjectX500Principal());
            if (!selfIssued && untrustedChain.size() < MAX_PATH_LENGTH) {
                for (X509Certificate candidateIssuer : intermediates) {
                    if (used.contains(candidateIssuer)) {
                        continue;
                    }
                    if (!current.getIssuerX500Principal().equals(
                                candidateIssuer.getSubjectX500Principal())) {
                        continue;
                    }
                    // Prune expired and non-signing candidates before recursing.
                    try {
                        candidateIssuer.checkValidity(date);
                    } catch (CertificateException e) {
                        lastException = moreSpecific(lastException, e);
                        continue;
                    }
                    if (!isSignedBy(current, candidateIssuer)) {
                        continue;
                    }
                    used.add(candidateIssuer);
                    untrustedChain.add(candidateIssuer);
                    try {
                        return buildRecursive(untrustedChain, used);
                    } catch (SignatureBudgetExceededException e) {
                        throw e;
                    } catch (GeneralSecurityException e) {
                        lastException = moreSpecific(lastException, e);
                    }
                    // Could not form a valid chain via this certificate, remove it from this chain.
                    untrustedChain.remove(untrustedChain.size() - 1);
                    used.remove(candidateIssuer);
                }
            }

            if (lastException != null) {
                throw lastException;
            }
            CertPath certPath = factory.generateCertPath(untrustedChain);
            throw new CertPathValidatorException("Trust anchor for certification path not found.",
                    null, certPath, -1, PKIXReason.NO_TRUST_ANCHOR);
        }

        private List<X509Certificate> findIssuingRoots(X509Certificate cert)
                throws SignatureBudgetExceededException {
            List<X509Certificate> result = new ArrayList<X509Certificate>();
            for (X509Certificate root : roots) {
                if (root.getSubjectX500Principal().equals(cert.getIssuerX500Principal())
                        && isSignedBy(cert, root)) {
                    result.add(root);
                }
            }
            return result;
        }

        private boolean isSignedBy(X509Certificate cert, X509Certificate issuer)
                throws SignatureBudgetExceededException {
            if (++signatureChecks > MAX_SIGNATURE_CHECKS) {
                throw new SignatureBudgetExceededException();
            }
            try {
                cert.verify(issuer.getPublicKey());
                return true;
            } catch (GeneralSecurityException e) {
                logger.log(Level.FINEST, issuer.getSubjectX500Principal() + " did not sign "
                        + cert.getSubjectX500Principal(), e);
                return false;
            }
        }

        private List<X509Certificate> verifyChain(List<X509Certificate> untrustedChain,
                X509Certificate root) throws GeneralSecurityException {
            root.checkValidity(date);

            CertPath certPath = factory.generateCertPath(untrustedChain);
            PKIXParameters params =
                    new PKIXParameters(Collections.singleton(new TrustAnchor(root, null)));
            params.setRevocationEnabled(false);
            params.setDate(date);
            params.addCertPathChecker(new ServerAuthUsageChecker(leaf));
            validator.validate(certPath, params);

            List<X509Certificate> wholeChain = new ArrayList<X509Certificate>(untrustedChain);
            wholeChain.add(root);
            return wholeChain;
        }

        // A failure after reaching a root says more than not reaching one.
        private static GeneralSecurityException moreSpecific(
                GeneralSecurityException previous, GeneralSecurityException current) {
            if (previous == null || isNoTrustAnchor(previous)) {
                return current;
            }
            return isNoTrustAnchor(current) ? previous : current;
        }

        private static boolean isNoTrustAnchor(GeneralSecurityException e) {
            return e instanceof CertPathValidatorException
                    && ((CertPathValidatorException) e).getReason() == PKIXReason.NO_TRUST_ANCHOR;
        }
    }

    private static final class SignatureBudgetExceededException
            extends CertPathBuilderException {
        private static final long serialVersionUID = 4468283413185387925L;

        SignatureBudgetExceededException() {
            super("path building exceeded " + PathBuilder.MAX_SIGNATURE_CHECKS
                    + " signature checks");
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger poolNumber = new AtomicInteger(1);
        private final AtomicInteger threadNumber = new AtomicInteger(1);
        private final String prefix = "certvet-validator-" + poolNumber.getAndIncrement() + "-";

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    public static final class Builder {
        private final CertificateRegistry registry;
        private Clock clock = Clock.systemUTC();
        private int parallelism = DEFAULT_PARALLELISM;
        private ExecutorService executor;
        private boolean hostnameVerification;

        private Builder(CertificateRegistry registry) {
            this.registry = Preconditions.checkNotNull(registry, "registry == null");
        }

        /** Source of the validation time. Defaults to the system clock. */
        public Builder setClock(Clock clock) {
            this.clock = Preconditions.checkNotNull(clock, "clock == null");
            return this;
        }

        /** Upper bound on worker threads per call when no executor is supplied. */
        public Builder setParallelism(int parallelism) {
            Preconditions.checkArgument(parallelism > 0, "parallelism must be positive: %s",
                    parallelism);
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Runs the per-store work on {@code executor} instead of a pool owned by each call.
         * The caller keeps ownership and must shut it down.
         */
        public Builder setExecutor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Also requires the leaf to be valid for the host of the chain's endpoint. Off by
         * default.
         */
        public Builder setHostnameVerification(boolean hostnameVerification) {
            this.hostnameVerification = hostnameVerification;
            return this;
        }

        public ChainValidator build() {
            return new ChainValidator(this);
        }
    }
}
