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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A consistent set of trust stores together with the certificates their fingerprints refer to.
 */
public final class TrustStoreSnapshot {
    private final List<TrustStore> stores;
    private final CertificateRegistry registry;

    public TrustStoreSnapshot(List<TrustStore> stores, CertificateRegistry registry) {
        Preconditions.checkNotNull(stores, "stores == null");
        this.stores = Collections.unmodifiableList(new ArrayList<TrustStore>(stores));
        this.registry = Preconditions.checkNotNull(registry, "registry == null");
    }

    public List<TrustStore> getStores() {
        return stores;
    }

    public CertificateRegistry getRegistry() {
        return registry;
    }
}
