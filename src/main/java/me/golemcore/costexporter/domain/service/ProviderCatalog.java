package me.golemcore.costexporter.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.costexporter.domain.model.ProviderIdentity;
import me.golemcore.costexporter.infrastructure.config.ConfigurationException;
import me.golemcore.costexporter.port.outbound.UsageProviderPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Set of enabled usage providers, fixed at startup.
 *
 * <p>
 * All provider adapters are Spring beans; only those enabled by configuration
 * are polled. Provider names must be unique, otherwise two providers would
 * write the same metric series and startup fails.
 *
 * <p>
 * The identities exposed here are the only label pairs the metrics registry
 * accepts.
 *
 * @see UsageProviderPort
 */
@Component
@Slf4j
public class ProviderCatalog {

    private final List<UsageProviderPort> providers;
    private final Set<ProviderIdentity> identities;

    public ProviderCatalog(List<UsageProviderPort> adapters) {
        Map<String, UsageProviderPort> byName = new LinkedHashMap<>();
        for (UsageProviderPort adapter : adapters) {
            if (!adapter.isEnabled()) {
                log.debug("[Catalog] Provider disabled: {}", adapter.getIdentity().providerName());
                continue;
            }
            String name = adapter.getIdentity().providerName();
            UsageProviderPort existing = byName.putIfAbsent(name, adapter);
            if (existing != null) {
                throw new ConfigurationException("Duplicate provider name '" + name + "': "
                        + existing.getClass().getSimpleName() + " and " + adapter.getClass().getSimpleName());
            }
        }

        this.providers = Collections.unmodifiableList(new ArrayList<>(byName.values()));
        Set<ProviderIdentity> ids = new LinkedHashSet<>();
        for (UsageProviderPort provider : providers) {
            ids.add(provider.getIdentity());
        }
        this.identities = Collections.unmodifiableSet(ids);

        if (providers.isEmpty()) {
            log.warn("[Catalog] No providers enabled, /metrics will only report totals");
        } else {
            log.info("[Catalog] Enabled providers: {}", identities);
        }
    }

    public List<UsageProviderPort> getProviders() {
        return providers;
    }

    public Set<ProviderIdentity> getIdentities() {
        return identities;
    }
}
