package me.golemcore.costexporter.infrastructure.config;

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

import me.golemcore.costexporter.domain.service.ProviderCatalog;
import me.golemcore.costexporter.metrics.UsageMetricsRegistry;
import io.prometheus.client.CollectorRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the usage metrics registry into a dedicated Prometheus registry.
 *
 * <p>
 * The registry is owned here and injected into both the polling scheduler and
 * the metrics endpoint; nothing uses the Prometheus default registry.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public CollectorRegistry collectorRegistry() {
        return new CollectorRegistry();
    }

    @Bean
    public UsageMetricsRegistry usageMetricsRegistry(ProviderCatalog providerCatalog,
            CollectorRegistry collectorRegistry) {
        UsageMetricsRegistry registry = new UsageMetricsRegistry(providerCatalog.getIdentities());
        registry.registerAll(collectorRegistry);
        return registry;
    }
}
