package me.golemcore.costexporter.adapter.outbound.openai;

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

import me.golemcore.costexporter.adapter.outbound.FeignErrors;
import me.golemcore.costexporter.domain.model.BillingPeriod;
import me.golemcore.costexporter.domain.model.ProviderIdentity;
import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.infrastructure.config.ConfigurationException;
import me.golemcore.costexporter.infrastructure.config.ExporterProperties;
import me.golemcore.costexporter.infrastructure.http.FeignClientFactory;
import me.golemcore.costexporter.port.outbound.ProviderException;
import me.golemcore.costexporter.port.outbound.UsageProviderPort;
import feign.FeignException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Usage adapter for the OpenAI billing API.
 *
 * <p>
 * Each fetch makes two calls: month-to-date usage and the billing
 * subscription. Both must succeed; their combination yields the spend and the
 * remaining balance.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code exporter.providers.openai.enabled} - Enable/disable</li>
 * <li>{@code exporter.providers.openai.api-key} - API key, required when
 * enabled ({@code OPENAI_API_KEY})</li>
 * <li>{@code exporter.providers.openai.model} - model label (default
 * gpt-4)</li>
 * </ul>
 *
 * <p>
 * Provider name: {@code "openai"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiUsageAdapter implements UsageProviderPort {

    static final String PROVIDER_NAME = "openai";

    private final ExporterProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final Clock clock;

    private OpenAiBillingApi billingApi;
    private ProviderIdentity identity;
    private boolean enabled;
    private String apiKey;

    @PostConstruct
    public void init() {
        ExporterProperties.OpenAiProperties config = properties.getProviders().getOpenai();
        this.enabled = config.isEnabled();
        this.apiKey = config.getApiKey();
        this.identity = new ProviderIdentity(PROVIDER_NAME, config.getModel());

        if (!enabled) {
            log.info("[OpenAI] Provider disabled");
            return;
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(config.getApiKeyVariable()
                    + " is not set; it is required while the OpenAI provider is enabled");
        }

        this.billingApi = feignClientFactory.create(OpenAiBillingApi.class, config.getBaseUrl());
        log.info("[OpenAI] Provider initialized (model label: {})", identity.modelName());
    }

    @Override
    public ProviderIdentity getIdentity() {
        return identity;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public UsageRecord fetchUsage() throws ProviderException {
        if (billingApi == null) {
            throw new IllegalStateException("OpenAI provider is not enabled");
        }
        BillingPeriod period = BillingPeriod.monthToDate(clock);
        try {
            OpenAiBillingApi.UsageResponse usage = billingApi.getUsage(apiKey,
                    period.startDate().toString(), period.endDateExclusive().toString());
            OpenAiBillingApi.SubscriptionResponse subscription = billingApi.getSubscription(apiKey);
            return OpenAiUsageNormalizer.normalize(usage, subscription);
        } catch (FeignException e) {
            throw FeignErrors.translate(PROVIDER_NAME, e);
        }
    }
}
