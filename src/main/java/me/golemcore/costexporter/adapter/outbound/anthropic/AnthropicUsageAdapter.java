package me.golemcore.costexporter.adapter.outbound.anthropic;

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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Usage adapter for the Anthropic Admin API.
 *
 * <p>
 * Each fetch reads the month-to-date messages usage report (grouped by model)
 * and, unless disabled, the cost report. Both reports are paged; pages are
 * followed while {@code has_more} is set, up to {@value #MAX_PAGES} pages. A
 * report that cannot be read to its end fails the fetch, so partial totals are
 * never published.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code exporter.providers.anthropic.enabled} - Enable/disable</li>
 * <li>{@code exporter.providers.anthropic.api-key} - Admin API key, required
 * when enabled ({@code ANTHROPIC_ADMIN_API_KEY})</li>
 * <li>{@code exporter.providers.anthropic.model} - model to report</li>
 * <li>{@code exporter.providers.anthropic.cost-report-enabled} - read the cost
 * report (default true); if false cost is derived from tokens</li>
 * </ul>
 *
 * <p>
 * Provider name: {@code "anthropic"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnthropicUsageAdapter implements UsageProviderPort {

    static final String PROVIDER_NAME = "anthropic";
    static final int MAX_PAGES = 31;
    private static final int DAILY_BUCKET_LIMIT = 31;

    private static final String PARAM_STARTING_AT = "starting_at";
    private static final String PARAM_ENDING_AT = "ending_at";
    private static final String PARAM_BUCKET_WIDTH = "bucket_width";
    private static final String PARAM_GROUP_BY = "group_by[]";
    private static final String PARAM_LIMIT = "limit";
    private static final String PARAM_PAGE = "page";

    private final ExporterProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final Clock clock;

    private AnthropicAdminApi adminApi;
    private ProviderIdentity identity;
    private boolean enabled;
    private boolean costReportEnabled;
    private String apiKey;
    private String apiVersion;

    @PostConstruct
    public void init() {
        ExporterProperties.AnthropicProperties config = properties.getProviders().getAnthropic();
        this.enabled = config.isEnabled();
        this.apiKey = config.getApiKey();
        this.apiVersion = config.getApiVersion();
        this.costReportEnabled = config.isCostReportEnabled();
        this.identity = new ProviderIdentity(PROVIDER_NAME, config.getModel());

        if (!enabled) {
            log.info("[Anthropic] Provider disabled");
            return;
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(config.getApiKeyVariable()
                    + " is not set; it is required while the Anthropic provider is enabled");
        }

        this.adminApi = feignClientFactory.create(AnthropicAdminApi.class, config.getBaseUrl());
        log.info("[Anthropic] Provider initialized (model: {}, cost report: {})",
                identity.modelName(), costReportEnabled);
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
        if (adminApi == null) {
            throw new IllegalStateException("Anthropic provider is not enabled");
        }
        BillingPeriod period = BillingPeriod.monthToDate(clock);
        try {
            List<AnthropicAdminApi.UsageReport> usagePages = fetchPages(
                    page -> adminApi.getMessagesUsage(apiKey, apiVersion, usageQuery(period, "model", page)),
                    AnthropicAdminApi.UsageReport::getHasMore,
                    AnthropicAdminApi.UsageReport::getNextPage);

            List<AnthropicAdminApi.CostReport> costPages = null;
            if (costReportEnabled) {
                costPages = fetchPages(
                        page -> adminApi.getCostReport(apiKey, apiVersion, usageQuery(period, "description", page)),
                        AnthropicAdminApi.CostReport::getHasMore,
                        AnthropicAdminApi.CostReport::getNextPage);
            }
            return AnthropicUsageNormalizer.normalize(identity.modelName(), usagePages, costPages);
        } catch (FeignException e) {
            throw FeignErrors.translate(PROVIDER_NAME, e);
        }
    }

    private <T> List<T> fetchPages(Function<String, T> call, Function<T, Boolean> hasMore,
            Function<T, String> nextPage) throws ProviderException {
        List<T> pages = new ArrayList<>();
        String page = null;
        while (true) {
            T response = call.apply(page);
            pages.add(response);
            if (response == null || !Boolean.TRUE.equals(hasMore.apply(response))) {
                return pages;
            }
            page = nextPage.apply(response);
            if (page == null) {
                throw ProviderException.decode(PROVIDER_NAME,
                        "Report truncated: has_more is set but next_page is missing");
            }
            if (pages.size() >= MAX_PAGES) {
                throw ProviderException.decode(PROVIDER_NAME,
                        "Report truncated: more than " + MAX_PAGES + " pages");
            }
        }
    }

    private Map<String, Object> usageQuery(BillingPeriod period, String groupBy, String page) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put(PARAM_STARTING_AT, period.start().toString());
        query.put(PARAM_ENDING_AT, period.end().toString());
        query.put(PARAM_BUCKET_WIDTH, "1d");
        query.put(PARAM_GROUP_BY, groupBy);
        query.put(PARAM_LIMIT, DAILY_BUCKET_LIMIT);
        if (page != null) {
            query.put(PARAM_PAGE, page);
        }
        return query;
    }
}
