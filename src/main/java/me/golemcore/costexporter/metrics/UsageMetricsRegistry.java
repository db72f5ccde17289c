package me.golemcore.costexporter.metrics;

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
import me.golemcore.costexporter.domain.model.TokenKind;
import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.infrastructure.config.ConfigurationException;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Holds the last published usage per provider and model and renders it as
 * Prometheus gauges.
 *
 * <p>
 * Series:
 * <ul>
 * <li>{@code llm_cost_usd{provider,model}}</li>
 * <li>{@code llm_tokens{provider,model,type}} - {@code prompt} and
 * {@code completion}</li>
 * <li>{@code llm_requests{provider,model}}</li>
 * <li>{@code llm_remaining_balance_usd{provider,model}} - only for providers
 * reporting a balance</li>
 * <li>{@code llm_total_cost_usd} - sum of every applied cost, never
 * decreases</li>
 * </ul>
 *
 * <p>
 * Each key maps to one immutable {@link UsageRecord}, replaced in a single
 * put, so a scrape never observes half of an update. The key set is fixed at
 * construction; updates for any other identity are rejected so upstream data
 * cannot grow the number of series.
 *
 * @since 1.0
 */
@Slf4j
public class UsageMetricsRegistry extends Collector implements Collector.Describable {

    public static final String METRIC_COST = "llm_cost_usd";
    public static final String METRIC_TOKENS = "llm_tokens";
    public static final String METRIC_REQUESTS = "llm_requests";
    public static final String METRIC_REMAINING_BALANCE = "llm_remaining_balance_usd";
    public static final String METRIC_TOTAL_COST = "llm_total_cost_usd";

    private static final String LABEL_PROVIDER = "provider";
    private static final String LABEL_MODEL = "model";
    private static final String LABEL_TYPE = "type";
    private static final List<String> KEY_LABELS = List.of(LABEL_PROVIDER, LABEL_MODEL);
    private static final List<String> TOKEN_LABELS = List.of(LABEL_PROVIDER, LABEL_MODEL, LABEL_TYPE);

    private final Set<ProviderIdentity> identities;
    private final Map<ProviderIdentity, UsageRecord> records = new ConcurrentHashMap<>();
    private final DoubleAdder totalCost = new DoubleAdder();

    public UsageMetricsRegistry(Set<ProviderIdentity> identities) {
        this.identities = Collections.unmodifiableSet(new LinkedHashSet<>(identities));
    }

    /**
     * Register all metric descriptors with the exposition registry. Must be
     * called once per process.
     *
     * @throws ConfigurationException
     *             if any descriptor is already registered
     */
    public void registerAll(CollectorRegistry collectorRegistry) {
        try {
            collectorRegistry.register(this);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Usage metric descriptors already registered: " + e.getMessage(), e);
        }
        log.info("[Metrics] Registered usage metrics for {} provider(s)", identities.size());
    }

    /**
     * Replace the published values for one provider and model.
     *
     * @throws IllegalArgumentException
     *             if the identity was not configured at startup
     */
    public void update(ProviderIdentity identity, UsageRecord record) {
        if (!identities.contains(identity)) {
            throw new IllegalArgumentException("Unknown provider identity: " + identity);
        }
        records.put(identity, record);
        totalCost.add(record.costUsd());
    }

    /**
     * Immutable copy of the current records, in startup order.
     */
    public Map<ProviderIdentity, UsageRecord> snapshot() {
        Map<ProviderIdentity, UsageRecord> copy = new LinkedHashMap<>();
        for (ProviderIdentity identity : identities) {
            UsageRecord record = records.get(identity);
            if (record != null) {
                copy.put(identity, record);
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    public double getTotalCost() {
        return totalCost.sum();
    }

    public Set<ProviderIdentity> getIdentities() {
        return identities;
    }

    @Override
    public List<MetricFamilySamples> collect() {
        List<MetricFamilySamples.Sample> cost = new ArrayList<>();
        List<MetricFamilySamples.Sample> tokens = new ArrayList<>();
        List<MetricFamilySamples.Sample> requests = new ArrayList<>();
        List<MetricFamilySamples.Sample> balance = new ArrayList<>();

        for (Map.Entry<ProviderIdentity, UsageRecord> entry : snapshot().entrySet()) {
            ProviderIdentity id = entry.getKey();
            UsageRecord record = entry.getValue();
            List<String> keyValues = List.of(id.providerName(), id.modelName());

            cost.add(new MetricFamilySamples.Sample(METRIC_COST, KEY_LABELS, keyValues, record.costUsd()));
            tokens.add(tokenSample(id, TokenKind.PROMPT, record.promptTokens()));
            tokens.add(tokenSample(id, TokenKind.COMPLETION, record.completionTokens()));
            requests.add(new MetricFamilySamples.Sample(METRIC_REQUESTS, KEY_LABELS, keyValues,
                    record.requestCount()));
            record.balance().ifPresent(value -> balance.add(
                    new MetricFamilySamples.Sample(METRIC_REMAINING_BALANCE, KEY_LABELS, keyValues, value)));
        }

        List<MetricFamilySamples.Sample> total = List.of(
                new MetricFamilySamples.Sample(METRIC_TOTAL_COST, List.of(), List.of(), totalCost.sum()));

        return List.of(
                gauge(METRIC_COST, "Cost of LLM API usage in USD", cost),
                gauge(METRIC_TOKENS, "Tokens used by LLM API", tokens),
                gauge(METRIC_REQUESTS, "Number of LLM API requests", requests),
                gauge(METRIC_REMAINING_BALANCE, "Remaining budget balance in USD", balance),
                gauge(METRIC_TOTAL_COST, "Total accumulated cost across all providers", total));
    }

    @Override
    public List<MetricFamilySamples> describe() {
        return List.of(
                gauge(METRIC_COST, "Cost of LLM API usage in USD", List.of()),
                gauge(METRIC_TOKENS, "Tokens used by LLM API", List.of()),
                gauge(METRIC_REQUESTS, "Number of LLM API requests", List.of()),
                gauge(METRIC_REMAINING_BALANCE, "Remaining budget balance in USD", List.of()),
                gauge(METRIC_TOTAL_COST, "Total accumulated cost across all providers", List.of()));
    }

    private static MetricFamilySamples.Sample tokenSample(ProviderIdentity id, TokenKind kind, long value) {
        return new MetricFamilySamples.Sample(METRIC_TOKENS, TOKEN_LABELS,
                List.of(id.providerName(), id.modelName(), kind.label()), value);
    }

    private static MetricFamilySamples gauge(String name, String help, List<MetricFamilySamples.Sample> samples) {
        return new MetricFamilySamples(name, Type.GAUGE, help, samples);
    }
}
