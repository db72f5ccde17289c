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

import me.golemcore.costexporter.domain.model.PricingRule;
import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.infrastructure.config.ExporterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives USD cost from token counts using a per-model rate table.
 *
 * <p>
 * The table starts from built-in defaults and is overlaid with
 * {@code exporter.pricing.*}. It is read-only after construction. Unknown
 * models cost 0.0; this is not an error.
 *
 * <p>
 * Pricing is applied only to records without a provider-reported cost.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class PricingService {

    private static final double TOKENS_PER_RATE_UNIT = 1000.0;

    private static final Map<String, PricingRule> DEFAULT_RULES = Map.of(
            "gpt-4", new PricingRule(0.03, 0.06),
            "gpt-3.5-turbo", new PricingRule(0.0015, 0.002),
            "claude-3-5-sonnet-20241022", new PricingRule(0.003, 0.015),
            "anthropic.claude-3-5-sonnet-20241022-v2:0", new PricingRule(0.003, 0.015));

    private final Map<String, PricingRule> rules;

    public PricingService(ExporterProperties properties) {
        Map<String, PricingRule> merged = new LinkedHashMap<>(DEFAULT_RULES);
        for (Map.Entry<String, ExporterProperties.PricingProperties> entry : properties.getPricing().entrySet()) {
            ExporterProperties.PricingProperties rates = entry.getValue();
            merged.put(entry.getKey(), new PricingRule(rates.getPromptRatePer1k(), rates.getCompletionRatePer1k()));
        }
        this.rules = Collections.unmodifiableMap(merged);
        log.info("[Pricing] Loaded {} pricing rules", rules.size());
    }

    public double cost(String model, long promptTokens, long completionTokens) {
        PricingRule rule = model != null ? rules.get(model) : null;
        if (rule == null) {
            return 0.0;
        }
        return (promptTokens * rule.promptRatePer1k() + completionTokens * rule.completionRatePer1k())
                / TOKENS_PER_RATE_UNIT;
    }

    /**
     * Returns the record with a derived cost, or the record itself when the
     * provider already reported its cost.
     */
    public UsageRecord price(String model, UsageRecord record) {
        if (record.costReported()) {
            return record;
        }
        if (!rules.containsKey(model)) {
            log.debug("[Pricing] No rule for model '{}', cost is 0", model);
        }
        return record.toBuilder()
                .costUsd(cost(model, record.promptTokens(), record.completionTokens()))
                .build();
    }

    public Map<String, PricingRule> getRules() {
        return rules;
    }
}
