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

import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.port.outbound.ProviderException;

import java.math.BigDecimal;
import java.util.List;

/**
 * Maps Anthropic usage and cost report pages to a {@link UsageRecord}.
 *
 * <p>
 * Only results for the configured model are counted. Prompt tokens include
 * uncached, cache-read and cache-creation input tokens. Missing token fields
 * count as zero. When cost pages are given their amounts (cents) become the
 * reported cost; otherwise the record is left for the pricing service.
 * Anthropic exposes no billing limit, so there is never a balance.
 */
final class AnthropicUsageNormalizer {

    private static final BigDecimal CENTS_PER_DOLLAR = BigDecimal.valueOf(100);

    private AnthropicUsageNormalizer() {
    }

    static UsageRecord normalize(String model, List<AnthropicAdminApi.UsageReport> usagePages,
            List<AnthropicAdminApi.CostReport> costPages) throws ProviderException {
        long promptTokens = 0;
        long completionTokens = 0;

        for (AnthropicAdminApi.UsageReport page : usagePages) {
            if (page == null || page.getData() == null) {
                throw ProviderException.decode(AnthropicUsageAdapter.PROVIDER_NAME, "Usage report missing data");
            }
            for (AnthropicAdminApi.UsageBucket bucket : page.getData()) {
                if (bucket.getResults() == null) {
                    continue;
                }
                for (AnthropicAdminApi.UsageResult result : bucket.getResults()) {
                    if (!model.equals(result.getModel())) {
                        continue;
                    }
                    promptTokens += orZero(result.getUncachedInputTokens())
                            + orZero(result.getCacheReadInputTokens());
                    if (result.getCacheCreation() != null) {
                        promptTokens += orZero(result.getCacheCreation().getEphemeral1hInputTokens())
                                + orZero(result.getCacheCreation().getEphemeral5mInputTokens());
                    }
                    completionTokens += orZero(result.getOutputTokens());
                }
            }
        }

        UsageRecord.UsageRecordBuilder builder = UsageRecord.builder()
                .promptTokens(promptTokens)
                .completionTokens(completionTokens);

        if (costPages != null) {
            builder.costUsd(sumCost(model, costPages)).costReported(true);
        }
        return builder.build();
    }

    private static double sumCost(String model, List<AnthropicAdminApi.CostReport> costPages)
            throws ProviderException {
        BigDecimal cents = BigDecimal.ZERO;
        for (AnthropicAdminApi.CostReport page : costPages) {
            if (page == null || page.getData() == null) {
                throw ProviderException.decode(AnthropicUsageAdapter.PROVIDER_NAME, "Cost report missing data");
            }
            for (AnthropicAdminApi.CostBucket bucket : page.getData()) {
                if (bucket.getResults() == null) {
                    continue;
                }
                for (AnthropicAdminApi.CostResult result : bucket.getResults()) {
                    if (!model.equals(result.getModel())) {
                        continue;
                    }
                    cents = cents.add(parseAmount(result.getAmount()));
                }
            }
        }
        double usd = cents.divide(CENTS_PER_DOLLAR).doubleValue();
        if (!Double.isFinite(usd)) {
            throw ProviderException.decode(AnthropicUsageAdapter.PROVIDER_NAME, "Cost total out of range: " + cents);
        }
        return usd;
    }

    private static BigDecimal parseAmount(String amount) throws ProviderException {
        if (amount == null) {
            throw ProviderException.decode(AnthropicUsageAdapter.PROVIDER_NAME, "Cost result missing amount");
        }
        try {
            BigDecimal value = new BigDecimal(amount);
            if (value.signum() < 0) {
                throw ProviderException.decode(AnthropicUsageAdapter.PROVIDER_NAME, "Negative cost amount: " + amount);
            }
            return value;
        } catch (NumberFormatException e) {
            throw ProviderException.decode(AnthropicUsageAdapter.PROVIDER_NAME, "Invalid cost amount: " + amount, e);
        }
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
