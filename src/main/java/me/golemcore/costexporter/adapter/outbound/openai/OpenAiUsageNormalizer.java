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

import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.port.outbound.ProviderException;

/**
 * Maps OpenAI billing responses to a {@link UsageRecord}.
 *
 * <p>
 * Spend is reported in cents and is authoritative. The remaining balance is
 * the hard limit minus spend, and only exists when a payment method is on
 * file; pay-as-you-go and free-tier accounts have no balance. Token and
 * request counts are not reported by these endpoints and stay zero.
 */
final class OpenAiUsageNormalizer {

    private static final double CENTS_PER_DOLLAR = 100.0;

    private OpenAiUsageNormalizer() {
    }

    static UsageRecord normalize(OpenAiBillingApi.UsageResponse usage,
            OpenAiBillingApi.SubscriptionResponse subscription) throws ProviderException {
        if (usage == null || usage.getTotalUsage() == null) {
            throw ProviderException.decode(OpenAiUsageAdapter.PROVIDER_NAME, "Usage response missing total_usage");
        }
        if (subscription == null || subscription.getHasPaymentMethod() == null) {
            throw ProviderException.decode(OpenAiUsageAdapter.PROVIDER_NAME,
                    "Subscription response missing has_payment_method");
        }

        double currentSpend = usage.getTotalUsage() / CENTS_PER_DOLLAR;
        if (currentSpend < 0 || !Double.isFinite(currentSpend)) {
            throw ProviderException.decode(OpenAiUsageAdapter.PROVIDER_NAME,
                    "Invalid total_usage: " + usage.getTotalUsage());
        }

        Double remainingBalance = null;
        if (subscription.getHasPaymentMethod()) {
            if (subscription.getHardLimitUsd() == null) {
                throw ProviderException.decode(OpenAiUsageAdapter.PROVIDER_NAME,
                        "Subscription response missing hard_limit_usd");
            }
            remainingBalance = subscription.getHardLimitUsd() - currentSpend;
        }

        return UsageRecord.builder()
                .costUsd(currentSpend)
                .costReported(true)
                .remainingBalance(remainingBalance)
                .build();
    }
}
