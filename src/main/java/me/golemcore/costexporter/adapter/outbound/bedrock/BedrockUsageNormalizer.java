package me.golemcore.costexporter.adapter.outbound.bedrock;

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
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;

/**
 * Sums daily CloudWatch datapoints into a {@link UsageRecord}. Bedrock reports
 * no cost and no balance; cost is derived from tokens by the pricing service.
 */
final class BedrockUsageNormalizer {

    private BedrockUsageNormalizer() {
    }

    static UsageRecord normalize(GetMetricStatisticsResponse inputTokens, GetMetricStatisticsResponse outputTokens,
            GetMetricStatisticsResponse invocations) throws ProviderException {
        return UsageRecord.builder()
                .promptTokens(sum(inputTokens))
                .completionTokens(sum(outputTokens))
                .requestCount(sum(invocations))
                .build();
    }

    private static long sum(GetMetricStatisticsResponse response) throws ProviderException {
        if (response == null) {
            throw ProviderException.decode(BedrockUsageAdapter.PROVIDER_NAME, "Empty metric statistics response");
        }
        double total = 0;
        for (Datapoint datapoint : response.datapoints()) {
            Double value = datapoint.sum();
            if (value == null || !Double.isFinite(value) || value < 0) {
                throw ProviderException.decode(BedrockUsageAdapter.PROVIDER_NAME,
                        "Invalid " + response.label() + " datapoint: " + value);
            }
            total += value;
        }
        return Math.round(total);
    }
}
