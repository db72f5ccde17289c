package me.golemcore.costexporter.domain.model;

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

import lombok.Builder;

import java.util.Optional;

/**
 * Normalized usage snapshot for one provider and model at one poll tick.
 *
 * <p>
 * Immutable. {@code costReported} marks a cost the provider reported directly;
 * such a cost is authoritative and is never replaced by a token-based estimate.
 * {@code remainingBalance} is {@code null} when the account has no fixed limit.
 *
 * @param costUsd
 *            cost in USD, finite and never negative
 * @param costReported
 *            whether {@code costUsd} came from the provider
 * @param promptTokens
 *            prompt (input) tokens
 * @param completionTokens
 *            completion (output) tokens
 * @param requestCount
 *            number of requests
 * @param remainingBalance
 *            remaining budget in USD, or {@code null} when not applicable
 */
@Builder(toBuilder = true)
public record UsageRecord(
        double costUsd,
        boolean costReported,
        long promptTokens,
        long completionTokens,
        long requestCount,
        Double remainingBalance) {

    public UsageRecord {
        if (costUsd < 0 || !Double.isFinite(costUsd)) {
            throw new IllegalArgumentException("costUsd must be finite and >= 0: " + costUsd);
        }
        if (promptTokens < 0 || completionTokens < 0 || requestCount < 0) {
            throw new IllegalArgumentException("token and request counts must be >= 0");
        }
    }

    public Optional<Double> balance() {
        return Optional.ofNullable(remainingBalance);
    }
}
