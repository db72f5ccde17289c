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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;

/**
 * OpenAI billing endpoints used for spend and limit tracking.
 */
interface OpenAiBillingApi {

    @RequestLine("GET /v1/dashboard/billing/usage?start_date={startDate}&end_date={endDate}")
    @Headers({
            "Accept: application/json",
            "Authorization: Bearer {apiKey}"
    })
    UsageResponse getUsage(
            @Param("apiKey") String apiKey,
            @Param("startDate") String startDate,
            @Param("endDate") String endDate);

    @RequestLine("GET /v1/dashboard/billing/subscription")
    @Headers({
            "Accept: application/json",
            "Authorization: Bearer {apiKey}"
    })
    SubscriptionResponse getSubscription(@Param("apiKey") String apiKey);

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class UsageResponse {
        /** Accrued spend in cents. */
        @JsonProperty("total_usage")
        private Double totalUsage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class SubscriptionResponse {
        @JsonProperty("hard_limit_usd")
        private Double hardLimitUsd;

        @JsonProperty("has_payment_method")
        private Boolean hasPaymentMethod;
    }
}
