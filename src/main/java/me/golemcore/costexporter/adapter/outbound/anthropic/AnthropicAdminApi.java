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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.QueryMap;
import feign.RequestLine;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Admin API usage and cost reports.
 */
interface AnthropicAdminApi {

    @RequestLine("GET /v1/organizations/usage_report/messages")
    @Headers({
            "Accept: application/json",
            "x-api-key: {apiKey}",
            "anthropic-version: {version}"
    })
    UsageReport getMessagesUsage(
            @Param("apiKey") String apiKey,
            @Param("version") String version,
            @QueryMap Map<String, Object> query);

    @RequestLine("GET /v1/organizations/cost_report")
    @Headers({
            "Accept: application/json",
            "x-api-key: {apiKey}",
            "anthropic-version: {version}"
    })
    CostReport getCostReport(
            @Param("apiKey") String apiKey,
            @Param("version") String version,
            @QueryMap Map<String, Object> query);

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class UsageReport {
        private List<UsageBucket> data;

        @JsonProperty("has_more")
        private Boolean hasMore;

        @JsonProperty("next_page")
        private String nextPage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class UsageBucket {
        @JsonProperty("starting_at")
        private Instant startingAt;

        @JsonProperty("ending_at")
        private Instant endingAt;

        private List<UsageResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class UsageResult {
        private String model;

        @JsonProperty("uncached_input_tokens")
        private Long uncachedInputTokens;

        @JsonProperty("cache_read_input_tokens")
        private Long cacheReadInputTokens;

        @JsonProperty("cache_creation")
        private CacheCreation cacheCreation;

        @JsonProperty("output_tokens")
        private Long outputTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class CacheCreation {
        @JsonProperty("ephemeral_1h_input_tokens")
        private Long ephemeral1hInputTokens;

        @JsonProperty("ephemeral_5m_input_tokens")
        private Long ephemeral5mInputTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class CostReport {
        private List<CostBucket> data;

        @JsonProperty("has_more")
        private Boolean hasMore;

        @JsonProperty("next_page")
        private String nextPage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class CostBucket {
        private List<CostResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class CostResult {
        private String model;

        /** Cost in cents, as a decimal string. */
        private String amount;

        private String currency;
    }
}
