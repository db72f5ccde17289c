package me.golemcore.costexporter.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the exporter, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code exporter.*} prefix:
 * <ul>
 * <li>{@link PollingProperties} - poll interval</li>
 * <li>{@link HttpProperties} - shared HTTP client timeouts</li>
 * <li>{@link ProvidersProperties} - per-provider credentials and models</li>
 * <li>{@code pricing} - per-model token rates, merged over built-in
 * defaults</li>
 * </ul>
 *
 * <p>
 * Values normally come from environment variables through placeholders in
 * {@code application.yml}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "exporter")
@Data
public class ExporterProperties {

    private PollingProperties polling = new PollingProperties();
    private HttpProperties http = new HttpProperties();
    private ProvidersProperties providers = new ProvidersProperties();
    private Map<String, PricingProperties> pricing = new LinkedHashMap<>();

    @Data
    public static class PollingProperties {
        /** Fixed tick period. Plain numbers are seconds. */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration interval = Duration.ofMinutes(5);
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration initialDelay = Duration.ZERO;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        /** Upper bound for one provider call, including redirects and body. */
        private long callTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== PROVIDERS ====================

    @Data
    public static class ProvidersProperties {
        private OpenAiProperties openai = new OpenAiProperties();
        private AnthropicProperties anthropic = new AnthropicProperties();
        private BedrockProperties bedrock = new BedrockProperties();
    }

    @Data
    public static class OpenAiProperties {
        private boolean enabled = true;
        private String apiKey;
        private String apiKeyVariable = "OPENAI_API_KEY";
        private String baseUrl = "https://api.openai.com";
        private String model = "gpt-4";
    }

    @Data
    public static class AnthropicProperties {
        private boolean enabled = false;
        private String apiKey;
        private String apiKeyVariable = "ANTHROPIC_ADMIN_API_KEY";
        private String baseUrl = "https://api.anthropic.com";
        private String apiVersion = "2023-06-01";
        private String model = "claude-3-5-sonnet-20241022";
        /**
         * If false, the cost report is not requested and cost is derived from
         * token counts.
         */
        private boolean costReportEnabled = true;
    }

    @Data
    public static class BedrockProperties {
        private boolean enabled = false;
        private String region = "us-east-1";
        private String model = "anthropic.claude-3-5-sonnet-20241022-v2:0";
        private AssumeRoleProperties assumeRole = new AssumeRoleProperties();
    }

    @Data
    public static class AssumeRoleProperties {
        private boolean enabled = false;
        private String roleArn;
        private String roleArnVariable = "BEDROCK_ROLE_ARN";
        private String sessionName = "llm-cost-exporter";
        private Duration duration = Duration.ofHours(1);
        /** Leases are renewed this long before they expire. */
        private Duration refreshSkew = Duration.ofSeconds(60);
    }

    // ==================== PRICING ====================

    @Data
    public static class PricingProperties {
        private double promptRatePer1k;
        private double completionRatePer1k;
    }
}
