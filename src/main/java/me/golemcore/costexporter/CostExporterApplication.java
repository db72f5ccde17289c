package me.golemcore.costexporter;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the LLM cost exporter.
 *
 * <p>
 * The exporter polls usage and billing data from LLM API providers on a fixed
 * interval and republishes it as Prometheus gauges on {@code GET /metrics}.
 *
 * <h2>Providers</h2>
 * <ul>
 * <li><b>openai</b> - month-to-date spend and remaining hard-limit balance</li>
 * <li><b>anthropic</b> - admin usage and cost reports</li>
 * <li><b>bedrock</b> - CloudWatch token and invocation metrics, optionally
 * through an assumed IAM role</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Timer            → UsagePollingScheduler
 * Domain           → ProviderCatalog, UsageCollectionService, PricingService
 * Outbound         → OpenAI / Anthropic / Bedrock usage adapters
 * Inbound          → MetricsController (Prometheus text format), HealthController
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code exporter.*}
 * prefix, with environment variables as the usual source of values.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CostExporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostExporterApplication.class, args);
    }

}
