package me.golemcore.costexporter.infrastructure.http;

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

import me.golemcore.costexporter.infrastructure.config.ExporterProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Factory for creating Feign HTTP clients with OkHttp transport and Jackson
 * JSON encoding.
 *
 * <p>
 * All clients share:
 * <ul>
 * <li>OkHttp transport - shared connection pool and call timeout</li>
 * <li>Request options - connect/read timeouts from {@code exporter.http}, so
 * Feign does not replace them with its own defaults</li>
 * <li>No retryer - a failed request fails the provider for the current
 * tick</li>
 * <li>Jackson encoder/decoder - JSON serialization using the shared
 * ObjectMapper</li>
 * </ul>
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * OpenAiBillingApi client = factory.create(OpenAiBillingApi.class, "https://api.openai.com");
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final ExporterProperties properties;

    /**
     * Create a Feign client for the given API interface.
     */
    public <T> T create(Class<T> apiType, String baseUrl) {
        ExporterProperties.HttpProperties http = properties.getHttp();
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .options(new Request.Options(
                        http.getConnectTimeout(), TimeUnit.MILLISECONDS,
                        http.getReadTimeout(), TimeUnit.MILLISECONDS,
                        true))
                .retryer(Retryer.NEVER_RETRY)
                .target(apiType, baseUrl);
    }
}
