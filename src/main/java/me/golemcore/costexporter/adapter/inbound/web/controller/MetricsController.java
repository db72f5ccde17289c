package me.golemcore.costexporter.adapter.inbound.web.controller;

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

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Prometheus scrape endpoint.
 *
 * <p>
 * Renders the current registry in text format 0.0.4. Provider failures never
 * affect the status code; a provider without data simply has no series.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class MetricsController {

    private final CollectorRegistry collectorRegistry;

    @GetMapping("/metrics")
    public Mono<ResponseEntity<String>> scrape() {
        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, collectorRegistry.metricFamilySamples());
        } catch (IOException | RuntimeException e) {
            log.error("[Metrics] Failed to encode metrics: {}", e.getMessage(), e);
            return Mono.just(ResponseEntity.internalServerError().build());
        }
        return Mono.just(ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004)
                .body(writer.toString()));
    }
}
