package me.golemcore.costexporter.auto;

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

import me.golemcore.costexporter.domain.model.ProviderIdentity;
import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.domain.service.ProviderCatalog;
import me.golemcore.costexporter.domain.service.UsageCollectionService;
import me.golemcore.costexporter.infrastructure.config.ConfigurationException;
import me.golemcore.costexporter.infrastructure.config.ExporterProperties;
import me.golemcore.costexporter.metrics.UsageMetricsRegistry;
import me.golemcore.costexporter.port.outbound.ProviderException;
import me.golemcore.costexporter.port.outbound.UsageProviderPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-rate poller that collects usage from every enabled provider and
 * publishes it to the {@link UsageMetricsRegistry}.
 *
 * <p>
 * Each tick:
 * <ul>
 * <li>Gets a sequence number</li>
 * <li>Starts one poll per provider on the poller pool and returns without
 * waiting, so a slow provider never shifts the next tick</li>
 * <li>Applies a successful result only if no newer tick has already been
 * applied for that provider</li>
 * <li>Logs and drops failures; the provider keeps its previously published
 * values until a later tick succeeds</li>
 * </ul>
 *
 * <p>
 * In-flight polls are not cancelled when a new tick starts; the HTTP call
 * timeout bounds them.
 *
 * @since 1.0
 * @see UsageCollectionService
 */
@Component
@Slf4j
public class UsagePollingScheduler {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ProviderCatalog providerCatalog;
    private final UsageCollectionService collectionService;
    private final UsageMetricsRegistry metricsRegistry;
    private final ExporterProperties properties;

    private final AtomicLong tickSequence = new AtomicLong();
    private final Map<ProviderIdentity, AtomicLong> lastAppliedTick = new ConcurrentHashMap<>();
    private final ExecutorService pollers;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public UsagePollingScheduler(ProviderCatalog providerCatalog, UsageCollectionService collectionService,
            UsageMetricsRegistry metricsRegistry, ExporterProperties properties) {
        this.providerCatalog = providerCatalog;
        this.collectionService = collectionService;
        this.metricsRegistry = metricsRegistry;
        this.properties = properties;

        AtomicInteger threadIndex = new AtomicInteger();
        this.pollers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "usage-poller-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        Duration interval = properties.getPolling().getInterval();
        Duration initialDelay = properties.getPolling().getInitialDelay();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ConfigurationException("exporter.polling.interval must be positive, got " + interval);
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "usage-poll-scheduler");
            t.setDaemon(true);
            return t;
        });

        tickTask = scheduler.scheduleAtFixedRate(
                this::runTick,
                initialDelay.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);

        log.info("[Poller] Started with interval {} for {} provider(s)",
                interval, providerCatalog.getProviders().size());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
        pollers.shutdown();
        try {
            if (scheduler != null && !scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
            if (!pollers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                pollers.shutdownNow();
            }
        } catch (InterruptedException e) {
            if (scheduler != null) {
                scheduler.shutdownNow();
            }
            pollers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Poller] Shut down");
    }

    private void runTick() {
        // An exception escaping here would cancel all future ticks
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("[Poller] Tick failed to start: {}", e.getMessage(), e);
        }
    }

    /**
     * Start one poll per enabled provider.
     *
     * @return future completing when every poll of this tick has finished,
     *         successfully or not
     */
    CompletableFuture<Void> tick() {
        long sequence = tickSequence.incrementAndGet();
        List<UsageProviderPort> providers = providerCatalog.getProviders();
        log.debug("[Poller] Tick {}: polling {} provider(s)", sequence, providers.size());

        CompletableFuture<?>[] polls = providers.stream()
                .map(provider -> CompletableFuture.runAsync(() -> poll(provider, sequence), pollers))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(polls);
    }

    void poll(UsageProviderPort provider, long sequence) {
        ProviderIdentity identity = provider.getIdentity();
        try {
            UsageRecord record = collectionService.collect(provider);
            apply(identity, record, sequence);
        } catch (ProviderException e) {
            log.warn("[Poller] {} poll failed ({}): {}", identity, e.getReason(), e.getMessage());
        } catch (ConfigurationException e) {
            log.error("[Poller] {} skipped, configuration or credential error: {}", identity, e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - a provider must never take down the loop
            log.error("[Poller] {} poll failed unexpectedly: {}", identity, e.getMessage(), e);
        }
    }

    private void apply(ProviderIdentity identity, UsageRecord record, long sequence) {
        AtomicLong lastApplied = lastAppliedTick.computeIfAbsent(identity, k -> new AtomicLong());
        synchronized (lastApplied) {
            if (sequence <= lastApplied.get()) {
                log.debug("[Poller] {} result from tick {} discarded, tick {} already applied",
                        identity, sequence, lastApplied.get());
                return;
            }
            lastApplied.set(sequence);
            metricsRegistry.update(identity, record);
        }
        log.info("[Poller] {} updated: cost=${}, prompt={}, completion={}, requests={}",
                identity, record.costUsd(), record.promptTokens(), record.completionTokens(),
                record.requestCount());
    }
}
