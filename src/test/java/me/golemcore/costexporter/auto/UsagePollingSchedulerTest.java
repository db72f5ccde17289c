package me.golemcore.costexporter.auto;

import me.golemcore.costexporter.domain.model.ProviderIdentity;
import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.domain.service.ProviderCatalog;
import me.golemcore.costexporter.domain.service.UsageCollectionService;
import me.golemcore.costexporter.infrastructure.config.ConfigurationException;
import me.golemcore.costexporter.infrastructure.config.ExporterProperties;
import me.golemcore.costexporter.metrics.UsageMetricsRegistry;
import me.golemcore.costexporter.port.outbound.ProviderException;
import me.golemcore.costexporter.port.outbound.UsageProviderPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UsagePollingSchedulerTest {

    private static final ProviderIdentity OPENAI = new ProviderIdentity("openai", "gpt-4");
    private static final ProviderIdentity ANTHROPIC = new ProviderIdentity("anthropic", "claude");
    private static final ProviderIdentity BEDROCK = new ProviderIdentity("bedrock", "titan");

    private UsageProviderPort openai;
    private UsageProviderPort anthropic;
    private UsageProviderPort bedrock;
    private ProviderCatalog catalog;
    private UsageCollectionService collectionService;
    private UsageMetricsRegistry metricsRegistry;
    private ExporterProperties properties;
    private UsagePollingScheduler scheduler;

    @BeforeEach
    void setUp() {
        openai = provider(OPENAI);
        anthropic = provider(ANTHROPIC);
        bedrock = provider(BEDROCK);

        catalog = mock(ProviderCatalog.class);
        when(catalog.getProviders()).thenReturn(List.of(openai, anthropic, bedrock));

        collectionService = mock(UsageCollectionService.class);
        metricsRegistry = new UsageMetricsRegistry(new LinkedHashSet<>(List.of(OPENAI, ANTHROPIC, BEDROCK)));
        properties = new ExporterProperties();
        scheduler = new UsagePollingScheduler(catalog, collectionService, metricsRegistry, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void shouldPublishAllSuccessfulProviders() throws Exception {
        when(collectionService.collect(openai)).thenReturn(record(1));
        when(collectionService.collect(anthropic)).thenReturn(record(2));
        when(collectionService.collect(bedrock)).thenReturn(record(3));

        scheduler.tick().get(5, TimeUnit.SECONDS);

        Map<ProviderIdentity, UsageRecord> snapshot = metricsRegistry.snapshot();
        assertEquals(3, snapshot.size());
        assertEquals(2.0, snapshot.get(ANTHROPIC).costUsd());
        assertEquals(6.0, metricsRegistry.getTotalCost(), 1e-9);
    }

    @Test
    void shouldIsolateFailingProvider() throws Exception {
        when(collectionService.collect(openai)).thenThrow(ProviderException.auth("openai", "401", null));
        when(collectionService.collect(anthropic)).thenReturn(record(2));
        when(collectionService.collect(bedrock)).thenReturn(record(3));

        scheduler.tick().get(5, TimeUnit.SECONDS);

        Map<ProviderIdentity, UsageRecord> snapshot = metricsRegistry.snapshot();
        assertFalse(snapshot.containsKey(OPENAI));
        assertEquals(2.0, snapshot.get(ANTHROPIC).costUsd());
        assertEquals(3.0, snapshot.get(BEDROCK).costUsd());
    }

    @Test
    void shouldKeepPreviousValuesWhenProviderFailsLater() throws Exception {
        when(collectionService.collect(openai))
                .thenReturn(record(10))
                .thenThrow(ProviderException.network("openai", "timeout", null));
        when(collectionService.collect(anthropic)).thenReturn(record(2), record(4));
        when(collectionService.collect(bedrock)).thenReturn(record(3), record(5));

        scheduler.tick().get(5, TimeUnit.SECONDS);
        scheduler.tick().get(5, TimeUnit.SECONDS);

        Map<ProviderIdentity, UsageRecord> snapshot = metricsRegistry.snapshot();
        assertEquals(10.0, snapshot.get(OPENAI).costUsd());
        assertEquals(4.0, snapshot.get(ANTHROPIC).costUsd());
        assertEquals(5.0, snapshot.get(BEDROCK).costUsd());
    }

    @Test
    void shouldSurviveConfigurationAndRuntimeErrors() throws Exception {
        when(collectionService.collect(openai)).thenThrow(new ConfigurationException("assume role failed"));
        when(collectionService.collect(anthropic)).thenThrow(new IllegalStateException("bug"));
        when(collectionService.collect(bedrock)).thenReturn(record(3));

        scheduler.tick().get(5, TimeUnit.SECONDS);

        assertEquals(List.of(BEDROCK), List.copyOf(metricsRegistry.snapshot().keySet()));
    }

    @Test
    void shouldDiscardResultOfOlderTick() throws Exception {
        UsageRecord newer = record(20);
        UsageRecord older = record(10);
        when(collectionService.collect(openai)).thenReturn(newer, older);

        scheduler.poll(openai, 2);
        scheduler.poll(openai, 1);

        assertSame(newer, metricsRegistry.snapshot().get(OPENAI));
        assertEquals(20.0, metricsRegistry.getTotalCost(), 1e-9);
    }

    @Test
    void shouldNotWaitForSlowProviderBeforeNextTick() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(collectionService.collect(openai)).thenAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return record(1);
        }).thenReturn(record(7));
        when(collectionService.collect(anthropic)).thenReturn(record(2));
        when(collectionService.collect(bedrock)).thenReturn(record(3));

        CompletableFuture<Void> slowTick = scheduler.tick();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        scheduler.tick().get(5, TimeUnit.SECONDS);
        assertEquals(7.0, metricsRegistry.snapshot().get(OPENAI).costUsd());

        release.countDown();
        slowTick.get(5, TimeUnit.SECONDS);
        // The slow result belongs to tick 1 and must not overwrite tick 2
        assertEquals(7.0, metricsRegistry.snapshot().get(OPENAI).costUsd());
    }

    @Test
    void shouldRunFirstTickOnStart() throws Exception {
        properties.getPolling().setInterval(Duration.ofHours(1));
        when(collectionService.collect(any())).thenReturn(record(1));

        scheduler.init();

        verify(collectionService, timeout(5000)).collect(openai);
        verify(collectionService, timeout(5000)).collect(bedrock);
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        properties.getPolling().setInterval(Duration.ZERO);

        assertThrows(ConfigurationException.class, scheduler::init);
    }

    private static UsageProviderPort provider(ProviderIdentity identity) {
        UsageProviderPort provider = mock(UsageProviderPort.class);
        when(provider.getIdentity()).thenReturn(identity);
        when(provider.isEnabled()).thenReturn(true);
        return provider;
    }

    private static UsageRecord record(double cost) {
        return UsageRecord.builder().costUsd(cost).costReported(true).build();
    }
}
