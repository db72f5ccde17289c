package me.golemcore.costexporter.metrics;

import me.golemcore.costexporter.domain.model.ProviderIdentity;
import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.infrastructure.config.ConfigurationException;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UsageMetricsRegistryTest {

    private static final ProviderIdentity OPENAI = new ProviderIdentity("openai", "gpt-4");
    private static final ProviderIdentity BEDROCK = new ProviderIdentity("bedrock", "claude");
    private static final String[] KEY_LABELS = { "provider", "model" };
    private static final String[] TOKEN_LABELS = { "provider", "model", "type" };

    private CollectorRegistry collectorRegistry;
    private UsageMetricsRegistry registry;

    @BeforeEach
    void setUp() {
        collectorRegistry = new CollectorRegistry();
        registry = new UsageMetricsRegistry(new LinkedHashSet<>(List.of(OPENAI, BEDROCK)));
        registry.registerAll(collectorRegistry);
    }

    @Test
    void shouldRejectSecondRegistration() {
        assertThrows(ConfigurationException.class, () -> registry.registerAll(collectorRegistry));
    }

    @Test
    void shouldRejectUnknownIdentity() {
        ProviderIdentity unknown = new ProviderIdentity("openai", "gpt-4o");
        UsageRecord record = UsageRecord.builder().build();

        assertThrows(IllegalArgumentException.class, () -> registry.update(unknown, record));
        assertTrue(registry.snapshot().isEmpty());
    }

    @Test
    void shouldExposeAllSeriesForUpdatedProvider() {
        registry.update(OPENAI, UsageRecord.builder()
                .costUsd(50.0)
                .costReported(true)
                .promptTokens(1200)
                .completionTokens(300)
                .requestCount(7)
                .remainingBalance(50.0)
                .build());

        assertEquals(50.0, value(UsageMetricsRegistry.METRIC_COST, OPENAI));
        assertEquals(7.0, value(UsageMetricsRegistry.METRIC_REQUESTS, OPENAI));
        assertEquals(50.0, value(UsageMetricsRegistry.METRIC_REMAINING_BALANCE, OPENAI));
        assertEquals(1200.0, collectorRegistry.getSampleValue(UsageMetricsRegistry.METRIC_TOKENS, TOKEN_LABELS,
                new String[] { "openai", "gpt-4", "prompt" }));
        assertEquals(300.0, collectorRegistry.getSampleValue(UsageMetricsRegistry.METRIC_TOKENS, TOKEN_LABELS,
                new String[] { "openai", "gpt-4", "completion" }));
        assertEquals(50.0, collectorRegistry.getSampleValue(UsageMetricsRegistry.METRIC_TOTAL_COST));
    }

    @Test
    void shouldOmitBalanceWhenNotApplicable() {
        registry.update(BEDROCK, UsageRecord.builder().costUsd(1.5).promptTokens(10).build());

        assertEquals(1.5, value(UsageMetricsRegistry.METRIC_COST, BEDROCK));
        assertNull(value(UsageMetricsRegistry.METRIC_REMAINING_BALANCE, BEDROCK));
    }

    @Test
    void shouldDropBalanceWhenLaterRecordHasNone() {
        registry.update(OPENAI, UsageRecord.builder().costUsd(10).remainingBalance(90.0).build());
        registry.update(OPENAI, UsageRecord.builder().costUsd(11).build());

        assertNull(value(UsageMetricsRegistry.METRIC_REMAINING_BALANCE, OPENAI));
    }

    @Test
    void shouldKeepOneSeriesPerKeyAcrossUpdates() {
        for (int i = 1; i <= 5; i++) {
            registry.update(OPENAI, UsageRecord.builder().costUsd(i).promptTokens(i * 100L).build());
        }

        Map<String, Collector.MetricFamilySamples> families = families();
        assertEquals(1, families.get(UsageMetricsRegistry.METRIC_COST).samples.size());
        assertEquals(2, families.get(UsageMetricsRegistry.METRIC_TOKENS).samples.size());
        assertEquals(5.0, value(UsageMetricsRegistry.METRIC_COST, OPENAI));
    }

    @Test
    void shouldAccumulateTotalCostMonotonically() {
        registry.update(OPENAI, UsageRecord.builder().costUsd(10).build());
        registry.update(BEDROCK, UsageRecord.builder().costUsd(2).build());
        registry.update(OPENAI, UsageRecord.builder().costUsd(0).build());

        assertEquals(12.0, registry.getTotalCost(), 1e-9);
        assertEquals(0.0, value(UsageMetricsRegistry.METRIC_COST, OPENAI));
    }

    @Test
    void shouldReturnImmutableSnapshotInStartupOrder() {
        UsageRecord bedrockRecord = UsageRecord.builder().costUsd(1).build();
        UsageRecord openaiRecord = UsageRecord.builder().costUsd(2).build();
        registry.update(BEDROCK, bedrockRecord);
        registry.update(OPENAI, openaiRecord);

        Map<ProviderIdentity, UsageRecord> snapshot = registry.snapshot();

        assertEquals(List.of(OPENAI, BEDROCK), List.copyOf(snapshot.keySet()));
        assertSame(openaiRecord, snapshot.get(OPENAI));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(OPENAI));
    }

    @Test
    void shouldDescribeFamiliesBeforeAnyUpdate() {
        Map<String, Collector.MetricFamilySamples> families = families();

        assertEquals(Set.of(UsageMetricsRegistry.METRIC_COST, UsageMetricsRegistry.METRIC_TOKENS,
                UsageMetricsRegistry.METRIC_REQUESTS, UsageMetricsRegistry.METRIC_REMAINING_BALANCE,
                UsageMetricsRegistry.METRIC_TOTAL_COST), families.keySet());
        assertTrue(families.get(UsageMetricsRegistry.METRIC_COST).samples.isEmpty());
        assertEquals(0.0, collectorRegistry.getSampleValue(UsageMetricsRegistry.METRIC_TOTAL_COST));
    }

    private Double value(String metric, ProviderIdentity identity) {
        return collectorRegistry.getSampleValue(metric, KEY_LABELS,
                new String[] { identity.providerName(), identity.modelName() });
    }

    private Map<String, Collector.MetricFamilySamples> families() {
        Map<String, Collector.MetricFamilySamples> byName = new HashMap<>();
        for (Collector.MetricFamilySamples family : registry.collect()) {
            byName.put(family.name, family);
        }
        return byName;
    }
}
