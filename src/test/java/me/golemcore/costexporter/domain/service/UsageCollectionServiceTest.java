package me.golemcore.costexporter.domain.service;

import me.golemcore.costexporter.domain.model.ProviderIdentity;
import me.golemcore.costexporter.domain.model.UsageRecord;
import me.golemcore.costexporter.infrastructure.config.ExporterProperties;
import me.golemcore.costexporter.port.outbound.ProviderException;
import me.golemcore.costexporter.port.outbound.UsageProviderPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class UsageCollectionServiceTest {

    private UsageProviderPort provider;
    private UsageCollectionService service;

    @BeforeEach
    void setUp() {
        provider = mock(UsageProviderPort.class);
        when(provider.getIdentity()).thenReturn(new ProviderIdentity("bedrock", "gpt-4"));
        service = new UsageCollectionService(new PricingService(new ExporterProperties()));
    }

    @Test
    void shouldPriceFetchedTokensByModel() throws ProviderException {
        when(provider.fetchUsage()).thenReturn(UsageRecord.builder()
                .promptTokens(1000)
                .completionTokens(1000)
                .requestCount(4)
                .build());

        UsageRecord record = service.collect(provider);

        assertEquals(0.09, record.costUsd(), 1e-9);
        assertEquals(4, record.requestCount());
    }

    @Test
    void shouldPropagateProviderFailure() throws ProviderException {
        when(provider.fetchUsage()).thenThrow(ProviderException.decode("bedrock", "bad"));

        ProviderException e = assertThrows(ProviderException.class, () -> service.collect(provider));
        assertEquals(ProviderException.Reason.DECODE, e.getReason());
        assertEquals("bedrock", e.getProvider());
    }
}
