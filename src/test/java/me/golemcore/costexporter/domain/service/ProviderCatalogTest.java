package me.golemcore.costexporter.domain.service;

import me.golemcore.costexporter.domain.model.ProviderIdentity;
import me.golemcore.costexporter.infrastructure.config.ConfigurationException;
import me.golemcore.costexporter.port.outbound.UsageProviderPort;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProviderCatalogTest {

    @Test
    void shouldKeepOnlyEnabledProviders() {
        UsageProviderPort openai = provider("openai", "gpt-4", true);
        UsageProviderPort anthropic = provider("anthropic", "claude", false);
        UsageProviderPort bedrock = provider("bedrock", "titan", true);

        ProviderCatalog catalog = new ProviderCatalog(List.of(openai, anthropic, bedrock));

        assertEquals(List.of(openai, bedrock), catalog.getProviders());
        assertEquals(Set.of(new ProviderIdentity("openai", "gpt-4"), new ProviderIdentity("bedrock", "titan")),
                catalog.getIdentities());
    }

    @Test
    void shouldRejectDuplicateProviderNames() {
        List<UsageProviderPort> adapters = List.of(
                provider("openai", "gpt-4", true),
                provider("openai", "gpt-3.5-turbo", true));

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> new ProviderCatalog(adapters));
        assertTrue(e.getMessage().contains("openai"));
    }

    @Test
    void shouldIgnoreDuplicateNameWhenOneIsDisabled() {
        ProviderCatalog catalog = new ProviderCatalog(List.of(
                provider("openai", "gpt-4", true),
                provider("openai", "gpt-3.5-turbo", false)));

        assertEquals(1, catalog.getProviders().size());
    }

    @Test
    void shouldAllowEmptyCatalog() {
        ProviderCatalog catalog = new ProviderCatalog(List.of(provider("openai", "gpt-4", false)));

        assertTrue(catalog.getProviders().isEmpty());
        assertTrue(catalog.getIdentities().isEmpty());
    }

    private static UsageProviderPort provider(String name, String model, boolean enabled) {
        UsageProviderPort provider = mock(UsageProviderPort.class);
        when(provider.getIdentity()).thenReturn(new ProviderIdentity(name, model));
        when(provider.isEnabled()).thenReturn(enabled);
        return provider;
    }
}
