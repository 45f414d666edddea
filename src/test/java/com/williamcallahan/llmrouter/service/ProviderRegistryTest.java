package com.williamcallahan.llmrouter.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.llmrouter.domain.ProviderEndpoint;
import com.williamcallahan.llmrouter.domain.errors.ProviderBadRequestException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Verifies provider lookup by name and alias.
 */
class ProviderRegistryTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProviderDefinition nvidia = ProviderFixtures.nvidia(ProviderFixtures.NVIDIA_BASE_URL, objectMapper);
    private final ProviderDefinition openai = ProviderFixtures.openai(objectMapper);
    private final ProviderRegistry registry = new ProviderRegistry(List.of(nvidia, openai));

    @Test
    void resolvesNamesAndAliasesCaseInsensitively() {
        assertSame(nvidia, registry.lookup("nvidia"));
        assertSame(nvidia, registry.lookup("NVIDIA"));
        assertSame(nvidia, registry.lookup("nvidia_nim"));
        assertSame(openai, registry.lookup("openai"));
        assertEquals(List.of("nvidia", "openai"), registry.providerNames());
    }

    @Test
    void unknownProviderIsBadRequestListingRegisteredProviders() {
        ProviderBadRequestException thrown =
                assertThrows(ProviderBadRequestException.class, () -> registry.lookup("acme"));

        assertNull(thrown.provider());
        assertTrue(thrown.getMessage().contains("acme"));
        assertTrue(thrown.getMessage().contains("nvidia"));
    }

    @Test
    void duplicateRoutingNamesAreRejected() {
        ProviderDefinition clash = new ProviderDefinition(
                "nim",
                "http://localhost:9000/v1",
                Set.of("NVIDIA"),
                List.of(),
                Map.of(),
                Set.of(),
                Set.of(),
                nvidia.transformer(),
                nvidia.normalizer());

        assertThrows(IllegalArgumentException.class, () -> new ProviderRegistry(List.of(nvidia, clash)));
    }

    @Test
    void endpointUrlsUseConfiguredBaseOrCallerOverride() {
        assertEquals("https://integrate.api.nvidia.com/v1/chat/completions",
                nvidia.endpointUrl(ProviderEndpoint.CHAT_COMPLETIONS, null));
        assertEquals("http://127.0.0.1:8080/v1/embeddings",
                nvidia.endpointUrl(ProviderEndpoint.EMBEDDINGS, "http://127.0.0.1:8080/v1/"));
    }

    @Test
    void unsupportedEndpointIsBadRequest() {
        ProviderDefinition chatOnly = new ProviderDefinition(
                "chat-only",
                "http://localhost:9000/v1",
                Set.of(),
                List.of(),
                Map.of(ProviderEndpoint.CHAT_COMPLETIONS, "/chat/completions"),
                Set.of(),
                Set.of(),
                nvidia.transformer(),
                nvidia.normalizer());

        assertTrue(chatOnly.supports(ProviderEndpoint.CHAT_COMPLETIONS));
        assertThrows(ProviderBadRequestException.class,
                () -> chatOnly.endpointUrl(ProviderEndpoint.EMBEDDINGS, null));
    }
}
