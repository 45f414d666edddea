package com.williamcallahan.llmrouter.service;

import com.williamcallahan.llmrouter.domain.errors.ProviderBadRequestException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only lookup of provider definitions by routing prefix.
 *
 * <p>Built once at startup; names and aliases match case-insensitively. Instances hold only
 * immutable state and may be shared across concurrent calls.</p>
 */
public class ProviderRegistry {

    private final Map<String, ProviderDefinition> providersByRoutingName;
    private final List<String> providerNames;

    /**
     * Creates a registry over the given providers.
     *
     * @param providers provider definitions
     * @throws IllegalArgumentException when two providers claim the same name or alias
     */
    public ProviderRegistry(List<ProviderDefinition> providers) {
        Objects.requireNonNull(providers, "providers");
        Map<String, ProviderDefinition> routing = new LinkedHashMap<>();
        for (ProviderDefinition provider : providers) {
            register(routing, provider.name(), provider);
            for (String alias : provider.aliases()) {
                register(routing, alias, provider);
            }
        }
        this.providersByRoutingName = Map.copyOf(routing);
        this.providerNames = providers.stream().map(ProviderDefinition::name).toList();
    }

    /**
     * Resolves a routing prefix to its provider.
     *
     * @param providerName provider name or alias from the caller's model string
     * @return provider definition
     * @throws ProviderBadRequestException when no provider is registered under the name
     */
    public ProviderDefinition lookup(String providerName) {
        ProviderDefinition provider = providersByRoutingName.get(routingKey(providerName));
        if (provider == null) {
            throw new ProviderBadRequestException(
                    null, "Unknown LLM provider '" + providerName + "'. Registered providers: " + providerNames);
        }
        return provider;
    }

    /**
     * Returns canonical provider names in registration order.
     *
     * @return provider names
     */
    public List<String> providerNames() {
        return providerNames;
    }

    private static void register(Map<String, ProviderDefinition> routing, String name, ProviderDefinition provider) {
        String key = routingKey(name);
        ProviderDefinition existing = routing.putIfAbsent(key, provider);
        if (existing != null) {
            throw new IllegalArgumentException("Provider routing name '" + key + "' is claimed by both "
                    + existing.name() + " and " + provider.name());
        }
    }

    private static String routingKey(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
