package com.williamcallahan.llmrouter.service;

import com.williamcallahan.llmrouter.domain.ChatParameter;
import com.williamcallahan.llmrouter.domain.EmbeddingParameter;
import com.williamcallahan.llmrouter.domain.ProviderEndpoint;
import com.williamcallahan.llmrouter.domain.errors.ProviderBadRequestException;
import com.williamcallahan.llmrouter.support.BaseUrlNormalizer;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the dispatcher needs to call one provider.
 *
 * @param name canonical provider name used as the routing prefix
 * @param baseUrl normalized base URL endpoint paths are appended to
 * @param aliases alternative routing prefixes
 * @param apiKeyEnvironmentVariables variables consulted, in order, for an environment credential
 * @param endpointPaths paths of the endpoints this provider serves
 * @param supportedChatParameters chat parameters the provider accepts
 * @param supportedEmbeddingParameters embedding parameters the provider accepts
 * @param transformer request transformer for this provider's wire format
 * @param normalizer response normalizer for this provider's wire format
 */
public record ProviderDefinition(
        String name,
        String baseUrl,
        Set<String> aliases,
        List<String> apiKeyEnvironmentVariables,
        Map<ProviderEndpoint, String> endpointPaths,
        Set<ChatParameter> supportedChatParameters,
        Set<EmbeddingParameter> supportedEmbeddingParameters,
        ProviderRequestTransformer transformer,
        ProviderResponseNormalizer normalizer) {

    public ProviderDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name cannot be null or blank");
        }
        baseUrl = BaseUrlNormalizer.normalize(baseUrl);
        aliases = aliases == null ? Set.of() : Set.copyOf(aliases);
        apiKeyEnvironmentVariables =
                apiKeyEnvironmentVariables == null ? List.of() : List.copyOf(apiKeyEnvironmentVariables);
        endpointPaths = copyEndpoints(endpointPaths);
        supportedChatParameters = supportedChatParameters == null || supportedChatParameters.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.allOf(ChatParameter.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(supportedChatParameters));
        supportedEmbeddingParameters = supportedEmbeddingParameters == null || supportedEmbeddingParameters.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.allOf(EmbeddingParameter.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(supportedEmbeddingParameters));
        Objects.requireNonNull(transformer, "transformer");
        Objects.requireNonNull(normalizer, "normalizer");
    }

    /**
     * Reports whether the provider serves an endpoint.
     *
     * @param endpoint endpoint kind
     * @return true when a path is configured for the endpoint
     */
    public boolean supports(ProviderEndpoint endpoint) {
        return endpointPaths.containsKey(endpoint);
    }

    /**
     * Builds the absolute URL for an endpoint.
     *
     * @param endpoint endpoint kind
     * @param apiBaseOverride caller base URL, used instead of the configured one when non-blank
     * @return absolute endpoint URL
     * @throws ProviderBadRequestException when the provider does not serve the endpoint
     */
    public String endpointUrl(ProviderEndpoint endpoint, String apiBaseOverride) {
        String path = endpointPaths.get(endpoint);
        if (path == null) {
            throw new ProviderBadRequestException(
                    name, "Provider " + name + " does not support the " + endpoint.configKey() + " endpoint");
        }
        String effectiveBase = apiBaseOverride == null || apiBaseOverride.isBlank() ? baseUrl : apiBaseOverride;
        return BaseUrlNormalizer.resolve(effectiveBase, path);
    }

    private static Map<ProviderEndpoint, String> copyEndpoints(Map<ProviderEndpoint, String> endpointPaths) {
        EnumMap<ProviderEndpoint, String> copy = new EnumMap<>(ProviderEndpoint.class);
        if (endpointPaths == null || endpointPaths.isEmpty()) {
            for (ProviderEndpoint endpoint : ProviderEndpoint.values()) {
                copy.put(endpoint, endpoint.defaultPath());
            }
        } else {
            copy.putAll(endpointPaths);
        }
        return Collections.unmodifiableMap(copy);
    }
}
