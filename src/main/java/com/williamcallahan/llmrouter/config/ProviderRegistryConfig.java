package com.williamcallahan.llmrouter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.llmrouter.domain.ChatParameter;
import com.williamcallahan.llmrouter.domain.EmbeddingParameter;
import com.williamcallahan.llmrouter.domain.ProviderEndpoint;
import com.williamcallahan.llmrouter.service.OpenAiCompatibleRequestTransformer;
import com.williamcallahan.llmrouter.service.OpenAiCompatibleResponseNormalizer;
import com.williamcallahan.llmrouter.service.ProviderDefinition;
import com.williamcallahan.llmrouter.service.ProviderRegistry;
import com.williamcallahan.llmrouter.service.RestTemplateTransportInvoker;
import com.williamcallahan.llmrouter.service.TransportInvoker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the provider registry and outbound transport from {@link AppProperties}.
 *
 * <p>The registry is resolved once here; dispatch code never branches on provider names.</p>
 */
@Configuration
public class ProviderRegistryConfig {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistryConfig.class);

    private static final String API_STYLE_OPENAI_COMPATIBLE = "openai-compatible";

    /**
     * Creates the provider registry.
     *
     * @param appProperties routing configuration
     * @param objectMapper mapper shared by transformers and normalizers
     * @return immutable registry of configured providers
     */
    @Bean
    public ProviderRegistry providerRegistry(AppProperties appProperties, ObjectMapper objectMapper) {
        Objects.requireNonNull(appProperties, "appProperties");
        OpenAiCompatibleRequestTransformer transformer =
                new OpenAiCompatibleRequestTransformer(objectMapper, appProperties.isDropUnsupportedParams());
        OpenAiCompatibleResponseNormalizer normalizer = new OpenAiCompatibleResponseNormalizer(objectMapper);

        List<ProviderDefinition> providers = new ArrayList<>();
        appProperties.getProviders().forEach((providerName, providerSettings) -> {
            requireSupportedApiStyle(providerName, providerSettings.getApiStyle());
            providers.add(new ProviderDefinition(
                    providerName,
                    providerSettings.getBaseUrl(),
                    new LinkedHashSet<>(providerSettings.getAliases()),
                    providerSettings.getApiKeyEnv(),
                    endpointPaths(providerSettings.getEndpoints()),
                    parameters(providerSettings.getChatParameters(), ChatParameter.class, ChatParameter::fromWireName),
                    parameters(
                            providerSettings.getEmbeddingParameters(),
                            EmbeddingParameter.class,
                            EmbeddingParameter::fromWireName),
                    transformer,
                    normalizer));
        });
        ProviderRegistry registry = new ProviderRegistry(providers);
        log.info("[LLM] Provider registry initialized with {} provider(s): {}",
                providers.size(), registry.providerNames());
        return registry;
    }

    /**
     * Creates the HTTP transport used for provider calls.
     *
     * @param appProperties routing configuration
     * @param restTemplateBuilder RestTemplate builder
     * @return transport invoker
     */
    @Bean
    public TransportInvoker transportInvoker(AppProperties appProperties, RestTemplateBuilder restTemplateBuilder) {
        HttpSettings http = appProperties.getHttp();
        return new RestTemplateTransportInvoker(
                restTemplateBuilder,
                Duration.ofSeconds(http.getConnectTimeoutSeconds()),
                Duration.ofSeconds(http.getReadTimeoutSeconds()));
    }

    private static void requireSupportedApiStyle(String providerName, String apiStyle) {
        String normalizedStyle = apiStyle == null ? "" : apiStyle.trim().toLowerCase(Locale.ROOT);
        if (!API_STYLE_OPENAI_COMPATIBLE.equals(normalizedStyle)) {
            throw new IllegalArgumentException(
                    "llm.providers." + providerName + ".api-style '" + apiStyle + "' is not supported");
        }
    }

    private static Map<ProviderEndpoint, String> endpointPaths(Map<String, String> configuredEndpoints) {
        Map<ProviderEndpoint, String> endpointPaths = new EnumMap<>(ProviderEndpoint.class);
        configuredEndpoints.forEach((configKey, path) ->
                endpointPaths.put(ProviderEndpoint.fromConfigKey(configKey), path));
        return endpointPaths;
    }

    private static <E extends Enum<E>> Set<E> parameters(
            List<String> wireNames, Class<E> parameterType, Function<String, Optional<E>> lookup) {
        Set<E> parameters = EnumSet.noneOf(parameterType);
        for (String wireName : wireNames) {
            parameters.add(lookup.apply(wireName.trim())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown " + parameterType.getSimpleName() + " in configuration: " + wireName)));
        }
        return parameters;
    }
}
