package com.williamcallahan.llmrouter.config;

import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Routing configuration bound from {@code llm.*}.
 */
@Component
@ConfigurationProperties(prefix = "llm")
public class AppProperties {

    private boolean dropUnsupportedParams = false;
    private HttpSettings http = new HttpSettings();
    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();

    /**
     * Validates nested settings once binding completes.
     *
     * @throws IllegalArgumentException when a setting is missing or out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        http.validateConfiguration();
        providers.forEach((providerName, providerSettings) -> {
            if (providerSettings == null) {
                throw new IllegalArgumentException("llm.providers." + providerName + " must not be empty.");
            }
            providerSettings.validateConfiguration(providerName);
        });
    }

    public boolean isDropUnsupportedParams() {
        return dropUnsupportedParams;
    }

    public void setDropUnsupportedParams(boolean dropUnsupportedParams) {
        this.dropUnsupportedParams = dropUnsupportedParams;
    }

    public HttpSettings getHttp() {
        return http;
    }

    public void setHttp(HttpSettings http) {
        this.http = http;
    }

    public Map<String, ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderSettings> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(providers);
    }
}
