package com.williamcallahan.llmrouter.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration for one routable provider under {@code llm.providers.<name>}.
 *
 * <p>Empty parameter lists mean every canonical parameter is accepted; empty endpoint maps mean
 * the provider serves the default OpenAI paths.</p>
 */
public class ProviderSettings {

    private static final String API_STYLE_DEF = "openai-compatible";
    private static final String BLANK_TEXT_FMT = "%s must not be blank.";
    private static final String NULL_LIST_FMT = "%s must not be null.";

    private String baseUrl = "";
    private String apiStyle = API_STYLE_DEF;
    private List<String> aliases = new ArrayList<>();
    private List<String> apiKeyEnv = new ArrayList<>();
    private Map<String, String> endpoints = new LinkedHashMap<>();
    private List<String> chatParameters = new ArrayList<>();
    private List<String> embeddingParameters = new ArrayList<>();

    public ProviderSettings() {}

    /**
     * Validates provider settings.
     *
     * @param providerName configuration key of the provider, used in messages
     */
    public void validateConfiguration(final String providerName) {
        String prefix = "llm.providers." + providerName;
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_TEXT_FMT, prefix + ".base-url"));
        }
        if (apiStyle == null || apiStyle.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_TEXT_FMT, prefix + ".api-style"));
        }
        if (apiKeyEnv == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_LIST_FMT, prefix + ".api-key-env"));
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(final String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiStyle() {
        return apiStyle;
    }

    public void setApiStyle(final String apiStyle) {
        this.apiStyle = apiStyle;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public void setAliases(final List<String> aliases) {
        this.aliases = aliases == null ? new ArrayList<>() : new ArrayList<>(aliases);
    }

    public List<String> getApiKeyEnv() {
        return apiKeyEnv;
    }

    public void setApiKeyEnv(final List<String> apiKeyEnv) {
        this.apiKeyEnv = apiKeyEnv;
    }

    public Map<String, String> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(final Map<String, String> endpoints) {
        this.endpoints = endpoints == null ? new LinkedHashMap<>() : new LinkedHashMap<>(endpoints);
    }

    public List<String> getChatParameters() {
        return chatParameters;
    }

    public void setChatParameters(final List<String> chatParameters) {
        this.chatParameters = chatParameters == null ? new ArrayList<>() : new ArrayList<>(chatParameters);
    }

    public List<String> getEmbeddingParameters() {
        return embeddingParameters;
    }

    public void setEmbeddingParameters(final List<String> embeddingParameters) {
        this.embeddingParameters =
                embeddingParameters == null ? new ArrayList<>() : new ArrayList<>(embeddingParameters);
    }
}
