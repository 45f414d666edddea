package com.williamcallahan.llmrouter.domain;

/**
 * Endpoints an OpenAI-compatible provider may expose, relative to its base URL.
 */
public enum ProviderEndpoint {
    CHAT_COMPLETIONS("chat", "POST", "/chat/completions"),
    EMBEDDINGS("embeddings", "POST", "/embeddings"),
    MODELS("models", "GET", "/models");

    private final String configKey;
    private final String httpMethod;
    private final String defaultPath;

    ProviderEndpoint(String configKey, String httpMethod, String defaultPath) {
        this.configKey = configKey;
        this.httpMethod = httpMethod;
        this.defaultPath = defaultPath;
    }

    /** Key used for this endpoint in provider configuration. */
    public String configKey() {
        return configKey;
    }

    public String httpMethod() {
        return httpMethod;
    }

    public String defaultPath() {
        return defaultPath;
    }

    /**
     * Resolves an endpoint from its configuration key.
     *
     * @param configKey configuration key such as {@code chat}
     * @return matching endpoint
     * @throws IllegalArgumentException when no endpoint uses the key
     */
    public static ProviderEndpoint fromConfigKey(String configKey) {
        for (ProviderEndpoint endpoint : values()) {
            if (endpoint.configKey.equalsIgnoreCase(configKey == null ? "" : configKey.trim())) {
                return endpoint;
            }
        }
        throw new IllegalArgumentException("Unknown provider endpoint: " + configKey);
    }
}
