package com.williamcallahan.llmrouter.domain;

/**
 * Per-call overrides supplied by the caller.
 *
 * @param apiKey explicit credential, takes priority over environment credentials when non-blank
 * @param apiBase base URL override for the provider endpoint, ignored when blank
 */
public record CallOptions(String apiKey, String apiBase) {

    private static final CallOptions NONE = new CallOptions(null, null);

    /**
     * Returns options with no overrides.
     *
     * @return options that defer to the provider registry and environment
     */
    public static CallOptions none() {
        return NONE;
    }

    /**
     * Returns options carrying only an explicit API key.
     *
     * @param apiKey explicit credential
     * @return options with the given key
     */
    public static CallOptions withApiKey(String apiKey) {
        return new CallOptions(apiKey, null);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean hasApiBase() {
        return apiBase != null && !apiBase.isBlank();
    }

    @Override
    public String toString() {
        return "CallOptions[apiKey=" + (hasApiKey() ? "***" : "<none>") + ", apiBase=" + apiBase + "]";
    }
}
