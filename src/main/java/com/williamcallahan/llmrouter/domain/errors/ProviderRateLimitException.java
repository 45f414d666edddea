package com.williamcallahan.llmrouter.domain.errors;

/**
 * The vendor throttled the call (HTTP 429).
 */
public class ProviderRateLimitException extends LlmProviderException {

    public ProviderRateLimitException(String provider, int statusCode, String message, Throwable cause) {
        super(ProviderErrorKind.RATE_LIMIT, provider, statusCode, message, cause);
    }

    public ProviderRateLimitException(String provider, String message) {
        this(provider, NO_STATUS, message, null);
    }
}
