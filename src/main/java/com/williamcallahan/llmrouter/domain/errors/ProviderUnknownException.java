package com.williamcallahan.llmrouter.domain.errors;

/**
 * The failure did not match any recognized vendor error shape.
 */
public class ProviderUnknownException extends LlmProviderException {

    public ProviderUnknownException(String provider, int statusCode, String message, Throwable cause) {
        super(ProviderErrorKind.UNKNOWN, provider, statusCode, message, cause);
    }

    public ProviderUnknownException(String provider, String message) {
        this(provider, NO_STATUS, message, null);
    }
}
