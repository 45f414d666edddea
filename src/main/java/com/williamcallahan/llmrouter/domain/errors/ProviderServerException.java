package com.williamcallahan.llmrouter.domain.errors;

/**
 * The vendor failed while handling the call (HTTP 5xx).
 */
public class ProviderServerException extends LlmProviderException {

    public ProviderServerException(String provider, int statusCode, String message, Throwable cause) {
        super(ProviderErrorKind.SERVER_ERROR, provider, statusCode, message, cause);
    }

    public ProviderServerException(String provider, String message) {
        this(provider, NO_STATUS, message, null);
    }
}
