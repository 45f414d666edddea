package com.williamcallahan.llmrouter.domain.errors;

/**
 * No response arrived within the deadline. The only kind callers may treat as transient.
 */
public class ProviderTimeoutException extends LlmProviderException {

    public ProviderTimeoutException(String provider, int statusCode, String message, Throwable cause) {
        super(ProviderErrorKind.TIMEOUT, provider, statusCode, message, cause);
    }

    public ProviderTimeoutException(String provider, String message) {
        this(provider, NO_STATUS, message, null);
    }
}
