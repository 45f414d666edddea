package com.williamcallahan.llmrouter.domain.errors;

/**
 * Missing or rejected provider credential.
 */
public class ProviderAuthenticationException extends LlmProviderException {

    public ProviderAuthenticationException(String provider, int statusCode, String message, Throwable cause) {
        super(ProviderErrorKind.AUTHENTICATION, provider, statusCode, message, cause);
    }

    public ProviderAuthenticationException(String provider, String message) {
        this(provider, NO_STATUS, message, null);
    }
}
