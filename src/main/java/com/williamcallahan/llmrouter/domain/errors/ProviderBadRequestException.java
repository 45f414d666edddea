package com.williamcallahan.llmrouter.domain.errors;

/**
 * Malformed input, unknown provider, or a vendor 4xx other than authentication and rate limiting.
 */
public class ProviderBadRequestException extends LlmProviderException {

    public ProviderBadRequestException(String provider, int statusCode, String message, Throwable cause) {
        super(ProviderErrorKind.BAD_REQUEST, provider, statusCode, message, cause);
    }

    public ProviderBadRequestException(String provider, String message) {
        this(provider, NO_STATUS, message, null);
    }
}
