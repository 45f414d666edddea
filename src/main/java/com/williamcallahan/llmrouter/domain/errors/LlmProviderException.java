package com.williamcallahan.llmrouter.domain.errors;

import java.util.Objects;

/**
 * Base type for every failure surfaced to callers of the dispatcher.
 *
 * <p>Subtypes identify the failure kind so callers can catch exactly what they handle:
 * <ul>
 *   <li>{@link ProviderAuthenticationException} - missing or rejected credential</li>
 *   <li>{@link ProviderBadRequestException} - malformed input, unknown provider or model</li>
 *   <li>{@link ProviderTimeoutException} - no response within the deadline</li>
 *   <li>{@link ProviderRateLimitException} - vendor throttled the call</li>
 *   <li>{@link ProviderServerException} - vendor-side failure</li>
 *   <li>{@link ProviderUnknownException} - unrecognized failure shape</li>
 * </ul>
 */
public abstract class LlmProviderException extends RuntimeException {

    /** Status code used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final ProviderErrorKind kind;
    private final String provider;
    private final int statusCode;
    private final String vendorMessage;

    protected LlmProviderException(
            ProviderErrorKind kind, String provider, int statusCode, String message, Throwable cause) {
        super(describe(kind, provider, statusCode, message), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.provider = provider;
        this.statusCode = statusCode;
        this.vendorMessage = message == null ? "" : message;
    }

    /**
     * Creates the typed exception matching a failure kind.
     *
     * @param kind failure classification
     * @param provider provider name, or null when the failure preceded provider selection
     * @param statusCode vendor HTTP status, or {@link #NO_STATUS}
     * @param message vendor or validation message
     * @param cause underlying failure, may be null
     * @return exception of the subtype for {@code kind}
     */
    public static LlmProviderException of(
            ProviderErrorKind kind, String provider, int statusCode, String message, Throwable cause) {
        return switch (kind) {
            case AUTHENTICATION -> new ProviderAuthenticationException(provider, statusCode, message, cause);
            case BAD_REQUEST -> new ProviderBadRequestException(provider, statusCode, message, cause);
            case TIMEOUT -> new ProviderTimeoutException(provider, statusCode, message, cause);
            case RATE_LIMIT -> new ProviderRateLimitException(provider, statusCode, message, cause);
            case SERVER_ERROR -> new ProviderServerException(provider, statusCode, message, cause);
            case UNKNOWN -> new ProviderUnknownException(provider, statusCode, message, cause);
        };
    }

    public ProviderErrorKind kind() {
        return kind;
    }

    /** Provider name, or null when the call failed before a provider was selected. */
    public String provider() {
        return provider;
    }

    /** Vendor HTTP status, or {@link #NO_STATUS} when there was no response. */
    public int statusCode() {
        return statusCode;
    }

    public String vendorMessage() {
        return vendorMessage;
    }

    public boolean hasStatusCode() {
        return statusCode != NO_STATUS;
    }

    private static String describe(ProviderErrorKind kind, String provider, int statusCode, String message) {
        StringBuilder description = new StringBuilder();
        description.append(kind.name());
        if (provider != null) {
            description.append(" from provider ").append(provider);
        }
        if (statusCode != NO_STATUS) {
            description.append(" (HTTP ").append(statusCode).append(')');
        }
        if (message != null && !message.isBlank()) {
            description.append(": ").append(message);
        }
        return description.toString();
    }
}
