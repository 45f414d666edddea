package com.williamcallahan.llmrouter.domain.errors;

/**
 * Canonical classification of a failed provider call.
 */
public enum ProviderErrorKind {
    AUTHENTICATION,
    BAD_REQUEST,
    TIMEOUT,
    RATE_LIMIT,
    SERVER_ERROR,
    UNKNOWN;

    /**
     * Reports whether a caller may retry the call or move on to another provider.
     *
     * <p>Only timeouts qualify; every other kind is terminal for the call.</p>
     *
     * @return true for {@link #TIMEOUT}
     */
    public boolean isTransient() {
        return this == TIMEOUT;
    }
}
