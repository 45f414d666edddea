package com.williamcallahan.llmrouter.config;

import java.util.Locale;

/**
 * Outbound HTTP timeouts for provider calls.
 */
public class HttpSettings {

    private static final int CONNECT_TIMEOUT_DEF = 10;
    private static final int READ_TIMEOUT_DEF = 60;
    private static final int MIN_POSITIVE = 1;
    private static final String CONNECT_TIMEOUT_KEY = "llm.http.connect-timeout-seconds";
    private static final String READ_TIMEOUT_KEY = "llm.http.read-timeout-seconds";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int connectTimeoutSeconds = CONNECT_TIMEOUT_DEF;
    private int readTimeoutSeconds = READ_TIMEOUT_DEF;

    public HttpSettings() {}

    /**
     * Validates timeout settings.
     */
    public void validateConfiguration() {
        requirePositive(CONNECT_TIMEOUT_KEY, connectTimeoutSeconds);
        requirePositive(READ_TIMEOUT_KEY, readTimeoutSeconds);
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(final int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public int getReadTimeoutSeconds() {
        return readTimeoutSeconds;
    }

    public void setReadTimeoutSeconds(final int readTimeoutSeconds) {
        this.readTimeoutSeconds = readTimeoutSeconds;
    }

    private static void requirePositive(final String propertyKey, final int value) {
        if (value < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
