package com.williamcallahan.llmrouter.domain;

import java.util.Objects;

/**
 * Resolved API secret for a single provider call.
 *
 * @param secret opaque bearer secret
 * @param source origin of the secret
 */
public record Credential(String secret, CredentialSource source) {
    private static final int VISIBLE_SUFFIX_CHARS = 4;

    public Credential {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Credential secret cannot be null or blank");
        }
        Objects.requireNonNull(source, "source");
    }

    /**
     * Returns the secret with everything but its last characters hidden.
     *
     * @return masked secret safe for logs
     */
    public String masked() {
        if (secret.length() <= VISIBLE_SUFFIX_CHARS * 2) {
            return "****";
        }
        return "***" + secret.substring(secret.length() - VISIBLE_SUFFIX_CHARS);
    }

    @Override
    public String toString() {
        return "Credential[source=" + source + ", secret=" + masked() + "]";
    }
}
