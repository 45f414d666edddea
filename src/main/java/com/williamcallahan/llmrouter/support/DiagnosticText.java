package com.williamcallahan.llmrouter.support;

/**
 * Flattens vendor payloads and exception messages into short single-line diagnostics.
 */
public final class DiagnosticText {

    /** Longest diagnostic kept before truncation. */
    public static final int MAX_ERROR_SNIPPET = 512;

    private DiagnosticText() {}

    /**
     * Collapses line breaks and truncates long text.
     *
     * @param message raw text, may be null
     * @return single-line text of at most {@link #MAX_ERROR_SNIPPET} characters plus an ellipsis,
     *     or an empty string when blank
     */
    public static String sanitize(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }
}
