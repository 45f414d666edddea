package com.williamcallahan.llmrouter.domain;

/**
 * Token counters reported by the vendor.
 *
 * @param promptTokens tokens consumed by the input
 * @param completionTokens tokens produced by the model
 * @param totalTokens total billed tokens
 */
public record TokenUsage(long promptTokens, long completionTokens, long totalTokens) {

    /** Usage reported when the vendor omits counters. */
    public static final TokenUsage EMPTY = new TokenUsage(0L, 0L, 0L);

    public TokenUsage {
        if (promptTokens < 0 || completionTokens < 0 || totalTokens < 0) {
            throw new IllegalArgumentException("Token counters cannot be negative");
        }
    }
}
