package com.williamcallahan.llmrouter.domain;

import java.util.List;
import java.util.Objects;

/**
 * Canonical chat completion response.
 *
 * @param id vendor completion id
 * @param created vendor creation timestamp in epoch seconds
 * @param model vendor model id as returned
 * @param choices ordered completion candidates
 * @param usage token counters
 */
public record ChatCompletionResult(
        String id, long created, String model, List<ChatChoice> choices, TokenUsage usage) {
    public ChatCompletionResult {
        Objects.requireNonNull(model, "model");
        choices = choices == null ? List.of() : List.copyOf(choices);
        usage = usage == null ? TokenUsage.EMPTY : usage;
    }
}
