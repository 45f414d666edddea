package com.williamcallahan.llmrouter.domain;

import java.util.List;
import java.util.Objects;

/**
 * Canonical embedding response.
 *
 * @param model vendor model id as returned
 * @param data embeddings in vendor order
 * @param usage token counters
 */
public record EmbeddingResult(String model, List<EmbeddingVector> data, TokenUsage usage) {
    public EmbeddingResult {
        Objects.requireNonNull(model, "model");
        data = data == null ? List.of() : List.copyOf(data);
        usage = usage == null ? TokenUsage.EMPTY : usage;
    }
}
