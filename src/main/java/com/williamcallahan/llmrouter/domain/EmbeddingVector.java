package com.williamcallahan.llmrouter.domain;

import java.util.List;

/**
 * One embedding returned for the input at {@code index}.
 *
 * @param index position of the source text in the request
 * @param embedding vector components
 */
public record EmbeddingVector(int index, List<Double> embedding) {
    public EmbeddingVector {
        if (index < 0) {
            throw new IllegalArgumentException("Embedding index cannot be negative");
        }
        embedding = embedding == null ? List.of() : List.copyOf(embedding);
    }
}
