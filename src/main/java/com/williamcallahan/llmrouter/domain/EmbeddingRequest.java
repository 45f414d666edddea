package com.williamcallahan.llmrouter.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical embedding request.
 *
 * <p>{@code singleInput} records whether the caller passed one string rather than a list, so the
 * wire body can echo the same shape back to the vendor.</p>
 *
 * @param model provider-prefixed model identifier
 * @param input texts to embed
 * @param singleInput true when the caller supplied a single string
 * @param parameters optional embedding parameters
 * @param options caller overrides for credentials and endpoint
 */
public record EmbeddingRequest(
        String model,
        List<String> input,
        boolean singleInput,
        Map<EmbeddingParameter, Object> parameters,
        CallOptions options)
        implements CanonicalRequest {

    public EmbeddingRequest {
        input = input == null ? List.of() : List.copyOf(input);
        if (singleInput && input.size() != 1) {
            throw new IllegalArgumentException("Single-input embedding request must carry exactly one text");
        }
        EnumMap<EmbeddingParameter, Object> copy = new EnumMap<>(EmbeddingParameter.class);
        if (parameters != null) {
            parameters.forEach((parameter, value) -> copy.put(
                    Objects.requireNonNull(parameter, "parameter"),
                    Objects.requireNonNull(value, () -> "Value for " + parameter.wireName() + " is null")));
        }
        parameters = Collections.unmodifiableMap(copy);
        options = options == null ? CallOptions.none() : options;
    }

    /**
     * Creates a request embedding one text.
     *
     * @param model provider-prefixed model identifier
     * @param text text to embed
     * @param parameters optional embedding parameters
     * @param options caller overrides
     * @return embedding request
     */
    public static EmbeddingRequest ofText(
            String model, String text, Map<EmbeddingParameter, Object> parameters, CallOptions options) {
        return new EmbeddingRequest(model, List.of(Objects.requireNonNull(text, "text")), true, parameters, options);
    }

    /**
     * Creates a request embedding several texts in one call.
     *
     * @param model provider-prefixed model identifier
     * @param texts texts to embed, in order
     * @param parameters optional embedding parameters
     * @param options caller overrides
     * @return embedding request
     */
    public static EmbeddingRequest ofTexts(
            String model, List<String> texts, Map<EmbeddingParameter, Object> parameters, CallOptions options) {
        return new EmbeddingRequest(model, texts, false, parameters, options);
    }

    @Override
    public ProviderEndpoint endpoint() {
        return ProviderEndpoint.EMBEDDINGS;
    }
}
