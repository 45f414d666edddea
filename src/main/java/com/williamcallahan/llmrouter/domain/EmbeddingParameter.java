package com.williamcallahan.llmrouter.domain;

import java.util.Optional;

/**
 * Optional parameters recognized for embedding requests.
 */
public enum EmbeddingParameter {
    INPUT_TYPE("input_type", ParameterValueKind.STRING),
    TRUNCATE("truncate", ParameterValueKind.STRING),
    ENCODING_FORMAT("encoding_format", ParameterValueKind.STRING),
    DIMENSIONS("dimensions", ParameterValueKind.INTEGER),
    USER("user", ParameterValueKind.STRING);

    private final String wireName;
    private final ParameterValueKind valueKind;

    EmbeddingParameter(String wireName, ParameterValueKind valueKind) {
        this.wireName = wireName;
        this.valueKind = valueKind;
    }

    public String wireName() {
        return wireName;
    }

    public ParameterValueKind valueKind() {
        return valueKind;
    }

    public static Optional<EmbeddingParameter> fromWireName(String wireName) {
        for (EmbeddingParameter parameter : values()) {
            if (parameter.wireName.equals(wireName)) {
                return Optional.of(parameter);
            }
        }
        return Optional.empty();
    }
}
