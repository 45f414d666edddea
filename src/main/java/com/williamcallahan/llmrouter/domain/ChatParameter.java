package com.williamcallahan.llmrouter.domain;

import java.util.Optional;

/**
 * Optional sampling parameters recognized for chat completions.
 *
 * <p>Wire names follow the OpenAI chat completions contract and are sent verbatim.</p>
 */
public enum ChatParameter {
    TEMPERATURE("temperature", ParameterValueKind.NUMBER),
    TOP_P("top_p", ParameterValueKind.NUMBER),
    MAX_TOKENS("max_tokens", ParameterValueKind.INTEGER),
    N("n", ParameterValueKind.INTEGER),
    STOP("stop", ParameterValueKind.STRING_OR_LIST),
    PRESENCE_PENALTY("presence_penalty", ParameterValueKind.NUMBER),
    FREQUENCY_PENALTY("frequency_penalty", ParameterValueKind.NUMBER),
    SEED("seed", ParameterValueKind.INTEGER),
    USER("user", ParameterValueKind.STRING);

    private final String wireName;
    private final ParameterValueKind valueKind;

    ChatParameter(String wireName, ParameterValueKind valueKind) {
        this.wireName = wireName;
        this.valueKind = valueKind;
    }

    public String wireName() {
        return wireName;
    }

    public ParameterValueKind valueKind() {
        return valueKind;
    }

    /**
     * Looks up a parameter by its wire name.
     *
     * @param wireName name as it appears in a JSON request body
     * @return the parameter, or empty when the name is not part of the canonical schema
     */
    public static Optional<ChatParameter> fromWireName(String wireName) {
        for (ChatParameter parameter : values()) {
            if (parameter.wireName.equals(wireName)) {
                return Optional.of(parameter);
            }
        }
        return Optional.empty();
    }
}
