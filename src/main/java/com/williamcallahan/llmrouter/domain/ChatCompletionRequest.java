package com.williamcallahan.llmrouter.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical chat completion request.
 *
 * @param model provider-prefixed model identifier
 * @param messages ordered conversation turns
 * @param parameters optional sampling parameters, absent entries are never sent
 * @param options caller overrides for credentials and endpoint
 */
public record ChatCompletionRequest(
        String model, List<ChatMessage> messages, Map<ChatParameter, Object> parameters, CallOptions options)
        implements CanonicalRequest {

    public ChatCompletionRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        parameters = copyParameters(parameters);
        options = options == null ? CallOptions.none() : options;
    }

    @Override
    public ProviderEndpoint endpoint() {
        return ProviderEndpoint.CHAT_COMPLETIONS;
    }

    /**
     * Starts a builder for the given provider-prefixed model.
     *
     * @param model provider-prefixed model identifier
     * @return new builder
     */
    public static Builder builder(String model) {
        return new Builder(model);
    }

    private static Map<ChatParameter, Object> copyParameters(Map<ChatParameter, Object> parameters) {
        EnumMap<ChatParameter, Object> copy = new EnumMap<>(ChatParameter.class);
        if (parameters != null) {
            parameters.forEach((parameter, value) -> copy.put(
                    Objects.requireNonNull(parameter, "parameter"),
                    Objects.requireNonNull(value, () -> "Value for " + parameter.wireName() + " is null")));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Accumulates messages and parameters for a {@link ChatCompletionRequest}.
     */
    public static final class Builder {
        private final String model;
        private final List<ChatMessage> messages = new ArrayList<>();
        private final Map<ChatParameter, Object> parameters = new EnumMap<>(ChatParameter.class);
        private CallOptions options = CallOptions.none();

        private Builder(String model) {
            this.model = model;
        }

        public Builder message(String role, String content) {
            messages.add(new ChatMessage(role, content));
            return this;
        }

        public Builder messages(List<ChatMessage> chatMessages) {
            messages.addAll(chatMessages);
            return this;
        }

        public Builder parameter(ChatParameter parameter, Object value) {
            parameters.put(parameter, value);
            return this;
        }

        public Builder options(CallOptions callOptions) {
            this.options = callOptions;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.options = new CallOptions(apiKey, options.apiBase());
            return this;
        }

        public ChatCompletionRequest build() {
            return new ChatCompletionRequest(model, messages, parameters, options);
        }
    }
}
