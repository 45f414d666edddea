package com.williamcallahan.llmrouter.web;

import com.williamcallahan.llmrouter.domain.CallOptions;
import com.williamcallahan.llmrouter.domain.ChatCompletionRequest;
import com.williamcallahan.llmrouter.domain.ChatMessage;
import com.williamcallahan.llmrouter.domain.ChatParameter;
import com.williamcallahan.llmrouter.domain.EmbeddingParameter;
import com.williamcallahan.llmrouter.domain.EmbeddingRequest;
import com.williamcallahan.llmrouter.domain.errors.ProviderBadRequestException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Converts OpenAI-style JSON bodies into canonical requests.
 *
 * <p>Keys outside the canonical schema are rejected rather than forwarded. Null-valued keys are
 * treated as absent.</p>
 */
@Component
public class GatewayRequestParser {
    private static final String MODEL_KEY = "model";
    private static final String MESSAGES_KEY = "messages";
    private static final String INPUT_KEY = "input";

    /**
     * Parses a chat completion body.
     *
     * @param body decoded JSON object
     * @param options caller overrides taken from request headers
     * @return canonical chat request
     * @throws ProviderBadRequestException when the body does not fit the canonical schema
     */
    public ChatCompletionRequest parseChatCompletion(Map<String, Object> body, CallOptions options) {
        Map<String, Object> requestBody = requireBody(body);
        Map<ChatParameter, Object> parameters = new EnumMap<>(ChatParameter.class);
        for (Map.Entry<String, Object> entry : requestBody.entrySet()) {
            String key = entry.getKey();
            if (MODEL_KEY.equals(key) || MESSAGES_KEY.equals(key) || entry.getValue() == null) {
                continue;
            }
            ChatParameter parameter = ChatParameter.fromWireName(key)
                    .orElseThrow(() -> unknownKey(key));
            parameters.put(parameter, entry.getValue());
        }
        return new ChatCompletionRequest(
                requireModel(requestBody), parseMessages(requestBody.get(MESSAGES_KEY)), parameters, options);
    }

    /**
     * Parses an embedding body.
     *
     * @param body decoded JSON object
     * @param options caller overrides taken from request headers
     * @return canonical embedding request
     * @throws ProviderBadRequestException when the body does not fit the canonical schema
     */
    public EmbeddingRequest parseEmbedding(Map<String, Object> body, CallOptions options) {
        Map<String, Object> requestBody = requireBody(body);
        Map<EmbeddingParameter, Object> parameters = new EnumMap<>(EmbeddingParameter.class);
        for (Map.Entry<String, Object> entry : requestBody.entrySet()) {
            String key = entry.getKey();
            if (MODEL_KEY.equals(key) || INPUT_KEY.equals(key) || entry.getValue() == null) {
                continue;
            }
            EmbeddingParameter parameter = EmbeddingParameter.fromWireName(key)
                    .orElseThrow(() -> unknownKey(key));
            parameters.put(parameter, entry.getValue());
        }

        String model = requireModel(requestBody);
        Object input = requestBody.get(INPUT_KEY);
        if (input instanceof String text) {
            return EmbeddingRequest.ofText(model, text, parameters, options);
        }
        if (input instanceof List<?> items) {
            return EmbeddingRequest.ofTexts(model, stringList(items), parameters, options);
        }
        throw new ProviderBadRequestException(null, "'input' must be a string or a list of strings");
    }

    private static Map<String, Object> requireBody(Map<String, Object> body) {
        if (body == null) {
            throw new ProviderBadRequestException(null, "Request body is required");
        }
        return body;
    }

    private static String requireModel(Map<String, Object> body) {
        if (body.get(MODEL_KEY) instanceof String model && !model.isBlank()) {
            return model;
        }
        throw new ProviderBadRequestException(null, "'model' is required");
    }

    private static List<ChatMessage> parseMessages(Object rawMessages) {
        if (!(rawMessages instanceof List<?> items)) {
            throw new ProviderBadRequestException(null, "'messages' must be a list");
        }
        List<ChatMessage> messages = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> message)) {
                throw new ProviderBadRequestException(null, "Each message must be an object with role and content");
            }
            for (Object messageKey : message.keySet()) {
                if (!"role".equals(messageKey) && !"content".equals(messageKey)) {
                    throw new ProviderBadRequestException(null, "Unknown message field: " + messageKey);
                }
            }
            if (!(message.get("role") instanceof String role) || role.isBlank()) {
                throw new ProviderBadRequestException(null, "Message role is required");
            }
            Object content = message.get("content");
            if (content != null && !(content instanceof String)) {
                throw new ProviderBadRequestException(null, "Message content must be a string");
            }
            messages.add(new ChatMessage(role, (String) content));
        }
        return messages;
    }

    private static List<String> stringList(List<?> items) {
        List<String> texts = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof String text)) {
                throw new ProviderBadRequestException(null, "'input' must be a string or a list of strings");
            }
            texts.add(text);
        }
        return texts;
    }

    private static ProviderBadRequestException unknownKey(String key) {
        return new ProviderBadRequestException(null, "Unknown request parameter: " + key);
    }
}
