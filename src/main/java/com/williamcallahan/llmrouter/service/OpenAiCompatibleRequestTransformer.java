package com.williamcallahan.llmrouter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.llmrouter.domain.CanonicalRequest;
import com.williamcallahan.llmrouter.domain.ChatCompletionRequest;
import com.williamcallahan.llmrouter.domain.ChatMessage;
import com.williamcallahan.llmrouter.domain.ChatParameter;
import com.williamcallahan.llmrouter.domain.EmbeddingParameter;
import com.williamcallahan.llmrouter.domain.EmbeddingRequest;
import com.williamcallahan.llmrouter.domain.ParameterValueKind;
import com.williamcallahan.llmrouter.domain.ProviderEndpoint;
import com.williamcallahan.llmrouter.domain.ProviderModelId;
import com.williamcallahan.llmrouter.domain.errors.ProviderBadRequestException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds OpenAI chat completions and embeddings bodies.
 *
 * <p>Parameters are copied verbatim under their canonical wire names; absent parameters are
 * omitted, never defaulted. Parameters the provider does not accept are rejected, or dropped when
 * {@code dropUnsupportedParams} is set.</p>
 */
public class OpenAiCompatibleRequestTransformer implements ProviderRequestTransformer {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleRequestTransformer.class);

    private final ObjectMapper objectMapper;
    private final boolean dropUnsupportedParams;

    /**
     * Creates a transformer.
     *
     * @param objectMapper mapper used to build JSON nodes
     * @param dropUnsupportedParams drop parameters a provider does not accept instead of failing
     */
    public OpenAiCompatibleRequestTransformer(ObjectMapper objectMapper, boolean dropUnsupportedParams) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.dropUnsupportedParams = dropUnsupportedParams;
    }

    @Override
    public VendorRequestBody transform(
            CanonicalRequest request, ProviderModelId modelId, ProviderDefinition provider) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(provider, "provider");
        if (request instanceof ChatCompletionRequest chatRequest) {
            return new VendorRequestBody(
                    ProviderEndpoint.CHAT_COMPLETIONS, chatCompletionBody(chatRequest, modelId, provider));
        }
        if (request instanceof EmbeddingRequest embeddingRequest) {
            return new VendorRequestBody(
                    ProviderEndpoint.EMBEDDINGS, embeddingBody(embeddingRequest, modelId, provider));
        }
        throw new IllegalArgumentException("Unsupported request type: " + request.getClass().getName());
    }

    private ObjectNode chatCompletionBody(
            ChatCompletionRequest request, ProviderModelId modelId, ProviderDefinition provider) {
        if (request.messages().isEmpty()) {
            throw new ProviderBadRequestException(provider.name(), "messages must contain at least one message");
        }
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : request.messages()) {
            messages.addObject().put("role", message.role()).put("content", message.content());
        }
        body.put("model", modelId.vendorModel());

        List<String> droppedParameters = new ArrayList<>();
        for (Map.Entry<ChatParameter, Object> entry : request.parameters().entrySet()) {
            ChatParameter parameter = entry.getKey();
            if (!provider.supportedChatParameters().contains(parameter)) {
                droppedParameters.add(parameter.wireName());
                continue;
            }
            requireValueKind(provider, parameter.wireName(), parameter.valueKind(), entry.getValue());
            body.set(parameter.wireName(), objectMapper.valueToTree(entry.getValue()));
        }
        handleUnsupported(provider, droppedParameters);
        return body;
    }

    private ObjectNode embeddingBody(EmbeddingRequest request, ProviderModelId modelId, ProviderDefinition provider) {
        if (request.input().isEmpty()) {
            throw new ProviderBadRequestException(provider.name(), "input must contain at least one text");
        }
        ObjectNode body = objectMapper.createObjectNode();
        if (request.singleInput()) {
            body.put("input", request.input().get(0));
        } else {
            ArrayNode inputs = body.putArray("input");
            request.input().forEach(inputs::add);
        }
        body.put("model", modelId.vendorModel());

        List<String> droppedParameters = new ArrayList<>();
        for (Map.Entry<EmbeddingParameter, Object> entry : request.parameters().entrySet()) {
            EmbeddingParameter parameter = entry.getKey();
            if (!provider.supportedEmbeddingParameters().contains(parameter)) {
                droppedParameters.add(parameter.wireName());
                continue;
            }
            requireValueKind(provider, parameter.wireName(), parameter.valueKind(), entry.getValue());
            body.set(parameter.wireName(), objectMapper.valueToTree(entry.getValue()));
        }
        handleUnsupported(provider, droppedParameters);
        return body;
    }

    private static void requireValueKind(
            ProviderDefinition provider, String wireName, ParameterValueKind valueKind, Object value) {
        if (!valueKind.accepts(value)) {
            throw new ProviderBadRequestException(provider.name(), "Invalid value for " + wireName + ": expected "
                    + valueKind.name().toLowerCase(Locale.ROOT) + " but got " + describe(value));
        }
    }

    private void handleUnsupported(ProviderDefinition provider, List<String> unsupportedParameters) {
        if (unsupportedParameters.isEmpty()) {
            return;
        }
        if (!dropUnsupportedParams) {
            throw new ProviderBadRequestException(provider.name(), provider.name()
                    + " does not support parameters: " + unsupportedParameters
                    + ". Set llm.drop-unsupported-params=true to drop them.");
        }
        log.debug("[LLM] Dropping unsupported parameters (provider={}, parameters={})",
                provider.name(), Set.copyOf(unsupportedParameters));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
