package com.williamcallahan.llmrouter.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.llmrouter.domain.ChatChoice;
import com.williamcallahan.llmrouter.domain.ChatCompletionResult;
import com.williamcallahan.llmrouter.domain.ChatMessage;
import com.williamcallahan.llmrouter.domain.EmbeddingResult;
import com.williamcallahan.llmrouter.domain.EmbeddingVector;
import com.williamcallahan.llmrouter.domain.ModelCatalog;
import com.williamcallahan.llmrouter.domain.ProviderModel;
import com.williamcallahan.llmrouter.domain.ProviderModelId;
import com.williamcallahan.llmrouter.domain.TokenUsage;
import com.williamcallahan.llmrouter.domain.errors.LlmProviderException;
import com.williamcallahan.llmrouter.domain.errors.ProviderErrorKind;
import com.williamcallahan.llmrouter.support.DiagnosticText;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes OpenAI-compatible chat, embedding and model listing responses.
 *
 * <p>Status classification: 401/403 authentication, 400/404/422 bad request, 408 timeout,
 * 429 rate limit, 5xx server error, anything else unknown. A successful status with a body that
 * cannot be read is treated as a bad request carrying the vendor status. Embedding vectors are
 * accepted as float arrays or as base64-encoded float32 data.</p>
 */
public class OpenAiCompatibleResponseNormalizer implements ProviderResponseNormalizer {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleResponseNormalizer.class);

    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_UNPROCESSABLE_ENTITY = 422;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

    private static final String DEFAULT_ASSISTANT_ROLE = "assistant";

    private final ObjectMapper objectMapper;

    /**
     * Creates a normalizer.
     *
     * @param objectMapper mapper used to read vendor bodies
     */
    public OpenAiCompatibleResponseNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public ChatCompletionResult normalizeChatCompletion(TransportResponse response, ProviderModelId modelId) {
        String provider = modelId.provider();
        ChatCompletionPayload payload = readSuccessBody(response, provider, ChatCompletionPayload.class);
        if (payload.choices() == null || payload.choices().isEmpty()) {
            throw malformed(provider, response, "Chat completion response contained no choices");
        }
        List<ChatChoice> choices = new ArrayList<>(payload.choices().size());
        for (int position = 0; position < payload.choices().size(); position++) {
            ChoicePayload choice = payload.choices().get(position);
            if (choice == null || choice.message() == null) {
                throw malformed(provider, response, "Chat completion choice " + position + " has no message");
            }
            String vendorRole = choice.message().role();
            String role = vendorRole == null || vendorRole.isBlank() ? DEFAULT_ASSISTANT_ROLE : vendorRole;
            choices.add(new ChatChoice(
                    choice.index() == null ? position : choice.index(),
                    new ChatMessage(role, choice.message().content()),
                    choice.finishReason()));
        }
        return new ChatCompletionResult(
                payload.id(),
                payload.created() == null ? 0L : payload.created(),
                payload.model() == null || payload.model().isBlank() ? modelId.vendorModel() : payload.model(),
                choices,
                toUsage(payload.usage(), provider, response));
    }

    @Override
    public EmbeddingResult normalizeEmbedding(TransportResponse response, ProviderModelId modelId) {
        String provider = modelId.provider();
        EmbeddingPayload payload = readSuccessBody(response, provider, EmbeddingPayload.class);
        if (payload.data() == null || payload.data().isEmpty()) {
            throw malformed(provider, response, "Embedding response missing embedding entries");
        }
        List<EmbeddingVector> vectors = new ArrayList<>(payload.data().size());
        for (int position = 0; position < payload.data().size(); position++) {
            EmbeddingEntryPayload entry = payload.data().get(position);
            if (entry == null) {
                throw malformed(provider, response, "Embedding response contained null entry at index " + position);
            }
            vectors.add(toEmbeddingVector(entry, position, provider, response));
        }
        return new EmbeddingResult(
                payload.model() == null || payload.model().isBlank() ? modelId.vendorModel() : payload.model(),
                vectors,
                toUsage(payload.usage(), provider, response));
    }

    @Override
    public ModelCatalog normalizeModelList(TransportResponse response, String provider) {
        ModelListPayload payload = readSuccessBody(response, provider, ModelListPayload.class);
        if (payload.data() == null) {
            throw malformed(provider, response, "Model listing response missing data");
        }
        List<ProviderModel> models = new ArrayList<>(payload.data().size());
        for (ModelPayload model : payload.data()) {
            if (model == null || model.id() == null || model.id().isBlank()) {
                throw malformed(provider, response, "Model listing contained an entry without id");
            }
            models.add(new ProviderModel(
                    model.id(), model.object(), model.created() == null ? 0L : model.created(), model.ownedBy()));
        }
        return new ModelCatalog(provider, models);
    }

    @Override
    public LlmProviderException normalizeTransportFailure(TransportException failure, String provider) {
        ProviderErrorKind kind = failure.isTimedOut() || failure.isCancelled()
                ? ProviderErrorKind.TIMEOUT
                : ProviderErrorKind.UNKNOWN;
        return LlmProviderException.of(
                kind, provider, LlmProviderException.NO_STATUS, DiagnosticText.sanitize(failure.getMessage()), failure);
    }

    /**
     * Maps an HTTP status to its canonical error kind.
     *
     * @param statusCode vendor HTTP status
     * @return error kind for a non-successful status
     */
    static ProviderErrorKind classifyStatus(int statusCode) {
        if (statusCode == HTTP_UNAUTHORIZED || statusCode == HTTP_FORBIDDEN) {
            return ProviderErrorKind.AUTHENTICATION;
        }
        if (statusCode == HTTP_BAD_REQUEST || statusCode == HTTP_NOT_FOUND || statusCode == HTTP_UNPROCESSABLE_ENTITY) {
            return ProviderErrorKind.BAD_REQUEST;
        }
        if (statusCode == HTTP_REQUEST_TIMEOUT) {
            return ProviderErrorKind.TIMEOUT;
        }
        if (statusCode == HTTP_TOO_MANY_REQUESTS) {
            return ProviderErrorKind.RATE_LIMIT;
        }
        if (statusCode >= HTTP_INTERNAL_SERVER_ERROR) {
            return ProviderErrorKind.SERVER_ERROR;
        }
        return ProviderErrorKind.UNKNOWN;
    }

    private <T> T readSuccessBody(TransportResponse response, String provider, Class<T> payloadType) {
        Objects.requireNonNull(response, "response");
        if (!response.isSuccessful()) {
            throw vendorError(response, provider);
        }
        if (response.body().isBlank()) {
            throw malformed(provider, response, "Response body was empty");
        }
        try {
            T payload = objectMapper.readValue(response.body(), payloadType);
            if (payload == null) {
                throw malformed(provider, response, "Response body was null");
            }
            return payload;
        } catch (JsonProcessingException parseException) {
            throw LlmProviderException.of(
                    ProviderErrorKind.BAD_REQUEST,
                    provider,
                    response.statusCode(),
                    "Malformed response body: " + DiagnosticText.sanitize(parseException.getOriginalMessage()),
                    parseException);
        }
    }

    private LlmProviderException vendorError(TransportResponse response, String provider) {
        ProviderErrorKind kind = classifyStatus(response.statusCode());
        String vendorMessage = extractVendorMessage(response.body());
        log.warn("[LLM] Provider call failed (provider={}, status={}, kind={}): {}",
                provider, response.statusCode(), kind, vendorMessage.isBlank() ? "no details" : vendorMessage);
        return LlmProviderException.of(kind, provider, response.statusCode(), vendorMessage, null);
    }

    /**
     * Pulls a human-readable message out of a vendor error body.
     *
     * <p>Recognizes {@code error.message}, a string {@code error}, and the {@code detail},
     * {@code message} and {@code title} fields; otherwise falls back to the raw body.</p>
     */
    String extractVendorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException parseException) {
            return DiagnosticText.sanitize(body);
        }
        if (root == null || !root.isObject()) {
            return DiagnosticText.sanitize(body);
        }
        JsonNode error = root.path("error");
        if (error.isObject() && error.path("message").isTextual()) {
            return DiagnosticText.sanitize(error.path("message").asText());
        }
        if (error.isTextual()) {
            return DiagnosticText.sanitize(error.asText());
        }
        for (String field : List.of("detail", "message", "title")) {
            JsonNode candidate = root.path(field);
            if (candidate.isTextual() && !candidate.asText().isBlank()) {
                return DiagnosticText.sanitize(candidate.asText());
            }
        }
        return DiagnosticText.sanitize(body);
    }

    private EmbeddingVector toEmbeddingVector(
            EmbeddingEntryPayload entry, int position, String provider, TransportResponse response) {
        JsonNode embedding = entry.embedding();
        List<Double> values;
        if (embedding != null && embedding.isTextual()) {
            values = decodeBase64Floats(embedding.asText(), position, provider, response);
        } else if (embedding != null && embedding.isArray()) {
            values = readFloatArray(embedding, position, provider, response);
        } else {
            throw malformed(provider, response, "Embedding response missing embedding values at index " + position);
        }
        if (values.isEmpty()) {
            throw malformed(provider, response, "Embedding response missing embedding values at index " + position);
        }
        int index = entry.index() == null ? position : entry.index();
        if (index < 0) {
            throw malformed(provider, response, "Embedding response index out of bounds: " + index);
        }
        return new EmbeddingVector(index, values);
    }

    private static List<Double> readFloatArray(
            JsonNode embedding, int position, String provider, TransportResponse response) {
        List<Double> values = new ArrayList<>(embedding.size());
        int invalidValueCount = 0;
        for (JsonNode value : embedding) {
            if (value.isNumber()) {
                values.add(value.doubleValue());
            } else {
                invalidValueCount++;
            }
        }
        if (invalidValueCount > 0) {
            throw malformed(provider, response, "Embedding payload invalid: " + invalidValueCount
                    + " non-numeric values out of " + embedding.size() + " dimensions at index " + position);
        }
        return values;
    }

    /**
     * Decodes an {@code encoding_format=base64} vector: little-endian IEEE 754 float32 values.
     */
    private static List<Double> decodeBase64Floats(
            String encoded, int position, String provider, TransportResponse response) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException decodeException) {
            throw malformed(provider, response, "Embedding at index " + position + " is not valid base64");
        }
        if (bytes.length % Float.BYTES != 0) {
            throw malformed(provider, response, "Embedding at index " + position + " has " + bytes.length
                    + " bytes, not a whole number of float32 values");
        }
        FloatBuffer floats = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer();
        List<Double> values = new ArrayList<>(floats.remaining());
        while (floats.hasRemaining()) {
            values.add((double) floats.get());
        }
        return values;
    }

    private TokenUsage toUsage(UsagePayload usage, String provider, TransportResponse response) {
        if (usage == null) {
            return TokenUsage.EMPTY;
        }
        long promptTokens = usage.promptTokens() == null ? 0L : usage.promptTokens();
        long completionTokens = usage.completionTokens() == null ? 0L : usage.completionTokens();
        long totalTokens = usage.totalTokens() == null ? promptTokens + completionTokens : usage.totalTokens();
        if (promptTokens < 0 || completionTokens < 0 || totalTokens < 0) {
            throw malformed(provider, response, "Usage counters cannot be negative");
        }
        return new TokenUsage(promptTokens, completionTokens, totalTokens);
    }

    private static LlmProviderException malformed(String provider, TransportResponse response, String message) {
        return LlmProviderException.of(ProviderErrorKind.BAD_REQUEST, provider, response.statusCode(), message, null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatCompletionPayload(
            String id, Long created, String model, List<ChoicePayload> choices, UsagePayload usage) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChoicePayload(
            Integer index, MessagePayload message, @JsonProperty("finish_reason") String finishReason) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record MessagePayload(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingPayload(String model, List<EmbeddingEntryPayload> data, UsagePayload usage) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingEntryPayload(Integer index, JsonNode embedding) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record UsagePayload(
            @JsonProperty("prompt_tokens") Long promptTokens,
            @JsonProperty("completion_tokens") Long completionTokens,
            @JsonProperty("total_tokens") Long totalTokens) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ModelListPayload(String object, List<ModelPayload> data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ModelPayload(
            String id, String object, Long created, @JsonProperty("owned_by") String ownedBy) {}
}
