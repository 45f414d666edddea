package com.williamcallahan.llmrouter.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.llmrouter.domain.ChatCompletionResult;
import com.williamcallahan.llmrouter.domain.EmbeddingResult;
import com.williamcallahan.llmrouter.domain.ModelCatalog;
import com.williamcallahan.llmrouter.domain.ProviderModelId;
import com.williamcallahan.llmrouter.domain.TokenUsage;
import com.williamcallahan.llmrouter.domain.errors.LlmProviderException;
import com.williamcallahan.llmrouter.domain.errors.ProviderBadRequestException;
import com.williamcallahan.llmrouter.domain.errors.ProviderErrorKind;
import com.williamcallahan.llmrouter.domain.errors.ProviderTimeoutException;
import com.williamcallahan.llmrouter.domain.errors.ProviderUnknownException;
import com.williamcallahan.llmrouter.support.DiagnosticText;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Verifies response mapping and error classification for OpenAI-compatible vendors.
 */
class OpenAiCompatibleResponseNormalizerTest {
    private static final ProviderModelId DBRX = new ProviderModelId("nvidia", "databricks/dbrx-instruct");

    private final OpenAiCompatibleResponseNormalizer normalizer =
            new OpenAiCompatibleResponseNormalizer(new ObjectMapper());

    @Test
    void mapsChatCompletionFields() {
        String body = """
                {"id":"cmpl-mock","object":"chat.completion","created":1718000000,"model":"databricks/dbrx-instruct",
                 "choices":[{"index":0,"finish_reason":"stop","message":{"role":"assistant","content":"Mocked response"}}],
                 "usage":{"prompt_tokens":12,"completion_tokens":3,"total_tokens":15},"system_fingerprint":null}
                """;

        ChatCompletionResult result = normalizer.normalizeChatCompletion(new TransportResponse(200, body), DBRX);

        assertEquals("cmpl-mock", result.id());
        assertEquals(1718000000L, result.created());
        assertEquals("databricks/dbrx-instruct", result.model());
        assertEquals(1, result.choices().size());
        assertEquals("Mocked response", result.choices().get(0).message().content());
        assertEquals("assistant", result.choices().get(0).message().role());
        assertEquals("stop", result.choices().get(0).finishReason());
        assertEquals(new TokenUsage(12, 3, 15), result.usage());
    }

    @Test
    void missingModelAndUsageFallBackToDefaults() {
        String body = "{\"id\":\"x\",\"choices\":[{\"message\":{\"content\":\"hi\"}}]}";

        ChatCompletionResult result = normalizer.normalizeChatCompletion(new TransportResponse(200, body), DBRX);

        assertEquals("databricks/dbrx-instruct", result.model());
        assertEquals("assistant", result.choices().get(0).message().role());
        assertEquals(TokenUsage.EMPTY, result.usage());
    }

    @ParameterizedTest(name = "role \"{0}\" -> assistant")
    @ValueSource(strings = {"", "  ", "\t"})
    void blankVendorRoleFallsBackToAssistant(String role) {
        String body = "{\"id\":\"x\",\"choices\":[{\"message\":{\"role\":\"" + role.replace("\t", "\\t")
                + "\",\"content\":\"hi\"}}]}";

        ChatCompletionResult result = normalizer.normalizeChatCompletion(new TransportResponse(200, body), DBRX);

        assertEquals("assistant", result.choices().get(0).message().role());
        assertEquals("hi", result.choices().get(0).message().content());
    }

    @Test
    void normalizingTheSamePayloadTwiceYieldsEqualResults() {
        String body = "{\"id\":\"x\",\"created\":1,\"model\":\"m\",\"choices\":[{\"index\":0,"
                + "\"message\":{\"role\":\"assistant\",\"content\":\"hi\"}}]}";
        TransportResponse response = new TransportResponse(200, body);

        assertEquals(
                normalizer.normalizeChatCompletion(response, DBRX),
                normalizer.normalizeChatCompletion(response, DBRX));
    }

    @Test
    void embeddingEntriesKeepDeclaredIndex() {
        String body = """
                {"object":"list","model":"nvidia/nv-embedqa-e5-v5",
                 "data":[{"index":1,"embedding":[0.4,0.5]},{"index":0,"embedding":[0.1,0.2]}],
                 "usage":{"prompt_tokens":10,"total_tokens":10}}
                """;

        EmbeddingResult result = normalizer.normalizeEmbedding(
                new TransportResponse(200, body), new ProviderModelId("nvidia", "nvidia/nv-embedqa-e5-v5"));

        assertEquals(2, result.data().size());
        assertEquals(1, result.data().get(0).index());
        assertEquals(List.of(0.4, 0.5), result.data().get(0).embedding());
        assertEquals(new TokenUsage(10, 0, 10), result.usage());
    }

    @Test
    void decodesBase64EncodedEmbeddings() {
        String body = "{\"data\":[{\"index\":0,\"embedding\":\"zczMPc3MTD6amZk+\"}]}";

        EmbeddingResult result = normalizer.normalizeEmbedding(
                new TransportResponse(200, body), new ProviderModelId("nvidia", "nvidia/nv-embedqa-e5-v5"));

        List<Double> embedding = result.data().get(0).embedding();
        assertEquals(3, embedding.size());
        assertEquals(0.1, embedding.get(0), 1e-6);
        assertEquals(0.2, embedding.get(1), 1e-6);
        assertEquals(0.3, embedding.get(2), 1e-6);
        assertEquals("nvidia/nv-embedqa-e5-v5", result.model());
    }

    @ParameterizedTest(name = "embedding {0} is rejected")
    @ValueSource(strings = {"\"not base64!\"", "\"zczM\"", "\"zczMPc0=\"", "[0.1,null]", "[]", "null", "42"})
    void unreadableEmbeddingValuesAreBadRequests(String embedding) {
        String body = "{\"data\":[{\"index\":0,\"embedding\":" + embedding + "}]}";
        TransportResponse response = new TransportResponse(200, body);

        LlmProviderException thrown = assertThrows(ProviderBadRequestException.class,
                () -> normalizer.normalizeEmbedding(response, DBRX));

        assertEquals(200, thrown.statusCode());
    }

    @Test
    void mapsModelListing() {
        String body = """
                {"object":"list","data":[
                  {"id":"nv-mistralai/mistral-nemo-12b-instruct","object":"model","created":735790403,"owned_by":"01-ai"},
                  {"id":"nvidia/vila","object":"model","created":735790403,"owned_by":"abacusai"}]}
                """;

        ModelCatalog catalog = normalizer.normalizeModelList(new TransportResponse(200, body), "nvidia");

        assertEquals(List.of("nv-mistralai/mistral-nemo-12b-instruct", "nvidia/vila"), catalog.modelIds());
        assertEquals("abacusai", catalog.models().get(1).ownedBy());
    }

    @ParameterizedTest(name = "HTTP {0} -> {1}")
    @CsvSource({
        "400, BAD_REQUEST",
        "401, AUTHENTICATION",
        "403, AUTHENTICATION",
        "404, BAD_REQUEST",
        "408, TIMEOUT",
        "409, UNKNOWN",
        "422, BAD_REQUEST",
        "429, RATE_LIMIT",
        "500, SERVER_ERROR",
        "502, SERVER_ERROR",
        "503, SERVER_ERROR",
        "302, UNKNOWN"
    })
    void classifiesVendorStatus(int statusCode, ProviderErrorKind expectedKind) {
        TransportResponse response = new TransportResponse(statusCode, "{\"error\":{\"message\":\"nope\"}}");

        LlmProviderException thrown =
                assertThrows(LlmProviderException.class, () -> normalizer.normalizeChatCompletion(response, DBRX));

        assertEquals(expectedKind, thrown.kind());
        assertEquals(statusCode, thrown.statusCode());
        assertEquals("nvidia", thrown.provider());
        assertEquals("nope", thrown.vendorMessage());
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
        "{\"error\":{\"message\":\"Authentication failed\"}}|Authentication failed",
        "{\"error\":\"invalid key\"}|invalid key",
        "{\"detail\":\"Unauthorized\"}|Unauthorized",
        "{\"status\":401,\"title\":\"Unauthorized\"}|Unauthorized",
        "{\"message\":\"bad\"}|bad",
        "plain text failure|plain text failure"
    })
    void extractsVendorMessage(String body, String expectedMessage) {
        assertEquals(expectedMessage, normalizer.extractVendorMessage(body));
    }

    @Test
    void longRawBodiesAreTruncated() {
        String message = normalizer.extractVendorMessage("<html>" + "x".repeat(5000) + "</html>");

        assertTrue(message.length() <= DiagnosticText.MAX_ERROR_SNIPPET + 3);
    }

    @ParameterizedTest(name = "HTTP {0} body {1}")
    @CsvSource(delimiter = '|', value = {
        "200|not json",
        "200|{\"choices\":[]}",
        "200|{\"choices\":[{\"index\":0}]}",
        "201|{\"choices\":[{\"message\":{\"content\":\"hi\"}}],\"usage\":{\"prompt_tokens\":-1}}",
        "200|'   '"
    })
    void malformedSuccessBodyIsBadRequestCarryingVendorStatus(int statusCode, String body) {
        TransportResponse response = new TransportResponse(statusCode, body);

        LlmProviderException thrown = assertThrows(ProviderBadRequestException.class,
                () -> normalizer.normalizeChatCompletion(response, DBRX));

        assertEquals(statusCode, thrown.statusCode());
        assertEquals("nvidia", thrown.provider());
    }

    @Test
    void malformedEmbeddingAndModelBodiesCarryVendorStatus() {
        LlmProviderException embedding = assertThrows(ProviderBadRequestException.class,
                () -> normalizer.normalizeEmbedding(new TransportResponse(200, "{\"data\":[]}"), DBRX));
        LlmProviderException models = assertThrows(ProviderBadRequestException.class,
                () -> normalizer.normalizeModelList(new TransportResponse(200, "{\"object\":\"list\"}"), "nvidia"));

        assertEquals(200, embedding.statusCode());
        assertEquals(200, models.statusCode());
    }

    @Test
    void transportFailuresMapToTimeoutOrUnknown() {
        LlmProviderException timedOut = normalizer.normalizeTransportFailure(
                new TransportException("Request timed out", true, new SocketTimeoutException("Read timed out")),
                "nvidia");
        LlmProviderException refused = normalizer.normalizeTransportFailure(
                new TransportException("Connection refused", false, null), "nvidia");

        ProviderTimeoutException timeout = assertInstanceOf(ProviderTimeoutException.class, timedOut);
        assertTrue(timeout.kind().isTransient());
        assertEquals(LlmProviderException.NO_STATUS, timeout.statusCode());
        assertInstanceOf(ProviderUnknownException.class, refused);
        assertEquals(ProviderErrorKind.UNKNOWN, refused.kind());
    }

    @Test
    void cancelledTransportMapsToTimeout() {
        TransportException cancelled = new TransportException(
                "Request cancelled: http://localhost/v1/chat/completions", false, true, new InterruptedIOException());

        LlmProviderException mapped = normalizer.normalizeTransportFailure(cancelled, "nvidia");

        assertInstanceOf(ProviderTimeoutException.class, mapped);
        assertEquals(LlmProviderException.NO_STATUS, mapped.statusCode());
        assertTrue(mapped.getMessage().contains("Request cancelled"));
    }
}
