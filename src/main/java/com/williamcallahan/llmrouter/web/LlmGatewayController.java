package com.williamcallahan.llmrouter.web;

import com.williamcallahan.llmrouter.domain.CallOptions;
import com.williamcallahan.llmrouter.domain.ChatCompletionResult;
import com.williamcallahan.llmrouter.domain.EmbeddingResult;
import com.williamcallahan.llmrouter.domain.ModelCatalog;
import com.williamcallahan.llmrouter.domain.errors.LlmProviderException;
import com.williamcallahan.llmrouter.service.LlmDispatchService;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * OpenAI-style HTTP surface over the dispatcher.
 *
 * <p>A bearer token on the incoming call is forwarded as the explicit provider key; without one
 * the provider's environment credential is used.</p>
 */
@RestController
@RequestMapping("/v1")
public class LlmGatewayController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(LlmGatewayController.class);

    private static final String BEARER_PREFIX = "bearer ";

    private final LlmDispatchService dispatchService;
    private final GatewayRequestParser requestParser;

    public LlmGatewayController(
            LlmDispatchService dispatchService,
            GatewayRequestParser requestParser,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.dispatchService = dispatchService;
        this.requestParser = requestParser;
    }

    @PostMapping("/chat/completions")
    public ChatCompletionResult chatCompletions(
            @RequestBody Map<String, Object> body,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return dispatchService.completion(requestParser.parseChatCompletion(body, callOptions(authorization)));
    }

    @PostMapping("/embeddings")
    public EmbeddingResult embeddings(
            @RequestBody Map<String, Object> body,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return dispatchService.embedding(requestParser.parseEmbedding(body, callOptions(authorization)));
    }

    @GetMapping("/models")
    public ModelCatalog models(
            @RequestParam("provider") String provider,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return dispatchService.listModels(provider, callOptions(authorization));
    }

    @ExceptionHandler(LlmProviderException.class)
    public ResponseEntity<ApiErrorResponse> handleProviderFailure(LlmProviderException providerException) {
        log.warn("[LLM] Request failed (kind={}, provider={}, status={})",
                providerException.kind(), providerException.provider(), providerException.statusCode());
        return handleProviderException(providerException);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidArgument(IllegalArgumentException invalidArgument) {
        return handleValidationException(invalidArgument);
    }

    static CallOptions callOptions(String authorization) {
        if (authorization == null) {
            return CallOptions.none();
        }
        String trimmed = authorization.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            String token = trimmed.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? CallOptions.none() : CallOptions.withApiKey(token);
        }
        return CallOptions.none();
    }
}
