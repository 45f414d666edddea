package com.williamcallahan.llmrouter.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.llmrouter.domain.CallOptions;
import com.williamcallahan.llmrouter.domain.CanonicalRequest;
import com.williamcallahan.llmrouter.domain.ChatCompletionRequest;
import com.williamcallahan.llmrouter.domain.ChatCompletionResult;
import com.williamcallahan.llmrouter.domain.Credential;
import com.williamcallahan.llmrouter.domain.EmbeddingRequest;
import com.williamcallahan.llmrouter.domain.EmbeddingResult;
import com.williamcallahan.llmrouter.domain.ModelCatalog;
import com.williamcallahan.llmrouter.domain.ProviderEndpoint;
import com.williamcallahan.llmrouter.domain.ProviderModelId;
import com.williamcallahan.llmrouter.domain.errors.LlmProviderException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Routes canonical requests to their provider and returns canonical results.
 *
 * <p>Each call runs rewrite, provider lookup and credential resolution before anything touches
 * the network, so a malformed model id or missing key never produces an outbound request. The
 * service keeps no per-call state and performs no retries; callers decide what to do with each
 * {@link LlmProviderException} kind.</p>
 */
@Service
public class LlmDispatchService {
    private static final Logger log = LoggerFactory.getLogger(LlmDispatchService.class);

    private final ModelIdentifierRewriter modelIdentifierRewriter;
    private final ProviderRegistry providerRegistry;
    private final CredentialResolver credentialResolver;
    private final TransportInvoker transportInvoker;
    private final ObjectMapper objectMapper;

    /**
     * Creates the dispatcher.
     *
     * @param modelIdentifierRewriter splits caller model ids
     * @param providerRegistry provider lookup
     * @param credentialResolver credential selection
     * @param transportInvoker HTTP transport
     * @param objectMapper serializer for vendor bodies
     */
    public LlmDispatchService(
            ModelIdentifierRewriter modelIdentifierRewriter,
            ProviderRegistry providerRegistry,
            CredentialResolver credentialResolver,
            TransportInvoker transportInvoker,
            ObjectMapper objectMapper) {
        this.modelIdentifierRewriter = Objects.requireNonNull(modelIdentifierRewriter, "modelIdentifierRewriter");
        this.providerRegistry = Objects.requireNonNull(providerRegistry, "providerRegistry");
        this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver");
        this.transportInvoker = Objects.requireNonNull(transportInvoker, "transportInvoker");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Runs a chat completion.
     *
     * @param request canonical chat request
     * @return canonical completion
     * @throws LlmProviderException on any routing, credential, transport or vendor failure
     */
    public ChatCompletionResult completion(ChatCompletionRequest request) {
        PreparedCall call = prepare(request);
        log.debug("[LLM] Chat completion (provider={}, model={}, messages={})",
                call.provider().name(), call.modelId().vendorModel(), request.messages().size());
        TransportResponse response = execute(call.provider(), call.transportRequest(), call.credential());
        return call.provider().normalizer().normalizeChatCompletion(response, call.modelId());
    }

    /**
     * Runs an embedding request.
     *
     * @param request canonical embedding request
     * @return canonical embeddings
     * @throws LlmProviderException on any routing, credential, transport or vendor failure
     */
    public EmbeddingResult embedding(EmbeddingRequest request) {
        PreparedCall call = prepare(request);
        log.debug("[EMBEDDING] Embedding (provider={}, model={}, inputs={})",
                call.provider().name(), call.modelId().vendorModel(), request.input().size());
        TransportResponse response = execute(call.provider(), call.transportRequest(), call.credential());
        return call.provider().normalizer().normalizeEmbedding(response, call.modelId());
    }

    /**
     * Lists the models a provider advertises.
     *
     * @param providerName provider name or alias
     * @param options caller overrides for credential and base URL
     * @return advertised models
     * @throws LlmProviderException on any routing, credential, transport or vendor failure
     */
    public ModelCatalog listModels(String providerName, CallOptions options) {
        CallOptions callOptions = options == null ? CallOptions.none() : options;
        ProviderDefinition provider = providerRegistry.lookup(providerName);
        Credential credential = credentialResolver.resolve(callOptions.apiKey(), provider);
        String url = provider.endpointUrl(ProviderEndpoint.MODELS, callOptions.apiBase());
        TransportRequest transportRequest =
                new TransportRequest(ProviderEndpoint.MODELS.httpMethod(), url, null);
        TransportResponse response = execute(provider, transportRequest, credential);
        return provider.normalizer().normalizeModelList(response, provider.name());
    }

    private PreparedCall prepare(CanonicalRequest request) {
        Objects.requireNonNull(request, "request");
        ProviderModelId callerModelId = modelIdentifierRewriter.rewrite(request.model());
        ProviderDefinition provider = providerRegistry.lookup(callerModelId.provider());
        ProviderModelId modelId = new ProviderModelId(provider.name(), callerModelId.vendorModel());
        Credential credential = credentialResolver.resolve(request.options().apiKey(), provider);

        VendorRequestBody body = provider.transformer().transform(request, modelId, provider);
        String url = provider.endpointUrl(body.endpoint(), request.options().apiBase());
        TransportRequest transportRequest =
                new TransportRequest(body.endpoint().httpMethod(), url, serialize(body));
        return new PreparedCall(provider, modelId, credential, transportRequest);
    }

    private TransportResponse execute(
            ProviderDefinition provider, TransportRequest transportRequest, Credential credential) {
        try {
            return transportInvoker.invoke(transportRequest, credential);
        } catch (TransportException transportException) {
            throw provider.normalizer().normalizeTransportFailure(transportException, provider.name());
        }
    }

    private String serialize(VendorRequestBody body) {
        try {
            return objectMapper.writeValueAsString(body.payload());
        } catch (JsonProcessingException serializationException) {
            throw new IllegalStateException("Failed to serialize vendor request body", serializationException);
        }
    }

    private record PreparedCall(
            ProviderDefinition provider,
            ProviderModelId modelId,
            Credential credential,
            TransportRequest transportRequest) {}
}
