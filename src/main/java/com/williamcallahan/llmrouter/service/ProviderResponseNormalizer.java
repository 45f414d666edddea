package com.williamcallahan.llmrouter.service;

import com.williamcallahan.llmrouter.domain.ChatCompletionResult;
import com.williamcallahan.llmrouter.domain.EmbeddingResult;
import com.williamcallahan.llmrouter.domain.ModelCatalog;
import com.williamcallahan.llmrouter.domain.ProviderModelId;
import com.williamcallahan.llmrouter.domain.errors.LlmProviderException;

/**
 * Maps a provider's raw responses into canonical results and canonical errors.
 *
 * <p>This is the only component that builds an {@link LlmProviderException} from vendor output.
 * Implementations hold no per-call state, so normalizing the same response twice yields equal
 * results.</p>
 */
public interface ProviderResponseNormalizer {

    /**
     * Normalizes a chat completions response.
     *
     * @param response raw vendor response
     * @param modelId model id the call was made with
     * @return canonical completion
     * @throws LlmProviderException when the status is not successful or the body is malformed
     */
    ChatCompletionResult normalizeChatCompletion(TransportResponse response, ProviderModelId modelId);

    /**
     * Normalizes an embeddings response.
     *
     * @param response raw vendor response
     * @param modelId model id the call was made with
     * @return canonical embeddings
     * @throws LlmProviderException when the status is not successful or the body is malformed
     */
    EmbeddingResult normalizeEmbedding(TransportResponse response, ProviderModelId modelId);

    /**
     * Normalizes a models listing response.
     *
     * @param response raw vendor response
     * @param provider canonical provider name
     * @return advertised models
     * @throws LlmProviderException when the status is not successful or the body is malformed
     */
    ModelCatalog normalizeModelList(TransportResponse response, String provider);

    /**
     * Converts a failure that produced no HTTP response.
     *
     * @param failure transport failure
     * @param provider canonical provider name
     * @return canonical error to throw
     */
    LlmProviderException normalizeTransportFailure(TransportException failure, String provider);
}
