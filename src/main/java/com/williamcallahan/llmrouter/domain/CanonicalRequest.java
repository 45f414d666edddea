package com.williamcallahan.llmrouter.domain;

/**
 * Provider-agnostic request accepted by the dispatcher.
 *
 * <p>The model string is the caller-facing identifier, {@code <provider>/<vendor_model>}, and is
 * rewritten before anything reaches the wire.</p>
 */
public sealed interface CanonicalRequest permits ChatCompletionRequest, EmbeddingRequest {

    /**
     * Returns the caller-facing, provider-prefixed model identifier.
     *
     * @return model identifier as supplied by the caller
     */
    String model();

    /**
     * Returns caller overrides for credentials and endpoint.
     *
     * @return call options, never null
     */
    CallOptions options();

    /**
     * Returns the provider endpoint this request targets.
     *
     * @return endpoint kind
     */
    ProviderEndpoint endpoint();
}
