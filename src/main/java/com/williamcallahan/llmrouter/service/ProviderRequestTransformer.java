package com.williamcallahan.llmrouter.service;

import com.williamcallahan.llmrouter.domain.CanonicalRequest;
import com.williamcallahan.llmrouter.domain.ProviderModelId;

/**
 * Maps canonical requests into a provider's wire format.
 *
 * <p>Implementations perform no I/O and must be deterministic: the same request and model id
 * always produce an equal body.</p>
 */
public interface ProviderRequestTransformer {

    /**
     * Builds the vendor request body.
     *
     * @param request canonical chat or embedding request
     * @param modelId rewritten model id; {@code vendorModel} is what goes on the wire
     * @param provider provider the body is addressed to, used for parameter support checks
     * @return vendor body for the request's endpoint
     * @throws com.williamcallahan.llmrouter.domain.errors.ProviderBadRequestException when the request
     *     cannot be expressed for this provider
     */
    VendorRequestBody transform(CanonicalRequest request, ProviderModelId modelId, ProviderDefinition provider);
}
