package com.williamcallahan.llmrouter.service;

import com.williamcallahan.llmrouter.domain.ProviderModelId;
import com.williamcallahan.llmrouter.domain.errors.ProviderBadRequestException;
import org.springframework.stereotype.Service;

/**
 * Splits caller model identifiers into a routing provider and the vendor-native model id.
 *
 * <p>Only the first {@code /} separates the provider, so vendor namespaces survive:
 * {@code nvidia/nvidia/nv-embedqa-e5-v5} routes to {@code nvidia} with vendor model
 * {@code nvidia/nv-embedqa-e5-v5}. An unqualified model string is rejected rather than guessed.</p>
 */
@Service
public class ModelIdentifierRewriter {

    static final String PROVIDER_NOT_PROVIDED_MESSAGE =
            "LLM Provider NOT provided. Pass in the LLM provider you are trying to call. You passed model=";

    private static final char PROVIDER_SEPARATOR = '/';

    /**
     * Rewrites a caller model identifier.
     *
     * @param callerModel model string in {@code <provider>/<vendor_model>} form
     * @return provider and vendor model pair
     * @throws ProviderBadRequestException when the provider or vendor segment is missing
     */
    public ProviderModelId rewrite(String callerModel) {
        String trimmedModel = callerModel == null ? "" : callerModel.trim();
        int separatorIndex = trimmedModel.indexOf(PROVIDER_SEPARATOR);
        if (separatorIndex <= 0 || separatorIndex == trimmedModel.length() - 1) {
            throw new ProviderBadRequestException(null, PROVIDER_NOT_PROVIDED_MESSAGE + callerModel);
        }
        String provider = trimmedModel.substring(0, separatorIndex).trim();
        String vendorModel = trimmedModel.substring(separatorIndex + 1).trim();
        if (provider.isEmpty() || vendorModel.isEmpty()) {
            throw new ProviderBadRequestException(null, PROVIDER_NOT_PROVIDED_MESSAGE + callerModel);
        }
        return new ProviderModelId(provider, vendorModel);
    }
}
