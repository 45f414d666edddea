package com.williamcallahan.llmrouter.domain;

/**
 * Caller model identifier split into its routing provider and the vendor-native model id.
 *
 * @param provider routing segment before the first {@code /}
 * @param vendorModel model id as the vendor expects it, may itself contain {@code /}
 */
public record ProviderModelId(String provider, String vendorModel) {
    public ProviderModelId {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider cannot be null or blank");
        }
        if (vendorModel == null || vendorModel.isBlank()) {
            throw new IllegalArgumentException("vendorModel cannot be null or blank");
        }
    }

    /**
     * Returns the caller-facing form, {@code <provider>/<vendorModel>}.
     *
     * @return routed model identifier
     */
    public String routedId() {
        return provider + "/" + vendorModel;
    }
}
