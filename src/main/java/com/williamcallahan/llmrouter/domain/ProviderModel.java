package com.williamcallahan.llmrouter.domain;

/**
 * Model advertised by a provider's models listing.
 *
 * @param id vendor model id
 * @param object object type reported by the vendor, usually {@code model}
 * @param created creation timestamp in epoch seconds, 0 when absent
 * @param ownedBy owning organisation, may be null
 */
public record ProviderModel(String id, String object, long created, String ownedBy) {
    public ProviderModel {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Model id cannot be null or blank");
        }
    }
}
