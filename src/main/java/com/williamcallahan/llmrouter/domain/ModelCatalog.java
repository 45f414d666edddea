package com.williamcallahan.llmrouter.domain;

import java.util.List;

/**
 * Models a provider reports as available.
 *
 * @param provider canonical provider name
 * @param models advertised models in vendor order
 */
public record ModelCatalog(String provider, List<ProviderModel> models) {
    public ModelCatalog {
        models = models == null ? List.of() : List.copyOf(models);
    }

    /**
     * Returns the advertised model ids.
     *
     * @return ids in vendor order
     */
    public List<String> modelIds() {
        return models.stream().map(ProviderModel::id).toList();
    }
}
