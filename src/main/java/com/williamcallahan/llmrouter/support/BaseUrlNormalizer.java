package com.williamcallahan.llmrouter.support;

import com.williamcallahan.llmrouter.domain.ProviderEndpoint;

/**
 * Normalizes provider base URLs before endpoint paths are appended.
 *
 * <p>Configured and caller-supplied base URLs sometimes carry a trailing slash or a full endpoint
 * path (for example {@code .../v1/chat/completions}); both are stripped so joining with an endpoint
 * path never doubles a segment.</p>
 */
public final class BaseUrlNormalizer {

    private BaseUrlNormalizer() {}

    /**
     * Normalizes a provider base URL.
     *
     * @param baseUrl raw base URL from configuration or the caller
     * @return base URL without trailing slash or endpoint suffix
     * @throws IllegalStateException if baseUrl is null or blank
     */
    public static String normalize(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("Provider base URL is not configured");
        }
        String trimmed = stripTrailingSlashes(baseUrl.trim());
        for (ProviderEndpoint endpoint : ProviderEndpoint.values()) {
            if (trimmed.endsWith(endpoint.defaultPath())) {
                trimmed = trimmed.substring(0, trimmed.length() - endpoint.defaultPath().length());
                break;
            }
        }
        return stripTrailingSlashes(trimmed);
    }

    /**
     * Joins a normalized base URL with an endpoint path.
     *
     * @param baseUrl raw base URL
     * @param path endpoint path, with or without a leading slash
     * @return absolute endpoint URL
     */
    public static String resolve(String baseUrl, String path) {
        String normalizedBase = normalize(baseUrl);
        if (path == null || path.isBlank()) {
            return normalizedBase;
        }
        String trimmedPath = path.trim();
        return trimmedPath.startsWith("/") ? normalizedBase + trimmedPath : normalizedBase + "/" + trimmedPath;
    }

    private static String stripTrailingSlashes(String url) {
        String stripped = url;
        while (stripped.endsWith("/")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped;
    }
}
