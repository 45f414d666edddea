package com.williamcallahan.llmrouter.service;

/**
 * Outbound HTTP call described without any client library types.
 *
 * @param method HTTP method name such as {@code POST}
 * @param url absolute endpoint URL
 * @param body serialized JSON body, or null for body-less methods
 */
public record TransportRequest(String method, String url, String body) {
    public TransportRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method must not be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
    }
}
