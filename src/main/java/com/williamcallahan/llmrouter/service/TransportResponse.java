package com.williamcallahan.llmrouter.service;

/**
 * Raw vendor response, returned for every HTTP status.
 *
 * @param statusCode HTTP status code
 * @param body response body, empty when the vendor sent none
 */
public record TransportResponse(int statusCode, String body) {
    private static final int SUCCESS_MIN = 200;
    private static final int SUCCESS_MAX_EXCLUSIVE = 300;

    public TransportResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return statusCode >= SUCCESS_MIN && statusCode < SUCCESS_MAX_EXCLUSIVE;
    }
}
