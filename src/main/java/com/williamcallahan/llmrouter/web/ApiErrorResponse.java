package com.williamcallahan.llmrouter.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * Standard JSON error payload returned by the gateway endpoints.
 *
 * @param status fixed status indicator (always "error")
 * @param message user-facing error message
 * @param details failure classification, absent for plain validation errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String status, String message, ErrorDetails details) {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    /**
     * Creates an error response with no classification details.
     *
     * @param message user-facing error message
     * @return standardized error payload
     */
    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null);
    }

    /**
     * Creates an error response including classification details.
     *
     * @param message user-facing error message
     * @param details failure classification
     * @return standardized error payload
     */
    public static ApiErrorResponse error(String message, ErrorDetails details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }

    /**
     * Classification of a provider failure.
     *
     * @param type failure kind name
     * @param provider provider name, null when the failure preceded provider selection
     * @param vendorStatus vendor HTTP status, null when no response was received
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorDetails(String type, String provider, Integer vendorStatus) {}
}
