package com.williamcallahan.llmrouter.web;

import com.williamcallahan.llmrouter.domain.errors.LlmProviderException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds consistent error responses for the gateway controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds an error response with status and message.
     *
     * @param status HTTP status to return
     * @param message error message
     * @return response entity carrying the error payload
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response describing a classified provider failure.
     *
     * @param status HTTP status to return
     * @param providerException classified failure
     * @return response entity carrying the error payload and its classification
     */
    public ResponseEntity<ApiErrorResponse> buildProviderErrorResponse(
            HttpStatus status, LlmProviderException providerException) {
        ApiErrorResponse.ErrorDetails details = new ApiErrorResponse.ErrorDetails(
                providerException.kind().name(),
                providerException.provider(),
                providerException.hasStatusCode() ? providerException.statusCode() : null);
        return ResponseEntity.status(status).body(ApiErrorResponse.error(providerException.getMessage(), details));
    }
}
