package com.williamcallahan.llmrouter.web;

import com.williamcallahan.llmrouter.domain.errors.LlmProviderException;
import com.williamcallahan.llmrouter.domain.errors.ProviderErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Base controller providing the shared mapping from failures to HTTP responses.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Maps a classified provider failure to its HTTP status and error payload.
     *
     * @param providerException classified failure
     * @return error response
     */
    protected ResponseEntity<ApiErrorResponse> handleProviderException(LlmProviderException providerException) {
        return exceptionBuilder.buildProviderErrorResponse(statusFor(providerException.kind()), providerException);
    }

    /**
     * Handles validation exceptions with bad request responses.
     *
     * @param validationException the validation exception
     * @return bad request error response
     */
    protected ResponseEntity<ApiErrorResponse> handleValidationException(
            IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }

    static HttpStatus statusFor(ProviderErrorKind kind) {
        return switch (kind) {
            case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
            case BAD_REQUEST -> HttpStatus.BAD_REQUEST;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case RATE_LIMIT -> HttpStatus.TOO_MANY_REQUESTS;
            case SERVER_ERROR, UNKNOWN -> HttpStatus.BAD_GATEWAY;
        };
    }
}
