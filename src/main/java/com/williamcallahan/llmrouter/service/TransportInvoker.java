package com.williamcallahan.llmrouter.service;

import com.williamcallahan.llmrouter.domain.Credential;

/**
 * Executes provider HTTP calls.
 *
 * <p>Implementations attach the credential as a bearer token, return every HTTP status as a
 * {@link TransportResponse}, and never retry.</p>
 */
@FunctionalInterface
public interface TransportInvoker {

    /**
     * Executes one provider call.
     *
     * @param request method, URL and body
     * @param credential credential sent as {@code Authorization: Bearer}
     * @return raw status and body
     * @throws TransportException when no response was received
     */
    TransportResponse invoke(TransportRequest request, Credential credential) throws TransportException;
}
