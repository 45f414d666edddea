package com.williamcallahan.llmrouter.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.llmrouter.domain.ProviderEndpoint;
import java.util.Objects;

/**
 * Wire-ready JSON body for one provider endpoint.
 *
 * <p>The payload is copied on the way in and out so a body cannot change after it is built.</p>
 *
 * @param endpoint endpoint the body is addressed to
 * @param payload JSON object sent as the request body
 */
public record VendorRequestBody(ProviderEndpoint endpoint, ObjectNode payload) {
    public VendorRequestBody {
        Objects.requireNonNull(endpoint, "endpoint");
        payload = Objects.requireNonNull(payload, "payload").deepCopy();
    }

    @Override
    public ObjectNode payload() {
        return payload.deepCopy();
    }
}
