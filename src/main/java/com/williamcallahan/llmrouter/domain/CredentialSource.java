package com.williamcallahan.llmrouter.domain;

/**
 * Where a resolved credential came from.
 */
public enum CredentialSource {
    /** Supplied by the caller for this call. */
    EXPLICIT,
    /** Read from the provider's environment-scoped variable. */
    ENVIRONMENT
}
