package com.williamcallahan.llmrouter.service;

import com.williamcallahan.llmrouter.domain.Credential;
import com.williamcallahan.llmrouter.domain.CredentialSource;
import com.williamcallahan.llmrouter.domain.errors.ProviderAuthenticationException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/**
 * Picks the API key for a provider call.
 *
 * <p>An explicit caller key wins; otherwise the provider's environment variables are consulted in
 * order. When neither yields a key the call fails here, before any request leaves the process.</p>
 */
@Service
public class CredentialResolver {
    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final Environment environment;

    /**
     * Creates a resolver reading environment credentials through Spring's property sources.
     *
     * @param environment Spring environment covering process variables and application config
     */
    public CredentialResolver(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * Resolves the credential for one call.
     *
     * @param explicitKey caller-supplied key, may be null or blank
     * @param provider provider being called
     * @return resolved credential
     * @throws ProviderAuthenticationException when no key is available
     */
    public Credential resolve(String explicitKey, ProviderDefinition provider) {
        Objects.requireNonNull(provider, "provider");
        if (explicitKey != null && !explicitKey.isBlank()) {
            return new Credential(explicitKey.trim(), CredentialSource.EXPLICIT);
        }
        for (String variableName : provider.apiKeyEnvironmentVariables()) {
            String environmentKey = environment.getProperty(variableName);
            if (environmentKey != null && !environmentKey.isBlank()) {
                log.debug("[LLM] Using environment credential (provider={}, variable={})", provider.name(), variableName);
                return new Credential(environmentKey.trim(), CredentialSource.ENVIRONMENT);
            }
        }
        throw new ProviderAuthenticationException(provider.name(), missingKeyMessage(provider));
    }

    private static String missingKeyMessage(ProviderDefinition provider) {
        if (provider.apiKeyEnvironmentVariables().isEmpty()) {
            return "Missing API key for provider " + provider.name() + ". Pass api_key explicitly.";
        }
        return "Missing API key for provider " + provider.name() + ". Pass api_key explicitly or set "
                + String.join(" or ", provider.apiKeyEnvironmentVariables()) + ".";
    }
}
