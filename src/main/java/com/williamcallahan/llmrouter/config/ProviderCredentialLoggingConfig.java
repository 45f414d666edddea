package com.williamcallahan.llmrouter.config;

import com.williamcallahan.llmrouter.domain.Credential;
import com.williamcallahan.llmrouter.domain.CredentialSource;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Reports at startup which providers have an environment credential available.
 *
 * <p>A provider without one still works when callers pass an explicit key.</p>
 */
@Configuration
public class ProviderCredentialLoggingConfig {
    private static final Logger logger = LoggerFactory.getLogger(ProviderCredentialLoggingConfig.class);

    private final AppProperties appProperties;
    private final Environment environment;
    private final String activeProfile;

    public ProviderCredentialLoggingConfig(
            AppProperties appProperties,
            Environment environment,
            @Value("${spring.profiles.active:dev}") String activeProfile) {
        this.appProperties = appProperties;
        this.environment = environment;
        this.activeProfile = activeProfile;
    }

    @PostConstruct
    public void logCredentialStatus() {
        logger.info("=== Provider Credential Status ===");
        boolean isDev = "dev".equalsIgnoreCase(activeProfile);

        appProperties.getProviders().forEach((providerName, providerSettings) -> {
            String configuredVariable = null;
            String configuredValue = null;
            for (String variableName : providerSettings.getApiKeyEnv()) {
                String value = environment.getProperty(variableName);
                if (hasValue(value)) {
                    configuredVariable = variableName;
                    configuredValue = value;
                    break;
                }
            }
            if (configuredVariable == null) {
                logger.info("{}: No environment key ({}) - explicit api key required",
                        providerName, String.join(", ", providerSettings.getApiKeyEnv()));
            } else if (isDev) {
                Credential credential = new Credential(configuredValue, CredentialSource.ENVIRONMENT);
                logger.info("{}: {} configured ({})", providerName, configuredVariable, credential.masked());
            } else {
                logger.info("{}: {} configured", providerName, configuredVariable);
            }
        });

        logger.info("==================================");
    }

    private boolean hasValue(String value) {
        return value != null && !value.isBlank();
    }
}
