package br.edu.ifba.federated.model;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Runtime view and hot-swap of the model provider settings.
 */
@ApplicationScoped
public class ProviderSettingsService {

    private static final Logger LOG = Logger.getLogger(ProviderSettingsService.class);

    @Inject
    ModelProvider modelProvider;

    /**
     * Current settings with the API key masked.
     */
    @NotNull
    public ProviderSettings current() {
        return modelProvider.currentSettings().masked();
    }

    /**
     * Validates and applies new settings. Calls already in flight finish on the previous channels.
     *
     * @return the applied settings, masked
     * @throws IllegalArgumentException when required fields for the provider are missing
     */
    @NotNull
    public ProviderSettings update(@NotNull final ProviderSettings settings) {
        validate(settings);
        modelProvider.switchProvider(settings);
        LOG.infof("Settings updated: provider=%s, localFirst=%s", settings.provider().id(), settings.useLocalModel());
        return current();
    }

    static void validate(final ProviderSettings settings) {
        switch (settings.provider()) {
            case OPENAI, GEMINI -> requirePresent(settings.apiKey(), "apiKey");
            case AZURE -> {
                requirePresent(settings.apiKey(), "apiKey");
                requirePresent(settings.endpoint(), "endpoint");
                requirePresent(settings.deployment(), "deployment");
                requirePresent(settings.embeddingDeployment(), "embeddingDeployment");
            }
            case OLLAMA -> {
                // no credentials
            }
        }
    }

    private static void requirePresent(final String value, final String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required for this provider");
        }
    }
}
