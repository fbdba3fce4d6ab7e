package br.edu.ifba.federated.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Switchable model provider settings. Null fields fall back to the configured defaults
 * of the selected provider.
 *
 * @param provider            backend used for the cloud channel and embeddings
 * @param apiKey              credential for the backend (unused by ollama)
 * @param model               chat model override
 * @param endpoint            Azure resource endpoint
 * @param apiVersion          Azure API version
 * @param deployment          Azure chat deployment
 * @param embeddingDeployment Azure embedding deployment
 * @param useLocalModel       route generation to the local channel first
 */
public record ProviderSettings(
    @NotNull ProviderKind provider,
    @Nullable String apiKey,
    @Nullable String model,
    @Nullable String endpoint,
    @Nullable String apiVersion,
    @Nullable String deployment,
    @Nullable String embeddingDeployment,
    boolean useLocalModel
) {

    public ProviderSettings {
        Objects.requireNonNull(provider, "provider must not be null");
    }

    public static ProviderSettings of(@NotNull final ProviderKind provider, @Nullable final String apiKey, final boolean useLocalModel) {
        return new ProviderSettings(provider, apiKey, null, null, null, null, null, useLocalModel);
    }

    /**
     * Copy safe to return to callers: the API key is reduced to its first three and last two characters.
     */
    public ProviderSettings masked() {
        return new ProviderSettings(provider, mask(apiKey), model, endpoint, apiVersion, deployment,
            embeddingDeployment, useLocalModel);
    }

    static String mask(final String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= 5) {
            return "***";
        }
        return secret.substring(0, 3) + "***" + secret.substring(secret.length() - 2);
    }
}
