package br.edu.ifba.federated.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Immutable set of channels built for one provider configuration. A provider switch
 * replaces the whole set, so a call that captured an instance keeps using it to completion.
 */
public record ModelChannels(
    @NotNull ChatChannel cloud,
    @NotNull EmbeddingChannel embedding,
    @NotNull LocalModelChannel local,
    @NotNull ProviderSettings settings
) {

    public ModelChannels {
        Objects.requireNonNull(cloud, "cloud must not be null");
        Objects.requireNonNull(embedding, "embedding must not be null");
        Objects.requireNonNull(local, "local must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
    }
}
