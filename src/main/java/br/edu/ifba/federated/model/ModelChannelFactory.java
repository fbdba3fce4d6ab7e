package br.edu.ifba.federated.model;

import org.jetbrains.annotations.NotNull;

/**
 * Builds a fresh set of channels for a provider configuration.
 */
@FunctionalInterface
public interface ModelChannelFactory {

    @NotNull
    ModelChannels create(@NotNull ProviderSettings settings);
}
