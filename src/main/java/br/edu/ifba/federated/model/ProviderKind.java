package br.edu.ifba.federated.model;

import java.util.Locale;

/**
 * Cloud backends the model provider can be switched to at runtime.
 */
public enum ProviderKind {
    OPENAI,
    AZURE,
    GEMINI,
    OLLAMA;

    /**
     * Parses a provider name case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static ProviderKind from(final String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("provider must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown model provider: " + name, e);
        }
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
