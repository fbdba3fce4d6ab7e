package br.edu.ifba.federated.retrieval;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Which candidate paths a query runs.
 */
public enum RetrievalMode {
    /** Graph path and vector path. */
    HYBRID,
    /** Vector path only: no entity extraction, no graph expansion. */
    VECTOR,
    /** Graph path only: no vector search. */
    GRAPH;

    public boolean usesGraph() {
        return this != VECTOR;
    }

    public boolean usesVectors() {
        return this != GRAPH;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a mode name; null or blank means {@link #HYBRID}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static RetrievalMode from(@Nullable final String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        for (RetrievalMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown retrieval mode: " + value + " (expected hybrid, vector or graph)");
    }
}
