package br.edu.ifba.federated.retrieval;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * @param query        natural-language question
 * @param sourceFilter restricts every path to one document path, when non-null
 * @param mode         candidate paths to run
 */
public record RetrievalRequest(
    @NotNull String query,
    @Nullable String sourceFilter,
    @NotNull RetrievalMode mode
) {

    public RetrievalRequest {
        Objects.requireNonNull(query, "query must not be null");
        if (query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (sourceFilter != null && sourceFilter.isBlank()) {
            sourceFilter = null;
        }
        if (mode == null) {
            mode = RetrievalMode.HYBRID;
        }
    }

    public static RetrievalRequest of(@NotNull final String query) {
        return new RetrievalRequest(query, null, RetrievalMode.HYBRID);
    }
}
