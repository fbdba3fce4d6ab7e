package br.edu.ifba.federated.retrieval;

import br.edu.ifba.federated.vector.ChunkPayload;
import br.edu.ifba.federated.vector.VectorStore;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A chunk pooled from the vector path or the graph path, before reranking.
 */
public record RetrievalCandidate(
    @NotNull String id,
    @NotNull String text,
    @NotNull ChunkPayload metadata
) {

    public RetrievalCandidate {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    public static RetrievalCandidate from(@NotNull final VectorStore.ScoredPoint point) {
        return new RetrievalCandidate(point.id(), textOf(point.payload()), point.payload());
    }

    public static RetrievalCandidate from(@NotNull final VectorStore.StoredPoint point) {
        return new RetrievalCandidate(point.id(), textOf(point.payload()), point.payload());
    }

    private static String textOf(final ChunkPayload payload) {
        return payload.text() != null ? payload.text() : "";
    }
}
