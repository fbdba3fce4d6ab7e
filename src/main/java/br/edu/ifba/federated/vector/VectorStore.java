package br.edu.ifba.federated.vector;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Storage interface for chunk vectors.
 *
 * <p>Similarity is cosine. The collection is created on first use with the dimensionality
 * of the active embedding model, and {@link #clear()} drops it so the next write recreates it.</p>
 */
public interface VectorStore extends AutoCloseable {

    /**
     * Inserts or replaces the point with the given id.
     */
    CompletableFuture<Void> upsert(
        @NotNull String id,
        @NotNull String text,
        @NotNull float[] vector,
        @NotNull ChunkMetadata metadata
    );

    /**
     * Nearest neighbours of {@code vector}, best first.
     *
     * @param sourceFilter when non-null, only points whose {@code source} equals it
     */
    CompletableFuture<List<ScoredPoint>> search(@NotNull float[] vector, int limit, @Nullable String sourceFilter);

    /**
     * Payloads of the given points. Unknown ids are absent from the result.
     * An empty id list completes immediately with an empty list.
     */
    CompletableFuture<List<StoredPoint>> getByIds(@NotNull List<String> ids);

    CompletableFuture<Void> clear();

    @Override
    default void close() {
    }

    /**
     * A search hit.
     */
    record ScoredPoint(
        @NotNull String id,
        double score,
        @NotNull ChunkPayload payload
    ) {
    }

    /**
     * A point fetched by id.
     */
    record StoredPoint(
        @NotNull String id,
        @NotNull ChunkPayload payload
    ) {
    }
}
