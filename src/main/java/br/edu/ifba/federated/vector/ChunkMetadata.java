package br.edu.ifba.federated.vector;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Everything stored with a chunk vector except its text.
 */
public record ChunkMetadata(
    @NotNull String source,
    @NotNull String batch,
    int chunkIndex,
    @NotNull String chunkId,
    int pageNumber
) {

    public ChunkMetadata {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(batch, "batch must not be null");
        Objects.requireNonNull(chunkId, "chunkId must not be null");
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be >= 0, got: " + chunkIndex);
        }
        if (pageNumber < 0) {
            throw new IllegalArgumentException("pageNumber must be >= 0, got: " + pageNumber);
        }
    }
}
