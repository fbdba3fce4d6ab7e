package br.edu.ifba.federated.vector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Payload stored with every chunk vector. Field names are the stored JSON keys.
 * The numeric fields may be absent on points read back from the store.
 *
 * @param text       headered chunk text that was embedded
 * @param source     document path
 * @param batch      upload batch id
 * @param chunkIndex position of the chunk in its document (0-based)
 * @param chunkId    chunk id shared with the graph's Chunk node
 * @param pageNumber resolved page (1-based), or 0 when it could not be resolved
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkPayload(
    @JsonProperty("text") String text,
    @JsonProperty("source") String source,
    @JsonProperty("batch") String batch,
    @JsonProperty("chunk_index") Integer chunkIndex,
    @JsonProperty("chunk_id") String chunkId,
    @JsonProperty("page_number") Integer pageNumber
) {

    public static ChunkPayload of(@NotNull final String text, @NotNull final ChunkMetadata metadata) {
        Objects.requireNonNull(text, "text must not be null");
        return new ChunkPayload(
            text,
            metadata.source(),
            metadata.batch(),
            metadata.chunkIndex(),
            metadata.chunkId(),
            metadata.pageNumber()
        );
    }
}
