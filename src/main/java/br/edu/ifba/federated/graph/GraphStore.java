package br.edu.ifba.federated.graph;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Storage interface for the entity/chunk knowledge graph.
 *
 * <p>Node labels are {@code Entity{name}} and {@code Chunk{id, source}}. Relationship
 * types are sanitized uppercase tokens, plus {@code MENTIONS} from a chunk to each entity
 * it contains.</p>
 *
 * <h2>Matching</h2>
 * <p>Every read that takes entity names matches case-insensitively by substring, so
 * "acme" finds "Acme Corp".</p>
 *
 * <h2>Failures</h2>
 * <p>Reads are best-effort enrichment: a failed read is logged and completes with an
 * empty list. Writes complete exceptionally so the caller can decide how to degrade.</p>
 */
public interface GraphStore extends AutoCloseable {

    /**
     * Idempotently inserts {@code (subject)-[relation]->(object)}, creating missing entities.
     */
    CompletableFuture<Void> upsertTriple(@NotNull String subject, @NotNull String relation, @NotNull String object);

    /**
     * Creates the chunk node if absent and links it with {@code MENTIONS} to every given entity.
     */
    CompletableFuture<Void> linkChunkToEntities(
        @NotNull String chunkId,
        @NotNull Collection<String> entities,
        @NotNull String source
    );

    /**
     * Outgoing edges of every entity matching any of the names.
     */
    CompletableFuture<List<GraphTriple>> queryNeighbors(@NotNull Collection<String> entityNames);

    /**
     * Direct edges, in either direction, whose both endpoints match names in the set.
     * Never returns an edge from a node to itself. Needs at least two names.
     */
    CompletableFuture<List<GraphTriple>> findPaths(@NotNull Collection<String> entityNames);

    /**
     * Ids of chunks mentioning an entity that matches the name, optionally restricted to one source.
     */
    CompletableFuture<List<String>> chunksForEntity(@NotNull String entityName, @Nullable String sourceFilter);

    /**
     * Deletes the whole graph. Succeeds when the graph does not exist.
     */
    CompletableFuture<Void> reset();

    @Override
    default void close() {
    }
}
