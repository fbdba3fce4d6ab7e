package br.edu.ifba.federated.graph;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory graph store with the same matching rules as the FalkorDB adapter.
 * Used in tests and local runs without Redis.
 */
public class InMemoryGraphStore implements GraphStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStore.class);

    // Edges in insertion order, deduplicated as (from, relation, to)
    private final Set<GraphTriple> edges = ConcurrentHashMap.newKeySet();
    private final List<GraphTriple> edgeOrder = new ArrayList<>();

    // chunkId -> source
    private final Map<String, String> chunkSources = new ConcurrentHashMap<>();

    // chunkId -> mentioned entity names, in link order; guarded by itself
    private final Map<String, Set<String>> mentions = new LinkedHashMap<>();

    @Override
    public CompletableFuture<Void> upsertTriple(
            @NotNull final String subject,
            @NotNull final String relation,
            @NotNull final String object) {
        final GraphTriple triple = new GraphTriple(
            subject.trim(), CypherSanitizer.relationType(relation), object.trim());
        synchronized (edgeOrder) {
            if (edges.add(triple)) {
                edgeOrder.add(triple);
                logger.debug("Upserted triple {}", triple.describe());
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> linkChunkToEntities(
            @NotNull final String chunkId,
            @NotNull final Collection<String> entities,
            @NotNull final String source) {
        chunkSources.put(chunkId, source);
        synchronized (mentions) {
            final Set<String> linked = mentions.computeIfAbsent(chunkId, k -> new LinkedHashSet<>());
            for (String entity : entities) {
                if (entity != null && !entity.isBlank()) {
                    linked.add(entity.trim());
                }
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<GraphTriple>> queryNeighbors(@NotNull final Collection<String> entityNames) {
        final List<String> names = FalkorGraphStore.usableNames(entityNames);
        final List<GraphTriple> result = new ArrayList<>();
        for (GraphTriple edge : snapshot()) {
            if (result.size() >= FalkorGraphStore.NEIGHBOR_LIMIT) {
                break;
            }
            if (matchesAny(edge.from(), names)) {
                result.add(edge);
            }
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<List<GraphTriple>> findPaths(@NotNull final Collection<String> entityNames) {
        final List<String> names = FalkorGraphStore.usableNames(entityNames);
        if (names.size() < 2) {
            return CompletableFuture.completedFuture(List.of());
        }
        final List<GraphTriple> result = new ArrayList<>();
        for (GraphTriple edge : snapshot()) {
            if (result.size() >= FalkorGraphStore.PATH_LIMIT) {
                break;
            }
            if (!edge.from().equals(edge.to())
                    && matchesAny(edge.from(), names)
                    && matchesAny(edge.to(), names)) {
                result.add(edge);
            }
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<List<String>> chunksForEntity(
            @NotNull final String entityName,
            @Nullable final String sourceFilter) {
        if (entityName.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }
        final List<String> needle = List.of(entityName.trim());
        final List<String> ids = new ArrayList<>();
        synchronized (mentions) {
            mentions.forEach((chunkId, entities) -> {
                if (sourceFilter != null && !sourceFilter.isBlank()
                        && !sourceFilter.equals(chunkSources.get(chunkId))) {
                    return;
                }
                if (entities.stream().anyMatch(entity -> matchesAny(entity, needle))) {
                    ids.add(chunkId);
                }
            });
        }
        return CompletableFuture.completedFuture(ids);
    }

    @Override
    public CompletableFuture<Void> reset() {
        synchronized (edgeOrder) {
            edges.clear();
            edgeOrder.clear();
        }
        chunkSources.clear();
        synchronized (mentions) {
            mentions.clear();
        }
        logger.info("In-memory graph cleared");
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Number of distinct edges, for assertions.
     */
    public int edgeCount() {
        return edges.size();
    }

    private List<GraphTriple> snapshot() {
        synchronized (edgeOrder) {
            return new ArrayList<>(edgeOrder);
        }
    }

    private static boolean matchesAny(final String candidate, final List<String> names) {
        final String lowered = candidate.toLowerCase(Locale.ROOT);
        for (String name : names) {
            if (lowered.contains(name.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
