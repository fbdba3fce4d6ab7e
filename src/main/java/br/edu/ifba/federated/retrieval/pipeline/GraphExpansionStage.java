package br.edu.ifba.federated.retrieval.pipeline;

import br.edu.ifba.federated.graph.GraphStore;
import br.edu.ifba.federated.graph.GraphTriple;
import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import br.edu.ifba.federated.vector.VectorStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Walks the knowledge graph from the extracted entities and fetches the chunks
 * that mention what it finds.
 *
 * <ol>
 *   <li>Neighbors and connecting paths are looked up concurrently and unioned.</li>
 *   <li>The entity set grows with every triple endpoint, capped at {@code expandedEntityCap}.</li>
 *   <li>Chunk ids linked to those entities are collected (source filter applied),
 *       deduplicated and capped at {@code graphChunkCap}.</li>
 *   <li>The chunk texts are fetched from the vector store by id.</li>
 * </ol>
 *
 * <p>Chunk fetch failures leave the graph path empty. Graph reads already degrade
 * to empty results inside the store.</p>
 */
public class GraphExpansionStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(GraphExpansionStage.class);
    private static final String STAGE_NAME = "graph-expansion";

    private final GraphStore graphStore;
    private final VectorStore vectorStore;
    private final int expandedEntityCap;
    private final int graphChunkCap;

    public GraphExpansionStage(
            @NotNull final GraphStore graphStore,
            @NotNull final VectorStore vectorStore,
            final int expandedEntityCap,
            final int graphChunkCap) {
        this.graphStore = graphStore;
        this.vectorStore = vectorStore;
        this.expandedEntityCap = expandedEntityCap;
        this.graphChunkCap = graphChunkCap;
    }

    @Override
    public CompletableFuture<RetrievalContext> process(@NotNull final RetrievalContext context) {
        final List<String> entities = context.getEntities();
        final CompletableFuture<List<GraphTriple>> neighbors = graphStore.queryNeighbors(entities);
        final CompletableFuture<List<GraphTriple>> paths = graphStore.findPaths(entities);

        return neighbors.thenCombine(paths, GraphExpansionStage::union)
            .thenCompose(triples -> {
                context.setTriples(triples);
                final List<String> expanded = expandEntities(entities, triples, expandedEntityCap);
                logger.debug("Graph expansion: {} triples, {} entities", triples.size(), expanded.size());
                return collectChunkIds(expanded, context.getSourceFilter());
            })
            .thenCompose(this::fetchChunks)
            .thenApply(candidates -> {
                context.setGraphCandidates(candidates);
                return context;
            });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }

    @Override
    public boolean shouldSkip(@NotNull final RetrievalContext context) {
        return !context.getMode().usesGraph() || context.getEntities().isEmpty();
    }

    static List<GraphTriple> union(final List<GraphTriple> first, final List<GraphTriple> second) {
        final Set<GraphTriple> merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return new ArrayList<>(merged);
    }

    /**
     * Extracted entities first, then triple endpoints in triple order,
     * compared case-insensitively.
     */
    static List<String> expandEntities(final List<String> entities, final List<GraphTriple> triples, final int cap) {
        final Map<String, String> byKey = new LinkedHashMap<>();
        final List<String> ordered = new ArrayList<>(entities);
        for (GraphTriple triple : triples) {
            ordered.add(triple.from());
            ordered.add(triple.to());
        }
        for (String name : ordered) {
            if (name == null || name.isBlank()) {
                continue;
            }
            byKey.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), name.trim());
            if (byKey.size() >= cap) {
                break;
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private CompletableFuture<List<String>> collectChunkIds(final List<String> entities, final String sourceFilter) {
        final List<CompletableFuture<List<String>>> lookups = entities.stream()
            .map(entity -> graphStore.chunksForEntity(entity, sourceFilter))
            .toList();
        return CompletableFuture.allOf(lookups.toArray(CompletableFuture[]::new))
            .thenApply(v -> lookups.stream()
                .flatMap(lookup -> lookup.join().stream())
                .distinct()
                .limit(graphChunkCap)
                .collect(Collectors.toList()));
    }

    private CompletableFuture<List<RetrievalCandidate>> fetchChunks(final List<String> chunkIds) {
        if (chunkIds.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return vectorStore.getByIds(chunkIds)
            .thenApply(points -> points.stream().map(RetrievalCandidate::from).toList())
            .exceptionally(e -> {
                logger.warn("Could not fetch {} graph-linked chunks: {}", chunkIds.size(), e.getMessage());
                return List.of();
            });
    }
}
