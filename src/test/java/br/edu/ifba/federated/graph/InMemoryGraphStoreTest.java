package br.edu.ifba.federated.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryGraphStoreTest {

    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        store.upsertTriple("Alice", "works for", "Acme Corp").join();
        store.upsertTriple("Acme Corp", "located in", "Paris").join();
    }

    @Test
    @DisplayName("upserting the same triple twice keeps one edge")
    void idempotentUpsert() {
        store.upsertTriple("Alice", "WORKS_FOR", "Acme Corp").join();
        store.upsertTriple(" Alice ", "works for", "Acme Corp").join();

        assertEquals(2, store.edgeCount());
    }

    @Test
    @DisplayName("neighbors match names case-insensitively by substring")
    void neighborsBySubstring() {
        final List<GraphTriple> neighbors = store.queryNeighbors(List.of("acme")).join();

        assertEquals(List.of(new GraphTriple("Acme Corp", "LOCATED_IN", "Paris")), neighbors);
    }

    @Test
    @DisplayName("paths connect two named entities and need two names")
    void paths() {
        assertEquals(List.of(new GraphTriple("Alice", "WORKS_FOR", "Acme Corp")),
            store.findPaths(List.of("alice", "ACME")).join());
        assertTrue(store.findPaths(List.of("alice")).join().isEmpty());
    }

    @Test
    @DisplayName("paths never include self loops")
    void noSelfLoops() {
        store.upsertTriple("Acme Corp", "owns", "Acme Corp").join();

        final List<GraphTriple> paths = store.findPaths(List.of("Acme", "Paris")).join();

        assertTrue(paths.stream().noneMatch(t -> t.from().equals(t.to())));
        assertEquals(1, paths.size());
    }

    @Test
    @DisplayName("chunk lookups honor the source filter")
    void chunksBySource() {
        store.linkChunkToEntities("c1", List.of("Acme Corp", "Alice"), "a.pdf").join();
        store.linkChunkToEntities("c2", List.of("Acme Corp"), "b.pdf").join();

        assertEquals(2, store.chunksForEntity("acme", null).join().size());
        assertEquals(List.of("c2"), store.chunksForEntity("acme", "b.pdf").join());
        assertTrue(store.chunksForEntity("  ", null).join().isEmpty());
    }

    @Test
    @DisplayName("chunk lookups return chunks in the order they were linked")
    void chunksInLinkOrder() {
        final List<String> linked = new ArrayList<>();
        for (int i = 40; i > 0; i--) {
            final String chunkId = "doc.pdf::chunk-" + i;
            store.linkChunkToEntities(chunkId, List.of("Acme Corp"), "doc.pdf").join();
            linked.add(chunkId);
        }
        store.linkChunkToEntities("doc.pdf::chunk-40", List.of("Alice"), "doc.pdf").join();

        assertEquals(linked, store.chunksForEntity("acme", null).join());
    }

    @Test
    @DisplayName("reset removes every edge and chunk")
    void reset() {
        store.linkChunkToEntities("c1", List.of("Acme Corp"), "a.pdf").join();

        store.reset().join();

        assertEquals(0, store.edgeCount());
        assertTrue(store.chunksForEntity("Acme", null).join().isEmpty());
    }
}
