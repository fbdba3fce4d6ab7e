package br.edu.ifba.federated.vector;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector store using brute-force cosine similarity.
 * Suitable for tests and small local runs.
 */
public class InMemoryVectorStore implements VectorStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final Map<String, Entry> storage = new ConcurrentHashMap<>();

    private volatile int dimension = -1;

    @Override
    public CompletableFuture<Void> upsert(
            @NotNull final String id,
            @NotNull final String text,
            @NotNull final float[] vector,
            @NotNull final ChunkMetadata metadata) {
        synchronized (storage) {
            if (dimension < 0) {
                dimension = vector.length;
            } else if (dimension != vector.length) {
                return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Vector dimension " + vector.length + " does not match collection dimension " + dimension));
            }
            storage.put(id, new Entry(vector.clone(), ChunkPayload.of(text, metadata)));
        }
        logger.debug("Upserted vector: {}", id);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<ScoredPoint>> search(
            @NotNull final float[] vector,
            final int limit,
            @Nullable final String sourceFilter) {
        if (limit <= 0) {
            return CompletableFuture.completedFuture(List.of());
        }
        final List<ScoredPoint> scored = new ArrayList<>();
        storage.forEach((id, entry) -> {
            if (sourceFilter != null && !sourceFilter.equals(entry.payload().source())) {
                return;
            }
            if (entry.vector().length == vector.length) {
                scored.add(new ScoredPoint(id, cosineSimilarity(vector, entry.vector()), entry.payload()));
            }
        });
        scored.sort(Comparator.comparingDouble(ScoredPoint::score).reversed());
        return CompletableFuture.completedFuture(
            scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored);
    }

    @Override
    public CompletableFuture<List<StoredPoint>> getByIds(@NotNull final List<String> ids) {
        final List<StoredPoint> points = new ArrayList<>();
        for (String id : ids) {
            final Entry entry = storage.get(id);
            if (entry != null) {
                points.add(new StoredPoint(id, entry.payload()));
            }
        }
        return CompletableFuture.completedFuture(points);
    }

    @Override
    public CompletableFuture<Void> clear() {
        synchronized (storage) {
            storage.clear();
            dimension = -1;
        }
        logger.info("In-memory vector store cleared");
        return CompletableFuture.completedFuture(null);
    }

    public int size() {
        return storage.size();
    }

    static double cosineSimilarity(final float[] a, final float[] b) {
        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private record Entry(float[] vector, ChunkPayload payload) {
    }
}
