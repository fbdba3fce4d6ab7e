package br.edu.ifba.federated.vector.qdrant;

import br.edu.ifba.federated.model.ModelProvider;
import br.edu.ifba.federated.shared.TransientFailurePredicate;
import br.edu.ifba.federated.vector.ChunkMetadata;
import br.edu.ifba.federated.vector.ChunkPayload;
import br.edu.ifba.federated.vector.VectorStore;
import br.edu.ifba.federated.vector.qdrant.QdrantClient.CreateCollectionRequest;
import br.edu.ifba.federated.vector.qdrant.QdrantClient.ExistsResult;
import br.edu.ifba.federated.vector.qdrant.QdrantClient.Filter;
import br.edu.ifba.federated.vector.qdrant.QdrantClient.PointStruct;
import br.edu.ifba.federated.vector.qdrant.QdrantClient.QdrantResponse;
import br.edu.ifba.federated.vector.qdrant.QdrantClient.RecordDto;
import br.edu.ifba.federated.vector.qdrant.QdrantClient.RetrieveRequest;
import br.edu.ifba.federated.vector.qdrant.QdrantClient.ScoredPointDto;
import br.edu.ifba.federated.vector.qdrant.QdrantClient.SearchRequest;
import br.edu.ifba.federated.vector.qdrant.QdrantClient.UpsertRequest;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Qdrant implementation of {@link VectorStore} over its REST API.
 *
 * <p>The collection is checked, and created when missing, before the first operation
 * after startup or after {@link #clear()}. Its size is the dimension reported by the
 * active embedding channel.</p>
 */
@ApplicationScoped
public class QdrantVectorStore implements VectorStore {

    private static final Logger logger = LoggerFactory.getLogger(QdrantVectorStore.class);

    private final QdrantClient client;
    private final ModelProvider modelProvider;
    private final String collection;
    private final String apiKey;
    private final ExecutorService executor;

    private volatile boolean collectionReady = false;

    @Inject
    public QdrantVectorStore(
            @RestClient final QdrantClient client,
            final ModelProvider modelProvider,
            @ConfigProperty(name = "federated.vector.collection", defaultValue = "federated_docs") final String collection,
            @ConfigProperty(name = "federated.vector.api-key") final Optional<String> apiKey) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.modelProvider = Objects.requireNonNull(modelProvider, "modelProvider must not be null");
        this.collection = collection;
        this.apiKey = apiKey.filter(key -> !key.isBlank()).orElse(null);
        this.executor = Executors.newCachedThreadPool();
    }

    @PreDestroy
    @Override
    public void close() {
        executor.shutdown();
    }

    @Override
    @Retry(maxRetries = 2, delay = 500, delayUnit = ChronoUnit.MILLIS, maxDuration = 30, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<Void> upsert(
            @NotNull final String id,
            @NotNull final String text,
            @NotNull final float[] vector,
            @NotNull final ChunkMetadata metadata) {
        return CompletableFuture.runAsync(() -> {
            ensureCollection();
            final PointStruct point = new PointStruct(id, vector, ChunkPayload.of(text, metadata));
            client.upsertPoints(apiKey, collection, true, new UpsertRequest(List.of(point)));
            logger.debug("Upserted point {} into {}", id, collection);
        }, executor);
    }

    @Override
    @Retry(maxRetries = 2, delay = 500, delayUnit = ChronoUnit.MILLIS, maxDuration = 30, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<List<ScoredPoint>> search(
            @NotNull final float[] vector,
            final int limit,
            @Nullable final String sourceFilter) {
        return CompletableFuture.supplyAsync(() -> {
            ensureCollection();
            final Filter filter = sourceFilter != null && !sourceFilter.isBlank()
                ? Filter.matching("source", sourceFilter)
                : null;
            final QdrantResponse<List<ScoredPointDto>> response =
                client.search(apiKey, collection, new SearchRequest(vector, limit, filter, true));

            final List<ScoredPoint> points = new ArrayList<>();
            if (response != null && response.result() != null) {
                for (ScoredPointDto hit : response.result()) {
                    if (hit.id() != null && hit.payload() != null) {
                        points.add(new ScoredPoint(hit.id().toString(), hit.score(), hit.payload()));
                    }
                }
            }
            logger.debug("Vector search returned {} points (limit={}, filter={})", points.size(), limit, sourceFilter);
            return points;
        }, executor);
    }

    @Override
    @Retry(maxRetries = 2, delay = 500, delayUnit = ChronoUnit.MILLIS, maxDuration = 30, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<List<StoredPoint>> getByIds(@NotNull final List<String> ids) {
        if (ids.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.supplyAsync(() -> {
            ensureCollection();
            final QdrantResponse<List<RecordDto>> response =
                client.retrieve(apiKey, collection, new RetrieveRequest(ids, true, false));

            final List<StoredPoint> points = new ArrayList<>();
            if (response != null && response.result() != null) {
                for (RecordDto record : response.result()) {
                    if (record.id() != null && record.payload() != null) {
                        points.add(new StoredPoint(record.id().toString(), record.payload()));
                    }
                }
            }
            return points;
        }, executor);
    }

    @Override
    public CompletableFuture<Void> clear() {
        return CompletableFuture.runAsync(() -> {
            synchronized (this) {
                if (collectionExists()) {
                    client.deleteCollection(apiKey, collection);
                    logger.info("Dropped vector collection {}", collection);
                }
                collectionReady = false;
            }
        }, executor);
    }

    private void ensureCollection() {
        if (collectionReady) {
            return;
        }
        synchronized (this) {
            if (collectionReady) {
                return;
            }
            if (!collectionExists()) {
                final int dimension = modelProvider.embeddingDimension();
                client.createCollection(apiKey, collection, CreateCollectionRequest.cosine(dimension));
                logger.info("Created vector collection {} (size={}, distance=Cosine)", collection, dimension);
            }
            collectionReady = true;
        }
    }

    private boolean collectionExists() {
        final QdrantResponse<ExistsResult> response = client.exists(apiKey, collection);
        return response != null && response.result() != null && response.result().exists();
    }
}
