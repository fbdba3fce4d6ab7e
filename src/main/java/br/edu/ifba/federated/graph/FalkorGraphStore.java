package br.edu.ifba.federated.graph;

import br.edu.ifba.federated.shared.TransientFailurePredicate;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.graph.Record;
import redis.clients.jedis.graph.ResultSet;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * FalkorDB implementation of {@link GraphStore}, talking Cypher over Redis through Jedis.
 *
 * <p>All values are sent as query parameters; only the relation type is placed in the
 * query text, after {@link CypherSanitizer#relationType(String)}.</p>
 */
@ApplicationScoped
public class FalkorGraphStore implements GraphStore {

    private static final Logger logger = LoggerFactory.getLogger(FalkorGraphStore.class);

    static final int NEIGHBOR_LIMIT = 50;
    static final int PATH_LIMIT = 20;

    @Inject
    JedisPooled jedis;

    @ConfigProperty(name = "federated.graph.name", defaultValue = "federated_mem")
    String graphName;

    private final ExecutorService executor;

    public FalkorGraphStore() {
        this.executor = Executors.newCachedThreadPool();
    }

    @PreDestroy
    @Override
    public void close() {
        executor.shutdown();
    }

    // ===== Writes =====

    @Override
    @Retry(maxRetries = 2, delay = 200, delayUnit = ChronoUnit.MILLIS, maxDuration = 30, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<Void> upsertTriple(
            @NotNull final String subject,
            @NotNull final String relation,
            @NotNull final String object) {
        return CompletableFuture.runAsync(() -> {
            final String relationType = CypherSanitizer.relationType(relation);
            final Map<String, Object> params = new HashMap<>();
            params.put("subject", CypherSanitizer.parameter(subject.trim()));
            params.put("object", CypherSanitizer.parameter(object.trim()));

            jedis.graphQuery(graphName,
                "MERGE (a:Entity {name: $subject}) "
                    + "MERGE (b:Entity {name: $object}) "
                    + "MERGE (a)-[:" + relationType + "]->(b)",
                params);
            logger.debug("Upserted triple ({})-[{}]->({})", subject, relationType, object);
        }, executor);
    }

    @Override
    @Retry(maxRetries = 2, delay = 200, delayUnit = ChronoUnit.MILLIS, maxDuration = 30, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 5, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<Void> linkChunkToEntities(
            @NotNull final String chunkId,
            @NotNull final Collection<String> entities,
            @NotNull final String source) {
        return CompletableFuture.runAsync(() -> {
            final Map<String, Object> chunkParams = new HashMap<>();
            chunkParams.put("id", CypherSanitizer.parameter(chunkId));
            chunkParams.put("source", CypherSanitizer.parameter(source));
            jedis.graphQuery(graphName, "MERGE (c:Chunk {id: $id}) SET c.source = $source", chunkParams);

            for (String entity : new LinkedHashSet<>(entities)) {
                if (entity == null || entity.isBlank()) {
                    continue;
                }
                final Map<String, Object> params = new HashMap<>();
                params.put("id", CypherSanitizer.parameter(chunkId));
                params.put("name", CypherSanitizer.parameter(entity.trim()));
                jedis.graphQuery(graphName,
                    "MATCH (c:Chunk {id: $id}) "
                        + "MERGE (e:Entity {name: $name}) "
                        + "MERGE (c)-[:MENTIONS]->(e)",
                    params);
            }
            logger.debug("Linked chunk {} to {} entities", chunkId, entities.size());
        }, executor);
    }

    // ===== Reads =====

    @Override
    public CompletableFuture<List<GraphTriple>> queryNeighbors(@NotNull final Collection<String> entityNames) {
        final List<String> names = usableNames(entityNames);
        if (names.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.supplyAsync(() -> {
            final Map<String, Object> params = new HashMap<>();
            final String query = "MATCH (n:Entity)-[r]->(m:Entity) WHERE "
                + nameMatch("n", names, params)
                + " RETURN n.name, type(r), m.name LIMIT " + NEIGHBOR_LIMIT;
            return readTriples("queryNeighbors", query, params);
        }, executor);
    }

    @Override
    public CompletableFuture<List<GraphTriple>> findPaths(@NotNull final Collection<String> entityNames) {
        final List<String> names = usableNames(entityNames);
        if (names.size() < 2) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.supplyAsync(() -> {
            final Map<String, Object> params = new HashMap<>();
            final String condition = nameMatch("a", names, params);
            final String query = "MATCH (a:Entity)-[r]-(b:Entity) WHERE "
                + condition + " AND " + condition.replace("a.name", "b.name")
                + " AND id(a) <> id(b)"
                + " RETURN a.name, type(r), b.name LIMIT " + PATH_LIMIT;
            return readTriples("findPaths", query, params).stream()
                .filter(triple -> !triple.from().equals(triple.to()))
                .toList();
        }, executor);
    }

    @Override
    public CompletableFuture<List<String>> chunksForEntity(
            @NotNull final String entityName,
            @Nullable final String sourceFilter) {
        if (entityName.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return CompletableFuture.supplyAsync(() -> {
            final Map<String, Object> params = new HashMap<>();
            params.put("name", CypherSanitizer.parameter(entityName.trim()));
            String where = "WHERE toLower(e.name) CONTAINS toLower($name)";
            if (sourceFilter != null && !sourceFilter.isBlank()) {
                params.put("source", CypherSanitizer.parameter(sourceFilter));
                where += " AND c.source = $source";
            }
            final String query = "MATCH (c:Chunk)-[:MENTIONS]->(e:Entity) " + where + " RETURN DISTINCT c.id";
            try {
                final List<String> ids = new ArrayList<>();
                for (Record record : jedis.graphQuery(graphName, query, params)) {
                    final Object id = record.getValue(0);
                    if (id != null) {
                        ids.add(id.toString());
                    }
                }
                return ids;
            } catch (RuntimeException e) {
                logger.warn("Graph read chunksForEntity failed for '{}': {}", entityName, e.getMessage());
                return List.of();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> reset() {
        return CompletableFuture.runAsync(() -> {
            try {
                jedis.graphDelete(graphName);
                logger.info("Graph {} deleted", graphName);
            } catch (JedisDataException e) {
                logger.info("Graph {} not deleted (probably absent): {}", graphName, e.getMessage());
            }
        }, executor);
    }

    // ===== Helpers =====

    private List<GraphTriple> readTriples(final String operation, final String query, final Map<String, Object> params) {
        try {
            final ResultSet resultSet = jedis.graphQuery(graphName, query, params);
            final List<GraphTriple> triples = new ArrayList<>();
            for (Record record : resultSet) {
                final Object from = record.getValue(0);
                final Object relation = record.getValue(1);
                final Object to = record.getValue(2);
                if (from != null && relation != null && to != null) {
                    triples.add(new GraphTriple(from.toString(), relation.toString(), to.toString()));
                }
            }
            logger.debug("Graph read {} returned {} rows", operation, triples.size());
            return triples;
        } catch (RuntimeException e) {
            logger.warn("Graph read {} failed: {}", operation, e.getMessage());
            return List.of();
        }
    }

    /**
     * Builds {@code (toLower(x.name) CONTAINS toLower($e0) OR ...)} and registers the parameters.
     */
    static String nameMatch(final String alias, final List<String> names, final Map<String, Object> params) {
        final StringBuilder condition = new StringBuilder("(");
        for (int i = 0; i < names.size(); i++) {
            final String key = "e" + i;
            params.put(key, CypherSanitizer.parameter(names.get(i)));
            if (i > 0) {
                condition.append(" OR ");
            }
            condition.append("toLower(").append(alias).append(".name) CONTAINS toLower($").append(key).append(")");
        }
        return condition.append(")").toString();
    }

    static List<String> usableNames(final Collection<String> entityNames) {
        return entityNames.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .distinct()
            .toList();
    }
}
