package br.edu.ifba.federated.retrieval;

import br.edu.ifba.federated.graph.InMemoryGraphStore;
import br.edu.ifba.federated.model.FakeModelProvider;
import br.edu.ifba.federated.model.ModelPrompts;
import br.edu.ifba.federated.rerank.LexicalReranker;
import br.edu.ifba.federated.rerank.RankedCandidate;
import br.edu.ifba.federated.rerank.Reranker;
import br.edu.ifba.federated.vector.ChunkMetadata;
import br.edu.ifba.federated.vector.ChunkPayload;
import br.edu.ifba.federated.shared.MalformedModelResponseException;
import br.edu.ifba.federated.shared.TransientFailurePredicate;
import br.edu.ifba.federated.vector.InMemoryVectorStore;
import io.smallrye.faulttolerance.api.RetryWhen;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.lang.reflect.Method;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrievalOrchestratorTest {

    private FakeModelProvider provider;
    private InMemoryGraphStore graphStore;
    private InMemoryVectorStore vectorStore;
    private AtomicInteger rerankerLookups;
    private RetrievalOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        provider = new FakeModelProvider();
        graphStore = new InMemoryGraphStore();
        vectorStore = new InMemoryVectorStore();
        rerankerLookups = new AtomicInteger();
        final Supplier<Reranker> reranker = () -> {
            rerankerLookups.incrementAndGet();
            return new LexicalReranker();
        };
        orchestrator = new RetrievalOrchestrator(provider, graphStore, vectorStore, reranker, RetrievalSettings.defaults());
    }

    @Nested
    @DisplayName("Hybrid queries")
    class Hybrid {

        @BeforeEach
        void seedCorpus() {
            index("c-acme", "Acme Corp is a widget maker founded by Alice.", "acme.pdf", 0, 1);
            index("c-paris", "The office building sits on the left bank of the Seine.", "office.pdf", 3, 2);
            index("c-other", "Quarterly revenue grew by ten percent.", "finance.pdf", 0, 4);
            graphStore.upsertTriple("Acme Corp", "located in", "Paris").join();
            graphStore.linkChunkToEntities("c-acme", List.of("Acme Corp", "Alice"), "acme.pdf").join();
            graphStore.linkChunkToEntities("c-paris", List.of("Paris"), "office.pdf").join();
            provider.entities = text -> List.of("Acme");
            provider.cloud = (prompt, system) -> "Acme Corp is located in Paris.";
        }

        @Test
        @DisplayName("should answer from graph-linked and vector passages")
        void answersWithBothPaths() {
            final RetrievalResponse response = orchestrator.query(RetrievalRequest.of("Where is Acme located?")).join();

            assertEquals("Acme Corp is located in Paris.", response.answer());
            assertEquals(List.of("Acme"), response.graphContext());
            assertTrue(response.sources().stream().anyMatch(s -> s.source().equals("office.pdf")));
            assertTrue(response.debug().promptSent().contains("Acme Corp -[LOCATED_IN]-> Paris"));
            assertEquals("hybrid", response.debug().mode());
            assertEquals("fake:openai", response.debug().providerUsed());
            assertEquals(2, response.debug().candidates().graph());
            assertEquals(response.debug().candidates().pooled(), response.debug().candidates().reranked());
        }

        @Test
        @DisplayName("should refine short queries and report both versions")
        void reportsRefinement() {
            provider.refine = query -> "What are the definitions of " + query + "?";

            final RetrievalResponse response = orchestrator.query(RetrievalRequest.of("Acme")).join();

            assertEquals("Acme", response.debug().originalQuery());
            assertEquals("What are the definitions of Acme?", response.debug().refinedQuery());
        }

        @Test
        @DisplayName("should restrict every path to the source filter")
        void sourceFilter() {
            final RetrievalResponse response = orchestrator.query(
                new RetrievalRequest("Where is Acme located?", "acme.pdf", RetrievalMode.HYBRID)).join();

            assertTrue(response.sources().stream().allMatch(s -> s.source().equals("acme.pdf")));
        }

        @Test
        @DisplayName("sources carry chunk position and page")
        void sourcePositions() {
            final RetrievalResponse response = orchestrator.query(
                new RetrievalRequest("office building Seine bank", null, RetrievalMode.VECTOR)).join();

            final SourceReference top = response.sources().get(0);
            assertEquals("office.pdf", top.source());
            assertEquals(3, top.chunkIndex());
            assertEquals(2, top.pageNumber());
            assertTrue(response.graphContext().isEmpty());
            assertEquals(0, provider.callCount("extractEntities"));
        }
    }

    @Nested
    @DisplayName("Empty corpus")
    class EmptyCorpus {

        @Test
        @DisplayName("should answer not-found without synthesis or reranking")
        void notFound() {
            final RetrievalResponse response = orchestrator.query(
                new RetrievalRequest("What is the refund policy for enterprise customers?", null, RetrievalMode.VECTOR)).join();

            assertEquals(ModelPrompts.NOT_FOUND_ANSWER, response.answer());
            assertTrue(response.sources().isEmpty());
            assertEquals(0, response.debug().candidates().reranked());
            assertEquals(0, rerankerLookups.get());
            assertEquals(0, provider.callCount("generateCloud"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should name the stage that failed")
        void namesStage() {
            provider.embedding = text -> {
                throw new IllegalStateException("embedding backend down");
            };

            final CompletionException error = assertThrows(CompletionException.class,
                () -> orchestrator.query(new RetrievalRequest("what does acme make these days", null, RetrievalMode.VECTOR)).join());

            final RetrievalException failure = assertInstanceOf(RetrievalException.class, error.getCause());
            assertEquals("vector-search", failure.getStage());
        }

        @Test
        @DisplayName("should retry connection failures but not malformed model output")
        void retriesOnlyTransientStageFailures() throws NoSuchMethodException {
            final TransientFailurePredicate retryable = new TransientFailurePredicate();
            final RetrievalRequest request = new RetrievalRequest("what does acme make these days", null, RetrievalMode.VECTOR);

            provider.embedding = text -> {
                throw new MalformedModelResponseException("embedding response had no vector");
            };
            final Throwable malformed = assertThrows(CompletionException.class,
                () -> orchestrator.query(request).join()).getCause();

            provider.embedding = text -> {
                throw new JedisConnectionException("Connection refused");
            };
            final Throwable unreachable = assertThrows(CompletionException.class,
                () -> orchestrator.query(request).join()).getCause();

            assertInstanceOf(RetrievalException.class, malformed);
            assertFalse(retryable.test(malformed));
            assertTrue(retryable.test(unreachable));

            final Method query = RetrievalOrchestrator.class.getMethod("query", RetrievalRequest.class);
            assertEquals(TransientFailurePredicate.class, query.getAnnotation(RetryWhen.class).exception());
            assertEquals(0, query.getAnnotation(Retry.class).abortOn().length);
        }

        @Test
        @DisplayName("blank queries are rejected before any stage runs")
        void blankQuery() {
            assertThrows(IllegalArgumentException.class, () -> RetrievalRequest.of("   "));
        }
    }

    @Test
    @DisplayName("missing chunk position and page fall back to defaults")
    void toSourceDefaults() {
        final SourceReference source = RetrievalOrchestrator.toSource(new RankedCandidate(
            new RetrievalCandidate("x", "text", new ChunkPayload("text", "a.pdf", null, null, "x", null)),
            0.5, 0, 0));

        assertEquals(0, source.chunkIndex());
        assertEquals(1, source.pageNumber());
    }

    private void index(final String id, final String text, final String source, final int chunkIndex, final int page) {
        vectorStore.upsert(id, text, FakeModelProvider.bagOfWords(text),
            new ChunkMetadata(source, "b1", chunkIndex, id, page)).join();
    }
}
