package br.edu.ifba.federated.rerank;

import br.edu.ifba.federated.rerank.CohereRerankClient.CohereRerankResponse;
import br.edu.ifba.federated.rerank.CohereRerankClient.CohereRerankResult;
import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RerankerFactoryTest {

    private RerankerConfig config;
    private RerankerConfig.CohereConfig cohereConfig;
    private RerankerFactory factory;
    private CohereReranker cohere;

    @BeforeEach
    void setUp() {
        config = mock(RerankerConfig.class);
        cohereConfig = mock(RerankerConfig.CohereConfig.class);
        when(config.cohere()).thenReturn(cohereConfig);
        when(config.enabled()).thenReturn(true);
        when(cohereConfig.apiKey()).thenReturn(Optional.empty());

        cohere = new CohereReranker();
        cohere.config = config;

        factory = new RerankerFactory();
        factory.config = config;
        factory.passthroughReranker = new PassthroughReranker();
        factory.lexicalReranker = new LexicalReranker();
        factory.cohereReranker = cohere;
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("should use passthrough when reranking is disabled")
        void disabled() {
            when(config.enabled()).thenReturn(false);

            assertSame(factory.passthroughReranker, factory.getReranker());
        }

        @Test
        @DisplayName("should use the lexical reranker by default")
        void lexical() {
            when(config.provider()).thenReturn("lexical");

            assertEquals("lexical", factory.getReranker().getProviderName());
        }

        @Test
        @DisplayName("should fall back to lexical when Cohere has no key")
        void cohereWithoutKey() {
            when(config.provider()).thenReturn("cohere");

            assertSame(factory.lexicalReranker, factory.getReranker());
        }

        @Test
        @DisplayName("should select Cohere when a key is configured")
        void cohereWithKey() {
            when(config.provider()).thenReturn("Cohere");
            when(cohereConfig.apiKey()).thenReturn(Optional.of("key"));

            assertSame(cohere, factory.getReranker());
        }

        @Test
        @DisplayName("should fall back to lexical for an unknown provider")
        void unknown() {
            when(config.provider()).thenReturn("mystery");

            assertSame(factory.lexicalReranker, factory.getReranker());
        }
    }

    @Nested
    @DisplayName("Cohere response mapping")
    class CohereMapping {

        private final List<RetrievalCandidate> pool = List.of(
            LexicalRerankerTest.candidate("c1", "first"),
            LexicalRerankerTest.candidate("c2", "second"),
            LexicalRerankerTest.candidate("c3", "third"));

        @Test
        @DisplayName("should order by relevance and drop out-of-range indexes")
        void ordersByRelevance() {
            final CohereRerankResponse response = new CohereRerankResponse("r1", List.of(
                new CohereRerankResult(0, 0.2),
                new CohereRerankResult(7, 0.99),
                new CohereRerankResult(2, 0.8)));

            final List<RankedCandidate> ranked = CohereReranker.toRanked(response, pool, 5);

            assertEquals(List.of("c3", "c1"), ranked.stream().map(r -> r.candidate().id()).toList());
            assertEquals(2, ranked.get(0).originalRank());
            assertEquals(0, ranked.get(0).newRank());
        }

        @Test
        @DisplayName("should reject a response without results")
        void noResults() {
            assertThrows(IllegalStateException.class,
                () -> CohereReranker.toRanked(new CohereRerankResponse("r1", null), pool, 5));
        }
    }
}
