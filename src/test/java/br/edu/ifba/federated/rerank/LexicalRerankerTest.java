package br.edu.ifba.federated.rerank;

import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import br.edu.ifba.federated.vector.ChunkPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LexicalRerankerTest {

    private LexicalReranker reranker;

    @BeforeEach
    void setUp() {
        reranker = new LexicalReranker();
    }

    @Test
    @DisplayName("should move the most relevant candidate to the top")
    void ranksByRelevance() {
        final List<RetrievalCandidate> pool = List.of(
            candidate("c1", "The weather in Lisbon was mild all week."),
            candidate("c2", "Acme Corp moved its headquarters to Paris in 2019."),
            candidate("c3", "Paris hosts many museums."));

        final List<RankedCandidate> ranked = reranker.rerank("Where is Acme headquarters?", pool, 3);

        assertEquals("c2", ranked.get(0).candidate().id());
        assertEquals(1, ranked.get(0).originalRank());
        assertEquals(0, ranked.get(0).newRank());
        assertEquals(1.0, ranked.get(0).score(), 1e-9);
        assertTrue(ranked.get(0).movedUp());
    }

    @Test
    @DisplayName("should keep pool order between equal scores and honor topK")
    void stableAndLimited() {
        final List<RetrievalCandidate> pool = List.of(
            candidate("c1", "nothing relevant"),
            candidate("c2", "still nothing"),
            candidate("c3", "and more filler"));

        final List<RankedCandidate> ranked = reranker.rerank("quantum chromodynamics", pool, 2);

        assertEquals(List.of("c1", "c2"), ranked.stream().map(r -> r.candidate().id()).toList());
        assertEquals(0.0, ranked.get(0).score());
    }

    @Test
    @DisplayName("should return nothing for an empty pool")
    void emptyPool() {
        assertTrue(reranker.rerank("anything", List.of(), 5).isEmpty());
    }

    @Test
    @DisplayName("tokenize drops stop words and single characters")
    void tokenize() {
        assertEquals(List.of("acme", "corp", "paris"), LexicalReranker.tokenize("Is Acme-Corp in a Paris?"));
    }

    @Test
    @DisplayName("passthrough keeps pool order with decreasing scores")
    void passthrough() {
        final List<RankedCandidate> ranked = new PassthroughReranker().rerank("q",
            List.of(candidate("c1", "a"), candidate("c2", "b")), 5);

        assertEquals(2, ranked.size());
        assertEquals(1.0, ranked.get(0).score());
        assertEquals(0.95, ranked.get(1).score(), 1e-9);
    }

    static RetrievalCandidate candidate(final String id, final String text) {
        return new RetrievalCandidate(id, text, new ChunkPayload(text, "doc.pdf", "b1", 0, id, 1));
    }
}
