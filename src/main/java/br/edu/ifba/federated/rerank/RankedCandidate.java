package br.edu.ifba.federated.rerank;

import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A candidate with its relevance score and its position before and after reranking.
 *
 * @param candidate    the scored candidate
 * @param score        relevance score, higher is better
 * @param originalRank position in the pool (0-based)
 * @param newRank      position after reranking (0-based)
 */
public record RankedCandidate(
    @NotNull RetrievalCandidate candidate,
    double score,
    int originalRank,
    int newRank
) {

    public RankedCandidate {
        Objects.requireNonNull(candidate, "candidate must not be null");
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be a number");
        }
        if (originalRank < 0) {
            throw new IllegalArgumentException("originalRank must be >= 0, got: " + originalRank);
        }
        if (newRank < 0) {
            throw new IllegalArgumentException("newRank must be >= 0, got: " + newRank);
        }
    }

    public boolean movedUp() {
        return newRank < originalRank;
    }
}
