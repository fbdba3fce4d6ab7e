package br.edu.ifba.federated.rerank;

import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Scores a pooled candidate set against a query and returns the best ones.
 */
public interface Reranker {

    /**
     * @param query      the refined query
     * @param candidates pooled candidates in pool order
     * @param topK       maximum results to return
     * @return at most {@code topK} candidates, best first; empty for an empty pool
     */
    @NotNull
    List<RankedCandidate> rerank(@NotNull String query, @NotNull List<RetrievalCandidate> candidates, int topK);

    boolean isAvailable();

    @NotNull
    String getProviderName();
}
