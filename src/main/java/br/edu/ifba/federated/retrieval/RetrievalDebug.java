package br.edu.ifba.federated.retrieval;

/**
 * Trace of how an answer was produced. Always returned with the answer.
 *
 * @param mode          mode that ran
 * @param originalQuery query as submitted
 * @param refinedQuery  query after refinement (equal to the original for long queries)
 * @param promptSent    exact synthesis prompt
 * @param candidates    candidate counts per stage
 * @param providerUsed  active provider and model at synthesis time
 */
public record RetrievalDebug(
    String mode,
    String originalQuery,
    String refinedQuery,
    String promptSent,
    CandidateCounts candidates,
    String providerUsed
) {

    /**
     * @param vector   hits from vector search
     * @param graph    chunks fetched through graph expansion
     * @param pooled   distinct candidates after pooling
     * @param reranked candidates scored by the reranker
     */
    public record CandidateCounts(int vector, int graph, int pooled, int reranked) {
    }
}
