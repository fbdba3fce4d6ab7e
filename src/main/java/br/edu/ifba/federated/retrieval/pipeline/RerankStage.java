package br.edu.ifba.federated.retrieval.pipeline;

import br.edu.ifba.federated.rerank.RankedCandidate;
import br.edu.ifba.federated.rerank.Reranker;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Scores the pool against the refined query and keeps the best {@code topK}.
 * An empty pool never reaches the reranker.
 */
public class RerankStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(RerankStage.class);
    private static final String STAGE_NAME = "rerank";

    private final Supplier<Reranker> rerankerSupplier;
    private final int topK;

    /**
     * @param rerankerSupplier resolved per query so a configuration change or an
     *                         unavailable provider is picked up
     */
    public RerankStage(@NotNull final Supplier<Reranker> rerankerSupplier, final int topK) {
        this.rerankerSupplier = rerankerSupplier;
        this.topK = topK;
    }

    @Override
    public CompletableFuture<RetrievalContext> process(@NotNull final RetrievalContext context) {
        final Reranker reranker = rerankerSupplier.get();
        final List<RankedCandidate> ranked = reranker.rerank(context.getRefinedQuery(), context.getPool(), topK);
        context.setRanked(ranked);
        context.setRerankedCount(context.getPool().size());
        logger.debug("Reranker {} kept {} of {} candidates",
            reranker.getProviderName(), ranked.size(), context.getPool().size());
        return CompletableFuture.completedFuture(context);
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }

    @Override
    public boolean shouldSkip(@NotNull final RetrievalContext context) {
        return context.getPool().isEmpty();
    }
}
