package br.edu.ifba.federated.retrieval.pipeline;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * A step of the retrieval pipeline.
 *
 * <p>Stages hold no per-query state. They read their inputs from the
 * {@link RetrievalContext}, write their outputs back to it and complete with the
 * same instance.</p>
 */
public interface PipelineStage {

    /**
     * @param context the per-query context
     * @return future completing with the context once this stage's outputs are set
     */
    CompletableFuture<RetrievalContext> process(@NotNull RetrievalContext context);

    /**
     * @return stage name used in logs and in {@link br.edu.ifba.federated.retrieval.RetrievalException}
     */
    String getName();

    /**
     * Returns true when this stage contributes nothing for the given context.
     * Never skipped by default.
     */
    default boolean shouldSkip(@NotNull RetrievalContext context) {
        return false;
    }
}
