package br.edu.ifba.federated.retrieval.pipeline;

import br.edu.ifba.federated.model.ModelProvider;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Rewrites short queries into a fuller search intent. Queries with at least
 * {@code shortQueryWords} words are used as submitted.
 */
public class QueryRefinementStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(QueryRefinementStage.class);
    private static final String STAGE_NAME = "refine";

    private final ModelProvider modelProvider;
    private final int shortQueryWords;

    public QueryRefinementStage(@NotNull final ModelProvider modelProvider, final int shortQueryWords) {
        this.modelProvider = modelProvider;
        this.shortQueryWords = shortQueryWords;
    }

    @Override
    public CompletableFuture<RetrievalContext> process(@NotNull final RetrievalContext context) {
        final String query = context.getRequest().query();
        return modelProvider.refine(query).thenApply(refined -> {
            if (refined != null && !refined.isBlank()) {
                context.setRefinedQuery(refined.trim());
            }
            logger.debug("Refined '{}' into '{}'", query, context.getRefinedQuery());
            return context;
        });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }

    @Override
    public boolean shouldSkip(@NotNull final RetrievalContext context) {
        return wordCount(context.getRequest().query()) >= shortQueryWords;
    }

    static int wordCount(final String text) {
        final String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
