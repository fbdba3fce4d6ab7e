package br.edu.ifba.federated.retrieval.pipeline;

import br.edu.ifba.federated.model.ModelProvider;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Extracts up to {@code maxEntities} entity names from the refined query.
 * Skipped when the mode does not use the graph.
 */
public class EntityExtractionStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(EntityExtractionStage.class);
    private static final String STAGE_NAME = "extract-entities";

    private final ModelProvider modelProvider;
    private final int maxEntities;

    public EntityExtractionStage(@NotNull final ModelProvider modelProvider, final int maxEntities) {
        this.modelProvider = modelProvider;
        this.maxEntities = maxEntities;
    }

    @Override
    public CompletableFuture<RetrievalContext> process(@NotNull final RetrievalContext context) {
        return modelProvider.extractEntities(context.getRefinedQuery(), maxEntities).thenApply(entities -> {
            context.setEntities(entities.size() > maxEntities ? entities.subList(0, maxEntities) : entities);
            logger.debug("Extracted entities: {}", context.getEntities());
            return context;
        });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }

    @Override
    public boolean shouldSkip(@NotNull final RetrievalContext context) {
        return !context.getMode().usesGraph();
    }
}
