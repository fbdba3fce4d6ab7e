package br.edu.ifba.federated.retrieval.pipeline;

import br.edu.ifba.federated.model.ModelProvider;
import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import br.edu.ifba.federated.vector.VectorStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Embeds the refined query and takes the {@code topK} nearest chunks.
 */
public class VectorSearchStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(VectorSearchStage.class);
    private static final String STAGE_NAME = "vector-search";

    private final ModelProvider modelProvider;
    private final VectorStore vectorStore;
    private final int topK;

    public VectorSearchStage(
            @NotNull final ModelProvider modelProvider,
            @NotNull final VectorStore vectorStore,
            final int topK) {
        this.modelProvider = modelProvider;
        this.vectorStore = vectorStore;
        this.topK = topK;
    }

    @Override
    public CompletableFuture<RetrievalContext> process(@NotNull final RetrievalContext context) {
        return modelProvider.embed(context.getRefinedQuery())
            .thenCompose(vector -> vectorStore.search(vector, topK, context.getSourceFilter()))
            .thenApply(hits -> {
                context.setVectorCandidates(hits.stream().map(RetrievalCandidate::from).toList());
                logger.debug("Vector search found {} candidates", hits.size());
                return context;
            });
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }

    @Override
    public boolean shouldSkip(@NotNull final RetrievalContext context) {
        return !context.getMode().usesVectors();
    }
}
