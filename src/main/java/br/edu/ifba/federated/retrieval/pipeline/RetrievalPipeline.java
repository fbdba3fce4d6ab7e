package br.edu.ifba.federated.retrieval.pipeline;

import br.edu.ifba.federated.retrieval.RetrievalException;
import br.edu.ifba.federated.retrieval.RetrievalRequest;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs a query through an ordered list of {@link PipelineStage}s.
 *
 * <p>Stages are chained with {@code thenCompose}. A failing stage completes the
 * returned future with a {@link RetrievalException} naming that stage, and no
 * later stage runs.</p>
 *
 * <pre>{@code
 * RetrievalPipeline pipeline = RetrievalPipeline.builder()
 *     .addStage(new QueryRefinementStage(modelProvider, 5))
 *     .addStage(new VectorSearchStage(modelProvider, vectorStore, 20))
 *     .addStage(new CandidatePoolingStage())
 *     .build();
 *
 * RetrievalContext context = pipeline.execute(RetrievalRequest.of("acme?")).join();
 * }</pre>
 */
public class RetrievalPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalPipeline.class);

    private final List<PipelineStage> stages;

    private RetrievalPipeline(final Builder builder) {
        this.stages = List.copyOf(builder.stages);
    }

    public CompletableFuture<RetrievalContext> execute(@NotNull final RetrievalRequest request) {
        logger.info("Starting retrieval pipeline, mode={}", request.mode().id());
        final long startTime = System.currentTimeMillis();

        CompletableFuture<RetrievalContext> future = CompletableFuture.completedFuture(new RetrievalContext(request));
        for (PipelineStage stage : stages) {
            future = future.thenCompose(ctx -> executeStage(stage, ctx));
        }
        return future.thenApply(ctx -> {
            logger.info("Retrieval pipeline completed in {}ms, pooled={}, ranked={}",
                System.currentTimeMillis() - startTime, ctx.getPool().size(), ctx.getRanked().size());
            return ctx;
        });
    }

    public List<String> stageNames() {
        return stages.stream().map(PipelineStage::getName).toList();
    }

    private CompletableFuture<RetrievalContext> executeStage(
            @NotNull final PipelineStage stage,
            @NotNull final RetrievalContext context) {
        if (stage.shouldSkip(context)) {
            logger.debug("Skipping stage: {}", stage.getName());
            return CompletableFuture.completedFuture(context);
        }

        logger.debug("Executing stage: {}", stage.getName());
        final long stageStart = System.currentTimeMillis();

        final CompletableFuture<RetrievalContext> result;
        try {
            result = stage.process(context);
        } catch (RuntimeException e) {
            logger.error("Stage {} failed: {}", stage.getName(), e.getMessage(), e);
            return CompletableFuture.failedFuture(new RetrievalException(stage.getName(), e));
        }

        return result
            .thenApply(ctx -> {
                logger.debug("Stage {} completed in {}ms", stage.getName(), System.currentTimeMillis() - stageStart);
                return ctx;
            })
            .exceptionally(e -> {
                final Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                logger.error("Stage {} failed: {}", stage.getName(), cause.getMessage(), cause);
                throw new RetrievalException(stage.getName(), cause);
            });
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<PipelineStage> stages = new ArrayList<>();

        /**
         * Adds a stage. Stages run in the order they are added.
         */
        public Builder addStage(@NotNull final PipelineStage stage) {
            this.stages.add(stage);
            return this;
        }

        public RetrievalPipeline build() {
            if (stages.isEmpty()) {
                throw new IllegalStateException("At least one stage is required");
            }
            return new RetrievalPipeline(this);
        }
    }
}
