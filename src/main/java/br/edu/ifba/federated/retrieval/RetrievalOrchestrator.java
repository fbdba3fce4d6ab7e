package br.edu.ifba.federated.retrieval;

import br.edu.ifba.federated.graph.GraphStore;
import br.edu.ifba.federated.model.ModelProvider;
import br.edu.ifba.federated.rerank.RankedCandidate;
import br.edu.ifba.federated.rerank.Reranker;
import br.edu.ifba.federated.rerank.RerankerFactory;
import br.edu.ifba.federated.retrieval.pipeline.CandidatePoolingStage;
import br.edu.ifba.federated.retrieval.pipeline.EntityExtractionStage;
import br.edu.ifba.federated.retrieval.pipeline.GraphExpansionStage;
import br.edu.ifba.federated.retrieval.pipeline.QueryRefinementStage;
import br.edu.ifba.federated.retrieval.pipeline.RerankStage;
import br.edu.ifba.federated.retrieval.pipeline.RetrievalContext;
import br.edu.ifba.federated.retrieval.pipeline.RetrievalPipeline;
import br.edu.ifba.federated.retrieval.pipeline.SynthesisStage;
import br.edu.ifba.federated.retrieval.pipeline.VectorSearchStage;
import br.edu.ifba.federated.shared.TransientFailurePredicate;
import br.edu.ifba.federated.vector.ChunkPayload;
import br.edu.ifba.federated.vector.VectorStore;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Answers a question from the federated graph and vector corpus.
 *
 * <p>Refinement, entity extraction, graph expansion, vector search, pooling,
 * reranking and synthesis run as one {@link RetrievalPipeline}. The mode decides
 * which candidate paths take part. A query that failed on a transient error is
 * retried as a whole; malformed model output and other permanent failures are not.</p>
 */
@ApplicationScoped
public class RetrievalOrchestrator {

    private static final Logger LOG = Logger.getLogger(RetrievalOrchestrator.class);

    private final ModelProvider modelProvider;
    private final RetrievalPipeline pipeline;

    @Inject
    public RetrievalOrchestrator(
            final ModelProvider modelProvider,
            final GraphStore graphStore,
            final VectorStore vectorStore,
            final RerankerFactory rerankerFactory,
            final RetrievalConfig config) {
        this(modelProvider, graphStore, vectorStore, rerankerFactory::getReranker, config.toSettings());
    }

    public RetrievalOrchestrator(
            @NotNull final ModelProvider modelProvider,
            @NotNull final GraphStore graphStore,
            @NotNull final VectorStore vectorStore,
            @NotNull final Supplier<Reranker> rerankerSupplier,
            @NotNull final RetrievalSettings settings) {
        this.modelProvider = modelProvider;
        this.pipeline = RetrievalPipeline.builder()
            .addStage(new QueryRefinementStage(modelProvider, settings.shortQueryWords()))
            .addStage(new EntityExtractionStage(modelProvider, settings.maxEntities()))
            .addStage(new GraphExpansionStage(graphStore, vectorStore,
                settings.expandedEntityCap(), settings.graphChunkCap()))
            .addStage(new VectorSearchStage(modelProvider, vectorStore, settings.vectorTopK()))
            .addStage(new CandidatePoolingStage())
            .addStage(new RerankStage(rerankerSupplier, settings.rerankTopK()))
            .addStage(new SynthesisStage(modelProvider))
            .build();
    }

    /**
     * Runs a query.
     *
     * @param request validated query, filter and mode
     * @return the answer with its sources, the extracted entities and a debug trace;
     *         completes with a {@link RetrievalException} naming the failing stage
     *         once every attempt has failed
     */
    @Retry(maxRetries = 2, delay = 1, delayUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 3, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public CompletableFuture<RetrievalResponse> query(@NotNull final RetrievalRequest request) {
        LOG.infof("Query received: mode=%s, filter=%s", request.mode().id(), request.sourceFilter());
        return pipeline.execute(request).thenApply(this::toResponse);
    }

    private RetrievalResponse toResponse(final RetrievalContext context) {
        final List<SourceReference> sources = context.getRanked().stream()
            .map(RetrievalOrchestrator::toSource)
            .toList();

        final RetrievalDebug debug = new RetrievalDebug(
            context.getMode().id(),
            context.getRequest().query(),
            context.getRefinedQuery(),
            context.getPrompt(),
            new RetrievalDebug.CandidateCounts(
                context.getVectorCandidates().size(),
                context.getGraphCandidates().size(),
                context.getPool().size(),
                context.getRerankedCount()),
            modelProvider.providerName());

        LOG.debugf("Query answered with %d sources (vector=%d, graph=%d)",
            sources.size(), context.getVectorCandidates().size(), context.getGraphCandidates().size());
        return new RetrievalResponse(context.getAnswer(), sources, context.getEntities(), debug);
    }

    static SourceReference toSource(final RankedCandidate ranked) {
        final ChunkPayload payload = ranked.candidate().metadata();
        return new SourceReference(
            payload.source(),
            ranked.candidate().text(),
            ranked.score(),
            payload.chunkIndex() != null ? payload.chunkIndex() : 0,
            payload.pageNumber() != null ? payload.pageNumber() : 1);
    }
}
