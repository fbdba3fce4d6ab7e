package br.edu.ifba.federated.retrieval.pipeline;

import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Merges vector hits and graph-linked chunks by id. Vector hits come first and
 * the first occurrence of an id wins.
 */
public class CandidatePoolingStage implements PipelineStage {

    private static final String STAGE_NAME = "pool";

    @Override
    public CompletableFuture<RetrievalContext> process(@NotNull final RetrievalContext context) {
        final Map<String, RetrievalCandidate> pool = new LinkedHashMap<>();
        for (RetrievalCandidate candidate : context.getVectorCandidates()) {
            pool.putIfAbsent(candidate.id(), candidate);
        }
        for (RetrievalCandidate candidate : context.getGraphCandidates()) {
            pool.putIfAbsent(candidate.id(), candidate);
        }
        context.setPool(new ArrayList<>(pool.values()));
        return CompletableFuture.completedFuture(context);
    }

    @Override
    public String getName() {
        return STAGE_NAME;
    }
}
