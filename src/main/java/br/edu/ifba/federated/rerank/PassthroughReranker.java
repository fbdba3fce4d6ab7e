package br.edu.ifba.federated.rerank;

import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps pool order, used when reranking is disabled.
 * Scores are synthetic: 1.0, 0.95, 0.90, ... down to 0.1.
 */
@ApplicationScoped
@Named("passthroughReranker")
public class PassthroughReranker implements Reranker {

    private static final Logger logger = Logger.getLogger(PassthroughReranker.class);

    @Override
    @NotNull
    public List<RankedCandidate> rerank(
            @NotNull final String query,
            @NotNull final List<RetrievalCandidate> candidates,
            final int topK) {
        final int limit = Math.min(Math.max(topK, 0), candidates.size());
        logger.debugf("Passthrough reranker: keeping %d of %d candidates", limit, candidates.size());

        final List<RankedCandidate> results = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            results.add(new RankedCandidate(candidates.get(i), Math.max(0.1, 1.0 - i * 0.05), i, i));
        }
        return results;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    @NotNull
    public String getProviderName() {
        return "none";
    }
}
