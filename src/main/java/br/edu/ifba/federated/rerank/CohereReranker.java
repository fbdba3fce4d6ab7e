package br.edu.ifba.federated.rerank;

import br.edu.ifba.federated.rerank.CohereRerankClient.CohereRerankRequest;
import br.edu.ifba.federated.rerank.CohereRerankClient.CohereRerankResponse;
import br.edu.ifba.federated.rerank.CohereRerankClient.CohereRerankResult;
import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reranker backed by the Cohere Rerank API.
 *
 * <p>A circuit breaker and a timeout guard the remote call; when either trips, or the call
 * fails, the candidates are scored by the {@link LexicalReranker} instead.</p>
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li><code>rerank.provider</code> - cohere</li>
 *   <li><code>rerank.inputCandidates</code> - Number of pooled candidates</li>
 * </ul>
 */
@ApplicationScoped
@Named("cohereReranker")
public class CohereReranker implements Reranker {

    private static final Logger LOG = LoggerFactory.getLogger(CohereReranker.class);
    private static final String PROVIDER_NAME = "cohere";

    private static final String MDC_PROVIDER = "rerank.provider";
    private static final String MDC_INPUT = "rerank.inputCandidates";

    @Inject
    @RestClient
    CohereRerankClient client;

    @Inject
    RerankerConfig config;

    @Inject
    @Named("lexicalReranker")
    Reranker fallbackReranker;

    @Override
    @NotNull
    @CircuitBreaker(requestVolumeThreshold = 4, failureRatio = 0.5, delay = 10000, successThreshold = 2)
    @Timeout(value = 3000)
    @Fallback(fallbackMethod = "fallbackRerank")
    public List<RankedCandidate> rerank(
            @NotNull final String query,
            @NotNull final List<RetrievalCandidate> candidates,
            final int topK) {
        if (candidates.isEmpty() || topK <= 0) {
            return List.of();
        }
        try {
            MDC.put(MDC_PROVIDER, PROVIDER_NAME);
            MDC.put(MDC_INPUT, String.valueOf(candidates.size()));

            final List<String> documents = candidates.stream().map(RetrievalCandidate::text).toList();
            final String apiKey = config.cohere().apiKey()
                .filter(key -> !key.isBlank())
                .orElseThrow(() -> new IllegalStateException("Cohere API key not configured"));

            final long start = System.currentTimeMillis();
            final CohereRerankResponse response = client.rerank("Bearer " + apiKey, CohereRerankRequest.of(
                config.cohere().model(), query, documents, Math.min(topK, candidates.size())));

            final List<RankedCandidate> ranked = toRanked(response, candidates, topK);
            LOG.info("Rerank completed - duration={}ms, input={}, output={}",
                System.currentTimeMillis() - start, candidates.size(), ranked.size());
            return ranked;
        } finally {
            MDC.remove(MDC_PROVIDER);
            MDC.remove(MDC_INPUT);
        }
    }

    @SuppressWarnings("unused")
    @NotNull
    List<RankedCandidate> fallbackRerank(
            @NotNull final String query,
            @NotNull final List<RetrievalCandidate> candidates,
            final int topK) {
        LOG.warn("Cohere rerank unavailable, scoring {} candidates lexically", candidates.size());
        return fallbackReranker.rerank(query, candidates, topK);
    }

    static List<RankedCandidate> toRanked(
            final CohereRerankResponse response,
            final List<RetrievalCandidate> candidates,
            final int topK) {
        if (response == null || response.results() == null) {
            throw new IllegalStateException("Cohere returned no results");
        }
        final List<CohereRerankResult> sorted = new ArrayList<>(response.results());
        sorted.sort(Comparator.comparingDouble(CohereRerankResult::relevanceScore).reversed());

        final List<RankedCandidate> ranked = new ArrayList<>();
        for (CohereRerankResult result : sorted) {
            if (ranked.size() >= topK) {
                break;
            }
            if (result.index() >= 0 && result.index() < candidates.size()) {
                ranked.add(new RankedCandidate(
                    candidates.get(result.index()), result.relevanceScore(), result.index(), ranked.size()));
            }
        }
        return ranked;
    }

    @Override
    public boolean isAvailable() {
        return config.cohere().apiKey().filter(key -> !key.isBlank()).isPresent();
    }

    @Override
    @NotNull
    public String getProviderName() {
        return PROVIDER_NAME;
    }
}
