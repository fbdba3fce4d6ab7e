package br.edu.ifba.federated.rerank;

import br.edu.ifba.federated.retrieval.RetrievalCandidate;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Local reranker scoring candidates with BM25 computed over the pool itself.
 *
 * <p>Scores are normalized to [0, 1] by the best score in the pool. Candidates with equal
 * scores keep their pool order. Runs in-process, so it is the default and the fallback
 * for remote rerankers.</p>
 */
@ApplicationScoped
@Named("lexicalReranker")
public class LexicalReranker implements Reranker {

    private static final Logger LOG = LoggerFactory.getLogger(LexicalReranker.class);

    private static final double K1 = 1.2;
    private static final double B = 0.75;

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "by", "do", "does", "for", "from", "how",
        "in", "is", "it", "of", "on", "or", "that", "the", "this", "to", "was", "what",
        "when", "where", "which", "who", "why", "with"
    );

    @Override
    @NotNull
    public List<RankedCandidate> rerank(
            @NotNull final String query,
            @NotNull final List<RetrievalCandidate> candidates,
            final int topK) {
        if (candidates.isEmpty() || topK <= 0) {
            return List.of();
        }

        final Set<String> queryTerms = new LinkedHashSet<>(tokenize(query));
        final List<List<String>> documents = new ArrayList<>(candidates.size());
        final Map<String, Integer> documentFrequency = new HashMap<>();
        double totalLength = 0;
        for (RetrievalCandidate candidate : candidates) {
            final List<String> tokens = tokenize(candidate.text());
            documents.add(tokens);
            totalLength += tokens.size();
            for (String term : new LinkedHashSet<>(tokens)) {
                if (queryTerms.contains(term)) {
                    documentFrequency.merge(term, 1, Integer::sum);
                }
            }
        }
        final double averageLength = Math.max(1.0, totalLength / candidates.size());

        final double[] raw = new double[candidates.size()];
        double best = 0.0;
        for (int i = 0; i < documents.size(); i++) {
            raw[i] = bm25(queryTerms, documents.get(i), documentFrequency, candidates.size(), averageLength);
            best = Math.max(best, raw[i]);
        }

        final List<Integer> order = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> raw[i]).reversed().thenComparing(i -> i));

        final int limit = Math.min(topK, candidates.size());
        final List<RankedCandidate> ranked = new ArrayList<>(limit);
        for (int newRank = 0; newRank < limit; newRank++) {
            final int original = order.get(newRank);
            final double score = best > 0.0 ? raw[original] / best : 0.0;
            ranked.add(new RankedCandidate(candidates.get(original), score, original, newRank));
        }

        LOG.debug("Lexical rerank: {} candidates, {} query terms, kept {}",
            candidates.size(), queryTerms.size(), ranked.size());
        return ranked;
    }

    private static double bm25(
            final Set<String> queryTerms,
            final List<String> document,
            final Map<String, Integer> documentFrequency,
            final int documentCount,
            final double averageLength) {
        if (document.isEmpty()) {
            return 0.0;
        }
        final Map<String, Integer> termFrequency = new HashMap<>();
        for (String token : document) {
            if (queryTerms.contains(token)) {
                termFrequency.merge(token, 1, Integer::sum);
            }
        }
        double score = 0.0;
        for (Map.Entry<String, Integer> entry : termFrequency.entrySet()) {
            final int df = documentFrequency.getOrDefault(entry.getKey(), 0);
            final double idf = Math.log(1.0 + (documentCount - df + 0.5) / (df + 0.5));
            final double tf = entry.getValue();
            score += idf * (tf * (K1 + 1)) / (tf + K1 * (1 - B + B * document.size() / averageLength));
        }
        return score;
    }

    static List<String> tokenize(final String text) {
        final List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    @NotNull
    public String getProviderName() {
        return "lexical";
    }
}
