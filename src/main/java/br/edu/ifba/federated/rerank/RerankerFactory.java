package br.edu.ifba.federated.rerank;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

/**
 * Selects the configured reranker.
 *
 * <p>Falls back to the lexical reranker when the provider is unknown or not available
 * (e.g. missing API key), and to pool order when reranking is disabled.</p>
 */
@ApplicationScoped
public class RerankerFactory {

    private static final Logger logger = Logger.getLogger(RerankerFactory.class);

    @Inject
    RerankerConfig config;

    @Inject
    @Named("passthroughReranker")
    Reranker passthroughReranker;

    @Inject
    @Named("lexicalReranker")
    Reranker lexicalReranker;

    @Inject
    @Named("cohereReranker")
    Reranker cohereReranker;

    public Reranker getReranker() {
        if (!config.enabled()) {
            logger.debug("Reranking disabled, keeping pool order");
            return passthroughReranker;
        }

        final String provider = config.provider().toLowerCase();
        final Reranker selected = switch (provider) {
            case "cohere" -> cohereReranker;
            case "lexical" -> lexicalReranker;
            default -> {
                logger.warnf("Unknown reranker provider '%s', using lexical reranker", provider);
                yield lexicalReranker;
            }
        };

        if (!selected.isAvailable()) {
            logger.warnf("Reranker provider '%s' is not available (missing API key?), using lexical reranker", provider);
            return lexicalReranker;
        }
        return selected;
    }
}
