package br.edu.ifba.federated.rerank;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Reranker settings.
 *
 * <pre>
 * federated.rerank.enabled=true
 * federated.rerank.provider=lexical
 * federated.rerank.cohere.api-key=${COHERE_API_KEY:}
 * </pre>
 */
@ConfigMapping(prefix = "federated.rerank")
public interface RerankerConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * {@code lexical} or {@code cohere}.
     */
    @WithDefault("lexical")
    String provider();

    CohereConfig cohere();

    interface CohereConfig {

        @WithName("api-key")
        Optional<String> apiKey();

        @WithDefault("rerank-english-v3.0")
        String model();
    }
}
