package br.edu.ifba.federated.retrieval;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Fan-out limits of the retrieval pipeline.
 */
@ConfigMapping(prefix = "federated.retrieval")
public interface RetrievalConfig {

    /**
     * Queries with fewer words than this are refined before retrieval.
     */
    @WithName("short-query-words")
    @WithDefault("5")
    int shortQueryWords();

    @WithName("max-entities")
    @WithDefault("3")
    int maxEntities();

    @WithName("expanded-entity-cap")
    @WithDefault("10")
    int expandedEntityCap();

    @WithName("graph-chunk-cap")
    @WithDefault("25")
    int graphChunkCap();

    @WithName("vector-top-k")
    @WithDefault("20")
    int vectorTopK();

    @WithName("rerank-top-k")
    @WithDefault("8")
    int rerankTopK();

    default RetrievalSettings toSettings() {
        return new RetrievalSettings(shortQueryWords(), maxEntities(), expandedEntityCap(),
            graphChunkCap(), vectorTopK(), rerankTopK());
    }
}
