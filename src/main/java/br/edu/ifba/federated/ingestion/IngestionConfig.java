package br.edu.ifba.federated.ingestion;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Chunking, summarization and upload limits.
 */
@ConfigMapping(prefix = "federated.ingest")
public interface IngestionConfig {

    @WithName("chunk-size")
    @WithDefault("4000")
    int chunkSize();

    @WithName("chunk-overlap")
    @WithDefault("200")
    int chunkOverlap();

    /**
     * Texts at least this long are split in half before summarizing.
     */
    @WithName("summary-threshold")
    @WithDefault("12000")
    int summaryThreshold();

    /**
     * Upper bound on the split depth derived from the text length.
     */
    @WithName("summary-max-depth")
    @WithDefault("8")
    int summaryMaxDepth();

    @WithName("max-file-bytes")
    @WithDefault("52428800")
    long maxFileBytes();
}
