package br.edu.ifba.federated.retrieval;

/**
 * Immutable snapshot of {@link RetrievalConfig}.
 */
public record RetrievalSettings(
    int shortQueryWords,
    int maxEntities,
    int expandedEntityCap,
    int graphChunkCap,
    int vectorTopK,
    int rerankTopK
) {

    public RetrievalSettings {
        if (maxEntities <= 0 || expandedEntityCap <= 0 || graphChunkCap <= 0 || vectorTopK <= 0 || rerankTopK <= 0) {
            throw new IllegalArgumentException("retrieval limits must be > 0");
        }
    }

    public static RetrievalSettings defaults() {
        return new RetrievalSettings(5, 3, 10, 25, 20, 8);
    }
}
