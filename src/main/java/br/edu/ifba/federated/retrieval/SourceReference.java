package br.edu.ifba.federated.retrieval;

/**
 * A passage used for the answer.
 */
public record SourceReference(
    String source,
    String text,
    double score,
    int chunkIndex,
    int pageNumber
) {
}
