package br.edu.ifba.federated.ingestion;

/**
 * @param id    deterministic id shared by the vector point and the graph node
 * @param index position in the document (0-based)
 * @param text  raw chunk text, a substring of the document text
 */
public record Chunk(String id, int index, String text) {
}
