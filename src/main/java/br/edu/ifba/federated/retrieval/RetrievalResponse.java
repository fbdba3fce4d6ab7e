package br.edu.ifba.federated.retrieval;

import java.util.List;

/**
 * @param answer       synthesized answer
 * @param sources      passages given to the model, best first
 * @param graphContext entities extracted from the query (empty in vector mode)
 * @param debug        retrieval trace
 */
public record RetrievalResponse(
    String answer,
    List<SourceReference> sources,
    List<String> graphContext,
    RetrievalDebug debug
) {

    public RetrievalResponse {
        sources = sources != null ? List.copyOf(sources) : List.of();
        graphContext = graphContext != null ? List.copyOf(graphContext) : List.of();
    }
}
