package br.edu.ifba.federated.graph;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A directed (from, relation, to) fact as returned by graph reads.
 */
public record GraphTriple(
    @NotNull String from,
    @NotNull String relation,
    @NotNull String to
) {

    public GraphTriple {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(relation, "relation must not be null");
        Objects.requireNonNull(to, "to must not be null");
    }

    /**
     * Line used in the synthesis prompt, e.g. {@code - Acme Corp -[LOCATED_IN]-> Paris}.
     */
    public String describe() {
        return "- " + from + " -[" + relation + "]-> " + to;
    }
}
