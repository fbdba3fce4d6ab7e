package br.edu.ifba.federated.retrieval;

/**
 * A query failed in one of its stages after every retry.
 */
public class RetrievalException extends RuntimeException {

    private final String stage;

    public RetrievalException(final String stage, final Throwable cause) {
        super("Retrieval failed at stage " + stage + ": " + (cause != null ? cause.getMessage() : "unknown"), cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
