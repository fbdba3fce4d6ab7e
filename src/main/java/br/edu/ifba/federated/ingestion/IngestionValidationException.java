package br.edu.ifba.federated.ingestion;

/**
 * A job or a submitted file failed validation. Never retried.
 */
public class IngestionValidationException extends RuntimeException {

    public IngestionValidationException(final String message) {
        super(message);
    }
}
