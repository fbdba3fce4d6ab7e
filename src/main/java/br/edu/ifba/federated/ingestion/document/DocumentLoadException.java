package br.edu.ifba.federated.ingestion.document;

/**
 * A document could not be read or produced no text. Fails the job.
 */
public class DocumentLoadException extends RuntimeException {

    public DocumentLoadException(final String message) {
        super(message);
    }

    public DocumentLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
