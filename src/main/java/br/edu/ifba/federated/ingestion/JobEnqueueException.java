package br.edu.ifba.federated.ingestion;

/**
 * A job could not be handed to the queue. If its content hash was reserved, the
 * reservation has already been released when this is thrown.
 */
public class JobEnqueueException extends RuntimeException {

    public JobEnqueueException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
