package br.edu.ifba.federated.shared;

/**
 * Raised when a call to a model backend fails.
 * Carries the HTTP status when the backend answered with one, {@code -1} otherwise.
 */
public class ModelCallException extends RuntimeException {

    private final int status;

    public ModelCallException(final String message, final int status) {
        super(message);
        this.status = status;
    }

    public ModelCallException(final String message, final Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public int getStatus() {
        return status;
    }
}
