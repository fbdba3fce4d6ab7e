package br.edu.ifba.federated.shared;

/**
 * The model answered, but the answer could not be used: no choices, an empty
 * embedding, or structured output that does not parse. Never retried.
 */
public class MalformedModelResponseException extends RuntimeException {

    public MalformedModelResponseException(final String message) {
        super(message);
    }

    public MalformedModelResponseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
