package br.edu.ifba.federated.shared;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Predicate to determine if a failure from a model channel or a backing store
 * is transient and should be retried.
 *
 * <h2>Transient (will retry):</h2>
 * <ul>
 *   <li>I/O failures: connect refused, socket timeout, reset</li>
 *   <li>REST client {@link ProcessingException}s (transport level)</li>
 *   <li>HTTP 408, 429 and any 5xx response</li>
 *   <li>Redis connection failures</li>
 *   <li>{@link ModelCallException} carrying one of the statuses above</li>
 * </ul>
 *
 * <h2>Permanent (will NOT retry):</h2>
 * <ul>
 *   <li>{@link MalformedModelResponseException}: the backend answered, the answer is unusable</li>
 *   <li>HTTP 4xx other than 408/429 (bad request, auth, not found)</li>
 *   <li>Everything else</li>
 * </ul>
 *
 * <h2>Usage with SmallRye Fault Tolerance:</h2>
 * <pre>{@code
 * @Retry(maxRetries = 2)
 * @RetryWhen(exception = TransientFailurePredicate.class)
 * public CompletableFuture<String> generate(String prompt) { ... }
 * }</pre>
 */
public final class TransientFailurePredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientFailurePredicate.class);

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final Pattern TRANSIENT_MESSAGE_PATTERN = Pattern.compile(
        "(?i)(" +
        "connection\\s+(refused|reset|closed|timed\\s*out|lost|aborted)" +
        "|unable\\s+to\\s+connect" +
        "|network\\s+(is\\s+unreachable|error|timeout)" +
        "|socket\\s+(timeout|closed|reset)" +
        "|read\\s+timed\\s*out" +
        "|connect\\s+timed\\s*out" +
        "|broken\\s+pipe" +
        "|server\\s+(overloaded|not\\s+available|unavailable)" +
        "|rate\\s+limit" +
        "|too\\s+many\\s+requests" +
        "|temporarily\\s+unavailable" +
        "|try\\s+(again|later)" +
        ")"
    );

    @Override
    public boolean test(final Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof MalformedModelResponseException) {
                return false;
            }
            if (isTransientType(current)) {
                logger.debug("Transient failure detected: {} - {}",
                    current.getClass().getSimpleName(), current.getMessage());
                return true;
            }
            if (isTransientByMessage(current.getMessage())) {
                logger.debug("Transient failure detected by message: {}", current.getMessage());
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private boolean isTransientType(final Throwable throwable) {
        if (throwable instanceof IOException
                || throwable instanceof UncheckedIOException
                || throwable instanceof TimeoutException
                || throwable instanceof ProcessingException
                || throwable instanceof JedisConnectionException) {
            return true;
        }
        if (throwable instanceof ModelCallException modelCall) {
            return isTransientStatus(modelCall.getStatus());
        }
        if (throwable instanceof WebApplicationException webFailure && webFailure.getResponse() != null) {
            return isTransientStatus(webFailure.getResponse().getStatus());
        }
        return false;
    }

    /**
     * Determines whether an HTTP status code indicates a retryable condition.
     *
     * @param status HTTP status, or a non-positive value when unknown
     * @return {@code true} for 408, 429 and 5xx
     */
    public static boolean isTransientStatus(final int status) {
        return status == 408 || status == 429 || (status >= 500 && status <= 599);
    }

    private boolean isTransientByMessage(final String message) {
        return message != null && TRANSIENT_MESSAGE_PATTERN.matcher(message).find();
    }
}
