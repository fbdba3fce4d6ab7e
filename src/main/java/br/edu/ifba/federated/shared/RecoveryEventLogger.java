package br.edu.ifba.federated.shared;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging for the places where the system degrades instead of failing.
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li><code>recovery.operation</code> - The operation that degraded</li>
 *   <li><code>recovery.action</code> - fallback, skip or restart</li>
 *   <li><code>recovery.exception</code> - Exception class name that triggered it</li>
 * </ul>
 *
 * <h2>Log Format Example:</h2>
 * <pre>
 * WARN  [RecoveryEventLogger] Fallback for generate: local -> cloud (ModelCallException - Connection refused)
 * WARN  [RecoveryEventLogger] Skipped graph-extraction for chunk 3 of temp/a.pdf: MalformedModelResponseException - ...
 * WARN  [RecoveryEventLogger] Restarting ingestion-consumer (attempt 2): KafkaException - ...
 * </pre>
 */
@ApplicationScoped
public class RecoveryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RecoveryEventLogger.class);

    private static final String MDC_OPERATION = "recovery.operation";
    private static final String MDC_ACTION = "recovery.action";
    private static final String MDC_EXCEPTION = "recovery.exception";

    private static final int MAX_MESSAGE_LENGTH = 200;

    /**
     * Logs a switch from one channel to another.
     *
     * @param operation the operation being served
     * @param from      channel that could not serve it
     * @param to        channel used instead
     * @param failure   the failure that caused the switch, or null when the channel was simply unavailable
     */
    public void logFallback(final String operation, final String from, final String to, final Throwable failure) {
        try {
            putContext(operation, "fallback", failure);
            if (failure == null) {
                logger.warn("Fallback for {}: {} -> {} ({} unavailable)", operation, from, to, from);
            } else {
                logger.warn("Fallback for {}: {} -> {} ({} - {})",
                    operation, from, to, exceptionName(failure), truncateMessage(failure.getMessage()));
            }
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs a best-effort step that was skipped while the surrounding work continued.
     *
     * @param operation the skipped step
     * @param scope     what the step was applied to
     * @param failure   the failure
     */
    public void logSkipped(final String operation, final String scope, final Throwable failure) {
        try {
            putContext(operation, "skip", failure);
            logger.warn("Skipped {} for {}: {} - {}",
                operation, scope, exceptionName(failure), truncateMessage(failure != null ? failure.getMessage() : null));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs a restart of a long-running loop.
     *
     * @param operation the loop being restarted
     * @param attempt   restart count (1-based)
     * @param failure   the failure that stopped the loop
     */
    public void logRestart(final String operation, final int attempt, final Throwable failure) {
        try {
            putContext(operation, "restart", failure);
            logger.warn("Restarting {} (attempt {}): {} - {}",
                operation, attempt, exceptionName(failure), truncateMessage(failure != null ? failure.getMessage() : null));
        } finally {
            clearMDC();
        }
    }

    private void putContext(final String operation, final String action, final Throwable failure) {
        MDC.put(MDC_OPERATION, operation);
        MDC.put(MDC_ACTION, action);
        MDC.put(MDC_EXCEPTION, exceptionName(failure));
    }

    private void clearMDC() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_ACTION);
        MDC.remove(MDC_EXCEPTION);
    }

    private static String exceptionName(final Throwable failure) {
        return failure != null ? failure.getClass().getSimpleName() : "none";
    }

    private String truncateMessage(final String message) {
        if (message == null) {
            return "null";
        }
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
