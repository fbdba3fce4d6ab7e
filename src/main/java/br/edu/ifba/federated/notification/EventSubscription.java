package br.edu.ifba.federated.notification;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Live feed of the events of one batch. Only events published after the subscription
 * was opened are delivered.
 */
public interface EventSubscription extends AutoCloseable {

    Duration POLL_INTERVAL = Duration.ofMillis(100);

    String channel();

    /**
     * Waits up to {@code timeout} for the next event.
     */
    Optional<ProgressEvent> poll(@NotNull Duration timeout);

    /**
     * Delivers events to {@code consumer}, polling every 100 ms, until the subscription is
     * closed or {@code disconnected} reports true. Returns the number of events delivered.
     */
    default int forEach(@NotNull final Consumer<ProgressEvent> consumer, @NotNull final BooleanSupplier disconnected) {
        int delivered = 0;
        while (!isClosed() && !disconnected.getAsBoolean()) {
            final Optional<ProgressEvent> event = poll(POLL_INTERVAL);
            if (event.isPresent()) {
                consumer.accept(event.get());
                delivered++;
            }
        }
        return delivered;
    }

    boolean isClosed();

    @Override
    void close();
}
