package br.edu.ifba.federated.notification;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Subscription backed by an in-process queue that the channel implementation feeds.
 */
abstract class QueuedSubscription implements EventSubscription {

    private final String channel;
    private final BlockingQueue<ProgressEvent> events = new LinkedBlockingQueue<>();
    private volatile boolean closed = false;

    protected QueuedSubscription(final String channel) {
        this.channel = channel;
    }

    void offer(final ProgressEvent event) {
        if (!closed) {
            events.offer(event);
        }
    }

    @Override
    public String channel() {
        return channel;
    }

    @Override
    public Optional<ProgressEvent> poll(@NotNull final Duration timeout) {
        if (closed && events.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            return Optional.empty();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            onClose();
        }
    }

    protected abstract void onClose();
}
