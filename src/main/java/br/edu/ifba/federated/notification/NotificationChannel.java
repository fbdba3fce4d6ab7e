package br.edu.ifba.federated.notification;

import org.jetbrains.annotations.NotNull;

/**
 * Best-effort progress feed. Never the source of truth for job state: use the ledger for that.
 */
public interface NotificationChannel {

    /**
     * Publishes to {@code batch:{batch}}. Failures are logged, never thrown.
     */
    void publish(@NotNull String batch, @NotNull ProgressEvent event);

    /**
     * Opens a live subscription to {@code batch:{batch}}.
     */
    @NotNull
    EventSubscription subscribe(@NotNull String batch);

    static String channelName(final String batch) {
        return "batch:" + batch;
    }
}
