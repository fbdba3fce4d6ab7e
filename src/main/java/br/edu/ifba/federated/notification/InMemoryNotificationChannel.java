package br.edu.ifba.federated.notification;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process {@link NotificationChannel}. Keeps a copy of every published event for assertions.
 */
public class InMemoryNotificationChannel implements NotificationChannel {

    private final Map<String, Set<MemorySubscription>> subscribers = new ConcurrentHashMap<>();
    private final List<PublishedEvent> published = new CopyOnWriteArrayList<>();

    @Override
    public void publish(@NotNull final String batch, @NotNull final ProgressEvent event) {
        final String channel = NotificationChannel.channelName(batch);
        published.add(new PublishedEvent(channel, event));
        for (MemorySubscription subscription : subscribers.getOrDefault(channel, Set.of())) {
            subscription.offer(event);
        }
    }

    @Override
    @NotNull
    public EventSubscription subscribe(@NotNull final String batch) {
        final MemorySubscription subscription = new MemorySubscription(NotificationChannel.channelName(batch));
        subscribers.computeIfAbsent(subscription.channel(), k -> ConcurrentHashMap.newKeySet()).add(subscription);
        return subscription;
    }

    public List<PublishedEvent> published() {
        return List.copyOf(published);
    }

    public List<ProgressEvent> eventsFor(@NotNull final String batch) {
        final String channel = NotificationChannel.channelName(batch);
        final List<ProgressEvent> events = new ArrayList<>();
        for (PublishedEvent event : published) {
            if (event.channel().equals(channel)) {
                events.add(event.event());
            }
        }
        return events;
    }

    public record PublishedEvent(String channel, ProgressEvent event) {
    }

    private final class MemorySubscription extends QueuedSubscription {

        MemorySubscription(final String channel) {
            super(channel);
        }

        @Override
        protected void onClose() {
            final Set<MemorySubscription> current = subscribers.get(channel());
            if (current != null) {
                current.remove(this);
            }
        }
    }
}
