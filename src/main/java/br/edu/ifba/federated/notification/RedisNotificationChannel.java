package br.edu.ifba.federated.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.JedisPubSub;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Redis pub/sub implementation of {@link NotificationChannel}.
 *
 * <p>Each subscription owns a daemon thread blocked in {@code SUBSCRIBE}; received
 * messages are decoded and queued for {@link EventSubscription#poll}.</p>
 */
@ApplicationScoped
public class RedisNotificationChannel implements NotificationChannel {

    private static final Logger logger = LoggerFactory.getLogger(RedisNotificationChannel.class);

    private static final long SUBSCRIBE_WAIT_MS = 2000;

    private final AtomicInteger threadCounter = new AtomicInteger();

    private final JedisPooled jedis;
    private final ObjectMapper objectMapper;

    @Inject
    public RedisNotificationChannel(final JedisPooled jedis, final ObjectMapper objectMapper) {
        this.jedis = Objects.requireNonNull(jedis, "jedis must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void publish(@NotNull final String batch, @NotNull final ProgressEvent event) {
        final String channel = NotificationChannel.channelName(batch);
        try {
            final long receivers = jedis.publish(channel, objectMapper.writeValueAsString(event));
            logger.debug("Published {} for {} on {} ({} receivers)", event.status(), event.file(), channel, receivers);
        } catch (JsonProcessingException | RuntimeException e) {
            logger.warn("Failed to publish progress on {}: {}", channel, e.getMessage());
        }
    }

    @Override
    @NotNull
    public EventSubscription subscribe(@NotNull final String batch) {
        final RedisSubscription subscription = new RedisSubscription(NotificationChannel.channelName(batch));
        final Thread listener = new Thread(subscription::listen,
            "notification-sub-" + threadCounter.incrementAndGet());
        listener.setDaemon(true);
        listener.start();
        subscription.awaitSubscribed();
        return subscription;
    }

    private final class RedisSubscription extends QueuedSubscription {

        private final CountDownLatch subscribed = new CountDownLatch(1);

        private final JedisPubSub pubSub = new JedisPubSub() {
            @Override
            public void onSubscribe(final String channel, final int subscribedChannels) {
                subscribed.countDown();
            }

            @Override
            public void onMessage(final String channel, final String message) {
                try {
                    offer(objectMapper.readValue(message, ProgressEvent.class));
                } catch (JsonProcessingException e) {
                    logger.warn("Dropping undecodable event on {}: {}", channel, e.getMessage());
                }
            }
        };

        RedisSubscription(final String channel) {
            super(channel);
        }

        void listen() {
            try {
                jedis.subscribe(pubSub, channel());
            } catch (RuntimeException e) {
                if (!isClosed()) {
                    logger.warn("Subscription to {} ended: {}", channel(), e.getMessage());
                }
            } finally {
                subscribed.countDown();
                close();
            }
        }

        void awaitSubscribed() {
            try {
                if (!subscribed.await(SUBSCRIBE_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    logger.warn("Subscription to {} not confirmed after {} ms", channel(), SUBSCRIBE_WAIT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        protected void onClose() {
            if (pubSub.isSubscribed()) {
                pubSub.unsubscribe();
            }
            logger.debug("Closed subscription to {}", channel());
        }
    }
}
