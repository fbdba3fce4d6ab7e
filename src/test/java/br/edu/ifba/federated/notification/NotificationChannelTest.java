package br.edu.ifba.federated.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationChannelTest {

    @Nested
    @DisplayName("Progress events")
    class Events {

        @Test
        @DisplayName("chunk progress should round the percentage")
        void chunkPercentage() {
            assertEquals(33, ProgressEvent.chunk("a.pdf", 1, 3).progress());
            assertEquals(67, ProgressEvent.chunk("a.pdf", 2, 3).progress());
            assertEquals("Processing chunk 2/3", ProgressEvent.chunk("a.pdf", 2, 3).message());
        }

        @Test
        @DisplayName("failed events always carry an error")
        void failedCarriesError() {
            assertEquals("unknown error", ProgressEvent.failed("a.pdf", null).error());
            assertEquals(ProgressStatus.FAILED, ProgressEvent.failed("a.pdf", "boom").status());
        }

        @Test
        @DisplayName("completed events report 100")
        void completed() {
            assertEquals(100, ProgressEvent.completed("a.pdf").progress());
            assertNull(ProgressEvent.skipped("a.pdf").progress());
        }
    }

    @Nested
    @DisplayName("In-memory channel")
    class InMemory {

        private InMemoryNotificationChannel channel;

        @BeforeEach
        void setUp() {
            channel = new InMemoryNotificationChannel();
        }

        @Test
        @DisplayName("subscribers receive only events published after subscribing")
        void liveOnly() {
            channel.publish("b1", ProgressEvent.step("a.pdf", "Started processing"));

            try (EventSubscription subscription = channel.subscribe("b1")) {
                channel.publish("b1", ProgressEvent.completed("a.pdf"));
                channel.publish("b2", ProgressEvent.completed("other.pdf"));

                final Optional<ProgressEvent> first = subscription.poll(Duration.ofMillis(100));
                assertTrue(first.isPresent());
                assertEquals(ProgressStatus.COMPLETED, first.get().status());
                assertFalse(subscription.poll(Duration.ofMillis(20)).isPresent());
            }
        }

        @Test
        @DisplayName("forEach stops when the client disconnects")
        void forEachStops() {
            final EventSubscription subscription = channel.subscribe("b1");
            channel.publish("b1", ProgressEvent.step("a.pdf", "Started processing"));
            channel.publish("b1", ProgressEvent.completed("a.pdf"));

            final List<ProgressEvent> received = new ArrayList<>();
            final int delivered = subscription.forEach(received::add, () -> received.size() >= 2);

            assertEquals(2, delivered);
            subscription.close();
            assertTrue(subscription.isClosed());
        }

        @Test
        @DisplayName("records events per batch channel")
        void recordsPerBatch() {
            channel.publish("b1", ProgressEvent.completed("a.pdf"));
            channel.publish("b2", ProgressEvent.completed("b.pdf"));

            assertEquals(1, channel.eventsFor("b1").size());
            assertEquals("batch:b2", channel.published().get(1).channel());
        }
    }

    @Nested
    @DisplayName("Redis channel")
    class Redis {

        private JedisPooled jedis;
        private RedisNotificationChannel channel;

        @BeforeEach
        void setUp() {
            jedis = mock(JedisPooled.class);
            channel = new RedisNotificationChannel(jedis, new ObjectMapper());
        }

        @Test
        @DisplayName("should publish the event as JSON on the batch channel")
        void publishesJson() {
            channel.publish("b1", ProgressEvent.failed("a.pdf", "boom"));

            final ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
            verify(jedis).publish(eq("batch:b1"), message.capture());
            assertTrue(message.getValue().contains("\"status\":\"FAILED\""));
            assertTrue(message.getValue().contains("\"error\":\"boom\""));
            assertFalse(message.getValue().contains("progress"));
        }

        @Test
        @DisplayName("should swallow publish failures")
        void publishFailure() {
            when(jedis.publish(anyString(), anyString())).thenThrow(new JedisConnectionException("down"));

            assertDoesNotThrow(() -> channel.publish("b1", ProgressEvent.completed("a.pdf")));
        }
    }
}
