package br.edu.ifba.federated.shared;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TransientFailurePredicate}.
 */
class TransientFailurePredicateTest {

    private TransientFailurePredicate predicate;

    @BeforeEach
    void setUp() {
        predicate = new TransientFailurePredicate();
    }

    @Nested
    @DisplayName("Transient failures")
    class Transient {

        @Test
        @DisplayName("should retry I/O failures")
        void ioFailures() {
            assertTrue(predicate.test(new ConnectException("refused")));
            assertTrue(predicate.test(new SocketTimeoutException("timeout")));
            assertTrue(predicate.test(new IOException("stream closed")));
        }

        @Test
        @DisplayName("should retry REST transport failures")
        void restTransport() {
            assertTrue(predicate.test(new ProcessingException("transport failure")));
        }

        @Test
        @DisplayName("should retry 429 and 5xx responses")
        void retryableStatuses() {
            assertTrue(predicate.test(new WebApplicationException(429)));
            assertTrue(predicate.test(new WebApplicationException(503)));
            assertTrue(predicate.test(new ModelCallException("overloaded", 502)));
        }

        @Test
        @DisplayName("should retry Redis connection failures")
        void redisConnection() {
            assertTrue(predicate.test(new JedisConnectionException("Could not get a resource from the pool")));
        }

        @Test
        @DisplayName("should find a transient cause inside wrappers")
        void walksCauseChain() {
            assertTrue(predicate.test(new CompletionException(new RuntimeException(new ConnectException("x")))));
        }

        @Test
        @DisplayName("should recognise transient messages")
        void transientMessages() {
            assertTrue(predicate.test(new RuntimeException("Connection reset by peer")));
            assertTrue(predicate.test(new IllegalStateException("Service temporarily unavailable")));
        }
    }

    @Nested
    @DisplayName("Permanent failures")
    class Permanent {

        @Test
        @DisplayName("should not retry malformed model responses")
        void malformed() {
            assertFalse(predicate.test(new MalformedModelResponseException("not json")));
            assertFalse(predicate.test(new CompletionException(new MalformedModelResponseException("not json"))));
        }

        @Test
        @DisplayName("should not retry client errors")
        void clientErrors() {
            assertFalse(predicate.test(new WebApplicationException(400)));
            assertFalse(predicate.test(new WebApplicationException(401)));
            assertFalse(predicate.test(new ModelCallException("bad key", 401)));
        }

        @Test
        @DisplayName("should not retry validation or null")
        void others() {
            assertFalse(predicate.test(new IllegalArgumentException("query must not be blank")));
            assertFalse(predicate.test(null));
        }
    }
}
