package br.edu.ifba.federated.ledger;

import org.eclipse.microprofile.faulttolerance.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobLedgerTest {

    @Nested
    @DisplayName("Stored values")
    class StoredValues {

        @Test
        @DisplayName("should encode failures with their message")
        void encodeFailure() {
            assertEquals("FAILED: parse error", JobState.FAILED.encode("parse error"));
            assertEquals("FAILED", JobState.FAILED.encode(null));
            assertEquals("COMPLETED", JobState.COMPLETED.encode("ignored"));
        }

        @Test
        @DisplayName("should decode known values and reject others")
        void decode() {
            assertEquals(JobState.FAILED, JobState.decode("FAILED: boom"));
            assertEquals(JobState.PROCESSING, JobState.decode("PROCESSING"));
            assertNull(JobState.decode("WHATEVER"));
            assertNull(HashState.decode(null));
            assertEquals(HashState.QUEUED, HashState.decode("QUEUED"));
        }
    }

    @Nested
    @DisplayName("In-memory ledger")
    class InMemory {

        private InMemoryJobLedger ledger;

        @BeforeEach
        void setUp() {
            ledger = new InMemoryJobLedger();
        }

        @Test
        @DisplayName("should report an unknown job for a missing entry")
        void unknownJob() {
            final JobStatus status = ledger.jobState("b1", "/tmp/a.pdf");

            assertFalse(status.isKnown());
            assertEquals("/tmp/a.pdf", status.file());
        }

        @Test
        @DisplayName("should store the failure text with the job")
        void failureText() {
            ledger.markJob("b1", "/tmp/a.pdf", JobState.FAILED, "Document is empty");

            final JobStatus status = ledger.jobState("b1", "/tmp/a.pdf");
            assertEquals(JobState.FAILED, status.state());
            assertEquals("Document is empty", status.error());
            assertEquals("FAILED: Document is empty", ledger.raw("job:b1:/tmp/a.pdf"));
        }

        @Test
        @DisplayName("should reserve a hash only once until it is released")
        void reserveOnce() {
            assertTrue(ledger.reserveHash("abc"));
            assertFalse(ledger.reserveHash("abc"));
            assertEquals(HashState.QUEUED, ledger.hashState("abc"));

            ledger.releaseHash("abc");

            assertNull(ledger.hashState("abc"));
            assertTrue(ledger.reserveHash("abc"));
        }

        @Test
        @DisplayName("should keep a completed hash reserved")
        void completedStaysReserved() {
            ledger.reserveHash("abc");
            ledger.completeHash("abc");

            assertEquals(HashState.COMPLETED, ledger.hashState("abc"));
            assertFalse(ledger.reserveHash("abc"));
        }

        @Test
        @DisplayName("clear should remove jobs and hashes")
        void clear() {
            ledger.reserveHash("abc");
            ledger.markJob("b1", "/tmp/a.pdf", JobState.COMPLETED);

            assertEquals(2, ledger.clear());
            assertFalse(ledger.jobState("b1", "/tmp/a.pdf").isKnown());
        }
    }

    @Nested
    @DisplayName("Redis ledger")
    class Redis {

        private JedisPooled jedis;
        private RedisJobLedger ledger;

        @BeforeEach
        void setUp() {
            jedis = mock(JedisPooled.class);
            ledger = new RedisJobLedger(jedis);
        }

        @Test
        @DisplayName("should reserve with SETNX")
        void reserveWithSetnx() {
            when(jedis.setnx("hash:abc", "QUEUED")).thenReturn(1L, 0L);

            assertTrue(ledger.reserveHash("abc"));
            assertFalse(ledger.reserveHash("abc"));
        }

        @Test
        @DisplayName("should surface a lost SETNX reply instead of reporting a duplicate")
        void reserveIsNotRetried() throws NoSuchMethodException {
            when(jedis.setnx("hash:abc", "QUEUED"))
                .thenThrow(new JedisConnectionException("Unexpected end of stream."))
                .thenReturn(0L);

            assertThrows(JedisConnectionException.class, () -> ledger.reserveHash("abc"));

            final Retry retry = RedisJobLedger.class.getMethod("reserveHash", String.class).getAnnotation(Retry.class);
            assertNotNull(retry);
            assertEquals(0, retry.maxRetries());
            assertTrue(RedisJobLedger.class.getAnnotation(Retry.class).maxRetries() > 0);
        }

        @Test
        @DisplayName("should write job state under the job key")
        void markJob() {
            ledger.markJob("b1", "/tmp/a.pdf", JobState.FAILED, "boom");

            verify(jedis).set("job:b1:/tmp/a.pdf", "FAILED: boom");
        }

        @Test
        @DisplayName("should read job state back")
        void readJob() {
            when(jedis.get("job:b1:/tmp/a.pdf")).thenReturn("COMPLETED");

            assertEquals(JobState.COMPLETED, ledger.jobState("b1", "/tmp/a.pdf").state());
        }

        @Test
        @DisplayName("clear should scan and delete both key families")
        void clearScans() {
            when(jedis.scan(anyString(), any(ScanParams.class))).thenReturn(
                new ScanResult<>(ScanParams.SCAN_POINTER_START, List.of("hash:abc")),
                new ScanResult<>(ScanParams.SCAN_POINTER_START, List.of("job:b1:/tmp/a.pdf")));
            when(jedis.del(new String[]{"hash:abc"})).thenReturn(1L);
            when(jedis.del(new String[]{"job:b1:/tmp/a.pdf"})).thenReturn(1L);

            assertEquals(2, ledger.clear());
        }
    }
}
