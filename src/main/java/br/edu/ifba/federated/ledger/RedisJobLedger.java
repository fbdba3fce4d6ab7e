package br.edu.ifba.federated.ledger;

import br.edu.ifba.federated.shared.TransientFailurePredicate;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Redis implementation of {@link JobLedger}.
 */
@ApplicationScoped
@Retry(maxRetries = 2, delay = 200, delayUnit = ChronoUnit.MILLIS)
@ExponentialBackoff(maxDelay = 2, maxDelayUnit = ChronoUnit.SECONDS)
@RetryWhen(exception = TransientFailurePredicate.class)
public class RedisJobLedger implements JobLedger {

    private static final Logger logger = LoggerFactory.getLogger(RedisJobLedger.class);

    private static final int SCAN_BATCH = 500;

    private final JedisPooled jedis;

    @Inject
    public RedisJobLedger(final JedisPooled jedis) {
        this.jedis = Objects.requireNonNull(jedis, "jedis must not be null");
    }

    @Override
    public void markJob(
            @NotNull final String batch,
            @NotNull final String path,
            @NotNull final JobState state,
            @Nullable final String error) {
        jedis.set(JobLedger.jobKey(batch, path), state.encode(error));
        logger.debug("Job {}:{} -> {}", batch, path, state);
    }

    @Override
    @NotNull
    public JobStatus jobState(@NotNull final String batch, @NotNull final String path) {
        return JobStatus.fromStored(batch, path, jedis.get(JobLedger.jobKey(batch, path)));
    }

    @Override
    @Nullable
    public HashState hashState(@NotNull final String hash) {
        return HashState.decode(jedis.get(JobLedger.hashKey(hash)));
    }

    /**
     * Attempted once. A retried SETNX cannot tell its own earlier write from a duplicate.
     */
    @Override
    @Retry(maxRetries = 0)
    public boolean reserveHash(@NotNull final String hash) {
        return jedis.setnx(JobLedger.hashKey(hash), HashState.QUEUED.name()) == 1L;
    }

    @Override
    public void completeHash(@NotNull final String hash) {
        jedis.set(JobLedger.hashKey(hash), HashState.COMPLETED.name());
    }

    @Override
    public void releaseHash(@NotNull final String hash) {
        jedis.del(JobLedger.hashKey(hash));
        logger.info("Released dedup lock for hash {}", hash);
    }

    @Override
    public long clear() {
        final long removed = deleteMatching(HASH_PREFIX + "*") + deleteMatching(JOB_PREFIX + "*");
        logger.info("Cleared {} ledger keys", removed);
        return removed;
    }

    private long deleteMatching(final String pattern) {
        final ScanParams params = new ScanParams().match(pattern).count(SCAN_BATCH);
        String cursor = ScanParams.SCAN_POINTER_START;
        long removed = 0;
        do {
            final ScanResult<String> page = jedis.scan(cursor, params);
            final List<String> keys = page.getResult();
            if (!keys.isEmpty()) {
                removed += jedis.del(keys.toArray(new String[0]));
            }
            cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        return removed;
    }
}
