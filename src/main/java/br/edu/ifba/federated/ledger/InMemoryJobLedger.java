package br.edu.ifba.federated.ledger;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link JobLedger} storing the same key/value strings as the Redis ledger.
 */
public class InMemoryJobLedger implements JobLedger {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public void markJob(
            @NotNull final String batch,
            @NotNull final String path,
            @NotNull final JobState state,
            @Nullable final String error) {
        entries.put(JobLedger.jobKey(batch, path), state.encode(error));
    }

    @Override
    @NotNull
    public JobStatus jobState(@NotNull final String batch, @NotNull final String path) {
        return JobStatus.fromStored(batch, path, entries.get(JobLedger.jobKey(batch, path)));
    }

    @Override
    @Nullable
    public HashState hashState(@NotNull final String hash) {
        return HashState.decode(entries.get(JobLedger.hashKey(hash)));
    }

    @Override
    public boolean reserveHash(@NotNull final String hash) {
        return entries.putIfAbsent(JobLedger.hashKey(hash), HashState.QUEUED.name()) == null;
    }

    @Override
    public void completeHash(@NotNull final String hash) {
        entries.put(JobLedger.hashKey(hash), HashState.COMPLETED.name());
    }

    @Override
    public void releaseHash(@NotNull final String hash) {
        entries.remove(JobLedger.hashKey(hash));
    }

    @Override
    public long clear() {
        final long before = entries.size();
        entries.keySet().removeIf(key -> key.startsWith(HASH_PREFIX) || key.startsWith(JOB_PREFIX));
        return before - entries.size();
    }

    /**
     * Raw stored value, for assertions.
     */
    @Nullable
    public String raw(@NotNull final String key) {
        return entries.get(key);
    }
}
