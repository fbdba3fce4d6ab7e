package br.edu.ifba.federated.ledger;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Authoritative record of per-file job state and per-content dedup state.
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li><code>job:{batch}:{path}</code> - PROCESSING, COMPLETED or "FAILED: message"</li>
 *   <li><code>hash:{contentHash}</code> - QUEUED or COMPLETED; absent after a failure</li>
 * </ul>
 *
 * <p>A COMPLETED hash means the content is indexed in both stores. A QUEUED hash means a
 * job is in flight and identical content must not be submitted again until it resolves.</p>
 */
public interface JobLedger {

    String JOB_PREFIX = "job:";
    String HASH_PREFIX = "hash:";

    void markJob(@NotNull String batch, @NotNull String path, @NotNull JobState state, @Nullable String error);

    default void markJob(@NotNull String batch, @NotNull String path, @NotNull JobState state) {
        markJob(batch, path, state, null);
    }

    @NotNull
    JobStatus jobState(@NotNull String batch, @NotNull String path);

    @Nullable
    HashState hashState(@NotNull String hash);

    /**
     * Atomically records the hash as QUEUED when it has no record yet.
     *
     * @return true when this call created the record
     */
    boolean reserveHash(@NotNull String hash);

    void completeHash(@NotNull String hash);

    /**
     * Deletes the hash record so the same content can be submitted again.
     */
    void releaseHash(@NotNull String hash);

    /**
     * Deletes every job and hash record.
     *
     * @return number of keys removed
     */
    long clear();

    static String jobKey(final String batch, final String path) {
        return JOB_PREFIX + batch + ":" + path;
    }

    static String hashKey(final String hash) {
        return HASH_PREFIX + hash;
    }
}
