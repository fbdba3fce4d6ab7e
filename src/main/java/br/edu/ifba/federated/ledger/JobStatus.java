package br.edu.ifba.federated.ledger;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Ledger view of one job.
 *
 * @param file  document path
 * @param batch batch id
 * @param state current state, or null when the ledger has no entry
 * @param error failure text for {@link JobState#FAILED}
 */
public record JobStatus(
    @NotNull String file,
    @NotNull String batch,
    @Nullable JobState state,
    @Nullable String error
) {

    public JobStatus {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(batch, "batch must not be null");
    }

    static JobStatus fromStored(final String batch, final String file, @Nullable final String stored) {
        final JobState state = JobState.decode(stored);
        String error = null;
        if (state == JobState.FAILED && stored.length() > JobState.FAILED.name().length()) {
            error = stored.substring(JobState.FAILED.name().length()).replaceFirst("^:\\s*", "");
        }
        return new JobStatus(file, batch, state, error);
    }

    public boolean isKnown() {
        return state != null;
    }
}
