package br.edu.ifba.federated.ledger;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Lifecycle of one file inside one batch.
 */
public enum JobState {
    PROCESSING,
    COMPLETED,
    FAILED;

    private static final String FAILED_PREFIX = "FAILED";

    /**
     * Value written under {@code job:{batch}:{path}}. Failures carry the error text
     * as {@code FAILED: <message>}.
     */
    @NotNull
    public String encode(@Nullable final String error) {
        if (this == FAILED && error != null && !error.isBlank()) {
            return FAILED_PREFIX + ": " + error;
        }
        return name();
    }

    /**
     * @return the state, or null for an unknown value
     */
    @Nullable
    public static JobState decode(@Nullable final String stored) {
        if (stored == null) {
            return null;
        }
        if (stored.startsWith(FAILED_PREFIX)) {
            return FAILED;
        }
        for (JobState state : values()) {
            if (state.name().equals(stored)) {
                return state;
            }
        }
        return null;
    }
}
