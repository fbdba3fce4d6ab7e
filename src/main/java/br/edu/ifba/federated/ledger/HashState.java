package br.edu.ifba.federated.ledger;

import org.jetbrains.annotations.Nullable;

/**
 * Dedup state of one content hash. An absent record means the content may be submitted.
 */
public enum HashState {
    QUEUED,
    COMPLETED;

    @Nullable
    public static HashState decode(@Nullable final String stored) {
        if (stored == null) {
            return null;
        }
        for (HashState state : values()) {
            if (state.name().equals(stored)) {
                return state;
            }
        }
        return null;
    }
}
