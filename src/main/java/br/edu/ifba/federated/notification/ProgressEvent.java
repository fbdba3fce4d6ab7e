package br.edu.ifba.federated.notification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One progress notification for a file of a batch, published as JSON on {@code batch:{id}}.
 *
 * @param file     document path
 * @param status   current status
 * @param progress completion percentage while processing chunks
 * @param message  human-readable step description
 * @param error    failure text, only for {@link ProgressStatus#FAILED}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgressEvent(
    @NotNull String file,
    @NotNull ProgressStatus status,
    @Nullable Integer progress,
    @Nullable String message,
    @Nullable String error
) {

    public ProgressEvent {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static ProgressEvent step(@NotNull final String file, @NotNull final String message) {
        return new ProgressEvent(file, ProgressStatus.PROCESSING, null, message, null);
    }

    /**
     * Chunk progress, {@code round(done / total * 100)}.
     */
    public static ProgressEvent chunk(@NotNull final String file, final int done, final int total) {
        final int percent = total <= 0 ? 100 : (int) Math.round(done * 100.0 / total);
        return new ProgressEvent(file, ProgressStatus.PROCESSING, percent,
            "Processing chunk " + done + "/" + total, null);
    }

    public static ProgressEvent skipped(@NotNull final String file) {
        return new ProgressEvent(file, ProgressStatus.SKIPPED, null, "Already processed.", null);
    }

    public static ProgressEvent completed(@NotNull final String file) {
        return new ProgressEvent(file, ProgressStatus.COMPLETED, 100, "Done", null);
    }

    public static ProgressEvent failed(@NotNull final String file, @Nullable final String error) {
        return new ProgressEvent(file, ProgressStatus.FAILED, null, null, error != null ? error : "unknown error");
    }
}
