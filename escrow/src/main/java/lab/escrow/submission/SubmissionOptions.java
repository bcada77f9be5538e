package lab.escrow.submission;

import lombok.Builder;

import java.time.Duration;

/**
 * @param retryOnExhaustion schedule a delayed retry instead of failing the request when the
 *                          last failure was retryable
 * @param retryDelay        delay for that retry, null for the configured default
 */
@Builder(toBuilder = true)
public record SubmissionOptions(
        SubmissionMode mode,
        SubmissionPriority priority,
        boolean force,
        boolean retryOnExhaustion,
        Duration retryDelay
) {

    public SubmissionOptions {
        mode = mode == null ? SubmissionMode.SERVER : mode;
        priority = priority == null ? SubmissionPriority.NORMAL : priority;
    }

    public static SubmissionOptions defaults() {
        return SubmissionOptions.builder().build();
    }

    public static SubmissionOptions of(SubmissionMode mode) {
        return SubmissionOptions.builder().mode(mode).build();
    }
}
