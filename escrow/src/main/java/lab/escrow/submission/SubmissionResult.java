package lab.escrow.submission;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmissionResult(
        boolean success,
        String txHash,
        String error,
        ErrorAnalysis errorAnalysis,
        int attempts,
        SubmissionMode mode,
        Instant submittedAt,
        boolean discarded,
        Instant nextRetryAt
) {

    public static SubmissionResult succeeded(String txHash, int attempts, SubmissionMode mode, Instant submittedAt) {
        return new SubmissionResult(true, txHash, null, null, attempts, mode, submittedAt, false, null);
    }

    public static SubmissionResult failed(String error, ErrorAnalysis analysis, int attempts, SubmissionMode mode) {
        return new SubmissionResult(false, null, error, analysis, attempts, mode, null, false, null);
    }

    public static SubmissionResult retryScheduled(String error, ErrorAnalysis analysis, int attempts,
                                                  SubmissionMode mode, Instant nextRetryAt) {
        return new SubmissionResult(false, null, error, analysis, attempts, mode, null, false, nextRetryAt);
    }

    public static SubmissionResult discarded(String txHash, int attempts, SubmissionMode mode) {
        return new SubmissionResult(false, txHash, "Submission cancelled", null, attempts, mode, null, true, null);
    }

    public boolean retryPending() {
        return nextRetryAt != null;
    }
}
