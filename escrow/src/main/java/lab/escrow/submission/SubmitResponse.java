package lab.escrow.submission;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmitResponse(
        boolean success,
        String txHash,
        String message,
        int attempts,
        SubmissionMode mode,
        Instant submittedAt,
        String error,
        ErrorAnalysis errorAnalysis,
        Instant nextRetryAt
) {

    static SubmitResponse from(SubmissionResult result) {
        String message;
        if (result.success()) {
            message = "Transaction submitted successfully";
        } else if (result.retryPending()) {
            message = "Submission failed, retry scheduled";
        } else if (result.discarded()) {
            message = "Submission was cancelled";
        } else {
            message = "Submission failed";
        }
        return new SubmitResponse(
                result.success(),
                result.txHash(),
                message,
                result.attempts(),
                result.mode(),
                result.submittedAt(),
                result.error(),
                result.errorAnalysis(),
                result.nextRetryAt()
        );
    }
}
