package lab.escrow.submission;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ErrorAnalysis(
        @JsonProperty("errorType") SubmissionErrorKind kind,
        ErrorSeverity severity,
        String category,
        String issue,
        List<String> suggestions,
        @JsonProperty("isRetryable") boolean retryable,
        boolean rebuildRequired,
        Integer httpStatus
) {

    public static ErrorAnalysis of(SubmissionErrorKind kind, Integer httpStatus) {
        return new ErrorAnalysis(
                kind,
                kind.getSeverity(),
                kind.getCategory(),
                kind.getIssue(),
                kind.getSuggestions(),
                kind.isRetryable(),
                kind.isRebuildRequired(),
                httpStatus
        );
    }

    public boolean autoRetryable() {
        return kind.isAutoRetryable();
    }
}
