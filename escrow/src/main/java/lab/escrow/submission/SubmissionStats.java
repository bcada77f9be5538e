package lab.escrow.submission;

public record SubmissionStats(
        int activeSubmissions,
        int scheduledRetries,
        long totalSubmitted,
        long totalFailed,
        long totalCancelled,
        long totalAttempts,
        int maxAttempts
) {}
