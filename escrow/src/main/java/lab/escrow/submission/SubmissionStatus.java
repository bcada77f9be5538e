package lab.escrow.submission;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SubmissionStatus(
        @JsonProperty("isActive") boolean active,
        boolean hasRetryScheduled,
        int attempts,
        Instant nextRetryAt
) {

    public static final SubmissionStatus INACTIVE = new SubmissionStatus(false, false, 0, null);
}
