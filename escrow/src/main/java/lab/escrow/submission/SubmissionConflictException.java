package lab.escrow.submission;

/**
 * The request already has a submission in flight, a live transaction, or a queued entry.
 */
public class SubmissionConflictException extends RuntimeException {

    public SubmissionConflictException(String message) {
        super(message);
    }
}
