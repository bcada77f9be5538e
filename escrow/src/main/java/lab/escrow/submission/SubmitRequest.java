package lab.escrow.submission;

public record SubmitRequest(
        String mode,
        String priority,
        Boolean force
) {

    public SubmissionOptions toOptions() {
        return SubmissionOptions.builder()
                .mode(SubmissionMode.from(mode))
                .priority(SubmissionPriority.from(priority))
                .force(Boolean.TRUE.equals(force))
                .build();
    }
}
