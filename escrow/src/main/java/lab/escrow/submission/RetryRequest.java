package lab.escrow.submission;

public record RetryRequest(
        String mode,
        Integer delaySeconds
) {}
