package lab.escrow.submission;

import java.util.List;

public record BatchSubmitRequest(
        List<String> requestIds,
        String mode,
        Integer maxConcurrency
) {}
