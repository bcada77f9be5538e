package lab.escrow.confirmation;

public record MonitorConfig(
        long checkIntervalMs,
        int requiredConfirmations,
        long maxConfirmationTimeMs,
        int maxRetries,
        int batchSize,
        long batchPauseMs,
        long notFoundGraceMs
) {

    public static MonitorConfig from(ConfirmationProperties properties) {
        return new MonitorConfig(
                properties.getCheckInterval().toMillis(),
                properties.getRequiredConfirmations(),
                properties.getMaxConfirmationTime().toMillis(),
                properties.getMaxRetries(),
                Math.max(1, properties.getBatchSize()),
                properties.getBatchPause().toMillis(),
                properties.getNotFoundGrace().toMillis()
        );
    }

    MonitorConfig apply(MonitorConfigUpdate update) {
        return new MonitorConfig(
                update.checkIntervalMs() != null ? update.checkIntervalMs() : checkIntervalMs,
                update.requiredConfirmations() != null ? update.requiredConfirmations() : requiredConfirmations,
                update.maxConfirmationTimeMs() != null ? update.maxConfirmationTimeMs() : maxConfirmationTimeMs,
                maxRetries,
                batchSize,
                batchPauseMs,
                notFoundGraceMs
        );
    }

    int maxCheckFailures() {
        return maxRetries * 5;
    }
}
