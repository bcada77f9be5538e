package lab.escrow.confirmation;

import lab.escrow.common.InvalidRequestException;

/**
 * Partial update; null fields keep their current value.
 */
public record MonitorConfigUpdate(
        Long checkIntervalMs,
        Integer requiredConfirmations,
        Long maxConfirmationTimeMs
) {

    static final long MIN_CHECK_INTERVAL_MS = 10_000;
    static final long MAX_CHECK_INTERVAL_MS = 300_000;
    static final int MIN_CONFIRMATIONS = 1;
    static final int MAX_CONFIRMATIONS = 10;
    static final long MIN_CONFIRMATION_TIME_MS = 3_600_000;

    void validate() {
        if (checkIntervalMs != null
                && (checkIntervalMs < MIN_CHECK_INTERVAL_MS || checkIntervalMs > MAX_CHECK_INTERVAL_MS)) {
            throw new InvalidRequestException("checkIntervalMs must be between 10000 and 300000");
        }
        if (requiredConfirmations != null
                && (requiredConfirmations < MIN_CONFIRMATIONS || requiredConfirmations > MAX_CONFIRMATIONS)) {
            throw new InvalidRequestException("requiredConfirmations must be between 1 and 10");
        }
        if (maxConfirmationTimeMs != null && maxConfirmationTimeMs < MIN_CONFIRMATION_TIME_MS) {
            throw new InvalidRequestException("maxConfirmationTimeMs must be at least 3600000 (1 hour)");
        }
    }
}
