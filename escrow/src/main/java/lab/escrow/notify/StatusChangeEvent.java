package lab.escrow.notify;

import java.time.Instant;

public record StatusChangeEvent(
        String requestId,
        StatusChangeType type,
        String txHash,
        Integer confirmations,
        Integer requiredConfirmations,
        Long blockHeight,
        String blockHash,
        String failureReason,
        Instant timestamp
) {

    public static StatusChangeEvent submitted(String requestId, String txHash, Instant timestamp) {
        return new StatusChangeEvent(requestId, StatusChangeType.SUBMITTED, txHash, 0, null, null, null, null, timestamp);
    }

    public static StatusChangeEvent progress(String requestId, String txHash, int confirmations, int required,
                                             Long blockHeight, String blockHash, Instant timestamp) {
        return new StatusChangeEvent(requestId, StatusChangeType.CONFIRMATION_PROGRESS, txHash,
                confirmations, required, blockHeight, blockHash, null, timestamp);
    }

    public static StatusChangeEvent confirmed(String requestId, String txHash, int confirmations,
                                              Long blockHeight, String blockHash, Instant timestamp) {
        return new StatusChangeEvent(requestId, StatusChangeType.CONFIRMED, txHash,
                confirmations, null, blockHeight, blockHash, null, timestamp);
    }

    public static StatusChangeEvent failed(String requestId, String txHash, String reason, Instant timestamp) {
        return new StatusChangeEvent(requestId, StatusChangeType.FAILED, txHash, null, null, null, null, reason, timestamp);
    }
}
