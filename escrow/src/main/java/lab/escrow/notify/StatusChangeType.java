package lab.escrow.notify;

public enum StatusChangeType {
    SUBMITTED,
    CONFIRMATION_PROGRESS,
    CONFIRMED,
    FAILED
}
