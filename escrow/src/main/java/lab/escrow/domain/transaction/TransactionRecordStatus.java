package lab.escrow.domain.transaction;

public enum TransactionRecordStatus {
    SUBMITTED,
    CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this != SUBMITTED;
    }
}
