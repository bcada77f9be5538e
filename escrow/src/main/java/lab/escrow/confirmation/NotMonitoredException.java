package lab.escrow.confirmation;

public class NotMonitoredException extends RuntimeException {

    public NotMonitoredException(String txHash) {
        super("Transaction is not being monitored: " + txHash);
    }
}
