package lab.escrow.confirmation;

import lab.escrow.domain.transaction.TransactionRecord;
import lab.escrow.domain.transaction.TransactionRecordStatus;

import java.time.Instant;

/**
 * Mutable per-hash monitor state. All access goes through the instance monitor.
 */
final class MonitoredTransaction {

    final String txHash;
    final String requestId;
    final Instant submittedAt;

    TransactionRecordStatus status = TransactionRecordStatus.SUBMITTED;
    int confirmations;
    Long blockHeight;
    String blockHash;
    Instant blockTime;
    int checkAttempts;
    int checkFailures;
    Instant lastCheckedAt;
    String lastError;

    MonitoredTransaction(String txHash, String requestId, Instant submittedAt) {
        this.txHash = txHash;
        this.requestId = requestId;
        this.submittedAt = submittedAt;
    }

    static MonitoredTransaction fromRecord(TransactionRecord record) {
        MonitoredTransaction tx = new MonitoredTransaction(record.getTxHash(), record.getRequestId(), record.getSubmittedAt());
        tx.confirmations = record.getConfirmations();
        tx.blockHeight = record.getBlockHeight();
        tx.blockHash = record.getBlockHash();
        tx.blockTime = record.getBlockTime();
        return tx;
    }

    synchronized MonitoredTransactionView view() {
        return new MonitoredTransactionView(txHash, requestId, status, confirmations, blockHeight, blockHash, blockTime,
                checkAttempts, checkFailures, submittedAt, lastCheckedAt, lastError);
    }
}
