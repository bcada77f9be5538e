package lab.escrow.confirmation;

import lab.escrow.domain.transaction.TransactionRecordStatus;

import java.time.Instant;

public record MonitoredTransactionView(
        String txHash,
        String requestId,
        TransactionRecordStatus status,
        int confirmations,
        Long blockHeight,
        String blockHash,
        Instant blockTime,
        int checkAttempts,
        int checkFailures,
        Instant submittedAt,
        Instant lastCheckedAt,
        String lastError
) {}
