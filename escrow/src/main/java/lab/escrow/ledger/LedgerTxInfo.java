package lab.escrow.ledger;

import java.time.Instant;

public record LedgerTxInfo(
        String blockHash,
        long blockHeight,
        Instant blockTime
) {}
