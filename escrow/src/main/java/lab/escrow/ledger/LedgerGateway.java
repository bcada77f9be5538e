package lab.escrow.ledger;

import java.util.Optional;

public interface LedgerGateway {

    /**
     * Broadcasts a fully signed transaction.
     *
     * @return the ledger-assigned transaction hash
     * @throws LedgerGatewayException when the ledger or transport rejects the body
     */
    String submitTransaction(String signedTxHex);

    /**
     * @return block placement of the transaction, or empty when the ledger does not know the hash yet
     */
    Optional<LedgerTxInfo> getTransactionInfo(String txHash);

    long getCurrentTipHeight();

    String getName();
}
