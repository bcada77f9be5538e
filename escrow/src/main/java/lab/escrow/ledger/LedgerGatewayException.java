package lab.escrow.ledger;

import lombok.Getter;

/**
 * Failure reported by the ledger service or the transport in front of it.
 * {@code httpStatus} is 0 when no HTTP response was received.
 */
@Getter
public class LedgerGatewayException extends RuntimeException {

    private final int httpStatus;

    public LedgerGatewayException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public LedgerGatewayException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }
}
