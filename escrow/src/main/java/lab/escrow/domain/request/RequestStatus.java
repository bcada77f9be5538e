package lab.escrow.domain.request;

import java.util.EnumSet;
import java.util.Set;

public enum RequestStatus {
    REQUESTED,
    SIGNED,
    SUBMITTED,
    CONFIRMED,
    FAILED,
    EXPIRED;

    private static final Set<RequestStatus> TERMINAL = EnumSet.of(CONFIRMED, FAILED, EXPIRED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
