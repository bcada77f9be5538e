package lab.escrow.submission;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ErrorSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
