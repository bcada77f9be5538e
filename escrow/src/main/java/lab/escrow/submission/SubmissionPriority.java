package lab.escrow.submission;

import com.fasterxml.jackson.annotation.JsonValue;
import lab.escrow.common.InvalidRequestException;

import java.util.Locale;

public enum SubmissionPriority {
    NORMAL,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SubmissionPriority from(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "normal" -> NORMAL;
            case "high" -> HIGH;
            default -> throw new InvalidRequestException("Unsupported priority '%s'. Allowed: normal, high".formatted(value));
        };
    }
}
