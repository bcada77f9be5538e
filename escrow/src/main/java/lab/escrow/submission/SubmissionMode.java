package lab.escrow.submission;

import com.fasterxml.jackson.annotation.JsonValue;
import lab.escrow.common.InvalidRequestException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum SubmissionMode {
    SERVER,
    WALLET;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SubmissionMode from(String value) {
        if (value == null || value.isBlank()) {
            return SERVER;
        }
        return Arrays.stream(values())
                .filter(mode -> mode.wireName().equals(value.trim().toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new InvalidRequestException(
                        "Unsupported submission mode '%s'. Allowed modes: %s".formatted(value, String.join(", ", wireNames()))));
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(SubmissionMode::wireName).toList();
    }
}
