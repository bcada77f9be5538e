package lab.escrow.store;

import lombok.Builder;
import lombok.Singular;

import java.util.Map;

/**
 * One append-only audit entry. {@code details} keeps insertion order and may hold null values.
 */
@Builder
public record AuditEvent(
        String eventType,
        String resourceType,
        String resourceId,
        String actor,
        @Singular("detail") Map<String, Object> details
) {

    public static final String SYSTEM_ACTOR = "system";

    public static AuditEventBuilder transaction(String eventType, String requestId) {
        return AuditEvent.builder()
                .eventType(eventType)
                .resourceType("transaction")
                .resourceId(requestId)
                .actor(SYSTEM_ACTOR)
                .detail("request_id", requestId);
    }
}
