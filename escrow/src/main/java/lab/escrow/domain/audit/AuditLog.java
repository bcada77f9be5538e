package lab.escrow.domain.audit;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "escrow_audit_logs", indexes = {
        @Index(name = "idx_audit_resource", columnList = "resourceId"),
        @Index(name = "idx_audit_event_type", columnList = "eventType")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(updatable = false, length = 50)
    private String resourceType;

    @Column(updatable = false, length = 100)
    private String resourceId;

    @Column(nullable = false, updatable = false, length = 100)
    private String actor;

    @Lob
    @Column(updatable = false)
    private String detailsJson;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static AuditLog of(String eventType, String resourceType, String resourceId, String actor, String detailsJson, Instant createdAt) {
        return AuditLog.builder()
                .eventType(eventType)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .actor(actor)
                .detailsJson(detailsJson)
                .createdAt(createdAt)
                .build();
    }
}
