package lab.escrow.domain.request;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "escrow_requests",
       indexes = {
           @Index(name = "idx_request_status", columnList = "status"),
           @Index(name = "idx_request_ttl_slot", columnList = "ttlSlot")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class EscrowRequest {

    @Id
    @Column(length = 100)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RequestStatus status;

    @Column(nullable = false, length = 100)
    private String owner;

    // fixed / sweep / rate_based rule, kept opaque here
    @Lob
    @Column(nullable = false)
    private String amountRuleJson;

    // ledger slot after which the pre-signed body is no longer valid
    @Column(nullable = false)
    private long ttlSlot;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static EscrowRequest signed(String id, String owner, String amountRuleJson, long ttlSlot) {
        Instant now = Instant.now();
        return EscrowRequest.builder()
                .id(id)
                .owner(owner)
                .amountRuleJson(amountRuleJson)
                .ttlSlot(ttlSlot)
                .status(RequestStatus.SIGNED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
