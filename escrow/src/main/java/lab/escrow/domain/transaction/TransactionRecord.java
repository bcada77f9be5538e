package lab.escrow.domain.transaction;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "escrow_transactions",
       indexes = {
           @Index(name = "idx_tx_request", columnList = "requestId"),
           @Index(name = "idx_tx_hash", columnList = "txHash"),
           @Index(name = "idx_tx_status", columnList = "status"),
           @Index(name = "idx_tx_submitted_at", columnList = "submittedAt")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class TransactionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String requestId;

    @Column(length = 64)
    private String txHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionRecordStatus status;

    @Column(nullable = false, length = 16)
    private String submissionMode;

    @Column(nullable = false, updatable = false)
    private Instant submittedAt;

    @Column(nullable = false)
    private int confirmations;

    private Long blockHeight;

    @Column(length = 64)
    private String blockHash;

    private Instant blockTime;

    private Instant confirmedAt;

    @Column(length = 500)
    private String failureReason;

    @Column(nullable = false)
    private Instant updatedAt;

    public static TransactionRecord submitted(String requestId, String txHash, String submissionMode, Instant submittedAt) {
        return TransactionRecord.builder()
                .requestId(requestId)
                .txHash(txHash)
                .submissionMode(submissionMode)
                .submittedAt(submittedAt)
                .status(TransactionRecordStatus.SUBMITTED)
                .confirmations(0)
                .updatedAt(submittedAt)
                .build();
    }
}
