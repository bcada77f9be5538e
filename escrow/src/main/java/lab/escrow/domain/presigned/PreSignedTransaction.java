package lab.escrow.domain.presigned;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "escrow_presigned",
       indexes = {
           @Index(name = "idx_presigned_request", columnList = "requestId")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class PreSignedTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String requestId;

    // wallet provider that produced the witness (nami, eternl, ...)
    @Column(nullable = false, length = 50)
    private String providerId;

    // full signed transaction (body + witness set), hex encoded CBOR
    @Lob
    @Column(nullable = false)
    private String signedTxHex;

    @Column(nullable = false, length = 64)
    private String txHash;

    private Long feeLovelace;

    @Column(nullable = false, updatable = false)
    private Instant signedAt;

    public static PreSignedTransaction of(String requestId, String providerId, String signedTxHex, String txHash, Long feeLovelace) {
        return PreSignedTransaction.builder()
                .requestId(requestId)
                .providerId(providerId)
                .signedTxHex(signedTxHex)
                .txHash(txHash)
                .feeLovelace(feeLovelace)
                .signedAt(Instant.now())
                .build();
    }
}
