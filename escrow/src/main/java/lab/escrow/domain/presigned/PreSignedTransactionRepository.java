package lab.escrow.domain.presigned;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface PreSignedTransactionRepository extends JpaRepository<PreSignedTransaction, UUID> {
    Optional<PreSignedTransaction> findFirstByRequestIdOrderBySignedAtDesc(String requestId);
}
