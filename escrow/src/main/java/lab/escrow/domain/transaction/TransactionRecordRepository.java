package lab.escrow.domain.transaction;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TransactionRecordRepository extends JpaRepository<TransactionRecord, UUID> {

    Optional<TransactionRecord> findFirstByRequestIdOrderBySubmittedAtDesc(String requestId);

    Optional<TransactionRecord> findFirstByTxHashOrderBySubmittedAtDesc(String txHash);

    List<TransactionRecord> findByStatusAndTxHashIsNotNullOrderBySubmittedAtAsc(TransactionRecordStatus status);

    List<TransactionRecord> findAllByOrderBySubmittedAtDesc(Pageable pageable);

    // Terminal rows are never touched again: every write below is guarded by status = SUBMITTED.

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update TransactionRecord t set t.status = :next, t.failureReason = :reason, t.updatedAt = :now "
            + "where t.txHash = :txHash and t.status = lab.escrow.domain.transaction.TransactionRecordStatus.SUBMITTED")
    int compareAndSetStatus(@Param("txHash") String txHash,
                            @Param("next") TransactionRecordStatus next,
                            @Param("reason") String reason,
                            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update TransactionRecord t set t.confirmations = :confirmations, t.blockHeight = :blockHeight, "
            + "t.blockHash = :blockHash, t.blockTime = :blockTime, t.updatedAt = :now "
            + "where t.txHash = :txHash and t.status = lab.escrow.domain.transaction.TransactionRecordStatus.SUBMITTED")
    int updateProgress(@Param("txHash") String txHash,
                       @Param("confirmations") int confirmations,
                       @Param("blockHeight") Long blockHeight,
                       @Param("blockHash") String blockHash,
                       @Param("blockTime") Instant blockTime,
                       @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update TransactionRecord t set t.status = lab.escrow.domain.transaction.TransactionRecordStatus.CONFIRMED, "
            + "t.confirmations = :confirmations, t.blockHeight = :blockHeight, t.blockHash = :blockHash, "
            + "t.blockTime = :blockTime, t.confirmedAt = :now, t.updatedAt = :now "
            + "where t.txHash = :txHash and t.status = lab.escrow.domain.transaction.TransactionRecordStatus.SUBMITTED")
    int markConfirmed(@Param("txHash") String txHash,
                      @Param("confirmations") int confirmations,
                      @Param("blockHeight") Long blockHeight,
                      @Param("blockHash") String blockHash,
                      @Param("blockTime") Instant blockTime,
                      @Param("now") Instant now);
}
