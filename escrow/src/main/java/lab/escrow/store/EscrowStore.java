package lab.escrow.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lab.escrow.common.InvalidRequestException;
import lab.escrow.domain.audit.AuditLog;
import lab.escrow.domain.audit.AuditLogRepository;
import lab.escrow.domain.presigned.PreSignedTransaction;
import lab.escrow.domain.presigned.PreSignedTransactionRepository;
import lab.escrow.domain.request.EscrowRequest;
import lab.escrow.domain.request.EscrowRequestRepository;
import lab.escrow.domain.request.RequestStatus;
import lab.escrow.domain.transaction.TransactionRecord;
import lab.escrow.domain.transaction.TransactionRecordRepository;
import lab.escrow.domain.transaction.TransactionRecordStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Durable state for the submission pipeline. Every status write is a compare-and-set on the
 * expected source status so a stale worker can never move a terminal row backwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowStore {

    private static final Pattern REQUEST_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,100}$");

    private final EscrowRequestRepository requestRepository;
    private final PreSignedTransactionRepository preSignedRepository;
    private final TransactionRecordRepository transactionRepository;
    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // Single key format for request ids. Callers never fall back to prefixed variants.
    public static String canonicalRequestId(String rawId) {
        if (rawId == null) {
            throw new InvalidRequestException("request id is required");
        }
        String trimmed = rawId.trim();
        if (!REQUEST_ID_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidRequestException("invalid request id: " + rawId);
        }
        return trimmed;
    }

    @Transactional(readOnly = true)
    public Optional<EscrowRequest> getRequestById(String requestId) {
        return requestRepository.findById(canonicalRequestId(requestId));
    }

    @Transactional
    public EscrowRequest saveRequest(EscrowRequest request) {
        return requestRepository.save(request);
    }

    // Returns false when the row is missing or no longer in one of the expected statuses.
    @Transactional
    public boolean updateRequestStatus(String requestId, RequestStatus next, RequestStatus... expected) {
        int updated = requestRepository.compareAndSetStatus(
                canonicalRequestId(requestId),
                Arrays.asList(expected),
                next,
                clock.instant()
        );
        if (updated == 0) {
            log.warn("event=escrow_store.request_status.cas_miss requestId={} next={} expected={}",
                    requestId, next, Arrays.toString(expected));
            return false;
        }
        log.info("event=escrow_store.request_status.updated requestId={} status={}", requestId, next);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<PreSignedTransaction> getPreSignedTransaction(String requestId) {
        return preSignedRepository.findFirstByRequestIdOrderBySignedAtDesc(canonicalRequestId(requestId));
    }

    @Transactional
    public PreSignedTransaction savePreSignedTransaction(PreSignedTransaction preSigned) {
        return preSignedRepository.save(preSigned);
    }

    @Transactional(readOnly = true)
    public Optional<TransactionRecord> getTransactionByRequestId(String requestId) {
        return transactionRepository.findFirstByRequestIdOrderBySubmittedAtDesc(canonicalRequestId(requestId));
    }

    @Transactional(readOnly = true)
    public Optional<TransactionRecord> getTransactionByHash(String txHash) {
        return transactionRepository.findFirstByTxHashOrderBySubmittedAtDesc(txHash);
    }

    @Transactional
    public TransactionRecord createTransactionRecord(String requestId, String txHash, String submissionMode, Instant submittedAt) {
        TransactionRecord saved = transactionRepository.save(
                TransactionRecord.submitted(canonicalRequestId(requestId), txHash, submissionMode, submittedAt));
        log.info("event=escrow_store.transaction.created requestId={} txHash={} recordId={}", requestId, txHash, saved.getId());
        return saved;
    }

    @Transactional
    public boolean updateTransactionStatusByHash(String txHash, TransactionRecordStatus status, String reason) {
        boolean updated = transactionRepository.compareAndSetStatus(txHash, status, reason, clock.instant()) > 0;
        if (!updated) {
            log.warn("event=escrow_store.transaction_status.cas_miss txHash={} next={}", txHash, status);
        }
        return updated;
    }

    @Transactional
    public boolean updateTransactionProgress(String txHash, int confirmations, Long blockHeight, String blockHash, Instant blockTime) {
        return transactionRepository.updateProgress(txHash, confirmations, blockHeight, blockHash, blockTime, clock.instant()) > 0;
    }

    @Transactional
    public boolean markTransactionConfirmed(String txHash, int confirmations, Long blockHeight, String blockHash, Instant blockTime) {
        boolean updated = transactionRepository.markConfirmed(txHash, confirmations, blockHeight, blockHash, blockTime, clock.instant()) > 0;
        if (!updated) {
            log.warn("event=escrow_store.transaction_confirm.cas_miss txHash={}", txHash);
        }
        return updated;
    }

    @Transactional(readOnly = true)
    public List<TransactionRecord> listPendingTransactions() {
        return transactionRepository.findByStatusAndTxHashIsNotNullOrderBySubmittedAtAsc(TransactionRecordStatus.SUBMITTED);
    }

    @Transactional(readOnly = true)
    public List<TransactionRecord> recentTransactions(int limit) {
        return transactionRepository.findAllByOrderBySubmittedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional
    public AuditLog appendAuditLog(AuditEvent event) {
        String actor = event.actor() == null ? AuditEvent.SYSTEM_ACTOR : event.actor();
        AuditLog saved = auditLogRepository.save(AuditLog.of(
                event.eventType(),
                event.resourceType(),
                event.resourceId(),
                actor,
                toJson(event),
                clock.instant()
        ));
        log.debug("event=escrow_store.audit.appended eventType={} resourceId={}", event.eventType(), event.resourceId());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<AuditLog> getAuditTrail(String resourceId) {
        return auditLogRepository.findByResourceIdOrderByCreatedAtAsc(resourceId);
    }

    private String toJson(AuditEvent event) {
        if (event.details() == null || event.details().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(event.details());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize audit details for " + event.eventType(), e);
        }
    }
}
