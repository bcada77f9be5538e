package lab.escrow.store;

import lab.escrow.common.InvalidRequestException;
import lab.escrow.domain.audit.AuditLog;
import lab.escrow.domain.request.EscrowRequest;
import lab.escrow.domain.request.RequestStatus;
import lab.escrow.domain.transaction.TransactionRecord;
import lab.escrow.domain.transaction.TransactionRecordStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {
        "escrow.submission.base-delay=10ms",
        "escrow.submission.max-delay=20ms",
        "escrow.submission.queue.enabled=false",
        "escrow.confirmation.auto-start=false"
})
class EscrowStoreTest {

    @Autowired
    private EscrowStore store;

    private static String newRequestId() {
        return "store-" + UUID.randomUUID();
    }

    private static String newTxHash() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    @Test
    void requestStatusMovesOnlyFromExpectedStatus() {
        String requestId = newRequestId();
        store.saveRequest(EscrowRequest.signed(requestId, "owner-1", "{\"type\":\"sweep\"}", 1_000L));

        assertThat(store.updateRequestStatus(requestId, RequestStatus.SUBMITTED, RequestStatus.SIGNED)).isTrue();
        assertThat(store.updateRequestStatus(requestId, RequestStatus.FAILED, RequestStatus.SIGNED)).isFalse();
        assertThat(store.updateRequestStatus(requestId, RequestStatus.CONFIRMED, RequestStatus.SIGNED, RequestStatus.SUBMITTED)).isTrue();

        assertThat(store.getRequestById(requestId)).get()
                .extracting(EscrowRequest::getStatus)
                .isEqualTo(RequestStatus.CONFIRMED);
    }

    @Test
    void missingRequestIsNotUpdated() {
        assertThat(store.updateRequestStatus(newRequestId(), RequestStatus.FAILED, RequestStatus.SIGNED)).isFalse();
    }

    @Test
    void requestIdsAreTrimmedAndValidated() {
        String requestId = newRequestId();
        store.saveRequest(EscrowRequest.signed(requestId, "owner-1", "{}", 1_000L));

        assertThat(store.getRequestById("  " + requestId + " ")).isPresent();
        assertThatThrownBy(() -> store.getRequestById("../etc/passwd"))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> EscrowStore.canonicalRequestId(null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> EscrowStore.canonicalRequestId("x".repeat(101)))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void confirmedTransactionIsNeverMovedAgain() {
        String requestId = newRequestId();
        String txHash = newTxHash();
        Instant submittedAt = Instant.parse("2024-05-01T00:00:00Z");
        store.createTransactionRecord(requestId, txHash, "server", submittedAt);

        assertThat(store.updateTransactionProgress(txHash, 1, 98L, "blk", submittedAt.plusSeconds(20))).isTrue();
        assertThat(store.markTransactionConfirmed(txHash, 3, 98L, "blk", submittedAt.plusSeconds(20))).isTrue();

        assertThat(store.updateTransactionStatusByHash(txHash, TransactionRecordStatus.FAILED, "late timeout")).isFalse();
        assertThat(store.updateTransactionProgress(txHash, 1, 98L, "blk", submittedAt)).isFalse();
        assertThat(store.markTransactionConfirmed(txHash, 5, 98L, "blk", submittedAt)).isFalse();

        TransactionRecord record = store.getTransactionByHash(txHash).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(TransactionRecordStatus.CONFIRMED);
        assertThat(record.getConfirmations()).isEqualTo(3);
        assertThat(record.getBlockHeight()).isEqualTo(98L);
        assertThat(record.getConfirmedAt()).isNotNull();
        assertThat(record.getFailureReason()).isNull();
    }

    @Test
    void failedTransactionKeepsReasonAndLeavesPendingList() {
        String requestId = newRequestId();
        String txHash = newTxHash();
        store.createTransactionRecord(requestId, txHash, "wallet", Instant.parse("2024-05-01T00:00:00Z"));

        assertThat(store.listPendingTransactions()).extracting(TransactionRecord::getTxHash).contains(txHash);

        assertThat(store.updateTransactionStatusByHash(txHash, TransactionRecordStatus.FAILED, "Confirmation timeout exceeded")).isTrue();

        TransactionRecord record = store.getTransactionByRequestId(requestId).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(TransactionRecordStatus.FAILED);
        assertThat(record.getFailureReason()).isEqualTo("Confirmation timeout exceeded");
        assertThat(record.getSubmissionMode()).isEqualTo("wallet");
        assertThat(store.listPendingTransactions()).extracting(TransactionRecord::getTxHash).doesNotContain(txHash);
    }

    @Test
    void latestRecordWinsForRequest() {
        String requestId = newRequestId();
        store.createTransactionRecord(requestId, newTxHash(), "server", Instant.parse("2024-05-01T00:00:00Z"));
        String latest = newTxHash();
        store.createTransactionRecord(requestId, latest, "server", Instant.parse("2024-05-01T00:05:00Z"));

        assertThat(store.getTransactionByRequestId(requestId)).get()
                .extracting(TransactionRecord::getTxHash)
                .isEqualTo(latest);
    }

    @Test
    void auditTrailKeepsDetailsAsJson() {
        String requestId = newRequestId();
        store.appendAuditLog(AuditEvent.transaction("transaction_submission_started", requestId)
                .detail("mode", "server")
                .detail("tx_hash", null)
                .build());
        store.appendAuditLog(AuditEvent.transaction("transaction_submitted", requestId)
                .detail("attempts", 2)
                .build());

        List<AuditLog> trail = store.getAuditTrail(requestId);

        assertThat(trail).extracting(AuditLog::getEventType)
                .containsExactlyInAnyOrder("transaction_submission_started", "transaction_submitted");
        AuditLog started = trail.stream()
                .filter(log -> log.getEventType().equals("transaction_submission_started"))
                .findFirst()
                .orElseThrow();
        assertThat(started.getActor()).isEqualTo(AuditEvent.SYSTEM_ACTOR);
        assertThat(started.getResourceType()).isEqualTo("transaction");
        assertThat(started.getDetailsJson())
                .contains("\"request_id\":\"" + requestId + "\"")
                .contains("\"mode\":\"server\"")
                .contains("\"tx_hash\":null");
    }
}
