package lab.escrow.submission;

import lab.escrow.common.InvalidRequestException;
import lab.escrow.store.AuditEvent;
import lab.escrow.store.EscrowStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchSubmissionManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    @Mock TransactionSubmitter submitter;
    @Mock EscrowStore store;

    SubmissionProperties properties;
    BatchSubmissionManager manager;

    @BeforeEach
    void setUp() {
        properties = new SubmissionProperties();
        manager = new BatchSubmissionManager(submitter, store, properties);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private static SubmissionResult success(String requestId) {
        return SubmissionResult.succeeded("hash-" + requestId, 1, SubmissionMode.SERVER, NOW);
    }

    @Test
    void inFlightSubmissionsNeverExceedRequestedConcurrency() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(submitter.submit(anyString(), any())).thenAnswer(invocation -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            inFlight.decrementAndGet();
            return success(invocation.getArgument(0));
        });

        List<String> ids = List.of("r1", "r2", "r3", "r4", "r5", "r6");
        BatchSubmissionManager.BatchResult result = manager.submitBatch(ids, SubmissionOptions.defaults(), 2);

        assertThat(peak.get()).isBetween(1, 2);
        assertThat(result.maxConcurrency()).isEqualTo(2);
        assertThat(result.results().keySet()).containsExactlyElementsOf(ids);
        assertThat(result.summary()).isEqualTo(new BatchSubmissionManager.BatchSummary(6, 6, 0, 100));
        verify(submitter, times(6)).submit(anyString(), any());
    }

    @Test
    void itemFailuresAreReportedPerItem() {
        when(submitter.submit(eq("ok-1"), any())).thenReturn(success("ok-1"));
        when(submitter.submit(eq("dup-submitted"), any()))
                .thenThrow(new SubmissionConflictException("Request dup-submitted already submitted"));
        when(submitter.submit(eq("ledger-down"), any())).thenReturn(
                SubmissionResult.failed("503 unavailable", ErrorAnalysis.of(SubmissionErrorKind.SERVER_ERROR, 503),
                        3, SubmissionMode.SERVER));

        BatchSubmissionManager.BatchResult result = manager.submitBatch(
                List.of("ok-1", "dup-submitted", "ledger-down"), SubmissionOptions.defaults(), null);

        assertThat(result.results().get("ok-1").success()).isTrue();
        SubmissionResult rejected = result.results().get("dup-submitted");
        assertThat(rejected.success()).isFalse();
        assertThat(rejected.attempts()).isZero();
        assertThat(rejected.error()).contains("already submitted");
        assertThat(result.results().get("ledger-down").attempts()).isEqualTo(3);
        assertThat(result.summary()).isEqualTo(new BatchSubmissionManager.BatchSummary(3, 1, 2, 33));
        assertThat(result.maxConcurrency()).isEqualTo(3);
    }

    @Test
    void duplicateIdsAreSubmittedOnce() {
        when(submitter.submit(anyString(), any())).thenAnswer(invocation -> success(invocation.getArgument(0)));

        BatchSubmissionManager.BatchResult result = manager.submitBatch(
                List.of("r1", " r1 ", "r2"), SubmissionOptions.defaults(), 1);

        assertThat(result.results().keySet()).containsExactly("r1", "r2");
        verify(submitter, times(1)).submit(eq("r1"), any());
    }

    @Test
    void completedBatchIsAudited() {
        when(submitter.submit(anyString(), any())).thenAnswer(invocation -> success(invocation.getArgument(0)));

        manager.submitBatch(List.of("r1", "r2"), SubmissionOptions.of(SubmissionMode.WALLET), 2);

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(store).appendAuditLog(captor.capture());
        AuditEvent event = captor.getValue();
        assertThat(event.eventType()).isEqualTo("batch_submission_completed");
        assertThat(event.resourceType()).isEqualTo("batch");
        assertThat(event.details()).containsEntry("total", 2).containsEntry("successful", 2);
    }

    @Test
    void emptyOrOversizedBatch_isRejected() {
        assertThatThrownBy(() -> manager.submitBatch(List.of(), SubmissionOptions.defaults(), null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> manager.submitBatch(null, SubmissionOptions.defaults(), null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> manager.submitBatch(Collections.nCopies(11, "r1"), SubmissionOptions.defaults(), null))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("exceeds");

        verifyNoInteractions(submitter, store);
    }

    @Test
    void concurrencyIsClampedToConfiguredCeiling() {
        assertThat(manager.resolveConcurrency(null)).isEqualTo(3);
        assertThat(manager.resolveConcurrency(4)).isEqualTo(4);
        assertThat(manager.resolveConcurrency(50)).isEqualTo(5);
        assertThat(manager.resolveConcurrency(0)).isEqualTo(1);
    }
}
