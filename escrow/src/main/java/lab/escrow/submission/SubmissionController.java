package lab.escrow.submission;

import lab.escrow.common.InvalidRequestException;
import lab.escrow.domain.request.EscrowRequest;
import lab.escrow.domain.request.RequestStatus;
import lab.escrow.domain.transaction.TransactionRecord;
import lab.escrow.store.AuditEvent;
import lab.escrow.store.EscrowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/submit")
public class SubmissionController {

    private static final int RECENT_SUBMISSIONS = 10;
    private static final int MAX_RETRY_DELAY_SECONDS = 3600;

    private final TransactionSubmitter submitter;
    private final SubmissionQueue queue;
    private final SubmissionQueueWorker queueWorker;
    private final BatchSubmissionManager batchManager;
    private final EscrowStore store;
    private final SubmissionProperties properties;

    @PostMapping("/{id}")
    public ResponseEntity<SubmitResponse> submit(@PathVariable String id,
                                                 @RequestBody(required = false) SubmitRequest body) {
        SubmissionOptions options = body == null ? SubmissionOptions.defaults() : body.toOptions();
        log.info("event=submit.request requestId={} mode={} priority={} force={}",
                id, options.mode().wireName(), options.priority().wireName(), options.force());
        SubmissionResult result = submitter.submit(id, options);
        log.info("event=submit.response requestId={} success={} attempts={}", id, result.success(), result.attempts());
        return ResponseEntity.status(statusOf(result)).body(SubmitResponse.from(result));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchSubmissionManager.BatchResult> submitBatch(@RequestBody BatchSubmitRequest body) {
        Integer maxConcurrency = body.maxConcurrency();
        int ceiling = properties.getBatch().getMaxConcurrency();
        if (maxConcurrency != null && (maxConcurrency < 1 || maxConcurrency > ceiling)) {
            throw new InvalidRequestException("maxConcurrency must be between 1 and " + ceiling);
        }
        log.info("event=submit.batch.request size={} maxConcurrency={}",
                body.requestIds() == null ? 0 : body.requestIds().size(), maxConcurrency);
        BatchSubmissionManager.BatchResult result = batchManager.submitBatch(
                body.requestIds(),
                SubmissionOptions.of(SubmissionMode.from(body.mode())),
                maxConcurrency
        );
        return ResponseEntity.ok(result);
    }

    @PostMapping("/queue/{id}")
    public ResponseEntity<QueueResponse> enqueue(@PathVariable String id,
                                                 @RequestBody(required = false) SubmitRequest body) {
        SubmissionOptions options = body == null ? SubmissionOptions.defaults() : body.toOptions();
        EscrowRequest request = store.getRequestById(id)
                .orElseThrow(() -> new InvalidRequestException("Request not found: " + id));
        if (request.getStatus() != RequestStatus.SIGNED && !options.force()) {
            throw new InvalidRequestException("Request " + id + " must be SIGNED to queue (current status: " + request.getStatus() + ")");
        }

        int position = queue.enqueue(request.getId(), options, options.priority());
        store.appendAuditLog(AuditEvent.transaction("transaction_queued", request.getId())
                .detail("mode", options.mode().wireName())
                .detail("priority", options.priority().wireName())
                .detail("queue_position", position)
                .build());
        return ResponseEntity.ok(new QueueResponse(true, "Transaction queued for submission", position));
    }

    @GetMapping("/status/{id}")
    public ResponseEntity<StatusResponse> status(@PathVariable String id) {
        String requestId = EscrowStore.canonicalRequestId(id);
        TransactionRecord record = store.getTransactionByRequestId(requestId).orElse(null);
        return ResponseEntity.ok(new StatusResponse(
                requestId,
                submitter.getSubmissionStatus(requestId),
                record,
                queue.positionOf(requestId).orElse(null),
                queue.getStatus()
        ));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<CancelResponse> cancel(@PathVariable String id) {
        String requestId = EscrowStore.canonicalRequestId(id);
        boolean dequeued = queue.remove(requestId);
        boolean cancelled = submitter.cancelSubmission(requestId);
        if (dequeued) {
            store.appendAuditLog(AuditEvent.transaction("transaction_dequeued", requestId).build());
        }
        boolean any = dequeued || cancelled;
        log.info("event=submit.cancel requestId={} dequeued={} cancelled={}", requestId, dequeued, cancelled);
        return ResponseEntity.ok(new CancelResponse(any,
                any ? "Submission cancelled" : "No active, scheduled or queued submission found"));
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(new StatsResponse(
                submitter.getStats(),
                queue.getStatus(),
                queueWorker.isProcessing(),
                store.recentTransactions(RECENT_SUBMISSIONS)
        ));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<RetryResponse> retry(@PathVariable String id,
                                               @RequestBody(required = false) RetryRequest body) {
        int delaySeconds = body == null || body.delaySeconds() == null ? 0 : body.delaySeconds();
        if (delaySeconds < 0 || delaySeconds > MAX_RETRY_DELAY_SECONDS) {
            throw new InvalidRequestException("delaySeconds must be between 0 and " + MAX_RETRY_DELAY_SECONDS);
        }
        SubmissionMode mode = SubmissionMode.from(body == null ? null : body.mode());
        EscrowRequest request = store.getRequestById(id)
                .orElseThrow(() -> new InvalidRequestException("Request not found: " + id));
        if (request.getStatus() != RequestStatus.SIGNED && request.getStatus() != RequestStatus.FAILED) {
            throw new InvalidRequestException("Only SIGNED or FAILED requests can be retried (current status: " + request.getStatus() + ")");
        }
        // a FAILED request has to bypass the SIGNED precondition
        SubmissionOptions options = SubmissionOptions.builder()
                .mode(mode)
                .force(request.getStatus() == RequestStatus.FAILED)
                .build();

        if (delaySeconds > 0) {
            Instant retryAt = submitter.scheduleRetry(request.getId(), Duration.ofSeconds(delaySeconds), options);
            return ResponseEntity.ok(new RetryResponse(true, "Retry scheduled in " + delaySeconds + " seconds", retryAt, null));
        }

        SubmissionResult result = submitter.submit(request.getId(), options);
        store.appendAuditLog(AuditEvent.transaction("submission_immediate_retry", request.getId())
                .detail("mode", mode.wireName())
                .detail("success", result.success())
                .detail("tx_hash", result.txHash())
                .build());
        if (!result.success()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new RetryResponse(false, "Retry failed: " + result.error(), null, null));
        }
        return ResponseEntity.ok(new RetryResponse(true, "Retry successful", null, result.txHash()));
    }

    private HttpStatus statusOf(SubmissionResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        if (result.retryPending()) {
            return HttpStatus.ACCEPTED;
        }
        if (result.discarded()) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    public record QueueResponse(boolean success, String message, int queuePosition) {}

    public record StatusResponse(
            String requestId,
            SubmissionStatus submissionStatus,
            TransactionRecord transactionRecord,
            Integer queuePosition,
            SubmissionQueue.QueueStatus queueStatus
    ) {}

    public record CancelResponse(boolean success, String message) {}

    public record StatsResponse(
            SubmissionStats submitterStats,
            SubmissionQueue.QueueStatus queueStatus,
            boolean queueProcessing,
            List<TransactionRecord> recentSubmissions
    ) {}

    public record RetryResponse(boolean success, String message, Instant retryScheduledAt, String txHash) {}
}
