package lab.escrow.submission;

import jakarta.annotation.PreDestroy;
import lab.escrow.common.InvalidRequestException;
import lab.escrow.confirmation.ConfirmationMonitor;
import lab.escrow.domain.presigned.PreSignedTransaction;
import lab.escrow.domain.request.EscrowRequest;
import lab.escrow.domain.request.RequestStatus;
import lab.escrow.domain.transaction.TransactionRecord;
import lab.escrow.domain.transaction.TransactionRecordStatus;
import lab.escrow.ledger.LedgerGateway;
import lab.escrow.notify.StatusChangeEvent;
import lab.escrow.notify.StatusNotifier;
import lab.escrow.store.AuditEvent;
import lab.escrow.store.EscrowStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-submission primitive shared by the HTTP routes, the queue worker and the batch manager.
 * At most one submission per request id is active at any time; the active map entry is claimed
 * with {@code putIfAbsent} before any precondition is read.
 */
@Slf4j
@Service
public class TransactionSubmitter {

    private static final String MDC_REQUEST_ID_KEY = "requestId";

    private final EscrowStore store;
    private final LedgerGateway ledgerGateway;
    private final SubmissionErrorClassifier classifier;
    private final StatusNotifier notifier;
    private final ConfirmationMonitor confirmationMonitor;
    private final SubmissionProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService retryScheduler;

    private final ConcurrentHashMap<String, ActiveSubmission> active = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ScheduledRetry> scheduledRetries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SubmissionOptions> lastOptions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> scheduledRetryCounts = new ConcurrentHashMap<>();

    private final AtomicLong totalSubmitted = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicLong totalCancelled = new AtomicLong();
    private final AtomicLong totalAttempts = new AtomicLong();

    public TransactionSubmitter(EscrowStore store,
                                LedgerGateway ledgerGateway,
                                SubmissionErrorClassifier classifier,
                                StatusNotifier notifier,
                                ConfirmationMonitor confirmationMonitor,
                                SubmissionProperties properties,
                                Clock clock) {
        this.store = store;
        this.ledgerGateway = ledgerGateway;
        this.classifier = classifier;
        this.notifier = notifier;
        this.confirmationMonitor = confirmationMonitor;
        this.properties = properties;
        this.clock = clock;
        this.retryScheduler = Executors.newScheduledThreadPool(Math.max(1, properties.getRetrySchedulerThreads()));
    }

    public SubmissionResult submit(String rawRequestId, SubmissionOptions options) {
        String requestId = EscrowStore.canonicalRequestId(rawRequestId);
        SubmissionOptions opts = options == null ? SubmissionOptions.defaults() : options;

        ActiveSubmission handle = new ActiveSubmission(opts);
        claimSlot(requestId, handle);

        boolean mdcSet = MDC.get(MDC_REQUEST_ID_KEY) == null;
        if (mdcSet) {
            MDC.put(MDC_REQUEST_ID_KEY, requestId);
        }
        try {
            // a manual submission supersedes any timer still pending for this request
            ScheduledRetry pending = scheduledRetries.remove(requestId);
            if (pending != null) {
                pending.cancel();
            }
            lastOptions.put(requestId, opts);
            return runSubmission(requestId, opts, handle);
        } finally {
            if (!scheduledRetries.containsKey(requestId)) {
                clearRetryState(requestId);
            }
            active.remove(requestId, handle);
            handle.done.complete(null);
            if (mdcSet) {
                MDC.remove(MDC_REQUEST_ID_KEY);
            }
        }
    }

    private void claimSlot(String requestId, ActiveSubmission handle) {
        ActiveSubmission existing = active.putIfAbsent(requestId, handle);
        if (existing == null) {
            return;
        }
        if (!handle.options.force()) {
            log.info("event=submitter.submit.rejected requestId={} reason=in_progress", requestId);
            throw new SubmissionConflictException("Submission already in progress for request " + requestId);
        }

        log.info("event=submitter.submit.force_override requestId={}", requestId);
        cancelInternal(requestId, "force_override");
        awaitFinish(requestId, existing);

        if (active.putIfAbsent(requestId, handle) != null) {
            throw new SubmissionConflictException("Another submission started for request " + requestId + " during override");
        }
    }

    private void awaitFinish(String requestId, ActiveSubmission previous) {
        Duration wait = properties.getForceOverrideWait();
        try {
            previous.done.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new SubmissionConflictException("Previous submission for request " + requestId
                    + " did not stop within " + wait.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SubmissionConflictException("Interrupted while overriding submission for request " + requestId);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Previous submission completed exceptionally", e);
        }
    }

    private SubmissionResult runSubmission(String requestId, SubmissionOptions opts, ActiveSubmission handle) {
        EscrowRequest request = store.getRequestById(requestId)
                .orElseThrow(() -> new InvalidRequestException("Request not found: " + requestId));
        RequestStatus observedStatus = request.getStatus();
        checkRequestStatus(requestId, observedStatus, opts.force());
        checkExistingTransaction(requestId, opts.force());
        PreSignedTransaction preSigned = store.getPreSignedTransaction(requestId)
                .orElseThrow(() -> new InvalidRequestException("No pre-signed transaction for request " + requestId));

        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        log.info("event=submitter.submit.start requestId={} mode={} force={} maxAttempts={} ledger={}",
                requestId, opts.mode().wireName(), opts.force(), maxAttempts, ledgerGateway.getName());
        store.appendAuditLog(AuditEvent.transaction("transaction_submission_started", requestId)
                .detail("mode", opts.mode().wireName())
                .detail("priority", opts.priority().wireName())
                .detail("force", opts.force())
                .detail("max_attempts", maxAttempts)
                .build());

        String lastError = null;
        ErrorAnalysis lastAnalysis = null;
        int attempts = 0;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (handle.isCancelled()) {
                return discard(requestId, opts, attempts, null);
            }
            attempts = attempt;
            handle.attempts.set(attempt);
            totalAttempts.incrementAndGet();

            String txHash;
            try {
                txHash = ledgerGateway.submitTransaction(preSigned.getSignedTxHex());
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                lastAnalysis = classifier.classify(e);
                log.warn("event=submitter.attempt.failed requestId={} attempt={} errorType={} retryable={} error={}",
                        requestId, attempt, lastAnalysis.kind().getWireName(), lastAnalysis.autoRetryable(), lastError);
                store.appendAuditLog(AuditEvent.transaction("transaction_submission_attempt_failed", requestId)
                        .detail("attempt", attempt)
                        .detail("error", lastError)
                        .detail("error_type", lastAnalysis.kind().getWireName())
                        .detail("retryable", lastAnalysis.autoRetryable())
                        .build());

                if (!lastAnalysis.autoRetryable() || attempt == maxAttempts) {
                    break;
                }
                Duration delay = backoffDelay(attempt);
                log.info("event=submitter.attempt.backoff requestId={} attempt={} delayMs={}", requestId, attempt, delay.toMillis());
                if (handle.awaitCancellation(delay)) {
                    return discard(requestId, opts, attempts, null);
                }
                continue;
            }

            if (handle.isCancelled()) {
                return discard(requestId, opts, attempts, txHash);
            }
            return onSubmitted(requestId, opts, attempts, txHash, observedStatus);
        }

        return onExhausted(requestId, opts, attempts, lastError, lastAnalysis, observedStatus);
    }

    private void checkRequestStatus(String requestId, RequestStatus status, boolean force) {
        if (status == RequestStatus.CONFIRMED || status == RequestStatus.EXPIRED) {
            throw new InvalidRequestException("Request " + requestId + " is " + status + " and cannot be submitted");
        }
        if (status != RequestStatus.SIGNED && !force) {
            throw new InvalidRequestException("Request " + requestId + " must be SIGNED to submit (current status: " + status + ")");
        }
    }

    private void checkExistingTransaction(String requestId, boolean force) {
        Optional<TransactionRecord> existing = store.getTransactionByRequestId(requestId);
        if (existing.isEmpty()) {
            return;
        }
        TransactionRecord record = existing.get();
        if (record.getStatus() == TransactionRecordStatus.CONFIRMED) {
            throw new SubmissionConflictException("Request " + requestId + " already confirmed with txHash " + record.getTxHash());
        }
        if (record.getStatus() == TransactionRecordStatus.SUBMITTED && !force) {
            throw new SubmissionConflictException("Request " + requestId + " already submitted with txHash " + record.getTxHash());
        }
    }

    private SubmissionResult onSubmitted(String requestId, SubmissionOptions opts, int attempts, String txHash,
                                         RequestStatus observedStatus) {
        Instant submittedAt = clock.instant();
        boolean reused = reuseOrSupersedeLiveRecord(requestId, txHash);
        if (!reused) {
            store.createTransactionRecord(requestId, txHash, opts.mode().wireName(), submittedAt);
        }
        if (!store.updateRequestStatus(requestId, RequestStatus.SUBMITTED, observedStatus)) {
            log.warn("event=submitter.submit.request_status_changed requestId={} expected={}", requestId, observedStatus);
        }
        store.appendAuditLog(AuditEvent.transaction("transaction_submitted", requestId)
                .detail("tx_hash", txHash)
                .detail("attempts", attempts)
                .detail("mode", opts.mode().wireName())
                .detail("reused_record", reused)
                .build());

        totalSubmitted.incrementAndGet();
        clearRetryState(requestId);
        log.info("event=submitter.submit.success requestId={} txHash={} attempts={}", requestId, txHash, attempts);

        notifier.publish(StatusChangeEvent.submitted(requestId, txHash, submittedAt));
        try {
            confirmationMonitor.addTransaction(txHash, requestId, submittedAt);
        } catch (RuntimeException e) {
            log.warn("event=submitter.monitor_registration.failed requestId={} txHash={} error={}",
                    requestId, txHash, e.getMessage());
        }
        return SubmissionResult.succeeded(txHash, attempts, opts.mode(), submittedAt);
    }

    /**
     * Keeps at most one SUBMITTED record per request. A rebroadcast that returns the hash already on
     * record reuses that row; any other live record is moved to FAILED before a new one is written.
     *
     * @return true when the existing record already carries {@code txHash}
     */
    private boolean reuseOrSupersedeLiveRecord(String requestId, String txHash) {
        Optional<TransactionRecord> live = store.getTransactionByRequestId(requestId)
                .filter(record -> record.getStatus() == TransactionRecordStatus.SUBMITTED);
        if (live.isEmpty()) {
            return false;
        }
        String previousHash = live.get().getTxHash();
        if (previousHash.equals(txHash)) {
            log.info("event=submitter.submit.record_reused requestId={} txHash={}", requestId, txHash);
            return true;
        }
        if (store.updateTransactionStatusByHash(previousHash, TransactionRecordStatus.FAILED, "Superseded by " + txHash)) {
            log.info("event=submitter.submit.record_superseded requestId={} previousTxHash={} txHash={}",
                    requestId, previousHash, txHash);
        }
        try {
            confirmationMonitor.removeTransaction(previousHash);
        } catch (RuntimeException e) {
            log.warn("event=submitter.monitor_removal.failed requestId={} txHash={} error={}",
                    requestId, previousHash, e.getMessage());
        }
        return false;
    }

    private SubmissionResult onExhausted(String requestId, SubmissionOptions opts, int attempts, String lastError,
                                         ErrorAnalysis lastAnalysis, RequestStatus observedStatus) {
        if (canScheduleRetry(requestId, opts, lastAnalysis)) {
            Duration delay = opts.retryDelay() != null ? opts.retryDelay() : properties.getScheduledRetryDelay();
            Instant nextRetryAt = scheduleRetry(requestId, delay, opts);
            log.info("event=submitter.submit.exhausted_retry_scheduled requestId={} attempts={} nextRetryAt={}",
                    requestId, attempts, nextRetryAt);
            return SubmissionResult.retryScheduled(lastError, lastAnalysis, attempts, opts.mode(), nextRetryAt);
        }

        // a forced resubmission of a live transaction leaves that transaction to the monitor
        if (observedStatus != RequestStatus.SUBMITTED
                && !store.updateRequestStatus(requestId, RequestStatus.FAILED, observedStatus)) {
            log.warn("event=submitter.submit.request_status_changed requestId={} expected={}", requestId, observedStatus);
        }
        store.appendAuditLog(AuditEvent.transaction("transaction_submission_failed", requestId)
                .detail("error", lastError)
                .detail("error_type", lastAnalysis == null ? null : lastAnalysis.kind().getWireName())
                .detail("attempts", attempts)
                .detail("mode", opts.mode().wireName())
                .build());

        totalFailed.incrementAndGet();
        clearRetryState(requestId);
        log.warn("event=submitter.submit.failed requestId={} attempts={} error={}", requestId, attempts, lastError);

        notifier.publish(StatusChangeEvent.failed(requestId, null, lastError, clock.instant()));
        return SubmissionResult.failed(lastError, lastAnalysis, attempts, opts.mode());
    }

    private boolean canScheduleRetry(String requestId, SubmissionOptions opts, ErrorAnalysis lastAnalysis) {
        if (!opts.retryOnExhaustion() || lastAnalysis == null || !lastAnalysis.autoRetryable()) {
            return false;
        }
        AtomicInteger used = scheduledRetryCounts.get(requestId);
        return used == null || used.get() < properties.getMaxScheduledRetries();
    }

    private SubmissionResult discard(String requestId, SubmissionOptions opts, int attempts, String txHash) {
        log.info("event=submitter.submit.discarded requestId={} attempts={} txHash={}", requestId, attempts, txHash);
        store.appendAuditLog(AuditEvent.transaction("transaction_submission_discarded", requestId)
                .detail("attempts", attempts)
                .detail("tx_hash", txHash)
                .build());
        return SubmissionResult.discarded(txHash, attempts, opts.mode());
    }

    Duration backoffDelay(int attempt) {
        long base = properties.getBaseDelay().toMillis();
        long cap = properties.getMaxDelay().toMillis();
        long exponential = base << Math.min(Math.max(attempt - 1, 0), 20);
        long capped = Math.min(exponential, cap);
        double ratio = Math.max(0.0, Math.min(properties.getJitterRatio(), 1.0));
        double jitter = 1.0 + ratio * (2 * ThreadLocalRandom.current().nextDouble() - 1);
        return Duration.ofMillis(Math.max(0L, Math.round(capped * jitter)));
    }

    public SubmissionStatus getSubmissionStatus(String rawRequestId) {
        if (rawRequestId == null) {
            return SubmissionStatus.INACTIVE;
        }
        String key = rawRequestId.trim();
        ActiveSubmission submission = active.get(key);
        ScheduledRetry retry = scheduledRetries.get(key);
        boolean isActive = submission != null && !submission.isCancelled();
        if (!isActive && retry == null) {
            return SubmissionStatus.INACTIVE;
        }
        int attempts = isActive ? submission.attempts.get() : 0;
        return new SubmissionStatus(isActive, retry != null, attempts, retry == null ? null : retry.fireAt);
    }

    public boolean cancelSubmission(String rawRequestId) {
        if (rawRequestId == null) {
            return false;
        }
        return cancelInternal(rawRequestId.trim(), "user_request");
    }

    private boolean cancelInternal(String requestId, String reason) {
        boolean hadRetry = false;
        ScheduledRetry retry = scheduledRetries.remove(requestId);
        if (retry != null) {
            retry.cancel();
            hadRetry = true;
        }
        boolean hadActive = false;
        ActiveSubmission submission = active.get(requestId);
        if (submission != null && submission.cancel()) {
            active.remove(requestId, submission);
            hadActive = true;
        }
        if (!hadRetry && !hadActive) {
            return false;
        }

        totalCancelled.incrementAndGet();
        clearRetryState(requestId);
        log.info("event=submitter.cancel requestId={} reason={} active={} scheduledRetry={}",
                requestId, reason, hadActive, hadRetry);
        store.appendAuditLog(AuditEvent.transaction("submission_cancelled", requestId)
                .detail("reason", reason)
                .detail("had_active_submission", hadActive)
                .detail("had_scheduled_retry", hadRetry)
                .build());
        return true;
    }

    public Instant scheduleRetry(String rawRequestId, Duration delay) {
        String requestId = EscrowStore.canonicalRequestId(rawRequestId);
        return scheduleRetry(requestId, delay, lastOptions.getOrDefault(requestId, SubmissionOptions.defaults()));
    }

    public Instant scheduleRetry(String rawRequestId, Duration delay, SubmissionOptions options) {
        String requestId = EscrowStore.canonicalRequestId(rawRequestId);
        Duration safeDelay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        Instant fireAt = clock.instant().plus(safeDelay);
        SubmissionOptions opts = options == null ? SubmissionOptions.defaults() : options;
        lastOptions.put(requestId, opts);

        // registered before the timer is armed so a fast timer always finds its own entry
        ScheduledRetry retry = new ScheduledRetry(requestId, fireAt, opts);
        ScheduledRetry previous = scheduledRetries.put(requestId, retry);
        if (previous != null) {
            previous.cancel();
        }
        int count = scheduledRetryCounts.computeIfAbsent(requestId, key -> new AtomicInteger()).incrementAndGet();
        retry.arm(retryScheduler.schedule(() -> fireRetry(retry), safeDelay.toMillis(), TimeUnit.MILLISECONDS));

        log.info("event=submitter.retry.scheduled requestId={} delayMs={} fireAt={} count={}",
                requestId, safeDelay.toMillis(), fireAt, count);
        store.appendAuditLog(AuditEvent.transaction("submission_retry_scheduled", requestId)
                .detail("delay_ms", safeDelay.toMillis())
                .detail("next_retry_at", fireAt.toString())
                .detail("scheduled_count", count)
                .detail("replaced_existing", previous != null)
                .build());
        return fireAt;
    }

    private void fireRetry(ScheduledRetry retry) {
        if (retry.isCancelled() || !scheduledRetries.remove(retry.requestId, retry)) {
            return;
        }
        MDC.put(MDC_REQUEST_ID_KEY, retry.requestId);
        try {
            log.info("event=submitter.retry.fire requestId={}", retry.requestId);
            SubmissionResult result = submit(retry.requestId, retry.options);
            log.info("event=submitter.retry.done requestId={} success={} txHash={}",
                    retry.requestId, result.success(), result.txHash());
        } catch (SubmissionConflictException | InvalidRequestException e) {
            log.warn("event=submitter.retry.rejected requestId={} reason={}", retry.requestId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("event=submitter.retry.error requestId={} error={}", retry.requestId, e.getMessage(), e);
        } finally {
            MDC.remove(MDC_REQUEST_ID_KEY);
        }
    }

    private void clearRetryState(String requestId) {
        scheduledRetryCounts.remove(requestId);
        lastOptions.remove(requestId);
    }

    int retryStateSize() {
        return lastOptions.size() + scheduledRetryCounts.size();
    }

    public SubmissionStats getStats() {
        int activeCount = (int) active.values().stream().filter(submission -> !submission.isCancelled()).count();
        return new SubmissionStats(
                activeCount,
                scheduledRetries.size(),
                totalSubmitted.get(),
                totalFailed.get(),
                totalCancelled.get(),
                totalAttempts.get(),
                properties.getMaxAttempts()
        );
    }

    @PreDestroy
    public void shutdown() {
        scheduledRetries.values().forEach(ScheduledRetry::cancel);
        scheduledRetries.clear();
        active.values().forEach(ActiveSubmission::cancel);
        retryScheduler.shutdownNow();
        log.info("event=submitter.shutdown");
    }

    private static final class ActiveSubmission {

        private final SubmissionOptions options;
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final CountDownLatch cancelSignal = new CountDownLatch(1);
        private final CompletableFuture<Void> done = new CompletableFuture<>();
        private final AtomicInteger attempts = new AtomicInteger();

        private ActiveSubmission(SubmissionOptions options) {
            this.options = options;
        }

        boolean cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return false;
            }
            cancelSignal.countDown();
            return true;
        }

        boolean isCancelled() {
            return cancelled.get();
        }

        // true when cancelled while waiting
        boolean awaitCancellation(Duration delay) {
            try {
                return cancelSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel();
                return true;
            }
        }
    }

    private static final class ScheduledRetry {

        private final String requestId;
        private final Instant fireAt;
        private final SubmissionOptions options;
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private volatile ScheduledFuture<?> future;

        private ScheduledRetry(String requestId, Instant fireAt, SubmissionOptions options) {
            this.requestId = requestId;
            this.fireAt = fireAt;
            this.options = options;
        }

        void arm(ScheduledFuture<?> scheduled) {
            this.future = scheduled;
            if (cancelled.get()) {
                scheduled.cancel(false);
            }
        }

        void cancel() {
            cancelled.set(true);
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }

        boolean isCancelled() {
            return cancelled.get();
        }
    }
}
