package lab.escrow.submission;

import jakarta.annotation.PreDestroy;
import lab.escrow.common.InvalidRequestException;
import lab.escrow.store.AuditEvent;
import lab.escrow.store.EscrowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Fans a list of request ids out to {@link TransactionSubmitter} with a bounded number in flight.
 */
@Slf4j
@Service
public class BatchSubmissionManager {

    public record BatchSummary(
            int total,
            int successful,
            int failed,
            int successRatePercent
    ) {}

    public record BatchResult(
            Map<String, SubmissionResult> results,
            BatchSummary summary,
            int maxConcurrency
    ) {}

    private final TransactionSubmitter submitter;
    private final EscrowStore store;
    private final SubmissionProperties properties;
    private final ExecutorService executor;

    public BatchSubmissionManager(TransactionSubmitter submitter, EscrowStore store, SubmissionProperties properties) {
        this.submitter = submitter;
        this.store = store;
        this.properties = properties;
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getBatch().getMaxConcurrency()));
    }

    public BatchResult submitBatch(List<String> requestIds, SubmissionOptions options, Integer maxConcurrency) {
        SubmissionProperties.Batch batch = properties.getBatch();
        if (requestIds == null || requestIds.isEmpty()) {
            throw new InvalidRequestException("requestIds must not be empty");
        }
        if (requestIds.size() > batch.getMaxBatchSize()) {
            throw new InvalidRequestException("Batch size " + requestIds.size() + " exceeds the maximum of " + batch.getMaxBatchSize());
        }

        Set<String> ids = new LinkedHashSet<>();
        for (String requestId : requestIds) {
            ids.add(requestId == null ? "" : requestId.trim());
        }
        SubmissionOptions opts = options == null ? SubmissionOptions.defaults() : options;
        int concurrency = resolveConcurrency(maxConcurrency);
        log.info("event=batch_submission.start size={} distinct={} maxConcurrency={} mode={}",
                requestIds.size(), ids.size(), concurrency, opts.mode().wireName());

        Semaphore permits = new Semaphore(concurrency);
        Map<String, CompletableFuture<SubmissionResult>> pending = new LinkedHashMap<>();
        for (String requestId : ids) {
            if (!acquire(permits)) {
                pending.put(requestId, CompletableFuture.completedFuture(
                        SubmissionResult.failed("Batch interrupted", null, 0, opts.mode())));
                continue;
            }
            try {
                pending.put(requestId, CompletableFuture.supplyAsync(() -> submitOne(requestId, opts, permits), executor));
            } catch (RejectedExecutionException e) {
                permits.release();
                pending.put(requestId, CompletableFuture.completedFuture(
                        SubmissionResult.failed("Batch executor unavailable", null, 0, opts.mode())));
            }
        }

        Map<String, SubmissionResult> results = new LinkedHashMap<>();
        pending.forEach((requestId, future) -> results.put(requestId, await(future, opts)));

        int successful = (int) results.values().stream().filter(SubmissionResult::success).count();
        BatchSummary summary = new BatchSummary(
                results.size(),
                successful,
                results.size() - successful,
                (int) Math.round(successful * 100.0 / results.size())
        );
        log.info("event=batch_submission.done total={} successful={} failed={}",
                summary.total(), summary.successful(), summary.failed());
        store.appendAuditLog(AuditEvent.builder()
                .eventType("batch_submission_completed")
                .resourceType("batch")
                .actor(AuditEvent.SYSTEM_ACTOR)
                .detail("request_ids", List.copyOf(results.keySet()))
                .detail("total", summary.total())
                .detail("successful", summary.successful())
                .detail("failed", summary.failed())
                .detail("max_concurrency", concurrency)
                .build());
        return new BatchResult(results, summary, concurrency);
    }

    int resolveConcurrency(Integer requested) {
        SubmissionProperties.Batch batch = properties.getBatch();
        int value = requested == null ? batch.getDefaultConcurrency() : requested;
        return Math.max(1, Math.min(value, batch.getMaxConcurrency()));
    }

    private SubmissionResult submitOne(String requestId, SubmissionOptions opts, Semaphore permits) {
        try {
            return submitter.submit(requestId, opts);
        } catch (RuntimeException e) {
            log.warn("event=batch_submission.item_failed requestId={} error={}", requestId, e.getMessage());
            return SubmissionResult.failed(e.getMessage(), null, 0, opts.mode());
        } finally {
            permits.release();
        }
    }

    private boolean acquire(Semaphore permits) {
        try {
            permits.acquire();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private SubmissionResult await(CompletableFuture<SubmissionResult> future, SubmissionOptions opts) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return SubmissionResult.failed(cause.getMessage(), null, 0, opts.mode());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
