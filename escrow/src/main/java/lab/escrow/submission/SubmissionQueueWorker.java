package lab.escrow.submission;

import lab.escrow.common.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@RequiredArgsConstructor
public class SubmissionQueueWorker {

    private final SubmissionQueue queue;
    private final TransactionSubmitter submitter;
    private final SubmissionProperties properties;
    private final AtomicBoolean processing = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${escrow.submission.queue.drain-interval-ms:500}")
    public void drain() {
        if (!properties.getQueue().isEnabled()) {
            return;
        }
        processNext();
    }

    /**
     * Submits the head of the queue.
     *
     * @return false when the queue was empty or another drain is running
     */
    public boolean processNext() {
        if (!processing.compareAndSet(false, true)) {
            return false;
        }
        try {
            Optional<SubmissionQueue.QueueEntry> next = queue.dequeueNext();
            if (next.isEmpty()) {
                return false;
            }
            SubmissionQueue.QueueEntry entry = next.get();
            MDC.put("requestId", entry.requestId());
            try {
                SubmissionResult result = submitter.submit(entry.requestId(), entry.options());
                log.info("event=submission_queue.processed requestId={} success={} attempts={} txHash={}",
                        entry.requestId(), result.success(), result.attempts(), result.txHash());
            } catch (SubmissionConflictException | InvalidRequestException e) {
                log.warn("event=submission_queue.rejected requestId={} reason={}", entry.requestId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("event=submission_queue.error requestId={} error={}", entry.requestId(), e.getMessage(), e);
            } finally {
                MDC.remove("requestId");
            }
            return true;
        } finally {
            processing.set(false);
        }
    }

    public boolean isProcessing() {
        return processing.get();
    }
}
