package lab.escrow.submission;

import lab.escrow.store.EscrowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Two-tier FIFO of pending submissions. HIGH entries are always served before NORMAL ones.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubmissionQueue {

    public record QueueEntry(
            String requestId,
            SubmissionOptions options,
            SubmissionPriority priority,
            Instant enqueuedAt
    ) {}

    public record QueueStatus(
            int queueLength,
            int highPriorityCount,
            int normalPriorityCount,
            Instant oldestEnqueuedAt
    ) {}

    private final Deque<QueueEntry> high = new ArrayDeque<>();
    private final Deque<QueueEntry> normal = new ArrayDeque<>();
    private final Clock clock;

    /**
     * @return 1-based position of the new entry
     */
    public synchronized int enqueue(String rawRequestId, SubmissionOptions options, SubmissionPriority priority) {
        String requestId = EscrowStore.canonicalRequestId(rawRequestId);
        if (indexOf(requestId) >= 0) {
            throw new SubmissionConflictException("Request " + requestId + " is already queued");
        }
        SubmissionPriority tier = priority == null ? SubmissionPriority.NORMAL : priority;
        SubmissionOptions base = options == null ? SubmissionOptions.defaults() : options;
        QueueEntry entry = new QueueEntry(requestId, base.toBuilder().priority(tier).build(), tier, clock.instant());

        int position;
        if (tier == SubmissionPriority.HIGH) {
            high.addLast(entry);
            position = high.size();
        } else {
            normal.addLast(entry);
            position = high.size() + normal.size();
        }
        log.info("event=submission_queue.enqueued requestId={} priority={} position={} length={}",
                requestId, tier.wireName(), position, high.size() + normal.size());
        return position;
    }

    public synchronized Optional<QueueEntry> dequeueNext() {
        QueueEntry entry = high.pollFirst();
        if (entry == null) {
            entry = normal.pollFirst();
        }
        return Optional.ofNullable(entry);
    }

    public synchronized boolean remove(String requestId) {
        boolean removed = high.removeIf(entry -> entry.requestId().equals(requestId))
                | normal.removeIf(entry -> entry.requestId().equals(requestId));
        if (removed) {
            log.info("event=submission_queue.removed requestId={}", requestId);
        }
        return removed;
    }

    /**
     * @return 1-based position, or empty when the request is not queued
     */
    public synchronized Optional<Integer> positionOf(String requestId) {
        int index = indexOf(requestId);
        return index < 0 ? Optional.empty() : Optional.of(index + 1);
    }

    public synchronized QueueStatus getStatus() {
        Instant oldest = null;
        for (QueueEntry entry : snapshot()) {
            if (oldest == null || entry.enqueuedAt().isBefore(oldest)) {
                oldest = entry.enqueuedAt();
            }
        }
        return new QueueStatus(high.size() + normal.size(), high.size(), normal.size(), oldest);
    }

    public synchronized List<QueueEntry> snapshot() {
        List<QueueEntry> entries = new ArrayList<>(high);
        entries.addAll(normal);
        return entries;
    }

    private int indexOf(String requestId) {
        int index = 0;
        for (QueueEntry entry : high) {
            if (entry.requestId().equals(requestId)) {
                return index;
            }
            index++;
        }
        for (QueueEntry entry : normal) {
            if (entry.requestId().equals(requestId)) {
                return index;
            }
            index++;
        }
        return -1;
    }
}
