package lab.escrow.submission;

import lab.escrow.common.InvalidRequestException;
import lab.escrow.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionQueueTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
    private final SubmissionQueue queue = new SubmissionQueue(clock);

    @Test
    void highPriorityIsServedFirst_thenFifoWithinTier() {
        assertThat(queue.enqueue("A", SubmissionOptions.defaults(), SubmissionPriority.NORMAL)).isEqualTo(1);
        clock.advance(Duration.ofSeconds(1));
        assertThat(queue.enqueue("B", SubmissionOptions.defaults(), SubmissionPriority.HIGH)).isEqualTo(1);
        clock.advance(Duration.ofSeconds(1));
        assertThat(queue.enqueue("C", SubmissionOptions.defaults(), SubmissionPriority.NORMAL)).isEqualTo(3);

        assertThat(queue.dequeueNext()).get().extracting(SubmissionQueue.QueueEntry::requestId).isEqualTo("B");
        assertThat(queue.dequeueNext()).get().extracting(SubmissionQueue.QueueEntry::requestId).isEqualTo("A");
        assertThat(queue.dequeueNext()).get().extracting(SubmissionQueue.QueueEntry::requestId).isEqualTo("C");
        assertThat(queue.dequeueNext()).isEmpty();
    }

    @Test
    void entryCarriesQueuedPriorityInItsOptions() {
        queue.enqueue("A", SubmissionOptions.of(SubmissionMode.WALLET), SubmissionPriority.HIGH);

        SubmissionQueue.QueueEntry entry = queue.dequeueNext().orElseThrow();
        assertThat(entry.options().mode()).isEqualTo(SubmissionMode.WALLET);
        assertThat(entry.options().priority()).isEqualTo(SubmissionPriority.HIGH);
    }

    @Test
    void duplicateRequestId_isRejected() {
        queue.enqueue("A", SubmissionOptions.defaults(), SubmissionPriority.NORMAL);

        assertThatThrownBy(() -> queue.enqueue("A", SubmissionOptions.defaults(), SubmissionPriority.HIGH))
                .isInstanceOf(SubmissionConflictException.class);
    }

    @Test
    void invalidRequestId_isRejected() {
        assertThatThrownBy(() -> queue.enqueue("not valid!", SubmissionOptions.defaults(), SubmissionPriority.NORMAL))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void removeAndStatus() {
        Instant first = clock.instant();
        queue.enqueue("A", SubmissionOptions.defaults(), SubmissionPriority.NORMAL);
        clock.advance(Duration.ofSeconds(5));
        queue.enqueue("B", SubmissionOptions.defaults(), SubmissionPriority.HIGH);

        SubmissionQueue.QueueStatus status = queue.getStatus();
        assertThat(status.queueLength()).isEqualTo(2);
        assertThat(status.highPriorityCount()).isEqualTo(1);
        assertThat(status.normalPriorityCount()).isEqualTo(1);
        assertThat(status.oldestEnqueuedAt()).isEqualTo(first);
        assertThat(queue.positionOf("A")).contains(2);

        assertThat(queue.remove("A")).isTrue();
        assertThat(queue.remove("A")).isFalse();
        assertThat(queue.positionOf("A")).isEmpty();
        assertThat(queue.getStatus().queueLength()).isEqualTo(1);
    }
}
