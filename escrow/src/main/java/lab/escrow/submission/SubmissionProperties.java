package lab.escrow.submission;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "escrow.submission")
public class SubmissionProperties {

    /**
     * Gateway calls per submission, the first one included.
     */
    private int maxAttempts = 3;

    /**
     * Backoff before attempt n+1 is baseDelay * 2^(n-1), capped at maxDelay.
     */
    private Duration baseDelay = Duration.ofSeconds(5);

    private Duration maxDelay = Duration.ofSeconds(60);

    /**
     * Each backoff delay is spread by +/- this fraction.
     */
    private double jitterRatio = 0.2;

    /**
     * Delayed retries allowed per request after exhaustion before it is marked FAILED.
     */
    private int maxScheduledRetries = 3;

    private Duration scheduledRetryDelay = Duration.ofMinutes(1);

    /**
     * How long a forced submission waits for the attempt it cancelled to stop.
     */
    private Duration forceOverrideWait = Duration.ofSeconds(30);

    private int retrySchedulerThreads = 2;

    private Batch batch = new Batch();
    private Queue queue = new Queue();

    @Data
    public static class Batch {
        private int defaultConcurrency = 3;
        private int maxConcurrency = 5;
        private int maxBatchSize = 10;
    }

    @Data
    public static class Queue {
        private boolean enabled = true;
        private long drainIntervalMs = 500;
    }
}
