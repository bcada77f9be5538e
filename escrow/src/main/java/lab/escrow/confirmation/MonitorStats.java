package lab.escrow.confirmation;

import java.time.Instant;

public record MonitorStats(
        boolean running,
        int monitoredCount,
        long totalChecks,
        long totalConfirmed,
        long totalFailed,
        long cycles,
        Instant lastCycleAt,
        MonitorConfig config
) {}
