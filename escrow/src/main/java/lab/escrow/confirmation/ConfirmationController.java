package lab.escrow.confirmation;

import lab.escrow.common.InvalidRequestException;
import lab.escrow.domain.transaction.TransactionRecord;
import lab.escrow.store.EscrowStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/confirmation")
public class ConfirmationController {

    private final ConfirmationMonitor monitor;
    private final EscrowStore store;
    private final Clock clock;

    @GetMapping("/status")
    public ResponseEntity<MonitorStats> status() {
        return ResponseEntity.ok(monitor.getStats());
    }

    @PostMapping("/start")
    public ResponseEntity<ControlResponse> start() {
        monitor.start();
        return ResponseEntity.ok(new ControlResponse(true, "Confirmation monitor started", monitor.isRunning()));
    }

    @PostMapping("/stop")
    public ResponseEntity<ControlResponse> stop() {
        monitor.stop();
        return ResponseEntity.ok(new ControlResponse(true, "Confirmation monitor stopped", monitor.isRunning()));
    }

    @GetMapping("/transactions")
    public ResponseEntity<List<MonitoredTransactionView>> transactions() {
        return ResponseEntity.ok(monitor.getAllMonitoredTransactions());
    }

    @GetMapping("/transactions/{txHash}")
    public ResponseEntity<MonitoredTransactionView> transaction(@PathVariable String txHash) {
        return monitor.getTransactionStatus(txHash)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotMonitoredException(txHash));
    }

    @DeleteMapping("/transactions/{txHash}")
    public ResponseEntity<ControlResponse> remove(@PathVariable String txHash) {
        if (!monitor.removeTransaction(txHash)) {
            throw new NotMonitoredException(txHash);
        }
        return ResponseEntity.ok(new ControlResponse(true, "Transaction removed from monitoring", monitor.isRunning()));
    }

    @PostMapping("/transactions/{txHash}/check")
    public ResponseEntity<MonitoredTransactionView> check(@PathVariable String txHash) {
        log.info("event=confirmation.check.request txHash={}", txHash);
        return ResponseEntity.ok(monitor.forceCheckTransaction(txHash));
    }

    // The stored record wins over the body so a hash is always tracked under the request that broadcast it.
    @PostMapping("/transactions/{txHash}/add")
    public ResponseEntity<MonitoredTransactionView> add(@PathVariable String txHash,
                                                        @RequestBody(required = false) AddTransactionRequest body) {
        Optional<TransactionRecord> record = store.getTransactionByHash(txHash);
        String requestId;
        Instant submittedAt;
        if (record.isPresent()) {
            requestId = record.get().getRequestId();
            submittedAt = record.get().getSubmittedAt();
        } else {
            if (body == null || body.requestId() == null) {
                throw new InvalidRequestException("requestId is required for a hash without a transaction record");
            }
            requestId = EscrowStore.canonicalRequestId(body.requestId());
            submittedAt = clock.instant();
        }
        monitor.addTransaction(txHash, requestId, submittedAt);
        return monitor.getTransactionStatus(txHash)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(new MonitoredTransactionView(txHash, requestId, null, 0,
                        null, null, null, 0, 0, submittedAt, null, "transaction reached a terminal state on first check")));
    }

    @PatchMapping("/config")
    public ResponseEntity<MonitorConfig> updateConfig(@RequestBody MonitorConfigUpdate update) {
        return ResponseEntity.ok(monitor.updateConfig(update));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        MonitorStats stats = monitor.getStats();
        Instant lastCycle = stats.lastCycleAt();
        long staleAfterMs = stats.config().checkIntervalMs() * 3;
        boolean stale = stats.running()
                && lastCycle != null
                && Duration.between(lastCycle, clock.instant()).toMillis() > staleAfterMs;
        boolean healthy = stats.running() && !stale;
        return ResponseEntity.ok(new HealthResponse(healthy, stats.running(), stale, stats.monitoredCount(), lastCycle));
    }

    public record AddTransactionRequest(String requestId) {}

    public record ControlResponse(boolean success, String message, boolean running) {}

    public record HealthResponse(boolean healthy, boolean running, boolean stale, int monitoredCount, Instant lastCycleAt) {}
}
