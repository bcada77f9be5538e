package lab.escrow.confirmation;

import jakarta.annotation.PreDestroy;
import lab.escrow.domain.request.RequestStatus;
import lab.escrow.domain.transaction.TransactionRecord;
import lab.escrow.domain.transaction.TransactionRecordStatus;
import lab.escrow.ledger.LedgerGateway;
import lab.escrow.ledger.LedgerTxInfo;
import lab.escrow.notify.StatusChangeEvent;
import lab.escrow.notify.StatusNotifier;
import lab.escrow.store.AuditEvent;
import lab.escrow.store.EscrowStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls every broadcast hash until it is CONFIRMED or FAILED.
 *
 * <p>Each hash moves SUBMITTED -> CONFIRMED | FAILED exactly once: checks and terminal
 * transitions for one hash are serialized on its {@link MonitoredTransaction}, and the store
 * writes are compare-and-set from SUBMITTED. The periodic loop is a cancellable fixed-delay task;
 * {@link #runCheckCycle()} runs one tick synchronously.
 */
@Slf4j
@Component
public class ConfirmationMonitor {

    private static final String MDC_TX_HASH_KEY = "txHash";

    private final EscrowStore store;
    private final LedgerGateway ledgerGateway;
    private final StatusNotifier notifier;
    private final ConfirmationProperties properties;
    private final Clock clock;

    private final ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService checkExecutor;
    private final ConcurrentHashMap<String, MonitoredTransaction> monitored = new ConcurrentHashMap<>();
    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);

    private final AtomicLong totalChecks = new AtomicLong();
    private final AtomicLong totalConfirmed = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicLong cycles = new AtomicLong();

    private volatile MonitorConfig config;
    private volatile ScheduledFuture<?> tickTask;
    private volatile Instant lastCycleAt;

    public ConfirmationMonitor(EscrowStore store,
                               LedgerGateway ledgerGateway,
                               StatusNotifier notifier,
                               ConfirmationProperties properties,
                               Clock clock) {
        this.store = store;
        this.ledgerGateway = ledgerGateway;
        this.notifier = notifier;
        this.properties = properties;
        this.clock = clock;
        this.config = MonitorConfig.from(properties);
        this.checkExecutor = Executors.newFixedThreadPool(Math.max(1, properties.getCheckThreads()));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isAutoStart()) {
            start();
        }
    }

    public synchronized void start() {
        if (isRunning()) {
            log.info("event=confirmation_monitor.start.skipped reason=already_running");
            return;
        }
        int reloaded = 0;
        for (TransactionRecord record : store.listPendingTransactions()) {
            if (monitored.putIfAbsent(record.getTxHash(), MonitoredTransaction.fromRecord(record)) == null) {
                reloaded++;
            }
        }
        arm(config.checkIntervalMs());
        log.info("event=confirmation_monitor.started reloaded={} monitored={} intervalMs={} required={}",
                reloaded, monitored.size(), config.checkIntervalMs(), config.requiredConfirmations());
    }

    public synchronized void stop() {
        ScheduledFuture<?> task = tickTask;
        if (task == null) {
            return;
        }
        task.cancel(false);
        tickTask = null;
        log.info("event=confirmation_monitor.stopped monitored={}", monitored.size());
    }

    public boolean isRunning() {
        return tickTask != null;
    }

    private void arm(long intervalMs) {
        tickTask = ticker.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    // an exception escaping a fixed-delay task would silently end the schedule
    private void tick() {
        try {
            runCheckCycle();
        } catch (RuntimeException e) {
            log.error("event=confirmation_monitor.cycle.error error={}", e.getMessage(), e);
        }
    }

    public void runCheckCycle() {
        if (!cycleRunning.compareAndSet(false, true)) {
            log.debug("event=confirmation_monitor.cycle.skipped reason=previous_cycle_running");
            return;
        }
        try {
            MonitorConfig cfg = config;
            Instant now = clock.instant();
            List<MonitoredTransaction> toCheck = new ArrayList<>();
            for (MonitoredTransaction tx : monitored.values()) {
                if (Duration.between(tx.submittedAt, now).toMillis() > cfg.maxConfirmationTimeMs()) {
                    failTransaction(tx, "Confirmation timeout exceeded");
                } else {
                    toCheck.add(tx);
                }
            }
            toCheck.sort(Comparator.comparing(tx -> tx.submittedAt));

            for (int from = 0; from < toCheck.size(); from += cfg.batchSize()) {
                if (from > 0 && !pauseBetweenBatches(cfg.batchPauseMs())) {
                    break;
                }
                List<MonitoredTransaction> batch = toCheck.subList(from, Math.min(from + cfg.batchSize(), toCheck.size()));
                CompletableFuture<?>[] checks = batch.stream()
                        .map(tx -> CompletableFuture.runAsync(() -> checkTransaction(tx), checkExecutor))
                        .toArray(CompletableFuture[]::new);
                try {
                    CompletableFuture.allOf(checks).join();
                } catch (CompletionException e) {
                    log.error("event=confirmation_monitor.batch.error error={}", e.getMessage(), e);
                }
            }

            cycles.incrementAndGet();
            lastCycleAt = now;
            log.debug("event=confirmation_monitor.cycle.done checked={} monitored={}", toCheck.size(), monitored.size());
        } finally {
            cycleRunning.set(false);
        }
    }

    private boolean pauseBetweenBatches(long pauseMs) {
        if (pauseMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(pauseMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("event=confirmation_monitor.cycle.interrupted");
            return false;
        }
    }

    void checkTransaction(MonitoredTransaction tx) {
        synchronized (tx) {
            if (tx.status != TransactionRecordStatus.SUBMITTED || monitored.get(tx.txHash) != tx) {
                return;
            }
            MDC.put(MDC_TX_HASH_KEY, tx.txHash);
            try {
                MonitorConfig cfg = config;
                Instant now = clock.instant();
                tx.checkAttempts++;
                tx.lastCheckedAt = now;
                totalChecks.incrementAndGet();

                Optional<LedgerTxInfo> info;
                long tip = 0L;
                // only ledger lookups count as check failures; store faults propagate to the cycle
                try {
                    info = ledgerGateway.getTransactionInfo(tx.txHash);
                    if (info.isPresent()) {
                        tip = ledgerGateway.getCurrentTipHeight();
                    }
                } catch (RuntimeException e) {
                    onCheckFailure(tx, cfg, e);
                    return;
                }
                if (info.isEmpty()) {
                    onNotFound(tx, cfg, now);
                } else {
                    onFound(tx, cfg, info.get(), tip);
                }
            } finally {
                MDC.remove(MDC_TX_HASH_KEY);
            }
        }
    }

    private void onNotFound(MonitoredTransaction tx, MonitorConfig cfg, Instant now) {
        long ageMs = Duration.between(tx.submittedAt, now).toMillis();
        if (ageMs > cfg.notFoundGraceMs()) {
            failTransaction(tx, "Transaction not found on blockchain after "
                    + Duration.ofMillis(cfg.notFoundGraceMs()).toMinutes() + " minutes");
            return;
        }
        log.debug("event=confirmation_monitor.check.not_found txHash={} ageMs={}", tx.txHash, ageMs);
    }

    private void onFound(MonitoredTransaction tx, MonitorConfig cfg, LedgerTxInfo info, long tipHeight) {
        int confirmations = (int) Math.max(0L, tipHeight - info.blockHeight() + 1);
        boolean changed = confirmations != tx.confirmations || tx.blockHeight == null;
        tx.confirmations = confirmations;
        tx.blockHeight = info.blockHeight();
        tx.blockHash = info.blockHash();
        tx.blockTime = info.blockTime();
        tx.lastError = null;

        if (confirmations >= cfg.requiredConfirmations()) {
            confirmTransaction(tx);
            return;
        }
        store.updateTransactionProgress(tx.txHash, confirmations, tx.blockHeight, tx.blockHash, tx.blockTime);
        log.info("event=confirmation_monitor.check.progress txHash={} confirmations={} required={}",
                tx.txHash, confirmations, cfg.requiredConfirmations());
        if (changed) {
            notifier.publish(StatusChangeEvent.progress(tx.requestId, tx.txHash, confirmations,
                    cfg.requiredConfirmations(), tx.blockHeight, tx.blockHash, clock.instant()));
        }
    }

    private void onCheckFailure(MonitoredTransaction tx, MonitorConfig cfg, RuntimeException e) {
        tx.checkFailures++;
        tx.lastError = e.getMessage();
        log.warn("event=confirmation_monitor.check.failed txHash={} failures={} error={}",
                tx.txHash, tx.checkFailures, e.getMessage());
        if (tx.checkFailures > cfg.maxCheckFailures()) {
            failTransaction(tx, "Too many check failures");
        }
    }

    private void confirmTransaction(MonitoredTransaction tx) {
        synchronized (tx) {
            if (tx.status != TransactionRecordStatus.SUBMITTED) {
                return;
            }
            if (!store.markTransactionConfirmed(tx.txHash, tx.confirmations, tx.blockHeight, tx.blockHash, tx.blockTime)) {
                dropOnConflict(tx, TransactionRecordStatus.CONFIRMED);
                return;
            }
            if (!store.updateRequestStatus(tx.requestId, RequestStatus.CONFIRMED, RequestStatus.SUBMITTED)) {
                log.warn("event=confirmation_monitor.request_status_changed requestId={} txHash={}", tx.requestId, tx.txHash);
            }
            tx.status = TransactionRecordStatus.CONFIRMED;
            monitored.remove(tx.txHash, tx);
            store.appendAuditLog(AuditEvent.transaction("transaction_confirmed", tx.requestId)
                    .detail("tx_hash", tx.txHash)
                    .detail("confirmations", tx.confirmations)
                    .detail("block_height", tx.blockHeight)
                    .detail("block_hash", tx.blockHash)
                    .build());
            totalConfirmed.incrementAndGet();
            log.info("event=confirmation_monitor.confirmed requestId={} txHash={} confirmations={} blockHeight={}",
                    tx.requestId, tx.txHash, tx.confirmations, tx.blockHeight);
            notifier.publish(StatusChangeEvent.confirmed(tx.requestId, tx.txHash, tx.confirmations,
                    tx.blockHeight, tx.blockHash, clock.instant()));
        }
    }

    private void failTransaction(MonitoredTransaction tx, String reason) {
        synchronized (tx) {
            if (tx.status != TransactionRecordStatus.SUBMITTED) {
                return;
            }
            if (!store.updateTransactionStatusByHash(tx.txHash, TransactionRecordStatus.FAILED, reason)) {
                dropOnConflict(tx, TransactionRecordStatus.FAILED);
                return;
            }
            if (!store.updateRequestStatus(tx.requestId, RequestStatus.FAILED, RequestStatus.SUBMITTED)) {
                log.warn("event=confirmation_monitor.request_status_changed requestId={} txHash={}", tx.requestId, tx.txHash);
            }
            tx.status = TransactionRecordStatus.FAILED;
            tx.lastError = reason;
            monitored.remove(tx.txHash, tx);
            store.appendAuditLog(AuditEvent.transaction("transaction_failed", tx.requestId)
                    .detail("tx_hash", tx.txHash)
                    .detail("reason", reason)
                    .detail("check_attempts", tx.checkAttempts)
                    .detail("check_failures", tx.checkFailures)
                    .build());
            totalFailed.incrementAndGet();
            log.warn("event=confirmation_monitor.failed requestId={} txHash={} reason={}", tx.requestId, tx.txHash, reason);
            notifier.publish(StatusChangeEvent.failed(tx.requestId, tx.txHash, reason, clock.instant()));
        }
    }

    // The stored row already left SUBMITTED through another path; stop tracking without a second transition.
    private void dropOnConflict(MonitoredTransaction tx, TransactionRecordStatus attempted) {
        TransactionRecordStatus stored = store.getTransactionByHash(tx.txHash)
                .map(TransactionRecord::getStatus)
                .orElse(null);
        tx.status = stored != null ? stored : attempted;
        monitored.remove(tx.txHash, tx);
        log.warn("event=confirmation_monitor.state_conflict txHash={} attempted={} stored={}", tx.txHash, attempted, stored);
        store.appendAuditLog(AuditEvent.transaction("transaction_state_conflict", tx.requestId)
                .detail("tx_hash", tx.txHash)
                .detail("attempted_status", attempted.name())
                .detail("stored_status", stored == null ? null : stored.name())
                .build());
    }

    public void addTransaction(String txHash, String requestId, Instant submittedAt) {
        MonitoredTransaction tx = new MonitoredTransaction(txHash, requestId, submittedAt);
        if (monitored.putIfAbsent(txHash, tx) != null) {
            log.debug("event=confirmation_monitor.add.skipped txHash={} reason=already_monitored", txHash);
            return;
        }
        log.info("event=confirmation_monitor.add requestId={} txHash={}", requestId, txHash);
        checkTransaction(tx);
    }

    public boolean removeTransaction(String txHash) {
        boolean removed = monitored.remove(txHash) != null;
        if (removed) {
            log.info("event=confirmation_monitor.remove txHash={}", txHash);
        }
        return removed;
    }

    public MonitoredTransactionView forceCheckTransaction(String txHash) {
        MonitoredTransaction tx = monitored.get(txHash);
        if (tx == null) {
            throw new NotMonitoredException(txHash);
        }
        log.info("event=confirmation_monitor.force_check txHash={}", txHash);
        checkTransaction(tx);
        return tx.view();
    }

    public Optional<MonitoredTransactionView> getTransactionStatus(String txHash) {
        return Optional.ofNullable(monitored.get(txHash)).map(MonitoredTransaction::view);
    }

    public List<MonitoredTransactionView> getAllMonitoredTransactions() {
        return monitored.values().stream()
                .map(MonitoredTransaction::view)
                .sorted(Comparator.comparing(MonitoredTransactionView::submittedAt))
                .toList();
    }

    public MonitorStats getStats() {
        return new MonitorStats(
                isRunning(),
                monitored.size(),
                totalChecks.get(),
                totalConfirmed.get(),
                totalFailed.get(),
                cycles.get(),
                lastCycleAt,
                config
        );
    }

    public MonitorConfig getConfig() {
        return config;
    }

    public synchronized MonitorConfig updateConfig(MonitorConfigUpdate update) {
        update.validate();
        MonitorConfig previous = config;
        MonitorConfig next = previous.apply(update);
        config = next;
        if (isRunning() && next.checkIntervalMs() != previous.checkIntervalMs()) {
            tickTask.cancel(false);
            arm(next.checkIntervalMs());
        }
        log.info("event=confirmation_monitor.config.updated intervalMs={} required={} maxConfirmationTimeMs={}",
                next.checkIntervalMs(), next.requiredConfirmations(), next.maxConfirmationTimeMs());
        return next;
    }

    @PreDestroy
    public void shutdown() {
        stop();
        ticker.shutdownNow();
        checkExecutor.shutdownNow();
        log.info("event=confirmation_monitor.shutdown monitored={}", monitored.size());
    }
}
