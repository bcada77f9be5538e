package lab.escrow.sim.fakeledger;

import lab.escrow.ledger.LedgerGateway;
import lab.escrow.ledger.LedgerGatewayException;
import lab.escrow.ledger.LedgerTxInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.HexFormat;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process ledger for mock mode and tests. Submissions land in a mempool until mined;
 * failures for the next submits or lookups can be scripted.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "escrow.ledger", name = "mode", havingValue = "mock", matchIfMissing = true)
public class FakeLedger implements LedgerGateway {

    public record ScriptedFailure(int httpStatus, String message) {}

    private final Clock clock;
    private final Deque<ScriptedFailure> submitFailures = new ArrayDeque<>();
    private final AtomicInteger lookupFailures = new AtomicInteger();
    private final Set<String> mempool = ConcurrentHashMap.newKeySet();
    private final Map<String, LedgerTxInfo> mined = new ConcurrentHashMap<>();
    private final AtomicLong tipHeight = new AtomicLong(1_000);
    private final AtomicInteger submitCalls = new AtomicInteger();

    public FakeLedger(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String submitTransaction(String signedTxHex) {
        submitCalls.incrementAndGet();
        ScriptedFailure failure;
        synchronized (submitFailures) {
            failure = submitFailures.pollFirst();
        }
        if (failure != null) {
            log.info("event=fake_ledger.submit.scripted_failure status={} message={}", failure.httpStatus(), failure.message());
            throw new LedgerGatewayException(failure.message(), failure.httpStatus());
        }
        String txHash = hashOf(signedTxHex);
        if (!mined.containsKey(txHash)) {
            mempool.add(txHash);
        }
        log.info("event=fake_ledger.submit.accepted txHash={}", txHash);
        return txHash;
    }

    @Override
    public Optional<LedgerTxInfo> getTransactionInfo(String txHash) {
        consumeLookupFailure();
        return Optional.ofNullable(mined.get(txHash));
    }

    @Override
    public long getCurrentTipHeight() {
        consumeLookupFailure();
        return tipHeight.get();
    }

    @Override
    public String getName() {
        return "mock";
    }

    public void failNextSubmissions(int count, int httpStatus, String message) {
        synchronized (submitFailures) {
            for (int i = 0; i < count; i++) {
                submitFailures.addLast(new ScriptedFailure(httpStatus, message));
            }
        }
    }

    public void failNextLookups(int count) {
        lookupFailures.addAndGet(count);
    }

    // Places the hash in a block at the given height. The hash does not need to be in the mempool.
    public LedgerTxInfo mine(String txHash, long blockHeight) {
        LedgerTxInfo info = new LedgerTxInfo(hashOf("block-" + blockHeight), blockHeight, clock.instant());
        mined.put(txHash, info);
        mempool.remove(txHash);
        tipHeight.accumulateAndGet(blockHeight, Math::max);
        log.info("event=fake_ledger.mine txHash={} blockHeight={}", txHash, blockHeight);
        return info;
    }

    public long mineMempool() {
        long height = tipHeight.incrementAndGet();
        for (String txHash : List.copyOf(mempool)) {
            mine(txHash, height);
        }
        return height;
    }

    public void setTipHeight(long height) {
        tipHeight.set(height);
    }

    public long tipHeight() {
        return tipHeight.get();
    }

    public Set<String> mempool() {
        return Set.copyOf(mempool);
    }

    public int submitCalls() {
        return submitCalls.get();
    }

    public void reset() {
        synchronized (submitFailures) {
            submitFailures.clear();
        }
        lookupFailures.set(0);
        mempool.clear();
        mined.clear();
        tipHeight.set(1_000);
        submitCalls.set(0);
    }

    public static String hashOf(String signedTxHex) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(signedTxHex.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void consumeLookupFailure() {
        if (lookupFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new LedgerGatewayException("connection reset by fake ledger", 0);
        }
    }
}
