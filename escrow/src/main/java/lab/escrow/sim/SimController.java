package lab.escrow.sim;

import lab.escrow.domain.presigned.PreSignedTransaction;
import lab.escrow.domain.request.EscrowRequest;
import lab.escrow.sim.fakeledger.FakeLedger;
import lab.escrow.store.EscrowStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Set;

/**
 * Drives the in-process ledger so labs and integration tests can reproduce submission and
 * confirmation scenarios deterministically.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/sim")
@ConditionalOnProperty(prefix = "escrow.ledger", name = "mode", havingValue = "mock", matchIfMissing = true)
public class SimController {

    private final FakeLedger fakeLedger;
    private final EscrowStore store;

    // Seeds a SIGNED request with its pre-signed body, standing in for the signing flow.
    @PostMapping("/requests")
    public SeededRequest seed(@RequestBody SeedRequest body) {
        String requestId = EscrowStore.canonicalRequestId(body.requestId());
        String owner = body.owner() == null ? "sim-owner" : body.owner();
        String signedTxHex = body.signedTxHex() == null
                ? "84a400" + HexFormat.of().formatHex(requestId.getBytes(StandardCharsets.UTF_8))
                : body.signedTxHex();
        store.saveRequest(EscrowRequest.signed(requestId, owner, "{\"type\":\"fixed\"}",
                body.ttlSlot() == null ? 0L : body.ttlSlot()));
        PreSignedTransaction preSigned = store.savePreSignedTransaction(PreSignedTransaction.of(
                requestId, "sim", signedTxHex, FakeLedger.hashOf(signedTxHex), null));
        return new SeededRequest(requestId, preSigned.getTxHash());
    }

    @PostMapping("/ledger/submit-failures")
    public void failNextSubmissions(@RequestBody ScriptedFailures body) {
        fakeLedger.failNextSubmissions(body.count(), body.httpStatus(), body.message());
    }

    @PostMapping("/ledger/lookup-failures/{count}")
    public void failNextLookups(@PathVariable int count) {
        fakeLedger.failNextLookups(count);
    }

    @PostMapping("/ledger/mine/{txHash}")
    public LedgerState mine(@PathVariable String txHash, @RequestParam(required = false) Long height) {
        fakeLedger.mine(txHash, height == null ? fakeLedger.tipHeight() + 1 : height);
        return state();
    }

    @PostMapping("/ledger/mine-mempool")
    public LedgerState mineMempool() {
        fakeLedger.mineMempool();
        return state();
    }

    @PostMapping("/ledger/tip/{height}")
    public LedgerState setTip(@PathVariable long height) {
        fakeLedger.setTipHeight(height);
        return state();
    }

    @GetMapping("/ledger")
    public LedgerState state() {
        return new LedgerState(fakeLedger.tipHeight(), fakeLedger.mempool(), fakeLedger.submitCalls());
    }

    @PostMapping("/ledger/reset")
    public void reset() {
        fakeLedger.reset();
    }

    public record SeedRequest(String requestId, String owner, String signedTxHex, Long ttlSlot) {}

    public record SeededRequest(String requestId, String expectedTxHash) {}

    public record ScriptedFailures(int count, int httpStatus, String message) {}

    public record LedgerState(long tipHeight, Set<String> mempool, int submitCalls) {}
}
