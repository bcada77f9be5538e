package lab.escrow.ledger;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "escrow.ledger", name = "mode", havingValue = "blockfrost")
public class BlockfrostModeStartupGuard {

    private static final Set<String> NETWORKS = Set.of("mainnet", "preprod", "preview");

    private final LedgerProperties properties;

    @PostConstruct
    void validate() {
        LedgerProperties.Blockfrost blockfrost = properties.getBlockfrost();
        String network = blockfrost.getNetwork();
        if (network == null || !NETWORKS.contains(network)) {
            throw new IllegalStateException("escrow.ledger.blockfrost.network must be one of " + NETWORKS + " but was " + network);
        }
        if ("mainnet".equals(network) && !blockfrost.isAllowMainnet()) {
            throw new IllegalStateException("mainnet is not allowed unless escrow.ledger.blockfrost.allow-mainnet=true");
        }
        String projectId = blockfrost.getProjectId();
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalStateException("ESCROW_BLOCKFROST_PROJECT_ID must be configured in blockfrost mode");
        }
        // Blockfrost project ids are issued per network and carry it as prefix.
        if (!projectId.startsWith(network)) {
            throw new IllegalStateException("Blockfrost project id does not belong to network " + network);
        }
    }
}
