package lab.escrow.ledger;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "escrow.ledger")
public class LedgerProperties {

    /**
     * mock: in-process fake ledger. blockfrost: Blockfrost HTTP API.
     */
    private String mode = "mock";

    private Blockfrost blockfrost = new Blockfrost();

    @Data
    public static class Blockfrost {
        private String projectId;

        /**
         * mainnet, preprod or preview
         */
        private String network = "preprod";

        /**
         * Overrides the URL derived from the network, e.g. for a self-hosted instance.
         */
        private String baseUrl;

        private boolean allowMainnet = false;

        private long connectTimeoutMs = 10_000;

        private long readTimeoutMs = 30_000;

        private Proxy proxy = new Proxy();

        public String resolveBaseUrl() {
            if (baseUrl != null && !baseUrl.isBlank()) {
                return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
            }
            return "https://cardano-" + network + ".blockfrost.io/api/v0";
        }
    }

    @Data
    public static class Proxy {
        private boolean enabled = false;
        private String host;
        private int port = 8080;
        private String username;
        private String password;
    }
}
