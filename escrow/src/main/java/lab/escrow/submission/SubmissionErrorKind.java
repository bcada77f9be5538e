package lab.escrow.submission;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.List;

/**
 * Ledger failure taxonomy. A kind is re-attempted automatically only when it is retryable
 * and the same signed body can succeed, i.e. no rebuild is needed.
 */
@Getter
public enum SubmissionErrorKind {

    TTL_EXPIRED("ttl_expired", true, true, ErrorSeverity.CRITICAL, "transaction_validity",
            "Transaction TTL has expired",
            List.of("Rebuild transaction with extended TTL",
                    "Check system clock synchronization",
                    "Consider setting longer TTL margin")),
    MISSING_WITNESSES("missing_witnesses", true, true, ErrorSeverity.CRITICAL, "transaction_authorization",
            "Required signatures are missing",
            List.of("Ensure all required UTxO owners have signed",
                    "Check witness set construction",
                    "Verify key hash computation")),
    UTXO_NOT_FOUND("utxo_not_found", true, false, ErrorSeverity.HIGH, "transaction_inputs",
            "Referenced UTxO does not exist or already spent",
            List.of("Verify UTxO still exists on chain",
                    "Check for concurrent spending",
                    "Refresh UTxO set before rebuilding")),
    INSUFFICIENT_FEE("insufficient_fee", true, false, ErrorSeverity.HIGH, "transaction_fee",
            "Transaction fee is insufficient",
            List.of("Increase transaction fee",
                    "Fetch latest protocol parameters")),
    MALFORMED_TRANSACTION("malformed_transaction", false, false, ErrorSeverity.CRITICAL, "transaction_format",
            "Transaction format is invalid",
            List.of("Verify CBOR encoding",
                    "Validate all required fields are present")),
    API_UNAUTHORIZED("api_unauthorized", false, false, ErrorSeverity.HIGH, "api_access",
            "Ledger API access denied",
            List.of("Check API key validity",
                    "Verify API key permissions")),
    NETWORK_ERROR("network_error", true, false, ErrorSeverity.MEDIUM, "network",
            "Network connectivity problem",
            List.of("Retry submission",
                    "Verify ledger service status")),
    RATE_LIMITED("rate_limited", true, false, ErrorSeverity.MEDIUM, "api_limits",
            "API rate limit exceeded",
            List.of("Wait before retrying",
                    "Consider upgrading API plan")),
    SERVER_ERROR("server_error", true, false, ErrorSeverity.MEDIUM, "server",
            "Ledger service error",
            List.of("Retry after delay",
                    "Report if persistent")),
    UNKNOWN("unknown", false, false, ErrorSeverity.ERROR, "general",
            "Unrecognized ledger error",
            List.of());

    private final String wireName;
    private final boolean retryable;
    private final boolean rebuildRequired;
    private final ErrorSeverity severity;
    private final String category;
    private final String issue;
    private final List<String> suggestions;

    SubmissionErrorKind(String wireName, boolean retryable, boolean rebuildRequired, ErrorSeverity severity,
                        String category, String issue, List<String> suggestions) {
        this.wireName = wireName;
        this.retryable = retryable;
        this.rebuildRequired = rebuildRequired;
        this.severity = severity;
        this.category = category;
        this.issue = issue;
        this.suggestions = suggestions;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isAutoRetryable() {
        return retryable && !rebuildRequired;
    }
}
