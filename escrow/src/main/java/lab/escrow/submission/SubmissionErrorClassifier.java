package lab.escrow.submission;

import lab.escrow.ledger.LedgerGatewayException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps a ledger failure onto {@link SubmissionErrorKind}.
 * <p>
 * Access, rate-limit and server kinds come from the HTTP status alone. Ledger rule names are
 * matched as whole words, and only in 4xx bodies or failures that never got an HTTP response.
 * Within each rule list the first match wins.
 */
@Component
public class SubmissionErrorClassifier {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final List<Map.Entry<Pattern, SubmissionErrorKind>> LEDGER_RULES = List.of(
            rule("outsidevalidityinterval\\w*|\\bpast expiry\\b|\\bttl\\b|\\bexpired\\b", SubmissionErrorKind.TTL_EXPIRED),
            rule("missingvkeywitnesses\\w*|\\bmissing\\b.*\\bwitness(es)?\\b", SubmissionErrorKind.MISSING_WITNESSES),
            rule("badinputsutxo|\\b(utxo|input)s?\\b.*\\bnot found\\b", SubmissionErrorKind.UTXO_NOT_FOUND),
            rule("feetoosmall\\w*|\\bfee\\b|\\binsufficient\\b|\\btoo small\\b", SubmissionErrorKind.INSUFFICIENT_FEE),
            rule("deserialisefailure|\\bmalformed\\b|\\binvalid\\b|\\bcbor\\b", SubmissionErrorKind.MALFORMED_TRANSACTION)
    );

    // only for failures without an HTTP status
    private static final List<Map.Entry<Pattern, SubmissionErrorKind>> TRANSPORT_RULES = List.of(
            rule("\\btime(d)? ?out\\b|\\bnetwork\\b|\\bconnection\\b", SubmissionErrorKind.NETWORK_ERROR),
            rule("\\bunauthorized\\b|\\bforbidden\\b", SubmissionErrorKind.API_UNAUTHORIZED),
            rule("\\brate limit(ed)?\\b|\\btoo many requests\\b|\\bthrottled\\b", SubmissionErrorKind.RATE_LIMITED),
            rule("\\binternal server error\\b|\\bservice unavailable\\b|\\bbad gateway\\b", SubmissionErrorKind.SERVER_ERROR)
    );

    public ErrorAnalysis classify(Throwable error) {
        Integer status = null;
        if (error instanceof LedgerGatewayException gatewayException && gatewayException.getHttpStatus() > 0) {
            status = gatewayException.getHttpStatus();
        }
        return classify(error == null ? null : error.getMessage(), status);
    }

    public ErrorAnalysis classify(String message, Integer httpStatus) {
        SubmissionErrorKind kind;
        if (httpStatus == null || httpStatus <= 0) {
            kind = firstMatch(LEDGER_RULES, message);
            if (kind == SubmissionErrorKind.UNKNOWN) {
                kind = firstMatch(TRANSPORT_RULES, message);
            }
        } else {
            kind = fromStatus(httpStatus);
            if (kind == SubmissionErrorKind.UNKNOWN && httpStatus >= 400 && httpStatus < 500) {
                kind = firstMatch(LEDGER_RULES, message);
            }
        }
        return ErrorAnalysis.of(kind, httpStatus);
    }

    SubmissionErrorKind fromStatus(int status) {
        if (status == 401 || status == 403) {
            return SubmissionErrorKind.API_UNAUTHORIZED;
        }
        if (status == 408) {
            return SubmissionErrorKind.NETWORK_ERROR;
        }
        if (status == 429) {
            return SubmissionErrorKind.RATE_LIMITED;
        }
        if (status >= 500) {
            return SubmissionErrorKind.SERVER_ERROR;
        }
        return SubmissionErrorKind.UNKNOWN;
    }

    private static SubmissionErrorKind firstMatch(List<Map.Entry<Pattern, SubmissionErrorKind>> rules, String message) {
        if (message == null || message.isBlank()) {
            return SubmissionErrorKind.UNKNOWN;
        }
        for (Map.Entry<Pattern, SubmissionErrorKind> rule : rules) {
            if (rule.getKey().matcher(message).find()) {
                return rule.getValue();
            }
        }
        return SubmissionErrorKind.UNKNOWN;
    }

    private static Map.Entry<Pattern, SubmissionErrorKind> rule(String regex, SubmissionErrorKind kind) {
        return Map.entry(Pattern.compile(regex, FLAGS), kind);
    }
}
