package lab.escrow.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "escrow.ledger", name = "mode", havingValue = "blockfrost")
public class BlockfrostLedgerGateway implements LedgerGateway {

    private static final MediaType CBOR = MediaType.get("application/cbor");
    private static final String PROJECT_ID_HEADER = "project_id";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String projectId;

    public BlockfrostLedgerGateway(OkHttpClient blockfrostHttpClient, ObjectMapper objectMapper, LedgerProperties properties) {
        this.httpClient = blockfrostHttpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getBlockfrost().resolveBaseUrl();
        this.projectId = properties.getBlockfrost().getProjectId();
    }

    @Override
    public String submitTransaction(String signedTxHex) {
        byte[] body;
        try {
            body = HexFormat.of().parseHex(signedTxHex.trim());
        } catch (IllegalArgumentException e) {
            throw new LedgerGatewayException("malformed transaction: signed body is not valid hex", 400, e);
        }

        Request request = newRequest("/tx/submit")
                .post(RequestBody.create(body, CBOR))
                .build();
        log.info("event=blockfrost.submit.request bytes={}", body.length);

        try (Response response = httpClient.newCall(request).execute()) {
            String payload = readBody(response);
            if (!response.isSuccessful()) {
                throw failure("submit", response.code(), payload);
            }
            String txHash = objectMapper.readValue(payload, String.class);
            log.info("event=blockfrost.submit.accepted txHash={}", txHash);
            return txHash;
        } catch (IOException e) {
            throw new LedgerGatewayException("network error during submit: " + e.getMessage(), 0, e);
        }
    }

    @Override
    public Optional<LedgerTxInfo> getTransactionInfo(String txHash) {
        Request request = newRequest("/txs/" + txHash).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            String payload = readBody(response);
            if (response.code() == 404) {
                return Optional.empty();
            }
            if (!response.isSuccessful()) {
                throw failure("lookup", response.code(), payload);
            }
            JsonNode node = objectMapper.readTree(payload);
            return Optional.of(new LedgerTxInfo(
                    node.path("block").asText(null),
                    node.path("block_height").asLong(),
                    Instant.ofEpochSecond(node.path("block_time").asLong())
            ));
        } catch (IOException e) {
            throw new LedgerGatewayException("network error during lookup: " + e.getMessage(), 0, e);
        }
    }

    @Override
    public long getCurrentTipHeight() {
        Request request = newRequest("/blocks/latest").get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            String payload = readBody(response);
            if (!response.isSuccessful()) {
                throw failure("tip", response.code(), payload);
            }
            return objectMapper.readTree(payload).path("height").asLong();
        } catch (IOException e) {
            throw new LedgerGatewayException("network error during tip lookup: " + e.getMessage(), 0, e);
        }
    }

    @Override
    public String getName() {
        return "blockfrost";
    }

    private Request.Builder newRequest(String path) {
        return new Request.Builder()
                .url(baseUrl + path)
                .header(PROJECT_ID_HEADER, projectId);
    }

    private String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body == null ? "" : body.string();
    }

    // Blockfrost errors look like {"status_code":400,"error":"Bad Request","message":"..."}
    private LedgerGatewayException failure(String operation, int status, String payload) {
        String message = payload;
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node != null && node.hasNonNull("message")) {
                message = node.get("message").asText();
            }
        } catch (IOException e) {
            log.debug("event=blockfrost.{}.non_json_error status={}", operation, status);
        }
        log.warn("event=blockfrost.{}.rejected status={} message={}", operation, status, message);
        return new LedgerGatewayException(status + " " + message, status);
    }
}
