package lab.escrow.submission;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lab.escrow.domain.audit.AuditLog;
import lab.escrow.domain.request.RequestStatus;
import lab.escrow.store.EscrowStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "escrow.submission.base-delay=10ms",
        "escrow.submission.max-delay=20ms",
        "escrow.submission.queue.enabled=false",
        "escrow.confirmation.auto-start=false"
})
@AutoConfigureMockMvc
class SubmissionControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private EscrowStore store;

    @Autowired
    private SubmissionQueueWorker queueWorker;

    @BeforeEach
    void resetLedger() throws Exception {
        mockMvc.perform(post("/sim/ledger/reset")).andExpect(status().isOk());
    }

    private String seed(String prefix) throws Exception {
        String requestId = prefix + "-" + UUID.randomUUID();
        MvcResult result = mockMvc.perform(post("/sim/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"requestId": "%s"}
                                """.formatted(requestId)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("requestId").asText();
    }

    private String expectedHash(String requestId) {
        return store.getPreSignedTransaction(requestId).orElseThrow().getTxHash();
    }

    @Test
    void submit_broadcastsAndRecordsTransaction() throws Exception {
        String requestId = seed("single");

        mockMvc.perform(post("/submit/{id}", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"mode": "server"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.txHash").value(expectedHash(requestId)))
                .andExpect(jsonPath("$.attempts").value(1))
                .andExpect(jsonPath("$.mode").value("server"))
                .andExpect(jsonPath("$.message").value("Transaction submitted successfully"));

        assertThat(store.getRequestById(requestId).orElseThrow().getStatus()).isEqualTo(RequestStatus.SUBMITTED);

        mockMvc.perform(get("/submit/status/{id}", requestId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.submissionStatus.isActive").value(false))
                .andExpect(jsonPath("$.transactionRecord.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.transactionRecord.txHash").value(expectedHash(requestId)));

        mockMvc.perform(post("/submit/{id}", requestId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("must be SIGNED")));
    }

    @Test
    void submit_transientLedgerFailuresAreRetried() throws Exception {
        String requestId = seed("transient");
        mockMvc.perform(post("/sim/ledger/submit-failures")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"count": 2, "httpStatus": 503, "message": "503 Service Unavailable"}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(post("/submit/{id}", requestId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.attempts").value(3));

        mockMvc.perform(get("/sim/ledger"))
                .andExpect(jsonPath("$.submitCalls").value(3));
    }

    @Test
    void submit_exhaustedRetriesFailRequestAndRetryRecoversIt() throws Exception {
        String requestId = seed("exhausted");
        mockMvc.perform(post("/sim/ledger/submit-failures")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"count": 3, "httpStatus": 503, "message": "503 Service Unavailable"}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(post("/submit/{id}", requestId))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.attempts").value(3))
                .andExpect(jsonPath("$.error").value("503 Service Unavailable"))
                .andExpect(jsonPath("$.errorAnalysis.errorType").value("server_error"))
                .andExpect(jsonPath("$.errorAnalysis.isRetryable").value(true));

        assertThat(store.getRequestById(requestId).orElseThrow().getStatus()).isEqualTo(RequestStatus.FAILED);

        mockMvc.perform(post("/submit/{id}/retry", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.txHash").value(expectedHash(requestId)));

        assertThat(store.getRequestById(requestId).orElseThrow().getStatus()).isEqualTo(RequestStatus.SUBMITTED);
        assertThat(store.getAuditTrail(requestId))
                .extracting(AuditLog::getEventType)
                .contains("transaction_submission_failed", "submission_immediate_retry", "transaction_submitted");
    }

    @Test
    void submit_nonRetryableFailureStopsAfterFirstAttempt() throws Exception {
        String requestId = seed("malformed");
        mockMvc.perform(post("/sim/ledger/submit-failures")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"count": 1, "httpStatus": 400, "message": "400 DeserialiseFailure: invalid cbor"}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(post("/submit/{id}", requestId))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.attempts").value(1))
                .andExpect(jsonPath("$.errorAnalysis.errorType").value("malformed_transaction"))
                .andExpect(jsonPath("$.errorAnalysis.isRetryable").value(false))
                .andExpect(jsonPath("$.errorAnalysis.suggestions", hasItem("Verify CBOR encoding")));
    }

    @Test
    void submit_unknownModeIsRejected() throws Exception {
        String requestId = seed("mode");

        mockMvc.perform(post("/submit/{id}", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"mode": "carrier-pigeon"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.allowedModes[0]").value("server"))
                .andExpect(jsonPath("$.allowedModes[1]").value("wallet"));
    }

    @Test
    void submit_unknownOrMalformedRequestIdIsRejected() throws Exception {
        mockMvc.perform(post("/submit/{id}", "never-seeded-" + UUID.randomUUID()))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/submit/{id}", "bad!id"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("invalid request id: bad!id"));
    }

    @Test
    void batch_submitsEachRequestAndSummarizes() throws Exception {
        String first = seed("batch");
        String second = seed("batch");

        mockMvc.perform(post("/submit/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"requestIds": ["%s", "%s", "no-such-request"], "maxConcurrency": 2}
                                """.formatted(first, second)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.total").value(3))
                .andExpect(jsonPath("$.summary.successful").value(2))
                .andExpect(jsonPath("$.summary.failed").value(1))
                .andExpect(jsonPath("$.maxConcurrency").value(2))
                .andExpect(jsonPath("$.results['" + first + "'].success").value(true))
                .andExpect(jsonPath("$.results['no-such-request'].attempts").value(0));
    }

    @Test
    void batch_rejectsConcurrencyAboveCeiling() throws Exception {
        mockMvc.perform(post("/submit/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"requestIds": ["a"], "maxConcurrency": 9}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("maxConcurrency must be between 1 and 5"));
    }

    @Test
    void queue_enqueueThenDrainSubmits() throws Exception {
        String requestId = seed("queued");

        mockMvc.perform(post("/submit/queue/{id}", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"priority": "high"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.queuePosition").value(1));

        mockMvc.perform(post("/submit/queue/{id}", requestId))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/submit/status/{id}", requestId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queuePosition").value(1))
                .andExpect(jsonPath("$.queueStatus.highPriorityCount").value(1));

        assertThat(queueWorker.processNext()).isTrue();

        mockMvc.perform(get("/submit/status/{id}", requestId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queuePosition").doesNotExist())
                .andExpect(jsonPath("$.transactionRecord.txHash").value(expectedHash(requestId)));
    }

    @Test
    void cancel_removesQueuedRequest() throws Exception {
        String requestId = seed("cancel");
        mockMvc.perform(post("/submit/queue/{id}", requestId)).andExpect(status().isOk());

        mockMvc.perform(delete("/submit/{id}", requestId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(delete("/submit/{id}", requestId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false));

        assertThat(queueWorker.processNext()).isFalse();
        assertThat(store.getTransactionByRequestId(requestId)).isEmpty();
    }

    @Test
    void retry_withDelaySchedulesTimer() throws Exception {
        String requestId = seed("delayed");

        MvcResult result = mockMvc.perform(post("/submit/{id}/retry", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"delaySeconds": 600}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.retryScheduledAt").exists())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(body.get("message").asText()).isEqualTo("Retry scheduled in 600 seconds");

        mockMvc.perform(get("/submit/status/{id}", requestId))
                .andExpect(jsonPath("$.submissionStatus.hasRetryScheduled").value(true));

        mockMvc.perform(delete("/submit/{id}", requestId))
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(get("/submit/status/{id}", requestId))
                .andExpect(jsonPath("$.submissionStatus.hasRetryScheduled").value(false));
    }

    @Test
    void retry_rejectsOutOfRangeDelay() throws Exception {
        String requestId = seed("delay-range");

        mockMvc.perform(post("/submit/{id}/retry", requestId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"delaySeconds": 3601}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void stats_reportSubmitterAndQueueState() throws Exception {
        mockMvc.perform(get("/submit/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.submitterStats.maxAttempts").value(3))
                .andExpect(jsonPath("$.queueStatus.queueLength").isNumber())
                .andExpect(jsonPath("$.recentSubmissions").isArray());
    }
}
