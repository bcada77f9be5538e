package lab.escrow.common;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "escrow.submission.queue.enabled=false",
        "escrow.confirmation.auto-start=false"
})
@Import(GlobalExceptionHandlerTest.TestConfig.class)
@AutoConfigureMockMvc
class GlobalExceptionHandlerTest {

    private static final String SIGNED_BODY = "84a4" + "0123456789abcdef".repeat(10);
    private static final String TX_HASH = "ab".repeat(32);

    @Autowired
    private MockMvc mockMvc;

    @Test
    void runtimeExceptionMessageIsSanitized() throws Exception {
        mockMvc.perform(get("/test-error").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isInternalServerError())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value(500))
                .andExpect(jsonPath("$.path").value("/test-error"))
                .andExpect(jsonPath("$.message").value("Ledger rejected [REDACTED_HEX] as " + TX_HASH));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/submit/{id}", "req-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value(startsWith("Invalid JSON body.")))
                .andExpect(jsonPath("$.allowedModes.length()").value(2));
    }

    @Test
    void typeMismatchNamesParameter() throws Exception {
        mockMvc.perform(post("/sim/ledger/tip/{height}", "tall"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value 'tall' for parameter 'height'"));
    }

    @Test
    void correlationIdIsEchoedOrGenerated() throws Exception {
        mockMvc.perform(get("/submit/stats").header(CorrelationIdFilter.CORRELATION_ID_HEADER, " cid-42 "))
                .andExpect(status().isOk())
                .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "cid-42"));

        String generated = mockMvc.perform(get("/submit/stats"))
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER);
        assertThat(generated).isNotBlank();
    }

    @Test
    void shortHexIsNotRedacted() {
        assertThat(GlobalExceptionHandler.sanitizeMessage("hash " + TX_HASH)).isEqualTo("hash " + TX_HASH);
        assertThat(GlobalExceptionHandler.sanitizeMessage("body 0x" + SIGNED_BODY)).isEqualTo("body [REDACTED_HEX]");
        assertThat(GlobalExceptionHandler.sanitizeMessage(null)).isEqualTo("Unexpected server error");
    }

    @TestConfiguration
    static class TestConfig {
        @Bean
        TestErrorController testErrorController() {
            return new TestErrorController();
        }
    }

    @RestController
    static class TestErrorController {
        @GetMapping("/test-error")
        String error() {
            throw new IllegalStateException("Ledger rejected " + SIGNED_BODY + " as " + TX_HASH);
        }
    }
}
