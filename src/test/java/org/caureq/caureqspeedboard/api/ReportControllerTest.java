package org.caureq.caureqspeedboard.api;

import static org.caureq.caureqspeedboard.Fixtures.TOKEN;
import static org.caureq.caureqspeedboard.Fixtures.props;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.caureq.caureqspeedboard.api.dto.ReportAck;
import org.caureq.caureqspeedboard.api.error.GlobalExceptionHandler;
import org.caureq.caureqspeedboard.security.TokenFilter;
import org.caureq.caureqspeedboard.service.IngestService;
import org.caureq.caureqspeedboard.service.ReportValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ReportControllerTest {

    private static final String BODY = """
            {"node_id": "lv", "download_mbps": 120.4, "upload_mbps": 60.1, "ping_ms": 12.5,
             "isp": "Tet", "location": "Riga", "status": "🚨 Very low"}
            """;

    @Mock
    private IngestService ingestService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new ReportController(ingestService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(new TokenFilter(props(List.of(), List.of())))
                .build();
    }

    @Test
    void acceptsReportWithBearerToken() throws Exception {
        when(ingestService.ingest(any())).thenReturn(ReportAck.ok("lv", Instant.parse("2024-05-01T12:00:00Z")));

        mvc.perform(post("/api/v1/report")
                        .header("Authorization", "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.nodeId").value("lv"));
    }

    @Test
    void acceptsApiKeyHeader() throws Exception {
        when(ingestService.ingest(any())).thenReturn(ReportAck.ok("lv", Instant.parse("2024-05-01T12:00:00Z")));

        mvc.perform(post("/api/v1/report")
                        .header("X-API-KEY", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("missing or wrong token is rejected before the body is looked at")
    void rejectsBadToken() throws Exception {
        mvc.perform(post("/api/v1/report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.error").value("unauthorized"));

        mvc.perform(post("/api/v1/report")
                        .header("Authorization", "Bearer wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized());

        verify(ingestService, never()).ingest(any());
    }

    @Test
    @DisplayName("a percent-encoded route without a token is rejected too")
    void encodedPathNeedsToken() throws Exception {
        mvc.perform(post(URI.create("/api/v1/%72eport"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized());

        verify(ingestService, never()).ingest(any());
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mvc.perform(post("/api/v1/report")
                        .header("Authorization", "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"node_id\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void missingMeasurementFailsValidation() throws Exception {
        mvc.perform(post("/api/v1/report")
                        .header("Authorization", "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"node_id\": \"lv\", \"upload_mbps\": 1, \"ping_ms\": 1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.fieldErrors.downloadMbps").exists());

        verify(ingestService, never()).ingest(any());
    }

    @Test
    void serviceRejectionIsBadRequest() throws Exception {
        when(ingestService.ingest(any())).thenThrow(new ReportValidationException("ping_ms", "ping_ms must be >= 0"));

        mvc.perform(post("/api/v1/report")
                        .header("Authorization", "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.field").value("ping_ms"));
    }
}
