package org.caureq.caureqspeedboard.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.caureq.caureqspeedboard.Fixtures.props;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.caureq.caureqspeedboard.api.dto.ReportDTO;
import org.caureq.caureqspeedboard.domain.SpeedReport;
import org.caureq.caureqspeedboard.service.digest.DigestService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IngestServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private AggregatorService aggregator;

    @Mock
    private DigestService digests;

    private IngestService service(boolean sendImmediately) {
        return new IngestService(aggregator, digests, props(List.of(), List.of(), sendImmediately), CLOCK);
    }

    private static ReportDTO dto(String nodeId, Double down, Double up, Double ping) {
        return new ReportDTO(nodeId, down, up, ping, " Tet ", "Riga", null, null, "", "2024-05-01T14:59:00+03:00");
    }

    @Test
    @DisplayName("accepted report is stamped with the master clock")
    void stampsServerTime() {
        var ack = service(false).ingest(dto(" lv ", 120.4, 60.0, 12.0));

        var captor = ArgumentCaptor.forClass(SpeedReport.class);
        verify(aggregator).record(captor.capture());
        var r = captor.getValue();
        assertThat(r.nodeId()).isEqualTo("lv");
        assertThat(r.capturedAt()).isEqualTo(NOW);
        assertThat(r.reportedAt()).isEqualTo(Instant.parse("2024-05-01T11:59:00Z"));
        assertThat(r.isp()).isEqualTo("Tet");
        assertThat(r.description()).isNull();
        assertThat(ack.status()).isEqualTo("ok");
        assertThat(ack.nodeId()).isEqualTo("lv");
        assertThat(ack.receivedAt()).isEqualTo(NOW);
    }

    @Test
    void blankNodeIdIsRejected() {
        assertThatThrownBy(() -> service(false).ingest(dto("  ", 1.0, 1.0, 1.0)))
                .isInstanceOf(ReportValidationException.class)
                .hasMessageContaining("node_id");
        verify(aggregator, never()).record(any());
    }

    @Test
    void negativeAndNonFiniteMeasurementsAreRejected() {
        assertThatThrownBy(() -> service(false).ingest(dto("lv", -1.0, 1.0, 1.0)))
                .isInstanceOf(ReportValidationException.class)
                .hasMessageContaining("download_mbps");
        assertThatThrownBy(() -> service(false).ingest(dto("lv", 1.0, Double.NaN, 1.0)))
                .isInstanceOf(ReportValidationException.class)
                .hasMessageContaining("upload_mbps");
        assertThatThrownBy(() -> service(false).ingest(dto("lv", 1.0, 1.0, null)))
                .isInstanceOf(ReportValidationException.class)
                .hasMessageContaining("ping_ms");
        verify(aggregator, never()).record(any());
    }

    @Test
    void immediateDigestOnlyWhenEnabled() {
        service(false).ingest(dto("lv", 10.0, 1.0, 1.0));
        verify(digests, never()).dispatchAsync(any());

        service(true).ingest(dto("lv", 10.0, 1.0, 1.0));
        verify(digests).dispatchAsync(DigestService.Trigger.REPORT);
    }

    @Test
    void clientTimestampParsing() {
        assertThat(IngestService.parseClientTime("2024-05-01T10:00:00")).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(IngestService.parseClientTime("yesterday")).isNull();
        assertThat(IngestService.parseClientTime(null)).isNull();
    }
}
