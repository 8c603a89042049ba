package org.caureq.caureqspeedboard.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.api.dto.ReportAck;
import org.caureq.caureqspeedboard.api.dto.ReportDTO;
import org.caureq.caureqspeedboard.config.AppProps;
import org.caureq.caureqspeedboard.domain.SpeedReport;
import org.caureq.caureqspeedboard.service.digest.DigestService;
import org.caureq.caureqspeedboard.service.status.StatusClassifier;
import org.springframework.stereotype.Service;

import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngestService {
    private final AggregatorService aggregator;
    private final DigestService digests;
    private final AppProps props;
    private final Clock clock;

    /**
     * Records a report stamped with the master's clock. The optional immediate digest is
     * queued and never affects the outcome of this call.
     */
    public ReportAck ingest(ReportDTO d) {
        var nodeId = d.nodeId() == null ? "" : d.nodeId().trim();
        if (nodeId.isEmpty()) throw new ReportValidationException("node_id", "node_id must not be empty");
        double down = requireMeasurement("download_mbps", d.downloadMbps());
        double up = requireMeasurement("upload_mbps", d.uploadMbps());
        double ping = requireMeasurement("ping_ms", d.pingMs());

        var now = clock.instant();
        var report = SpeedReport.builder()
                .nodeId(nodeId)
                .downloadMbps(down)
                .uploadMbps(up)
                .pingMs(ping)
                .isp(blankToNull(d.isp()))
                .location(blankToNull(d.location()))
                .osInfo(blankToNull(d.osInfo()))
                .testServer(blankToNull(d.testServer()))
                .description(blankToNull(d.description()))
                .reportedAt(parseClientTime(d.timestamp()))
                .capturedAt(now)
                .build();

        aggregator.record(report);
        var tier = StatusClassifier.classify(down, up, ping, props.thresholds().bounds());
        log.info("report from {} down={} up={} ping={} tier={}", nodeId, down, up, ping, tier);

        if (props.schedule().sendImmediately()) {
            digests.dispatchAsync(DigestService.Trigger.REPORT);
        }
        return ReportAck.ok(nodeId, now);
    }

    private static double requireMeasurement(String field, Double v) {
        if (v == null) throw new ReportValidationException(field, field + " is required");
        if (!Double.isFinite(v)) throw new ReportValidationException(field, field + " must be a finite number");
        if (v < 0) throw new ReportValidationException(field, field + " must be >= 0");
        return v;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private static final List<Function<String, Instant>> CLIENT_TIME_FORMATS = List.of(
            v -> OffsetDateTime.parse(v).toInstant(),
            v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC)
    );

    /** Accepts ISO offsets or zone-less local times (read as UTC); anything else is dropped. */
    static Instant parseClientTime(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var s = raw.trim();
        DateTimeParseException last = null;
        for (var format : CLIENT_TIME_FORMATS) {
            try {
                return format.apply(s);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        log.debug("unparseable node timestamp '{}': {}", s, last.getMessage());
        return null;
    }
}
