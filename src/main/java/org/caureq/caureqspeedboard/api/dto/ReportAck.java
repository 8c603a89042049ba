package org.caureq.caureqspeedboard.api.dto;

import java.time.Instant;

public record ReportAck(String status, String nodeId, Instant receivedAt) {
    public static ReportAck ok(String nodeId, Instant receivedAt) {
        return new ReportAck("ok", nodeId, receivedAt);
    }
}
