package org.caureq.caureqspeedboard.domain;

import lombok.Builder;

import java.time.Instant;

/**
 * Latest measurement received from one node. Immutable; a newer report for the
 * same node replaces the whole record.
 *
 * capturedAt is the master's clock at ingestion, reportedAt is whatever the node claimed.
 */
@Builder(toBuilder = true)
public record SpeedReport(String nodeId,
                          double downloadMbps,
                          double uploadMbps,
                          double pingMs,
                          String isp,
                          String location,
                          String osInfo,
                          String testServer,
                          String description,
                          Instant reportedAt,
                          Instant capturedAt) {
}
