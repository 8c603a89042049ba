package org.caureq.caureqspeedboard.api.dto;

import org.caureq.caureqspeedboard.domain.NodeHealth;
import org.caureq.caureqspeedboard.domain.NodeView;
import org.caureq.caureqspeedboard.domain.SpeedReport;
import org.caureq.caureqspeedboard.domain.Tier;

import java.time.Instant;

/** Operator view of one node: classification plus the retained last report. */
public record NodeStatusDTO(String nodeId, String flag, String displayName, int orderRank,
                            boolean stale, Tier tier, NodeHealth health,
                            Instant lastSeen, SpeedReport lastReport) {

    public static NodeStatusDTO from(NodeView v) {
        var last = v.lastReport();
        return new NodeStatusDTO(v.meta().nodeId(), v.meta().flag(), v.meta().label(), v.meta().orderRank(),
                v.stale(), v.tier(), v.health(),
                last == null ? null : last.capturedAt(), last);
    }
}
