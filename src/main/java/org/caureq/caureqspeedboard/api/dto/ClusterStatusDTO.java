package org.caureq.caureqspeedboard.api.dto;

import org.caureq.caureqspeedboard.domain.AggregatedView;
import org.caureq.caureqspeedboard.domain.ClusterStatus;
import org.caureq.caureqspeedboard.domain.NodeHealth;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ClusterStatusDTO(Instant generatedAt, ClusterStatus status,
                               Map<NodeHealth, Integer> summary, List<NodeStatusDTO> nodes) {

    public static ClusterStatusDTO from(AggregatedView view) {
        return new ClusterStatusDTO(view.generatedAt(), view.clusterStatus(), view.summary(),
                view.nodes().stream().map(NodeStatusDTO::from).toList());
    }
}
