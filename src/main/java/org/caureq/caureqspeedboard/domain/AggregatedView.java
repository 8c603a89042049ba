package org.caureq.caureqspeedboard.domain;

import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Point-in-time view of every known node, in display order. */
public record AggregatedView(Instant generatedAt,
                             ZoneId zone,
                             List<NodeView> nodes,
                             ClusterStatus clusterStatus) {

    public AggregatedView {
        nodes = List.copyOf(nodes);
    }

    public Map<NodeHealth, Integer> summary() {
        var counts = new EnumMap<NodeHealth, Integer>(NodeHealth.class);
        for (var h : NodeHealth.values()) counts.put(h, 0);
        for (var n : nodes) counts.merge(n.health(), 1, Integer::sum);
        return counts;
    }
}
