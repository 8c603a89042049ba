package org.caureq.caureqspeedboard.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.config.AppProps;
import org.caureq.caureqspeedboard.domain.*;
import org.caureq.caureqspeedboard.service.state.NodeRegistry;
import org.caureq.caureqspeedboard.service.state.NodeStateStore;
import org.caureq.caureqspeedboard.service.status.StatusClassifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Owns the node state and turns it into {@link AggregatedView}s.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregatorService {
    private final NodeStateStore store;
    private final NodeRegistry registry;
    private final AppProps props;
    private final Clock clock;

    /** Last arrival wins, regardless of the report's own timestamps. */
    public Optional<SpeedReport> record(SpeedReport report) {
        registry.noteReporting(report.nodeId());
        return store.put(report);
    }

    public AggregatedView buildView() {
        return buildView(clock.instant());
    }

    public AggregatedView buildView(Instant now) {
        var snapshot = store.snapshot();
        var window = props.status().staleWindow();
        var bounds = props.thresholds().bounds();

        var rows = new ArrayList<NodeView>();
        for (var meta : registry.ordered(snapshot.keySet())) {
            var last = snapshot.get(meta.nodeId());
            boolean stale = isStale(last, now, window);
            Tier tier = null;
            if (!stale) {
                tier = StatusClassifier.classify(last.downloadMbps(), last.uploadMbps(), last.pingMs(), bounds);
            }
            var health = StatusClassifier.health(tier, stale);
            rows.add(new NodeView(meta, stale ? null : last, last, stale, tier, health));
        }
        var cluster = StatusClassifier.clusterStatus(rows.stream().map(NodeView::health).toList());
        return new AggregatedView(now, props.zone(), rows, cluster);
    }

    static boolean isStale(SpeedReport last, Instant now, Duration window) {
        if (last == null || last.capturedAt() == null) return true;
        return Duration.between(last.capturedAt(), now).compareTo(window) > 0;
    }
}
