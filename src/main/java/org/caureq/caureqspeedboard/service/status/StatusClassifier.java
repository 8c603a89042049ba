package org.caureq.caureqspeedboard.service.status;

import org.caureq.caureqspeedboard.domain.ClusterStatus;
import org.caureq.caureqspeedboard.domain.NodeHealth;
import org.caureq.caureqspeedboard.domain.Tier;

import java.util.Collection;
import java.util.Map;

/**
 * Pure tier and health classification, shared by ingestion logging, the aggregator and the renderer.
 *
 * Download is the only input that moves the tier. Upload and ping are accepted so callers
 * can pass a whole measurement, but the base policy ignores them.
 */
public final class StatusClassifier {

    private StatusClassifier() {}

    /**
     * Highest tier whose lower bound is met by {@code download}.
     * VERY_LOW is the floor; tiers without a bound are never selected.
     */
    public static Tier classify(double download, double upload, double ping, Map<Tier, Double> bounds) {
        Tier best = Tier.VERY_LOW;
        if (!Double.isFinite(download) || bounds == null) return best;
        for (Tier t : Tier.values()) {
            Double lower = bounds.get(t);
            if (lower != null && download >= lower && t.compareTo(best) > 0) {
                best = t;
            }
        }
        return best;
    }

    /** Stale nodes are STALE whatever their last tier; anything under LOW is DEGRADED. */
    public static NodeHealth health(Tier tier, boolean stale) {
        if (stale || tier == null) return NodeHealth.STALE;
        return tier.isBelow(Tier.LOW) ? NodeHealth.DEGRADED : NodeHealth.OK;
    }

    /** DEGRADED as soon as one node is stale or degraded. */
    public static ClusterStatus clusterStatus(Collection<NodeHealth> nodes) {
        for (NodeHealth h : nodes) {
            if (h != NodeHealth.OK) return ClusterStatus.DEGRADED;
        }
        return ClusterStatus.OK;
    }
}
