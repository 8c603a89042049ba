package org.caureq.caureqspeedboard.domain;

/**
 * One row of an {@link AggregatedView}.
 *
 * report is null when the node never reported or its last report is stale;
 * lastReport keeps the retained report either way.
 */
public record NodeView(NodeMeta meta,
                       SpeedReport report,
                       SpeedReport lastReport,
                       boolean stale,
                       Tier tier,
                       NodeHealth health) {

    public boolean online() { return !stale && report != null; }
}
