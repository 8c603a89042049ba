package org.caureq.caureqspeedboard.service.state;

import org.caureq.caureqspeedboard.domain.SpeedReport;

import java.util.Map;
import java.util.Optional;

/**
 * Latest report per node. Replacement is whole-record; snapshots are point-in-time copies.
 */
public interface NodeStateStore {

    Optional<SpeedReport> get(String nodeId);

    /** Replaces the node's report, returning the previous one if any. */
    Optional<SpeedReport> put(SpeedReport report);

    /** Immutable copy, consistent across all nodes. */
    Map<String, SpeedReport> snapshot();
}
