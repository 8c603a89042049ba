package org.caureq.caureqspeedboard.domain;

/** Display attributes of a node, configured out-of-band. */
public record NodeMeta(String nodeId, String flag, String displayName, int orderRank) {

    public String label() {
        return (displayName == null || displayName.isBlank()) ? nodeId : displayName;
    }

    /** Meta for a node that reports without being configured. */
    public static NodeMeta unconfigured(String nodeId) {
        return new NodeMeta(nodeId, null, nodeId, Integer.MAX_VALUE);
    }
}
