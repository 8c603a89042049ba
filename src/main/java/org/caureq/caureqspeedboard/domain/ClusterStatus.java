package org.caureq.caureqspeedboard.domain;

public enum ClusterStatus {
    OK("✅"),
    DEGRADED("⚠️");

    private final String glyph;

    ClusterStatus(String glyph) { this.glyph = glyph; }

    public String glyph() { return glyph; }
}
