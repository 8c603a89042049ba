package org.caureq.caureqspeedboard.domain;

public enum NodeHealth {
    OK("✅"),
    DEGRADED("⚠️"),
    STALE("🔴");

    private final String glyph;

    NodeHealth(String glyph) { this.glyph = glyph; }

    public String glyph() { return glyph; }
}
