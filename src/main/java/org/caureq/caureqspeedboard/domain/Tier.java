package org.caureq.caureqspeedboard.domain;

/** Download speed tiers, ordered from worst to best. */
public enum Tier {
    VERY_LOW("🚨"),
    LOW("🐌"),
    MEDIUM("🚗"),
    GOOD("👍"),
    EXCELLENT("🚀");

    private final String glyph;

    Tier(String glyph) { this.glyph = glyph; }

    public String glyph() { return glyph; }

    public boolean isBelow(Tier other) { return compareTo(other) < 0; }
}
