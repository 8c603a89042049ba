package org.caureq.caureqspeedboard.domain;

import java.util.Locale;

public enum ViewMode {
    COMPACT("compact"),
    DETAILED("detailed");

    private final String code;

    ViewMode(String code) { this.code = code; }

    public String code() { return code; }

    public ViewMode toggle() { return this == COMPACT ? DETAILED : COMPACT; }

    /** Unknown codes resolve to COMPACT. */
    public static ViewMode fromCode(String code) {
        if (code == null) return COMPACT;
        var c = code.trim().toLowerCase(Locale.ROOT);
        return DETAILED.code.equals(c) ? DETAILED : COMPACT;
    }

    public static boolean isSupported(String code) {
        if (code == null) return false;
        var c = code.trim().toLowerCase(Locale.ROOT);
        return COMPACT.code.equals(c) || DETAILED.code.equals(c);
    }
}
