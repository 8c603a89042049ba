package org.caureq.caureqspeedboard.domain;

import java.util.Locale;

/** Languages a digest can be rendered in. EN is the fallback. */
public enum Language {
    EN("en", "🇬🇧 English"),
    RU("ru", "🇷🇺 Русский");

    public static final Language FALLBACK = EN;

    private final String code;
    private final String buttonText;

    Language(String code, String buttonText) {
        this.code = code;
        this.buttonText = buttonText;
    }

    public String code() { return code; }

    public String buttonText() { return buttonText; }

    /** Unknown, blank or null codes resolve to {@link #FALLBACK}. */
    public static Language fromCode(String code) {
        if (code == null) return FALLBACK;
        var c = code.trim().toLowerCase(Locale.ROOT);
        for (var l : values()) {
            if (l.code.equals(c)) return l;
        }
        return FALLBACK;
    }

    public static boolean isSupported(String code) {
        if (code == null) return false;
        var c = code.trim().toLowerCase(Locale.ROOT);
        for (var l : values()) {
            if (l.code.equals(c)) return true;
        }
        return false;
    }
}
