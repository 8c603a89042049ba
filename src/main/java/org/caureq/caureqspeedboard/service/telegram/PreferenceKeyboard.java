package org.caureq.caureqspeedboard.service.telegram;

import org.caureq.caureqspeedboard.domain.Language;
import org.caureq.caureqspeedboard.domain.RecipientPref;
import org.caureq.caureqspeedboard.domain.ViewMode;
import org.caureq.caureqspeedboard.service.render.Labels;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Buttons attached to every digest so a chat can switch its own language and view.
 * Callback data is "lang:&lt;code&gt;" or "view:&lt;code&gt;".
 */
@Component
public class PreferenceKeyboard {
    static final String LANG_PREFIX = "lang:";
    static final String VIEW_PREFIX = "view:";
    private static final String CURRENT = "✓ ";

    public InlineKeyboard forPreference(RecipientPref pref) {
        var langRow = new ArrayList<InlineKeyboard.Button>();
        for (var l : Language.values()) {
            var text = (l == pref.getLanguage() ? CURRENT : "") + l.buttonText();
            langRow.add(new InlineKeyboard.Button(text, LANG_PREFIX + l.code()));
        }
        var viewRow = new ArrayList<InlineKeyboard.Button>();
        for (var v : ViewMode.values()) {
            var text = (v == pref.getViewMode() ? CURRENT : "") + Labels.view(v, pref.getLanguage());
            viewRow.add(new InlineKeyboard.Button(text, VIEW_PREFIX + v.code()));
        }
        return new InlineKeyboard(List.of(List.copyOf(langRow), List.copyOf(viewRow)));
    }

    /** Parsed button press; empty when the data is not one of ours. */
    public Optional<Choice> parse(String callbackData) {
        if (callbackData == null) return Optional.empty();
        if (callbackData.startsWith(LANG_PREFIX)) {
            var code = callbackData.substring(LANG_PREFIX.length());
            if (!Language.isSupported(code)) return Optional.empty();
            return Optional.of(new Choice(Language.fromCode(code), null));
        }
        if (callbackData.startsWith(VIEW_PREFIX)) {
            var code = callbackData.substring(VIEW_PREFIX.length());
            if (!ViewMode.isSupported(code)) return Optional.empty();
            return Optional.of(new Choice(null, ViewMode.fromCode(code)));
        }
        return Optional.empty();
    }

    /** Exactly one of language or viewMode is set. */
    public record Choice(Language language, ViewMode viewMode) {}
}
