package org.caureq.caureqspeedboard.service.prefs;

import org.caureq.caureqspeedboard.config.AppProps;
import org.caureq.caureqspeedboard.domain.Language;
import org.caureq.caureqspeedboard.domain.ViewMode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default language and view per recipient: its own configured defaults, else the global ones.
 */
@Component
public class RecipientDefaults {
    private final Language globalLanguage;
    private final ViewMode globalView;
    private final Map<String, AppProps.RecipientProps> byId = new LinkedHashMap<>();
    private final List<String> recipientIds;

    public RecipientDefaults(AppProps props) {
        this.globalLanguage = props.defaults().lang();
        this.globalView = props.defaults().view();
        for (var r : props.recipients()) byId.putIfAbsent(r.chatId().trim(), r);
        this.recipientIds = List.copyOf(byId.keySet());
    }

    /** Configured digest destinations, in configuration order. */
    public List<String> recipientIds() {
        return recipientIds;
    }

    public Language language(String recipientId) {
        var r = byId.get(recipientId);
        if (r == null || !Language.isSupported(r.defaultLanguage())) return globalLanguage;
        return Language.fromCode(r.defaultLanguage());
    }

    public ViewMode viewMode(String recipientId) {
        var r = byId.get(recipientId);
        if (r == null || !ViewMode.isSupported(r.defaultViewMode())) return globalView;
        return ViewMode.fromCode(r.defaultViewMode());
    }
}
