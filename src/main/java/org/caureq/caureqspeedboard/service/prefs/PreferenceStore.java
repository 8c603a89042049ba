package org.caureq.caureqspeedboard.service.prefs;

import org.caureq.caureqspeedboard.domain.Language;
import org.caureq.caureqspeedboard.domain.RecipientPref;
import org.caureq.caureqspeedboard.domain.ViewMode;

/**
 * Per-recipient language and view mode. Lookups never fail; mutations are durable
 * before they return.
 */
public interface PreferenceStore {

    /** Existing preference, or the recipient's default, which is persisted on first read. */
    RecipientPref getOrDefault(String recipientId);

    /** @throws PreferencePersistenceException when the change could not be stored */
    RecipientPref setLanguage(String recipientId, Language language);

    /** @throws PreferencePersistenceException when the change could not be stored */
    RecipientPref setViewMode(String recipientId, ViewMode viewMode);
}
