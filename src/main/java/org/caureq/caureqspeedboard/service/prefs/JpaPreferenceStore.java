package org.caureq.caureqspeedboard.service.prefs;

import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.domain.Language;
import org.caureq.caureqspeedboard.domain.RecipientPref;
import org.caureq.caureqspeedboard.domain.ViewMode;
import org.caureq.caureqspeedboard.repo.RecipientPrefRepo;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Preference store backed by the recipient_prefs table.
 *
 * Each write is its own repository transaction, committed while the recipient's lock is held.
 * Reads that hit a storage error fall back to the last value this process persisted or read.
 */
@Slf4j
@Service
public class JpaPreferenceStore implements PreferenceStore {
    private final RecipientPrefRepo repo;
    private final RecipientDefaults defaults;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, RecipientPref> lastPersisted = new ConcurrentHashMap<>();

    public JpaPreferenceStore(RecipientPrefRepo repo, RecipientDefaults defaults, Clock clock) {
        this.repo = repo;
        this.defaults = defaults;
        this.clock = clock;
    }

    @Override
    public RecipientPref getOrDefault(String recipientId) {
        return withLock(recipientId, () -> {
            try {
                var pref = repo.findById(recipientId).orElseGet(() -> {
                    var created = repo.saveAndFlush(defaultFor(recipientId));
                    log.info("[Prefs] registered {} with defaults lang={} view={}",
                            recipientId, created.getLanguage(), created.getViewMode());
                    return created;
                });
                remember(pref);
                return copy(pref);
            } catch (DataAccessException e) {
                var cached = lastPersisted.get(recipientId);
                log.warn("[Prefs] read failed for {}, using {}: {}", recipientId,
                        cached != null ? "last persisted value" : "defaults", e.getMessage());
                return cached != null ? copy(cached) : defaultFor(recipientId);
            }
        });
    }

    @Override
    public RecipientPref setLanguage(String recipientId, Language language) {
        return update(recipientId, p -> p.setLanguage(language), "lang=" + language);
    }

    @Override
    public RecipientPref setViewMode(String recipientId, ViewMode viewMode) {
        return update(recipientId, p -> p.setViewMode(viewMode), "view=" + viewMode);
    }

    private RecipientPref update(String recipientId, Consumer<RecipientPref> change, String what) {
        return withLock(recipientId, () -> {
            try {
                var pref = repo.findById(recipientId).orElseGet(() -> defaultFor(recipientId));
                change.accept(pref);
                pref.setUpdatedAt(clock.instant());
                var saved = repo.saveAndFlush(pref);
                remember(saved);
                log.info("[Prefs] {} -> {}", recipientId, what);
                return copy(saved);
            } catch (DataAccessException e) {
                log.error("[Prefs] could not persist {} for {}: {}", what, recipientId, e.getMessage());
                throw new PreferencePersistenceException(recipientId, "could not persist preference " + what, e);
            }
        });
    }

    private RecipientPref defaultFor(String recipientId) {
        var now = clock.instant();
        return RecipientPref.builder()
                .recipientId(recipientId)
                .language(defaults.language(recipientId))
                .viewMode(defaults.viewMode(recipientId))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private void remember(RecipientPref pref) {
        lastPersisted.put(pref.getRecipientId(), copy(pref));
    }

    private static RecipientPref copy(RecipientPref p) {
        return p.toBuilder().build();
    }

    private <T> T withLock(String recipientId, Supplier<T> body) {
        var lock = locks.computeIfAbsent(recipientId, k -> new ReentrantLock());
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }
}
