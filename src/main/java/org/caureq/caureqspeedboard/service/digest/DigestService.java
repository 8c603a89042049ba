package org.caureq.caureqspeedboard.service.digest;

import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.domain.AggregatedView;
import org.caureq.caureqspeedboard.service.AggregatorService;
import org.caureq.caureqspeedboard.service.prefs.PreferenceStore;
import org.caureq.caureqspeedboard.service.prefs.RecipientDefaults;
import org.caureq.caureqspeedboard.service.render.DigestRenderer;
import org.caureq.caureqspeedboard.service.telegram.PreferenceKeyboard;
import org.caureq.caureqspeedboard.service.telegram.TelegramClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Builds one view and sends it to every configured recipient in that recipient's preferences.
 *
 * Scheduled and report-triggered digests share {@link #buildAndDispatch}. Only one digest runs
 * at a time: a scheduled tick that finds one running is skipped, a triggered one waits.
 */
@Slf4j
@Service
public class DigestService {
    private final AggregatorService aggregator;
    private final PreferenceStore prefs;
    private final RecipientDefaults recipients;
    private final DigestRenderer renderer;
    private final PreferenceKeyboard keyboard;
    private final TelegramClient telegram;
    private final TaskExecutor digestExecutor;

    private final ReentrantLock running = new ReentrantLock();
    private volatile Instant lastDigestAt;

    public enum Trigger { SCHEDULED, REPORT }

    public record DigestResult(Trigger trigger, int sent, int failed, boolean skipped) {
        static DigestResult skipped(Trigger trigger) { return new DigestResult(trigger, 0, 0, true); }
    }

    public DigestService(AggregatorService aggregator, PreferenceStore prefs, RecipientDefaults recipients,
                         DigestRenderer renderer, PreferenceKeyboard keyboard, TelegramClient telegram,
                         @Qualifier("digestExecutor") TaskExecutor digestExecutor) {
        this.aggregator = aggregator;
        this.prefs = prefs;
        this.recipients = recipients;
        this.renderer = renderer;
        this.keyboard = keyboard;
        this.telegram = telegram;
        this.digestExecutor = digestExecutor;
    }

    /** Timer path: never overlaps a digest already in flight. */
    public DigestResult runScheduled() {
        if (!running.tryLock()) {
            log.warn("[Digest] previous digest still dispatching, skipping this tick");
            return DigestResult.skipped(Trigger.SCHEDULED);
        }
        try {
            return buildAndDispatch(Trigger.SCHEDULED);
        } finally {
            running.unlock();
        }
    }

    /** Report path: queued on the digest executor, failures only logged. */
    public void dispatchAsync(Trigger trigger) {
        try {
            digestExecutor.execute(() -> {
                running.lock();
                try {
                    buildAndDispatch(trigger);
                } catch (RuntimeException e) {
                    log.error("[Digest] {} digest failed: {}", trigger, e.getMessage(), e);
                } finally {
                    running.unlock();
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("[Digest] {} digest not queued: {}", trigger, e.getMessage());
        }
    }

    DigestResult buildAndDispatch(Trigger trigger) {
        var view = aggregator.buildView();
        int sent = 0, failed = 0;
        for (var chatId : recipients.recipientIds()) {
            if (sendTo(chatId, view)) sent++; else failed++;
        }
        lastDigestAt = view.generatedAt();
        log.info("[Digest] {} digest: cluster={} nodes={} sent={} failed={}",
                trigger, view.clusterStatus(), view.nodes().size(), sent, failed);
        return new DigestResult(trigger, sent, failed, false);
    }

    /** Renders and sends the current state to a single chat, outside the configured list. */
    public boolean sendCurrent(String chatId) {
        return sendTo(chatId, aggregator.buildView());
    }

    private boolean sendTo(String chatId, AggregatedView view) {
        try {
            var pref = prefs.getOrDefault(chatId);
            var text = renderer.render(view, pref);
            telegram.sendMessage(chatId, text, keyboard.forPreference(pref));
            return true;
        } catch (RuntimeException e) {
            log.error("[Digest] dispatch to {} failed: {}", chatId, e.getMessage());
            return false;
        }
    }

    public Optional<Instant> lastDigestAt() {
        return Optional.ofNullable(lastDigestAt);
    }
}
