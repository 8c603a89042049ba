package org.caureq.caureqspeedboard.service.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.domain.RecipientPref;
import org.caureq.caureqspeedboard.service.AggregatorService;
import org.caureq.caureqspeedboard.service.digest.DigestService;
import org.caureq.caureqspeedboard.service.prefs.PreferencePersistenceException;
import org.caureq.caureqspeedboard.service.prefs.PreferenceStore;
import org.caureq.caureqspeedboard.service.render.DigestRenderer;
import org.caureq.caureqspeedboard.service.render.Labels;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Routes inbound Telegram updates, whether they arrive by webhook or long polling.
 *
 * Button presses change the pressing chat's preference and re-render the message they belong to.
 * Commands: /start and /settings register the chat and show the buttons, /report sends the current digest.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramUpdateHandler {
    private final PreferenceStore prefs;
    private final PreferenceKeyboard keyboard;
    private final DigestRenderer renderer;
    private final AggregatorService aggregator;
    private final DigestService digests;
    private final TelegramClient telegram;

    /** Never throws; a bad update must not hold back the ones after it. */
    public void handle(JsonNode update) {
        try {
            if (update.hasNonNull("callback_query")) {
                onCallback(update.get("callback_query"));
            } else if (update.hasNonNull("message")) {
                onMessage(update.get("message"));
            }
        } catch (RuntimeException e) {
            log.error("[Telegram] update {} failed: {}", update.path("update_id").asLong(-1), e.getMessage());
        }
    }

    void onCallback(JsonNode cq) {
        var callbackId = cq.path("id").asText();
        var message = cq.path("message");
        var chatId = message.path("chat").path("id").asText("");
        if (chatId.isEmpty()) {
            telegram.answerCallbackQuery(callbackId, null);
            return;
        }
        var current = prefs.getOrDefault(chatId);
        var choice = keyboard.parse(cq.path("data").asText(null));
        if (choice.isEmpty()) {
            telegram.answerCallbackQuery(callbackId, Labels.get("pref_unknown", current.getLanguage()));
            return;
        }

        RecipientPref updated;
        try {
            var c = choice.get();
            updated = c.language() != null
                    ? prefs.setLanguage(chatId, c.language())
                    : prefs.setViewMode(chatId, c.viewMode());
        } catch (PreferencePersistenceException e) {
            telegram.answerCallbackQuery(callbackId, Labels.get("pref_failed", current.getLanguage()));
            return;
        }
        telegram.answerCallbackQuery(callbackId, Labels.get("pref_saved", updated.getLanguage()));

        var messageId = message.path("message_id").asLong(0);
        if (messageId > 0) {
            var text = renderer.render(aggregator.buildView(), updated);
            telegram.editMessageText(chatId, messageId, text, keyboard.forPreference(updated));
        }
    }

    void onMessage(JsonNode message) {
        var chatId = message.path("chat").path("id").asText("");
        var command = command(message.path("text").asText(""));
        if (chatId.isEmpty() || command.isEmpty()) return;

        switch (command) {
            case "/start", "/settings" -> {
                var pref = prefs.getOrDefault(chatId);
                var text = Labels.get("settings_prompt", pref.getLanguage()) + "\n\n"
                        + renderer.render(aggregator.buildView(), pref);
                telegram.sendMessage(chatId, text, keyboard.forPreference(pref));
            }
            case "/report" -> digests.sendCurrent(chatId);
            default -> log.debug("[Telegram] ignoring {} from {}", command, chatId);
        }
    }

    /** "/Report@my_bot extra" -> "/report"; plain text -> "". */
    static String command(String text) {
        var t = text.trim();
        if (!t.startsWith("/")) return "";
        int end = t.length();
        for (int i = 1; i < t.length(); i++) {
            char ch = t.charAt(i);
            if (ch == '@' || Character.isWhitespace(ch)) { end = i; break; }
        }
        return t.substring(0, end).toLowerCase(Locale.ROOT);
    }
}
