package org.caureq.caureqspeedboard.api;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.config.TelegramProps;
import org.caureq.caureqspeedboard.service.telegram.TelegramUpdateHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Telegram webhook target, active only with telegram.updates=webhook.
 * Always answers 200 once authenticated so Telegram does not redeliver.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/telegram/webhook")
@RequiredArgsConstructor
public class TelegramWebhookController {
    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final TelegramProps props;
    private final TelegramUpdateHandler handler;

    @PostMapping
    public ResponseEntity<Void> update(@RequestHeader(value = SECRET_HEADER, required = false) String secret,
                                       @RequestBody JsonNode update) {
        if (props.updates() != TelegramProps.UpdatesMode.WEBHOOK) {
            return ResponseEntity.notFound().build();
        }
        if (!secretMatches(secret)) {
            log.warn("[Telegram] webhook call with bad secret token");
            return ResponseEntity.status(401).build();
        }
        handler.handle(update);
        return ResponseEntity.ok().build();
    }

    private boolean secretMatches(String presented) {
        var expected = props.webhookSecret();
        if (expected == null || expected.isBlank()) return true;
        if (presented == null) return false;
        return MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
