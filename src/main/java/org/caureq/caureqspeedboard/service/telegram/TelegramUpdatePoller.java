package org.caureq.caureqspeedboard.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.config.TelegramProps;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Long-polls getUpdates when the bot has no webhook.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "telegram", name = "updates", havingValue = "polling", matchIfMissing = true)
public class TelegramUpdatePoller {
    private final TelegramClient telegram;
    private final TelegramUpdateHandler handler;
    private final TelegramProps props;

    private long nextOffset = 0;
    private int consecutiveFailures = 0;

    @Scheduled(fixedDelayString = "${telegram.poll-interval:PT3S}", initialDelayString = "PT5S")
    public void poll() {
        if (!telegram.isEnabled()) return;
        try {
            var updates = telegram.getUpdates(nextOffset, props.pollTimeoutSeconds());
            for (var u : updates) {
                nextOffset = Math.max(nextOffset, u.path("update_id").asLong() + 1);
                handler.handle(u);
            }
            if (consecutiveFailures > 0) log.info("[Telegram] polling recovered after {} failures", consecutiveFailures);
            consecutiveFailures = 0;
        } catch (TelegramApiException e) {
            // one line per outage, not per poll
            if (consecutiveFailures++ == 0) log.warn("[Telegram] polling failed: {}", e.getMessage());
        }
    }

    long nextOffset() { return nextOffset; }
}
