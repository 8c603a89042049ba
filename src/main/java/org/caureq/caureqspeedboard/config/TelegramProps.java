package org.caureq.caureqspeedboard.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "telegram")
public record TelegramProps(@DefaultValue("true") boolean enabled,
                            String botToken,
                            @DefaultValue("https://api.telegram.org") String baseUrl,
                            @DefaultValue("30s") Duration timeout,
                            @Min(0) @Max(10) @DefaultValue("3") int maxRetries,
                            @DefaultValue("2s") Duration retryBackoff,
                            String webhookSecret,
                            @DefaultValue("polling") UpdatesMode updates,
                            @DefaultValue("3s") Duration pollInterval,
                            @Min(0) @Max(50) @DefaultValue("25") int pollTimeoutSeconds) {

    /** How inbound chat events (button presses, commands) reach the master. */
    public enum UpdatesMode { POLLING, WEBHOOK, NONE }

    public boolean hasToken() { return botToken != null && !botToken.isBlank(); }
}
