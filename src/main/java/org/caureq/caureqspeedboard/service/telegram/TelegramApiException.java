package org.caureq.caureqspeedboard.service.telegram;

import java.util.Map;

/** Failed Telegram Bot API call. status is 0 when the API could not be reached. */
public class TelegramApiException extends RuntimeException {
    private final int status;
    private final Map<String, Object> payload;

    public TelegramApiException(int status, String message, Map<String,Object> payload) {
        super(message);
        this.status = status;
        this.payload = payload;
    }

    public TelegramApiException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.payload = Map.of();
    }

    public int status() { return status; }
    public Map<String,Object> payload() { return payload; }

    /** Rate limiting, server errors and transport failures are worth another attempt. */
    public boolean isTransient() {
        return status == 0 || status == 429 || status >= 500;
    }
}
