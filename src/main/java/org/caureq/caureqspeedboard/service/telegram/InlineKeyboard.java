package org.caureq.caureqspeedboard.service.telegram;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Telegram InlineKeyboardMarkup. */
public record InlineKeyboard(@JsonProperty("inline_keyboard") List<List<Button>> rows) {

    public record Button(@JsonProperty("text") String text,
                         @JsonProperty("callback_data") String callbackData) {}
}
