package org.caureq.caureqspeedboard.service.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.config.TelegramProps;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClientRequest;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Thin client for the Telegram Bot API methods the master needs.
 *
 * Every call is bounded by the configured timeout and retried with backoff only for
 * transient failures. The bot token is part of the URL, so it never goes into messages.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramClient {
    /** Telegram rejects longer message texts. */
    public static final int MAX_MESSAGE_LENGTH = 4096;
    private static final String ELLIPSIS = "\n…";

    private final TelegramProps props;
    private final WebClient telegramWebClient;
    private final ObjectMapper om = new ObjectMapper();

    @PostConstruct
    void checkToken() {
        if (!isEnabled()) {
            log.warn("[Telegram] disabled (enabled={} token set={}), digests will only be logged",
                    props.enabled(), props.hasToken());
            return;
        }
        var t = props.botToken();
        var masked = t.length() > 6 ? t.substring(0, 6) + "********" : "********";
        log.info("[Telegram] bot token = {}", masked);
    }

    public boolean isEnabled() {
        return props.enabled() && props.hasToken();
    }

    /**
     * Sends an HTML message.
     *
     * @return the message id, empty when Telegram is disabled
     */
    public Optional<Long> sendMessage(String chatId, String html, InlineKeyboard keyboard) {
        if (!isEnabled()) {
            log.debug("[Telegram] disabled, not sending to {}:\n{}", chatId, html);
            return Optional.empty();
        }
        var body = messageBody(chatId, html, keyboard);
        var result = call("sendMessage", body);
        return Optional.of(result.path("message_id").asLong());
    }

    /** Replaces the text and buttons of a message sent earlier. */
    public void editMessageText(String chatId, long messageId, String html, InlineKeyboard keyboard) {
        if (!isEnabled()) return;
        var body = messageBody(chatId, html, keyboard);
        body.put("message_id", messageId);
        try {
            call("editMessageText", body);
        } catch (TelegramApiException e) {
            // pressing the already-selected button yields "message is not modified"
            if (e.status() == 400 && String.valueOf(e.payload().get("raw")).contains("message is not modified")) {
                log.debug("[Telegram] message {} in {} unchanged", messageId, chatId);
                return;
            }
            throw e;
        }
    }

    public void answerCallbackQuery(String callbackQueryId, String text) {
        if (!isEnabled()) return;
        var body = om.createObjectNode();
        body.put("callback_query_id", callbackQueryId);
        if (text != null && !text.isBlank()) body.put("text", text);
        call("answerCallbackQuery", body);
    }

    /**
     * Long-polls for updates after {@code offset}.
     *
     * @return the JSON array of updates, empty when disabled
     */
    public JsonNode getUpdates(long offset, int timeoutSeconds) {
        if (!isEnabled()) return om.createArrayNode();
        var body = om.createObjectNode();
        body.put("offset", offset);
        body.put("timeout", timeoutSeconds);
        body.putArray("allowed_updates").add("message").add("callback_query");
        // the server holds the request for timeoutSeconds, so allow for it on top of the usual limit
        return call("getUpdates", body, props.timeout().plusSeconds(timeoutSeconds), 0);
    }

    private ObjectNode messageBody(String chatId, String html, InlineKeyboard keyboard) {
        var body = om.createObjectNode();
        body.put("chat_id", chatId);
        body.put("text", truncate(html));
        body.put("parse_mode", "HTML");
        body.put("disable_web_page_preview", true);
        if (keyboard != null) body.set("reply_markup", om.valueToTree(keyboard));
        return body;
    }

    private JsonNode call(String method, ObjectNode body) {
        return call(method, body, props.timeout(), props.maxRetries());
    }

    private JsonNode call(String method, ObjectNode body, Duration timeout, int retries) {
        var spec = telegramWebClient.post()
                .uri("/bot{token}/{method}", props.botToken(), method)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                // overrides the connector-wide response timeout, which is shorter than a long poll
                .httpRequest(r -> r.<HttpClientRequest>getNativeRequest().responseTimeout(timeout))
                .retrieve();
        var response = handle(spec, method, timeout, retries).block();
        if (response == null || !response.path("ok").asBoolean(false)) {
            var description = response == null ? "empty response" : response.path("description").asText("");
            throw new TelegramApiException(200, "Telegram %s not ok: %s".formatted(method, description),
                    Map.of("raw", String.valueOf(response)));
        }
        return response.path("result");
    }

    /** Central error mapping and bounded retry. */
    private Mono<JsonNode> handle(WebClient.ResponseSpec spec, String method, Duration timeout, int retries) {
        return spec
                .onStatus(s -> !s.is2xxSuccessful(),
                        r -> r.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> new TelegramApiException(
                                        r.statusCode().value(),
                                        "Telegram API error " + r.statusCode().value() + " on " + method
                                                + (body.isBlank() ? "" : " -> " + body),
                                        Map.of("raw", body)
                                ))
                )
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .onErrorMap(ex -> !(ex instanceof TelegramApiException), ex -> unreachable(method, ex))
                .retryWhen(
                        Retry.backoff(retries, props.retryBackoff()).jitter(0.4)
                                .filter(ex -> ex instanceof TelegramApiException t && t.isTransient())
                                .doBeforeRetry(s -> log.debug("[Telegram] retry {} of {} after: {}",
                                        s.totalRetries() + 1, method, s.failure().getMessage()))
                                .onRetryExhaustedThrow((r, s) -> s.failure())
                );
    }

    private static TelegramApiException unreachable(String method, Throwable ex) {
        String reason;
        if (ex instanceof TimeoutException) {
            reason = "timed out";
        } else if (ex instanceof WebClientRequestException w) {
            // its message carries the request URL, and with it the bot token
            reason = w.getMostSpecificCause().getClass().getSimpleName();
        } else {
            reason = ex.getClass().getSimpleName();
        }
        return new TelegramApiException(0, "Telegram " + method + " unreachable: " + reason, (Throwable) null);
    }

    /**
     * Cuts at the last whole line that fits, so no tag or entity is split.
     * Rendered lines never span a tag. A single oversized line falls back to its last space.
     */
    static String truncate(String text) {
        if (text.length() <= MAX_MESSAGE_LENGTH) return text;
        int limit = MAX_MESSAGE_LENGTH - ELLIPSIS.length();
        int cut = text.lastIndexOf('\n', limit);
        if (cut <= 0) cut = text.lastIndexOf(' ', limit);
        if (cut <= 0) cut = limit;
        return text.substring(0, cut) + ELLIPSIS;
    }
}
