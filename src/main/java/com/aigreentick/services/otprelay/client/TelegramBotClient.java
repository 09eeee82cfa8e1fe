package com.aigreentick.services.otprelay.client;

import com.aigreentick.services.otprelay.constants.OtpRelayConstants;
import com.aigreentick.services.otprelay.dto.telegram.TelegramResponse;
import com.aigreentick.services.otprelay.dto.telegram.TelegramUpdate;
import com.aigreentick.services.otprelay.exception.TelegramApiException;
import com.aigreentick.services.otprelay.util.CandidateFields;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Map;

/**
 * HTTP client for the Telegram Bot API.
 *
 * Only the two methods the relay needs: sendMessage for replies and OTP
 * delivery, getUpdates for the command poller. The base URL already carries
 * the bot token (see WebClientConfig).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TelegramBotClient {

    @Qualifier("telegramWebClient")
    private final WebClient webClient;

    private static final ParameterizedTypeReference<TelegramResponse<Map<String, Object>>> MESSAGE_TYPE =
            new ParameterizedTypeReference<>() {};

    private static final ParameterizedTypeReference<TelegramResponse<List<TelegramUpdate>>> UPDATES_TYPE =
            new ParameterizedTypeReference<>() {};

    /**
     * Send a plain-text message. Text over Telegram's limit is truncated.
     */
    @RateLimiter(name = "telegramSend")
    public void sendMessage(long chatId, String text) {
        String body = CandidateFields.truncate(text, OtpRelayConstants.TELEGRAM_MAX_MESSAGE_LENGTH);
        try {
            TelegramResponse<Map<String, Object>> response = webClient.post()
                    .uri("/sendMessage")
                    .bodyValue(Map.of("chat_id", chatId, "text", body))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, res ->
                            res.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(error -> new TelegramApiException(
                                            "sendMessage failed (" + res.statusCode().value() + "): " + error,
                                            res.statusCode().value())))
                    .bodyToMono(MESSAGE_TYPE)
                    .block();

            requireOk(response, "sendMessage");
            log.debug("Telegram message sent: chatId={}", chatId);
        } catch (WebClientResponseException ex) {
            throw new TelegramApiException("sendMessage failed: " + ex.getMessage(), ex.getStatusCode().value());
        } catch (WebClientRequestException ex) {
            throw new TelegramApiException("Telegram unreachable: " + ex.getMessage(), ex);
        }
    }

    /**
     * Long-poll for updates after {@code offset}.
     */
    public List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds) {
        try {
            TelegramResponse<List<TelegramUpdate>> response = webClient.get()
                    .uri(uri -> uri
                            .path("/getUpdates")
                            .queryParam("offset", offset)
                            .queryParam("timeout", timeoutSeconds)
                            .queryParam("allowed_updates", "[\"message\"]")
                            .build())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, res ->
                            res.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(error -> new TelegramApiException(
                                            "getUpdates failed (" + res.statusCode().value() + "): " + error,
                                            res.statusCode().value())))
                    .bodyToMono(UPDATES_TYPE)
                    .block();

            requireOk(response, "getUpdates");
            return response.getResult() != null ? response.getResult() : List.of();
        } catch (WebClientResponseException ex) {
            throw new TelegramApiException("getUpdates failed: " + ex.getMessage(), ex.getStatusCode().value());
        } catch (WebClientRequestException ex) {
            throw new TelegramApiException("Telegram unreachable: " + ex.getMessage(), ex);
        }
    }

    private void requireOk(TelegramResponse<?> response, String method) {
        if (response == null) {
            throw new TelegramApiException(method + " returned an empty body", 502);
        }
        if (!response.isOk()) {
            int status = response.getErrorCode() != null ? response.getErrorCode() : 502;
            throw new TelegramApiException(method + " not ok: " + response.getDescription(), status);
        }
    }
}
