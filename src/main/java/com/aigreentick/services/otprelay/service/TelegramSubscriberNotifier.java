package com.aigreentick.services.otprelay.service;

import com.aigreentick.services.otprelay.client.TelegramBotClient;
import com.aigreentick.services.otprelay.exception.TelegramApiException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sends chat messages through the Telegram Bot API. A failed send is logged
 * once and not retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelegramSubscriberNotifier implements SubscriberNotifier {

    private final TelegramBotClient telegramBotClient;

    @Override
    public boolean notify(long subscriberId, String text) {
        try {
            telegramBotClient.sendMessage(subscriberId, text);
            return true;
        } catch (TelegramApiException ex) {
            log.error("Failed to send Telegram message to {}: {}", subscriberId, ex.getMessage());
        } catch (RequestNotPermitted ex) {
            log.error("Telegram send rate limit exceeded, message to {} dropped", subscriberId);
        }
        return false;
    }
}
