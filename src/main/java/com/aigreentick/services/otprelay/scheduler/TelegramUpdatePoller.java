package com.aigreentick.services.otprelay.scheduler;

import com.aigreentick.services.otprelay.client.TelegramBotClient;
import com.aigreentick.services.otprelay.config.OtpRelayProperties;
import com.aigreentick.services.otprelay.dto.telegram.TelegramUpdate;
import com.aigreentick.services.otprelay.exception.TelegramApiException;
import com.aigreentick.services.otprelay.service.BotCommandService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * ══════════════════════════════════════════════════════════════════
 * Telegram Update Poller
 * ══════════════════════════════════════════════════════════════════
 *
 * Long-polls getUpdates and hands every update to BotCommandService on
 * the commandTaskExecutor pool.
 *
 * OFFSET
 * ──────
 *   Kept in memory. Each cycle asks for updates after the highest id seen,
 *   which also acknowledges everything before it on Telegram's side.
 *   After a restart Telegram redelivers unacknowledged updates.
 *
 * FAILURES
 * ────────
 *   A failed poll is logged and the next cycle runs after the fixed delay.
 *   A command that throws is logged; the offset has already moved past it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramUpdatePoller {

    private final TelegramBotClient telegramBotClient;
    private final BotCommandService botCommandService;
    private final OtpRelayProperties properties;

    @Qualifier("commandTaskExecutor")
    private final TaskExecutor commandTaskExecutor;

    private volatile long nextOffset = 0;

    @Scheduled(fixedDelayString = "${otp-relay.telegram.poll-interval-ms:1000}")
    public void poll() {
        if (!properties.getTelegram().isPollingEnabled()) {
            return;
        }

        List<TelegramUpdate> updates;
        try {
            updates = telegramBotClient.getUpdates(nextOffset, properties.getTelegram().getLongPollTimeoutSeconds());
        } catch (TelegramApiException ex) {
            log.warn("Telegram poll failed (status={}): {}", ex.getHttpStatus(), ex.getMessage());
            return;
        }

        if (updates.isEmpty()) {
            return;
        }
        log.debug("Received {} Telegram updates", updates.size());

        for (TelegramUpdate update : updates) {
            nextOffset = Math.max(nextOffset, update.getUpdateId() + 1);
            commandTaskExecutor.execute(() -> dispatch(update));
        }
    }

    long getNextOffset() {
        return nextOffset;
    }

    private void dispatch(TelegramUpdate update) {
        try {
            botCommandService.handle(update);
        } catch (RuntimeException ex) {
            log.error("Command handling failed for update {}: {}", update.getUpdateId(), ex.getMessage(), ex);
        }
    }
}
