package com.aigreentick.services.otprelay.exception;

import lombok.Getter;

/**
 * Thrown when the Telegram Bot API rejects a call or cannot be reached
 */
@Getter
public class TelegramApiException extends OtpRelayException {

    private final int httpStatus;

    public TelegramApiException(String message, int httpStatus) {
        super(message, "TELEGRAM_API_ERROR");
        this.httpStatus = httpStatus;
    }

    public TelegramApiException(String message, Throwable cause) {
        super(message, "TELEGRAM_API_ERROR", cause);
        this.httpStatus = 503;
    }
}
