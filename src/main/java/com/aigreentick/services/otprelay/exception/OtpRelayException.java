package com.aigreentick.services.otprelay.exception;

import lombok.Getter;

/**
 * Base exception for all OTP relay exceptions
 */
@Getter
public class OtpRelayException extends RuntimeException {

    private final String errorCode;

    public OtpRelayException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public OtpRelayException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
