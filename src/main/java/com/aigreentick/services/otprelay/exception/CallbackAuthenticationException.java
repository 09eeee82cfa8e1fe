package com.aigreentick.services.otprelay.exception;

/**
 * Thrown when a callback carries neither the configured secret nor the API key
 */
public class CallbackAuthenticationException extends OtpRelayException {

    public CallbackAuthenticationException(String message) {
        super(message, "CALLBACK_AUTH_FAILED");
    }

    public static CallbackAuthenticationException secretMismatch() {
        return new CallbackAuthenticationException("Callback secret mismatch");
    }

    public static CallbackAuthenticationException apiKeyMismatch() {
        return new CallbackAuthenticationException("Callback mapikey mismatch");
    }
}
