package com.aigreentick.services.otprelay.exception;

/**
 * Thrown when a successful allocation response lacks a usable number
 */
public class AllocationResponseException extends OtpRelayException {

    public AllocationResponseException(String message) {
        super(message, "ALLOCATION_RESPONSE_INVALID");
    }
}
