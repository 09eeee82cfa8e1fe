package com.aigreentick.services.otprelay.exception;

import lombok.Getter;

/**
 * Thrown when the allocation API returns a non-success status or cannot be reached
 *
 * - AllocationApiException: server errors (5xx), network errors, timeouts
 * - AllocationApiException.ClientException: client errors (4xx), ignored by the circuit breaker
 */
@Getter
public class AllocationApiException extends OtpRelayException {

    private final int httpStatus;

    public AllocationApiException(String message) {
        super(message, "ALLOCATION_API_ERROR");
        this.httpStatus = 503;
    }

    public AllocationApiException(String message, int httpStatus) {
        super(message, "ALLOCATION_API_ERROR");
        this.httpStatus = httpStatus;
    }

    public AllocationApiException(String message, Throwable cause) {
        super(message, "ALLOCATION_API_ERROR", cause);
        this.httpStatus = 503;
    }

    public static AllocationApiException serviceUnavailable() {
        return new AllocationApiException(
                "Allocation API is temporarily unavailable. Please try again later."
        );
    }

    public static AllocationApiException unreachable(Throwable cause) {
        return new AllocationApiException("Allocation API unreachable: " + cause.getMessage(), cause);
    }

    /**
     * A 4xx from the allocation API: bad range, bad key
     */
    @Getter
    public static class ClientException extends AllocationApiException {

        public ClientException(String message, int httpStatus) {
            super(message, httpStatus);
        }
    }
}
