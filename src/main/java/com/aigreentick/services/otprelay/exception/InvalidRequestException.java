package com.aigreentick.services.otprelay.exception;

import com.aigreentick.services.otprelay.constants.OtpRelayConstants;

/**
 * Thrown for malformed or incomplete callback payloads and command arguments
 */
public class InvalidRequestException extends OtpRelayException {

    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }

    public static InvalidRequestException missingPayload() {
        return new InvalidRequestException("Callback body is missing or empty");
    }

    public static InvalidRequestException malformedPayload() {
        return new InvalidRequestException("Callback payload is not a JSON object");
    }

    public static InvalidRequestException missingNumber() {
        return new InvalidRequestException(OtpRelayConstants.ERROR_MISSING_NUMBER);
    }

    public static InvalidRequestException blankRange() {
        return new InvalidRequestException("Range prefix is required");
    }
}
