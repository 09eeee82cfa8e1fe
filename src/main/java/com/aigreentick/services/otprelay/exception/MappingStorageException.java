package com.aigreentick.services.otprelay.exception;

/**
 * Thrown when the mappings file cannot be read or written
 */
public class MappingStorageException extends OtpRelayException {

    public MappingStorageException(String message, Throwable cause) {
        super(message, "MAPPING_STORAGE_ERROR", cause);
    }
}
