package com.aigreentick.services.otprelay.exception;

import java.time.Duration;

/**
 * Thrown when the mappings lock is not acquired within the configured wait
 */
public class MappingLockTimeoutException extends OtpRelayException {

    public MappingLockTimeoutException(String lockName, Duration timeout) {
        super("Could not acquire " + lockName + " within " + timeout.toMillis() + "ms", "MAPPING_LOCK_TIMEOUT");
    }
}
