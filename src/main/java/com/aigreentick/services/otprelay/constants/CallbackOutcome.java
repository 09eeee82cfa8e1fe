package com.aigreentick.services.otprelay.constants;

/**
 * What happened to an accepted callback. All three are reported as HTTP 200.
 */
public enum CallbackOutcome {
    /** Sent to the chat that owns the number */
    FORWARDED,
    /** No owner found, sent to the admin chat */
    ESCALATED,
    /** No owner found and no admin configured */
    DROPPED
}
