package com.aigreentick.services.otprelay.constants;

/**
 * States of a single /range allocation.
 *
 * REQUESTED → API_CALLED → PARSED_OK → MAPPED → DONE
 * API_CALLED → API_ERROR → REPORTED
 * API_CALLED → PARSE_ERROR → REPORTED
 */
public enum AllocationState {
    REQUESTED,
    API_CALLED,
    API_ERROR,
    PARSED_OK,
    PARSE_ERROR,
    MAPPED,
    DONE,
    REPORTED;

    public boolean isTerminal() {
        return this == DONE || this == REPORTED;
    }
}
