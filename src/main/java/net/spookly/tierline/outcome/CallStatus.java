package net.spookly.tierline.outcome;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Final status of one inbound call event.
 */
public enum CallStatus {
    SUCCESS("success"),
    API_ERROR("api_error"),
    NO_TIER("no_tier"),
    EXCEPTION("exception");

    private final String wireName;

    CallStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Failures are calls that reached a tier but did not produce an accepted bid.
     */
    public boolean isFailure() {
        return this == API_ERROR || this == EXCEPTION;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
