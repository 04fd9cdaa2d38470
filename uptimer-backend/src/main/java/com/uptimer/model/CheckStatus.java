package com.uptimer.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reachability classification of a single probe.
 */
public enum CheckStatus {
    UP("up"),
    DEGRADED("degraded"),
    DOWN("down");

    private final String value;

    CheckStatus(String value) {
        this.value = value;
    }

    /**
     * Wire and storage representation.
     *
     * @return lowercase status name
     */
    @JsonValue
    public String value() {
        return value;
    }
}
