package com.strata.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final status of one task attempt.
 */
public enum TaskStatus {
    @JsonProperty("success")
    SUCCESS("success"),
    @JsonProperty("error")
    ERROR("error"),
    /** Failure of a side-effect-free code task; recorded but never halts dependents. */
    @JsonProperty("failed_safe")
    FAILED_SAFE("failed_safe");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
