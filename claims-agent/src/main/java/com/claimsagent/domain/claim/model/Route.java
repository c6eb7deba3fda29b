package com.claimsagent.domain.claim.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Workflow queue a claim is sent to.
 */
public enum Route {
    MANUAL_REVIEW("Manual Review"),
    INVESTIGATION_FLAG("Investigation Flag"),
    SPECIALIST_QUEUE("Specialist Queue"),
    FAST_TRACK("Fast-track"),
    STANDARD_PROCESSING("Standard Processing");

    private final String label;

    Route(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
