package com.z254.sipo.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operator-facing urgency of an incident, driven by aggregated revenue risk.
 */
public enum Priority {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
