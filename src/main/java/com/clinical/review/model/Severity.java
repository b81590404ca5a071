package com.clinical.review.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review item severity. The rank orders items: high first, low last.
 */
public enum Severity {
    HIGH("high", 0),
    MEDIUM("medium", 1),
    LOW("low", 2);

    private final String value;
    private final int rank;

    Severity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    public static Severity fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity value cannot be null");
        }
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown Severity: " + value);
    }
}
