package com.clinical.review.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of review item. The wire values are matched by downstream consumers.
 */
public enum ReviewItemType {
    LAB_ABNORMAL("lab-abnormal"),
    LAB_DELTA("lab-delta"),
    MED_INTERACTION("med-interaction"),
    MED_ADHERENCE("med-adherence"),
    CARE_GAP("care-gap");

    private final String value;

    ReviewItemType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ReviewItemType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ReviewItemType value cannot be null");
        }
        for (ReviewItemType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ReviewItemType: " + value);
    }
}
