package com.clinical.review.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Chart view a review item points at.
 */
public enum ChartTab {
    LABS("labs"),
    LAB_TRENDS("lab-trends"),
    MEDICATIONS("medications"),
    MED_TIMELINE("med-timeline"),
    CONDITIONS("conditions");

    private final String value;

    ChartTab(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
