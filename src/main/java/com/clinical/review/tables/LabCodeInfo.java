package com.clinical.review.tables;

import java.util.Objects;

/**
 * Display name and ranking priority for a lab code.
 */
public final class LabCodeInfo {
    private final String code;
    private final String display;
    private final int priority;

    public LabCodeInfo(String code, String display, int priority) {
        this.code = Objects.requireNonNull(code, "code");
        this.display = display;
        this.priority = priority;
    }

    public String getCode() {
        return code;
    }

    public String getDisplay() {
        return display;
    }

    public int getPriority() {
        return priority;
    }
}
