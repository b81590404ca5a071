package com.clinical.review.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Pointer from a review item to the chart view (and optionally the lab code) that explains it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ChartHint {
    private final ChartTab tab;
    private final String code;

    public ChartHint(ChartTab tab) {
        this(tab, null);
    }

    public ChartHint(ChartTab tab, String code) {
        this.tab = Objects.requireNonNull(tab, "tab");
        this.code = code;
    }

    public ChartTab getTab() {
        return tab;
    }

    public String getCode() {
        return code;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ChartHint other = (ChartHint) o;
        return tab == other.tab && Objects.equals(code, other.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tab, code);
    }

    @Override
    public String toString() {
        return code == null ? tab.getValue() : tab.getValue() + ":" + code;
    }
}
