package com.clinical.review.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * An actionable finding for the reviewing clinician.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ReviewItem {
    private final String id;
    private final ReviewItemType type;
    private final Severity severity;
    private final String title;
    private final String description;
    private final String details;
    private final String resourceRef;
    private final ChartHint chartHint;
    private final boolean actionRequired;
    private final Instant dateIdentified;

    public ReviewItem(String id, ReviewItemType type, Severity severity, String title,
                      String description, String details, String resourceRef, ChartHint chartHint,
                      boolean actionRequired, Instant dateIdentified) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.title = title;
        this.description = description;
        this.details = details;
        this.resourceRef = resourceRef;
        this.chartHint = chartHint;
        this.actionRequired = actionRequired;
        this.dateIdentified = Objects.requireNonNull(dateIdentified, "dateIdentified");
    }

    public String getId() {
        return id;
    }

    public ReviewItemType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getDetails() {
        return details;
    }

    public String getResourceRef() {
        return resourceRef;
    }

    public ChartHint getChartHint() {
        return chartHint;
    }

    public boolean isActionRequired() {
        return actionRequired;
    }

    public Instant getDateIdentified() {
        return dateIdentified;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReviewItem other = (ReviewItem) o;
        return actionRequired == other.actionRequired
                && id.equals(other.id)
                && type == other.type
                && severity == other.severity
                && Objects.equals(title, other.title)
                && Objects.equals(description, other.description)
                && Objects.equals(details, other.details)
                && Objects.equals(resourceRef, other.resourceRef)
                && Objects.equals(chartHint, other.chartHint)
                && dateIdentified.equals(other.dateIdentified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, severity, title, description, details, resourceRef,
                chartHint, actionRequired, dateIdentified);
    }

    @Override
    public String toString() {
        return "ReviewItem{" + id + " " + severity.getValue() + " " + title + "}";
    }
}
