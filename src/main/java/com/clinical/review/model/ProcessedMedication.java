package com.clinical.review.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One qualifying medication order. Orders for the same drug are kept separately.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProcessedMedication {
    private final String name;
    private final String code;
    private final String status;
    private final boolean active;
    private final String category;
    private final String dosage;
    private final String frequency;
    private final String route;
    private final Instant authoredDate;
    private final Instant validFrom;
    private final Instant validUntil;
    private final int relevanceScore;
    private final String sourceRef;

    public ProcessedMedication(String name, String code, String status, boolean active,
                               String category, String dosage, String frequency, String route,
                               Instant authoredDate, Instant validFrom, Instant validUntil,
                               int relevanceScore, String sourceRef) {
        this.name = name;
        this.code = code;
        this.status = status;
        this.active = active;
        this.category = category;
        this.dosage = dosage;
        this.frequency = frequency != null ? frequency : "";
        this.route = route;
        this.authoredDate = authoredDate;
        this.validFrom = validFrom;
        this.validUntil = validUntil;
        this.relevanceScore = relevanceScore;
        this.sourceRef = sourceRef;
    }

    public String getName() {
        return name;
    }

    /**
     * @return canonical drug code (RxNorm where available), or null
     */
    public String getCode() {
        return code;
    }

    public String getStatus() {
        return status;
    }

    @JsonProperty("isActive")
    public boolean isActive() {
        return active;
    }

    public String getCategory() {
        return category;
    }

    public String getDosage() {
        return dosage;
    }

    /**
     * @return e.g. "2 times per 1 d", or an empty string when timing is incomplete
     */
    public String getFrequency() {
        return frequency;
    }

    public String getRoute() {
        return route;
    }

    public Instant getAuthoredDate() {
        return authoredDate;
    }

    public Instant getValidFrom() {
        return validFrom;
    }

    public Instant getValidUntil() {
        return validUntil;
    }

    public int getRelevanceScore() {
        return relevanceScore;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ProcessedMedication other = (ProcessedMedication) o;
        return active == other.active
                && relevanceScore == other.relevanceScore
                && Objects.equals(name, other.name)
                && Objects.equals(code, other.code)
                && Objects.equals(status, other.status)
                && Objects.equals(category, other.category)
                && Objects.equals(dosage, other.dosage)
                && frequency.equals(other.frequency)
                && Objects.equals(route, other.route)
                && Objects.equals(authoredDate, other.authoredDate)
                && Objects.equals(validFrom, other.validFrom)
                && Objects.equals(validUntil, other.validUntil)
                && Objects.equals(sourceRef, other.sourceRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, code, status, active, category, dosage, frequency, route,
                authoredDate, validFrom, validUntil, relevanceScore, sourceRef);
    }

    @Override
    public String toString() {
        return "ProcessedMedication{" + name + " (" + code + ") " + status + " score=" + relevanceScore + "}";
    }
}
