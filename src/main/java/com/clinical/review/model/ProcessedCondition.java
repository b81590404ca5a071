package com.clinical.review.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProcessedCondition {
    private final String name;
    private final String code;
    private final String clinicalStatus;
    private final String verificationStatus;
    private final String category;
    private final String severity;
    private final Instant onsetDate;
    private final Instant recordedDate;
    private final boolean chronic;
    private final boolean active;
    private final int relevanceScore;
    private final String sourceRef;

    public ProcessedCondition(String name, String code, String clinicalStatus, String verificationStatus,
                              String category, String severity, Instant onsetDate, Instant recordedDate,
                              boolean chronic, boolean active, int relevanceScore, String sourceRef) {
        this.name = name;
        this.code = code;
        this.clinicalStatus = clinicalStatus;
        this.verificationStatus = verificationStatus;
        this.category = category;
        this.severity = severity;
        this.onsetDate = onsetDate;
        this.recordedDate = recordedDate;
        this.chronic = chronic;
        this.active = active;
        this.relevanceScore = relevanceScore;
        this.sourceRef = sourceRef;
    }

    public String getName() {
        return name;
    }

    public String getCode() {
        return code;
    }

    public String getClinicalStatus() {
        return clinicalStatus;
    }

    public String getVerificationStatus() {
        return verificationStatus;
    }

    public String getCategory() {
        return category;
    }

    public String getSeverity() {
        return severity;
    }

    public Instant getOnsetDate() {
        return onsetDate;
    }

    public Instant getRecordedDate() {
        return recordedDate;
    }

    @JsonProperty("isChronic")
    public boolean isChronic() {
        return chronic;
    }

    @JsonProperty("isActive")
    public boolean isActive() {
        return active;
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
        ProcessedCondition other = (ProcessedCondition) o;
        return chronic == other.chronic
                && active == other.active
                && relevanceScore == other.relevanceScore
                && Objects.equals(name, other.name)
                && Objects.equals(code, other.code)
                && Objects.equals(clinicalStatus, other.clinicalStatus)
                && Objects.equals(verificationStatus, other.verificationStatus)
                && Objects.equals(category, other.category)
                && Objects.equals(severity, other.severity)
                && Objects.equals(onsetDate, other.onsetDate)
                && Objects.equals(recordedDate, other.recordedDate)
                && Objects.equals(sourceRef, other.sourceRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, code, clinicalStatus, verificationStatus, category, severity,
                onsetDate, recordedDate, chronic, active, relevanceScore, sourceRef);
    }

    @Override
    public String toString() {
        return "ProcessedCondition{" + name + " " + clinicalStatus + (chronic ? " chronic" : "")
                + " score=" + relevanceScore + "}";
    }
}
