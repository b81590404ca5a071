package com.clinical.review.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * The most recent numeric result for one lab code, with its unit normalized and its relevance scored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProcessedLabValue {
    private final String code;
    private final String display;
    private final BigDecimal value;
    private final String unit;
    private final String normalizedUnit;
    private final BigDecimal normalizedValue;
    private final ReferenceRange referenceRange;
    private final String interpretation;
    private final Instant date;
    private final boolean abnormal;
    private final int relevanceScore;
    private final String sourceRef;

    public ProcessedLabValue(String code, String display, BigDecimal value, String unit,
                             String normalizedUnit, BigDecimal normalizedValue,
                             ReferenceRange referenceRange, String interpretation, Instant date,
                             boolean abnormal, int relevanceScore, String sourceRef) {
        this.code = Objects.requireNonNull(code, "code");
        this.display = display;
        this.value = value;
        this.unit = unit;
        this.normalizedUnit = normalizedUnit;
        this.normalizedValue = normalizedValue;
        this.referenceRange = referenceRange;
        this.interpretation = interpretation;
        this.date = date;
        this.abnormal = abnormal;
        this.relevanceScore = relevanceScore;
        this.sourceRef = sourceRef;
    }

    public String getCode() {
        return code;
    }

    public String getDisplay() {
        return display;
    }

    public BigDecimal getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public String getNormalizedUnit() {
        return normalizedUnit;
    }

    public BigDecimal getNormalizedValue() {
        return normalizedValue;
    }

    public ReferenceRange getReferenceRange() {
        return referenceRange;
    }

    public String getInterpretation() {
        return interpretation;
    }

    /**
     * @return effective date of the source observation, or null when it carried none
     */
    public Instant getDate() {
        return date;
    }

    @JsonProperty("isAbnormal")
    public boolean isAbnormal() {
        return abnormal;
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
        ProcessedLabValue other = (ProcessedLabValue) o;
        return abnormal == other.abnormal
                && relevanceScore == other.relevanceScore
                && code.equals(other.code)
                && Objects.equals(display, other.display)
                && Objects.equals(value, other.value)
                && Objects.equals(unit, other.unit)
                && Objects.equals(normalizedUnit, other.normalizedUnit)
                && Objects.equals(normalizedValue, other.normalizedValue)
                && Objects.equals(referenceRange, other.referenceRange)
                && Objects.equals(interpretation, other.interpretation)
                && Objects.equals(date, other.date)
                && Objects.equals(sourceRef, other.sourceRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, display, value, unit, normalizedUnit, normalizedValue,
                referenceRange, interpretation, date, abnormal, relevanceScore, sourceRef);
    }

    @Override
    public String toString() {
        return "ProcessedLabValue{" + code + " " + normalizedValue + " " + normalizedUnit
                + (abnormal ? " abnormal" : "") + " score=" + relevanceScore + "}";
    }
}
