package com.clinical.review.tables;

import com.clinical.review.model.SelectionResult;
import org.hl7.fhir.r4.model.Patient;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A preventive-care screening rule: who is eligible, and when the screening counts as missing.
 * Rules are plain values holding two predicates; see {@link CareGapRules} for the default set.
 */
public final class CareGapRule {

    /**
     * Demographic eligibility for a rule.
     */
    @FunctionalInterface
    public interface Eligibility {
        boolean applies(Patient patient, LocalDate today);

        default Eligibility and(Eligibility other) {
            return (patient, today) -> applies(patient, today) && other.applies(patient, today);
        }
    }

    /**
     * Gap test over the selected resources. True means the screening is missing or stale.
     */
    @FunctionalInterface
    public interface GapCheck {
        boolean hasGap(SelectionResult selection, Instant now);
    }

    private final String id;
    private final String name;
    private final String description;
    private final String recommendation;
    private final Eligibility eligibility;
    private final GapCheck gapCheck;

    public CareGapRule(String id, String name, String description, String recommendation,
                       Eligibility eligibility, GapCheck gapCheck) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.description = description;
        this.recommendation = recommendation;
        this.eligibility = Objects.requireNonNull(eligibility, "eligibility");
        this.gapCheck = Objects.requireNonNull(gapCheck, "gapCheck");
    }

    public boolean applies(Patient patient, LocalDate today) {
        return eligibility.applies(patient, today);
    }

    public boolean checkGap(SelectionResult selection, Instant now) {
        return gapCheck.hasGap(selection, now);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getRecommendation() {
        return recommendation;
    }
}
