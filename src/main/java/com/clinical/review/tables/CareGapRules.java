package com.clinical.review.tables;

import com.clinical.review.fhir.FhirDates;
import com.clinical.review.model.ProcessedCondition;
import com.clinical.review.model.ProcessedLabValue;
import com.clinical.review.model.SelectionResult;
import com.clinical.review.tables.CareGapRule.Eligibility;
import org.hl7.fhir.r4.model.Enumerations.AdministrativeGender;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Default preventive-care screening rules and the building blocks they are made of.
 */
public final class CareGapRules {

    // LOINC codes accepted as screening evidence
    static final String LOINC_MAMMOGRAPHY = "24606-6";
    static final String LOINC_COLONOSCOPY = "18746-8";
    static final Set<String> LOINC_HBA1C = Set.of("4548-4", "33747-0");
    static final Set<String> LOINC_LIPIDS = Set.of("2093-3", "2085-9", "2089-1", "18262-6", "13457-7");

    // SNOMED codes for type 1 and type 2 diabetes
    static final Set<String> SNOMED_DIABETES = Set.of("44054006", "46635009");

    static final long MAMMOGRAPHY_STALE_DAYS = 730;
    static final long COLONOSCOPY_STALE_DAYS = 3650;
    static final long HBA1C_STALE_DAYS = 180;
    static final long LIPID_STALE_DAYS = 1825;

    private CareGapRules() {
    }

    public static List<CareGapRule> defaults() {
        return List.of(
            new CareGapRule(
                "mammography-screening",
                "Mammography Screening",
                "Mammography every 2 years for women 50-74",
                "Schedule mammography screening",
                female().and(ageBetween(50, 74)),
                missingOrOlderThan(codeOrKeyword(Set.of(LOINC_MAMMOGRAPHY), "mammogram", "mammography"),
                    MAMMOGRAPHY_STALE_DAYS)
            ),
            new CareGapRule(
                "colonoscopy-screening",
                "Colorectal Cancer Screening",
                "Colonoscopy every 10 years for adults 45-75",
                "Schedule colonoscopy screening",
                ageBetween(45, 75),
                missingOrOlderThan(codeOrKeyword(Set.of(LOINC_COLONOSCOPY), "colonoscopy"),
                    COLONOSCOPY_STALE_DAYS)
            ),
            new CareGapRule(
                "hba1c-diabetic",
                "HbA1c Monitoring for Diabetes",
                "HbA1c every 3-6 months for diabetic patients",
                "Order HbA1c test for diabetes monitoring",
                (patient, today) -> true,
                onlyWhen(CareGapRules::hasActiveDiabetes,
                    missingOrOlderThan(codeOrKeyword(LOINC_HBA1C), HBA1C_STALE_DAYS))
            ),
            new CareGapRule(
                "lipid-screening",
                "Lipid Panel Screening",
                "Lipid panel every 5 years for adults 40+",
                "Order lipid panel screening",
                ageBetween(40, Integer.MAX_VALUE),
                missingOrOlderThan(codeOrKeyword(LOINC_LIPIDS, "lipid", "cholesterol"), LIPID_STALE_DAYS)
            )
        );
    }

    /**
     * Eligibility for patients whose age on the reference day is within [min, max].
     * Patients without a usable birth date are not eligible.
     */
    public static Eligibility ageBetween(int min, int max) {
        return (patient, today) -> FhirDates.ageOn(patient, today)
                .map(age -> age >= min && age <= max)
                .orElse(false);
    }

    public static Eligibility female() {
        return (patient, today) -> patient != null
                && patient.getGender() == AdministrativeGender.FEMALE;
    }

    /**
     * Gap exists when no lab value matches the evidence predicate, when none of the matches
     * carries a date, or when the newest dated match is more than {@code staleAfterDays} old.
     */
    public static CareGapRule.GapCheck missingOrOlderThan(Predicate<ProcessedLabValue> evidence,
                                                          long staleAfterDays) {
        return (selection, now) -> {
            Optional<Instant> latest = selection.getLabValues().stream()
                    .filter(evidence)
                    .map(ProcessedLabValue::getDate)
                    .filter(Objects::nonNull)
                    .max(Instant::compareTo);
            return latest.isEmpty() || FhirDates.daysBetween(latest.get(), now) > staleAfterDays;
        };
    }

    /**
     * Lab values whose code is in {@code codes} or whose display contains any keyword (case-insensitive)
     */
    public static Predicate<ProcessedLabValue> codeOrKeyword(Set<String> codes, String... keywords) {
        return lab -> {
            if (codes.contains(lab.getCode())) {
                return true;
            }
            if (lab.getDisplay() == null) {
                return false;
            }
            String display = lab.getDisplay().toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (display.contains(keyword)) {
                    return true;
                }
            }
            return false;
        };
    }

    public static CareGapRule.GapCheck onlyWhen(Predicate<SelectionResult> precondition,
                                                CareGapRule.GapCheck check) {
        return (selection, now) -> precondition.test(selection) && check.hasGap(selection, now);
    }

    static boolean hasActiveDiabetes(SelectionResult selection) {
        return selection.getConditions().stream()
                .filter(ProcessedCondition::isActive)
                .anyMatch(CareGapRules::isDiabetes);
    }

    private static boolean isDiabetes(ProcessedCondition condition) {
        if (condition.getCode() != null && SNOMED_DIABETES.contains(condition.getCode())) {
            return true;
        }
        return condition.getName() != null
                && condition.getName().toLowerCase(Locale.ROOT).contains("diabetes");
    }
}
