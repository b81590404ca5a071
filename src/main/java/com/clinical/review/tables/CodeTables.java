package com.clinical.review.tables;

import com.clinical.review.model.Severity;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static reference data shared by the resource selector and the review item analyzer:
 * lab priorities, chronic condition codes, unit conversions, drug interactions and care-gap rules.
 * <p>
 * Instances are immutable. Build the standard tables once with {@link #defaults()} and pass them
 * to both stages; tests can derive alternate tables with {@link #toBuilder()}.
 */
public final class CodeTables {

    private final Map<String, LabCodeInfo> labCodes;
    private final Set<String> chronicConditionCodes;
    private final Map<String, UnitConversion> unitConversions;
    private final List<InteractionRule> interactionRules;
    private final List<CareGapRule> careGapRules;

    private CodeTables(Builder builder) {
        this.labCodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.labCodes));
        this.chronicConditionCodes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.chronicConditionCodes));
        this.unitConversions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.unitConversions));
        this.interactionRules = List.copyOf(builder.interactionRules);
        this.careGapRules = List.copyOf(builder.careGapRules);
    }

    /**
     * Build the standard tables
     */
    public static CodeTables defaults() {
        return builder()
            // Lab priorities (LOINC)
            .labCode("4548-4", "Hemoglobin A1c", 10)
            .labCode("33747-0", "Hemoglobin A1c", 10)
            .labCode("18262-6", "Low density lipoprotein cholesterol", 9)
            .labCode("13457-7", "Cholesterol in LDL", 9)
            .labCode("2093-3", "Total cholesterol", 8)
            .labCode("2085-9", "High density lipoprotein cholesterol", 8)
            .labCode("8480-6", "Systolic blood pressure", 9)
            .labCode("8462-4", "Diastolic blood pressure", 9)
            .labCode("33743-4", "Estimated glomerular filtration rate", 8)
            .labCode("2160-0", "Creatinine", 7)
            .labCode("6690-2", "Leukocytes", 6)
            .labCode("718-7", "Hemoglobin", 7)
            .labCode("4544-3", "Hematocrit", 6)
            .labCode("777-3", "Platelets", 6)
            .labCode("2947-0", "Sodium", 5)
            .labCode("2823-3", "Potassium", 5)
            .labCode("1975-2", "Bilirubin", 4)
            .labCode("1742-6", "ALT", 4)
            .labCode("1920-8", "AST", 4)
            // Chronic conditions (SNOMED)
            .chronicCondition("44054006")   // Type 2 diabetes
            .chronicCondition("46635009")   // Type 1 diabetes
            .chronicCondition("38341003")   // Hypertension
            .chronicCondition("13644009")   // Hypercholesterolemia
            .chronicCondition("49601007")   // Cardiovascular disease
            .chronicCondition("413838009")  // Chronic kidney disease
            .chronicCondition("195967001")  // Asthma
            .chronicCondition("13645005")   // COPD
            .chronicCondition("40412008")   // Rheumatoid arthritis
            .chronicCondition("56265001")   // Heart disease
            // Unit conversions, per lab code
            .unitConversion("4548-4", "mmol/mol", "0.09148", "%")
            .unitConversion("33747-0", "mmol/mol", "0.09148", "%")
            .unitConversion("2093-3", "mmol/L", "38.67", "mg/dL")
            .unitConversion("2085-9", "mmol/L", "38.67", "mg/dL")
            .unitConversion("2089-1", "mmol/L", "38.67", "mg/dL")
            .unitConversion("18262-6", "mmol/L", "38.67", "mg/dL")
            .unitConversion("13457-7", "mmol/L", "38.67", "mg/dL")
            .unitConversion("2345-7", "mmol/L", "18.018", "mg/dL") // glucose
            .unitConversion("2160-0", "umol/L", "0.0113", "mg/dL")
            // Drug interactions (RxNorm)
            .interaction("1191", "1191", Severity.MEDIUM,
                "Duplicate aspirin therapy detected",
                "Review dosing and consider consolidation")
            .interaction("6809", "4821", Severity.LOW,
                "Metformin and insulin combination requires monitoring",
                "Monitor blood glucose levels closely")
            .interaction("29046", "1191", Severity.MEDIUM,
                "ACE inhibitor and aspirin may increase bleeding risk",
                "Monitor for signs of bleeding")
            .careGapRules(CareGapRules.defaults())
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with these tables
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.labCodes.putAll(labCodes);
        builder.chronicConditionCodes.addAll(chronicConditionCodes);
        builder.unitConversions.putAll(unitConversions);
        builder.interactionRules.addAll(interactionRules);
        builder.careGapRules.addAll(careGapRules);
        return builder;
    }

    public Optional<LabCodeInfo> labCode(String code) {
        return Optional.ofNullable(labCodes.get(code));
    }

    public boolean isChronicCondition(String code) {
        return code != null && chronicConditionCodes.contains(code);
    }

    /**
     * Find the conversion registered for a lab code reported in the given unit.
     * Codes without an entry for that unit are not converted.
     */
    public Optional<UnitConversion> unitConversion(String code, String unit) {
        if (code == null || unit == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(unitConversions.get(codeUnitKey(code, unit)));
    }

    /**
     * @return the first rule matching the pair in either order
     */
    public Optional<InteractionRule> findInteraction(String codeA, String codeB) {
        return interactionRules.stream()
                .filter(rule -> rule.matches(codeA, codeB))
                .findFirst();
    }

    public Map<String, LabCodeInfo> getLabCodes() {
        return labCodes;
    }

    public Set<String> getChronicConditionCodes() {
        return chronicConditionCodes;
    }

    public List<InteractionRule> getInteractionRules() {
        return interactionRules;
    }

    public List<CareGapRule> getCareGapRules() {
        return careGapRules;
    }

    private static String codeUnitKey(String code, String unit) {
        return code + "|" + unit;
    }

    public static final class Builder {
        private final Map<String, LabCodeInfo> labCodes = new LinkedHashMap<>();
        private final Set<String> chronicConditionCodes = new LinkedHashSet<>();
        private final Map<String, UnitConversion> unitConversions = new LinkedHashMap<>();
        private final List<InteractionRule> interactionRules = new ArrayList<>();
        private final List<CareGapRule> careGapRules = new ArrayList<>();

        private Builder() {
        }

        public Builder labCode(String code, String display, int priority) {
            labCodes.put(code, new LabCodeInfo(code, display, priority));
            return this;
        }

        public Builder chronicCondition(String code) {
            chronicConditionCodes.add(code);
            return this;
        }

        public Builder unitConversion(String code, String fromUnit, String factor, String targetUnit) {
            unitConversions.put(codeUnitKey(code, fromUnit),
                new UnitConversion(fromUnit, new BigDecimal(factor), targetUnit));
            return this;
        }

        public Builder interaction(String codeA, String codeB, Severity severity,
                                   String description, String action) {
            interactionRules.add(new InteractionRule(codeA, codeB, severity, description, action));
            return this;
        }

        public Builder careGapRule(CareGapRule rule) {
            careGapRules.add(rule);
            return this;
        }

        public Builder careGapRules(List<CareGapRule> rules) {
            careGapRules.addAll(rules);
            return this;
        }

        public Builder clearCareGapRules() {
            careGapRules.clear();
            return this;
        }

        public CodeTables build() {
            return new CodeTables(this);
        }
    }
}
