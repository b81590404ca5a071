package com.clinical.review.selector;

import com.clinical.review.fhir.FhirDates;
import com.clinical.review.model.ProcessedCondition;
import com.clinical.review.model.ProcessedLabValue;
import com.clinical.review.model.ProcessedMedication;
import com.clinical.review.model.ProcessingStats;
import com.clinical.review.model.ReferenceRange;
import com.clinical.review.model.SelectionResult;
import com.clinical.review.tables.CodeTables;
import com.clinical.review.tables.LabCodeInfo;
import com.clinical.review.tables.UnitConversion;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.Dosage;
import org.hl7.fhir.r4.model.Encounter;
import org.hl7.fhir.r4.model.MedicationRequest;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Period;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.Resource;
import org.hl7.fhir.r4.model.Timing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Selects the clinically relevant subset of a FHIR bundle: the latest result per lab code,
 * qualifying medication orders, open conditions and recent encounters, each scored for relevance.
 * <p>
 * Selection never modifies the bundle. Every recency rule is measured against a single reference
 * instant, taken from the injected clock once per call or passed in explicitly.
 */
public class ResourceSelector {
    private static final Logger logger = LoggerFactory.getLogger(ResourceSelector.class);

    private static final String LOINC_SYSTEM = "loinc.org";
    private static final String SNOMED_SYSTEM = "snomed.info";
    private static final String RXNORM_SYSTEM = "rxnorm";

    // Lab scoring
    private static final int DEFAULT_LAB_PRIORITY = 3;
    private static final int ABNORMAL_LAB_BONUS = 2;
    private static final int RECENT_LAB_BONUS = 1;
    private static final long LAB_RECENCY_DAYS = 90;

    // Medication scoring
    private static final int BASE_MEDICATION_SCORE = 5;
    private static final int ACTIVE_MEDICATION_BONUS = 3;
    private static final int RECENT_MEDICATION_BONUS = 2;
    private static final int INPATIENT_MEDICATION_BONUS = 1;
    private static final long RECENT_MEDICATION_DAYS = 30;
    private static final long COMPLETED_MEDICATION_DAYS = 90;

    // Condition scoring
    private static final int BASE_CONDITION_SCORE = 4;
    private static final int ACTIVE_CONDITION_BONUS = 3;
    private static final int CHRONIC_CONDITION_BONUS = 2;
    private static final int SEVERE_CONDITION_BONUS = 2;
    private static final int RECENT_CONDITION_BONUS = 1;
    private static final long RECENT_CONDITION_DAYS = 90;
    private static final long UNCONFIRMED_CONDITION_DAYS = 30;
    private static final String SNOMED_SEVERE = "24484000";

    private static final int MAX_ENCOUNTERS = 10;

    private final CodeTables codeTables;
    private final Clock clock;

    /**
     * Create a selector using the system UTC clock
     * @param codeTables Reference tables for priorities, units and chronic codes
     */
    public ResourceSelector(CodeTables codeTables) {
        this(codeTables, Clock.systemUTC());
    }

    /**
     * Create a selector with an explicit time source
     * @param codeTables Reference tables for priorities, units and chronic codes
     * @param clock Source of the reference instant for recency checks
     */
    public ResourceSelector(CodeTables codeTables, Clock clock) {
        if (codeTables == null) {
            throw new IllegalArgumentException("CodeTables cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.codeTables = codeTables;
        this.clock = clock;
    }

    /**
     * Main selection method that runs every selection rule over the bundle
     * @param bundle The bundle to select from
     * @return SelectionResult with scored labs, medications, conditions and recent encounters
     * @throws MissingSubjectException if the bundle contains no Patient resource
     */
    public SelectionResult selectRelevantResources(Bundle bundle) {
        return selectRelevantResources(bundle, clock.instant());
    }

    /**
     * Run every selection rule against an explicit reference instant
     * @param bundle The bundle to select from
     * @param now Reference instant for recency checks
     * @return SelectionResult for the bundle
     * @throws MissingSubjectException if the bundle contains no Patient resource
     */
    public SelectionResult selectRelevantResources(Bundle bundle, Instant now) {
        long startNanos = System.nanoTime();

        Patient patient = findPatient(bundle)
                .orElseThrow(() -> new MissingSubjectException("No patient resource found in bundle"));

        List<ProcessedLabValue> labValues = selectLabValues(bundle, now);
        List<ProcessedMedication> medications = selectActiveMedications(bundle, now);
        List<ProcessedCondition> conditions = selectConditions(bundle, now);
        List<Encounter> encounters = selectEncounters(bundle);

        long processingTimeMs = (System.nanoTime() - startNanos) / 1_000_000;

        ProcessingStats stats = new ProcessingStats(
            resourcesOf(bundle, Observation.class).size(),
            labValues.size(),
            resourcesOf(bundle, MedicationRequest.class).size(),
            (int) medications.stream().filter(ProcessedMedication::isActive).count(),
            resourcesOf(bundle, Condition.class).size(),
            (int) conditions.stream().filter(ProcessedCondition::isChronic).count(),
            processingTimeMs
        );

        logger.info("Selected {} lab values, {} medications, {} conditions and {} encounters in {} ms",
            labValues.size(), medications.size(), conditions.size(), encounters.size(), processingTimeMs);

        return new SelectionResult(patient, labValues, medications, conditions, encounters, stats);
    }

    // ========== Lab values ==========

    /**
     * Select the most recent final or amended result per lab code
     * @param bundle The bundle to select from
     * @return Processed lab values, highest relevance first
     */
    public List<ProcessedLabValue> selectLabValues(Bundle bundle) {
        return selectLabValues(bundle, clock.instant());
    }

    public List<ProcessedLabValue> selectLabValues(Bundle bundle, Instant now) {
        List<Observation> observations = resourcesOf(bundle, Observation.class).stream()
                .filter(this::isFinalOrAmended)
                .collect(Collectors.toList());

        List<ProcessedLabValue> processedLabs = new ArrayList<>();

        for (Map.Entry<String, Observation> entry : mostRecentByLabCode(observations).entrySet()) {
            processLabValue(entry.getKey(), entry.getValue(), now).ifPresent(processedLabs::add);
        }

        processedLabs.sort(Comparator.comparingInt(ProcessedLabValue::getRelevanceScore).reversed());
        return processedLabs;
    }

    private boolean isFinalOrAmended(Observation observation) {
        if (!observation.hasStatus()) {
            return false;
        }
        return observation.getStatus() == Observation.ObservationStatus.FINAL
                || observation.getStatus() == Observation.ObservationStatus.AMENDED;
    }

    /**
     * Keep the observation with the latest effective date per lab code.
     * Ties keep the first one seen; a dated observation replaces an undated one.
     */
    private Map<String, Observation> mostRecentByLabCode(List<Observation> observations) {
        Map<String, Observation> latestByCode = new LinkedHashMap<>();

        for (Observation observation : observations) {
            Optional<Coding> labCoding = findCoding(observation.hasCode() ? observation.getCode() : null, LOINC_SYSTEM);
            if (labCoding.isEmpty()) {
                logger.debug("Skipping observation {} without a lab code", referenceOf(observation));
                continue;
            }

            String code = labCoding.get().getCode();
            Observation existing = latestByCode.get(code);
            if (existing == null) {
                latestByCode.put(code, observation);
                continue;
            }

            Instant observationDate = effectiveDate(observation);
            Instant existingDate = effectiveDate(existing);
            if (observationDate != null && (existingDate == null || observationDate.isAfter(existingDate))) {
                latestByCode.put(code, observation);
            }
        }

        return latestByCode;
    }

    private Optional<ProcessedLabValue> processLabValue(String code, Observation observation, Instant now) {
        Optional<Quantity> quantityOpt = numericQuantity(observation);
        if (quantityOpt.isEmpty()) {
            logger.debug("Skipping observation {} for {}: no numeric quantity", referenceOf(observation), code);
            return Optional.empty();
        }

        Quantity quantity = quantityOpt.get();
        BigDecimal rawValue = quantity.getValue();
        String rawUnit = quantity.hasUnit() ? quantity.getUnit() : (quantity.hasCode() ? quantity.getCode() : "");

        BigDecimal normalizedValue = rawValue;
        String normalizedUnit = rawUnit;
        ReferenceRange referenceRange = extractReferenceRange(observation);

        // Range bounds are in the source unit too
        Optional<UnitConversion> conversion = codeTables.unitConversion(code, rawUnit);
        if (conversion.isPresent()) {
            normalizedValue = conversion.get().apply(rawValue);
            normalizedUnit = conversion.get().getTargetUnit();
            referenceRange = convertRange(referenceRange, conversion.get());
        }

        boolean abnormal = referenceRange != null && referenceRange.isOutside(normalizedValue);

        Instant date = effectiveDate(observation);
        Optional<LabCodeInfo> labCodeInfo = codeTables.labCode(code);

        int relevanceScore = labCodeInfo.map(LabCodeInfo::getPriority).orElse(DEFAULT_LAB_PRIORITY);
        if (abnormal) {
            relevanceScore += ABNORMAL_LAB_BONUS;
        }
        if (FhirDates.isWithinDays(date, now, LAB_RECENCY_DAYS)) {
            relevanceScore += RECENT_LAB_BONUS;
        }

        return Optional.of(new ProcessedLabValue(
            code,
            labDisplay(observation, labCodeInfo),
            rawValue,
            rawUnit,
            normalizedUnit,
            normalizedValue,
            referenceRange,
            extractInterpretation(observation),
            date,
            abnormal,
            relevanceScore,
            referenceOf(observation)
        ));
    }

    private Optional<Quantity> numericQuantity(Observation observation) {
        if (!observation.hasValueQuantity()) {
            return Optional.empty();
        }
        Quantity quantity = observation.getValueQuantity();
        if (!quantity.hasValue()) {
            return Optional.empty();
        }
        return Optional.of(quantity);
    }

    /**
     * Extract the first reference range; a range without either bound counts as no range
     */
    private ReferenceRange extractReferenceRange(Observation observation) {
        if (!observation.hasReferenceRange()) {
            return null;
        }
        Observation.ObservationReferenceRangeComponent range = observation.getReferenceRange().get(0);
        BigDecimal low = range.hasLow() && range.getLow().hasValue() ? range.getLow().getValue() : null;
        BigDecimal high = range.hasHigh() && range.getHigh().hasValue() ? range.getHigh().getValue() : null;
        if (low == null && high == null) {
            return null;
        }
        return new ReferenceRange(low, high, range.hasText() ? range.getText() : null);
    }

    private ReferenceRange convertRange(ReferenceRange range, UnitConversion conversion) {
        if (range == null) {
            return null;
        }
        return new ReferenceRange(
            range.getLow() != null ? conversion.apply(range.getLow()) : null,
            range.getHigh() != null ? conversion.apply(range.getHigh()) : null,
            range.getText());
    }

    private String extractInterpretation(Observation observation) {
        if (!observation.hasInterpretation()) {
            return null;
        }
        return firstCodingDisplay(observation.getInterpretation().get(0));
    }

    private String labDisplay(Observation observation, Optional<LabCodeInfo> labCodeInfo) {
        if (labCodeInfo.isPresent() && labCodeInfo.get().getDisplay() != null) {
            return labCodeInfo.get().getDisplay();
        }
        return findCoding(observation.getCode(), LOINC_SYSTEM)
                .filter(Coding::hasDisplay)
                .map(Coding::getDisplay)
                .orElse("Unknown Lab");
    }

    private Instant effectiveDate(Observation observation) {
        if (observation.hasEffectiveDateTimeType()) {
            return FhirDates.parse(observation.getEffectiveDateTimeType()).orElse(null);
        }
        if (observation.hasEffectiveInstantType()) {
            return FhirDates.parse(observation.getEffectiveInstantType()).orElse(null);
        }
        if (observation.hasEffectivePeriod()) {
            return periodStart(observation.getEffectivePeriod());
        }
        return null;
    }

    // ========== Medications ==========

    /**
     * Select active orders and orders completed within the last 90 days.
     * Orders for the same drug are all kept.
     * @param bundle The bundle to select from
     * @return Processed medications, highest relevance first
     */
    public List<ProcessedMedication> selectActiveMedications(Bundle bundle) {
        return selectActiveMedications(bundle, clock.instant());
    }

    public List<ProcessedMedication> selectActiveMedications(Bundle bundle, Instant now) {
        List<ProcessedMedication> processedMeds = new ArrayList<>();

        for (MedicationRequest medication : resourcesOf(bundle, MedicationRequest.class)) {
            if (!medication.hasStatus()) {
                continue;
            }

            MedicationRequest.MedicationRequestStatus status = medication.getStatus();
            Instant authoredDate = medication.hasAuthoredOnElement()
                    ? FhirDates.parse(medication.getAuthoredOnElement()).orElse(null) : null;

            if (status == MedicationRequest.MedicationRequestStatus.COMPLETED) {
                if (!FhirDates.isWithinDays(authoredDate, now, COMPLETED_MEDICATION_DAYS)) {
                    logger.debug("Skipping completed medication {} authored more than {} days ago",
                        referenceOf(medication), COMPLETED_MEDICATION_DAYS);
                    continue;
                }
            } else if (status != MedicationRequest.MedicationRequestStatus.ACTIVE) {
                continue;
            }

            boolean active = status == MedicationRequest.MedicationRequestStatus.ACTIVE;
            Coding category = medication.hasCategory() ? firstCoding(medication.getCategory().get(0)) : null;
            boolean inpatient = category != null && "inpatient".equals(category.getCode());

            int relevanceScore = BASE_MEDICATION_SCORE;
            if (active) {
                relevanceScore += ACTIVE_MEDICATION_BONUS;
            }
            if (FhirDates.isWithinDays(authoredDate, now, RECENT_MEDICATION_DAYS)) {
                relevanceScore += RECENT_MEDICATION_BONUS;
            }
            if (inpatient) {
                relevanceScore += INPATIENT_MEDICATION_BONUS;
            }

            Dosage dosage = medication.hasDosageInstruction() ? medication.getDosageInstruction().get(0) : null;
            Period validity = medication.hasDispenseRequest() && medication.getDispenseRequest().hasValidityPeriod()
                    ? medication.getDispenseRequest().getValidityPeriod() : null;

            processedMeds.add(new ProcessedMedication(
                medicationName(medication),
                drugCode(medication),
                status.toCode(),
                active,
                category != null && category.hasDisplay() ? category.getDisplay() : null,
                dosage != null && dosage.hasText() ? dosage.getText() : null,
                frequencyText(dosage),
                dosage != null && dosage.hasRoute() ? firstCodingDisplay(dosage.getRoute()) : null,
                authoredDate,
                validity != null ? periodStart(validity) : null,
                validity != null && validity.hasEndElement() ? FhirDates.parse(validity.getEndElement()).orElse(null) : null,
                relevanceScore,
                referenceOf(medication)
            ));
        }

        processedMeds.sort(Comparator.comparingInt(ProcessedMedication::getRelevanceScore).reversed());
        return processedMeds;
    }

    private String medicationName(MedicationRequest medication) {
        if (medication.hasMedicationCodeableConcept()) {
            CodeableConcept concept = medication.getMedicationCodeableConcept();
            if (concept.hasText()) {
                return concept.getText();
            }
            Optional<String> display = concept.getCoding().stream()
                    .filter(Coding::hasDisplay)
                    .map(Coding::getDisplay)
                    .findFirst();
            if (display.isPresent()) {
                return display.get();
            }
        }
        if (medication.hasMedicationReference() && medication.getMedicationReference().hasDisplay()) {
            return medication.getMedicationReference().getDisplay();
        }
        return "Unknown Medication";
    }

    /**
     * Canonical drug code: the RxNorm coding if present, otherwise the first coded entry
     */
    private String drugCode(MedicationRequest medication) {
        if (!medication.hasMedicationCodeableConcept()) {
            return null;
        }
        CodeableConcept concept = medication.getMedicationCodeableConcept();
        return findCoding(concept, RXNORM_SYSTEM)
                .or(() -> concept.getCoding().stream().filter(Coding::hasCode).findFirst())
                .map(Coding::getCode)
                .orElse(null);
    }

    /**
     * Build "N times per P unit" from the dosage timing, or an empty string if any part is missing
     */
    private String frequencyText(Dosage dosage) {
        if (dosage == null || !dosage.hasTiming() || !dosage.getTiming().hasRepeat()) {
            return "";
        }
        Timing.TimingRepeatComponent repeat = dosage.getTiming().getRepeat();
        if (!repeat.hasFrequency() || !repeat.hasPeriod() || !repeat.hasPeriodUnit()) {
            return "";
        }
        return repeat.getFrequency() + " times per "
                + repeat.getPeriod().stripTrailingZeros().toPlainString() + " "
                + repeat.getPeriodUnit().toCode();
    }

    // ========== Conditions ==========

    /**
     * Select conditions that are not inactive. Unconfirmed conditions are kept only when
     * recorded within the last 30 days.
     * @param bundle The bundle to select from
     * @return Processed conditions, highest relevance first
     */
    public List<ProcessedCondition> selectConditions(Bundle bundle) {
        return selectConditions(bundle, clock.instant());
    }

    public List<ProcessedCondition> selectConditions(Bundle bundle, Instant now) {
        List<ProcessedCondition> processedConditions = new ArrayList<>();

        for (Condition condition : resourcesOf(bundle, Condition.class)) {
            String clinicalStatus = firstCodingCode(condition.hasClinicalStatus() ? condition.getClinicalStatus() : null);
            if (clinicalStatus == null) {
                clinicalStatus = "unknown";
            }
            if ("inactive".equals(clinicalStatus)) {
                continue;
            }

            String verificationStatus = firstCodingCode(
                condition.hasVerificationStatus() ? condition.getVerificationStatus() : null);
            Instant recordedDate = condition.hasRecordedDateElement()
                    ? FhirDates.parse(condition.getRecordedDateElement()).orElse(null) : null;

            if ("unconfirmed".equals(verificationStatus)
                    && !FhirDates.isWithinDays(recordedDate, now, UNCONFIRMED_CONDITION_DAYS)) {
                logger.debug("Skipping unconfirmed condition {} not recorded in the last {} days",
                    referenceOf(condition), UNCONFIRMED_CONDITION_DAYS);
                continue;
            }

            String snomedCode = findCoding(condition.hasCode() ? condition.getCode() : null, SNOMED_SYSTEM)
                    .map(Coding::getCode)
                    .orElse(null);
            boolean chronic = codeTables.isChronicCondition(snomedCode);
            boolean active = "active".equals(clinicalStatus) || "recurrence".equals(clinicalStatus);
            Coding severity = condition.hasSeverity() ? firstCoding(condition.getSeverity()) : null;

            int relevanceScore = BASE_CONDITION_SCORE;
            if (active) {
                relevanceScore += ACTIVE_CONDITION_BONUS;
            }
            if (chronic) {
                relevanceScore += CHRONIC_CONDITION_BONUS;
            }
            if (isSevere(severity)) {
                relevanceScore += SEVERE_CONDITION_BONUS;
            }
            if (FhirDates.isWithinDays(recordedDate, now, RECENT_CONDITION_DAYS)) {
                relevanceScore += RECENT_CONDITION_BONUS;
            }

            processedConditions.add(new ProcessedCondition(
                conditionName(condition),
                snomedCode,
                clinicalStatus,
                verificationStatus,
                condition.hasCategory() ? firstCodingDisplay(condition.getCategory().get(0)) : null,
                severity == null ? null : (severity.hasDisplay() ? severity.getDisplay() : severity.getCode()),
                onsetDate(condition),
                recordedDate,
                chronic,
                active,
                relevanceScore,
                referenceOf(condition)
            ));
        }

        processedConditions.sort(Comparator.comparingInt(ProcessedCondition::getRelevanceScore).reversed());
        return processedConditions;
    }

    private boolean isSevere(Coding severity) {
        if (severity == null || !severity.hasCode()) {
            return false;
        }
        return "severe".equalsIgnoreCase(severity.getCode()) || SNOMED_SEVERE.equals(severity.getCode());
    }

    private String conditionName(Condition condition) {
        if (condition.hasCode()) {
            if (condition.getCode().hasText()) {
                return condition.getCode().getText();
            }
            String display = firstCodingDisplay(condition.getCode());
            if (display != null) {
                return display;
            }
        }
        return "Unknown Condition";
    }

    private Instant onsetDate(Condition condition) {
        if (condition.hasOnsetDateTimeType()) {
            return FhirDates.parse(condition.getOnsetDateTimeType()).orElse(null);
        }
        if (condition.hasOnsetPeriod()) {
            return periodStart(condition.getOnsetPeriod());
        }
        return null;
    }

    // ========== Encounters ==========

    /**
     * Select finished and in-progress encounters, newest first, at most 10.
     * Encounters without a start date sort last.
     * @param bundle The bundle to select from
     * @return The most recent encounters
     */
    public List<Encounter> selectEncounters(Bundle bundle) {
        Comparator<Encounter> newestFirst = Comparator.comparing(
            (Encounter encounter) -> encounter.hasPeriod() ? periodStart(encounter.getPeriod()) : null,
            Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

        return resourcesOf(bundle, Encounter.class).stream()
                .filter(encounter -> encounter.getStatus() == Encounter.EncounterStatus.FINISHED
                        || encounter.getStatus() == Encounter.EncounterStatus.INPROGRESS)
                .sorted(newestFirst)
                .limit(MAX_ENCOUNTERS)
                .collect(Collectors.toList());
    }

    // ========== Helpers ==========

    private Optional<Patient> findPatient(Bundle bundle) {
        return resourcesOf(bundle, Patient.class).stream().findFirst();
    }

    /**
     * Collect the bundle's resources of one type, in entry order
     */
    private <T extends Resource> List<T> resourcesOf(Bundle bundle, Class<T> resourceClass) {
        List<T> resources = new ArrayList<>();
        if (bundle == null || !bundle.hasEntry()) {
            return resources;
        }
        for (Bundle.BundleEntryComponent entry : bundle.getEntry()) {
            if (entry.hasResource() && resourceClass.isInstance(entry.getResource())) {
                resources.add(resourceClass.cast(entry.getResource()));
            }
        }
        return resources;
    }

    /**
     * Find the first coding with a code whose system contains the given fragment
     */
    private Optional<Coding> findCoding(CodeableConcept concept, String systemFragment) {
        if (concept == null || !concept.hasCoding()) {
            return Optional.empty();
        }
        return concept.getCoding().stream()
                .filter(coding -> coding.hasSystem() && coding.getSystem().contains(systemFragment))
                .filter(Coding::hasCode)
                .findFirst();
    }

    private Coding firstCoding(CodeableConcept concept) {
        if (concept == null || !concept.hasCoding()) {
            return null;
        }
        return concept.getCoding().get(0);
    }

    private String firstCodingCode(CodeableConcept concept) {
        Coding coding = firstCoding(concept);
        return coding != null && coding.hasCode() ? coding.getCode() : null;
    }

    private String firstCodingDisplay(CodeableConcept concept) {
        Coding coding = firstCoding(concept);
        return coding != null && coding.hasDisplay() ? coding.getDisplay() : null;
    }

    private Instant periodStart(Period period) {
        if (period == null || !period.hasStartElement()) {
            return null;
        }
        return FhirDates.parse(period.getStartElement()).orElse(null);
    }

    /**
     * Build "Type/id" for a resource, or return the URN itself for urn-identified entries
     */
    private String referenceOf(Resource resource) {
        if (!resource.hasIdElement() || resource.getIdElement().getIdPart() == null) {
            return null;
        }
        String value = resource.getIdElement().getValue();
        if (value.startsWith("urn:")) {
            return value;
        }
        return resource.fhirType() + "/" + resource.getIdElement().getIdPart();
    }
}
