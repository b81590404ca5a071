package com.clinical.review.selector;

import ca.uhn.fhir.context.FhirContext;
import com.clinical.review.model.ProcessedCondition;
import com.clinical.review.model.ProcessedLabValue;
import com.clinical.review.model.ProcessedMedication;
import com.clinical.review.model.SelectionResult;
import com.clinical.review.tables.CodeTables;
import org.hl7.fhir.r4.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResourceSelector
 */
public class ResourceSelectorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
    private static final String LOINC = "http://loinc.org";
    private static final String SNOMED = "http://snomed.info/sct";
    private static final String RXNORM = "http://www.nlm.nih.gov/research/umls/rxnorm";

    private ResourceSelector selector;

    @BeforeEach
    public void setUp() {
        selector = new ResourceSelector(CodeTables.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ========== Lab Value Tests ==========

    @Test
    public void testSelectLabValues_KeepsMostRecentPerCode() {
        Bundle bundle = bundleOf(
            createPatient(),
            createObservation("a1c-old", "4548-4", "7.0", "%", "2024-01-01", "4", "6"),
            createObservation("a1c-new", "4548-4", "8.0", "%", "2024-05-01", "4", "6"));

        List<ProcessedLabValue> labs = selector.selectLabValues(bundle);

        assertEquals(1, labs.size());
        ProcessedLabValue lab = labs.get(0);
        assertEquals(new BigDecimal("8.0"), lab.getValue());
        assertEquals("Observation/a1c-new", lab.getSourceRef());
        assertEquals("Hemoglobin A1c", lab.getDisplay());
        assertEquals(Instant.parse("2024-05-01T00:00:00Z"), lab.getDate());
    }

    @Test
    public void testSelectLabValues_AbnormalScoring() {
        Bundle bundle = bundleOf(
            createPatient(),
            createObservation("high", "4548-4", "8.0", "%", "2024-05-01", "4", "6"),
            createObservation("normal", "2160-0", "1.0", "mg/dL", "2024-05-01", "0.6", "1.2"));

        List<ProcessedLabValue> labs = selector.selectLabValues(bundle);

        ProcessedLabValue a1c = findLab(labs, "4548-4");
        assertTrue(a1c.isAbnormal());
        assertEquals(10 + 2 + 1, a1c.getRelevanceScore());

        ProcessedLabValue creatinine = findLab(labs, "2160-0");
        assertFalse(creatinine.isAbnormal());
        assertEquals(7 + 1, creatinine.getRelevanceScore());
    }

    @Test
    public void testSelectLabValues_BoundaryValueIsNormal() {
        Bundle bundle = bundleOf(createPatient(),
            createObservation("edge", "4548-4", "6.0", "%", "2024-05-01", "4", "6"));

        assertFalse(selector.selectLabValues(bundle).get(0).isAbnormal());
    }

    @Test
    public void testSelectLabValues_NoRecencyBonusForOldResult() {
        Bundle bundle = bundleOf(createPatient(),
            createObservation("old", "2160-0", "1.0", "mg/dL", "2023-01-01", null, null));

        ProcessedLabValue lab = selector.selectLabValues(bundle).get(0);
        assertEquals(7, lab.getRelevanceScore());
        assertNull(lab.getReferenceRange());
        assertFalse(lab.isAbnormal());
    }

    @Test
    public void testSelectLabValues_SkipsNonFinalStatus() {
        Observation preliminary = createObservation("prelim", "4548-4", "8.0", "%", "2024-05-01", null, null);
        preliminary.setStatus(Observation.ObservationStatus.PRELIMINARY);
        Observation amended = createObservation("amended", "2160-0", "1.0", "mg/dL", "2024-05-01", null, null);
        amended.setStatus(Observation.ObservationStatus.AMENDED);

        List<ProcessedLabValue> labs = selector.selectLabValues(bundleOf(createPatient(), preliminary, amended));

        assertEquals(1, labs.size());
        assertEquals("2160-0", labs.get(0).getCode());
    }

    @Test
    public void testSelectLabValues_LatestWithoutQuantityDropsCode() {
        Observation numeric = createObservation("numeric", "4548-4", "7.0", "%", "2024-01-01", null, null);
        Observation text = createObservation("text", "4548-4", null, null, "2024-05-01", null, null);
        text.setValue(new StringType("see report"));

        assertTrue(selector.selectLabValues(bundleOf(createPatient(), numeric, text)).isEmpty());
    }

    @Test
    public void testSelectLabValues_ZeroIsNumeric() {
        Bundle bundle = bundleOf(createPatient(),
            createObservation("zero", "1975-2", "0", "mg/dL", "2024-05-01", "0.1", "1.2"));

        ProcessedLabValue lab = selector.selectLabValues(bundle).get(0);
        assertEquals(0, lab.getValue().signum());
        assertTrue(lab.isAbnormal());
    }

    @Test
    public void testSelectLabValues_SkipsObservationWithoutLoinc() {
        Observation vitals = new Observation();
        vitals.setId("local");
        vitals.setStatus(Observation.ObservationStatus.FINAL);
        vitals.getCode().addCoding().setSystem("http://example.org/local").setCode("X1");
        vitals.setValue(new Quantity().setValue(1));

        assertTrue(selector.selectLabValues(bundleOf(createPatient(), vitals)).isEmpty());
    }

    @Test
    public void testSelectLabValues_UnitConversion() {
        Bundle bundle = bundleOf(createPatient(),
            createObservation("glucose", "2345-7", "5", "mmol/L", "2024-05-01", "3.9", "5.6"),
            createObservation("chol", "2093-3", "5", "mmol/L", "2024-05-01", null, "5.2"));

        List<ProcessedLabValue> labs = selector.selectLabValues(bundle);

        ProcessedLabValue glucose = findLab(labs, "2345-7");
        assertEquals("mmol/L", glucose.getUnit());
        assertEquals("mg/dL", glucose.getNormalizedUnit());
        assertEquals(new BigDecimal("90.09"), glucose.getNormalizedValue());
        assertEquals(new BigDecimal("70.27"), glucose.getReferenceRange().getLow());
        assertEquals(new BigDecimal("100.90"), glucose.getReferenceRange().getHigh());
        assertFalse(glucose.isAbnormal());

        ProcessedLabValue cholesterol = findLab(labs, "2093-3");
        assertEquals(new BigDecimal("193.35"), cholesterol.getNormalizedValue());
        assertNull(cholesterol.getReferenceRange().getLow());
        assertFalse(cholesterol.isAbnormal());
    }

    @Test
    public void testSelectLabValues_CodeWithoutConversionPassesThrough() {
        Bundle bundle = bundleOf(createPatient(),
            createObservation("k", "2823-3", "4.0", "mmol/L", "2024-05-01", "3.5", "5.1"));

        ProcessedLabValue potassium = selector.selectLabValues(bundle).get(0);

        assertEquals("mmol/L", potassium.getNormalizedUnit());
        assertEquals(new BigDecimal("4.0"), potassium.getNormalizedValue());
        assertEquals(new BigDecimal("3.5"), potassium.getReferenceRange().getLow());
        assertFalse(potassium.isAbnormal());
        assertEquals(5 + 1, potassium.getRelevanceScore());
    }

    @Test
    public void testSelectLabValues_ConvertedValueJudgedAgainstConvertedRange() {
        Bundle bundle = bundleOf(createPatient(),
            createObservation("a1c-normal", "4548-4", "40", "mmol/mol", "2024-05-01", "20", "42"),
            createObservation("a1c-high", "33747-0", "60", "mmol/mol", "2024-05-01", "20", "42"));

        List<ProcessedLabValue> labs = selector.selectLabValues(bundle);

        ProcessedLabValue normal = findLab(labs, "4548-4");
        assertEquals("%", normal.getNormalizedUnit());
        assertEquals(new BigDecimal("3.66"), normal.getNormalizedValue());
        assertEquals(new BigDecimal("1.83"), normal.getReferenceRange().getLow());
        assertEquals(new BigDecimal("3.84"), normal.getReferenceRange().getHigh());
        assertFalse(normal.isAbnormal());

        ProcessedLabValue high = findLab(labs, "33747-0");
        assertEquals(new BigDecimal("5.49"), high.getNormalizedValue());
        assertTrue(high.isAbnormal());
    }

    @Test
    public void testSelectLabValues_ElectrolytePanelNotFlagged() {
        Bundle bundle = bundleOf(createPatient(),
            createObservation("na", "2947-0", "140", "mmol/L", "2024-05-01", "135", "145"),
            createObservation("k", "2823-3", "4.0", "mmol/L", "2024-05-01", "3.5", "5.1"));

        List<ProcessedLabValue> labs = selector.selectLabValues(bundle);

        assertEquals(2, labs.size());
        assertTrue(labs.stream().noneMatch(ProcessedLabValue::isAbnormal));
    }

    @Test
    public void testSelectLabValues_UnknownCodeDisplayAndPriority() {
        Observation named = createObservation("vitd", "1989-3", "30", "ng/mL", "2023-01-01", null, null);
        named.getCode().getCodingFirstRep().setDisplay("Vitamin D");
        Observation unnamed = createObservation("other", "0000-1", "1", "", "2023-01-01", null, null);

        List<ProcessedLabValue> labs = selector.selectLabValues(bundleOf(createPatient(), named, unnamed));

        assertEquals("Vitamin D", findLab(labs, "1989-3").getDisplay());
        assertEquals("Unknown Lab", findLab(labs, "0000-1").getDisplay());
        assertEquals(3, findLab(labs, "0000-1").getRelevanceScore());
    }

    @Test
    public void testSelectLabValues_SortedByRelevance() {
        Bundle bundle = bundleOf(createPatient(),
            createObservation("sodium", "2947-0", "140", "mmol/L", "2023-01-01", null, null),
            createObservation("a1c", "4548-4", "8.0", "%", "2024-05-01", "4", "6"),
            createObservation("creat", "2160-0", "1.0", "mg/dL", "2024-05-01", null, null));

        List<ProcessedLabValue> labs = selector.selectLabValues(bundle);

        for (int i = 1; i < labs.size(); i++) {
            assertTrue(labs.get(i - 1).getRelevanceScore() >= labs.get(i).getRelevanceScore());
        }
        assertEquals("4548-4", labs.get(0).getCode());
    }

    // ========== Medication Tests ==========

    @Test
    public void testSelectActiveMedications_StatusRules() {
        Bundle bundle = bundleOf(createPatient(),
            createMedication("active", "1191", "Aspirin", MedicationRequest.MedicationRequestStatus.ACTIVE, "2024-05-20"),
            createMedication("recent-done", "6809", "Metformin", MedicationRequest.MedicationRequestStatus.COMPLETED, "2024-04-01"),
            createMedication("old-done", "4821", "Insulin", MedicationRequest.MedicationRequestStatus.COMPLETED, "2023-12-01"),
            createMedication("stopped", "29046", "Lisinopril", MedicationRequest.MedicationRequestStatus.STOPPED, "2024-05-20"));

        List<ProcessedMedication> meds = selector.selectActiveMedications(bundle);

        assertEquals(2, meds.size());
        ProcessedMedication aspirin = findMedication(meds, "Aspirin");
        assertTrue(aspirin.isActive());
        assertEquals(5 + 3 + 2, aspirin.getRelevanceScore());
        assertEquals("1191", aspirin.getCode());

        ProcessedMedication metformin = findMedication(meds, "Metformin");
        assertFalse(metformin.isActive());
        assertEquals("completed", metformin.getStatus());
        assertEquals(5, metformin.getRelevanceScore());
    }

    @Test
    public void testSelectActiveMedications_InpatientBonusAndFrequency() {
        MedicationRequest medication = createMedication("inpt", "1191", "Aspirin",
            MedicationRequest.MedicationRequestStatus.ACTIVE, "2023-01-01");
        medication.addCategory().addCoding().setCode("inpatient").setDisplay("Inpatient");
        Dosage dosage = medication.addDosageInstruction().setText("81 mg by mouth");
        dosage.getTiming().getRepeat().setFrequency(2).setPeriod(1).setPeriodUnit(Timing.UnitsOfTime.D);

        ProcessedMedication processed = selector.selectActiveMedications(bundleOf(createPatient(), medication)).get(0);

        assertEquals(5 + 3 + 1, processed.getRelevanceScore());
        assertEquals("Inpatient", processed.getCategory());
        assertEquals("81 mg by mouth", processed.getDosage());
        assertEquals("2 times per 1 d", processed.getFrequency());
    }

    @Test
    public void testSelectActiveMedications_MissingTimingGivesEmptyFrequency() {
        MedicationRequest medication = createMedication("m", "1191", "Aspirin",
            MedicationRequest.MedicationRequestStatus.ACTIVE, null);

        ProcessedMedication processed = selector.selectActiveMedications(bundleOf(createPatient(), medication)).get(0);

        assertEquals("", processed.getFrequency());
        assertNull(processed.getAuthoredDate());
        assertEquals(5 + 3, processed.getRelevanceScore());
    }

    @Test
    public void testSelectActiveMedications_PrefersRxNormCode() {
        MedicationRequest medication = new MedicationRequest();
        medication.setId("coded");
        medication.setStatus(MedicationRequest.MedicationRequestStatus.ACTIVE);
        CodeableConcept concept = new CodeableConcept();
        concept.addCoding().setSystem("http://example.org/ndc").setCode("LOCAL-1");
        concept.addCoding().setSystem(RXNORM).setCode("1191").setDisplay("Aspirin");
        medication.setMedication(concept);

        ProcessedMedication processed = selector.selectActiveMedications(bundleOf(createPatient(), medication)).get(0);

        assertEquals("1191", processed.getCode());
        assertEquals("Aspirin", processed.getName());
    }

    // ========== Condition Tests ==========

    @Test
    public void testSelectConditions_FiltersInactiveAndOldUnconfirmed() {
        Bundle bundle = bundleOf(createPatient(),
            createCondition("inactive", "38341003", "Hypertension", "inactive", "confirmed", "2024-05-01"),
            createCondition("new-unconfirmed", "195967001", "Asthma", "active", "unconfirmed", "2024-05-25"),
            createCondition("old-unconfirmed", "13645005", "COPD", "active", "unconfirmed", "2024-01-01"),
            createCondition("resolved", "10509002", "Acute bronchitis", "resolved", "confirmed", "2022-01-01"));

        List<ProcessedCondition> conditions = selector.selectConditions(bundle);

        assertEquals(2, conditions.size());
        assertTrue(conditions.stream().anyMatch(c -> c.getName().equals("Asthma")));
        ProcessedCondition resolved = conditions.stream()
            .filter(c -> c.getName().equals("Acute bronchitis")).findFirst().orElseThrow();
        assertFalse(resolved.isActive());
        assertFalse(resolved.isChronic());
        assertEquals(4, resolved.getRelevanceScore());
    }

    @Test
    public void testSelectConditions_FullScore() {
        Condition diabetes = createCondition("dm", "44054006", "Type 2 diabetes mellitus", "active", "confirmed", "2024-05-01");
        diabetes.setSeverity(new CodeableConcept().addCoding(new Coding(SNOMED, "24484000", "Severe")));

        ProcessedCondition processed = selector.selectConditions(bundleOf(createPatient(), diabetes)).get(0);

        assertTrue(processed.isChronic());
        assertTrue(processed.isActive());
        assertEquals("Severe", processed.getSeverity());
        assertEquals(4 + 3 + 2 + 2 + 1, processed.getRelevanceScore());
        assertEquals("44054006", processed.getCode());
    }

    @Test
    public void testSelectConditions_RecurrenceCountsAsActive() {
        Condition condition = createCondition("rec", "38341003", "Hypertension", "recurrence", "confirmed", "2020-01-01");

        ProcessedCondition processed = selector.selectConditions(bundleOf(createPatient(), condition)).get(0);

        assertTrue(processed.isActive());
        assertEquals(4 + 3 + 2, processed.getRelevanceScore());
    }

    // ========== Encounter Tests ==========

    @Test
    public void testSelectEncounters_NewestFirstLimitedToTen() {
        List<Resource> resources = new ArrayList<>();
        resources.add(createPatient());
        for (int month = 1; month <= 12; month++) {
            resources.add(createEncounter("e" + month, Encounter.EncounterStatus.FINISHED,
                String.format("2023-%02d-15", month)));
        }
        resources.add(createEncounter("planned", Encounter.EncounterStatus.PLANNED, "2024-07-01"));

        List<Encounter> encounters = selector.selectEncounters(bundleOf(resources.toArray(new Resource[0])));

        assertEquals(10, encounters.size());
        assertEquals("e12", encounters.get(0).getIdElement().getIdPart());
        assertEquals("e3", encounters.get(9).getIdElement().getIdPart());
    }

    @Test
    public void testSelectEncounters_UndatedSortLast() {
        Bundle bundle = bundleOf(createPatient(),
            createEncounter("undated", Encounter.EncounterStatus.INPROGRESS, null),
            createEncounter("dated", Encounter.EncounterStatus.FINISHED, "2024-01-01"));

        List<Encounter> encounters = selector.selectEncounters(bundle);

        assertEquals("dated", encounters.get(0).getIdElement().getIdPart());
        assertEquals("undated", encounters.get(1).getIdElement().getIdPart());
    }

    // ========== Full Selection Tests ==========

    @Test
    public void testSelectRelevantResources_MissingPatient() {
        Bundle bundle = bundleOf(createObservation("a1c", "4548-4", "8.0", "%", "2024-05-01", null, null));

        assertThrows(MissingSubjectException.class, () -> selector.selectRelevantResources(bundle));
        assertThrows(MissingSubjectException.class, () -> selector.selectRelevantResources(null));
    }

    @Test
    public void testSelectRelevantResources_Stats() {
        Observation preliminary = createObservation("prelim", "2160-0", "1.0", "mg/dL", "2024-05-01", null, null);
        preliminary.setStatus(Observation.ObservationStatus.PRELIMINARY);
        Bundle bundle = bundleOf(createPatient(),
            createObservation("a1c", "4548-4", "8.0", "%", "2024-05-01", "4", "6"),
            preliminary,
            createMedication("m1", "1191", "Aspirin", MedicationRequest.MedicationRequestStatus.ACTIVE, "2024-05-20"),
            createMedication("m2", "6809", "Metformin", MedicationRequest.MedicationRequestStatus.COMPLETED, "2024-05-01"),
            createCondition("dm", "44054006", "Type 2 diabetes mellitus", "active", "confirmed", "2024-05-01"));

        SelectionResult result = selector.selectRelevantResources(bundle);

        assertNotNull(result.getPatient());
        assertEquals(2, result.getProcessingStats().getTotalObservations());
        assertEquals(1, result.getProcessingStats().getSelectedLabValues());
        assertEquals(2, result.getProcessingStats().getTotalMedications());
        assertEquals(1, result.getProcessingStats().getActiveMedications());
        assertEquals(1, result.getProcessingStats().getTotalConditions());
        assertEquals(1, result.getProcessingStats().getChronicConditions());
        assertTrue(result.getProcessingStats().getProcessingTimeMs() >= 0);
    }

    @Test
    public void testSelectRelevantResources_RepeatableAndDoesNotModifyBundle() {
        Bundle bundle = bundleOf(createPatient(),
            createObservation("a1c", "4548-4", "8.0", "%", "2024-05-01", "4", "6"),
            createMedication("m1", "1191", "Aspirin", MedicationRequest.MedicationRequestStatus.ACTIVE, null),
            createCondition("dm", "44054006", "Type 2 diabetes mellitus", "active", "confirmed", null),
            createEncounter("e1", Encounter.EncounterStatus.FINISHED, null));
        String before = FhirContext.forR4().newJsonParser().encodeResourceToString(bundle);

        SelectionResult first = selector.selectRelevantResources(bundle, NOW);
        SelectionResult second = selector.selectRelevantResources(bundle, NOW);

        assertEquals(first.getLabValues(), second.getLabValues());
        assertEquals(first.getMedications(), second.getMedications());
        assertEquals(first.getConditions(), second.getConditions());
        assertEquals(before, FhirContext.forR4().newJsonParser().encodeResourceToString(bundle));
    }

    @Test
    public void testConstructor_NullArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ResourceSelector(null));
        assertThrows(IllegalArgumentException.class, () -> new ResourceSelector(CodeTables.defaults(), null));
    }

    // ========== Helpers ==========

    private Bundle bundleOf(Resource... resources) {
        Bundle bundle = new Bundle();
        bundle.setType(Bundle.BundleType.COLLECTION);
        for (Resource resource : resources) {
            bundle.addEntry().setResource(resource);
        }
        return bundle;
    }

    private Patient createPatient() {
        Patient patient = new Patient();
        patient.setId("p1");
        patient.setGender(Enumerations.AdministrativeGender.FEMALE);
        patient.getBirthDateElement().setValueAsString("1970-01-01");
        return patient;
    }

    private Observation createObservation(String id, String loinc, String value, String unit, String date,
                                          String low, String high) {
        Observation observation = new Observation();
        observation.setId(id);
        observation.setStatus(Observation.ObservationStatus.FINAL);
        observation.getCode().addCoding().setSystem(LOINC).setCode(loinc);
        if (value != null) {
            observation.setValue(new Quantity().setValue(new BigDecimal(value)).setUnit(unit));
        }
        if (date != null) {
            observation.setEffective(new DateTimeType(date));
        }
        if (low != null || high != null) {
            Observation.ObservationReferenceRangeComponent range = observation.addReferenceRange();
            if (low != null) {
                range.setLow(new Quantity().setValue(new BigDecimal(low)));
            }
            if (high != null) {
                range.setHigh(new Quantity().setValue(new BigDecimal(high)));
            }
        }
        return observation;
    }

    private MedicationRequest createMedication(String id, String rxnorm, String name,
                                               MedicationRequest.MedicationRequestStatus status, String authoredOn) {
        MedicationRequest medication = new MedicationRequest();
        medication.setId(id);
        medication.setStatus(status);
        medication.setIntent(MedicationRequest.MedicationRequestIntent.ORDER);
        medication.setMedication(new CodeableConcept().addCoding(new Coding(RXNORM, rxnorm, name)));
        if (authoredOn != null) {
            medication.setAuthoredOnElement(new DateTimeType(authoredOn));
        }
        return medication;
    }

    private Condition createCondition(String id, String snomed, String name, String clinicalStatus,
                                      String verificationStatus, String recordedDate) {
        Condition condition = new Condition();
        condition.setId(id);
        condition.setClinicalStatus(new CodeableConcept().addCoding(
            new Coding("http://terminology.hl7.org/CodeSystem/condition-clinical", clinicalStatus, null)));
        condition.setVerificationStatus(new CodeableConcept().addCoding(
            new Coding("http://terminology.hl7.org/CodeSystem/condition-ver-status", verificationStatus, null)));
        condition.setCode(new CodeableConcept().addCoding(new Coding(SNOMED, snomed, name)));
        if (recordedDate != null) {
            condition.setRecordedDateElement(new DateTimeType(recordedDate));
        }
        return condition;
    }

    private Encounter createEncounter(String id, Encounter.EncounterStatus status, String start) {
        Encounter encounter = new Encounter();
        encounter.setId(id);
        encounter.setStatus(status);
        if (start != null) {
            encounter.setPeriod(new Period().setStartElement(new DateTimeType(start)));
        }
        return encounter;
    }

    private ProcessedLabValue findLab(List<ProcessedLabValue> labs, String code) {
        return labs.stream().filter(lab -> lab.getCode().equals(code)).findFirst().orElseThrow();
    }

    private ProcessedMedication findMedication(List<ProcessedMedication> meds, String name) {
        return meds.stream().filter(med -> med.getName().equals(name)).findFirst().orElseThrow();
    }
}
