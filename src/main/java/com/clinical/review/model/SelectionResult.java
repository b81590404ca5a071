package com.clinical.review.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.hl7.fhir.r4.model.Encounter;
import org.hl7.fhir.r4.model.Patient;

import java.util.List;
import java.util.Objects;

/**
 * Clinically relevant subset of one bundle. Built once by the resource selector and never changed afterwards.
 */
public final class SelectionResult {
    private final Patient patient;
    private final List<ProcessedLabValue> labValues;
    private final List<ProcessedMedication> medications;
    private final List<ProcessedCondition> conditions;
    private final List<Encounter> encounters;
    private final ProcessingStats processingStats;

    public SelectionResult(Patient patient, List<ProcessedLabValue> labValues,
                           List<ProcessedMedication> medications, List<ProcessedCondition> conditions,
                           List<Encounter> encounters, ProcessingStats processingStats) {
        this.patient = patient;
        this.labValues = labValues != null ? List.copyOf(labValues) : List.of();
        this.medications = medications != null ? List.copyOf(medications) : List.of();
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        this.encounters = encounters != null ? List.copyOf(encounters) : List.of();
        this.processingStats = Objects.requireNonNull(processingStats, "processingStats");
    }

    /**
     * @return the bundle's subject; may be null only for selections assembled by hand
     */
    @JsonIgnore
    public Patient getPatient() {
        return patient;
    }

    public List<ProcessedLabValue> getLabValues() {
        return labValues;
    }

    public List<ProcessedMedication> getMedications() {
        return medications;
    }

    public List<ProcessedCondition> getConditions() {
        return conditions;
    }

    @JsonIgnore
    public List<Encounter> getEncounters() {
        return encounters;
    }

    public ProcessingStats getProcessingStats() {
        return processingStats;
    }
}
