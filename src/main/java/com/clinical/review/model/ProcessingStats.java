package com.clinical.review.model;

/**
 * Counts describing how much of a bundle survived selection.
 * {@code processingTimeMs} is wall-clock and only meant for observability.
 */
public final class ProcessingStats {
    private final int totalObservations;
    private final int selectedLabValues;
    private final int totalMedications;
    private final int activeMedications;
    private final int totalConditions;
    private final int chronicConditions;
    private final long processingTimeMs;

    public ProcessingStats(int totalObservations, int selectedLabValues, int totalMedications,
                           int activeMedications, int totalConditions, int chronicConditions,
                           long processingTimeMs) {
        this.totalObservations = totalObservations;
        this.selectedLabValues = selectedLabValues;
        this.totalMedications = totalMedications;
        this.activeMedications = activeMedications;
        this.totalConditions = totalConditions;
        this.chronicConditions = chronicConditions;
        this.processingTimeMs = processingTimeMs;
    }

    public int getTotalObservations() {
        return totalObservations;
    }

    public int getSelectedLabValues() {
        return selectedLabValues;
    }

    public int getTotalMedications() {
        return totalMedications;
    }

    public int getActiveMedications() {
        return activeMedications;
    }

    public int getTotalConditions() {
        return totalConditions;
    }

    public int getChronicConditions() {
        return chronicConditions;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    @Override
    public String toString() {
        return "ProcessingStats{observations=" + selectedLabValues + "/" + totalObservations
                + ", medications=" + activeMedications + "/" + totalMedications
                + ", conditions=" + chronicConditions + "/" + totalConditions
                + ", " + processingTimeMs + "ms}";
    }
}
