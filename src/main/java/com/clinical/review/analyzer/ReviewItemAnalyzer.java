package com.clinical.review.analyzer;

import com.clinical.review.fhir.FhirDates;
import com.clinical.review.model.ChartHint;
import com.clinical.review.model.ChartTab;
import com.clinical.review.model.ProcessedLabValue;
import com.clinical.review.model.ProcessedMedication;
import com.clinical.review.model.ReferenceRange;
import com.clinical.review.model.ReviewItem;
import com.clinical.review.model.ReviewItemType;
import com.clinical.review.model.SelectionResult;
import com.clinical.review.model.Severity;
import com.clinical.review.tables.CareGapRule;
import com.clinical.review.tables.CodeTables;
import com.clinical.review.tables.InteractionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Derives review items from selected resources: abnormal and fast-changing labs, drug interactions
 * and duplicates, long-running orders, and missing preventive screenings.
 */
public class ReviewItemAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(ReviewItemAnalyzer.class);

    // Percent change thresholds between consecutive results
    private static final double SIGNIFICANT_CHANGE_PERCENT = 30.0;
    private static final double MAJOR_CHANGE_PERCENT = 50.0;

    // Active orders older than this are flagged for an adherence review
    private static final double LONG_TERM_MEDICATION_DAYS = 90.0;

    private static final Comparator<ReviewItem> SEVERITY_THEN_NEWEST =
        Comparator.comparingInt((ReviewItem item) -> item.getSeverity().getRank())
            .thenComparing(ReviewItem::getDateIdentified, Comparator.reverseOrder());

    private final CodeTables codeTables;
    private final Clock clock;

    public ReviewItemAnalyzer(CodeTables codeTables) {
        this(codeTables, Clock.systemUTC());
    }

    public ReviewItemAnalyzer(CodeTables codeTables, Clock clock) {
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
     * Main analysis method: labs, then medications, then care gaps, sorted by severity
     * (high first) and then by date identified (newest first)
     * @param selection The selected resources, may be null
     * @return Ordered review items; empty when there is nothing to review
     */
    public List<ReviewItem> computeReviewItems(SelectionResult selection) {
        return computeReviewItems(selection, clock.instant());
    }

    public List<ReviewItem> computeReviewItems(SelectionResult selection, Instant now) {
        if (selection == null) {
            return new ArrayList<>();
        }

        List<ReviewItem> items = new ArrayList<>();
        items.addAll(analyzeLabs(selection.getLabValues(), now));
        items.addAll(analyzeMedications(selection.getMedications(), now));
        items.addAll(analyzeCareGaps(selection, now));

        items.sort(SEVERITY_THEN_NEWEST);

        logger.info("Computed {} review items ({} requiring action)",
            items.size(), items.stream().filter(ReviewItem::isActionRequired).count());
        return items;
    }

    // ========== Labs ==========

    /**
     * Flag abnormal results and significant changes between consecutive results of the same code
     * @param labs Processed lab values, possibly several per code
     * @return Lab review items in code-group order
     */
    public List<ReviewItem> analyzeLabs(List<ProcessedLabValue> labs) {
        return analyzeLabs(labs, clock.instant());
    }

    public List<ReviewItem> analyzeLabs(List<ProcessedLabValue> labs, Instant now) {
        List<ReviewItem> items = new ArrayList<>();
        if (labs == null) {
            return items;
        }

        Map<String, List<ProcessedLabValue>> labsByCode = labs.stream()
                .collect(Collectors.groupingBy(ProcessedLabValue::getCode, LinkedHashMap::new, Collectors.toList()));

        for (List<ProcessedLabValue> group : labsByCode.values()) {
            List<ProcessedLabValue> ordered = new ArrayList<>(group);
            ordered.sort(Comparator.comparing(ProcessedLabValue::getDate,
                Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));

            for (int index = 0; index < ordered.size(); index++) {
                ProcessedLabValue lab = ordered.get(index);

                if (lab.isAbnormal() && lab.getReferenceRange() != null) {
                    items.add(abnormalLabItem(lab, index, now));
                }

                if (index > 0) {
                    deltaItem(ordered.get(index - 1), lab, index, now).ifPresent(items::add);
                }
            }
        }

        return items;
    }

    private ReviewItem abnormalLabItem(ProcessedLabValue lab, int index, Instant now) {
        ReferenceRange range = lab.getReferenceRange();
        String description = String.format("%s %s (Normal: %s-%s)",
            formatNumber(comparableValue(lab)),
            nullToEmpty(lab.getNormalizedUnit()),
            range.getLow() != null ? formatNumber(range.getLow()) : "N/A",
            range.getHigh() != null ? formatNumber(range.getHigh()) : "N/A");

        return new ReviewItem(
            "lab-abnormal-" + sourceId(lab.getSourceRef(), index),
            ReviewItemType.LAB_ABNORMAL,
            Severity.MEDIUM,
            "Abnormal " + lab.getDisplay(),
            description,
            "Lab result is outside normal reference range. Date: " + formatDate(lab.getDate()),
            lab.getSourceRef(),
            new ChartHint(ChartTab.LAB_TRENDS, lab.getCode()),
            true,
            lab.getDate() != null ? lab.getDate() : now
        );
    }

    /**
     * Compare a result with the previous one of the same code; more than 30% change is significant,
     * more than 50% is high severity and needs action
     */
    private Optional<ReviewItem> deltaItem(ProcessedLabValue previous, ProcessedLabValue current,
                                           int index, Instant now) {
        BigDecimal previousValue = comparableValue(previous);
        BigDecimal currentValue = comparableValue(current);
        if (previousValue == null || currentValue == null || previousValue.signum() == 0) {
            return Optional.empty();
        }

        double prev = previousValue.doubleValue();
        double cur = currentValue.doubleValue();
        double percentChange = Math.abs((cur - prev) / prev) * 100;
        if (percentChange <= SIGNIFICANT_CHANGE_PERCENT) {
            return Optional.empty();
        }

        boolean major = percentChange > MAJOR_CHANGE_PERCENT;
        String direction = cur > prev ? "increased" : "decreased";

        return Optional.of(new ReviewItem(
            "lab-delta-" + sourceId(current.getSourceRef(), index),
            ReviewItemType.LAB_DELTA,
            major ? Severity.HIGH : Severity.MEDIUM,
            "Significant " + current.getDisplay() + " Change",
            String.format(Locale.ROOT, "%s %.1f%% from %s to %s %s",
                direction, percentChange, formatNumber(previousValue), formatNumber(currentValue),
                nullToEmpty(current.getNormalizedUnit())).trim(),
            "Significant change from " + formatDate(previous.getDate()) + " to " + formatDate(current.getDate()),
            current.getSourceRef(),
            new ChartHint(ChartTab.LAB_TRENDS, current.getCode()),
            major,
            current.getDate() != null ? current.getDate() : now
        ));
    }

    private BigDecimal comparableValue(ProcessedLabValue lab) {
        return lab.getNormalizedValue() != null ? lab.getNormalizedValue() : lab.getValue();
    }

    // ========== Medications ==========

    /**
     * Check every pair of active medications for catalogued interactions and duplicate codes,
     * and flag active orders authored more than 90 days ago
     * @param medications Processed medications
     * @return Medication review items
     */
    public List<ReviewItem> analyzeMedications(List<ProcessedMedication> medications) {
        return analyzeMedications(medications, clock.instant());
    }

    public List<ReviewItem> analyzeMedications(List<ProcessedMedication> medications, Instant now) {
        List<ReviewItem> items = new ArrayList<>();
        if (medications == null) {
            return items;
        }

        List<ProcessedMedication> activeMeds = medications.stream()
                .filter(ProcessedMedication::isActive)
                .collect(Collectors.toList());

        for (int i = 0; i < activeMeds.size(); i++) {
            for (int j = i + 1; j < activeMeds.size(); j++) {
                ProcessedMedication first = activeMeds.get(i);
                ProcessedMedication second = activeMeds.get(j);
                String pairId = sourceId(first.getSourceRef(), i) + "-" + sourceId(second.getSourceRef(), j);

                Optional<InteractionRule> interaction = codeTables.findInteraction(first.getCode(), second.getCode());
                if (interaction.isPresent()) {
                    InteractionRule rule = interaction.get();
                    items.add(new ReviewItem(
                        "med-interaction-" + pairId,
                        ReviewItemType.MED_INTERACTION,
                        rule.getSeverity(),
                        "Medication Interaction",
                        first.getName() + " + " + second.getName() + ": " + rule.getDescription(),
                        rule.getAction(),
                        null,
                        new ChartHint(ChartTab.MED_TIMELINE),
                        rule.getSeverity() == Severity.HIGH,
                        now
                    ));
                }

                // A catalogued interaction and a duplicate can both fire for the same pair
                if (first.getCode() != null && first.getCode().equals(second.getCode())) {
                    items.add(new ReviewItem(
                        "med-duplicate-" + pairId,
                        ReviewItemType.MED_INTERACTION,
                        Severity.MEDIUM,
                        "Duplicate Medication",
                        "Multiple prescriptions for " + first.getName(),
                        "Review for potential duplicate therapy and consolidate if appropriate",
                        null,
                        new ChartHint(ChartTab.MED_TIMELINE),
                        true,
                        now
                    ));
                }
            }
        }

        for (int index = 0; index < medications.size(); index++) {
            ProcessedMedication medication = medications.get(index);
            if (medication.getAuthoredDate() == null || !medication.isActive()) {
                continue;
            }

            double daysSinceOrdered = FhirDates.daysBetween(medication.getAuthoredDate(), now);
            if (daysSinceOrdered > LONG_TERM_MEDICATION_DAYS) {
                items.add(new ReviewItem(
                    "med-adherence-" + sourceId(medication.getSourceRef(), index),
                    ReviewItemType.MED_ADHERENCE,
                    Severity.LOW,
                    "Long-term Active Medication",
                    medication.getName() + " active for " + Math.round(daysSinceOrdered) + " days",
                    "Review medication adherence and consider refill needs",
                    medication.getSourceRef(),
                    new ChartHint(ChartTab.MEDICATIONS),
                    false,
                    now
                ));
            }
        }

        return items;
    }

    // ========== Care gaps ==========

    /**
     * Evaluate each care-gap rule the patient is eligible for
     * @param selection The selected resources
     * @return One care-gap item per triggered rule, empty when there is no patient
     */
    public List<ReviewItem> analyzeCareGaps(SelectionResult selection) {
        return analyzeCareGaps(selection, clock.instant());
    }

    public List<ReviewItem> analyzeCareGaps(SelectionResult selection, Instant now) {
        List<ReviewItem> items = new ArrayList<>();
        if (selection == null || selection.getPatient() == null) {
            return items;
        }

        LocalDate today = FhirDates.utcDate(now);

        for (CareGapRule rule : codeTables.getCareGapRules()) {
            if (!rule.applies(selection.getPatient(), today)) {
                continue;
            }
            if (!rule.checkGap(selection, now)) {
                continue;
            }

            logger.debug("Care gap found: {}", rule.getId());
            items.add(new ReviewItem(
                "care-gap-" + rule.getId(),
                ReviewItemType.CARE_GAP,
                Severity.MEDIUM,
                "Care Gap: " + rule.getName(),
                rule.getDescription(),
                rule.getRecommendation(),
                null,
                new ChartHint(ChartTab.LABS),
                true,
                now
            ));
        }

        return items;
    }

    // ========== Formatting ==========

    /**
     * Id part of a "Type/id" reference, or the position when the resource had no id
     */
    private String sourceId(String sourceRef, int fallbackIndex) {
        if (sourceRef == null || sourceRef.isEmpty()) {
            return String.valueOf(fallbackIndex);
        }
        return sourceRef.substring(sourceRef.lastIndexOf('/') + 1);
    }

    private String formatNumber(BigDecimal value) {
        if (value == null) {
            return "N/A";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    private String formatDate(Instant date) {
        if (date == null) {
            return "unknown date";
        }
        return FhirDates.utcDate(date).toString();
    }

    private String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
