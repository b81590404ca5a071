package com.clinical.review.fhir;

import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.PrimitiveType;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Date handling for FHIR date and dateTime strings.
 * Values without an offset are read as UTC so results do not depend on the JVM time zone.
 */
public final class FhirDates {

    private static final double MILLIS_PER_DAY = 24d * 60 * 60 * 1000;

    private FhirDates() {
    }

    /**
     * Parse a FHIR date or dateTime string
     * @param value e.g. "2024", "2024-03", "2024-03-15" or "2024-03-15T10:00:00+02:00"
     * @return the instant, or empty if the value is blank or unparseable
     */
    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        try {
            if (text.contains("T")) {
                if (hasOffset(text)) {
                    return Optional.of(OffsetDateTime.parse(text).toInstant());
                }
                return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
            }
            return parseLocalDate(text).map(date -> date.atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Parse the string form of a FHIR primitive (DateTimeType, DateType, ...)
     */
    public static Optional<Instant> parse(PrimitiveType<?> element) {
        if (element == null || element.isEmpty()) {
            return Optional.empty();
        }
        return parse(element.getValueAsString());
    }

    /**
     * @return the patient's birth date, or empty if absent or unparseable
     */
    public static Optional<LocalDate> birthDate(Patient patient) {
        if (patient == null || !patient.hasBirthDateElement()) {
            return Optional.empty();
        }
        String text = patient.getBirthDateElement().getValueAsString();
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return parseLocalDate(text.trim());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Calculate age in whole years on the given day. A birthday later in the year than
     * {@code today} has not been counted yet.
     * @return age in years, or empty if the birth date is not available
     */
    public static Optional<Integer> ageOn(Patient patient, LocalDate today) {
        return birthDate(patient).map(birth -> Period.between(birth, today).getYears());
    }

    /**
     * @return the UTC calendar date of the instant
     */
    public static LocalDate utcDate(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    /**
     * Fractional days from {@code from} to {@code to}; negative when {@code from} is later.
     */
    public static double daysBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_DAY;
    }

    /**
     * @return true if the date is no more than {@code maxDaysAgo} days before {@code now}.
     *         Future dates count as recent; a missing date never does.
     */
    public static boolean isWithinDays(Instant date, Instant now, long maxDaysAgo) {
        if (date == null) {
            return false;
        }
        return daysBetween(date, now) <= maxDaysAgo;
    }

    private static Optional<LocalDate> parseLocalDate(String text) {
        switch (text.length()) {
            case 4:
                return Optional.of(Year.parse(text).atDay(1));
            case 7:
                return Optional.of(YearMonth.parse(text).atDay(1));
            case 10:
                return Optional.of(LocalDate.parse(text));
            default:
                return Optional.empty();
        }
    }

    private static boolean hasOffset(String text) {
        int timeStart = text.indexOf('T');
        String time = text.substring(timeStart + 1);
        return time.endsWith("Z") || time.contains("+") || time.contains("-");
    }
}
