package com.civicintel.servicerequest.model;

import com.civicintel.servicerequest.config.IngestProperties;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Inclusive range of creation dates to ingest.
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public DateWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window start and end are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
    }

    public static DateWindow resolve(IngestProperties.Window window, Clock clock) {
        return resolve(window.startDate(), window.endDate(), window.defaultDays(), clock);
    }

    /**
     * Explicit dates win. A missing end means today in the clock's zone; a missing
     * start means end minus {@code defaultDays}.
     */
    public static DateWindow resolve(String startDate, String endDate, int defaultDays, Clock clock) {
        LocalDate end = isBlank(endDate) ? LocalDate.now(clock) : parseDate(endDate);
        LocalDate start = isBlank(startDate) ? end.minusDays(defaultDays) : parseDate(startDate);
        return new DateWindow(start, end);
    }

    /** Socrata SoQL filter covering every second of the window. */
    public String whereClause() {
        return String.format("created_date between '%sT00:00:00' and '%sT23:59:59'", start, end);
    }

    private static LocalDate parseDate(String value) {
        String trimmed = value.trim();
        if (trimmed.indexOf('T') > 0) {
            return LocalDate.from(DateTimeFormatter.ISO_DATE_TIME.parse(trimmed));
        }
        return LocalDate.parse(trimmed);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
