package com.civicintel.servicerequest.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;

/**
 * Normalises Socrata floating timestamps to UTC ISO-8601 strings.
 *
 * Socrata returns created_date / closed_date without an offset, e.g.
 * "2023-01-01T12:34:56.789" or "2023-01-01T12:34:56". Both are read as UTC:
 *   2023-01-01T12:34:56.789 → 2023-01-01T12:34:56.789000+00:00
 *   2023-01-01T12:34:56     → 2023-01-01T12:34:56+00:00
 *
 * Values in any other shape are returned untouched, so a malformed but
 * non-empty date is stored verbatim rather than dropped.
 */
@Component
@Slf4j
public class DateNormalizer {

    private static final DateTimeFormatter WITH_FRACTION = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 6, true)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter WITHOUT_FRACTION = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final List<DateTimeFormatter> INPUT_FORMATS = List.of(WITH_FRACTION, WITHOUT_FRACTION);

    private static final DateTimeFormatter MICROS_OUTPUT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSxxx");
    private static final DateTimeFormatter SECONDS_OUTPUT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx");

    /**
     * @param raw timestamp as returned by the API, may be null
     * @return UTC ISO string, null for null/empty input, or {@code raw} itself when unrecognised
     */
    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : INPUT_FORMATS) {
            try {
                return render(LocalDateTime.parse(raw, format));
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", raw, format);
            }
        }
        log.debug("Unrecognised timestamp kept as-is: {}", raw);
        return raw;
    }

    private String render(LocalDateTime timestamp) {
        DateTimeFormatter output = timestamp.getNano() == 0 ? SECONDS_OUTPUT : MICROS_OUTPUT;
        return timestamp.atOffset(ZoneOffset.UTC).format(output);
    }
}
