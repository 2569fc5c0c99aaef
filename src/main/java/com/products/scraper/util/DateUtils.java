package com.products.scraper.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Date conversions to Unix epoch seconds.
 * <p>
 * Shop dates carry no zone; they are read as wall-clock time of the JVM
 * default zone, the same zone used for the {@code date_to} cutoff.
 */
@Slf4j
public final class DateUtils {

    /** Ukrainian month names in the genitive case, as printed by brain.com.ua. */
    public static final Map<String, Integer> UA_MONTHS = Map.ofEntries(
            Map.entry("січня", 1),
            Map.entry("лютого", 2),
            Map.entry("березня", 3),
            Map.entry("квітня", 4),
            Map.entry("травня", 5),
            Map.entry("червня", 6),
            Map.entry("липня", 7),
            Map.entry("серпня", 8),
            Map.entry("вересня", 9),
            Map.entry("жовтня", 10),
            Map.entry("листопада", 11),
            Map.entry("грудня", 12)
    );

    /** {@code 2024-03-15 10:20:30} or {@code 2024-03-15T10:20:30}. */
    private static final DateTimeFormatter LOCAL_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter(Locale.ROOT);

    private DateUtils() {
    }

    /**
     * Parses the {@code date_to} request parameter.
     *
     * @param dateTo {@code YYYY-MM-DD}, may be {@code null}
     * @return epoch seconds of local midnight, or {@code null} when absent or invalid
     */
    public static Long parseDateTo(final String dateTo) {
        if (StringUtils.isBlank(dateTo)) {
            return null;
        }
        try {
            long ts = toEpochSecond(LocalDate.parse(dateTo.trim()).atStartOfDay());
            log.info("Date cutoff: {}", dateTo);
            return ts;
        } catch (DateTimeParseException ex) {
            log.error("Invalid date_to format: {}. Expected YYYY-MM-DD", dateTo);
            return null;
        }
    }

    /**
     * Parses a review timestamp such as {@code 2024-03-15 10:20:30}
     * (the ISO {@code T} form is accepted too).
     *
     * @param value raw timestamp
     * @return epoch seconds, or {@code null} if unparseable
     */
    public static Long parseTimestamp(final String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return toEpochSecond(LocalDateTime.parse(value.trim(), LOCAL_TIMESTAMP));
        } catch (DateTimeParseException ex) {
            log.warn("Failed to parse date {}", value);
            return null;
        }
    }

    /**
     * Parses a date written as {@code "15 березня 2024"}.
     *
     * @param value day, genitive month name, year
     * @return epoch seconds of local midnight, or {@code null} if unparseable
     */
    public static Long parseUkrainianDate(final String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 3) {
            log.warn("Unexpected date layout '{}'", value);
            return null;
        }
        Integer month = UA_MONTHS.get(parts[1].toLowerCase(Locale.ROOT));
        if (month == null) {
            log.warn("Unknown month: {}", parts[1]);
            return null;
        }
        try {
            LocalDate date = LocalDate.of(Integer.parseInt(parts[2]), month, Integer.parseInt(parts[0]));
            return toEpochSecond(date.atStartOfDay());
        } catch (NumberFormatException | DateTimeException ex) {
            log.warn("Failed to parse date '{}': {}", value, ex.getMessage());
            return null;
        }
    }

    private static long toEpochSecond(final LocalDateTime dateTime) {
        return dateTime.atZone(ZoneId.systemDefault()).toEpochSecond();
    }
}
