package io.github.cyfko.reportql.core.api;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Function;

/**
 * Wire data types of reporting columns together with the caster that turns the
 * string values of a response row into typed Java values.
 * <p>
 * The reporting service sends every cell as a string. Each data type knows how to
 * convert such a string into its natural Java counterpart:
 * </p>
 * <ul>
 *     <li>{@link #INTEGER} → {@link Long}</li>
 *     <li>{@link #FLOAT}, {@link #CURRENCY}, {@link #PERCENT}, {@link #TIME} → {@link Double}</li>
 *     <li>{@link #DATE} ({@code yyyyMMdd}) → {@link LocalDate}</li>
 *     <li>{@link #DATE_HOUR} ({@code yyyyMMddHH}) → {@link LocalDateTime}</li>
 *     <li>{@link #STRING} → {@link String} (unchanged)</li>
 * </ul>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * Object pageviews = DataType.INTEGER.cast("42");        // 42L
 * Object day = DataType.DATE.cast("20200101");            // 2020-01-01
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum DataType {

    /** Whole numbers such as counts. */
    INTEGER(Long::valueOf),

    /** Floating point numbers. */
    FLOAT(Double::valueOf),

    /** Monetary amounts. */
    CURRENCY(Double::valueOf),

    /** Percentages, expressed as plain numbers (e.g. {@code 12.5}). */
    PERCENT(Double::valueOf),

    /** Durations in seconds. */
    TIME(Double::valueOf),

    /** Calendar day in basic ISO format. */
    DATE(value -> LocalDate.parse(value, DateTimeFormatter.BASIC_ISO_DATE)),

    /** Calendar day and hour. */
    DATE_HOUR(value -> LocalDateTime.parse(value, DateTimeFormatter.ofPattern("yyyyMMddHH"))),

    /** Free text, left as is. */
    STRING(Function.identity());

    private final Function<String, ?> caster;

    DataType(Function<String, ?> caster) {
        this.caster = caster;
    }

    /**
     * Converts a raw cell value into this type's Java representation.
     *
     * @param raw the raw string as sent by the reporting service, may be {@code null}
     * @return the typed value, or {@code null} when {@code raw} is {@code null}
     * @throws NumberFormatException if a numeric cell is not a number
     * @throws java.time.format.DateTimeParseException if a date cell is malformed
     */
    public Object cast(String raw) {
        if (raw == null) {
            return null;
        }
        return caster.apply(raw);
    }
}
