package io.github.cyfko.reportql.core.query;

import io.github.cyfko.reportql.core.exception.QueryValidationException;

import java.util.Locale;

/**
 * Time bucketing of a report, expressed as a dimension inserted in front of the others.
 *
 * <table>
 *   <caption>Granularity dimensions</caption>
 *   <tr><th>Granularity</th><th>Index</th><th>Dimension</th></tr>
 *   <tr><td>YEAR</td><td>0</td><td>{@code ga:year}</td></tr>
 *   <tr><td>MONTH</td><td>1</td><td>{@code ga:yearMonth}</td></tr>
 *   <tr><td>WEEK</td><td>2</td><td>{@code ga:yearWeek}</td></tr>
 *   <tr><td>DAY</td><td>3</td><td>{@code ga:date}</td></tr>
 *   <tr><td>HOUR</td><td>4</td><td>{@code ga:dateHour}</td></tr>
 *   <tr><td>LIFETIME</td><td>-</td><td>none, one row for the whole range</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Granularity {

    YEAR("ga:year"),
    MONTH("ga:yearMonth"),
    WEEK("ga:yearWeek"),
    DAY("ga:date"),
    HOUR("ga:dateHour"),
    LIFETIME(null);

    private static final String CHOICES = "Granularity should be one of: lifetime, year, month, week, day, hour";

    private final String dimension;

    Granularity(String dimension) {
        this.dimension = dimension;
    }

    /**
     * @return the wire id of the bucketing dimension, {@code null} for {@link #LIFETIME}
     */
    public String getDimension() {
        return dimension;
    }

    /**
     * @param index position in {@code year, month, week, day, hour}
     * @return the granularity
     * @throws QueryValidationException if the index is out of range
     */
    public static Granularity fromIndex(int index) {
        if (index < 0 || index > HOUR.ordinal()) {
            throw new QueryValidationException(CHOICES + ". Received: " + index);
        }
        return values()[index];
    }

    /**
     * @param name granularity name, case-insensitive
     * @return the granularity
     * @throws QueryValidationException on unknown names
     */
    public static Granularity fromString(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (Granularity granularity : values()) {
                if (granularity.name().equals(normalized)) {
                    return granularity;
                }
            }
        }
        throw new QueryValidationException(CHOICES + ". Received: " + name);
    }
}
