package io.github.cyfko.reportql.core.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Descriptor of a reporting column (metric or dimension).
 * <p>
 * A column is addressable by three keys, all matched case-insensitively by registries and
 * reports:
 * </p>
 * <dl>
 *   <dt>{@code id}</dt><dd>the wire identifier, e.g. {@code ga:pageviews}</dd>
 *   <dt>{@code name}</dt><dd>the human readable name, e.g. {@code Pageviews}</dd>
 *   <dt>{@code slug}</dt><dd>a snake-cased form of the name, e.g. {@code session_duration}</dd>
 * </dl>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * Column sessions = Column.metric("ga:sessions", "Sessions", DataType.INTEGER);
 * sessions.select(Selector.GT, 10);   // "ga:sessions>10"
 * sessions.cast("42");                // 42L
 * }</pre>
 *
 * @param id       wire identifier
 * @param name     human readable name (defaults to the unprefixed id)
 * @param type     metric or dimension
 * @param dataType data type driving {@link #cast(String)}
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Column(String id, String name, ColumnType type, DataType dataType) {

    public Column {
        Objects.requireNonNull(id, "Column id is required");
        Objects.requireNonNull(type, "Column type is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Column id cannot be blank");
        }
        if (name == null || name.isBlank()) {
            name = unprefixed(id);
        }
        if (dataType == null) {
            dataType = DataType.STRING;
        }
    }

    public static Column metric(String id, String name, DataType dataType) {
        return new Column(id, name, ColumnType.METRIC, dataType);
    }

    public static Column dimension(String id, String name, DataType dataType) {
        return new Column(id, name, ColumnType.DIMENSION, dataType);
    }

    /**
     * Snake-cased name, usable as a stable programmatic key.
     *
     * @return e.g. {@code page_load_time} for "Page Load Time"
     */
    public String slug() {
        return name.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replaceAll("[^A-Za-z0-9]+", "_")
                .replaceAll("^_+|_+$", "")
                .toLowerCase(Locale.ROOT);
    }

    public boolean isMetric() {
        return type == ColumnType.METRIC;
    }

    public boolean isDimension() {
        return type == ColumnType.DIMENSION;
    }

    /**
     * Casts a raw response cell with this column's data type.
     *
     * @param raw cell value
     * @return typed value
     */
    public Object cast(String raw) {
        return dataType.cast(raw);
    }

    /**
     * Compiles a comparison of this column against a value.
     *
     * @param selector comparison operator
     * @param value    operand
     * @return wire expression, e.g. {@code ga:browser==Chrome}
     */
    public String select(Selector selector, Object value) {
        return selector.apply(id, value);
    }

    /**
     * Tells whether {@code key} addresses this column by id, unprefixed id, name or slug.
     *
     * @param key lookup key
     * @return {@code true} on a case-insensitive match
     */
    public boolean matches(String key) {
        if (key == null) {
            return false;
        }
        String candidate = key.trim();
        return id.equalsIgnoreCase(candidate)
                || unprefixed(id).equalsIgnoreCase(candidate)
                || name.equalsIgnoreCase(candidate)
                || slug().equalsIgnoreCase(candidate);
    }

    /**
     * Strips the namespace prefix of a wire identifier ({@code ga:}, {@code rt:} ...).
     *
     * @param id wire identifier
     * @return identifier without its prefix
     */
    public static String unprefixed(String id) {
        int colon = id.indexOf(':');
        return colon < 0 ? id : id.substring(colon + 1);
    }
}
