package io.github.cyfko.reportql.core.api;

/**
 * Kind of a reporting column.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ColumnType {

    /** Aggregated, numeric value computed by the reporting service. */
    METRIC,

    /** Grouping attribute that splits metric values into rows. */
    DIMENSION
}
