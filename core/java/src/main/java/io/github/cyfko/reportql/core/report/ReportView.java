package io.github.cyfko.reportql.core.report;

import java.util.List;

/**
 * Read-only shortcuts over report data.
 * <p>
 * Implemented by {@link Report} and by queries, which materialize their report on first
 * access and delegate to it:
 * </p>
 * <pre>{@code
 * Object pageviews = context.query("pageviews").range("2020-01-01", "2020-01-31").value();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ReportView {

    /**
     * @return every row, in response order
     */
    List<Row> rows();

    /**
     * @return the single value of a one-row, one-metric report, {@code null} when there are no rows
     * @throws IllegalStateException if the report has several rows or metrics
     */
    Object value();

    /**
     * @return the values of the only metric, one per row
     * @throws IllegalStateException if the report has several metrics
     */
    List<Object> values();

    /**
     * @return the first row, or {@code null} when there are none
     */
    Row first();

    /**
     * @return the last row, or {@code null} when there are none
     */
    Row last();
}
