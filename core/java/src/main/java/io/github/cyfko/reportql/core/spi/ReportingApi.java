package io.github.cyfko.reportql.core.spi;

/**
 * Reporting APIs a query can target.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ReportingApi {

    /** Historical, aggregated reporting with pagination. */
    CORE,

    /** Live data, single page. */
    REALTIME
}
