package io.github.cyfko.reportql.core.report;

import io.github.cyfko.reportql.core.query.CoreQuery;

import java.util.logging.Logger;

/**
 * Drives offset pagination of a {@link CoreQuery} and merges its pages into one
 * {@link Report}.
 * <p>
 * After each page the driver stops when either
 * </p>
 * <ul>
 *   <li>the page announces no following page (the report is complete), or</li>
 *   <li>the rows accumulated so far reach the query's limit.</li>
 * </ul>
 * <p>
 * The limit is checked after whole pages: when a page crosses it, every row of that page
 * is kept, so a report may hold more rows than the limit.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReportPaginator {

    private static final Logger log = Logger.getLogger(ReportPaginator.class.getName());

    private ReportPaginator() {
    }

    /**
     * Fetches pages until the result is complete or large enough.
     *
     * @param query first page's query
     * @return the merged report
     */
    public static Report collect(CoreQuery query) {
        long started = System.nanoTime();
        long limit = query.options().hasLimit() ? query.options().limit() : Long.MAX_VALUE;

        CoreQuery cursor = query;
        Report report = null;
        boolean enough = false;
        boolean complete = false;

        while (!(enough || complete)) {
            ResponsePage page = cursor.fetch();

            if (report == null) {
                report = Report.of(page, cursor);
            } else {
                report.append(page, cursor);
            }

            enough = report.size() >= limit;
            complete = !page.hasNextPage();
            cursor = cursor.next();
        }

        Report result = report;
        log.info(() -> String.format("Collected %d row(s) over %d page(s) in %d ms",
                result.size(), result.pages().size(), (System.nanoTime() - started) / 1_000_000));
        return result;
    }
}
