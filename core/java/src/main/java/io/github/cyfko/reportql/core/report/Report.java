package io.github.cyfko.reportql.core.report;

import io.github.cyfko.reportql.core.api.Column;
import io.github.cyfko.reportql.core.api.ColumnType;
import io.github.cyfko.reportql.core.api.DataType;
import io.github.cyfko.reportql.core.exception.ColumnNotFoundException;
import io.github.cyfko.reportql.core.query.Query;
import io.github.cyfko.reportql.core.spi.ColumnRegistry;

import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Data returned by a query, accumulated over one or more response pages.
 * <p>
 * A report is created from the first page of a query's response. Every following page is
 * merged by the {@link ReportPaginator}; apart from that the report is read-only.
 * </p>
 *
 * <h2>Access</h2>
 * <pre>{@code
 * Report report = query.get();
 *
 * // row-wise
 * for (Row row : report.rows()) {
 *     LocalDate day = (LocalDate) row.get("date");
 *     Long pageviews = (Long) row.get("pageviews");
 * }
 *
 * // column-wise
 * List<Object> sessions = report.column("sessions");
 *
 * // shortcuts
 * report.value();    // one row, one metric
 * report.values();   // one metric
 * report.first();
 * report.last();
 * }</pre>
 *
 * <h2>Totals</h2>
 * <p>
 * Totals are computed by the service over the whole result set and repeated on every
 * page; the totals of the last merged page are kept.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Report implements ReportView {

    private static final Logger log = Logger.getLogger(Report.class.getName());

    private final List<Column> headers;
    private final List<Row> rows = new ArrayList<>();
    private final Set<String> metrics = new LinkedHashSet<>();
    private final Set<String> dimensions = new LinkedHashSet<>();
    private final List<ResponsePage> pages = new ArrayList<>();
    private final List<Query<?>> queries = new ArrayList<>();
    private Map<String, Object> totals = Map.of();
    private boolean complete;

    private Report(List<Column> headers) {
        this.headers = Collections.unmodifiableList(headers);
    }

    /**
     * Creates a report from the first page of a query's response.
     *
     * @param page  first response page
     * @param query query that produced it
     * @return the report
     */
    public static Report of(ResponsePage page, Query<?> query) {
        ColumnRegistry registry = query.context().columns();
        List<Column> headers = new ArrayList<>();
        for (String name : page.columnHeaders()) {
            headers.add(registry.find(name).orElseGet(() -> {
                log.warning(() -> "Column " + name + " is unknown to the registry, its values are kept as strings");
                ColumnType type = query.metricIds().contains(name) ? ColumnType.METRIC : ColumnType.DIMENSION;
                return new Column(name, null, type, DataType.STRING);
            }));
        }

        Report report = new Report(headers);
        report.append(page, query);
        return report;
    }

    /**
     * Merges one more page.
     *
     * @param page  response page
     * @param query query that produced the page
     */
    void append(ResponsePage page, Query<?> query) {
        pages.add(page);
        queries.add(query);
        metrics.addAll(query.metricIds());
        dimensions.addAll(query.dimensionIds());
        complete = !page.hasNextPage();

        for (List<String> raw : page.rows()) {
            List<Object> typed = new ArrayList<>(headers.size());
            for (int i = 0; i < headers.size(); i++) {
                typed.add(headers.get(i).cast(i < raw.size() ? raw.get(i) : null));
            }
            rows.add(new Row(headers, typed));
        }

        totals = castTotals(page.totals(), query.context().columns());
    }

    private Map<String, Object> castTotals(Map<String, String> raw, ColumnRegistry registry) {
        Map<String, Object> typed = new LinkedHashMap<>();
        raw.forEach((id, value) -> {
            int index = find(headers, id);
            Optional<Column> column = index >= 0 ? Optional.of(headers.get(index)) : registry.find(id);
            typed.put(id, column.map(c -> c.cast(value)).orElse(value));
        });
        return Collections.unmodifiableMap(typed);
    }

    /**
     * Values of one column across every row.
     *
     * @param column a {@link Column}, or an id, name or slug
     * @return the column's values, in row order
     * @throws ColumnNotFoundException if the report has no such column
     */
    public List<Object> column(Object column) {
        int index = indexOf(headers, column);
        return rows.stream().map(row -> row.get(index)).collect(Collectors.toList());
    }

    @Override
    public List<Row> rows() {
        return Collections.unmodifiableList(rows);
    }

    @Override
    public Row first() {
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public Row last() {
        return rows.isEmpty() ? null : rows.get(rows.size() - 1);
    }

    @Override
    public Object value() {
        if (rows.isEmpty()) {
            return null;
        } else if (rows.size() == 1) {
            return values().get(0);
        }
        throw new IllegalStateException(
                "This report contains multiple rows or metrics. Please use rows(), first(), last() or a column name.");
    }

    @Override
    public List<Object> values() {
        if (metrics.size() == 1) {
            return column(metrics.iterator().next());
        }
        throw new IllegalStateException(
                "This report contains multiple metrics. Please use rows(), first(), last() or a column name.");
    }

    public List<Column> headers() {
        return headers;
    }

    /**
     * @return metric id → total over the whole result set, typed where the metric is known
     */
    public Map<String, Object> totals() {
        return totals;
    }

    /**
     * @return the first total, convenient when a single metric was requested
     */
    public Object total() {
        return totals.isEmpty() ? null : totals.values().iterator().next();
    }

    public Set<String> metrics() {
        return Collections.unmodifiableSet(metrics);
    }

    public Set<String> dimensions() {
        return Collections.unmodifiableSet(dimensions);
    }

    /**
     * @return {@code true} if the last merged page announced no following page
     */
    public boolean isComplete() {
        return complete;
    }

    public List<ResponsePage> pages() {
        return Collections.unmodifiableList(pages);
    }

    public List<Query<?>> queries() {
        return Collections.unmodifiableList(queries);
    }

    public int size() {
        return rows.size();
    }

    @Override
    public String toString() {
        return "Report[" + headers.stream().map(Column::name).collect(Collectors.joining(", ")) + "]";
    }

    static int indexOf(List<Column> headers, Object key) {
        int index;
        if (key instanceof Column column) {
            index = find(headers, column.id());
        } else if (key instanceof String name) {
            index = find(headers, name);
        } else {
            index = -1;
        }

        if (index < 0) {
            String missing = key instanceof Column column ? column.id() : String.valueOf(key);
            throw new ColumnNotFoundException(missing, missing + " not in column headers");
        }
        return index;
    }

    private static int find(List<Column> headers, String key) {
        // exact ids take precedence over names and slugs
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).id().equalsIgnoreCase(key)) return i;
        }
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).matches(key)) return i;
        }
        return -1;
    }
}
