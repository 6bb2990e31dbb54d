package io.github.cyfko.reportql.core.query;

import io.github.cyfko.reportql.core.ReportingContext;
import io.github.cyfko.reportql.core.api.SegmentScope;
import io.github.cyfko.reportql.core.compile.SelectorCompiler;
import io.github.cyfko.reportql.core.exception.QueryValidationException;
import io.github.cyfko.reportql.core.report.Report;
import io.github.cyfko.reportql.core.report.ReportPaginator;
import io.github.cyfko.reportql.core.spi.ReportingApi;

import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.Map;

/**
 * Query against the core reporting API: historical data over a date range, paginated.
 *
 * <h2>Date ranges</h2>
 * <pre>{@code
 * query.range("2020-01-01", "2020-01-31");
 * query.range("2020-01-01");                       // until today
 * query.range("2020-01-01", Period.ofDays(1));     // a single day
 * query.daily("30daysAgo");                        // one row per day
 * }</pre>
 *
 * <h2>Windows and pagination</h2>
 * <p>
 * {@link #limit(int)} caps the whole result, {@link #step(int)} only the size of each page.
 * {@link #get()} follows pages until the result is complete or the cap is reached.
 * </p>
 *
 * <h2>Segments</h2>
 * <pre>{@code
 * query.segment("users::condition::perUser::ga:sessions>10");
 * query.users(Map.of("sessions__gt", 10));         // users::condition::ga:sessions>10
 * query.segment("users", "users", Map.of("sessions__gt", 10));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class CoreQuery extends Query<CoreQuery> {

    public CoreQuery(ReportingContext context) {
        super(context);
    }

    protected CoreQuery(ReportingContext context, Map<String, Object> parameters, QueryOptions options) {
        super(context, parameters, options);
    }

    @Override
    protected CoreQuery newInstance(ReportingContext context, Map<String, Object> parameters, QueryOptions options) {
        return new CoreQuery(context, parameters, options);
    }

    @Override
    public ReportingApi api() {
        return ReportingApi.CORE;
    }

    // ---------------------------------------------------------------- precision

    /**
     * @param index 0 ({@code FASTER}), 1 ({@code DEFAULT}) or 2 ({@code HIGHER_PRECISION})
     * @return the new query
     * @throws QueryValidationException if the index is out of range
     */
    public CoreQuery precision(int index) {
        return precision(Precision.fromIndex(index));
    }

    public CoreQuery precision(String level) {
        return precision(Precision.fromString(level));
    }

    /**
     * Returns a new query with the given sampling level. {@link Precision#DEFAULT} sends no
     * {@code samplingLevel} at all.
     *
     * @param precision sampling level
     * @return the new query
     */
    public CoreQuery precision(Precision precision) {
        if (precision == null) {
            throw new QueryValidationException("Precision should be one of: FASTER, DEFAULT, HIGHER_PRECISION");
        }
        return derive(draft -> {
            if (precision == Precision.DEFAULT) {
                draft.parameters.remove(SAMPLING_LEVEL);
            } else {
                draft.parameters.put(SAMPLING_LEVEL, precision.name());
            }
        });
    }

    // ---------------------------------------------------------------- intervals

    /**
     * Returns a new query bucketed by time: the granularity's dimension becomes the first
     * dimension. {@link Granularity#LIFETIME} adds nothing.
     *
     * @param granularity time bucket
     * @return the new query
     */
    public CoreQuery interval(Granularity granularity) {
        if (granularity == null) {
            throw new QueryValidationException("Granularity should be one of: lifetime, year, month, week, day, hour");
        }
        String dimension = granularity.getDimension();
        return derive(draft -> {
            if (dimension != null) {
                List<String> dimensions = draft.list(DIMENSIONS);
                dimensions.remove(dimension);
                dimensions.add(0, dimension);
            }
        });
    }

    public CoreQuery interval(String granularity) {
        return interval(Granularity.fromString(granularity));
    }

    /**
     * @param index position in {@code year, month, week, day, hour}
     * @return the new query
     */
    public CoreQuery interval(int index) {
        return interval(Granularity.fromIndex(index));
    }

    // ---------------------------------------------------------------- ranges

    /**
     * @param start start date, the range ends today
     * @return the new query
     */
    public CoreQuery range(String start) {
        return range(start, null, null);
    }

    public CoreQuery range(String start, String stop) {
        return range(start, stop, null);
    }

    /**
     * @param start    start date
     * @param duration length of the range, the start day included
     * @return the new query
     */
    public CoreQuery range(String start, Period duration) {
        return range(start, null, duration);
    }

    /**
     * @param start  start date
     * @param stop   stop date, {@code null} when a duration is given
     * @param months duration in months
     * @param days   duration in days
     * @return the new query
     * @throws QueryValidationException if both a stop date and a duration are given
     */
    public CoreQuery range(String start, String stop, int months, int days) {
        return range(start, stop, Period.of(0, months, days));
    }

    public CoreQuery range(LocalDate start, LocalDate stop) {
        if (start == null || stop == null) {
            throw new QueryValidationException("A start and a stop date are required.");
        }
        return range(start.toString(), stop.toString(), null);
    }

    private CoreQuery range(String start, String stop, Period duration) {
        DateRanges.DateRange range = DateRanges.range(start, stop, duration, context().clock());
        return derive(draft -> {
            draft.parameters.put(START_DATE, range.start());
            draft.parameters.put(END_DATE, range.stop());
        });
    }

    public CoreQuery hourly(String start) {
        return interval(Granularity.HOUR).range(start);
    }

    public CoreQuery hourly(String start, String stop) {
        return interval(Granularity.HOUR).range(start, stop);
    }

    public CoreQuery hourly(String start, Period duration) {
        return interval(Granularity.HOUR).range(start, duration);
    }

    public CoreQuery daily(String start) {
        return interval(Granularity.DAY).range(start);
    }

    public CoreQuery daily(String start, String stop) {
        return interval(Granularity.DAY).range(start, stop);
    }

    public CoreQuery daily(String start, Period duration) {
        return interval(Granularity.DAY).range(start, duration);
    }

    public CoreQuery weekly(String start) {
        return interval(Granularity.WEEK).range(start);
    }

    public CoreQuery weekly(String start, String stop) {
        return interval(Granularity.WEEK).range(start, stop);
    }

    public CoreQuery weekly(String start, Period duration) {
        return interval(Granularity.WEEK).range(start, duration);
    }

    public CoreQuery monthly(String start) {
        return interval(Granularity.MONTH).range(start);
    }

    public CoreQuery monthly(String start, String stop) {
        return interval(Granularity.MONTH).range(start, stop);
    }

    public CoreQuery monthly(String start, Period duration) {
        return interval(Granularity.MONTH).range(start, duration);
    }

    public CoreQuery yearly(String start) {
        return interval(Granularity.YEAR).range(start);
    }

    public CoreQuery yearly(String start, String stop) {
        return interval(Granularity.YEAR).range(start, stop);
    }

    public CoreQuery yearly(String start, Period duration) {
        return interval(Granularity.YEAR).range(start, duration);
    }

    public CoreQuery lifetime(String start) {
        return range(start);
    }

    public CoreQuery lifetime(String start, String stop) {
        return range(start, stop);
    }

    public CoreQuery lifetime(String start, Period duration) {
        return range(start, duration);
    }

    // ---------------------------------------------------------------- windows

    /**
     * Returns a new query fetching at most {@code maximum} rows per request, without
     * capping the overall result.
     *
     * @param maximum page size
     * @return the new query
     */
    public CoreQuery step(int maximum) {
        requirePositive(maximum, "Step");
        return derive(draft -> draft.parameters.put(MAX_RESULTS, maximum));
    }

    /**
     * @param maximum number of rows to fetch, starting with the first
     * @return the new query
     */
    public CoreQuery limit(int maximum) {
        return limit(1, maximum);
    }

    /**
     * Returns a new query limited to a window of rows. Rows are 1-indexed.
     *
     * <pre>{@code
     * query.limit(100);       // rows 1 to 100
     * query.limit(50, 10);    // rows 50 to 59
     * }</pre>
     *
     * @param start   index of the first row
     * @param maximum number of rows
     * @return the new query
     */
    public CoreQuery limit(int start, int maximum) {
        requirePositive(start, "Start index");
        requirePositive(maximum, "Limit");
        return derive(draft -> {
            draft.limit = maximum;
            draft.parameters.put(START_INDEX, start);
            draft.parameters.put(MAX_RESULTS, maximum);
        });
    }

    // ---------------------------------------------------------------- segments

    /**
     * @param value precompiled segment expression or segment id
     * @return the new query
     */
    public CoreQuery segment(String value) {
        return segment(value, null, null, null);
    }

    /**
     * @param scope       {@code users} or {@code sessions}
     * @param metricScope {@code users}, {@code sessions}, {@code hits} or {@code null}
     * @param selection   keyword selection
     * @return the new query
     */
    public CoreQuery segment(String scope, String metricScope, Map<String, ?> selection) {
        return segment(null, scope, metricScope, selection);
    }

    /**
     * Returns a new query restricted to a segment of users or sessions. Either a raw
     * expression or a keyword selection is given; a selection needs a scope.
     *
     * @param value       precompiled segment expression, may be {@code null}
     * @param scope       {@code users} or {@code sessions}, required with a selection
     * @param metricScope optional qualifier of metric conditions
     * @param selection   keyword selection, may be {@code null}
     * @return the new query
     * @throws QueryValidationException if both or neither of value and selection are given,
     *                                  or if a selection comes without a valid scope
     */
    public CoreQuery segment(String value, String scope, String metricScope, Map<String, ?> selection) {
        List<String> group = conditions(value, selection, () -> {
            if (scope == null || scope.isBlank()) {
                throw new QueryValidationException("Scope is required. Choose from: users, sessions.");
            }
            SegmentScope qualifier = metricScope == null ? null : SegmentScope.fromString(metricScope);
            return context().compiler().compileSegment(SegmentScope.fromString(scope), qualifier, selection);
        }, "segment");

        return derive(draft -> {
            draft.segments.add(group);
            draft.parameters.put(SEGMENT, SelectorCompiler.join(draft.segments));
        });
    }

    public CoreQuery users(Map<String, ?> selection) {
        return segment(SegmentScope.USERS.getWireName(), null, selection);
    }

    public CoreQuery sessions(Map<String, ?> selection) {
        return segment(SegmentScope.SESSIONS.getWireName(), null, selection);
    }

    // ---------------------------------------------------------------- execution

    /**
     * Returns the query for the following page: the start index moves forward by the page
     * size ({@code max_results}, or the context's default page size).
     *
     * @return the new query
     */
    public CoreQuery next() {
        int step = intParameter(MAX_RESULTS, context().policy().defaultPageSize());
        int start = intParameter(START_INDEX, 1) + step;
        return derive(draft -> draft.parameters.put(START_INDEX, start));
    }

    /**
     * Runs the query, following every page until the result is complete or the
     * {@linkplain #limit(int) limit} is reached, and merges the pages into one report.
     *
     * @return the report
     */
    @Override
    public Report get() {
        return ReportPaginator.collect(this);
    }

    private int intParameter(String key, int fallback) {
        Object value = parameters().get(key);
        if (value == null) {
            return fallback;
        }
        return value instanceof Number number ? number.intValue() : Integer.parseInt(value.toString());
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new QueryValidationException(name + " must be positive. Received: " + value);
        }
    }
}
